// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.gateway;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.hiero.pool.node.base.BuildRelease;
import org.hiero.pool.node.base.NetAddresses;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;
import org.hiero.pool.node.spi.NetworkModule;
import org.hiero.pool.node.spi.threading.ThreadPoolManager;

/**
 * The network module. Listens for inbound peers on a TCP socket and dials outbound peers, keeping at most the
 * configured number of connections. The peer protocol spoken over those connections is not part of this class.
 *
 * <p>The accept loop, every dial and every peer reader hold an acquisition on the gateway's {@link ShutdownGroup}.
 * Stopping the gateway closes the listener, the sockets still dialing and all peers, which ends each of them promptly,
 * and then waits for them to finish. A peer whose remote end closes is removed, freeing its slot.
 */
public final class Gateway implements NetworkModule {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(Gateway.class.getName());
    /** Name of the known node list in the storage directory. */
    static final String NODE_LIST_FILE = "nodes.json";

    private final ShutdownGroup shutdownGroup = new ShutdownGroup("gateway");
    private final ServerSocketChannel listener;
    private final InetSocketAddress address;
    /** Connected peers by address. Additions go through {@link #addPeer} under {@link #peersLock}. */
    private final Map<String, SocketChannel> peers = new ConcurrentHashMap<>();
    /** Makes the limit check and the insertion of a peer atomic. */
    private final Object peersLock = new Object();
    /** Outbound sockets whose connect is still in progress. */
    private final Set<SocketChannel> dialing = ConcurrentHashMap.newKeySet();
    private final NodeListFile nodeList;
    private final Duration dialTimeout;
    private final int maxPeers;
    private final boolean persistNodeList;
    private final ExecutorService acceptExecutor;
    private final ExecutorService peerExecutor;

    /**
     * Bind the listener and start accepting peers.
     *
     * @param config the gateway configuration
     * @param release the release the node runs as, supplying default limits
     * @param listenAddress the address to listen on, {@code host:port} or {@code :port}
     * @param storageDirectory the directory holding the known node list
     * @param threadPoolManager source of the accept thread
     * @throws IOException if the directory or node list can not be read or the address can not be bound
     */
    public Gateway(
            @NonNull final GatewayConfig config,
            @NonNull final BuildRelease release,
            @NonNull final String listenAddress,
            @NonNull final Path storageDirectory,
            @NonNull final ThreadPoolManager threadPoolManager)
            throws IOException {
        Objects.requireNonNull(config);
        Objects.requireNonNull(release);
        Objects.requireNonNull(threadPoolManager);
        final InetSocketAddress bindAddress;
        try {
            bindAddress = NetAddresses.parse(listenAddress);
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid listen address '" + listenAddress + "'", e);
        }
        this.dialTimeout = config.dialTimeout(release);
        this.maxPeers = config.maxPeers(release);
        this.persistNodeList = config.persistNodeList();
        Files.createDirectories(storageDirectory);
        this.nodeList = NodeListFile.load(storageDirectory.resolve(NODE_LIST_FILE));
        this.listener = ServerSocketChannel.open();
        try {
            listener.bind(bindAddress);
        } catch (IOException e) {
            closeQuietly(listener, e);
            throw new IOException("could not listen on " + listenAddress, e);
        }
        this.address = (InetSocketAddress) listener.getLocalAddress();
        this.acceptExecutor = threadPoolManager.createSingleThreadExecutor("gateway-accept");
        this.peerExecutor = threadPoolManager.createThreadPerTaskExecutor("gateway-peer");
        // hooks run in reverse, the listener closes first and the node list is saved last
        shutdownGroup.onStop(this::saveNodeList);
        shutdownGroup.onStop(peerExecutor::shutdown);
        shutdownGroup.onStop(acceptExecutor::shutdown);
        shutdownGroup.onStop(this::disconnectAll);
        shutdownGroup.onStop(this::abortDials);
        shutdownGroup.onStop(this::closeListener);
        final ShutdownGroup.Token acceptToken;
        try {
            acceptToken = shutdownGroup.acquire();
        } catch (AlreadyStoppedException e) {
            throw new IllegalStateException("new gateway is already stopped", e);
        }
        acceptExecutor.execute(() -> acceptLoop(acceptToken));
        LOGGER.log(INFO, "Gateway listening on {0} with {1} known nodes", address, nodeList.nodes().size());
    }

    @NonNull
    @Override
    public String name() {
        return "gateway";
    }

    @NonNull
    @Override
    public ShutdownGroup shutdownGroup() {
        return shutdownGroup;
    }

    @NonNull
    @Override
    public InetSocketAddress address() {
        return address;
    }

    @NonNull
    @Override
    public Set<String> peers() {
        return Set.copyOf(peers.keySet());
    }

    /**
     * @return every node address this gateway has successfully dialed, including earlier runs
     */
    @NonNull
    public Set<String> knownNodes() {
        return nodeList.nodes();
    }

    @Override
    public void connect(@NonNull final String peerAddress) throws IOException {
        Objects.requireNonNull(peerAddress);
        try (ShutdownGroup.Token ignored = shutdownGroup.acquire()) {
            final InetSocketAddress remote;
            try {
                remote = NetAddresses.parse(peerAddress);
            } catch (IllegalArgumentException e) {
                throw new IOException("invalid peer address '" + peerAddress + "'", e);
            }
            if (isOwnAddress(remote)) {
                throw new IOException("refusing to connect to own address " + peerAddress);
            }
            synchronized (peersLock) {
                prunePeers();
                if (peers.containsKey(peerAddress)) {
                    throw new IOException("already connected to " + peerAddress);
                }
                if (peers.size() >= maxPeers) {
                    throw new IOException("peer limit of " + maxPeers + " reached");
                }
            }
            final SocketChannel channel = dial(peerAddress, remote);
            final PeerAdd added = addPeer(peerAddress, channel);
            if (added != PeerAdd.ADDED) {
                closeQuietly(channel, null);
                throw new IOException(
                        added == PeerAdd.DUPLICATE
                                ? "already connected to " + peerAddress
                                : "peer limit of " + maxPeers + " reached");
            }
            if (!startReader(peerAddress, channel)) {
                throw new IOException("gateway stopped while dialing " + peerAddress);
            }
            nodeList.add(peerAddress);
            LOGGER.log(DEBUG, "Connected to peer {0}", peerAddress);
        } catch (AlreadyStoppedException e) {
            throw new IOException("gateway is stopped", e);
        }
    }

    /**
     * Dial a peer. The socket is registered while connecting so that stopping the gateway closes it and ends the dial
     * right away instead of after the dial timeout.
     */
    private SocketChannel dial(final String peerAddress, final InetSocketAddress remote) throws IOException {
        final SocketChannel channel = SocketChannel.open();
        dialing.add(channel);
        boolean connected = false;
        try {
            // the stop hook may have run before the channel was registered
            if (shutdownGroup.isStopped()) {
                throw new IOException("gateway stopped while dialing " + peerAddress);
            }
            channel.socket().connect(remote, Math.toIntExact(dialTimeout.toMillis()));
            connected = true;
            return channel;
        } catch (IOException e) {
            if (shutdownGroup.isStopped()) {
                throw new IOException("gateway stopped while dialing " + peerAddress, e);
            }
            throw e;
        } finally {
            dialing.remove(channel);
            if (!connected) {
                closeQuietly(channel, null);
            }
        }
    }

    private void acceptLoop(final ShutdownGroup.Token token) {
        try (token) {
            while (!shutdownGroup.isStopped()) {
                final SocketChannel channel;
                try {
                    channel = listener.accept();
                } catch (ClosedChannelException e) {
                    break;
                } catch (IOException e) {
                    if (shutdownGroup.isStopped()) {
                        break;
                    }
                    LOGGER.log(WARNING, "Failed to accept a peer connection", e);
                    continue;
                }
                acceptPeer(channel);
            }
        }
        LOGGER.log(DEBUG, "Gateway accept loop finished");
    }

    private void acceptPeer(final SocketChannel channel) {
        String remote = "unknown";
        try {
            remote = NetAddresses.format((InetSocketAddress) channel.getRemoteAddress());
        } catch (IOException e) {
            LOGGER.log(DEBUG, "Could not read remote address of inbound peer", e);
        }
        if (shutdownGroup.isStopped() || addPeer(remote, channel) != PeerAdd.ADDED) {
            LOGGER.log(DEBUG, "Dropping inbound peer {0}, peer limit reached or stopping", remote);
            closeQuietly(channel, null);
            return;
        }
        if (startReader(remote, channel)) {
            LOGGER.log(DEBUG, "Accepted inbound peer {0}", remote);
        }
    }

    /**
     * Check the limit and insert the peer as one step, so concurrent dials and accepts can not exceed the limit.
     */
    private PeerAdd addPeer(final String peerAddress, final SocketChannel channel) {
        synchronized (peersLock) {
            prunePeers();
            if (peers.containsKey(peerAddress)) {
                return PeerAdd.DUPLICATE;
            }
            if (peers.size() >= maxPeers) {
                return PeerAdd.FULL;
            }
            peers.put(peerAddress, channel);
            return PeerAdd.ADDED;
        }
    }

    private void prunePeers() {
        peers.values().removeIf(channel -> !channel.isOpen() || !channel.isConnected());
    }

    /**
     * Start the reader of a newly added peer. It holds an acquisition until the peer is gone, and removes the peer
     * when the remote end closes. Inbound data is discarded, the peer protocol is not spoken here.
     *
     * @return false if the gateway stopped, the peer is removed and closed in that case
     */
    private boolean startReader(final String peerAddress, final SocketChannel channel) {
        final ShutdownGroup.Token token;
        try {
            token = shutdownGroup.acquire();
        } catch (AlreadyStoppedException e) {
            removePeer(peerAddress, channel);
            return false;
        }
        // disconnectAll may have run before the peer was added
        if (shutdownGroup.isStopped()) {
            token.close();
            removePeer(peerAddress, channel);
            return false;
        }
        try {
            peerExecutor.execute(() -> readUntilClosed(peerAddress, channel, token));
            return true;
        } catch (RejectedExecutionException e) {
            token.close();
            removePeer(peerAddress, channel);
            return false;
        }
    }

    private void readUntilClosed(
            final String peerAddress, final SocketChannel channel, final ShutdownGroup.Token token) {
        try (token) {
            final ByteBuffer buffer = ByteBuffer.allocate(4096);
            while (channel.read(buffer) >= 0) {
                buffer.clear();
            }
            LOGGER.log(DEBUG, "Peer {0} disconnected", peerAddress);
        } catch (IOException e) {
            if (!shutdownGroup.isStopped()) {
                LOGGER.log(DEBUG, "Connection to peer " + peerAddress + " failed", e);
            }
        } finally {
            removePeer(peerAddress, channel);
        }
    }

    private void removePeer(final String peerAddress, final SocketChannel channel) {
        peers.remove(peerAddress, channel);
        closeQuietly(channel, null);
    }

    private boolean isOwnAddress(final InetSocketAddress remote) {
        if (remote.getPort() != address.getPort() || remote.getAddress() == null) {
            return false;
        }
        return remote.getAddress().isLoopbackAddress()
                || remote.getAddress().isAnyLocalAddress()
                || remote.getAddress().equals(address.getAddress());
    }

    private void closeListener() {
        closeQuietly(listener, null);
    }

    private void abortDials() {
        for (final SocketChannel channel : dialing) {
            closeQuietly(channel, null);
        }
    }

    private void disconnectAll() {
        for (final Map.Entry<String, SocketChannel> peer : peers.entrySet()) {
            closeQuietly(peer.getValue(), null);
        }
        peers.clear();
    }

    private void saveNodeList() {
        if (!persistNodeList) {
            return;
        }
        try {
            nodeList.save();
        } catch (IOException e) {
            LOGGER.log(WARNING, "Failed to save the known node list", e);
        }
    }

    private enum PeerAdd {
        ADDED,
        DUPLICATE,
        FULL
    }

    private static void closeQuietly(final Closeable closeable, final Exception primary) {
        try {
            closeable.close();
        } catch (IOException e) {
            if (primary != null) {
                primary.addSuppressed(e);
            } else {
                LOGGER.log(DEBUG, "Failed to close gateway channel", e);
            }
        }
    }
}
