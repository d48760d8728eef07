// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.api;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;
import static java.lang.System.Logger.Level.WARNING;

import com.google.gson.Gson;
import edu.umd.cs.findbugs.annotations.NonNull;
import io.helidon.common.http.Http;
import io.helidon.webserver.Routing;
import io.helidon.webserver.ServerRequest;
import io.helidon.webserver.ServerResponse;
import io.helidon.webserver.WebServer;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.NetAddresses;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;
import org.hiero.pool.node.spi.ChainStateModule;
import org.hiero.pool.node.spi.NetworkModule;
import org.hiero.pool.node.spi.ServingModule;
import org.hiero.pool.node.spi.Transaction;
import org.hiero.pool.node.spi.TransactionPoolModule;

/**
 * The HTTP API of the node, the serving module. Every request must carry the node's agent id in its
 * {@code User-Agent} header, anything else is answered with 400 so that browsers can not be used to reach the API.
 */
public final class ApiServer implements ServingModule {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ApiServer.class.getName());
    /** The version reported by {@code /daemon/version} and {@code /version}. */
    public static final String VERSION = "0.1.0";

    private static final Gson GSON = new Gson();

    private final ShutdownGroup shutdownGroup = new ShutdownGroup("api");
    private final String agentId;
    /** Pool fee in units of 0.01%. */
    private final int poolFee;
    private final ChainStateModule chainState;
    private final NetworkModule network;
    private final TransactionPoolModule transactionPool;
    private final InetSocketAddress bindAddress;
    private final WebServer webServer;
    /** Set once the web server has started, only a started server is shut down. */
    private volatile boolean webServerStarted = false;
    /** Guards against shutting the web server down twice. */
    private final AtomicBoolean webServerShutDown = new AtomicBoolean(false);

    /**
     * Resolve the bind address and build, but not start, the web server.
     *
     * @param bindAddress the address to serve on, {@code host:port} or {@code :port}
     * @param agentId the string every request's user agent must contain
     * @param chainState the chain-state module
     * @param network the network module
     * @param transactionPool the transaction pool module
     * @param poolFee the pool fee reported by {@code /fee}, in units of 0.01%
     * @throws IOException if the bind address is invalid
     */
    public ApiServer(
            @NonNull final String bindAddress,
            @NonNull final String agentId,
            @NonNull final ChainStateModule chainState,
            @NonNull final NetworkModule network,
            @NonNull final TransactionPoolModule transactionPool,
            final int poolFee)
            throws IOException {
        if (poolFee < 0 || poolFee > 10_000) {
            throw new IllegalArgumentException("pool fee must be between 0 and 10000, was " + poolFee);
        }
        this.poolFee = poolFee;
        this.agentId = Objects.requireNonNull(agentId);
        this.chainState = Objects.requireNonNull(chainState);
        this.network = Objects.requireNonNull(network);
        this.transactionPool = Objects.requireNonNull(transactionPool);
        try {
            this.bindAddress = NetAddresses.parse(bindAddress);
        } catch (IllegalArgumentException e) {
            throw new IOException("invalid API address '" + bindAddress + "'", e);
        }
        final Routing routing = Routing.builder()
                .any(this::checkUserAgent)
                .get("/daemon/version", this::getVersion)
                .get("/version", this::getVersion)
                .get("/fee", this::getFee)
                .get("/consensus", this::getConsensus)
                .get("/gateway", this::getGateway)
                .get("/tpool", this::getTransactionPool)
                .build();
        this.webServer = WebServer.builder()
                .addRouting(routing)
                .bindAddress(this.bindAddress.getAddress())
                .port(this.bindAddress.getPort())
                .build();
        shutdownGroup.onStop(this::shutdownWebServer);
    }

    @NonNull
    @Override
    public String name() {
        return "api";
    }

    @NonNull
    @Override
    public ShutdownGroup shutdownGroup() {
        return shutdownGroup;
    }

    /**
     * @return the port the server listens on, only meaningful while serving
     */
    public int port() {
        return webServer.port();
    }

    @Override
    public void serve() throws IOException {
        final ShutdownGroup.Token token;
        try {
            token = shutdownGroup.acquire();
        } catch (AlreadyStoppedException e) {
            LOGGER.log(DEBUG, "API server stopped before serving");
            return;
        }
        try (token) {
            try {
                webServer.start().await();
                webServerStarted = true;
            } catch (RuntimeException e) {
                throw new IOException("could not start API server on " + bindAddress, e);
            }
            if (shutdownGroup.isStopped()) {
                // stopped while starting, the cleanup hook may have run before the server was up
                shutdownWebServer();
                return;
            }
            LOGGER.log(INFO, "API server listening on port {0}", webServer.port());
            final CompletableFuture<Void> stopped = shutdownGroup.stopSignal().toCompletableFuture();
            final CompletableFuture<WebServer> serverDown =
                    webServer.whenShutdown().toStage().toCompletableFuture();
            try {
                CompletableFuture.anyOf(stopped, serverDown).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("interrupted while serving");
            } catch (ExecutionException e) {
                throw new IOException("API server failed", e.getCause());
            }
            if (!shutdownGroup.isStopped()) {
                throw new IOException("API server shut down unexpectedly");
            }
        }
    }

    private void checkUserAgent(final ServerRequest request, final ServerResponse response) {
        final String userAgent = request.headers().first("User-Agent").orElse("");
        if (userAgent.contains(agentId)) {
            request.next();
        } else {
            LOGGER.log(DEBUG, "Rejected request from user agent {0}", userAgent);
            response.status(Http.Status.BAD_REQUEST_400)
                    .send("Browser access disabled due to security vulnerability.");
        }
    }

    private void getVersion(final ServerRequest request, final ServerResponse response) {
        sendJson(response, new VersionInfo(VERSION));
    }

    private void getFee(final ServerRequest request, final ServerResponse response) {
        sendJson(response, new FeeInfo(poolFee));
    }

    private void getConsensus(final ServerRequest request, final ServerResponse response) {
        try {
            final long height = chainState.height();
            final String currentBlock = chainState.blockIdAt(height).map(Hash::toHex).orElse(null);
            sendJson(response, new ConsensusInfo(height, chainState.genesisId().toHex(), currentBlock));
        } catch (IOException e) {
            LOGGER.log(WARNING, "Failed to read consensus state", e);
            response.status(Http.Status.SERVICE_UNAVAILABLE_503).send(e.getMessage());
        }
    }

    private void getGateway(final ServerRequest request, final ServerResponse response) {
        final List<String> peers = List.copyOf(new TreeSet<>(network.peers()));
        sendJson(response, new GatewayInfo(NetAddresses.format(network.address()), peers));
    }

    private void getTransactionPool(final ServerRequest request, final ServerResponse response) {
        final List<String> ids = transactionPool.transactions().stream()
                .map(Transaction::id)
                .map(Hash::toHex)
                .toList();
        sendJson(response, new TransactionPoolInfo(ids.size(), ids));
    }

    private static void sendJson(final ServerResponse response, final Object body) {
        response.headers().add("Content-Type", "application/json");
        response.send(GSON.toJson(body));
    }

    private void shutdownWebServer() {
        if (!webServerStarted || !webServerShutDown.compareAndSet(false, true)) {
            return;
        }
        try {
            webServer.shutdown().await();
            LOGGER.log(DEBUG, "API web server shut down");
        } catch (RuntimeException e) {
            LOGGER.log(WARNING, "API web server did not shut down cleanly", e);
        }
    }

    record VersionInfo(String version) {}

    record FeeInfo(int fee) {}

    record ConsensusInfo(long height, String genesisId, String currentBlock) {}

    record GatewayInfo(String address, List<String> peers) {}

    record TransactionPoolInfo(int size, List<String> transactionIds) {}
}
