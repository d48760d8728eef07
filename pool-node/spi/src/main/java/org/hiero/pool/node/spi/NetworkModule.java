// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Set;

/**
 * The network/peer layer, called the gateway. It listens for inbound peers and dials outbound ones.
 */
public interface NetworkModule extends PoolNodeModule {
    /**
     * Dial a peer and add it to the set of connected peers.
     *
     * @param address the peer address as {@code host:port}
     * @throws IOException if the dial fails or the gateway is stopped
     */
    void connect(@NonNull String address) throws IOException;

    /**
     * @return the address the gateway listens on
     */
    @NonNull
    InetSocketAddress address();

    /**
     * @return the addresses of the currently connected peers
     */
    @NonNull
    Set<String> peers();

    /**
     * Creates the network module. This is the first module constructed.
     */
    @FunctionalInterface
    interface Factory {
        /**
         * @param listenAddress the address to listen on, {@code host:port} or {@code :port}
         * @param storageDirectory the directory the module keeps its persisted data in
         * @return the new, listening, module
         * @throws IOException if the module can not be constructed
         */
        @NonNull
        NetworkModule create(@NonNull String listenAddress, @NonNull Path storageDirectory) throws IOException;
    }
}
