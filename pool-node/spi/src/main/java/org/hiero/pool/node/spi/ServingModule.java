// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;

/**
 * The request-serving layer. Constructing it resolves its bind address, {@link #serve()} then accepts requests until
 * the module is stopped.
 */
public interface ServingModule extends PoolNodeModule {
    /**
     * Serve requests. Blocks until the module is stopped, in which case it returns normally, or until serving fails.
     *
     * @throws IOException if serving could not start or stopped unexpectedly
     */
    void serve() throws IOException;

    /**
     * Creates the serving module, the last one.
     */
    @FunctionalInterface
    interface Factory {
        /**
         * @param bindAddress the address to serve on, {@code host:port} or {@code :port}
         * @param agentId the user agent string clients must send
         * @param chainState the chain-state module
         * @param network the network module
         * @param transactionPool the transaction pool module
         * @return the new module, not serving yet
         * @throws IOException if the module can not be constructed
         */
        @NonNull
        ServingModule create(
                @NonNull String bindAddress,
                @NonNull String agentId,
                @NonNull ChainStateModule chainState,
                @NonNull NetworkModule network,
                @NonNull TransactionPoolModule transactionPool)
                throws IOException;
    }
}
