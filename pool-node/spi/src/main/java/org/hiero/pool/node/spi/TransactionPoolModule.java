// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.spi;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;

/**
 * The pending-transaction layer.
 */
public interface TransactionPoolModule extends PoolNodeModule {
    /**
     * Outcome of offering a transaction to the pool.
     */
    enum AcceptResult {
        /** The transaction was added. */
        ACCEPTED,
        /** A transaction with the same id is already pending. */
        DUPLICATE,
        /** The pool is at its size limit. */
        POOL_FULL
    }

    /**
     * Offer a transaction to the pool.
     *
     * @param transaction the transaction
     * @return the outcome
     * @throws AlreadyStoppedException if the pool is stopped
     */
    @NonNull
    AcceptResult acceptTransaction(@NonNull Transaction transaction) throws AlreadyStoppedException;

    /**
     * @return the pending transactions in arrival order
     */
    @NonNull
    List<Transaction> transactions();

    /**
     * @return the number of pending transactions
     */
    int size();

    /**
     * Creates the transaction pool module, after the chain-state module.
     */
    @FunctionalInterface
    interface Factory {
        /**
         * @param chainState the chain-state module
         * @param network the network module
         * @param storageDirectory the directory the module keeps its persisted data in
         * @return the new module
         * @throws IOException if the module can not be constructed
         */
        @NonNull
        TransactionPoolModule create(
                @NonNull ChainStateModule chainState, @NonNull NetworkModule network, @NonNull Path storageDirectory)
                throws IOException;
    }
}
