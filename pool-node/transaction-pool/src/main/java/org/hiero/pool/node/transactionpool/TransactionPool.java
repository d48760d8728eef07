// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.transactionpool;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.hiero.pool.node.base.Hash;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;
import org.hiero.pool.node.spi.ChainStateModule;
import org.hiero.pool.node.spi.NetworkModule;
import org.hiero.pool.node.spi.Transaction;
import org.hiero.pool.node.spi.TransactionPoolModule;

/**
 * In-memory pool of pending transactions, kept in arrival order and bounded by {@link TransactionPoolConfig}.
 * Transactions larger than the configured limit are refused with an {@link IllegalArgumentException}.
 */
public final class TransactionPool implements TransactionPoolModule {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(TransactionPool.class.getName());

    private final ShutdownGroup shutdownGroup = new ShutdownGroup("transaction-pool");
    private final ChainStateModule consensus;
    private final NetworkModule gateway;
    private final TransactionPoolConfig config;
    /** Guarded by itself. */
    private final Map<Hash, Transaction> pending = new LinkedHashMap<>();

    /**
     * @param config pool limits
     * @param consensus the chain-state module, must not be null
     * @param gateway the network module, must not be null
     */
    public TransactionPool(
            @NonNull final TransactionPoolConfig config,
            @NonNull final ChainStateModule consensus,
            @NonNull final NetworkModule gateway) {
        this.config = Objects.requireNonNull(config);
        this.consensus = Objects.requireNonNull(consensus, "transaction pool requires a consensus set");
        this.gateway = Objects.requireNonNull(gateway, "transaction pool requires a gateway");
        shutdownGroup.onStop(this::purge);
        LOGGER.log(INFO, "Transaction pool created, limit {0} transactions", config.maxTransactions());
    }

    @NonNull
    @Override
    public String name() {
        return "transaction-pool";
    }

    @NonNull
    @Override
    public ShutdownGroup shutdownGroup() {
        return shutdownGroup;
    }

    @NonNull
    @Override
    public AcceptResult acceptTransaction(@NonNull final Transaction transaction) throws AlreadyStoppedException {
        Objects.requireNonNull(transaction);
        if (transaction.size() > config.maxTransactionBytes()) {
            throw new IllegalArgumentException("transaction of " + transaction.size() + " bytes exceeds limit of "
                    + config.maxTransactionBytes());
        }
        try (ShutdownGroup.Token ignored = shutdownGroup.acquire()) {
            synchronized (pending) {
                if (pending.containsKey(transaction.id())) {
                    return AcceptResult.DUPLICATE;
                }
                if (pending.size() >= config.maxTransactions()) {
                    return AcceptResult.POOL_FULL;
                }
                pending.put(transaction.id(), transaction);
            }
            LOGGER.log(DEBUG, "Accepted {0}", transaction);
            return AcceptResult.ACCEPTED;
        }
    }

    @NonNull
    @Override
    public List<Transaction> transactions() {
        synchronized (pending) {
            return List.copyOf(pending.values());
        }
    }

    @Override
    public int size() {
        synchronized (pending) {
            return pending.size();
        }
    }

    /**
     * @return the chain-state module this pool validates against
     */
    @NonNull
    ChainStateModule consensus() {
        return consensus;
    }

    /**
     * @return the network module this pool relays through
     */
    @NonNull
    NetworkModule gateway() {
        return gateway;
    }

    private void purge() {
        final int purged;
        synchronized (pending) {
            purged = pending.size();
            pending.clear();
        }
        LOGGER.log(DEBUG, "Purged {0} pending transactions", purged);
    }
}
