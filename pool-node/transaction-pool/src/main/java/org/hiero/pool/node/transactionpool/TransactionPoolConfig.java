// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.transactionpool;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.validation.annotation.Max;
import com.swirlds.config.api.validation.annotation.Min;
import org.hiero.pool.node.base.config.Loggable;

/**
 * Use this configuration across the transaction pool.
 *
 * @param maxTransactions the number of pending transactions at which new ones are refused
 * @param maxTransactionBytes the largest accepted transaction, in bytes
 */
@ConfigData("transactionPool")
public record TransactionPoolConfig(
        @Loggable @ConfigProperty(defaultValue = "10000") @Min(1) @Max(1_000_000) int maxTransactions,
        @Loggable @ConfigProperty(defaultValue = "16384") @Min(1) int maxTransactionBytes) {}
