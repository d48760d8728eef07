// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.swirlds.config.api.Configuration;
import com.swirlds.config.api.ConfigurationBuilder;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.hiero.pool.node.gateway.GatewayConfig;
import org.hiero.pool.node.transactionpool.TransactionPoolConfig;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link AutomaticEnvironmentVariableConfigSource}.
 */
public class AutomaticEnvironmentVariableConfigSourceTest {
    /**
     * Property names map to environment variable names in upper snake case.
     */
    @Test
    void testEnvNameMapping() {
        assertEquals("NODE_RPC_ADDRESS", AutomaticEnvironmentVariableConfigSource.getEnvName("node", "rpcAddress"));
        assertEquals(
                "TRANSACTION_POOL_MAX_TRANSACTIONS",
                AutomaticEnvironmentVariableConfigSource.getEnvName("transactionPool", "maxTransactions"));
        assertEquals(
                "BLOCK_NODE_EARLIEST_BLOCK",
                AutomaticEnvironmentVariableConfigSource.getEnvName("block.node", "earliestBlock"));
        final Map<String, String> mappings = AutomaticEnvironmentVariableConfigSource.collectEnvToPropertyNameMappings(
                List.of(GatewayConfig.class, TransactionPoolConfig.class));
        assertEquals("gateway.dialTimeoutMillis", mappings.get("GATEWAY_DIAL_TIMEOUT_MILLIS"));
        assertEquals("transactionPool.maxTransactions", mappings.get("TRANSACTION_POOL_MAX_TRANSACTIONS"));
    }

    /**
     * Without the environment variable set, the default value of the config record is used.
     */
    @Test
    void testNotSettingEnv() {
        final Configuration config = ConfigurationBuilder.create()
                .withSource(new AutomaticEnvironmentVariableConfigSource(
                        List.of(TransactionPoolConfig.class), varName -> null))
                .withConfigDataType(TransactionPoolConfig.class)
                .build();
        assertEquals(10_000, config.getConfigData(TransactionPoolConfig.class).maxTransactions());
    }

    /**
     * Test to check that when an environment variable is set, it overrides the default value in the config class.
     */
    @Test
    void testSettingEnv() {
        final AutomaticEnvironmentVariableConfigSource source = new AutomaticEnvironmentVariableConfigSource(
                List.of(GatewayConfig.class, TransactionPoolConfig.class),
                varName -> "TRANSACTION_POOL_MAX_TRANSACTIONS".equals(varName) ? "42" : null);
        assertEquals("42", source.getValue("transactionPool.maxTransactions"));
        assertTrue(source.getPropertyNames().contains("transactionPool.maxTransactions"));
        assertEquals(1, source.getPropertyNames().size());
        assertThrows(NoSuchElementException.class, () -> source.getValue("TRANSACTION_POOL_MAX_TRANSACTIONS"));
        assertThrows(IllegalArgumentException.class, () -> source.getValue(" "));
        final Configuration config = ConfigurationBuilder.create()
                .withSource(source)
                .withConfigDataType(TransactionPoolConfig.class)
                .build();
        assertEquals(42, config.getConfigData(TransactionPoolConfig.class).maxTransactions());
    }

    /**
     * Test the simple source methods.
     */
    @Test
    void testOtherSourceMethods() {
        final AutomaticEnvironmentVariableConfigSource source =
                new AutomaticEnvironmentVariableConfigSource(List.of(GatewayConfig.class), varName -> null);
        assertEquals(300, source.getOrdinal());
        assertEquals(AutomaticEnvironmentVariableConfigSource.class.getSimpleName(), source.getName());
        assertEquals(Collections.emptyList(), source.getListValue("gateway.maxPeers"));
        assertEquals(false, source.isListProperty("gateway.maxPeers"));
    }
}
