// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Objects;
import org.hiero.pool.node.api.ApiServer;
import org.hiero.pool.node.consensus.ConsensusSet;
import org.hiero.pool.node.gateway.Gateway;
import org.hiero.pool.node.gateway.GatewayConfig;
import org.hiero.pool.node.spi.ChainStateModule;
import org.hiero.pool.node.spi.NetworkModule;
import org.hiero.pool.node.spi.ServingModule;
import org.hiero.pool.node.spi.TransactionPoolModule;
import org.hiero.pool.node.spi.threading.ThreadPoolManager;
import org.hiero.pool.node.transactionpool.TransactionPool;
import org.hiero.pool.node.transactionpool.TransactionPoolConfig;

/**
 * The four module factories the {@link ModuleOrchestrator} constructs the node from, one per stage.
 *
 * @param network creates the gateway
 * @param chainState creates the consensus set
 * @param transactionPool creates the transaction pool
 * @param serving creates the API server
 */
public record ModuleFactories(
        @NonNull NetworkModule.Factory network,
        @NonNull ChainStateModule.Factory chainState,
        @NonNull TransactionPoolModule.Factory transactionPool,
        @NonNull ServingModule.Factory serving) {

    public ModuleFactories {
        Objects.requireNonNull(network);
        Objects.requireNonNull(chainState);
        Objects.requireNonNull(transactionPool);
        Objects.requireNonNull(serving);
    }

    /**
     * The production modules, configured from the given configuration.
     *
     * @param configuration the node configuration
     * @param threadPoolManager source of module threads
     * @return the factories
     */
    @NonNull
    static ModuleFactories standard(
            @NonNull final Configuration configuration, @NonNull final ThreadPoolManager threadPoolManager) {
        final NodeConfig nodeConfig = configuration.getConfigData(NodeConfig.class);
        final GatewayConfig gatewayConfig = configuration.getConfigData(GatewayConfig.class);
        final TransactionPoolConfig transactionPoolConfig = configuration.getConfigData(TransactionPoolConfig.class);
        return new ModuleFactories(
                (listenAddress, directory) ->
                        new Gateway(gatewayConfig, nodeConfig.release(), listenAddress, directory, threadPoolManager),
                (network, directory) -> new ConsensusSet(network, directory, nodeConfig.release()),
                (chainState, network, directory) -> new TransactionPool(transactionPoolConfig, chainState, network),
                (bindAddress, agentId, chainState, network, transactionPool) -> new ApiServer(
                        bindAddress, agentId, chainState, network, transactionPool, nodeConfig.poolFee()));
    }
}
