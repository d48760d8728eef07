// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import static java.lang.System.Logger.Level.DEBUG;
import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import org.hiero.pool.node.base.lifecycle.AlreadyStoppedException;
import org.hiero.pool.node.base.lifecycle.ShutdownGroup;
import org.hiero.pool.node.spi.ChainStateModule;
import org.hiero.pool.node.spi.NetworkModule;
import org.hiero.pool.node.spi.PoolNodeModule;
import org.hiero.pool.node.spi.ServingModule;
import org.hiero.pool.node.spi.TransactionPoolModule;

/**
 * Constructs the node's modules in dependency order, joins the network and serves until shut down.
 *
 * <p>Each constructed module's stop is registered on a process wide {@link ShutdownGroup}, so stopping that group stops
 * the modules in reverse construction order. The same happens when a stage fails: the modules built so far are stopped
 * before the {@link StageConstructionException} is thrown.
 */
public final class ModuleOrchestrator {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ModuleOrchestrator.class.getName());

    /** The construction stages, in order. */
    public enum Stage {
        NETWORK,
        CHAIN_STATE,
        TRANSACTION_POOL,
        SERVING
    }

    /** The state of the node. */
    public enum State {
        STARTING,
        RUNNING,
        FAILED,
        SHUTTING_DOWN
    }

    private final NodeConfig nodeConfig;
    private final ModuleFactories factories;
    private final BootstrapJoiner bootstrapJoiner;
    private final ShutdownGroup processGroup = new ShutdownGroup("pool-node");
    private final AtomicReference<State> state = new AtomicReference<>(State.STARTING);

    /**
     * @param nodeConfig addresses, agent id and data directory
     * @param factories the module factories
     * @param bootstrapJoiner joins the network once all modules are constructed
     */
    public ModuleOrchestrator(
            @NonNull final NodeConfig nodeConfig,
            @NonNull final ModuleFactories factories,
            @NonNull final BootstrapJoiner bootstrapJoiner) {
        this.nodeConfig = Objects.requireNonNull(nodeConfig);
        this.factories = Objects.requireNonNull(factories);
        this.bootstrapJoiner = Objects.requireNonNull(bootstrapJoiner);
    }

    /**
     * Construct all modules and serve. Blocks until the node is shut down or serving fails.
     *
     * @throws StageConstructionException if a module could not be constructed
     * @throws IOException if serving failed, all modules are stopped by then
     */
    public void start() throws StageConstructionException, IOException {
        LOGGER.log(INFO, "Starting pool node, data in {0}", nodeConfig.dataRootPath());
        final Path dataRoot = nodeConfig.dataRootPath();
        final NetworkModule network = construct(
                Stage.NETWORK, () -> factories.network().create(nodeConfig.rpcAddress(), dataRoot.resolve("gateway")));
        if (network == null) {
            return;
        }
        final ChainStateModule chainState = construct(
                Stage.CHAIN_STATE, () -> factories.chainState().create(network, dataRoot.resolve("consensus")));
        if (chainState == null) {
            return;
        }
        final TransactionPoolModule transactionPool = construct(
                Stage.TRANSACTION_POOL,
                () -> factories.transactionPool().create(chainState, network, dataRoot.resolve("transactionpool")));
        if (transactionPool == null) {
            return;
        }
        final ServingModule serving = construct(
                Stage.SERVING,
                () -> factories
                        .serving()
                        .create(nodeConfig.apiAddress(), nodeConfig.agentId(), chainState, network, transactionPool));
        if (serving == null) {
            return;
        }
        final ShutdownGroup.Token token;
        try {
            token = processGroup.acquire();
        } catch (AlreadyStoppedException e) {
            LOGGER.log(INFO, "Shutdown requested before serving");
            return;
        }
        state.compareAndSet(State.STARTING, State.RUNNING);
        LOGGER.log(INFO, "Pool node running, gateway on {0}", network.address());
        Exception failure = null;
        // the token must be released before the group is stopped below, stop waits for it
        try (token) {
            bootstrapJoiner.join(network);
            serving.serve();
        } catch (IOException | RuntimeException e) {
            failure = e;
        }
        if (failure != null && !processGroup.isStopped()) {
            state.set(State.FAILED);
            LOGGER.log(ERROR, "Serving failed, stopping all modules", failure);
        }
        stopProcessGroup();
        if (failure instanceof IOException ioException) {
            throw ioException;
        } else if (failure instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
    }

    /**
     * Stop all constructed modules, newest first, and wait for {@link #start()} to stop serving. Safe to call more than
     * once, and before or during {@link #start()}, in which case no further modules are constructed.
     */
    public void shutdown() {
        state.updateAndGet(current -> current == State.FAILED ? current : State.SHUTTING_DOWN);
        LOGGER.log(INFO, "Shutting down pool node");
        stopProcessGroup();
    }

    /**
     * @return the current state of the node
     */
    @NonNull
    public State state() {
        return state.get();
    }

    @Nullable
    private <M extends PoolNodeModule> M construct(final Stage stage, final ModuleConstructor<M> constructor)
            throws StageConstructionException {
        if (processGroup.isStopped()) {
            LOGGER.log(INFO, "Shutdown requested, not constructing {0}", stage);
            return null;
        }
        LOGGER.log(INFO, "Constructing {0}", stage);
        final M module;
        try {
            module = constructor.construct();
        } catch (IOException | RuntimeException e) {
            state.set(State.FAILED);
            LOGGER.log(ERROR, "Failed to construct " + stage + ", stopping constructed modules", e);
            stopProcessGroup();
            throw new StageConstructionException(stage, e);
        }
        // runs immediately if a shutdown happened during construction
        processGroup.onStop(() -> stopModule(module));
        return processGroup.isStopped() ? null : module;
    }

    private static void stopModule(final PoolNodeModule module) {
        try {
            module.stop();
            LOGGER.log(INFO, "Stopped {0}", module.name());
        } catch (AlreadyStoppedException e) {
            LOGGER.log(DEBUG, "Module {0} was already stopped", module.name());
        }
    }

    private void stopProcessGroup() {
        try {
            processGroup.stop();
        } catch (AlreadyStoppedException e) {
            LOGGER.log(DEBUG, "Pool node already stopped");
        }
    }

    @FunctionalInterface
    private interface ModuleConstructor<M extends PoolNodeModule> {
        M construct() throws IOException;
    }
}
