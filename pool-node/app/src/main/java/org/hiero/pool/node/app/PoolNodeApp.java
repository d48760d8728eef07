// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app;

import static java.lang.System.Logger.Level.ERROR;
import static java.lang.System.Logger.Level.INFO;

import com.swirlds.config.api.Configuration;
import com.swirlds.config.api.ConfigurationBuilder;
import com.swirlds.config.extensions.sources.ClasspathFileConfigSource;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.logging.LogManager;
import org.hiero.pool.node.app.config.AutomaticEnvironmentVariableConfigSource;
import org.hiero.pool.node.app.logging.ConfigLogger;
import org.hiero.pool.node.gateway.BootstrapPeers;
import org.hiero.pool.node.gateway.GatewayConfig;
import org.hiero.pool.node.spi.threading.ThreadPoolManager;
import org.hiero.pool.node.transactionpool.TransactionPoolConfig;

/** Main class for the pool node daemon */
public final class PoolNodeApp {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(PoolNodeApp.class.getName());
    /** The properties file on the classpath holding the defaults of this installation. */
    static final String APPLICATION_PROPERTIES = "app.properties";
    /** Every configuration record of the node. */
    static final List<Class<? extends Record>> CONFIG_DATA_TYPES =
            List.of(NodeConfig.class, GatewayConfig.class, TransactionPoolConfig.class);

    private PoolNodeApp() {}

    /**
     * Main entrypoint for the pool node. Returns once the node has been shut down, exits with status 1 if it could
     * not be started.
     *
     * @param args Command line arguments. Not used at present.
     * @throws IOException if the configuration can not be loaded
     */
    public static void main(final String[] args) throws IOException {
        loadLoggingConfiguration();
        final Configuration configuration = loadConfiguration(System::getenv);
        ConfigLogger.log(configuration, CONFIG_DATA_TYPES);
        final NodeConfig nodeConfig = configuration.getConfigData(NodeConfig.class);
        final ThreadPoolManager threadPoolManager = new DefaultThreadPoolManager();
        final ExecutorService dialExecutor = threadPoolManager.createThreadPerTaskExecutor("bootstrap-dial");
        final ModuleOrchestrator orchestrator = new ModuleOrchestrator(
                nodeConfig,
                ModuleFactories.standard(configuration, threadPoolManager),
                new BootstrapJoiner(BootstrapPeers.ADDRESSES, dialExecutor, new SecureRandom()));
        Runtime.getRuntime().addShutdownHook(new Thread(orchestrator::shutdown, "pool-node-shutdown"));
        int exitStatus = 0;
        try {
            orchestrator.start();
            LOGGER.log(INFO, "Pool node stopped");
        } catch (StageConstructionException e) {
            LOGGER.log(ERROR, "Pool node failed to start in stage " + e.stage(), e);
            exitStatus = 1;
        } catch (IOException e) {
            LOGGER.log(ERROR, "Pool node failed while serving", e);
            exitStatus = 1;
        } finally {
            dialExecutor.shutdownNow();
        }
        if (exitStatus != 0) {
            System.exit(exitStatus);
        }
    }

    /**
     * Build the node configuration from the classpath properties file and the environment.
     *
     * @param envVarGetter looks up environment variables
     * @return the configuration, with all node configuration records registered
     * @throws IOException if the properties file can not be read
     */
    @NonNull
    static Configuration loadConfiguration(@NonNull final Function<String, String> envVarGetter) throws IOException {
        final ConfigurationBuilder builder = ConfigurationBuilder.create()
                .withSource(new AutomaticEnvironmentVariableConfigSource(CONFIG_DATA_TYPES, envVarGetter))
                .withSource(new ClasspathFileConfigSource(Path.of(APPLICATION_PROPERTIES)));
        for (Class<? extends Record> configType : CONFIG_DATA_TYPES) {
            builder.withConfigDataType(configType);
        }
        return builder.build();
    }

    private static void loadLoggingConfiguration() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            LOGGER.log(INFO, "External logging configuration found");
            return;
        }
        try (InputStream loggingConfigIn =
                PoolNodeApp.class.getClassLoader().getResourceAsStream("logging.properties")) {
            if (loggingConfigIn != null) {
                LogManager.getLogManager().readConfiguration(loggingConfigIn);
            } else {
                LOGGER.log(INFO, "No logging configuration found");
            }
        } catch (IOException e) {
            LOGGER.log(INFO, "Failed to load logging configuration", e);
        }
        // tell helidon to use the same logging configuration
        System.setProperty("io.helidon.logging.config.disabled", "true");
    }
}
