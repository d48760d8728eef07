// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app.logging;

import static java.lang.System.Logger.Level.INFO;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.Configuration;
import edu.umd.cs.findbugs.annotations.NonNull;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.hiero.pool.node.base.config.Loggable;

/**
 * Use this class to log configuration data.
 */
public final class ConfigLogger {
    /** The logger for this class. */
    private static final System.Logger LOGGER = System.getLogger(ConfigLogger.class.getName());
    /** banner separator line */
    private static final String BANNER_LINE = "=".repeat(120);
    /** Shown in place of values not marked {@link Loggable}. */
    static final String MASK = "*****";

    private ConfigLogger() {}

    /**
     * Log the effective value of every property of the given configuration records.
     *
     * @param configuration the configuration to log
     * @param configTypes the configuration records registered with it
     */
    public static void log(
            @NonNull final Configuration configuration, @NonNull final List<Class<? extends Record>> configTypes) {
        if (LOGGER.isLoggable(INFO)) {
            LOGGER.log(INFO, BANNER_LINE);
            LOGGER.log(INFO, "Configuration:");
            for (final var config : collectConfig(configuration, configTypes).entrySet()) {
                LOGGER.log(INFO, "    " + config.getKey() + " = " + config.getValue());
            }
            LOGGER.log(INFO, BANNER_LINE);
        }
    }

    /**
     * Collect the properties of the configuration records. Values of properties not marked {@link Loggable} are masked,
     * unless they are empty so an admin can see a value was not set.
     *
     * @param configuration the configuration to read
     * @param configTypes the configuration records registered with it
     * @return sorted map of properties and values, with sensitive values masked
     */
    @NonNull
    static Map<String, String> collectConfig(
            @NonNull final Configuration configuration, @NonNull final List<Class<? extends Record>> configTypes) {
        final Map<String, String> config = new TreeMap<>();
        for (Class<? extends Record> configType : configTypes) {
            final ConfigData configDataAnnotation = configType.getDeclaredAnnotation(ConfigData.class);
            if (configDataAnnotation == null) {
                continue;
            }
            final Record configRecord = configuration.getConfigData(configType);
            for (RecordComponent component : configType.getRecordComponents()) {
                if (component.isAnnotationPresent(ConfigProperty.class)) {
                    final String key = configDataAnnotation.value() + "." + component.getName();
                    final String value = readValue(component, configRecord);
                    if (component.getAnnotation(Loggable.class) == null) {
                        config.put(key, value.isEmpty() ? "" : MASK);
                    } else {
                        config.put(key, value);
                    }
                }
            }
        }
        return config;
    }

    private static String readValue(final RecordComponent component, final Record configRecord) {
        try {
            return String.valueOf(component.getAccessor().invoke(configRecord));
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("could not read configuration property " + component.getName(), e);
        }
    }
}
