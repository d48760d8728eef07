// SPDX-License-Identifier: Apache-2.0
package org.hiero.pool.node.app.config;

import com.swirlds.config.api.ConfigData;
import com.swirlds.config.api.ConfigProperty;
import com.swirlds.config.api.source.ConfigSource;
import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.lang.reflect.RecordComponent;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Config source that maps environment variables to the properties of the node's configuration records. For example
 * the "node.rpcAddress" property maps to the "NODE_RPC_ADDRESS" environment variable and
 * "transactionPool.maxTransactions" to "TRANSACTION_POOL_MAX_TRANSACTIONS".
 */
public final class AutomaticEnvironmentVariableConfigSource implements ConfigSource {
    /** Ordinal for system environment, above the properties file. */
    private static final int SYSTEM_ENVIRONMENT_ORDINAL = 300;
    /** map from property name to environment variable name */
    private final Map<String, String> propertyNameToEnvMap;
    /** Set of properties that are set in the environment */
    private final Set<String> propertiesSetInEnvironment;
    /** function to get environment variable values, replaced in tests */
    private final Function<String, String> envVarGetter;

    /**
     * Creates a new AutomaticEnvironmentVariableConfigSource instance.
     *
     * @param configTypes the configuration types to collect property names from
     * @param envVarGetter the function to get the environment variable value
     */
    public AutomaticEnvironmentVariableConfigSource(
            @NonNull final List<Class<? extends Record>> configTypes,
            @NonNull final Function<String, String> envVarGetter) {
        this.envVarGetter = Objects.requireNonNull(envVarGetter);
        final Map<String, String> envToPropertyNameMap = collectEnvToPropertyNameMappings(configTypes);
        propertyNameToEnvMap = envToPropertyNameMap.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getValue, Map.Entry::getKey));
        propertiesSetInEnvironment = propertyNameToEnvMap.entrySet().stream()
                .filter(entry -> envVarGetter.apply(entry.getValue()) != null)
                .map(Map.Entry::getKey)
                .collect(Collectors.toUnmodifiableSet());
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Set<String> getPropertyNames() {
        return propertiesSetInEnvironment;
    }

    /**
     * {@inheritDoc}
     */
    @Nullable
    @Override
    public String getValue(@NonNull final String propertyName) throws NoSuchElementException {
        if (propertyName == null || propertyName.isBlank()) {
            throw new IllegalArgumentException("propertyName must not be blank");
        }
        final String envName = propertyNameToEnvMap.get(propertyName);
        if (envName == null) {
            throw new NoSuchElementException("Property " + propertyName + " is not defined");
        }
        return envVarGetter.apply(envName);
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean isListProperty(@NonNull final String propertyName) throws NoSuchElementException {
        return false;
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public List<String> getListValue(@NonNull final String propertyName) throws NoSuchElementException {
        return Collections.emptyList();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public int getOrdinal() {
        return SYSTEM_ENVIRONMENT_ORDINAL;
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public String getName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Scan the configuration records for all their properties and map environment variable names to property names.
     *
     * @param configTypes the configuration types to collect property names from
     * @return sorted map of environment variable names to property names
     */
    @NonNull
    static Map<String, String> collectEnvToPropertyNameMappings(
            @NonNull final List<Class<? extends Record>> configTypes) {
        final Map<String, String> envMappings = new TreeMap<>();
        for (Class<? extends Record> configType : configTypes) {
            final ConfigData configDataAnnotation = configType.getDeclaredAnnotation(ConfigData.class);
            if (configDataAnnotation != null) {
                for (RecordComponent component : configType.getRecordComponents()) {
                    if (component.isAnnotationPresent(ConfigProperty.class)) {
                        final String fieldName = component.getName();
                        envMappings.put(
                                getEnvName(configDataAnnotation.value(), fieldName),
                                configDataAnnotation.value() + "." + fieldName);
                    }
                }
            }
        }
        return envMappings;
    }

    /**
     * Convert a property name into an environment variable name. Every '.' becomes '_', every uppercase character is
     * prefixed with '_' and the result is upper cased.
     *
     * @param configDataName the name of the configuration data type
     * @param propertyName the name of the property
     * @return the environment variable name
     */
    static String getEnvName(@NonNull final String configDataName, @NonNull final String propertyName) {
        return toEnvStyle(configDataName.replace('.', '_')) + "_" + toEnvStyle(propertyName);
    }

    private static String toEnvStyle(final String name) {
        return name.replaceAll("([a-z0-9])([A-Z])", "$1_$2").toUpperCase();
    }
}
