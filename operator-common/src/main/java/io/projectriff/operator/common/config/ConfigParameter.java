/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.config;

import io.projectriff.operator.common.InvalidConfigurationException;

import java.util.HashMap;
import java.util.Map;

/**
 * Models a configuration parameter, identified by a unique key, which may be required, and if not may have a default value.
 * Optional parameters without a default value implicitly have a null default.
 * The key is also the name of the environment variable from which the value is read.
 *
 * @param key           Configuration parameter name/key
 * @param <T>           Type of object
 * @param type          Parser of the value
 * @param defaultValue  Default value of the configuration parameter
 * @param required      If the value is required or not
 * @param map           Map that will contain all the configuration parameters
 */
public record ConfigParameter<T>(String key, ConfigParameterParser<T> type, String defaultValue, boolean required, Map<String, ConfigParameter<?>> map) {
    /**
     * Marker for indication "all namespaces" which is used when creating watches to create a cluster wide watch.
     */
    public final static String ANY_NAMESPACE = "*";

    /**
     * Constructor of a required parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, Map<String, ConfigParameter<?>> map) {
        this(key, type, null, true, map);
        map.put(key(), this);
    }

    /**
     * Constructor of an optional parameter
     *
     * @param key           Configuration parameter name/key
     * @param type          Parser of the value
     * @param defaultValue  Default value of the configuration parameter
     * @param map           Configuration map
     */
    public ConfigParameter(String key, ConfigParameterParser<T> type, String defaultValue, Map<String, ConfigParameter<?>> map) {
        this(key, type, defaultValue, false, map);
        map.put(key(), this);
    }

    /**
     * Generates the configuration map
     *
     * @param envVarMap          Map containing values entered by user.
     * @param configParameterMap Map containing all the configuration keys with default values
     * @return                   Generated configuration map
     */
    public static Map<String, Object> define(Map<String, String> envVarMap, Map<String, ConfigParameter<?>> configParameterMap) {
        Map<String, Object> generatedMap = new HashMap<>(configParameterMap.size());
        for (Map.Entry<String, String> entry : envVarMap.entrySet()) {
            final ConfigParameter<?> configValue = configParameterMap.get(entry.getKey());
            if (configValue == null) {
                throw new InvalidConfigurationException("Unknown or null config value.");
            }

            // Empty values fall back to the default
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                generatedMap.put(configValue.key(), get(Map.of(), configValue));
            } else {
                generatedMap.put(configValue.key(), get(envVarMap, configValue));
            }
        }

        Map<String, ConfigParameter<?>> missing = new HashMap<>(configParameterMap);
        missing.keySet().removeAll(envVarMap.keySet());
        for (ConfigParameter<?> value : missing.values()) {
            generatedMap.put(value.key(), get(envVarMap, value));
        }
        return generatedMap;
    }

    private static <T> T get(Map<String, String> map, ConfigParameter<T> value) {
        final String s = map.getOrDefault(value.key(), value.defaultValue());
        if (s != null) {
            return value.type().parse(s);
        } else {
            if (value.required()) {
                throw new InvalidConfigurationException("Config value: " + value.key() + " is mandatory");
            }
            return null;
        }
    }
}
