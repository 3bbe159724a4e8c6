/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.config;

import io.projectriff.operator.common.InvalidConfigurationException;
import io.projectriff.operator.common.model.Labels;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Arrays.asList;

/**
 * Abstraction for things which convert a single configuration parameter value from a String to some specific type.
 */
public interface ConfigParameterParser<T> {

    /**
     * Parses the string based on its type
     *
     * @param configValue config value in String format
     * @throws InvalidConfigurationException if the given configuration value is not supported
     * @return the value based on its type
     */
    T parse(String configValue) throws InvalidConfigurationException;

    /**
     * A java string
     */
    ConfigParameterParser<String> STRING = configValue -> configValue;

    /**
     * A non empty java string
     */
    ConfigParameterParser<String> NON_EMPTY_STRING = configValue -> {
        if (configValue == null || configValue.isEmpty()) {
            throw new InvalidConfigurationException("Failed to parse. Value cannot be empty or null");
        } else {
            return configValue;
        }
    };

    /**
     * A Java Long
     */
    ConfigParameterParser<Long> LONG = configValue -> {
        try {
            return Long.parseLong(configValue);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * A Java Integer
     */
    ConfigParameterParser<Integer> INTEGER = configValue -> {
        try {
            return Integer.parseInt(configValue);
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid", e);
        }
    };

    /**
     * Strictly Positive Number
     *
     * @param parser ConfigParameterParser object
     * @param <T>    Type of parameter
     * @return Positive number
     */
    static <T extends Number> ConfigParameterParser<T> strictlyPositive(ConfigParameterParser<T> parser) {
        return configValue -> {
            var value = parser.parse(configValue);
            if (value.longValue() <= 0) {
                throw new InvalidConfigurationException("Failed to parse. Negative value is not supported for this configuration");
            }
            return value;
        };
    }

    /**
     * A Java Boolean
     */
    ConfigParameterParser<Boolean> BOOLEAN = configValue -> {
        if (configValue.equalsIgnoreCase("true") || configValue.equalsIgnoreCase("false")) {
            return Boolean.parseBoolean(configValue);
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + configValue + " is not valid");
        }
    };

    /**
     * A kubernetes selector.
     */
    ConfigParameterParser<Labels> LABEL_PREDICATE = stringLabels -> {
        try {
            return Labels.fromString(stringLabels);
        } catch (IllegalArgumentException e) {
            throw new InvalidConfigurationException("Failed to parse. Value " + stringLabels + " is not valid", e);
        }
    };

    /**
     * Set of namespaces
     */
    ConfigParameterParser<Set<String>> NAMESPACE_SET = namespacesList -> {
        Set<String> namespaces;
        if (namespacesList.trim().equals(ConfigParameter.ANY_NAMESPACE)) {
            namespaces = Collections.singleton(ConfigParameter.ANY_NAMESPACE);
        } else if (namespacesList.matches("(\\s*[a-z0-9.-]+\\s*,)*\\s*[a-z0-9.-]+\\s*")) {
            namespaces = new HashSet<>(asList(namespacesList.trim().split("\\s*,+\\s*")));
        } else {
            throw new InvalidConfigurationException("Not a valid list of namespaces nor the 'any namespace' wildcard "
                    + ConfigParameter.ANY_NAMESPACE);
        }

        return namespaces;
    };

    /**
     * Comma separated set of host names, optionally with ports (for example registry host names). An empty value
     * gives an empty set.
     */
    ConfigParameterParser<Set<String>> STRING_SET = list -> {
        if (list == null || list.isBlank()) {
            return Collections.emptySet();
        } else if (list.matches("(\\s*[A-Za-z0-9.:-]+\\s*,)*\\s*[A-Za-z0-9.:-]+\\s*")) {
            Set<String> hosts = new LinkedHashSet<>(Arrays.asList(list.trim().split("\\s*,+\\s*")));
            return Collections.unmodifiableSet(hosts);
        } else {
            throw new InvalidConfigurationException("Failed to parse. Value " + list + " is not a comma separated list of host names");
        }
    };
}
