/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system;

import io.projectriff.operator.common.config.ConfigParameter;
import io.projectriff.operator.common.model.Labels;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

import static io.projectriff.operator.common.config.ConfigParameterParser.INTEGER;
import static io.projectriff.operator.common.config.ConfigParameterParser.LABEL_PREDICATE;
import static io.projectriff.operator.common.config.ConfigParameterParser.LONG;
import static io.projectriff.operator.common.config.ConfigParameterParser.NAMESPACE_SET;
import static io.projectriff.operator.common.config.ConfigParameterParser.NON_EMPTY_STRING;
import static io.projectriff.operator.common.config.ConfigParameterParser.STRING_SET;
import static io.projectriff.operator.common.config.ConfigParameterParser.strictlyPositive;

/**
 * System Operator configuration
 */
public class SystemOperatorConfig {
    private static final Map<String, ConfigParameter<?>> CONFIG_VALUES = new HashMap<>();

    /**
     * Namespaces which are watched, {@code *} for all namespaces
     */
    public static final ConfigParameter<Set<String>> NAMESPACES = new ConfigParameter<>("RIFF_NAMESPACE", NAMESPACE_SET, "*", CONFIG_VALUES);
    /**
     * Labels the reconciled resources have to carry
     */
    public static final ConfigParameter<Labels> LABELS = new ConfigParameter<>("RIFF_LABELS", LABEL_PREDICATE, "", CONFIG_VALUES);
    /**
     * How many milliseconds between the periodic reconciliations of all resources
     */
    public static final ConfigParameter<Long> RECONCILIATION_INTERVAL_MS = new ConfigParameter<>("RIFF_FULL_RECONCILIATION_INTERVAL_MS", strictlyPositive(LONG), "120000", CONFIG_VALUES);
    /**
     * Size of the work queue of each controller
     */
    public static final ConfigParameter<Integer> WORK_QUEUE_SIZE = new ConfigParameter<>("RIFF_WORK_QUEUE_SIZE", strictlyPositive(INTEGER), "1024", CONFIG_VALUES);
    /**
     * Number of controller loops of each controller
     */
    public static final ConfigParameter<Integer> CONTROLLER_THREAD_POOL_SIZE = new ConfigParameter<>("RIFF_CONTROLLER_THREAD_POOL_SIZE", strictlyPositive(INTEGER), "2", CONFIG_VALUES);
    /**
     * Registries whose images are not resolved to digests
     */
    public static final ConfigParameter<Set<String>> SKIP_REGISTRIES = new ConfigParameter<>("RIFF_SKIP_REGISTRIES", STRING_SET, "ko.local,dev.local", CONFIG_VALUES);
    /**
     * Registries which are accessed over plain HTTP
     */
    public static final ConfigParameter<Set<String>> INSECURE_REGISTRIES = new ConfigParameter<>("RIFF_INSECURE_REGISTRIES", STRING_SET, "", CONFIG_VALUES);
    /**
     * Timeout of the requests to the registries in milliseconds
     */
    public static final ConfigParameter<Long> REGISTRY_TIMEOUT_MS = new ConfigParameter<>("RIFF_REGISTRY_TIMEOUT_MS", strictlyPositive(LONG), "30000", CONFIG_VALUES);
    /**
     * Service account used by the function builds
     */
    public static final ConfigParameter<String> BUILD_SERVICE_ACCOUNT = new ConfigParameter<>("RIFF_BUILD_SERVICE_ACCOUNT", NON_EMPTY_STRING, "riff-build", CONFIG_VALUES);
    /**
     * Cluster build template used by the function builds
     */
    public static final ConfigParameter<String> BUILD_TEMPLATE = new ConfigParameter<>("RIFF_BUILD_TEMPLATE", NON_EMPTY_STRING, "riff-cnb", CONFIG_VALUES);
    /**
     * Image of the processor sidecar of the streaming processors
     */
    public static final ConfigParameter<String> PROCESSOR_IMAGE = new ConfigParameter<>("RIFF_PROCESSOR_IMAGE", NON_EMPTY_STRING, "projectriff/streaming-processor:latest", CONFIG_VALUES);
    /**
     * DNS cache TTL in seconds
     */
    public static final ConfigParameter<Integer> DNS_CACHE_TTL = new ConfigParameter<>("RIFF_DNS_CACHE_TTL", INTEGER, "30", CONFIG_VALUES);

    private final Map<String, Object> map;

    private SystemOperatorConfig(Map<String, Object> map) {
        this.map = map;
    }

    /**
     * Loads the configuration from a map, typically the environment variables. Keys which are not configuration
     * parameters are ignored.
     *
     * @param map   Map with the configuration values
     *
     * @return  System Operator configuration
     */
    public static SystemOperatorConfig buildFromMap(Map<String, String> map) {
        Map<String, String> envMap = new HashMap<>(map);
        envMap.keySet().retainAll(SystemOperatorConfig.keyNames());

        Map<String, Object> generatedMap = ConfigParameter.define(envMap, CONFIG_VALUES);

        return new SystemOperatorConfig(generatedMap);
    }

    /**
     * @return Set of configuration key/names
     */
    public static Set<String> keyNames() {
        return Collections.unmodifiableSet(CONFIG_VALUES.keySet());
    }

    /**
     * Gets the configuration value corresponding to the key
     *
     * @param <T>      Type of value
     * @param value    Instance of Config Parameter class
     *
     * @return         Configuration value w.r.t to the key
     */
    @SuppressWarnings("unchecked")
    public <T> T get(ConfigParameter<T> value) {
        return (T) this.map.get(value.key());
    }

    public Set<String> getNamespaces() {
        return get(NAMESPACES);
    }

    public Labels getLabels() {
        return get(LABELS);
    }

    public long getReconciliationIntervalMs() {
        return get(RECONCILIATION_INTERVAL_MS);
    }

    public int getWorkQueueSize() {
        return get(WORK_QUEUE_SIZE);
    }

    public int getControllerThreadPoolSize() {
        return get(CONTROLLER_THREAD_POOL_SIZE);
    }

    public Set<String> getSkipRegistries() {
        return get(SKIP_REGISTRIES);
    }

    public Set<String> getInsecureRegistries() {
        return get(INSECURE_REGISTRIES);
    }

    public Duration getRegistryTimeout() {
        return Duration.ofMillis(get(REGISTRY_TIMEOUT_MS));
    }

    public String getBuildServiceAccount() {
        return get(BUILD_SERVICE_ACCOUNT);
    }

    public String getBuildTemplate() {
        return get(BUILD_TEMPLATE);
    }

    public String getProcessorImage() {
        return get(PROCESSOR_IMAGE);
    }

    public int getDnsCacheTtl() {
        return get(DNS_CACHE_TTL);
    }

    @Override
    public String toString() {
        return "SystemOperatorConfig(" +
                "namespaces=" + getNamespaces() +
                ",labels=" + getLabels() +
                ",reconciliationIntervalMs=" + getReconciliationIntervalMs() +
                ",workQueueSize=" + getWorkQueueSize() +
                ",controllerThreadPoolSize=" + getControllerThreadPoolSize() +
                ",skipRegistries=" + getSkipRegistries() +
                ",insecureRegistries=" + getInsecureRegistries() +
                ",registryTimeout=" + getRegistryTimeout() +
                ",buildServiceAccount=" + getBuildServiceAccount() +
                ",buildTemplate=" + getBuildTemplate() +
                ",processorImage=" + getProcessorImage() +
                ")";
    }
}
