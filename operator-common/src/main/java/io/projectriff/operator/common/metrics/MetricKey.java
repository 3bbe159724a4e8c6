/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.metrics;

import java.util.Objects;

/**
 * Key of the per kind and namespace metrics
 *
 * @param kind      Kind of the resource
 * @param namespace Namespace of the resource
 */
public record MetricKey(String kind, String namespace) {
    /**
     * @return  Key of the metric in the {@code kind/namespace} format
     */
    public String getKey() {
        return String.format("%s/%s", kind, namespace);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj instanceof MetricKey metricKey) {
            return Objects.equals(getKey(), metricKey.getKey());
        }
        return false;
    }

    @Override
    public int hashCode() {
        return getKey().hashCode();
    }
}
