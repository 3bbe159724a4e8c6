/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.http;

/**
 * A readiness check called by the {@link HealthCheckAndMetricsServer} when handling a readiness request.
 */
public interface Readiness {
    /**
     * @return  True when the operator synced its caches and processes the work queues.
     */
    boolean isReady();
}
