/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.http;

/**
 * A liveness check called by the {@link HealthCheckAndMetricsServer} when handling a health check request.
 */
public interface Liveness {
    /**
     * Indicates whether the operator is alive: its controller threads and informers are running. This method is
     * invoked on the HTTP request handling thread so it should not block.
     *
     * @return  True when the operator is alive, false otherwise.
     */
    boolean isAlive();
}
