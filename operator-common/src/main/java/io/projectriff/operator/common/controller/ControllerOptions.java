/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.model.Labels;

/**
 * Options of a controller
 *
 * @param namespace             Watched namespace or {@code *} for all namespaces
 * @param selector              Labels the owners have to carry, may be empty
 * @param workQueueSize         Size of the work queue
 * @param threadPoolSize        Number of controller loops
 * @param reconcileIntervalMs   Interval of the periodic reconciliation of all owners
 */
public record ControllerOptions(String namespace, Labels selector, int workQueueSize, int threadPoolSize, long reconcileIntervalMs) {
}
