/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.metrics;

import io.micrometer.core.instrument.Counter;
import io.projectriff.operator.common.MetricsProvider;
import io.projectriff.operator.common.model.Labels;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Metrics holder used by the controllers. On top of the generic reconciliation metrics, it counts the keys which were
 * already queued and the keys redelivered after a failure.
 */
public class ControllerMetricsHolder extends MetricsHolder {
    /**
     * Metric name for reconciliations which are already queued when we try to enqueue them again.
     */
    public static final String METRICS_RECONCILIATIONS_ALREADY_ENQUEUED = METRICS_RECONCILIATIONS + ".already.enqueued";
    /**
     * Metric name for reconciliations redelivered after a failure.
     */
    public static final String METRICS_RECONCILIATIONS_REQUEUED = METRICS_RECONCILIATIONS + ".requeued";

    private final Map<MetricKey, Counter> alreadyQueuedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> requeuedReconciliationsCounterMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the controller metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param selectorLabels    Selector labels to select the controller resources
     * @param metricsProvider   Metrics provider
     */
    public ControllerMetricsHolder(String kind, Labels selectorLabels, MetricsProvider metricsProvider) {
        super(kind, selectorLabels, metricsProvider);
    }

    /**
     * Counter metric for number of reconciliations which are already queued when we try to enqueue them again. This
     * might indicate for example that the periodic reconciliations are triggering faster than the operator
     * reconciles them.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter alreadyEnqueuedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_ALREADY_ENQUEUED,
                "Number of reconciliations skipped because the same resource was already waiting in the queue",
                alreadyQueuedReconciliationsCounterMap);
    }

    /**
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Counter of reconciliations redelivered with a backoff after they failed
     */
    public Counter requeuedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_REQUEUED,
                "Number of reconciliations scheduled again after a failure",
                requeuedReconciliationsCounterMap);
    }
}
