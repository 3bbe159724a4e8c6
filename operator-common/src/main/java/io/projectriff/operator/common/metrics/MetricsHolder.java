/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.projectriff.operator.common.MetricsProvider;
import io.projectriff.operator.common.model.Labels;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Metrics of the reconciliations of one kind of resource. The metrics are created lazily per namespace.
 */
public abstract class MetricsHolder {
    /**
     * Prefix used for metrics provided by riff operators
     */
    public static final String METRICS_PREFIX = "riff.";
    /**
     * Metric name for number of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS = METRICS_PREFIX + "reconciliations";
    /**
     * Metric name for number of periodic reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_PERIODICAL = METRICS_RECONCILIATIONS + ".periodical";
    /**
     * Metric name for number of failed reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_FAILED = METRICS_RECONCILIATIONS + ".failed";
    /**
     * Metric name for number of successful reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_SUCCESSFUL = METRICS_RECONCILIATIONS + ".successful";
    /**
     * Metric name for duration of reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_DURATION = METRICS_RECONCILIATIONS + ".duration";
    /**
     * Metric name for number of locked reconciliations.
     */
    public static final String METRICS_RECONCILIATIONS_LOCKED = METRICS_RECONCILIATIONS + ".locked";
    /**
     * Metric name for number of resources managed by the operator.
     */
    public static final String METRICS_RESOURCES = METRICS_PREFIX + "resources";

    protected final String kind;
    protected final Labels selectorLabels;
    protected final MetricsProvider metricsProvider;

    protected final Map<MetricKey, AtomicInteger> resourceCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> periodicReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> reconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> failedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> successfulReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Counter> lockedReconciliationsCounterMap = new ConcurrentHashMap<>(1);
    private final Map<MetricKey, Timer> reconciliationsTimerMap = new ConcurrentHashMap<>(1);

    /**
     * Constructs the metrics holder
     *
     * @param kind              Kind of the resources for which these metrics apply
     * @param selectorLabels    Selector labels to select the controller resources
     * @param metricsProvider   Metrics provider
     */
    public MetricsHolder(String kind, Labels selectorLabels, MetricsProvider metricsProvider) {
        this.kind = kind;
        this.selectorLabels = selectorLabels;
        this.metricsProvider = metricsProvider;
    }

    /**
     * @return  Metrics provider used for the metrics by this holder class
     */
    public MetricsProvider metricsProvider()    {
        return metricsProvider;
    }

    /**
     * Counter metric for number of periodic reconciliations. It is incremented once per timer-trigger, not for every
     * resource found by the periodic reconciliation.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter periodicReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_PERIODICAL,
                "Number of periodical reconciliations done by the operator",
                periodicReconciliationsCounterMap);
    }

    /**
     * Counter metric for number of reconciliations. It increments once per reconciled resource.
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter reconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS,
                "Number of reconciliations done by the operator for individual resources",
                reconciliationsCounterMap);
    }

    /**
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Counter of failed reconciliations
     */
    public Counter failedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_FAILED,
                "Number of reconciliations done by the operator for individual resources which failed",
                failedReconciliationsCounterMap);
    }

    /**
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Counter of successful reconciliations
     */
    public Counter successfulReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_SUCCESSFUL,
                "Number of reconciliations done by the operator for individual resources which were successful",
                successfulReconciliationsCounterMap);
    }

    /**
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Timer which measures how long do the reconciliations take
     */
    public Timer reconciliationsTimer(String namespace) {
        return getTimer(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_DURATION,
                "The time the reconciliation takes to complete",
                reconciliationsTimerMap);
    }

    /**
     * Counter metric for number of reconciliations which did not happen because they did not get the lock (another
     * reconciliation for the same resource was in progress).
     *
     * @param namespace     Namespace of the resources being reconciled
     *
     * @return  Metrics counter
     */
    public Counter lockedReconciliationsCounter(String namespace) {
        return getCounter(new MetricKey(kind, namespace), METRICS_RECONCILIATIONS_LOCKED,
                "Number of reconciliations skipped because another reconciliation for the same resource was still running",
                lockedReconciliationsCounterMap);
    }

    /**
     * @param namespace     Namespace of the resources
     *
     * @return  Gauge with the number of resources managed by this operator
     */
    public AtomicInteger resourceCounter(String namespace) {
        return getGauge(new MetricKey(kind, namespace), METRICS_RESOURCES,
                "Number of custom resources the operator sees",
                resourceCounterMap);
    }

    /**
     * Utility method which gets or creates the metric.
     *
     * @param metricKey         Key of the metric
     * @param metricMap         The map with the metrics
     * @param fn                Method for generating the metrics from its tags
     * @param optionalTags      Optional tags to be added to the metric
     *
     * @return  Metric
     *
     * @param <M>   Type of the metric
     */
    protected <M> M metric(MetricKey metricKey, Map<MetricKey, M> metricMap, Function<Tags, M> fn, Tag... optionalTags) {
        Tags metricTags = MetricsUtils.getAllMetricTags(metricKey.namespace(), metricKey.kind(), Optional.of(getLabelSelectorValues()), optionalTags);
        return metricMap.computeIfAbsent(metricKey, k -> fn.apply(metricTags));
    }

    protected Counter getCounter(MetricKey metricKey, String metricName, String metricHelp, Map<MetricKey, Counter> counterMap) {
        return metric(metricKey, counterMap, tags -> metricsProvider.counter(metricName, metricHelp, tags));
    }

    protected AtomicInteger getGauge(MetricKey metricKey, String metricName, String metricHelp, Map<MetricKey, AtomicInteger> gaugeMap) {
        return metric(metricKey, gaugeMap, tags -> metricsProvider.gauge(metricName, metricHelp, tags));
    }

    protected Timer getTimer(MetricKey metricKey, String metricName, String metricHelp, Map<MetricKey, Timer> timerMap) {
        return metric(metricKey, timerMap, tags -> metricsProvider.timer(metricName, metricHelp, tags));
    }

    protected String getLabelSelectorValues() {
        return selectorLabels != null ? selectorLabels.toSelectorString() : "";
    }
}
