/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.metrics.ControllerMetricsHolder;

import java.util.concurrent.ScheduledExecutorService;

/**
 * Controller loop which delegates the reconciliation to a {@link Reconciler}
 */
public class ControllerLoop extends AbstractControllerLoop {
    private final Reconciler reconciler;
    private final ControllerMetricsHolder metrics;

    /**
     * Creates the controller loop
     *
     * @param name                  The name of this controller loop
     * @param workQueue             Queue from which events should be consumed
     * @param lockManager           Lock manager shared by the loops of the same controller
     * @param backOff               Backoff shared by the loops of the same controller
     * @param scheduledExecutor     Scheduled executor service
     * @param reconciler            Reconciler of the owner kind
     * @param metrics               Metrics holder
     */
    public ControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ReconciliationBackOff backOff,
                          ScheduledExecutorService scheduledExecutor, Reconciler reconciler, ControllerMetricsHolder metrics) {
        super(name, workQueue, lockManager, backOff, scheduledExecutor);
        this.reconciler = reconciler;
        this.metrics = metrics;
    }

    @Override
    protected void reconcile(Reconciliation reconciliation) throws ReconciliationException {
        reconciler.reconcile(reconciliation);
    }

    @Override
    protected ControllerMetricsHolder metrics() {
        return metrics;
    }
}
