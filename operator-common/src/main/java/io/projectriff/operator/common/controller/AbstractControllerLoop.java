/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.micrometer.core.instrument.Timer;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.metrics.ControllerMetricsHolder;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * A controller loop thread. It takes owner keys from the work queue, obtains the lock of the key and runs the
 * reconciliation. Failed reconciliations are put back to the queue after a per key backoff.
 */
public abstract class AbstractControllerLoop {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractControllerLoop.class);
    private static final long PROGRESS_WARNING_MS = 60_000L;

    private final String name;
    private final Thread controllerThread;
    private final ControllerQueue workQueue;
    private final ReconciliationLockManager lockManager;
    private final ReconciliationBackOff backOff;
    private final ScheduledExecutorService scheduledExecutor;

    private volatile boolean stop = false;
    private volatile boolean running = false;

    /**
     * Creates the controller loop
     *
     * @param name                  The name of this controller loop, used for the thread name and in the logs
     * @param workQueue             Queue from which events should be consumed
     * @param lockManager           Lock manager for making sure no parallel reconciliations for a given resource can happen
     * @param backOff               Backoff used to delay the redelivery of failed reconciliations
     * @param scheduledExecutor     Scheduled executor service used to run the progress warnings and the redeliveries
     */
    public AbstractControllerLoop(String name, ControllerQueue workQueue, ReconciliationLockManager lockManager, ReconciliationBackOff backOff, ScheduledExecutorService scheduledExecutor) {
        this.name = name;
        this.workQueue = workQueue;
        this.lockManager = lockManager;
        this.backOff = backOff;
        this.scheduledExecutor = scheduledExecutor;
        this.controllerThread = new Thread(new Runner(), name);
    }

    /**
     * The main reconciliation logic which handles the reconciliations.
     *
     * @param reconciliation    Reconciliation identifier used for logging
     *
     * @throws ReconciliationException when the reconciliation failed and should be retried
     */
    protected abstract void reconcile(Reconciliation reconciliation) throws ReconciliationException;

    /**
     * @return Controller metrics holder instance
     */
    protected abstract ControllerMetricsHolder metrics();

    /**
     * Starts the controller: this method creates a new thread in which the controller will run
     */
    public void start() {
        LOGGER.debugOp("{}: Starting the controller loop", name);
        controllerThread.start();
    }

    /**
     * Stops the controller: this method sets the stop flag and interrupt the run loop
     *
     * @throws InterruptedException when interrupted while joining the thread
     */
    public void stop() throws InterruptedException {
        LOGGER.infoOp("{}: Requesting the controller loop to stop", name);
        this.stop = true;
        controllerThread.interrupt();
        controllerThread.join();
    }

    /**
     * @return  True when the controller is in the run loop, false otherwise
     */
    public boolean isRunning() {
        return running;
    }

    /**
     * @return  True when the controller loop thread is alive, false otherwise
     */
    public boolean isAlive() {
        return controllerThread.isAlive();
    }

    /**
     * Obtains the lock of the resource and reconciles it. If the lock is in use, the reconciliation is put back to
     * the queue.
     *
     * @param reconciliation    Reconciliation marker
     */
    /* test */ void reconcileWithLock(SimplifiedReconciliation reconciliation) {
        String lockName = reconciliation.lockName();
        boolean requeue = false;

        try {
            boolean locked = lockManager.tryLock(lockName, 1_000, TimeUnit.MILLISECONDS);

            if (locked) {
                try {
                    reconcileWrapper(reconciliation);
                } finally {
                    lockManager.unlock(lockName);
                }
            } else {
                LOGGER.warnOp("{}: Failed to acquire lock {}. The resource will be re-queued for later.", name, lockName);
                metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
                requeue = true;
            }
        } catch (InterruptedException e) {
            LOGGER.warnOp("{}: Interrupted while trying to acquire lock {}. The resource will be re-queued for later.", name, lockName);
            metrics().lockedReconciliationsCounter(reconciliation.namespace).increment();
            requeue = true;
        }

        if (requeue) {
            workQueue.enqueue(reconciliation);
        }
    }

    /**
     * Runs the reconciliation with the progress warnings, the metrics and the retry handling.
     *
     * @param simplified    Key of the reconciled resource
     */
    private void reconcileWrapper(SimplifiedReconciliation simplified) {
        Reconciliation reconciliation = simplified.toReconciliation();
        ScheduledFuture<?> progressWarning = scheduledExecutor
                .scheduleAtFixedRate(() -> LOGGER.infoCr(reconciliation, "Reconciliation is in progress"), PROGRESS_WARNING_MS, PROGRESS_WARNING_MS, TimeUnit.MILLISECONDS);
        metrics().reconciliationsCounter(reconciliation.namespace()).increment();
        Timer.Sample reconciliationTimerSample = Timer.start(metrics().metricsProvider().meterRegistry());

        try {
            reconcile(reconciliation);

            metrics().successfulReconciliationsCounter(reconciliation.namespace()).increment();
            backOff.success(simplified.lockName());
            LOGGER.debugCr(reconciliation, "reconciled");
        } catch (ReconciliationException | RuntimeException e) {
            metrics().failedReconciliationsCounter(reconciliation.namespace()).increment();
            long delayMs = backOff.failure(simplified.lockName());
            LOGGER.warnCr(reconciliation, "Reconciliation failed, retrying in {}ms: {}", delayMs, e.getMessage());
            LOGGER.debugCr(reconciliation, "Reconciliation failure", e);
            requeueAfter(simplified.withTrigger(SimplifiedReconciliation.TRIGGER_RETRY), delayMs);
        } finally {
            reconciliationTimerSample.stop(metrics().reconciliationsTimer(reconciliation.namespace()));
            progressWarning.cancel(true);
        }
    }

    private void requeueAfter(SimplifiedReconciliation reconciliation, long delayMs) {
        try {
            scheduledExecutor.schedule(() -> {
                metrics().requeuedReconciliationsCounter(reconciliation.namespace).increment();
                workQueue.enqueue(reconciliation);
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            LOGGER.debugOp("{}: Not re-queueing {} because the operator is shutting down", name, reconciliation);
        }
    }

    /**
     * Runs the controller loop: picks reconciliations from the work queue and executes them.
     */
    private class Runner implements Runnable {
        @Override
        public void run() {
            LOGGER.debugOp("{}: Starting", name);
            running = true;

            while (!stop) {
                try {
                    LOGGER.debugOp("{}: Waiting for next event from work queue", name);
                    SimplifiedReconciliation reconciliation = workQueue.take();
                    reconcileWithLock(reconciliation);
                } catch (InterruptedException e) {
                    LOGGER.debugOp("{}: was interrupted", name, e);
                } catch (Exception e) {
                    LOGGER.warnOp("{}: reconciliation failed", name, e);
                }
            }

            LOGGER.infoOp("{}: Stopping", name);
            running = false;
        }
    }
}
