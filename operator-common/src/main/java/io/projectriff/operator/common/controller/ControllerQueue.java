/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.metrics.ControllerMetricsHolder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Bounded work queue of owner keys. A key which is already waiting in the queue is not added a second time, which
 * coalesces bursts of events for the same resource into a single reconciliation.
 */
public class ControllerQueue {
    private final static Logger LOGGER = LogManager.getLogger(ControllerQueue.class);

    /*test*/ final BlockingQueue<SimplifiedReconciliation> queue;
    private final ControllerMetricsHolder metrics;

    /**
     * Creates the controller queue. There is one queue per owner kind.
     *
     * @param queueSize     The capacity of the work queue
     * @param metrics       Holder for the controller metrics
     */
    public ControllerQueue(int queueSize, ControllerMetricsHolder metrics) {
        this.queue = new ArrayBlockingQueue<>(queueSize);
        this.metrics = metrics;
    }

    /**
     * @return  Takes the next item from the queue. Blocks if the queue is empty.
     *
     * @throws InterruptedException if interrupted while waiting for the next resource
     */
    public SimplifiedReconciliation take() throws InterruptedException {
        return queue.take();
    }

    /**
     * Enqueues the next reconciliation unless another reconciliation for the same resource is already in the queue.
     *
     * @param reconciliation    Reconciliation identifier
     */
    public synchronized void enqueue(SimplifiedReconciliation reconciliation)    {
        if (!queue.contains(reconciliation)) {
            LOGGER.debug("Enqueueing {} {} in namespace {}", reconciliation.kind, reconciliation.name, reconciliation.namespace);
            if (!queue.offer(reconciliation))    {
                LOGGER.warn("Failed to enqueue {} because the controller queue is full", reconciliation);
            }
        } else {
            metrics.alreadyEnqueuedReconciliationsCounter(reconciliation.namespace).increment();
            LOGGER.debug("{} {} in namespace {} is already enqueued => ignoring", reconciliation.kind, reconciliation.name, reconciliation.namespace);
        }
    }

    /**
     * @return  Number of keys waiting in the queue
     */
    public int size() {
        return queue.size();
    }
}
