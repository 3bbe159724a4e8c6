/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.projectriff.operator.common.InformerUtils;
import io.projectriff.operator.common.MetricsProvider;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.http.Liveness;
import io.projectriff.operator.common.http.Readiness;
import io.projectriff.operator.common.metrics.ControllerMetricsHolder;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnerReferences;
import io.projectriff.operator.common.operator.resource.ResourceOperator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Controller of one owner kind. It queues the reconciliations of the owners based on the Kubernetes events of the
 * owners, of the children they control and of the resources they reference, and triggers periodic reconciliations of
 * all owners. The queued reconciliations are processed by the controller loops.
 *
 * @param <T>   Type of the owner
 */
public class Controller<T extends HasMetadata> implements Liveness, Readiness {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Controller.class);
    private static final long DEFAULT_RESYNC_PERIOD_MS = 5 * 60 * 1_000L; // 5 minutes by default

    private final String kind;
    private final String watchedNamespace;
    private final long reconcileIntervalMs;

    private final ControllerMetricsHolder metrics;
    private final ControllerQueue workQueue;
    private final List<ControllerLoop> threadPool;
    private final ScheduledExecutorService scheduledExecutor;

    private final SharedIndexInformer<T> ownerInformer;
    private final List<SharedIndexInformer<? extends HasMetadata>> secondaryInformers = new ArrayList<>();

    /**
     * Creates the controller
     *
     * @param ownerOperator         Operator for the owner resources
     * @param reconciler            Reconciler of a single owner
     * @param options               Options of the controller
     * @param metricsProvider       Metrics provider
     */
    public Controller(ResourceOperator<T> ownerOperator, Reconciler reconciler, ControllerOptions options, MetricsProvider metricsProvider) {
        this.kind = ownerOperator.kind();
        this.watchedNamespace = options.namespace();
        this.reconcileIntervalMs = options.reconcileIntervalMs();

        Labels selector = options.selector() != null ? options.selector() : Labels.EMPTY;

        this.metrics = new ControllerMetricsHolder(kind, selector, metricsProvider);
        this.workQueue = new ControllerQueue(options.workQueueSize(), metrics);
        this.ownerInformer = ownerOperator.informer(watchedNamespace, selector.toMap(), DEFAULT_RESYNC_PERIOD_MS);
        this.scheduledExecutor = Executors.newSingleThreadScheduledExecutor(r -> new Thread(r, kind + "ControllerScheduledExecutor"));

        ReconciliationLockManager lockManager = new ReconciliationLockManager();
        ReconciliationBackOff backOff = new ReconciliationBackOff();

        this.threadPool = new ArrayList<>(options.threadPoolSize());
        for (int i = 0; i < options.threadPoolSize(); i++)  {
            threadPool.add(new ControllerLoop(kind + "-ControllerLoop-" + i, workQueue, lockManager, backOff, scheduledExecutor, reconciler, metrics));
        }
    }

    /**
     * Watches the children of the given kind and reconciles their controlling owner when they change. Has to be
     * called before the controller is started.
     *
     * @param childOperator Operator for the children
     * @param <C>           Type of the children
     */
    public <C extends HasMetadata> void watchControlledChildren(ResourceOperator<C> childOperator) {
        SharedIndexInformer<C> informer = childOperator.informer(watchedNamespace, Map.of(), DEFAULT_RESYNC_PERIOD_MS);
        informer.addEventHandler(new SecondaryEventHandler<>(childOperator.kind(), this::enqueueControllerOf));
        secondaryInformers.add(informer);
    }

    /**
     * Watches the resources of the given kind and reconciles the owners which referenced them during their last
     * reconciliation. Has to be called before the controller is started.
     *
     * @param referenceOperator Operator for the referenced resources
     * @param tracker           Tracker of the references which is shared with the reconciler
     * @param <R>               Type of the referenced resources
     */
    public <R extends HasMetadata> void watchReferences(ResourceOperator<R> referenceOperator, ReferenceTracker tracker) {
        String referenceKind = referenceOperator.kind();
        SharedIndexInformer<R> informer = referenceOperator.informer(watchedNamespace, Map.of(), DEFAULT_RESYNC_PERIOD_MS);
        informer.addEventHandler(new SecondaryEventHandler<>(referenceKind, resource -> tracker
                .ownersReferencing(kind, referenceKind, resource.getMetadata().getNamespace(), resource.getMetadata().getName())
                .forEach(owner -> workQueue.enqueue(owner.withTrigger(SimplifiedReconciliation.TRIGGER_WATCH)))));
        secondaryInformers.add(informer);
    }

    private void enqueueOwner(T owner, String action) {
        LOGGER.infoOp("{} {} in namespace {} was {}", kind, owner.getMetadata().getName(), owner.getMetadata().getNamespace(), action);
        workQueue.enqueue(new SimplifiedReconciliation(kind, owner.getMetadata().getNamespace(), owner.getMetadata().getName()));
    }

    private void enqueueControllerOf(HasMetadata child) {
        OwnerReference controller = OwnerReferences.getControllerOf(child);

        if (controller != null && kind.equals(controller.getKind())) {
            workQueue.enqueue(new SimplifiedReconciliation(kind, child.getMetadata().getNamespace(), controller.getName()));
        }
    }

    /**
     * Indicates that the informers have been synced and are up-to-date.
     *
     * @return  True when all informers are synced. False otherwise.
     */
    protected boolean isSynced() {
        boolean synced = ownerInformer.hasSynced();

        for (SharedIndexInformer<? extends HasMetadata> informer : secondaryInformers) {
            synced &= informer.hasSynced();
        }

        return synced;
    }

    /**
     * Starts the controller: its informers, its loop threads and the periodic reconciliations
     */
    public void start() {
        ownerInformer.addEventHandler(new OwnerEventHandler());
        ownerInformer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(kind, isStarted, throwable));

        LOGGER.infoOp("Starting the {} informer", kind);
        ownerInformer.start();

        for (SharedIndexInformer<? extends HasMetadata> informer : secondaryInformers) {
            informer.exceptionHandler((isStarted, throwable) -> InformerUtils.loggingExceptionHandler(kind + " secondary", isStarted, throwable));
            informer.start();
        }

        while (!isSynced())   {
            LOGGER.infoOp("Waiting for the {} informers to sync", kind);
            try {
                Thread.sleep(1_000);
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while waiting for informers to sync", e);
            }
        }

        LOGGER.infoOp("Starting {} controller loops", kind);
        threadPool.forEach(AbstractControllerLoop::start);

        scheduledExecutor.scheduleAtFixedRate(new PeriodicReconciliation(), reconcileIntervalMs, reconcileIntervalMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Stops the controller and all its controller loop threads
     */
    public void stop() {
        LOGGER.infoOp("Stopping the {} scheduled executor service", kind);
        scheduledExecutor.shutdownNow();

        LOGGER.infoOp("Stopping {} controller loops", kind);
        threadPool.forEach(t -> {
            try {
                t.stop();
            } catch (InterruptedException e) {
                LOGGER.debugOp("Interrupted while stopping controller loop", e);
            }
        });

        List<SharedIndexInformer<?>> informers = new ArrayList<>(secondaryInformers);
        informers.add(ownerInformer);
        InformerUtils.stopAll(5_000L, informers.toArray(new SharedIndexInformer<?>[0]));
    }

    /**
     * The controller is ready when all its loops are running
     *
     * @return  True when the controller is ready, false otherwise
     */
    @Override
    public boolean isReady()    {
        boolean ready = true;

        for (ControllerLoop t : threadPool) {
            ready &= t.isRunning();
        }

        return ready;
    }

    /**
     * The controller is alive when all its loop threads and informers are alive
     *
     * @return  True when the controller is alive, false otherwise
     */
    @Override
    public boolean isAlive()    {
        boolean alive = ownerInformer.isRunning();

        for (ControllerLoop t : threadPool) {
            alive &= t.isAlive();
        }

        for (SharedIndexInformer<? extends HasMetadata> informer : secondaryInformers) {
            alive &= informer.isRunning();
        }

        return alive;
    }

    /**
     * Queues all owners known to the owner informer
     */
    class PeriodicReconciliation implements Runnable  {
        @Override
        public void run() {
            LOGGER.infoOp("Triggering periodic reconciliation of {} resources for namespace {}", kind, watchedNamespace);
            metrics.periodicReconciliationsCounter(watchedNamespace).increment();

            for (T owner : ownerInformer.getIndexer().list()) {
                workQueue.enqueue(new SimplifiedReconciliation(kind, owner.getMetadata().getNamespace(), owner.getMetadata().getName(), SimplifiedReconciliation.TRIGGER_TIMER));
            }
        }
    }

    private class OwnerEventHandler implements ResourceEventHandler<T> {
        @Override
        public void onAdd(T owner) {
            metrics.resourceCounter(watchedNamespace).incrementAndGet();
            enqueueOwner(owner, "ADDED");
        }

        @Override
        public void onUpdate(T oldOwner, T newOwner) {
            enqueueOwner(newOwner, "MODIFIED");
        }

        @Override
        public void onDelete(T owner, boolean deletedFinalStateUnknown) {
            metrics.resourceCounter(watchedNamespace).decrementAndGet();
            enqueueOwner(owner, "DELETED");
        }
    }

    private static class SecondaryEventHandler<S extends HasMetadata> implements ResourceEventHandler<S> {
        private final String secondaryKind;
        private final Consumer<S> enqueue;

        SecondaryEventHandler(String secondaryKind, Consumer<S> enqueue) {
            this.secondaryKind = secondaryKind;
            this.enqueue = enqueue;
        }

        @Override
        public void onAdd(S resource) {
            LOGGER.debugOp("{} {} in namespace {} was ADDED", secondaryKind, resource.getMetadata().getName(), resource.getMetadata().getNamespace());
            enqueue.accept(resource);
        }

        @Override
        public void onUpdate(S oldResource, S newResource) {
            LOGGER.debugOp("{} {} in namespace {} was MODIFIED", secondaryKind, newResource.getMetadata().getName(), newResource.getMetadata().getNamespace());
            enqueue.accept(newResource);
        }

        @Override
        public void onDelete(S resource, boolean deletedFinalStateUnknown) {
            LOGGER.debugOp("{} {} in namespace {} was DELETED", secondaryKind, resource.getMetadata().getName(), resource.getMetadata().getNamespace());
            enqueue.accept(resource);
        }
    }
}
