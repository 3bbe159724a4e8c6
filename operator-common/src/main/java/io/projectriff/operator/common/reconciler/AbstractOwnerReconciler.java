/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.common.Status;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.controller.Reconciler;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.model.ConditionManager;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.model.ResourceUtils;
import io.projectriff.operator.common.model.StatusDiff;
import io.projectriff.operator.common.model.StatusUtils;
import io.projectriff.operator.common.operator.resource.ResourceOperator;

import java.time.Duration;

/**
 * Drives one reconciliation of an owner resource. The owner is read, defaulted in memory and its children are
 * synchronized by the subclass. The status is written only when it changed, also when the synchronization failed,
 * so that the conditions describe the failure. The failure is rethrown afterwards to get the owner requeued.
 *
 * @param <O>   Type of the owner
 * @param <S>   Type of the owner status
 */
public abstract class AbstractOwnerReconciler<O extends CustomResource<?, S>, S extends Status> implements Reconciler {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractOwnerReconciler.class);

    protected final String kind;
    protected final ResourceOperator<O> ownerOperator;
    protected final EventRecorder eventRecorder;
    protected final ConditionSet conditionSet;

    /**
     * Constructor
     *
     * @param kind          Kind of the owner
     * @param ownerOperator Operator for the owner resources
     * @param eventRecorder Recorder for the events
     * @param conditionSet  Conditions of the owner
     */
    protected AbstractOwnerReconciler(String kind, ResourceOperator<O> ownerOperator, EventRecorder eventRecorder, ConditionSet conditionSet) {
        this.kind = kind;
        this.ownerOperator = ownerOperator;
        this.eventRecorder = eventRecorder;
        this.conditionSet = conditionSet;
    }

    @Override
    public void reconcile(Reconciliation reconciliation) throws ReconciliationException {
        O original = ownerOperator.get(reconciliation.namespace(), reconciliation.name());

        if (original == null) {
            LOGGER.debugCr(reconciliation, "{} {} no longer exists", kind, reconciliation.key());
            onOwnerDeleted(reconciliation);
            return;
        } else if (original.getMetadata().getDeletionTimestamp() != null) {
            LOGGER.debugCr(reconciliation, "{} {} is being deleted", kind, reconciliation.key());
            return;
        }

        O owner = ResourceUtils.deepCopy(original);
        applyDefaults(owner);

        if (owner.getStatus() == null) {
            owner.setStatus(newStatus());
        }

        ConditionManager conditions = conditionSet.manage(owner.getStatus());
        conditions.initializeConditions();

        ReconciliationException failure = null;
        boolean complete = false;

        try {
            complete = reconcileChildren(reconciliation, owner, conditions);
        } catch (ChildNotOwnedException e) {
            LOGGER.debugCr(reconciliation, e.getMessage());
            failure = e;
        } catch (ReconciliationException e) {
            failure = e;
        } catch (KubernetesClientException e) {
            failure = new ReconciliationException("Failed to reconcile " + kind + " " + reconciliation.key() + ": " + e.getMessage(), e);
        }

        if (complete && failure == null) {
            owner.getStatus().setObservedGeneration(owner.getMetadata().getGeneration());
        }

        boolean statusWritten;
        try {
            statusWritten = maybeUpdateStatus(reconciliation, original, owner);
        } catch (ReconciliationException e) {
            if (failure != null) {
                failure.addSuppressed(e);
                throw failure;
            }

            throw e;
        }

        if (failure != null) {
            throw failure;
        }

        if (statusWritten && !isReady(original.getStatus()) && conditions.isReady()) {
            Duration sinceCreation = StatusUtils.sinceTimestamp(original.getMetadata().getCreationTimestamp());
            LOGGER.infoCr(reconciliation, "{} {} became ready after {} ms", kind, reconciliation.key(), sinceCreation.toMillis());
            eventRecorder.event(owner, EventRecorder.TYPE_NORMAL, "Ready", "%s became ready after %s", kind, sinceCreation);
        }
    }

    /**
     * Writes the status when it differs from the status of the fetched owner
     *
     * @return  True when the status was written
     */
    private boolean maybeUpdateStatus(Reconciliation reconciliation, O original, O owner) throws ReconciliationException {
        StatusDiff diff = new StatusDiff(original.getStatus(), owner.getStatus());

        if (diff.isEmpty()) {
            LOGGER.debugCr(reconciliation, "Status of {} {} did not change", kind, reconciliation.key());
            return false;
        }

        O updated = ResourceUtils.deepCopy(original);
        updated.setStatus(owner.getStatus());

        try {
            ownerOperator.updateStatus(updated);
            LOGGER.debugCr(reconciliation, "Status of {} {} updated", kind, reconciliation.key());
            return true;
        } catch (KubernetesClientException e) {
            if (Util.isNotFound(e)) {
                LOGGER.debugCr(reconciliation, "{} {} was deleted before its status could be updated", kind, reconciliation.key());
                return false;
            } else if (Util.isConflict(e)) {
                LOGGER.debugCr(reconciliation, "{} {} changed while its status was being updated", kind, reconciliation.key());
                throw new ReconciliationException("Conflict while updating the status of " + kind + " " + reconciliation.key(), e);
            }

            LOGGER.warnCr(reconciliation, "Failed to update the status of {} {}: {}", kind, reconciliation.key(), e.getMessage());
            eventRecorder.event(owner, EventRecorder.TYPE_WARNING, "UpdateFailed", "Failed to update status: %s", e.getMessage());
            throw new ReconciliationException("Failed to update the status of " + kind + " " + reconciliation.key(), e);
        }
    }

    /**
     * Synchronizes the children of one kind. A child with the desired name which the owner does not control marks
     * the condition tracking the child as NotOwned.
     *
     * @param synchronizer      Synchronizer of the children
     * @param reconciliation    Reconciliation of the owner
     * @param owner             Owner
     * @param conditions        Conditions of the owner
     * @param conditionType     Condition tracking the child
     * @param <C>               Type of the child
     *
     * @return  The canonical child or null
     *
     * @throws ReconciliationException when the synchronization failed
     */
    protected <C extends HasMetadata> C synchronize(ChildSynchronizer<O, C> synchronizer, Reconciliation reconciliation, O owner,
                                                    ConditionManager conditions, String conditionType) throws ReconciliationException {
        try {
            return synchronizer.synchronize(reconciliation, owner);
        } catch (ChildNotOwnedException e) {
            conditions.markNotOwned(conditionType, e.getChildKind(), e.getChildName(), kind);
            throw e;
        }
    }

    private static boolean isReady(Status status) {
        if (status == null) {
            return false;
        }

        Condition ready = status.getCondition(ConditionSet.READY);
        return ready != null && ready.isTrue();
    }

    /**
     * Fills the unset fields of the owner with their defaults. Only the in-memory copy is changed.
     *
     * @param owner Owner
     */
    protected void applyDefaults(O owner) {
    }

    /**
     * Called when the owner does not exist anymore
     *
     * @param reconciliation    Reconciliation of the owner
     */
    protected void onOwnerDeleted(Reconciliation reconciliation) {
    }

    /**
     * @return  An empty status of the owner
     */
    protected abstract S newStatus();

    /**
     * Synchronizes the children of the owner in their dependency order and updates the conditions
     *
     * @param reconciliation    Reconciliation of the owner
     * @param owner             Owner with defaults applied
     * @param conditions        Conditions of the owner
     *
     * @return  True when all steps ran, false when a step stopped the reconciliation without an error
     *
     * @throws ReconciliationException when a step failed
     */
    protected abstract boolean reconcileChildren(Reconciliation reconciliation, O owner, ConditionManager conditions) throws ReconciliationException;
}
