/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnerReferences;
import io.projectriff.operator.common.model.ResourceUtils;
import io.projectriff.operator.common.operator.resource.ResourceOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Converges the children of one kind of an owner towards the desired child.
 * <ul>
 *     <li>Children are found through the selector labels and partitioned into those controlled by the owner and
 *     foreign ones. Foreign children are never modified or deleted.</li>
 *     <li>The canonical child is the owned child with the desired name or, when the desired child has a generated
 *     name, the most recently created owned child. All other owned children are deleted, oldest first. The first
 *     failed delete ends the synchronization with an error.</li>
 *     <li>A missing canonical child is created. An existing one is updated with the managed fields of the desired
 *     child when they differ.</li>
 *     <li>When no child is desired, all owned children are deleted.</li>
 * </ul>
 *
 * @param <O>   Type of the owner
 * @param <C>   Type of the child
 */
public class ChildSynchronizer<O extends HasMetadata, C extends HasMetadata> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ChildSynchronizer.class);

    private final ResourceOperator<C> childOperator;
    private final ChildDefinition<O, C> definition;
    private final EventRecorder eventRecorder;

    /**
     * Constructor
     *
     * @param childOperator Operator for the children
     * @param definition    Definition of the child
     * @param eventRecorder Recorder for the events about the children
     */
    public ChildSynchronizer(ResourceOperator<C> childOperator, ChildDefinition<O, C> definition, EventRecorder eventRecorder) {
        this.childOperator = childOperator;
        this.definition = definition;
        this.eventRecorder = eventRecorder;
    }

    /**
     * @return  Kind of the synchronized children
     */
    public String childKind() {
        return definition.childKind();
    }

    /**
     * Synchronizes the children of the owner
     *
     * @param reconciliation    Reconciliation of the owner
     * @param owner             Owner with defaults applied
     *
     * @return  The canonical child after the synchronization or null when no child exists
     *
     * @throws ChildNotOwnedException when a child with the desired name is not controlled by the owner
     * @throws ReconciliationException when a child could not be created, updated or deleted
     */
    public C synchronize(Reconciliation reconciliation, O owner) throws ReconciliationException {
        String namespace = owner.getMetadata().getNamespace();
        Labels selector = definition.selector(owner);
        C desired = definition.desired(owner);

        if (desired != null) {
            prepare(desired, owner, selector);
        }

        List<C> owned = new ArrayList<>();
        List<C> foreign = new ArrayList<>();
        List<C> existing = new ArrayList<>(childOperator.list(namespace, selector));
        existing.sort(ResourceUtils.BY_CREATION);

        for (C child : existing) {
            if (OwnerReferences.isControlledBy(child, owner)) {
                owned.add(child);
            } else {
                foreign.add(child);
            }
        }

        String desiredName = desired != null ? desired.getMetadata().getName() : null;

        if (desiredName != null) {
            for (C child : foreign) {
                if (desiredName.equals(child.getMetadata().getName())) {
                    throw new ChildNotOwnedException(definition.childKind(), desiredName);
                }
            }
        }

        if (desired == null) {
            deleteAll(reconciliation, owner, owned);
            return null;
        }

        C canonical = null;
        if (desiredName != null) {
            for (C child : owned) {
                if (desiredName.equals(child.getMetadata().getName())) {
                    canonical = child;
                }
            }
        } else if (!owned.isEmpty()) {
            canonical = owned.get(owned.size() - 1);
        }

        List<C> extras = new ArrayList<>(owned);
        extras.remove(canonical);
        deleteAll(reconciliation, owner, extras);

        if (canonical == null) {
            return create(reconciliation, owner, desired);
        } else if (!definition.semanticEquals(desired, canonical)) {
            return update(reconciliation, owner, definition.mergeOwnedFields(desired, ResourceUtils.deepCopy(canonical)));
        } else {
            LOGGER.traceCr(reconciliation, "{} {} is up to date", definition.childKind(), canonical.getMetadata().getName());
            return canonical;
        }
    }

    private void prepare(C desired, O owner, Labels selector) {
        if (desired.getMetadata() == null) {
            desired.setMetadata(new ObjectMeta());
        }

        ObjectMeta metadata = desired.getMetadata();
        metadata.setNamespace(owner.getMetadata().getNamespace());
        metadata.setOwnerReferences(new ArrayList<>(List.of(OwnerReferences.controllerReference(owner))));
        metadata.setLabels(Util.mergeLabelsOrAnnotations(metadata.getLabels(), selector.toMap()));
    }

    private C create(Reconciliation reconciliation, O owner, C desired) throws ReconciliationException {
        String name = desired.getMetadata().getName() != null ? desired.getMetadata().getName() : desired.getMetadata().getGenerateName();

        try {
            C created = childOperator.create(desired);
            LOGGER.infoCr(reconciliation, "Created {} {}", definition.childKind(), created.getMetadata().getName());
            eventRecorder.event(owner, EventRecorder.TYPE_NORMAL, "Created", "Created %s \"%s\"", definition.childKind(), created.getMetadata().getName());
            return created;
        } catch (KubernetesClientException e) {
            if (Util.isAlreadyExists(e) && desired.getMetadata().getName() != null) {
                C raced = childOperator.get(desired.getMetadata().getNamespace(), name);
                if (raced != null && !OwnerReferences.isControlledBy(raced, owner)) {
                    throw new ChildNotOwnedException(definition.childKind(), name);
                }

                LOGGER.debugCr(reconciliation, "{} {} was created concurrently", definition.childKind(), name);
                return raced;
            }

            LOGGER.warnCr(reconciliation, "Failed to create {} {}: {}", definition.childKind(), name, e.getMessage());
            eventRecorder.event(owner, EventRecorder.TYPE_WARNING, "CreationFailed", "Failed to create %s \"%s\": %s", definition.childKind(), name, e.getMessage());
            throw new ReconciliationException("Failed to create " + definition.childKind() + " " + name, e);
        }
    }

    private C update(Reconciliation reconciliation, O owner, C merged) throws ReconciliationException {
        String name = merged.getMetadata().getName();

        try {
            C updated = childOperator.update(merged);
            LOGGER.infoCr(reconciliation, "Updated {} {}", definition.childKind(), name);
            eventRecorder.event(owner, EventRecorder.TYPE_NORMAL, "Updated", "Updated %s \"%s\"", definition.childKind(), name);
            return updated;
        } catch (KubernetesClientException e) {
            if (Util.isConflict(e)) {
                LOGGER.debugCr(reconciliation, "{} {} changed while it was being updated", definition.childKind(), name);
            } else {
                LOGGER.warnCr(reconciliation, "Failed to update {} {}: {}", definition.childKind(), name, e.getMessage());
                eventRecorder.event(owner, EventRecorder.TYPE_WARNING, "UpdateFailed", "Failed to update %s \"%s\": %s", definition.childKind(), name, e.getMessage());
            }

            throw new ReconciliationException("Failed to update " + definition.childKind() + " " + name, e);
        }
    }

    private void deleteAll(Reconciliation reconciliation, O owner, List<C> children) throws ReconciliationException {
        for (C child : children) {
            String name = child.getMetadata().getName();

            try {
                childOperator.delete(child.getMetadata().getNamespace(), name, child.getMetadata().getResourceVersion());
                LOGGER.infoCr(reconciliation, "Deleted {} {}", definition.childKind(), name);
                eventRecorder.event(owner, EventRecorder.TYPE_NORMAL, "Deleted", "Deleted %s \"%s\"", definition.childKind(), name);
            } catch (KubernetesClientException e) {
                if (Util.isNotFound(e)) {
                    LOGGER.debugCr(reconciliation, "{} {} was already deleted", definition.childKind(), name);
                    continue;
                }

                LOGGER.warnCr(reconciliation, "Failed to delete {} {}: {}", definition.childKind(), name, e.getMessage());
                eventRecorder.event(owner, EventRecorder.TYPE_WARNING, "DeleteFailed", "Failed to delete %s \"%s\": %s", definition.childKind(), name, e.getMessage());
                throw new ReconciliationException("Failed to delete " + definition.childKind() + " " + name, e);
            }
        }
    }
}
