/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.Reconciliation;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Remembers which owners read which other resources during their reconciliation (for example a Deployer reading the
 * latest image of a FunctionBuild) so that a change of the referenced resource re-enqueues the owners.
 */
public class ReferenceTracker {
    /*test*/ final Map<String, Set<SimplifiedReconciliation>> trackers = new ConcurrentHashMap<>();

    /**
     * Records that the owner of the reconciliation depends on the referenced resource
     *
     * @param reconciliation    Reconciliation of the owner
     * @param kind              Kind of the referenced resource
     * @param namespace         Namespace of the referenced resource
     * @param name              Name of the referenced resource
     */
    public void track(Reconciliation reconciliation, String kind, String namespace, String name) {
        trackers.computeIfAbsent(key(kind, namespace, name), k -> ConcurrentHashMap.newKeySet())
                .add(new SimplifiedReconciliation(reconciliation.kind(), reconciliation.namespace(), reconciliation.name()));
    }

    /**
     * Forgets all references of a deleted owner
     *
     * @param reconciliation    Reconciliation of the owner
     */
    public void untrack(Reconciliation reconciliation) {
        SimplifiedReconciliation owner = new SimplifiedReconciliation(reconciliation.kind(), reconciliation.namespace(), reconciliation.name());
        trackers.values().forEach(owners -> owners.remove(owner));
        trackers.values().removeIf(Set::isEmpty);
    }

    /**
     * @param ownerKind Kind of the owners which should be returned
     * @param kind      Kind of the referenced resource
     * @param namespace Namespace of the referenced resource
     * @param name      Name of the referenced resource
     *
     * @return  Owners of the given kind which reference the resource
     */
    public Set<SimplifiedReconciliation> ownersReferencing(String ownerKind, String kind, String namespace, String name) {
        return trackers.getOrDefault(key(kind, namespace, name), Set.of())
                .stream()
                .filter(owner -> owner.kind.equals(ownerKind))
                .collect(Collectors.toSet());
    }

    private static String key(String kind, String namespace, String name) {
        return kind + "::" + namespace + "::" + name;
    }
}
