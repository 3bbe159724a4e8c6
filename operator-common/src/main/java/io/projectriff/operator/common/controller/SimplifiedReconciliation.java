/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.Reconciliation;

/**
 * The owner key which travels through the work queue. Two instances are equal when they point to the same resource,
 * regardless of their trigger, so the same resource is never queued twice.
 */
public class SimplifiedReconciliation {
    /**
     * Trigger of reconciliations caused by watch events
     */
    public static final String TRIGGER_WATCH = "watch";
    /**
     * Trigger of the periodic reconciliations
     */
    public static final String TRIGGER_TIMER = "timer";
    /**
     * Trigger of reconciliations redelivered after a failure
     */
    public static final String TRIGGER_RETRY = "retry";

    final String kind;
    final String namespace;
    final String name;
    final String trigger;

    /**
     * SimplifiedReconciliation constructor with default (watch) trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     */
    public SimplifiedReconciliation(String kind, String namespace, String name) {
        this(kind, namespace, name, TRIGGER_WATCH);
    }

    /**
     * SimplifiedReconciliation constructor with custom trigger
     *
     * @param kind      Kind of the resource
     * @param namespace Namespace of the resource
     * @param name      Name of the resource
     * @param trigger   Type of the trigger
     */
    public SimplifiedReconciliation(String kind, String namespace, String name, String trigger) {
        this.kind = kind;
        this.namespace = namespace;
        this.name = name;
        this.trigger = trigger;
    }

    /**
     * @return  New reconciliation of the same resource with a new trigger
     *
     * @param trigger   Type of the trigger
     */
    public SimplifiedReconciliation withTrigger(String trigger) {
        return new SimplifiedReconciliation(kind, namespace, name, trigger);
    }

    /**
     * Converts the simplified reconciliation to a proper reconciliation
     *
     * @return Reconciliation object
     */
    public Reconciliation toReconciliation() {
        return new Reconciliation(trigger, kind, namespace, name);
    }

    /**
     * Generates a lock name for this reconciliation and its resource. The lock name consists of the kind, namespace
     * and name. It is also used as the key of the retry backoff.
     *
     * @return Name of the lock which should be used for this resource
     */
    public String lockName() {
        return kind + "::" + namespace + "::" + name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o == null || getClass() != o.getClass()) {
            return false;
        } else {
            SimplifiedReconciliation reconciliation = (SimplifiedReconciliation) o;

            return this.kind.equals(reconciliation.kind)
                    && this.name.equals(reconciliation.name)
                    && this.namespace.equals(reconciliation.namespace);
        }
    }

    @Override
    public int hashCode() {
        int result = 17;
        result = 31 * result + (kind != null ? kind.hashCode() : 0);
        result = 31 * result + (name != null ? name.hashCode() : 0);
        result = 31 * result + (namespace != null ? namespace.hashCode() : 0);
        return result;
    }

    @Override
    public String toString() {
        return kind + "(" + namespace + "/" + name + ")";
    }
}
