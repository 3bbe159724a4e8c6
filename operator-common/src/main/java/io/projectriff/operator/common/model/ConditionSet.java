/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import io.projectriff.api.model.common.Status;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The condition types tracked for one kind of owner. The {@code Ready} condition is derived from the dependent
 * types, which are evaluated in their declared order.
 */
public class ConditionSet {
    /**
     * Type of the aggregated readiness condition
     */
    public static final String READY = "Ready";

    private final List<String> dependents;

    private ConditionSet(List<String> dependents) {
        this.dependents = Collections.unmodifiableList(new ArrayList<>(dependents));
    }

    /**
     * Declares the condition set of an owner kind
     *
     * @param dependents    Condition types which the Ready condition depends on, in evaluation order
     *
     * @return  The condition set
     */
    public static ConditionSet living(String... dependents) {
        List<String> types = List.of(dependents);
        if (types.contains(READY)) {
            throw new IllegalArgumentException("The " + READY + " condition cannot be a dependent condition");
        }
        return new ConditionSet(types);
    }

    /**
     * @return  Dependent condition types in evaluation order
     */
    public List<String> dependents() {
        return dependents;
    }

    /**
     * @param type  Condition type
     * @return  True when the type is the Ready condition or one of the dependents
     */
    public boolean isTracked(String type) {
        return READY.equals(type) || dependents.contains(type);
    }

    /**
     * Binds the condition set to a status
     *
     * @param status    Status which is modified by the returned manager
     *
     * @return  Manager of the conditions of the status
     */
    public ConditionManager manage(Status status) {
        return new ConditionManager(this, status);
    }
}
