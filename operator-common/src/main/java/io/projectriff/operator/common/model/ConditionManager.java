/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.common.Status;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Maintains the conditions of one status according to a {@link ConditionSet}. Every change of a dependent condition
 * recomputes the Ready condition:
 * <ul>
 *     <li>Ready is True when all dependents are True</li>
 *     <li>Ready is False when a dependent is False, with the reason and message of the first False dependent in
 *     declared order</li>
 *     <li>Ready is Unknown otherwise</li>
 * </ul>
 * The last transition time of a condition only moves when its status changes.
 */
public class ConditionManager {
    /**
     * Reason used when an existing child is not controlled by the owner
     */
    public static final String REASON_NOT_OWNED = "NotOwned";

    private final ConditionSet conditionSet;
    private final Status status;

    /* test */ ConditionManager(ConditionSet conditionSet, Status status) {
        this.conditionSet = conditionSet;
        this.status = status;
    }

    /**
     * Adds the tracked conditions which are missing with the Unknown status. Existing conditions are kept as they
     * are.
     */
    public void initializeConditions() {
        List<String> types = new ArrayList<>(conditionSet.dependents());
        types.add(ConditionSet.READY);

        for (String type : types) {
            if (status.getCondition(type) == null) {
                Condition condition = new Condition(type, Condition.UNKNOWN, null, null);
                condition.setLastTransitionTime(StatusUtils.iso8601Now());
                status.setCondition(condition);
            }
        }

        sort();
    }

    /**
     * @param type  Condition type
     *
     * @return  The condition or null
     */
    public Condition getCondition(String type) {
        return status.getCondition(type);
    }

    /**
     * @return  True when the Ready condition is True
     */
    public boolean isReady() {
        Condition ready = status.getCondition(ConditionSet.READY);
        return ready != null && ready.isTrue();
    }

    /**
     * Marks the condition True
     *
     * @param type  Condition type
     */
    public void markTrue(String type) {
        set(new Condition(type, Condition.TRUE, null, null));
    }

    /**
     * Marks the condition True with a reason, for example when the checked feature is not used
     *
     * @param type      Condition type
     * @param reason    Reason
     */
    public void markTrueWithReason(String type, String reason) {
        set(new Condition(type, Condition.TRUE, reason, null));
    }

    /**
     * Marks the condition False
     *
     * @param type          Condition type
     * @param reason        Reason
     * @param messageFormat Message format for {@link String#format(String, Object...)}
     * @param args          Message arguments
     */
    public void markFalse(String type, String reason, String messageFormat, Object... args) {
        set(new Condition(type, Condition.FALSE, reason, format(messageFormat, args)));
    }

    /**
     * Marks the condition Unknown
     *
     * @param type          Condition type
     * @param reason        Reason
     * @param messageFormat Message format for {@link String#format(String, Object...)}
     * @param args          Message arguments
     */
    public void markUnknown(String type, String reason, String messageFormat, Object... args) {
        set(new Condition(type, Condition.UNKNOWN, reason, format(messageFormat, args)));
    }

    /**
     * Marks the condition False because a child with the desired name exists but is not controlled by the owner.
     * The Ready condition follows through the aggregation.
     *
     * @param type      Condition type which tracks the child
     * @param childKind Kind of the conflicting child
     * @param childName Name of the conflicting child
     * @param ownerKind Kind of the owner
     */
    public void markNotOwned(String type, String childKind, String childName, String ownerKind) {
        markFalse(type, REASON_NOT_OWNED, "There is an existing %s \"%s\" that the %s does not own.", childKind, childName, ownerKind);
    }

    /**
     * Copies the status, reason and message of the ready condition of a child onto the given owner condition. A
     * child which does not report the condition yet leaves the owner condition unchanged.
     *
     * @param type              Owner condition type
     * @param childCondition    Ready condition of the child (may be null)
     */
    public void propagate(String type, Condition childCondition) {
        if (childCondition == null || childCondition.getStatus() == null) {
            return;
        }

        switch (childCondition.getStatus()) {
            case Condition.TRUE -> set(new Condition(type, Condition.TRUE, childCondition.getReason(), childCondition.getMessage()));
            case Condition.FALSE -> set(new Condition(type, Condition.FALSE, childCondition.getReason(), childCondition.getMessage()));
            default -> set(new Condition(type, Condition.UNKNOWN, childCondition.getReason(), childCondition.getMessage()));
        }
    }

    private void set(Condition condition) {
        if (ConditionSet.READY.equals(condition.getType())) {
            throw new IllegalArgumentException("The " + ConditionSet.READY + " condition is derived from the dependent conditions");
        }

        setCondition(condition);

        if (conditionSet.dependents().contains(condition.getType())) {
            recomputeReady();
        }

        sort();
    }

    private void setCondition(Condition condition) {
        Condition existing = status.getCondition(condition.getType());

        if (existing != null
                && Objects.equals(existing.getStatus(), condition.getStatus())
                && Objects.equals(existing.getReason(), condition.getReason())
                && Objects.equals(existing.getMessage(), condition.getMessage())) {
            return;
        }

        if (existing != null && Objects.equals(existing.getStatus(), condition.getStatus())) {
            condition.setLastTransitionTime(existing.getLastTransitionTime());
        } else {
            condition.setLastTransitionTime(StatusUtils.iso8601Now());
        }

        status.setCondition(condition);
    }

    private void recomputeReady() {
        Condition firstUnknown = null;

        for (String type : conditionSet.dependents()) {
            Condition condition = status.getCondition(type);

            if (condition == null || Condition.UNKNOWN.equals(condition.getStatus()) || condition.getStatus() == null) {
                if (firstUnknown == null) {
                    firstUnknown = condition != null ? condition : new Condition(type, Condition.UNKNOWN, null, null);
                }
            } else if (condition.isFalse()) {
                setCondition(new Condition(ConditionSet.READY, Condition.FALSE, condition.getReason(), condition.getMessage()));
                return;
            }
        }

        if (firstUnknown != null) {
            setCondition(new Condition(ConditionSet.READY, Condition.UNKNOWN, firstUnknown.getReason(), firstUnknown.getMessage()));
        } else {
            setCondition(new Condition(ConditionSet.READY, Condition.TRUE, null, null));
        }
    }

    private void sort() {
        if (status.getConditions() != null) {
            status.getConditions().sort(Comparator.comparing(Condition::getType));
        }
    }

    private static String format(String messageFormat, Object... args) {
        if (messageFormat == null) {
            return null;
        }

        return args == null || args.length == 0 ? messageFormat : String.format(messageFormat, args);
    }
}
