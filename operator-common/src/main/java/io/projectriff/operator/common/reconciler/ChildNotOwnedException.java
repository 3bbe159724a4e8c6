/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.projectriff.operator.common.ReconciliationException;

/**
 * A child with the desired name exists but is not controlled by the owner. The child is left untouched and the
 * conflict has to be resolved by a human.
 */
public class ChildNotOwnedException extends ReconciliationException {
    private final String childKind;
    private final String childName;

    /**
     * @param childKind Kind of the conflicting child
     * @param childName Name of the conflicting child
     */
    public ChildNotOwnedException(String childKind, String childName) {
        super(childKind + " " + childName + " already exists and is not owned by this resource");
        this.childKind = childKind;
        this.childName = childName;
    }

    /**
     * @return  Kind of the conflicting child
     */
    public String getChildKind() {
        return childKind;
    }

    /**
     * @return  Name of the conflicting child
     */
    public String getChildName() {
        return childName;
    }
}
