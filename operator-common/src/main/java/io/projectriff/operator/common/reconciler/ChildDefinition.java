/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.model.Labels;

/**
 * Describes one kind of child of an owner: how the desired child is derived from the owner and which of its fields
 * the owner manages. Fields outside of the managed set belong to other writers and are never overwritten.
 *
 * @param <O>   Type of the owner
 * @param <C>   Type of the child
 */
public interface ChildDefinition<O extends HasMetadata, C extends HasMetadata> {
    /**
     * @return  Kind of the child, used in events and conditions
     */
    String childKind();

    /**
     * @param owner Owner
     *
     * @return  Labels which all children of the owner carry. Used to list the existing children.
     */
    Labels selector(O owner);

    /**
     * Computes the desired child. The child may have a fixed {@code metadata.name} or a {@code metadata.generateName}.
     * The namespace, controller owner reference and selector labels are added by the caller.
     *
     * @param owner Owner with defaults applied
     *
     * @return  The desired child or null when the child should not exist
     *
     * @throws ReconciliationException when the desired state cannot be computed
     */
    C desired(O owner) throws ReconciliationException;

    /**
     * @param desired   Desired child
     * @param actual    Existing child
     *
     * @return  True when the managed fields of both children are equal
     */
    boolean semanticEquals(C desired, C actual);

    /**
     * Copies the managed fields of the desired child onto a copy of the existing child
     *
     * @param desired       Desired child
     * @param actualCopy    Copy of the existing child which may be modified
     *
     * @return  The child to write
     */
    C mergeOwnedFields(C desired, C actualCopy);
}
