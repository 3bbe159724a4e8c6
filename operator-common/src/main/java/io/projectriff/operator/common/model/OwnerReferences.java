/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;

/**
 * Builds and inspects controller owner references
 */
public class OwnerReferences {
    private OwnerReferences() { }

    /**
     * Creates the controller owner reference pointing to the owner. Children carrying it are garbage collected
     * together with the owner.
     *
     * @param owner Owner resource
     *
     * @return  Controller owner reference
     */
    public static OwnerReference controllerReference(HasMetadata owner) {
        return new OwnerReferenceBuilder()
                .withApiVersion(owner.getApiVersion())
                .withKind(owner.getKind())
                .withName(owner.getMetadata().getName())
                .withUid(owner.getMetadata().getUid())
                .withBlockOwnerDeletion(true)
                .withController(true)
                .build();
    }

    /**
     * @param resource  Resource whose owner reference is returned
     *
     * @return  The owner reference flagged as controller or null when there is none
     */
    public static OwnerReference getControllerOf(HasMetadata resource) {
        if (resource.getMetadata().getOwnerReferences() != null) {
            for (OwnerReference ref : resource.getMetadata().getOwnerReferences()) {
                if (Boolean.TRUE.equals(ref.getController())) {
                    return ref;
                }
            }
        }

        return null;
    }

    /**
     * Checks whether the resource is controlled by the owner. The controller reference has to match the owner's kind
     * and UID.
     *
     * @param resource  Child resource
     * @param owner     Owner resource
     *
     * @return  True when the owner is the controller of the resource
     */
    public static boolean isControlledBy(HasMetadata resource, HasMetadata owner) {
        OwnerReference ref = getControllerOf(resource);
        return ref != null
                && ref.getUid() != null
                && ref.getUid().equals(owner.getMetadata().getUid())
                && owner.getKind().equals(ref.getKind());
    }
}
