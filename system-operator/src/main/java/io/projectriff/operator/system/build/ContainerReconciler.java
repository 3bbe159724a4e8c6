/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.build;

import io.projectriff.api.model.build.Container;
import io.projectriff.api.model.build.ContainerStatus;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.digest.RegistryAuthContext;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.model.ConditionManager;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.operator.resource.ResourceOperator;
import io.projectriff.operator.common.reconciler.AbstractOwnerReconciler;
import io.projectriff.operator.common.reconciler.ImageResolutionStep;

/**
 * Reconciles containers by resolving their image to a digest on every reconciliation. Containers have no children.
 */
public class ContainerReconciler extends AbstractOwnerReconciler<Container, ContainerStatus> {
    /**
     * Conditions of containers
     */
    public static final ConditionSet CONDITIONS = ConditionSet.living(Container.CONDITION_IMAGE_RESOLVED);

    private final ImageResolutionStep imageResolution;

    /**
     * Constructor
     *
     * @param containerOperator Operator for the containers
     * @param imageResolution   Image resolution
     * @param eventRecorder     Recorder for the events
     */
    public ContainerReconciler(ResourceOperator<Container> containerOperator, ImageResolutionStep imageResolution, EventRecorder eventRecorder) {
        super(Container.RESOURCE_KIND, containerOperator, eventRecorder, CONDITIONS);
        this.imageResolution = imageResolution;
    }

    @Override
    protected ContainerStatus newStatus() {
        return new ContainerStatus();
    }

    @Override
    protected void applyDefaults(Container container) {
        if (container.getSpec() != null && (container.getSpec().getServiceAccountName() == null || container.getSpec().getServiceAccountName().isEmpty())) {
            container.getSpec().setServiceAccountName(Container.DEFAULT_SERVICE_ACCOUNT_NAME);
        }
    }

    @Override
    protected boolean reconcileChildren(Reconciliation reconciliation, Container container, ConditionManager conditions) throws ReconciliationException {
        if (container.getSpec() == null || container.getSpec().getImage() == null || container.getSpec().getImage().isEmpty()) {
            conditions.markFalse(Container.CONDITION_IMAGE_RESOLVED, ImageResolutionStep.REASON_IMAGE_MISSING, "No image is specified");
            return true;
        }

        RegistryAuthContext authContext = new RegistryAuthContext(container.getMetadata().getNamespace(), container.getSpec().getServiceAccountName());
        String image = imageResolution.resolve(reconciliation, container.getSpec().getImage(), authContext, conditions, Container.CONDITION_IMAGE_RESOLVED);

        container.getStatus().setLatestImage(image);
        conditions.markTrue(Container.CONDITION_IMAGE_RESOLVED);
        return true;
    }
}
