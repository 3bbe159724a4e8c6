/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.streaming;

import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentCondition;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.streaming.Processor;
import io.projectriff.api.model.streaming.ProcessorSpec;
import io.projectriff.api.model.streaming.ProcessorStatus;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.controller.ReferenceTracker;
import io.projectriff.operator.common.events.EventRecorder;
import io.projectriff.operator.common.model.ConditionManager;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.operator.resource.ResourceOperator;
import io.projectriff.operator.common.reconciler.AbstractOwnerReconciler;
import io.projectriff.operator.common.reconciler.ChildSynchronizer;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles streaming processors into a deployment of the function with the processor sidecar
 */
public class ProcessorReconciler extends AbstractOwnerReconciler<Processor, ProcessorStatus> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ProcessorReconciler.class);

    /**
     * Conditions of processors
     */
    public static final ConditionSet CONDITIONS = ConditionSet.living(Processor.CONDITION_DEPLOYMENT_READY);

    /**
     * Reason of the DeploymentReady condition of processors with an invalid spec
     */
    public static final String REASON_INVALID_SPEC = "InvalidSpec";

    /* test */ static final String DEPLOYMENT_AVAILABLE = "Available";

    private final ResourceOperator<FunctionBuild> functionBuildOperator;
    private final ReferenceTracker referenceTracker;
    private final ProcessorValidator validator = new ProcessorValidator();
    private final ChildSynchronizer<Processor, Deployment> deploymentSynchronizer;

    /**
     * Constructor
     *
     * @param processorOperator     Operator for the processors
     * @param functionBuildOperator Operator for the referenced function builds
     * @param deploymentOperator    Operator for the deployments
     * @param referenceTracker      Tracker of the function builds read by the processors
     * @param eventRecorder         Recorder for the events
     * @param processorImage        Image of the processor sidecar
     */
    public ProcessorReconciler(ResourceOperator<Processor> processorOperator,
                               ResourceOperator<FunctionBuild> functionBuildOperator,
                               ResourceOperator<Deployment> deploymentOperator,
                               ReferenceTracker referenceTracker,
                               EventRecorder eventRecorder,
                               String processorImage) {
        super(Processor.RESOURCE_KIND, processorOperator, eventRecorder, CONDITIONS);
        this.functionBuildOperator = functionBuildOperator;
        this.referenceTracker = referenceTracker;
        this.deploymentSynchronizer = new ChildSynchronizer<>(deploymentOperator, new ProcessorDeploymentDefinition(processorImage), eventRecorder);
    }

    @Override
    protected ProcessorStatus newStatus() {
        return new ProcessorStatus();
    }

    @Override
    protected void applyDefaults(Processor processor) {
        if (processor.getSpec() == null || processor.getSpec().equals(new ProcessorSpec())) {
            return;
        }

        if (processor.getSpec().getTemplate() == null) {
            processor.getSpec().setTemplate(new PodSpec());
        }

        PodSpec template = processor.getSpec().getTemplate();
        if (template.getContainers() == null) {
            template.setContainers(new ArrayList<>());
        }
        if (template.getContainers().isEmpty()) {
            template.getContainers().add(new io.fabric8.kubernetes.api.model.Container());
        }
        if (template.getContainers().get(0).getName() == null || template.getContainers().get(0).getName().isEmpty()) {
            template.getContainers().get(0).setName(ProcessorValidator.FUNCTION_CONTAINER_NAME);
        }
    }

    @Override
    protected void onOwnerDeleted(Reconciliation reconciliation) {
        referenceTracker.untrack(reconciliation);
    }

    @Override
    protected boolean reconcileChildren(Reconciliation reconciliation, Processor processor, ConditionManager conditions) throws ReconciliationException {
        ProcessorStatus status = processor.getStatus();

        List<String> errors = validator.validate(processor.getSpec());
        if (!errors.isEmpty()) {
            LOGGER.warnCr(reconciliation, "Processor {} is invalid: {}", reconciliation.key(), errors);
            conditions.markFalse(Processor.CONDITION_DEPLOYMENT_READY, REASON_INVALID_SPEC, String.join("; ", errors));
            return false;
        }

        String image = latestImage(reconciliation, processor);
        if (image == null) {
            return false;
        }
        status.setLatestImage(image);

        Deployment deployment = synchronize(deploymentSynchronizer, reconciliation, processor, conditions, Processor.CONDITION_DEPLOYMENT_READY);
        if (deployment == null) {
            return false;
        }

        status.setDeploymentName(deployment.getMetadata().getName());
        conditions.propagate(Processor.CONDITION_DEPLOYMENT_READY, availableCondition(deployment));

        return true;
    }

    private String latestImage(Reconciliation reconciliation, Processor processor) throws ReconciliationException {
        String functionRef = processor.getSpec().getFunctionRef();

        referenceTracker.untrack(reconciliation);

        if (functionRef == null || functionRef.isEmpty()) {
            return processor.getSpec().getTemplate().getContainers().get(0).getImage();
        }

        String namespace = processor.getMetadata().getNamespace();
        referenceTracker.track(reconciliation, FunctionBuild.RESOURCE_KIND, namespace, functionRef);

        FunctionBuild functionBuild;
        try {
            functionBuild = functionBuildOperator.get(namespace, functionRef);
        } catch (KubernetesClientException e) {
            throw new ReconciliationException("Failed to get FunctionBuild " + namespace + "/" + functionRef, e);
        }

        if (functionBuild == null) {
            LOGGER.debugCr(reconciliation, "FunctionBuild {} does not exist yet", functionRef);
            return null;
        }

        String latestImage = functionBuild.getStatus() != null ? functionBuild.getStatus().getLatestImage() : null;
        if (latestImage == null || latestImage.isEmpty()) {
            throw new ReconciliationException("FunctionBuild " + functionRef + " does not have a ready image");
        }

        return latestImage;
    }

    /**
     * @return  The Available condition of the deployment in the shape of the riff conditions, or null
     */
    /* test */ static Condition availableCondition(Deployment deployment) {
        if (deployment.getStatus() == null || deployment.getStatus().getConditions() == null) {
            return null;
        }

        for (DeploymentCondition condition : deployment.getStatus().getConditions()) {
            if (DEPLOYMENT_AVAILABLE.equals(condition.getType())) {
                return new Condition(DEPLOYMENT_AVAILABLE, condition.getStatus(), condition.getReason(), condition.getMessage());
            }
        }

        return null;
    }
}
