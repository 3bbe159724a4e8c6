/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.knative;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.fabric8.kubernetes.api.model.TypedLocalObjectReference;
import io.fabric8.kubernetes.api.model.TypedLocalObjectReferenceBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.api.model.Constants;
import io.projectriff.api.model.build.Container;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.common.Addressable;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.DeployerBuild;
import io.projectriff.api.model.knative.DeployerStatus;
import io.projectriff.api.model.knative.IngressPolicy;
import io.projectriff.api.model.thirdparty.knative.serving.Configuration;
import io.projectriff.api.model.thirdparty.knative.serving.Route;
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
import java.util.HashMap;

/**
 * Reconciles deployers into a Knative configuration running the latest image of the deployer and a Knative route
 * exposing it. The image comes from a referenced function build or container, or from the pod template.
 */
public class DeployerReconciler extends AbstractOwnerReconciler<Deployer, DeployerStatus> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(DeployerReconciler.class);

    /**
     * Conditions of deployers
     */
    public static final ConditionSet CONDITIONS = ConditionSet.living(Deployer.CONDITION_CONFIGURATION_READY, Deployer.CONDITION_ROUTE_READY);

    private final ResourceOperator<FunctionBuild> functionBuildOperator;
    private final ResourceOperator<Container> containerOperator;
    private final ReferenceTracker referenceTracker;
    private final ChildSynchronizer<Deployer, Configuration> configurationSynchronizer;
    private final ChildSynchronizer<Deployer, Route> routeSynchronizer;

    /**
     * Constructor
     *
     * @param deployerOperator      Operator for the deployers
     * @param functionBuildOperator Operator for the referenced function builds
     * @param containerOperator     Operator for the referenced containers
     * @param configurationOperator Operator for the Knative configurations
     * @param routeOperator         Operator for the Knative routes
     * @param referenceTracker      Tracker of the function builds and containers read by the deployers
     * @param eventRecorder         Recorder for the events
     */
    public DeployerReconciler(ResourceOperator<Deployer> deployerOperator,
                              ResourceOperator<FunctionBuild> functionBuildOperator,
                              ResourceOperator<Container> containerOperator,
                              ResourceOperator<Configuration> configurationOperator,
                              ResourceOperator<Route> routeOperator,
                              ReferenceTracker referenceTracker,
                              EventRecorder eventRecorder) {
        super(Deployer.RESOURCE_KIND, deployerOperator, eventRecorder, CONDITIONS);
        this.functionBuildOperator = functionBuildOperator;
        this.containerOperator = containerOperator;
        this.referenceTracker = referenceTracker;
        this.configurationSynchronizer = new ChildSynchronizer<>(configurationOperator, new ConfigurationDefinition(), eventRecorder);
        this.routeSynchronizer = new ChildSynchronizer<>(routeOperator, new RouteDefinition(), eventRecorder);
    }

    @Override
    protected DeployerStatus newStatus() {
        return new DeployerStatus();
    }

    @Override
    protected void applyDefaults(Deployer deployer) {
        if (deployer.getSpec() == null) {
            return;
        }

        PodTemplateSpec template = deployer.getSpec().getTemplate();
        if (template == null) {
            template = new PodTemplateSpec();
            deployer.getSpec().setTemplate(template);
        }

        if (template.getMetadata() == null) {
            template.setMetadata(new ObjectMeta());
        }
        if (template.getMetadata().getLabels() == null) {
            template.getMetadata().setLabels(new HashMap<>());
        }
        if (template.getMetadata().getAnnotations() == null) {
            template.getMetadata().setAnnotations(new HashMap<>());
        }

        if (template.getSpec() == null) {
            template.setSpec(new PodSpec());
        }
        if (template.getSpec().getContainers() == null) {
            template.getSpec().setContainers(new ArrayList<>());
        }
        if (template.getSpec().getContainers().isEmpty()) {
            template.getSpec().getContainers().add(new io.fabric8.kubernetes.api.model.Container());
        }

        if (deployer.getSpec().getIngressPolicy() == null) {
            deployer.getSpec().setIngressPolicy(IngressPolicy.ClusterLocal);
        }
    }

    @Override
    protected void onOwnerDeleted(Reconciliation reconciliation) {
        referenceTracker.untrack(reconciliation);
    }

    @Override
    protected boolean reconcileChildren(Reconciliation reconciliation, Deployer deployer, ConditionManager conditions) throws ReconciliationException {
        if (deployer.getSpec() == null) {
            throw new ReconciliationException("Deployer " + reconciliation.key() + " has no spec");
        }

        DeployerStatus status = deployer.getStatus();

        String image = latestImage(reconciliation, deployer);
        if (image == null) {
            return false;
        }
        status.setLatestImage(image);

        Configuration configuration = synchronize(configurationSynchronizer, reconciliation, deployer, conditions, Deployer.CONDITION_CONFIGURATION_READY);
        if (configuration == null) {
            status.setConfigurationRef(null);
            return false;
        }

        status.setConfigurationRef(reference(Configuration.RESOURCE_KIND, configuration.getMetadata().getName()));
        if (configuration.getStatus() != null) {
            conditions.propagate(Deployer.CONDITION_CONFIGURATION_READY, configuration.getStatus().getCondition(Configuration.CONDITION_READY));
        }

        Route route = synchronize(routeSynchronizer, reconciliation, deployer, conditions, Deployer.CONDITION_ROUTE_READY);
        if (route == null) {
            status.setRouteRef(null);
            return false;
        }

        status.setRouteRef(reference(Route.RESOURCE_KIND, route.getMetadata().getName()));
        if (route.getStatus() != null) {
            status.setUrl(route.getStatus().getUrl());
            status.setAddress(route.getStatus().getAddress() != null ? copyOf(route.getStatus().getAddress()) : null);
            conditions.propagate(Deployer.CONDITION_ROUTE_READY, route.getStatus().getCondition(Route.CONDITION_READY));
        }

        return true;
    }

    /**
     * Finds the image to deploy. A referenced function build or container which does not exist yet stops the
     * reconciliation without an error: the deployer is reconciled again once it is created.
     *
     * @return  The image or null when it is not available yet
     */
    private String latestImage(Reconciliation reconciliation, Deployer deployer) throws ReconciliationException {
        String namespace = deployer.getMetadata().getNamespace();
        DeployerBuild build = deployer.getSpec().getBuild();

        referenceTracker.untrack(reconciliation);

        if (build != null && build.getFunctionBuildRef() != null) {
            referenceTracker.track(reconciliation, FunctionBuild.RESOURCE_KIND, namespace, build.getFunctionBuildRef());
            FunctionBuild functionBuild = getReferenced(functionBuildOperator, FunctionBuild.RESOURCE_KIND, namespace, build.getFunctionBuildRef());

            if (functionBuild == null) {
                LOGGER.debugCr(reconciliation, "FunctionBuild {} does not exist yet", build.getFunctionBuildRef());
                return null;
            }

            return requireLatestImage(FunctionBuild.RESOURCE_KIND, build.getFunctionBuildRef(),
                    functionBuild.getStatus() != null ? functionBuild.getStatus().getLatestImage() : null);
        } else if (build != null && build.getContainerRef() != null) {
            referenceTracker.track(reconciliation, Container.RESOURCE_KIND, namespace, build.getContainerRef());
            Container container = getReferenced(containerOperator, Container.RESOURCE_KIND, namespace, build.getContainerRef());

            if (container == null) {
                LOGGER.debugCr(reconciliation, "Container {} does not exist yet", build.getContainerRef());
                return null;
            }

            return requireLatestImage(Container.RESOURCE_KIND, build.getContainerRef(),
                    container.getStatus() != null ? container.getStatus().getLatestImage() : null);
        }

        String image = deployer.getSpec().getTemplate().getSpec().getContainers().get(0).getImage();
        if (image == null || image.isEmpty()) {
            LOGGER.debugCr(reconciliation, "Deployer {} has no image to deploy", reconciliation.key());
            return null;
        }

        return image;
    }

    private static <T extends HasMetadata> T getReferenced(ResourceOperator<T> operator, String kind,
                                                            String namespace, String name) throws ReconciliationException {
        try {
            return operator.get(namespace, name);
        } catch (KubernetesClientException e) {
            throw new ReconciliationException("Failed to get " + kind + " " + namespace + "/" + name, e);
        }
    }

    private static String requireLatestImage(String kind, String name, String latestImage) throws ReconciliationException {
        if (latestImage == null || latestImage.isEmpty()) {
            throw new ReconciliationException(kind + " " + name + " does not have a ready image");
        }

        return latestImage;
    }

    private static TypedLocalObjectReference reference(String kind, String name) {
        return new TypedLocalObjectReferenceBuilder()
                .withApiGroup(Constants.KNATIVE_SERVING_GROUP)
                .withKind(kind)
                .withName(name)
                .build();
    }

    private static Addressable copyOf(Addressable address) {
        Addressable copy = new Addressable();
        copy.setUrl(address.getUrl());
        return copy;
    }
}
