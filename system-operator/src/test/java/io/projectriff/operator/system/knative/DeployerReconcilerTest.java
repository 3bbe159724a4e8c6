/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.knative;

import io.fabric8.kubernetes.api.model.IntOrString;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodTemplateSpecBuilder;
import io.fabric8.kubernetes.api.model.ProbeBuilder;
import io.projectriff.api.model.Constants;
import io.projectriff.api.model.build.Container;
import io.projectriff.api.model.build.ContainerStatus;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.build.FunctionBuildStatus;
import io.projectriff.api.model.common.Addressable;
import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.DeployerBuild;
import io.projectriff.api.model.knative.DeployerSpec;
import io.projectriff.api.model.knative.DeployerStatus;
import io.projectriff.api.model.knative.IngressPolicy;
import io.projectriff.api.model.thirdparty.knative.serving.Configuration;
import io.projectriff.api.model.thirdparty.knative.serving.ConfigurationStatus;
import io.projectriff.api.model.thirdparty.knative.serving.Route;
import io.projectriff.api.model.thirdparty.knative.serving.RouteStatus;
import io.projectriff.api.model.thirdparty.knative.serving.TrafficTarget;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.controller.ReferenceTracker;
import io.projectriff.operator.common.controller.SimplifiedReconciliation;
import io.projectriff.operator.common.events.RecordingEventRecorder;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.operator.resource.MockResourceOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DeployerReconcilerTest {
    private static final String NAMESPACE = "my-namespace";
    private static final String NAME = "square";
    private static final String IMAGE = "gcr.io/my-project/square@sha256:" + "12".repeat(32);
    private static final String BUILT_IMAGE = "gcr.io/my-project/square@sha256:" + "34".repeat(32);
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", Deployer.RESOURCE_KIND, NAMESPACE, NAME);
    private static final SimplifiedReconciliation OWNER = new SimplifiedReconciliation(Deployer.RESOURCE_KIND, NAMESPACE, NAME);

    private MockResourceOperator<Deployer> deployers;
    private MockResourceOperator<FunctionBuild> functionBuilds;
    private MockResourceOperator<Container> containers;
    private MockResourceOperator<Configuration> configurations;
    private MockResourceOperator<Route> routes;
    private ReferenceTracker tracker;
    private RecordingEventRecorder events;
    private DeployerReconciler reconciler;

    @BeforeEach
    public void setUp() {
        deployers = new MockResourceOperator<>(Deployer.RESOURCE_KIND);
        functionBuilds = new MockResourceOperator<>(FunctionBuild.RESOURCE_KIND);
        containers = new MockResourceOperator<>(Container.RESOURCE_KIND);
        configurations = new MockResourceOperator<>(Configuration.RESOURCE_KIND);
        routes = new MockResourceOperator<>(Route.RESOURCE_KIND);
        tracker = new ReferenceTracker();
        events = new RecordingEventRecorder();
        reconciler = new DeployerReconciler(deployers, functionBuilds, containers, configurations, routes, tracker, events);
    }

    private void deployer(DeployerSpec spec) {
        Deployer deployer = new Deployer();
        deployer.setMetadata(new ObjectMetaBuilder()
                .withNamespace(NAMESPACE)
                .withName(NAME)
                .withUid("square-uid")
                .withLabels(Map.of("app", "square"))
                .build());
        deployer.setSpec(spec);
        deployers.put(deployer);
    }

    private static DeployerSpec templateSpec(String image) {
        DeployerSpec spec = new DeployerSpec();
        spec.setTemplate(new PodTemplateSpecBuilder()
                .withNewSpec()
                    .addNewContainer()
                        .withImage(image)
                        .addNewEnv().withName("GREETING").withValue("hello").endEnv()
                    .endContainer()
                .endSpec()
                .build());
        return spec;
    }

    private static DeployerSpec buildSpec(String functionBuildRef, String containerRef) {
        DeployerBuild build = new DeployerBuild();
        build.setFunctionBuildRef(functionBuildRef);
        build.setContainerRef(containerRef);

        DeployerSpec spec = new DeployerSpec();
        spec.setBuild(build);
        return spec;
    }

    private void functionBuild(String name, String latestImage) {
        FunctionBuildStatus status = new FunctionBuildStatus();
        status.setLatestImage(latestImage);

        FunctionBuild functionBuild = new FunctionBuild();
        functionBuild.setMetadata(new ObjectMetaBuilder().withNamespace(NAMESPACE).withName(name).build());
        functionBuild.setStatus(status);
        functionBuilds.put(functionBuild);
    }

    private DeployerStatus status() {
        return deployers.get(NAMESPACE, NAME).getStatus();
    }

    private Configuration configuration() {
        List<Configuration> all = configurations.all();
        assertThat(all, hasSize(1));
        return all.get(0);
    }

    private void readyChildren() {
        String configurationName = configuration().getMetadata().getName();
        configurations.modify(NAMESPACE, configurationName, c -> {
            ConfigurationStatus status = new ConfigurationStatus();
            status.setConditions(List.of(new Condition(Configuration.CONDITION_READY, Condition.TRUE, null, null)));
            c.setStatus(status);
        });
        routes.modify(NAMESPACE, NAME, r -> {
            Addressable address = new Addressable();
            address.setUrl("http://square.my-namespace.svc.cluster.local");
            RouteStatus status = new RouteStatus();
            status.setUrl("http://square.my-namespace.example.com");
            status.setAddress(address);
            status.setConditions(List.of(new Condition(Route.CONDITION_READY, Condition.TRUE, null, null)));
            r.setStatus(status);
        });
    }

    @Test
    public void testChildrenAreCreatedFromTemplate() throws ReconciliationException {
        deployer(templateSpec(IMAGE));

        reconciler.reconcile(RECONCILIATION);

        Configuration configuration = configuration();
        assertThat(configuration.getMetadata().getName().startsWith("square-deployer-"), is(true));
        assertThat(configuration.getMetadata().getLabels(), is(Map.of(
                "app", "square",
                Deployer.LABEL_KEY, NAME,
                ConfigurationDefinition.LABEL_VISIBILITY, ConfigurationDefinition.VISIBILITY_CLUSTER_LOCAL)));
        io.fabric8.kubernetes.api.model.Container container = configuration.getSpec().getTemplate().getSpec().getContainers().get(0);
        assertThat(container.getImage(), is(IMAGE));
        assertThat(container.getEnv().get(0).getName(), is("GREETING"));
        assertThat(configuration.getSpec().getTemplate().getMetadata().getLabels().get(Deployer.LABEL_KEY), is(NAME));

        Route route = routes.get(NAMESPACE, NAME);
        TrafficTarget target = route.getSpec().getTraffic().get(0);
        assertThat(target.getConfigurationName(), is(configuration.getMetadata().getName()));
        assertThat(target.getPercent(), is(100L));
        assertThat(target.getLatestRevision(), is(true));
        assertThat(route.getMetadata().getLabels().get(ConfigurationDefinition.LABEL_VISIBILITY), is(ConfigurationDefinition.VISIBILITY_CLUSTER_LOCAL));

        DeployerStatus status = status();
        assertThat(status.getLatestImage(), is(IMAGE));
        assertThat(status.getConfigurationRef().getName(), is(configuration.getMetadata().getName()));
        assertThat(status.getConfigurationRef().getApiGroup(), is(Constants.KNATIVE_SERVING_GROUP));
        assertThat(status.getConfigurationRef().getKind(), is(Configuration.RESOURCE_KIND));
        assertThat(status.getRouteRef().getName(), is(NAME));
        assertThat(status.getCondition(ConditionSet.READY).getStatus(), is(Condition.UNKNOWN));
        assertThat(events.reasons(), contains("Created", "Created"));
    }

    @Test
    public void testReadyChildrenMakeDeployerReady() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        readyChildren();

        reconciler.reconcile(RECONCILIATION);

        DeployerStatus status = status();
        assertThat(status.getUrl(), is("http://square.my-namespace.example.com"));
        assertThat(status.getAddress().getUrl(), is("http://square.my-namespace.svc.cluster.local"));
        assertThat(status.getCondition(Deployer.CONDITION_CONFIGURATION_READY).getStatus(), is(Condition.TRUE));
        assertThat(status.getCondition(Deployer.CONDITION_ROUTE_READY).getStatus(), is(Condition.TRUE));
        assertThat(status.getCondition(ConditionSet.READY).getStatus(), is(Condition.TRUE));
        assertThat(status.getObservedGeneration(), is(1L));
        assertThat(events.reasons(), contains("Created", "Created", "Ready"));
        assertThat(configurations.updated, is(empty()));
        assertThat(routes.updated, is(empty()));
    }

    @Test
    public void testFailingConfigurationIsPropagated() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        configurations.modify(NAMESPACE, configuration().getMetadata().getName(), c -> {
            ConfigurationStatus status = new ConfigurationStatus();
            status.setConditions(List.of(new Condition(Configuration.CONDITION_READY, Condition.FALSE, "RevisionFailed", "Revision failed to start")));
            c.setStatus(status);
        });

        reconciler.reconcile(RECONCILIATION);

        Condition ready = status().getCondition(ConditionSet.READY);
        assertThat(ready.getStatus(), is(Condition.FALSE));
        assertThat(ready.getReason(), is("RevisionFailed"));
        assertThat(ready.getMessage(), is("Revision failed to start"));
    }

    @Test
    public void testChangedImageUpdatesConfiguration() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        deployers.modify(NAMESPACE, NAME, d -> d.getSpec().getTemplate().getSpec().getContainers().get(0).setImage(BUILT_IMAGE));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.created, hasSize(1));
        assertThat(configurations.updated, hasSize(1));
        assertThat(configuration().getSpec().getTemplate().getSpec().getContainers().get(0).getImage(), is(BUILT_IMAGE));
        assertThat(routes.updated, is(empty()));
        assertThat(status().getLatestImage(), is(BUILT_IMAGE));
    }

    private void applyKnativeDefaults() {
        configurations.modify(NAMESPACE, configuration().getMetadata().getName(), c -> {
            Map<String, String> labels = new HashMap<>(c.getMetadata().getLabels());
            labels.put("serving.knative.dev/route", NAME);
            c.getMetadata().setLabels(labels);
            Map<String, String> annotations = new HashMap<>(c.getMetadata().getAnnotations() != null ? c.getMetadata().getAnnotations() : Map.of());
            annotations.put("serving.knative.dev/creator", "system:serviceaccount:riff-system:riff-system-operator");
            c.getMetadata().setAnnotations(annotations);

            PodSpec pod = c.getSpec().getTemplate().getSpec();
            pod.setAdditionalProperty("timeoutSeconds", 300);
            io.fabric8.kubernetes.api.model.Container container = pod.getContainers().get(0);
            container.setName("user-container");
            container.setReadinessProbe(new ProbeBuilder()
                    .withSuccessThreshold(1)
                    .withNewTcpSocket()
                        .withPort(new IntOrString(0))
                    .endTcpSocket()
                    .build());
        });
    }

    @Test
    public void testKnativeDefaultsDoNotUpdateChildren() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        applyKnativeDefaults();

        reconciler.reconcile(RECONCILIATION);
        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.updated, is(empty()));
        assertThat(routes.updated, is(empty()));
        assertThat(events.reasons(), contains("Created", "Created"));
    }

    @Test
    public void testUpdateKeepsKnativeDefaults() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        applyKnativeDefaults();
        deployers.modify(NAMESPACE, NAME, d -> d.getSpec().getTemplate().getSpec().getContainers().get(0).getEnv().get(0).setValue("goodbye"));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.updated, hasSize(1));
        Configuration configuration = configuration();
        assertThat(configuration.getMetadata().getLabels().get("serving.knative.dev/route"), is(NAME));
        assertThat(configuration.getMetadata().getLabels().get(Deployer.LABEL_KEY), is(NAME));
        assertThat(configuration.getMetadata().getAnnotations().containsKey("serving.knative.dev/creator"), is(true));
        PodSpec pod = configuration.getSpec().getTemplate().getSpec();
        assertThat(pod.getAdditionalProperties().get("timeoutSeconds"), is(300));
        io.fabric8.kubernetes.api.model.Container container = pod.getContainers().get(0);
        assertThat(container.getEnv().get(0).getValue(), is("goodbye"));
        assertThat(container.getName(), is("user-container"));
        assertThat(container.getReadinessProbe().getSuccessThreshold(), is(1));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.updated, hasSize(1));
        assertThat(routes.updated, is(empty()));
    }

    @Test
    public void testScaleAnnotations() throws ReconciliationException {
        DeployerSpec spec = templateSpec(IMAGE);
        spec.setMinScale(1);
        spec.setMaxScale(3);
        deployer(spec);
        reconciler.reconcile(RECONCILIATION);

        Map<String, String> annotations = configuration().getMetadata().getAnnotations();
        assertThat(annotations.get(ConfigurationDefinition.ANNOTATION_MIN_SCALE), is("1"));
        assertThat(annotations.get(ConfigurationDefinition.ANNOTATION_MAX_SCALE), is("3"));
        assertThat(configuration().getSpec().getTemplate().getMetadata().getAnnotations().get(ConfigurationDefinition.ANNOTATION_MAX_SCALE), is("3"));

        configurations.modify(NAMESPACE, configuration().getMetadata().getName(), c -> {
            Map<String, String> changed = new HashMap<>(c.getMetadata().getAnnotations());
            changed.put("serving.knative.dev/creator", "someone");
            c.getMetadata().setAnnotations(changed);
        });
        deployers.modify(NAMESPACE, NAME, d -> d.getSpec().setMaxScale(null));

        reconciler.reconcile(RECONCILIATION);

        annotations = configuration().getMetadata().getAnnotations();
        assertThat(annotations.get(ConfigurationDefinition.ANNOTATION_MIN_SCALE), is("1"));
        assertThat(annotations.containsKey(ConfigurationDefinition.ANNOTATION_MAX_SCALE), is(false));
        assertThat(annotations.get("serving.knative.dev/creator"), is("someone"));
    }

    @Test
    public void testExternalIngress() throws ReconciliationException {
        DeployerSpec spec = templateSpec(IMAGE);
        spec.setIngressPolicy(IngressPolicy.External);
        deployer(spec);

        reconciler.reconcile(RECONCILIATION);

        assertThat(configuration().getMetadata().getLabels().containsKey(ConfigurationDefinition.LABEL_VISIBILITY), is(false));
        assertThat(routes.get(NAMESPACE, NAME).getMetadata().getLabels().containsKey(ConfigurationDefinition.LABEL_VISIBILITY), is(false));
    }

    @Test
    public void testMissingImageStopsReconciliation() throws ReconciliationException {
        deployer(templateSpec(null));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.created, is(empty()));
        assertThat(routes.created, is(empty()));
        assertThat(status().getObservedGeneration(), is(nullValue()));
    }

    @Test
    public void testFunctionBuildImage() throws ReconciliationException {
        functionBuild("square-build", BUILT_IMAGE);
        deployer(buildSpec("square-build", null));

        reconciler.reconcile(RECONCILIATION);

        assertThat(status().getLatestImage(), is(BUILT_IMAGE));
        assertThat(configuration().getSpec().getTemplate().getSpec().getContainers().get(0).getImage(), is(BUILT_IMAGE));
        assertThat(tracker.ownersReferencing(Deployer.RESOURCE_KIND, FunctionBuild.RESOURCE_KIND, NAMESPACE, "square-build"), contains(OWNER));
    }

    @Test
    public void testMissingFunctionBuildIsTrackedAndWaitedFor() throws ReconciliationException {
        deployer(buildSpec("square-build", null));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.created, is(empty()));
        assertThat(status().getLatestImage(), is(nullValue()));
        assertThat(tracker.ownersReferencing(Deployer.RESOURCE_KIND, FunctionBuild.RESOURCE_KIND, NAMESPACE, "square-build"), contains(OWNER));
    }

    @Test
    public void testFunctionBuildWithoutImage() {
        functionBuild("square-build", null);
        deployer(buildSpec("square-build", null));

        ReconciliationException e = assertThrows(ReconciliationException.class, () -> reconciler.reconcile(RECONCILIATION));

        assertThat(e.getMessage(), is("FunctionBuild square-build does not have a ready image"));
        assertThat(configurations.created, is(empty()));
    }

    @Test
    public void testContainerImageAndReferenceChange() throws ReconciliationException {
        ContainerStatus containerStatus = new ContainerStatus();
        containerStatus.setLatestImage(BUILT_IMAGE);
        Container container = new Container();
        container.setMetadata(new ObjectMetaBuilder().withNamespace(NAMESPACE).withName("square-container").build());
        container.setStatus(containerStatus);
        containers.put(container);
        functionBuild("square-build", IMAGE);

        deployer(buildSpec("square-build", null));
        reconciler.reconcile(RECONCILIATION);
        deployers.modify(NAMESPACE, NAME, d -> d.getSpec().setBuild(buildSpec(null, "square-container").getBuild()));

        reconciler.reconcile(RECONCILIATION);

        assertThat(status().getLatestImage(), is(BUILT_IMAGE));
        assertThat(tracker.ownersReferencing(Deployer.RESOURCE_KIND, Container.RESOURCE_KIND, NAMESPACE, "square-container"), contains(OWNER));
        assertThat(tracker.ownersReferencing(Deployer.RESOURCE_KIND, FunctionBuild.RESOURCE_KIND, NAMESPACE, "square-build"), is(empty()));
    }

    @Test
    public void testDeletedDeployerIsUntracked() throws ReconciliationException {
        deployer(buildSpec("square-build", null));
        reconciler.reconcile(RECONCILIATION);
        deployers.delete(NAMESPACE, NAME, null);

        reconciler.reconcile(RECONCILIATION);

        assertThat(tracker.ownersReferencing(Deployer.RESOURCE_KIND, FunctionBuild.RESOURCE_KIND, NAMESPACE, "square-build"), is(empty()));
    }

    @Test
    public void testStaleConfigurationsAreDeleted() throws ReconciliationException {
        deployer(templateSpec(IMAGE));
        reconciler.reconcile(RECONCILIATION);
        Configuration stale = configuration();
        stale.getMetadata().setName("square-deployer-stale");
        stale.getMetadata().setCreationTimestamp("2019-01-01T00:00:00Z");
        stale.getMetadata().setResourceVersion(null);
        configurations.put(stale);

        reconciler.reconcile(RECONCILIATION);

        assertThat(configurations.deleted, contains("square-deployer-stale"));
        assertThat(configurations.all(), hasSize(1));
    }
}
