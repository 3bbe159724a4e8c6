/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.events.RecordingEventRecorder;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnerReferences;
import io.projectriff.operator.common.operator.resource.MockResourceOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ChildSynchronizerTest {
    private static final String NAMESPACE = "my-namespace";
    private static final String NAME = "my-deployer";
    private static final String LABEL = "test.projectriff.io/owner";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", Deployer.RESOURCE_KIND, NAMESPACE, NAME);

    private MockResourceOperator<ConfigMap> configMaps;
    private RecordingEventRecorder events;
    private ConfigMapDefinition definition;
    private ChildSynchronizer<Deployer, ConfigMap> synchronizer;
    private Deployer owner;

    /**
     * Config map child carrying the desired data. The data and the labels are the owned fields.
     */
    static class ConfigMapDefinition implements ChildDefinition<Deployer, ConfigMap> {
        Map<String, String> data = Map.of("image", "registry.example.com/fn@sha256:1234");
        boolean generateName = false;

        @Override
        public String childKind() {
            return "ConfigMap";
        }

        @Override
        public Labels selector(Deployer owner) {
            return Labels.forLabel(LABEL, owner.getMetadata().getName());
        }

        @Override
        public ConfigMap desired(Deployer owner) {
            if (data == null) {
                return null;
            }

            ObjectMetaBuilder metadata = new ObjectMetaBuilder();
            if (generateName) {
                metadata.withGenerateName(owner.getMetadata().getName() + "-");
            } else {
                metadata.withName(owner.getMetadata().getName() + "-config");
            }

            return new ConfigMapBuilder().withMetadata(metadata.build()).withData(new HashMap<>(data)).build();
        }

        @Override
        public boolean semanticEquals(ConfigMap desired, ConfigMap actual) {
            return Objects.equals(desired.getData(), actual.getData())
                    && Objects.equals(desired.getMetadata().getLabels(), actual.getMetadata().getLabels());
        }

        @Override
        public ConfigMap mergeOwnedFields(ConfigMap desired, ConfigMap actualCopy) {
            actualCopy.setData(desired.getData());
            actualCopy.getMetadata().setLabels(desired.getMetadata().getLabels());
            return actualCopy;
        }
    }

    @BeforeEach
    public void setUp() {
        configMaps = new MockResourceOperator<>("ConfigMap");
        events = new RecordingEventRecorder();
        definition = new ConfigMapDefinition();
        synchronizer = new ChildSynchronizer<>(configMaps, definition, events);

        owner = new Deployer();
        owner.setMetadata(new ObjectMetaBuilder().withNamespace(NAMESPACE).withName(NAME).withUid("deployer-uid").build());
    }

    private ConfigMap ownedChild(String name) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                    .withNamespace(NAMESPACE)
                    .withName(name)
                    .withLabels(Map.of(LABEL, NAME))
                    .withOwnerReferences(OwnerReferences.controllerReference(owner))
                .endMetadata()
                .withData(new HashMap<>(definition.data))
                .build();
    }

    private ConfigMap foreignChild(String name) {
        return new ConfigMapBuilder()
                .withNewMetadata()
                    .withNamespace(NAMESPACE)
                    .withName(name)
                    .withLabels(Map.of(LABEL, NAME))
                    .withOwnerReferences(new OwnerReferenceBuilder().withKind(Deployer.RESOURCE_KIND).withName("other").withUid("other-uid").withController(true).build())
                .endMetadata()
                .build();
    }

    @Test
    public void testCreatesMissingChild() throws ReconciliationException {
        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName(), is("my-deployer-config"));
        assertThat(child.getMetadata().getNamespace(), is(NAMESPACE));
        assertThat(child.getMetadata().getLabels().get(LABEL), is(NAME));
        assertThat(OwnerReferences.isControlledBy(child, owner), is(true));
        assertThat(configMaps.created, hasSize(1));
        assertThat(events.reasons(), contains("Created"));
        assertThat(events.events.get(0).message(), is("Created ConfigMap \"my-deployer-config\""));
    }

    @Test
    public void testUpToDateChildIsNotWritten() throws ReconciliationException {
        synchronizer.synchronize(RECONCILIATION, owner);
        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child, is(notNullValue()));
        assertThat(configMaps.created, hasSize(1));
        assertThat(configMaps.updated, is(empty()));
        assertThat(configMaps.deleted, is(empty()));
    }

    @Test
    public void testDriftedChildIsUpdatedAndForeignFieldsArePreserved() throws ReconciliationException {
        synchronizer.synchronize(RECONCILIATION, owner);
        configMaps.modify(NAMESPACE, "my-deployer-config", cm -> {
            cm.setData(Map.of("image", "tampered"));
            cm.getMetadata().setAnnotations(Map.of("other.example.com/note", "keep me"));
        });

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getData(), is(definition.data));
        assertThat(child.getMetadata().getAnnotations().get("other.example.com/note"), is("keep me"));
        assertThat(configMaps.updated, hasSize(1));
        assertThat(events.reasons(), contains("Created", "Updated"));
    }

    @Test
    public void testForeignChildWithDesiredNameIsNotOwned() {
        configMaps.put(foreignChild("my-deployer-config"));

        ChildNotOwnedException e = assertThrows(ChildNotOwnedException.class, () -> synchronizer.synchronize(RECONCILIATION, owner));

        assertThat(e.getChildKind(), is("ConfigMap"));
        assertThat(e.getChildName(), is("my-deployer-config"));
        assertThat(configMaps.created, is(empty()));
        assertThat(configMaps.updated, is(empty()));
        assertThat(configMaps.deleted, is(empty()));
    }

    @Test
    public void testForeignChildWithOtherNameIsLeftAlone() throws ReconciliationException {
        configMaps.put(foreignChild("somebody-elses-config"));

        synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(configMaps.deleted, is(empty()));
        assertThat(configMaps.all(), hasSize(2));
    }

    @Test
    public void testUndesiredChildrenAreDeleted() throws ReconciliationException {
        configMaps.put(ownedChild("my-deployer-config"));
        configMaps.put(ownedChild("my-deployer-old"));
        configMaps.put(foreignChild("somebody-elses-config"));
        definition.data = null;

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child, is(nullValue()));
        assertThat(configMaps.deleted, contains("my-deployer-config", "my-deployer-old"));
        assertThat(configMaps.all(), hasSize(1));
    }

    @Test
    public void testExtraChildrenAreDeletedOldestFirst() throws ReconciliationException {
        configMaps.put(ownedChild("my-deployer-b"));
        configMaps.put(ownedChild("my-deployer-a"));
        configMaps.put(ownedChild("my-deployer-config"));

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName(), is("my-deployer-config"));
        assertThat(configMaps.deleted, contains("my-deployer-b", "my-deployer-a"));
        assertThat(configMaps.created, is(empty()));
    }

    @Test
    public void testNewestChildIsCanonicalWithGeneratedNames() throws ReconciliationException {
        definition.generateName = true;
        configMaps.put(ownedChild("my-deployer-older"));
        configMaps.put(ownedChild("my-deployer-newer"));

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName(), is("my-deployer-newer"));
        assertThat(configMaps.deleted, contains("my-deployer-older"));
        assertThat(configMaps.created, is(empty()));
    }

    @Test
    public void testGeneratedNameIsCreated() throws ReconciliationException {
        definition.generateName = true;

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName().startsWith("my-deployer-"), is(true));
        assertThat(configMaps.created, hasSize(1));
    }

    @Test
    public void testFailedDeleteStopsSynchronization() {
        configMaps.put(ownedChild("my-deployer-oldest"));
        configMaps.put(ownedChild("my-deployer-older"));
        configMaps.failOn(MockResourceOperator.Operation.DELETE, MockResourceOperator.apiError(500, "InternalError"));

        ReconciliationException e = assertThrows(ReconciliationException.class, () -> synchronizer.synchronize(RECONCILIATION, owner));

        assertThat(e.getMessage(), is("Failed to delete ConfigMap my-deployer-oldest"));
        assertThat(configMaps.deleted, is(empty()));
        assertThat(configMaps.get(NAMESPACE, "my-deployer-older"), is(notNullValue()));
        assertThat(configMaps.created, is(empty()));
        assertThat(events.reasons(), contains("DeleteFailed"));
        assertThat(events.events.get(0).message(), startsWith("Failed to delete ConfigMap \"my-deployer-oldest\""));
    }

    @Test
    public void testAlreadyDeletedChildIsIgnored() throws ReconciliationException {
        configMaps.put(ownedChild("my-deployer-old"));
        configMaps.failOn(MockResourceOperator.Operation.DELETE, MockResourceOperator.apiError(404, "NotFound"));

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName(), is("my-deployer-config"));
        assertThat(events.reasons(), contains("Created"));
    }

    @Test
    public void testFailedCreateIsReported() {
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(403, "Forbidden"));

        assertThrows(ReconciliationException.class, () -> synchronizer.synchronize(RECONCILIATION, owner));

        assertThat(events.reasons(), contains("CreationFailed"));
        assertThat(events.events.get(0).type(), is("Warning"));
    }

    @Test
    public void testConcurrentlyCreatedOwnedChildIsReturned() throws ReconciliationException {
        ConfigMap unlabelled = ownedChild("my-deployer-config");
        unlabelled.getMetadata().setLabels(null);
        configMaps.put(unlabelled);
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(409, "AlreadyExists"));

        ConfigMap child = synchronizer.synchronize(RECONCILIATION, owner);

        assertThat(child.getMetadata().getName(), is("my-deployer-config"));
        assertThat(events.reasons(), is(empty()));
    }

    @Test
    public void testConcurrentlyCreatedForeignChildIsNotOwned() {
        ConfigMap unlabelled = foreignChild("my-deployer-config");
        unlabelled.getMetadata().setLabels(null);
        configMaps.put(unlabelled);
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(409, "AlreadyExists"));

        assertThrows(ChildNotOwnedException.class, () -> synchronizer.synchronize(RECONCILIATION, owner));
    }

    @Test
    public void testUpdateConflictIsNotReportedAsEvent() throws ReconciliationException {
        synchronizer.synchronize(RECONCILIATION, owner);
        configMaps.modify(NAMESPACE, "my-deployer-config", cm -> cm.setData(Map.of("image", "tampered")));
        configMaps.failOn(MockResourceOperator.Operation.UPDATE, MockResourceOperator.apiError(409, "Conflict"));

        assertThrows(ReconciliationException.class, () -> synchronizer.synchronize(RECONCILIATION, owner));

        assertThat(events.reasons(), is(List.of("Created")));
    }
}
