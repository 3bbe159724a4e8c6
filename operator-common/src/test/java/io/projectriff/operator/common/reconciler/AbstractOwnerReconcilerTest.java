/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.ConfigMapBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReferenceBuilder;
import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.DeployerStatus;
import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.events.RecordingEventRecorder;
import io.projectriff.operator.common.model.ConditionManager;
import io.projectriff.operator.common.model.ConditionSet;
import io.projectriff.operator.common.operator.resource.MockResourceOperator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.arrayWithSize;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class AbstractOwnerReconcilerTest {
    private static final String NAMESPACE = "my-namespace";
    private static final String NAME = "my-deployer";
    private static final String CONFIG_READY = "ConfigReady";
    private static final Reconciliation RECONCILIATION = new Reconciliation("test", Deployer.RESOURCE_KIND, NAMESPACE, NAME);

    private MockResourceOperator<Deployer> deployers;
    private MockResourceOperator<ConfigMap> configMaps;
    private RecordingEventRecorder events;
    private TestReconciler reconciler;

    /**
     * Reconciler with a single config map child. The child condition becomes true once the child exists.
     */
    class TestReconciler extends AbstractOwnerReconciler<Deployer, DeployerStatus> {
        private final ChildSynchronizer<Deployer, ConfigMap> configMapSync;
        boolean stopEarly = false;
        int deletions = 0;

        TestReconciler() {
            super(Deployer.RESOURCE_KIND, deployers, events, ConditionSet.living(CONFIG_READY));
            this.configMapSync = new ChildSynchronizer<>(configMaps, new ChildSynchronizerTest.ConfigMapDefinition(), events);
        }

        @Override
        protected void onOwnerDeleted(Reconciliation reconciliation) {
            deletions++;
        }

        @Override
        protected DeployerStatus newStatus() {
            return new DeployerStatus();
        }

        @Override
        protected boolean reconcileChildren(Reconciliation reconciliation, Deployer owner, ConditionManager conditions) throws ReconciliationException {
            owner.getStatus().setLatestImage("registry.example.com/fn@sha256:1234");

            if (stopEarly) {
                return false;
            }

            ConfigMap child = synchronize(configMapSync, reconciliation, owner, conditions, CONFIG_READY);
            if (child != null) {
                conditions.markTrue(CONFIG_READY);
            }

            return true;
        }
    }

    @BeforeEach
    public void setUp() {
        deployers = new MockResourceOperator<>(Deployer.RESOURCE_KIND);
        configMaps = new MockResourceOperator<>("ConfigMap");
        events = new RecordingEventRecorder();
        reconciler = new TestReconciler();

        Deployer deployer = new Deployer();
        deployer.setMetadata(new ObjectMetaBuilder().withNamespace(NAMESPACE).withName(NAME).withUid("deployer-uid").build());
        deployers.put(deployer);
    }

    private DeployerStatus storedStatus() {
        return deployers.get(NAMESPACE, NAME).getStatus();
    }

    @Test
    public void testReconcileOfReadyOwner() throws ReconciliationException {
        reconciler.reconcile(RECONCILIATION);

        DeployerStatus status = storedStatus();
        assertThat(status.getObservedGeneration(), is(1L));
        assertThat(status.getLatestImage(), is("registry.example.com/fn@sha256:1234"));
        assertThat(status.getCondition(CONFIG_READY).getStatus(), is(Condition.TRUE));
        assertThat(status.getCondition(ConditionSet.READY).getStatus(), is(Condition.TRUE));
        assertThat(deployers.statusUpdates, hasSize(1));
        assertThat(events.reasons(), contains("Created", "Ready"));
    }

    @Test
    public void testUnchangedStatusIsNotWritten() throws ReconciliationException {
        reconciler.reconcile(RECONCILIATION);
        reconciler.reconcile(RECONCILIATION);

        assertThat(deployers.statusUpdates, hasSize(1));
        assertThat(events.reasons(), contains("Created", "Ready"));
    }

    @Test
    public void testReadyEventIsNotRepeatedAfterStatusChange() throws ReconciliationException {
        reconciler.reconcile(RECONCILIATION);
        deployers.modify(NAMESPACE, NAME, d -> d.getStatus().setLatestImage("registry.example.com/fn@sha256:0000"));

        reconciler.reconcile(RECONCILIATION);

        assertThat(deployers.statusUpdates, hasSize(2));
        assertThat(storedStatus().getLatestImage(), is("registry.example.com/fn@sha256:1234"));
        assertThat(events.reasons(), contains("Created", "Ready"));
    }

    @Test
    public void testMissingOwner() throws ReconciliationException {
        reconciler.reconcile(new Reconciliation("test", Deployer.RESOURCE_KIND, NAMESPACE, "missing"));

        assertThat(reconciler.deletions, is(1));
        assertThat(configMaps.created, is(empty()));
        assertThat(deployers.statusUpdates, is(empty()));
    }

    @Test
    public void testOwnerBeingDeletedIsSkipped() throws ReconciliationException {
        deployers.modify(NAMESPACE, NAME, d -> d.getMetadata().setDeletionTimestamp("2019-06-02T00:00:00Z"));

        reconciler.reconcile(RECONCILIATION);

        assertThat(configMaps.created, is(empty()));
        assertThat(deployers.statusUpdates, is(empty()));
    }

    @Test
    public void testStoppedReconciliationDoesNotObserveGeneration() throws ReconciliationException {
        reconciler.stopEarly = true;

        reconciler.reconcile(RECONCILIATION);

        DeployerStatus status = storedStatus();
        assertThat(status.getObservedGeneration(), is(nullValue()));
        assertThat(status.getCondition(ConditionSet.READY).getStatus(), is(Condition.UNKNOWN));
        assertThat(events.reasons(), is(empty()));
    }

    @Test
    public void testStatusIsWrittenWhenChildFails() {
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(403, "Forbidden"));

        assertThrows(ReconciliationException.class, () -> reconciler.reconcile(RECONCILIATION));

        DeployerStatus status = storedStatus();
        assertThat(status.getObservedGeneration(), is(nullValue()));
        assertThat(status.getLatestImage(), is("registry.example.com/fn@sha256:1234"));
        assertThat(status.getCondition(CONFIG_READY).getStatus(), is(Condition.UNKNOWN));
        assertThat(events.reasons(), contains("CreationFailed"));
    }

    @Test
    public void testChildNotOwned() {
        configMaps.put(new ConfigMapBuilder()
                .withNewMetadata()
                    .withNamespace(NAMESPACE)
                    .withName(NAME + "-config")
                    .withOwnerReferences(new OwnerReferenceBuilder().withKind("Deployer").withName("other").withUid("other-uid").withController(true).build())
                .endMetadata()
                .build());
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(409, "AlreadyExists"));

        assertThrows(ChildNotOwnedException.class, () -> reconciler.reconcile(RECONCILIATION));

        Condition condition = storedStatus().getCondition(CONFIG_READY);
        assertThat(condition.getStatus(), is(Condition.FALSE));
        assertThat(condition.getReason(), is(ConditionManager.REASON_NOT_OWNED));
        assertThat(condition.getMessage(), is("There is an existing ConfigMap \"my-deployer-config\" that the Deployer does not own."));
        assertThat(storedStatus().getCondition(ConditionSet.READY).getReason(), is(ConditionManager.REASON_NOT_OWNED));
    }

    @Test
    public void testOwnerDeletedBeforeStatusUpdate() throws ReconciliationException {
        deployers.failOn(MockResourceOperator.Operation.UPDATE_STATUS, MockResourceOperator.apiError(404, "NotFound"));

        reconciler.reconcile(RECONCILIATION);

        assertThat(events.reasons(), contains("Created"));
    }

    @Test
    public void testStatusConflictIsRetried() {
        deployers.failOn(MockResourceOperator.Operation.UPDATE_STATUS, MockResourceOperator.apiError(409, "Conflict"));

        assertThrows(ReconciliationException.class, () -> reconciler.reconcile(RECONCILIATION));

        assertThat(events.reasons(), contains("Created"));
    }

    @Test
    public void testChildFailureWinsOverStatusFailure() {
        configMaps.failOn(MockResourceOperator.Operation.CREATE, MockResourceOperator.apiError(403, "Forbidden"));
        deployers.failOn(MockResourceOperator.Operation.UPDATE_STATUS, MockResourceOperator.apiError(500, "InternalError"));

        ReconciliationException e = assertThrows(ReconciliationException.class, () -> reconciler.reconcile(RECONCILIATION));

        assertThat(e.getMessage(), is("Failed to create ConfigMap my-deployer-config"));
        assertThat(e.getSuppressed(), arrayWithSize(1));
        assertThat(e.getSuppressed()[0], instanceOf(ReconciliationException.class));
        assertThat(events.reasons(), contains("CreationFailed", "UpdateFailed"));
    }
}
