/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import io.projectriff.api.model.common.Condition;
import io.projectriff.api.model.knative.DeployerStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ConditionManagerTest {
    private static final String CONFIGURATION_READY = "ConfigurationReady";
    private static final String ROUTE_READY = "RouteReady";
    private static final ConditionSet CONDITIONS = ConditionSet.living(CONFIGURATION_READY, ROUTE_READY);

    private DeployerStatus status;
    private ConditionManager conditions;

    @BeforeEach
    public void setUp() {
        status = new DeployerStatus();
        conditions = CONDITIONS.manage(status);
        conditions.initializeConditions();
    }

    @Test
    public void testInitializeAddsUnknownConditionsSortedByType() {
        assertThat(status.getConditions().stream().map(Condition::getType).toList(), contains(CONFIGURATION_READY, ConditionSet.READY, ROUTE_READY));
        assertThat(status.getConditions().stream().map(Condition::getStatus).distinct().toList(), contains(Condition.UNKNOWN));
        assertThat(conditions.isReady(), is(false));
    }

    @Test
    public void testInitializeKeepsExistingConditions() {
        conditions.markTrue(CONFIGURATION_READY);
        String transitionTime = conditions.getCondition(CONFIGURATION_READY).getLastTransitionTime();

        conditions.initializeConditions();

        assertThat(conditions.getCondition(CONFIGURATION_READY).getStatus(), is(Condition.TRUE));
        assertThat(conditions.getCondition(CONFIGURATION_READY).getLastTransitionTime(), is(transitionTime));
        assertThat(status.getConditions().size(), is(3));
    }

    @Test
    public void testReadyWhenAllDependentsAreTrue() {
        conditions.markTrue(CONFIGURATION_READY);
        assertThat(conditions.isReady(), is(false));

        conditions.markTrue(ROUTE_READY);
        assertThat(conditions.isReady(), is(true));
        assertThat(conditions.getCondition(ConditionSet.READY).getReason(), is(nullValue()));
    }

    @Test
    public void testFirstFalseDependentDrivesReady() {
        conditions.markTrue(CONFIGURATION_READY);
        conditions.markFalse(ROUTE_READY, "RouteFailed", "route %s failed", "my-route");

        Condition ready = conditions.getCondition(ConditionSet.READY);
        assertThat(ready.getStatus(), is(Condition.FALSE));
        assertThat(ready.getReason(), is("RouteFailed"));
        assertThat(ready.getMessage(), is("route my-route failed"));

        conditions.markFalse(CONFIGURATION_READY, "RevisionFailed", "revision failed");
        assertThat(conditions.getCondition(ConditionSet.READY).getReason(), is("RevisionFailed"));
    }

    @Test
    public void testFalseWinsOverUnknown() {
        conditions.markUnknown(CONFIGURATION_READY, "Deploying", null);
        conditions.markFalse(ROUTE_READY, "RouteFailed", "failed");

        assertThat(conditions.getCondition(ConditionSet.READY).getStatus(), is(Condition.FALSE));
        assertThat(conditions.getCondition(ConditionSet.READY).getReason(), is("RouteFailed"));
    }

    @Test
    public void testUnknownReadyAdoptsFirstUnknownDependent() {
        conditions.markTrue(ROUTE_READY);
        conditions.markUnknown(CONFIGURATION_READY, "Deploying", "waiting for %d revisions", 2);

        Condition ready = conditions.getCondition(ConditionSet.READY);
        assertThat(ready.getStatus(), is(Condition.UNKNOWN));
        assertThat(ready.getReason(), is("Deploying"));
        assertThat(ready.getMessage(), is("waiting for 2 revisions"));
    }

    @Test
    public void testTransitionTimeOnlyMovesWithStatus() {
        conditions.markFalse(ROUTE_READY, "First", "first");
        Condition first = conditions.getCondition(ROUTE_READY);
        first.setLastTransitionTime("2019-06-01T00:00:00Z");

        conditions.markFalse(ROUTE_READY, "Second", "second");
        assertThat(conditions.getCondition(ROUTE_READY).getReason(), is("Second"));
        assertThat(conditions.getCondition(ROUTE_READY).getLastTransitionTime(), is("2019-06-01T00:00:00Z"));

        conditions.markTrue(ROUTE_READY);
        assertThat(conditions.getCondition(ROUTE_READY).getLastTransitionTime().equals("2019-06-01T00:00:00Z"), is(false));
    }

    @Test
    public void testMarkNotOwned() {
        conditions.markNotOwned(ROUTE_READY, "Route", "my-deployer", "Deployer");

        Condition route = conditions.getCondition(ROUTE_READY);
        assertThat(route.getStatus(), is(Condition.FALSE));
        assertThat(route.getReason(), is(ConditionManager.REASON_NOT_OWNED));
        assertThat(route.getMessage(), is("There is an existing Route \"my-deployer\" that the Deployer does not own."));
        assertThat(conditions.getCondition(ConditionSet.READY).getReason(), is(ConditionManager.REASON_NOT_OWNED));
    }

    @Test
    public void testPropagate() {
        conditions.propagate(CONFIGURATION_READY, new Condition("Ready", Condition.FALSE, "RevisionMissing", "no revision"));

        Condition configuration = conditions.getCondition(CONFIGURATION_READY);
        assertThat(configuration.getStatus(), is(Condition.FALSE));
        assertThat(configuration.getReason(), is("RevisionMissing"));
        assertThat(configuration.getMessage(), is("no revision"));

        conditions.propagate(CONFIGURATION_READY, new Condition("Ready", Condition.TRUE, null, null));
        assertThat(conditions.getCondition(CONFIGURATION_READY).getStatus(), is(Condition.TRUE));
    }

    @Test
    public void testPropagateMissingChildConditionIsNoop() {
        conditions.markFalse(CONFIGURATION_READY, "Failed", "failed");

        conditions.propagate(CONFIGURATION_READY, null);
        conditions.propagate(CONFIGURATION_READY, new Condition("Ready", null, null, null));

        assertThat(conditions.getCondition(CONFIGURATION_READY).getReason(), is("Failed"));
    }

    @Test
    public void testReadyCannotBeSetDirectly() {
        assertThrows(IllegalArgumentException.class, () -> conditions.markTrue(ConditionSet.READY));
    }
}
