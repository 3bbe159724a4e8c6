/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.Reconciliation;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.aMapWithSize;
import static org.hamcrest.Matchers.anEmptyMap;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;

public class ReferenceTrackerTest {
    private static final Reconciliation SQUARE = new Reconciliation("test", "Deployer", "ns", "square");
    private static final Reconciliation CUBE = new Reconciliation("test", "Deployer", "ns", "cube");
    private static final Reconciliation UPPER = new Reconciliation("test", "Processor", "ns", "upper");

    @Test
    public void testOwnersReferencingResource() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.track(SQUARE, "FunctionBuild", "ns", "square-build");
        tracker.track(CUBE, "FunctionBuild", "ns", "square-build");
        tracker.track(UPPER, "FunctionBuild", "ns", "square-build");

        Set<SimplifiedReconciliation> owners = tracker.ownersReferencing("Deployer", "FunctionBuild", "ns", "square-build");

        assertThat(owners, containsInAnyOrder(
                new SimplifiedReconciliation("Deployer", "ns", "square"),
                new SimplifiedReconciliation("Deployer", "ns", "cube")));
        assertThat(tracker.ownersReferencing("Processor", "FunctionBuild", "ns", "square-build"),
                containsInAnyOrder(new SimplifiedReconciliation("Processor", "ns", "upper")));
    }

    @Test
    public void testReferencesAreScopedByKindAndNamespace() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.track(SQUARE, "FunctionBuild", "ns", "square");

        assertThat(tracker.ownersReferencing("Deployer", "Container", "ns", "square"), is(empty()));
        assertThat(tracker.ownersReferencing("Deployer", "FunctionBuild", "other", "square"), is(empty()));
    }

    @Test
    public void testTrackingIsIdempotent() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.track(SQUARE, "FunctionBuild", "ns", "square");
        tracker.track(new Reconciliation("timer", "Deployer", "ns", "square"), "FunctionBuild", "ns", "square");

        assertThat(tracker.trackers, aMapWithSize(1));
        assertThat(tracker.ownersReferencing("Deployer", "FunctionBuild", "ns", "square").size(), is(1));
    }

    @Test
    public void testUntrackForgetsOwner() {
        ReferenceTracker tracker = new ReferenceTracker();
        tracker.track(SQUARE, "FunctionBuild", "ns", "square");
        tracker.track(SQUARE, "Container", "ns", "square");
        tracker.track(CUBE, "FunctionBuild", "ns", "square");

        tracker.untrack(SQUARE);

        assertThat(tracker.ownersReferencing("Deployer", "FunctionBuild", "ns", "square"),
                containsInAnyOrder(new SimplifiedReconciliation("Deployer", "ns", "cube")));
        assertThat(tracker.ownersReferencing("Deployer", "Container", "ns", "square"), is(empty()));

        tracker.untrack(CUBE);

        assertThat(tracker.trackers, is(anEmptyMap()));
    }
}
