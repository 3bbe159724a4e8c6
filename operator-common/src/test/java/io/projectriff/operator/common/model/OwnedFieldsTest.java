/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.PodSpecBuilder;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

public class OwnedFieldsTest {
    private static Container desiredContainer() {
        return new ContainerBuilder()
                .withName("function")
                .withImage("gcr.io/project/square@sha256:1234")
                .addNewEnv().withName("GREETING").withValue("hello").endEnv()
                .addNewPort().withContainerPort(8080).endPort()
                .build();
    }

    private static Container defaulted(Container container) {
        return new ContainerBuilder(container)
                .withImagePullPolicy("IfNotPresent")
                .withTerminationMessagePath("/dev/termination-log")
                .withTerminationMessagePolicy("File")
                .editFirstPort().withProtocol("TCP").endPort()
                .build();
    }

    private static PodSpec pod(Container container) {
        return new PodSpecBuilder().withContainers(container).build();
    }

    @Test
    public void testDefaultsMatch() {
        assertThat(OwnedFields.containersMatch(List.of(desiredContainer()), List.of(defaulted(desiredContainer()))), is(true));
    }

    @Test
    public void testChangedValueDoesNotMatch() {
        Container actual = defaulted(desiredContainer());
        actual.getEnv().get(0).setValue("goodbye");

        assertThat(OwnedFields.containersMatch(List.of(desiredContainer()), List.of(actual)), is(false));
    }

    @Test
    public void testDifferentNumberOfContainersDoesNotMatch() {
        assertThat(OwnedFields.containersMatch(List.of(desiredContainer()), List.of(desiredContainer(), desiredContainer())), is(false));
        assertThat(OwnedFields.containersMatch(List.of(desiredContainer()), null), is(false));
        assertThat(OwnedFields.containersMatch(null, List.of()), is(true));
    }

    @Test
    public void testOwnedFieldLeftUnsetDoesNotMatch() {
        Container actual = defaulted(desiredContainer());
        actual.setArgs(List.of("--verbose"));

        assertThat(OwnedFields.containersMatch(List.of(desiredContainer()), List.of(actual)), is(false));
    }

    @Test
    public void testEmptyValuesMatchMissingValues() {
        Container desired = desiredContainer();
        desired.getEnv().get(0).setValue("");
        Container actual = defaulted(desiredContainer());
        actual.getEnv().get(0).setValue(null);

        assertThat(OwnedFields.containersMatch(List.of(desired), List.of(actual)), is(true));
    }

    @Test
    public void testMergeKeepsDefaultsAndDropsUnsetOwnedFields() {
        Container actual = defaulted(desiredContainer());
        actual.setArgs(List.of("--verbose"));
        Container desired = desiredContainer();
        desired.setImage("gcr.io/project/square@sha256:5678");

        List<Container> merged = OwnedFields.mergeContainers(List.of(desired), List.of(actual));

        assertThat(merged.get(0).getImage(), is("gcr.io/project/square@sha256:5678"));
        assertThat(merged.get(0).getImagePullPolicy(), is("IfNotPresent"));
        assertThat(merged.get(0).getTerminationMessagePolicy(), is("File"));
        assertThat(merged.get(0).getArgs(), is(empty()));
        assertThat(OwnedFields.containersMatch(List.of(desired), merged), is(true));
    }

    @Test
    public void testMergeAddsNewContainers() {
        List<Container> merged = OwnedFields.mergeContainers(List.of(desiredContainer(), desiredContainer()), List.of(defaulted(desiredContainer())));

        assertThat(merged.size(), is(2));
        assertThat(merged.get(0).getImagePullPolicy(), is("IfNotPresent"));
        assertThat(merged.get(1).getImagePullPolicy(), is(nullValue()));
    }

    @Test
    public void testDefaultServiceAccount() {
        PodSpec actual = pod(defaulted(desiredContainer()));
        actual.setServiceAccountName("default");
        actual.setServiceAccount("default");
        actual.setDnsPolicy("ClusterFirst");

        assertThat(OwnedFields.podSpecMatches(pod(desiredContainer()), actual), is(true));

        PodSpec desired = pod(desiredContainer());
        desired.setServiceAccountName("builder");
        assertThat(OwnedFields.podSpecMatches(desired, actual), is(false));

        OwnedFields.mergePodSpec(desired, actual);
        assertThat(actual.getServiceAccountName(), is("builder"));
        assertThat(actual.getServiceAccount(), is(nullValue()));
        assertThat(actual.getDnsPolicy(), is("ClusterFirst"));
        assertThat(OwnedFields.podSpecMatches(desired, actual), is(true));
    }

    @Test
    public void testMissingPodSpecDoesNotMatch() {
        assertThat(OwnedFields.podSpecMatches(pod(desiredContainer()), null), is(false));
    }

    @Test
    public void testNestedObjectsAndLists() {
        assertThat(OwnedFields.matches(Map.of("a", List.of(Map.of("b", 1))), Map.of("a", List.of(Map.of("b", 1, "c", 2)), "d", 3)), is(true));
        assertThat(OwnedFields.matches(Map.of("a", List.of(Map.of("b", 1))), Map.of("a", List.of(Map.of("b", 2)))), is(false));
        assertThat(OwnedFields.matches(Map.of("a", List.of(1, 2)), Map.of("a", List.of(2, 1))), is(false));
        assertThat(OwnedFields.matches(Map.of("a", List.of()), Map.of()), is(true));
        assertThat(OwnedFields.matches(Map.of("a", 1), Map.of()), is(false));
    }

    @Test
    public void testOwnedMapKeys() {
        Set<String> owned = Set.of("autoscaling.knative.dev/maxScale", "riff");

        assertThat(OwnedFields.mapMatches(Map.of("riff", "yes"), Map.of("riff", "yes", "serving.knative.dev/route", "square"), owned), is(true));
        assertThat(OwnedFields.mapMatches(Map.of("riff", "yes"), Map.of("riff", "yes", "autoscaling.knative.dev/maxScale", "3"), owned), is(false));
        assertThat(OwnedFields.mapMatches(null, Map.of(), owned), is(true));

        Map<String, String> merged = OwnedFields.mergeMap(Map.of("riff", "yes"), Map.of("autoscaling.knative.dev/maxScale", "3", "foreign", "kept"), owned);
        assertThat(merged, is(Map.of("riff", "yes", "foreign", "kept")));
        assertThat(OwnedFields.mergeMap(null, null, owned).keySet(), is(empty()));
        assertThat(OwnedFields.mergeMap(Map.of("riff", "yes"), null, owned).keySet(), contains("riff"));
    }
}
