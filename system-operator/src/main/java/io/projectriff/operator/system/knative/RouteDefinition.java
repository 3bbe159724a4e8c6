/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.knative;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.IngressPolicy;
import io.projectriff.api.model.thirdparty.knative.serving.Route;
import io.projectriff.api.model.thirdparty.knative.serving.RouteSpec;
import io.projectriff.api.model.thirdparty.knative.serving.TrafficTarget;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnedFields;
import io.projectriff.operator.common.reconciler.ChildDefinition;

import java.util.List;
import java.util.Map;

/**
 * Knative route named after the deployer which sends all traffic to the configuration recorded in the deployer status
 */
class RouteDefinition implements ChildDefinition<Deployer, Route> {
    @Override
    public String childKind() {
        return Route.RESOURCE_KIND;
    }

    @Override
    public Labels selector(Deployer owner) {
        return Labels.forLabel(Deployer.LABEL_KEY, owner.getMetadata().getName());
    }

    @Override
    public Route desired(Deployer owner) {
        if (owner.getStatus().getConfigurationRef() == null) {
            return null;
        }

        Map<String, String> labels = Util.mergeLabelsOrAnnotations(owner.getMetadata().getLabels(), selector(owner).toMap());
        if (owner.getSpec().getIngressPolicy() == IngressPolicy.ClusterLocal) {
            labels.put(ConfigurationDefinition.LABEL_VISIBILITY, ConfigurationDefinition.VISIBILITY_CLUSTER_LOCAL);
        }

        TrafficTarget target = new TrafficTarget();
        target.setConfigurationName(owner.getStatus().getConfigurationRef().getName());
        target.setPercent(100L);
        target.setLatestRevision(true);

        RouteSpec spec = new RouteSpec();
        spec.setTraffic(List.of(target));

        Route route = new Route();
        route.setMetadata(new ObjectMetaBuilder()
                .withName(owner.getMetadata().getName())
                .withLabels(labels)
                .build());
        route.setSpec(spec);
        return route;
    }

    @Override
    public boolean semanticEquals(Route desired, Route actual) {
        Map<String, String> desiredLabels = desired.getMetadata().getLabels();
        return actual.getSpec() != null
                && OwnedFields.matches(desired.getSpec().getTraffic(), actual.getSpec().getTraffic())
                && OwnedFields.mapMatches(desiredLabels, actual.getMetadata().getLabels(), ConfigurationDefinition.ownedLabelKeys(desiredLabels));
    }

    @Override
    public Route mergeOwnedFields(Route desired, Route actualCopy) {
        Map<String, String> desiredLabels = desired.getMetadata().getLabels();
        if (actualCopy.getSpec() == null) {
            actualCopy.setSpec(new RouteSpec());
        }
        actualCopy.getSpec().setTraffic(desired.getSpec().getTraffic());
        actualCopy.getMetadata().setLabels(OwnedFields.mergeMap(desiredLabels, actualCopy.getMetadata().getLabels(), ConfigurationDefinition.ownedLabelKeys(desiredLabels)));
        return actualCopy;
    }
}
