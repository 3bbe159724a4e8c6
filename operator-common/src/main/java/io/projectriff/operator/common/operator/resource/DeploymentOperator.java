/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.RollableScalableResource;

/**
 * Operator for managing Deployments of the streaming processors
 */
public class DeploymentOperator extends AbstractNamespacedResourceOperator<Deployment, DeploymentList, RollableScalableResource<Deployment>> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public DeploymentOperator(KubernetesClient client) {
        super(client, "Deployment");
    }

    @Override
    protected MixedOperation<Deployment, DeploymentList, RollableScalableResource<Deployment>> operation() {
        return client.apps().deployments();
    }
}
