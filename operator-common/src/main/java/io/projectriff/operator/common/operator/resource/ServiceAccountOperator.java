/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.ServiceAccountList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.ServiceAccountResource;

/**
 * Operator for reading ServiceAccounts
 */
public class ServiceAccountOperator extends AbstractNamespacedResourceOperator<ServiceAccount, ServiceAccountList, ServiceAccountResource> {
    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     */
    public ServiceAccountOperator(KubernetesClient client) {
        super(client, "ServiceAccount");
    }

    @Override
    protected MixedOperation<ServiceAccount, ServiceAccountList, ServiceAccountResource> operation() {
        return client.serviceAccounts();
    }
}
