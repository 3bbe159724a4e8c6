/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;

/**
 * Operator for managing custom resources: the riff resources as well as the Knative resources they own.
 *
 * @param <T>   The custom resource type
 * @param <L>   The list variant of the custom resource type
 */
public class CrdOperator<T extends HasMetadata, L extends KubernetesResourceList<T>> extends AbstractNamespacedResourceOperator<T, L, Resource<T>> {
    private final Class<T> cls;
    private final Class<L> listCls;

    /**
     * Constructor
     *
     * @param client    The Kubernetes client
     * @param cls       The class of the custom resource
     * @param listCls   The list variant of the class of the custom resource
     * @param kind      The kind of the custom resource
     */
    public CrdOperator(KubernetesClient client, Class<T> cls, Class<L> listCls, String kind) {
        super(client, kind);
        this.cls = cls;
        this.listCls = listCls;
    }

    @Override
    protected MixedOperation<T, L, Resource<T>> operation() {
        return client.resources(cls, listCls);
    }
}
