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
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.config.ConfigParameter;
import io.projectriff.operator.common.model.Labels;

import java.util.List;
import java.util.Map;

/**
 * Abstract resource operator for namespaced resources backed by the Fabric8 Kubernetes client
 *
 * @param <T>   The Kubernetes resource type
 * @param <L>   The list variant of the Kubernetes resource type
 * @param <R>   The Fabric8 resource type of the single resource operations
 */
public abstract class AbstractNamespacedResourceOperator<T extends HasMetadata, L extends KubernetesResourceList<T>, R extends Resource<T>>
        implements ResourceOperator<T> {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(AbstractNamespacedResourceOperator.class);

    protected final KubernetesClient client;
    protected final String resourceKind;

    /**
     * Constructor
     *
     * @param client        The Kubernetes client
     * @param resourceKind  The kind of Kubernetes resource (used for logging)
     */
    public AbstractNamespacedResourceOperator(KubernetesClient client, String resourceKind) {
        this.client = client;
        this.resourceKind = resourceKind;
    }

    /**
     * @return  The Fabric8 operation for the resource kind
     */
    protected abstract MixedOperation<T, L, R> operation();

    @Override
    public String kind() {
        return resourceKind;
    }

    @Override
    public T get(String namespace, String name) {
        return operation().inNamespace(namespace).withName(name).get();
    }

    @Override
    public List<T> list(String namespace, Labels selector) {
        return operation().inNamespace(namespace).withLabels(selector.toMap()).list().getItems();
    }

    @Override
    public T create(T resource) {
        LOGGER.debugOp("{} {} in namespace {} is being created", resourceKind, name(resource), resource.getMetadata().getNamespace());
        return operation().inNamespace(resource.getMetadata().getNamespace()).resource(resource).create();
    }

    @Override
    public T update(T resource) {
        LOGGER.debugOp("{} {} in namespace {} is being updated", resourceKind, name(resource), resource.getMetadata().getNamespace());
        return operation().inNamespace(resource.getMetadata().getNamespace()).resource(resource).update();
    }

    @Override
    public void delete(String namespace, String name, String resourceVersion) {
        LOGGER.debugOp("{} {} in namespace {} is being deleted", resourceKind, name, namespace);
        operation().inNamespace(namespace).withName(name).lockResourceVersion(resourceVersion).delete();
    }

    @Override
    public T updateStatus(T resource) {
        LOGGER.debugOp("Status of {} {} in namespace {} is being updated", resourceKind, name(resource), resource.getMetadata().getNamespace());
        return operation().inNamespace(resource.getMetadata().getNamespace()).resource(resource).updateStatus();
    }

    @Override
    public SharedIndexInformer<T> informer(String namespace, Map<String, String> selectorLabels, long resyncIntervalMs) {
        if (ConfigParameter.ANY_NAMESPACE.equals(namespace)) {
            return operation().inAnyNamespace().withLabels(selectorLabels).runnableInformer(resyncIntervalMs);
        } else {
            return operation().inNamespace(namespace).withLabels(selectorLabels).runnableInformer(resyncIntervalMs);
        }
    }

    private static String name(HasMetadata resource) {
        return resource.getMetadata().getName() != null ? resource.getMetadata().getName() : resource.getMetadata().getGenerateName() + "*";
    }
}
