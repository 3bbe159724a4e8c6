/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.operator.resource;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.projectriff.operator.common.model.Labels;

import java.util.List;
import java.util.Map;

/**
 * Typed access to one kind of namespaced resource. All writes are guarded by optimistic concurrency: updates and
 * status updates carry the resource version of the object they were computed from and deletes carry a resource
 * version precondition. Failures are reported as {@link io.fabric8.kubernetes.client.KubernetesClientException} with
 * the HTTP code of the API server (404 not found, 409 conflict or already exists).
 *
 * @param <T>   Type of the resource
 */
public interface ResourceOperator<T extends HasMetadata> {
    /**
     * @return  Kind of the resource
     */
    String kind();

    /**
     * @param namespace Namespace
     * @param name      Name
     *
     * @return  The resource or null when it does not exist
     */
    T get(String namespace, String name);

    /**
     * @param namespace Namespace
     * @param selector  Labels the resources have to carry
     *
     * @return  The matching resources in no particular order
     */
    List<T> list(String namespace, Labels selector);

    /**
     * Creates the resource. Resources with {@code metadata.generateName} get their name from the server.
     *
     * @param resource  Resource to create
     *
     * @return  The created resource
     */
    T create(T resource);

    /**
     * Updates the resource. Fails with a conflict when the resource version changed in the meantime.
     *
     * @param resource  Resource with the resource version it was read with
     *
     * @return  The updated resource
     */
    T update(T resource);

    /**
     * Deletes the resource if it still has the given resource version
     *
     * @param namespace         Namespace
     * @param name              Name
     * @param resourceVersion   Expected resource version
     */
    void delete(String namespace, String name, String resourceVersion);

    /**
     * Updates the status subresource. Fails with a conflict when the resource version changed in the meantime.
     *
     * @param resource  Resource with the new status
     *
     * @return  The updated resource
     */
    T updateStatus(T resource);

    /**
     * Creates an informer which is not started yet
     *
     * @param namespace         Namespace or {@code *} for all namespaces
     * @param selectorLabels    Selector labels, may be empty
     * @param resyncIntervalMs  Resync interval of the informer
     *
     * @return  The informer
     */
    SharedIndexInformer<T> informer(String namespace, Map<String, String> selectorLabels, long resyncIntervalMs);
}
