/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.time.Instant;
import java.util.Comparator;

/**
 * Helpers for copying and ordering Kubernetes resources
 */
public class ResourceUtils {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Orders resources from the oldest to the newest. Resources without a creation timestamp sort last, ties are
     * broken by name.
     */
    public static final Comparator<HasMetadata> BY_CREATION = Comparator
            .comparing((HasMetadata r) -> creationTimestamp(r), Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(r -> r.getMetadata().getName(), Comparator.nullsFirst(Comparator.naturalOrder()));

    private ResourceUtils() { }

    /**
     * Deep copies a resource through its JSON representation. Reconcilers work on copies so that objects shared
     * with the informer caches are never modified.
     *
     * @param resource  Resource to copy
     * @param <T>       Type of the resource
     *
     * @return  Deep copy of the resource or null when the resource is null
     */
    @SuppressWarnings("unchecked")
    public static <T> T deepCopy(T resource) {
        if (resource == null) {
            return null;
        }

        return (T) MAPPER.convertValue(resource, resource.getClass());
    }

    private static Instant creationTimestamp(HasMetadata resource) {
        String timestamp = resource.getMetadata().getCreationTimestamp();
        return timestamp != null ? Instant.parse(timestamp) : null;
    }
}
