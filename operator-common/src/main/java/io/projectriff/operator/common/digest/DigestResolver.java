/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import java.util.Set;

/**
 * Resolves a mutable image reference to an immutable digest reference
 */
public interface DigestResolver {
    /**
     * Resolves the image. References to a registry in the skip list are returned unchanged without any network call.
     * References which already carry a digest are returned unchanged as well.
     *
     * @param imageRef          Image reference, for example {@code gcr.io/project/image:tag}
     * @param authContext       Identity whose pull credentials are used
     * @param skipRegistries    Registry host names which are not resolved
     *
     * @return  The digest reference, for example {@code gcr.io/project/image@sha256:...}
     *
     * @throws DigestResolutionException when the image cannot be resolved
     */
    String resolve(String imageRef, RegistryAuthContext authContext, Set<String> skipRegistries) throws DigestResolutionException;
}
