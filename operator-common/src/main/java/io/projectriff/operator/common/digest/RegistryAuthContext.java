/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

/**
 * Identity used to look up registry credentials: only the image pull secrets of this service account are used.
 *
 * @param namespace             Namespace of the service account
 * @param serviceAccountName    Name of the service account
 */
public record RegistryAuthContext(String namespace, String serviceAccountName) {
}
