/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

/**
 * Looks up the credentials for a registry
 */
public interface RegistryCredentialsProvider {
    /**
     * @param authContext   Identity whose credentials are used
     * @param registry      Registry host name, optionally with a port
     *
     * @return  Credentials or {@link RegistryCredentials#ANONYMOUS}
     *
     * @throws DigestResolutionException when the credentials cannot be read
     */
    RegistryCredentials credentialsFor(RegistryAuthContext authContext, String registry) throws DigestResolutionException;
}
