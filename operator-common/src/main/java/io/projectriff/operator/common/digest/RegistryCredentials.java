/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * User name and password for a registry
 *
 * @param username  User name
 * @param password  Password or token
 */
public record RegistryCredentials(String username, String password) {
    /**
     * No credentials
     */
    public static final RegistryCredentials ANONYMOUS = new RegistryCredentials(null, null);

    /**
     * @return  True when there are no credentials
     */
    public boolean isAnonymous() {
        return username == null && password == null;
    }

    /**
     * @return  Value of the Authorization header for the Basic scheme
     */
    public String basicAuthorization() {
        String userPass = (username != null ? username : "") + ":" + (password != null ? password : "");
        return "Basic " + Base64.getEncoder().encodeToString(userPass.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public String toString() {
        return isAnonymous() ? "RegistryCredentials(anonymous)" : "RegistryCredentials(" + username + ", ********)";
    }
}
