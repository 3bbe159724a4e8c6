/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

/**
 * An image reference could not be resolved to a digest: the reference is invalid, the registry is not reachable,
 * refused the credentials or does not know the image.
 */
public class DigestResolutionException extends Exception {
    /**
     * @param message   Error message
     */
    public DigestResolutionException(String message) {
        super(message);
    }

    /**
     * @param message   Error message
     * @param cause     Cause
     */
    public DigestResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
