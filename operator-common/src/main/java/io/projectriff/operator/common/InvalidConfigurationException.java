/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

/**
 * Thrown for exceptional circumstances when parsing the operator configuration.
 */
public class InvalidConfigurationException extends RuntimeException {
    /**
     * Constructs the exception
     *
     * @param message   Error message
     */
    public InvalidConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs the exception
     *
     * @param message   Error message
     * @param cause     Cause of the exception
     */
    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
