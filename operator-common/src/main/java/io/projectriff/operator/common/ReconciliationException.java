/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

/**
 * Failure of a reconcile cycle. The controller loop logs it, counts it as a failed reconciliation and redelivers
 * the owner key after a backoff.
 */
public class ReconciliationException extends Exception {
    /**
     * Constructs the exception
     *
     * @param message   Error message
     */
    public ReconciliationException(String message) {
        super(message);
    }

    /**
     * Constructs the exception
     *
     * @param message   Error message
     * @param cause     Cause of the failure
     */
    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
