/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;

/**
 * Converges one owner resource. Returning normally clears the retry backoff of the key, throwing redelivers the key
 * after a backoff.
 */
public interface Reconciler {
    /**
     * Runs one reconcile cycle
     *
     * @param reconciliation    Reconciliation with the kind, namespace and name of the owner
     *
     * @throws ReconciliationException when the cycle failed and should be retried
     */
    void reconcile(Reconciliation reconciliation) throws ReconciliationException;
}
