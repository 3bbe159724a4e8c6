/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.controller;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per key exponential backoff for redelivering failed reconciliations. The n-th consecutive failure of a key is
 * delayed by {@code scaleMs * base^(n-1)}, capped at {@code maxDelayMs}. A successful reconciliation forgets the key.
 */
public class ReconciliationBackOff {
    private static final long DEFAULT_SCALE_MS = 200L;
    private static final int DEFAULT_BASE = 2;
    private static final long DEFAULT_MAX_DELAY_MS = 5 * 60 * 1_000L;

    private final long scaleMs;
    private final int base;
    private final long maxDelayMs;
    /*test*/ final Map<String, Integer> failures = new ConcurrentHashMap<>();

    /**
     * Backoff starting at 200ms, doubling up to 5 minutes
     */
    public ReconciliationBackOff() {
        this(DEFAULT_SCALE_MS, DEFAULT_BASE, DEFAULT_MAX_DELAY_MS);
    }

    /**
     * @param scaleMs       Delay after the first failure
     * @param base          Multiplier applied with every further failure
     * @param maxDelayMs    Maximal delay
     */
    public ReconciliationBackOff(long scaleMs, int base, long maxDelayMs) {
        if (scaleMs <= 0) {
            throw new IllegalArgumentException("The scale has to be positive");
        }
        if (base <= 0) {
            throw new IllegalArgumentException("The base has to be positive");
        }
        if (maxDelayMs < scaleMs) {
            throw new IllegalArgumentException("The maximal delay has to be at least the scale");
        }
        this.scaleMs = scaleMs;
        this.base = base;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Records a failure of the key
     *
     * @param key   Key of the failed reconciliation
     *
     * @return  Delay in milliseconds before the key should be reconciled again
     */
    public long failure(String key) {
        int attempt = failures.merge(key, 1, Integer::sum);
        return delay(attempt);
    }

    /**
     * Forgets the failures of the key
     *
     * @param key   Key of the successful reconciliation
     */
    public void success(String key) {
        failures.remove(key);
    }

    private long delay(int attempt) {
        long delay = scaleMs;
        for (int i = 1; i < attempt; i++) {
            delay *= base;
            if (delay >= maxDelayMs) {
                return maxDelayMs;
            }
        }
        return Math.min(delay, maxDelayMs);
    }
}
