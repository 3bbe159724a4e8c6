/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system;

import io.projectriff.operator.common.http.Liveness;
import io.projectriff.operator.common.http.Readiness;

import java.util.List;

/**
 * Health of the operator: alive and ready when all of its controllers are
 */
class OperatorHealth implements Liveness, Readiness {
    private final List<? extends Liveness> livenesses;
    private final List<? extends Readiness> readinesses;

    <T extends Liveness & Readiness> OperatorHealth(List<T> components) {
        this.livenesses = components;
        this.readinesses = components;
    }

    @Override
    public boolean isAlive() {
        return livenesses.stream().allMatch(Liveness::isAlive);
    }

    @Override
    public boolean isReady() {
        return readinesses.stream().allMatch(Readiness::isReady);
    }
}
