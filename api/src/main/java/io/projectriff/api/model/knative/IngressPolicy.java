/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.knative;

/**
 * Whether a Deployer is reachable from outside of the cluster
 */
public enum IngressPolicy {
    ClusterLocal,
    External
}
