/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.serving;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * List of Knative Route resources
 */
public class RouteList extends DefaultKubernetesResourceList<Route> {
    private static final long serialVersionUID = 1L;
}
