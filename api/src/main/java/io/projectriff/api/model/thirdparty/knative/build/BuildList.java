/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.build;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * List of Knative Build resources
 */
public class BuildList extends DefaultKubernetesResourceList<Build> {
    private static final long serialVersionUID = 1L;
}
