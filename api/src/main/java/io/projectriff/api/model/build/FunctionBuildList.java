/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.build;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * List of FunctionBuild resources
 */
public class FunctionBuildList extends DefaultKubernetesResourceList<FunctionBuild> {
    private static final long serialVersionUID = 1L;
}
