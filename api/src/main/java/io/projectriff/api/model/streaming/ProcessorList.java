/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.streaming;

import io.fabric8.kubernetes.api.model.DefaultKubernetesResourceList;

/**
 * List of Processor resources
 */
public class ProcessorList extends DefaultKubernetesResourceList<Processor> {
    private static final long serialVersionUID = 1L;
}
