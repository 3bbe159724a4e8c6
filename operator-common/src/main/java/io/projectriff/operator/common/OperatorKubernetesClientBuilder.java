/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

/**
 * Builds the Kubernetes client used by the operator, identifying it through the user agent.
 */
public class OperatorKubernetesClientBuilder {
    private final String componentName;
    private final String version;

    /**
     * Constructor to create the OperatorKubernetesClientBuilder with the name of the component and its version.
     *
     * @param componentName  The name of the component using the client.
     * @param version        The version of the component using the client.
     */
    public OperatorKubernetesClientBuilder(final String componentName, final String version) {
        this.componentName = componentName;
        this.version = version;
    }

    /**
     * @return  The user agent sent with every request
     */
    /* test */ String userAgent() {
        return String.format("%s/%s", componentName, version);
    }

    /**
     * Builds the KubernetesClient.
     *
     * @return the Kubernetes Client
     */
    public KubernetesClient build() {
        final Config kubernetesClientConfig = new ConfigBuilder().withUserAgent(userAgent()).build();
        return new KubernetesClientBuilder().withConfig(kubernetesClientConfig).build();
    }
}
