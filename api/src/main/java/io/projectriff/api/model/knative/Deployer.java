/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.knative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.Version;
import io.projectriff.api.model.Constants;

/**
 * Runs the image of a FunctionBuild, a Container or a plain image as a Knative service
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
@Group(Constants.KNATIVE_GROUP)
@Version(Constants.V1ALPHA1)
public class Deployer extends CustomResource<DeployerSpec, DeployerStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "Deployer";
    public static final String LABEL_KEY = Constants.KNATIVE_GROUP + "/deployer";
    public static final String CONDITION_CONFIGURATION_READY = "ConfigurationReady";
    public static final String CONDITION_ROUTE_READY = "RouteReady";

    @Override
    public String toString() {
        YAMLMapper mapper = new YAMLMapper();
        try {
            return mapper.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }
}
