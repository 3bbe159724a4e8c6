/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.streaming;

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
 * Runs a function between input and output streams
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
@Group(Constants.STREAMING_GROUP)
@Version(Constants.V1ALPHA1)
public class Processor extends CustomResource<ProcessorSpec, ProcessorStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "Processor";
    public static final String LABEL_KEY = Constants.STREAMING_GROUP + "/processor";
    public static final String CONDITION_DEPLOYMENT_READY = "DeploymentReady";

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
