/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.build;

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
 * Tracks the latest digest of a container image built outside of riff
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"apiVersion", "kind", "metadata", "spec", "status"})
@Group(Constants.BUILD_GROUP)
@Version(Constants.V1ALPHA1)
public class Container extends CustomResource<ContainerSpec, ContainerStatus> implements Namespaced {
    private static final long serialVersionUID = 1L;

    public static final String RESOURCE_KIND = "Container";
    public static final String CONDITION_IMAGE_RESOLVED = "ImageResolved";
    public static final String DEFAULT_SERVICE_ACCOUNT_NAME = "default";

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
