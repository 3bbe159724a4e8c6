/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.knative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.projectriff.api.model.common.UnknownPropertyPreserving;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Reference to the resource providing the image of a Deployer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"functionBuildRef", "containerRef"})
@EqualsAndHashCode
public class DeployerBuild implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private String functionBuildRef;
    private String containerRef;
    private Map<String, Object> additionalProperties = new HashMap<>(0);

    public String getFunctionBuildRef() {
        return functionBuildRef;
    }

    public void setFunctionBuildRef(String functionBuildRef) {
        this.functionBuildRef = functionBuildRef;
    }

    public String getContainerRef() {
        return containerRef;
    }

    public void setContainerRef(String containerRef) {
        this.containerRef = containerRef;
    }

    @Override
    public Map<String, Object> getAdditionalProperties() {
        return this.additionalProperties != null ? this.additionalProperties : emptyMap();
    }

    @Override
    public void setAdditionalProperty(String name, Object value) {
        if (this.additionalProperties == null) {
            this.additionalProperties = new HashMap<>(1);
        }
        this.additionalProperties.put(name, value);
    }
}
