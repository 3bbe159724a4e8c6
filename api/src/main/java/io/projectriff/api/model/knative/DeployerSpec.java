/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.knative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.PodTemplateSpec;
import io.projectriff.api.model.common.UnknownPropertyPreserving;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Desired state of a Deployer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"build", "template", "ingressPolicy", "minScale", "maxScale"})
@EqualsAndHashCode
public class DeployerSpec implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private DeployerBuild build;
    private PodTemplateSpec template;
    private IngressPolicy ingressPolicy;
    private Integer minScale;
    private Integer maxScale;
    private Map<String, Object> additionalProperties = new HashMap<>(0);

    public DeployerBuild getBuild() {
        return build;
    }

    public void setBuild(DeployerBuild build) {
        this.build = build;
    }

    public PodTemplateSpec getTemplate() {
        return template;
    }

    public void setTemplate(PodTemplateSpec template) {
        this.template = template;
    }

    public IngressPolicy getIngressPolicy() {
        return ingressPolicy;
    }

    public void setIngressPolicy(IngressPolicy ingressPolicy) {
        this.ingressPolicy = ingressPolicy;
    }

    public Integer getMinScale() {
        return minScale;
    }

    public void setMinScale(Integer minScale) {
        this.minScale = minScale;
    }

    public Integer getMaxScale() {
        return maxScale;
    }

    public void setMaxScale(Integer maxScale) {
        this.maxScale = maxScale;
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
