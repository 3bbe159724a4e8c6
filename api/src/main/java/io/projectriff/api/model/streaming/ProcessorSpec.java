/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.streaming;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.projectriff.api.model.common.UnknownPropertyPreserving;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Desired state of a Processor
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"functionRef", "inputs", "outputs", "template"})
@EqualsAndHashCode
public class ProcessorSpec implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private String functionRef;
    private List<StreamBinding> inputs;
    private List<StreamBinding> outputs;
    private PodSpec template;
    private Map<String, Object> additionalProperties = new HashMap<>(0);

    public String getFunctionRef() {
        return functionRef;
    }

    public void setFunctionRef(String functionRef) {
        this.functionRef = functionRef;
    }

    public List<StreamBinding> getInputs() {
        return inputs;
    }

    public void setInputs(List<StreamBinding> inputs) {
        this.inputs = inputs;
    }

    public List<StreamBinding> getOutputs() {
        return outputs;
    }

    public void setOutputs(List<StreamBinding> outputs) {
        this.outputs = outputs;
    }

    public PodSpec getTemplate() {
        return template;
    }

    public void setTemplate(PodSpec template) {
        this.template = template;
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
