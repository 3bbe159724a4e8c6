/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Common status section: the generation last fully processed by the reconciler and the list of conditions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode
public abstract class Status implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private Long observedGeneration;
    private List<Condition> conditions;
    private Map<String, Object> additionalProperties = new HashMap<>(0);

    public Long getObservedGeneration() {
        return observedGeneration;
    }

    public void setObservedGeneration(Long observedGeneration) {
        this.observedGeneration = observedGeneration;
    }

    public List<Condition> getConditions() {
        return conditions;
    }

    public void setConditions(List<Condition> conditions) {
        this.conditions = conditions;
    }

    /**
     * Finds a condition by its type
     *
     * @param type  Condition type
     *
     * @return  The condition or null when the status does not carry it
     */
    @JsonIgnore
    public Condition getCondition(String type) {
        if (conditions != null) {
            for (Condition condition : conditions) {
                if (type.equals(condition.getType())) {
                    return condition;
                }
            }
        }

        return null;
    }

    /**
     * Adds the condition or replaces the existing condition with the same type
     *
     * @param condition Condition to set
     */
    @JsonIgnore
    public void setCondition(Condition condition) {
        if (conditions == null) {
            conditions = new ArrayList<>(1);
        }

        conditions.removeIf(c -> condition.getType().equals(c.getType()));
        conditions.add(condition);
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
