/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.serving;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.projectriff.api.model.common.UnknownPropertyPreserving;
import lombok.EqualsAndHashCode;

import java.io.Serializable;
import java.util.HashMap;
import java.util.Map;

import static java.util.Collections.emptyMap;

/**
 * Share of the traffic of a Route sent to a Configuration or Revision
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"configurationName", "revisionName", "latestRevision", "percent", "tag"})
@EqualsAndHashCode
public class TrafficTarget implements UnknownPropertyPreserving, Serializable {
    private static final long serialVersionUID = 1L;

    private String configurationName;
    private String revisionName;
    private Boolean latestRevision;
    private Long percent;
    private String tag;
    private Map<String, Object> additionalProperties = new HashMap<>(0);

    public String getConfigurationName() {
        return configurationName;
    }

    public void setConfigurationName(String configurationName) {
        this.configurationName = configurationName;
    }

    public String getRevisionName() {
        return revisionName;
    }

    public void setRevisionName(String revisionName) {
        this.revisionName = revisionName;
    }

    public Boolean getLatestRevision() {
        return latestRevision;
    }

    public void setLatestRevision(Boolean latestRevision) {
        this.latestRevision = latestRevision;
    }

    public Long getPercent() {
        return percent;
    }

    public void setPercent(Long percent) {
        this.percent = percent;
    }

    public String getTag() {
        return tag;
    }

    public void setTag(String tag) {
        this.tag = tag;
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
