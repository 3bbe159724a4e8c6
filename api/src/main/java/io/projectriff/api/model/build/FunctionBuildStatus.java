/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.build;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.projectriff.api.model.common.Status;
import lombok.EqualsAndHashCode;

/**
 * Observed state of a FunctionBuild
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"buildCacheName", "buildName", "latestImage"})
@EqualsAndHashCode(callSuper = true)
public class FunctionBuildStatus extends Status {
    private static final long serialVersionUID = 1L;

    private String buildCacheName;
    private String buildName;
    private String latestImage;

    public String getBuildCacheName() {
        return buildCacheName;
    }

    public void setBuildCacheName(String buildCacheName) {
        this.buildCacheName = buildCacheName;
    }

    public String getBuildName() {
        return buildName;
    }

    public void setBuildName(String buildName) {
        this.buildName = buildName;
    }

    public String getLatestImage() {
        return latestImage;
    }

    public void setLatestImage(String latestImage) {
        this.latestImage = latestImage;
    }
}
