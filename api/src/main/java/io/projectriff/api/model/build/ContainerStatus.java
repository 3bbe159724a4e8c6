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
 * Observed state of a Container
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"latestImage"})
@EqualsAndHashCode(callSuper = true)
public class ContainerStatus extends Status {
    private static final long serialVersionUID = 1L;

    private String latestImage;

    public String getLatestImage() {
        return latestImage;
    }

    public void setLatestImage(String latestImage) {
        this.latestImage = latestImage;
    }
}
