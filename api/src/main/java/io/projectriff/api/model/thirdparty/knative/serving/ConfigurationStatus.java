/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.serving;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.projectriff.api.model.common.Status;
import lombok.EqualsAndHashCode;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"latestCreatedRevisionName", "latestReadyRevisionName"})
@EqualsAndHashCode(callSuper = true)
public class ConfigurationStatus extends Status {
    private static final long serialVersionUID = 1L;

    private String latestCreatedRevisionName;
    private String latestReadyRevisionName;

    public String getLatestCreatedRevisionName() {
        return latestCreatedRevisionName;
    }

    public void setLatestCreatedRevisionName(String latestCreatedRevisionName) {
        this.latestCreatedRevisionName = latestCreatedRevisionName;
    }

    public String getLatestReadyRevisionName() {
        return latestReadyRevisionName;
    }

    public void setLatestReadyRevisionName(String latestReadyRevisionName) {
        this.latestReadyRevisionName = latestReadyRevisionName;
    }
}
