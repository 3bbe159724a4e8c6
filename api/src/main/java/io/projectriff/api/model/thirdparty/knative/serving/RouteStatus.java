/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.serving;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.projectriff.api.model.common.Addressable;
import io.projectriff.api.model.common.Status;
import lombok.EqualsAndHashCode;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"url", "address"})
@EqualsAndHashCode(callSuper = true)
public class RouteStatus extends Status {
    private static final long serialVersionUID = 1L;

    private String url;
    private Addressable address;

    public String getUrl() {
        return url;
    }

    public void setUrl(String url) {
        this.url = url;
    }

    public Addressable getAddress() {
        return address;
    }

    public void setAddress(Addressable address) {
        this.address = address;
    }
}
