/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.knative;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.fabric8.kubernetes.api.model.TypedLocalObjectReference;
import io.projectriff.api.model.common.Addressable;
import io.projectriff.api.model.common.Status;
import lombok.EqualsAndHashCode;

/**
 * Observed state of a Deployer
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"latestImage", "configurationRef", "routeRef", "url", "address"})
@EqualsAndHashCode(callSuper = true)
public class DeployerStatus extends Status {
    private static final long serialVersionUID = 1L;

    private String latestImage;
    private TypedLocalObjectReference configurationRef;
    private TypedLocalObjectReference routeRef;
    private String url;
    private Addressable address;

    public String getLatestImage() {
        return latestImage;
    }

    public void setLatestImage(String latestImage) {
        this.latestImage = latestImage;
    }

    public TypedLocalObjectReference getConfigurationRef() {
        return configurationRef;
    }

    public void setConfigurationRef(TypedLocalObjectReference configurationRef) {
        this.configurationRef = configurationRef;
    }

    public TypedLocalObjectReference getRouteRef() {
        return routeRef;
    }

    public void setRouteRef(TypedLocalObjectReference routeRef) {
        this.routeRef = routeRef;
    }

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
