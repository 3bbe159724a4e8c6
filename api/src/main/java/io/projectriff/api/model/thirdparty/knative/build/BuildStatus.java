/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model.thirdparty.knative.build;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.projectriff.api.model.common.Status;
import lombok.EqualsAndHashCode;

/**
 * Status of a Knative Build. Only the conditions are read, everything else is preserved as additional properties.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@EqualsAndHashCode(callSuper = true)
public class BuildStatus extends Status {
    private static final long serialVersionUID = 1L;
}
