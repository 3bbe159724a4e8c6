/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.metrics;

import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.projectriff.operator.common.config.ConfigParameter;

import java.util.Optional;

/**
 * Utility methods for constructing metric tags
 */
public class MetricsUtils {
    private MetricsUtils() { }

    /**
     * Constructs all tags of a metric
     *
     * @param namespace         Namespace of the resources being reconciled
     * @param kind              Kind of the resources for which these metrics apply
     * @param selectorLabels    Selector labels to select the controller resources
     * @param optionalTags      Optional tags to be added
     * @return  All tags for the metric combined
     */
    public static Tags getAllMetricTags(String namespace, String kind, Optional<String> selectorLabels, Tag... optionalTags) {
        Tags tags = Tags.of(
                Tag.of("kind", kind),
                Tag.of("namespace", ConfigParameter.ANY_NAMESPACE.equals(namespace) ? "" : namespace));
        if (selectorLabels.isPresent()) {
            tags = tags.and(Tag.of("selector", selectorLabels.get()));
        }
        if (optionalTags != null && optionalTags.length > 0) {
            tags = tags.and(optionalTags);
        }
        return tags;
    }
}
