/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.events;

import io.fabric8.kubernetes.api.model.HasMetadata;

/**
 * Records human readable events about a resource
 */
public interface EventRecorder {
    /**
     * Event type for normal operation
     */
    String TYPE_NORMAL = "Normal";
    /**
     * Event type for failures
     */
    String TYPE_WARNING = "Warning";

    /**
     * Records an event
     *
     * @param involved      Resource the event is about
     * @param type          {@link #TYPE_NORMAL} or {@link #TYPE_WARNING}
     * @param reason        Short machine readable reason, for example {@code Created}
     * @param messageFormat Message format for {@link String#format(String, Object...)}
     * @param args          Message arguments
     */
    void event(HasMetadata involved, String type, String reason, String messageFormat, Object... args);
}
