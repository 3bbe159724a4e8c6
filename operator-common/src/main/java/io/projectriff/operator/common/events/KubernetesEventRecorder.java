/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.events;

import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.model.StatusUtils;

/**
 * Event recorder which creates core/v1 Events through the Kubernetes API. Failures to record an event are logged and
 * otherwise ignored as events are informational only.
 */
public class KubernetesEventRecorder implements EventRecorder {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(KubernetesEventRecorder.class);

    private final KubernetesClient client;
    private final String component;

    /**
     * Constructor
     *
     * @param client    Kubernetes client
     * @param component Name of the component reported as the source of the events
     */
    public KubernetesEventRecorder(KubernetesClient client, String component) {
        this.client = client;
        this.component = component;
    }

    @Override
    public void event(HasMetadata involved, String type, String reason, String messageFormat, Object... args) {
        String message = args == null || args.length == 0 ? messageFormat : String.format(messageFormat, args);
        String namespace = involved.getMetadata().getNamespace();
        String now = StatusUtils.iso8601Now();

        Event event = new EventBuilder()
                .withNewMetadata()
                    .withGenerateName(involved.getMetadata().getName() + ".")
                    .withNamespace(namespace)
                .endMetadata()
                .withNewInvolvedObject()
                    .withApiVersion(involved.getApiVersion())
                    .withKind(involved.getKind())
                    .withName(involved.getMetadata().getName())
                    .withNamespace(namespace)
                    .withUid(involved.getMetadata().getUid())
                    .withResourceVersion(involved.getMetadata().getResourceVersion())
                .endInvolvedObject()
                .withType(type)
                .withReason(reason)
                .withMessage(message)
                .withFirstTimestamp(now)
                .withLastTimestamp(now)
                .withCount(1)
                .withNewSource()
                    .withComponent(component)
                .endSource()
                .build();

        try {
            client.v1().events().inNamespace(namespace).resource(event).create();
        } catch (KubernetesClientException e) {
            LOGGER.warnOp("Failed to record event {} for {} {} in namespace {}: {}", reason, involved.getKind(), involved.getMetadata().getName(), namespace, e.getMessage());
        }
    }
}
