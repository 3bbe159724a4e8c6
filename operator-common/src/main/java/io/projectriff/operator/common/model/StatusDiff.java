/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.zjsonpatch.JsonDiff;
import io.projectriff.api.model.common.Status;
import io.projectriff.operator.common.ReconciliationLogger;

import java.util.regex.Pattern;

/**
 * Diffs status section of a custom resource
 */
public class StatusDiff {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(StatusDiff.class.getName());
    private static final ObjectMapper PATCH_MAPPER = new ObjectMapper();
    private static final Pattern IGNORABLE_PATHS = Pattern.compile(
            "^(/conditions/[0-9]+/lastTransitionTime)$");

    private final boolean isEmpty;

    /**
     * Constructs the status diff
     *
     * @param current   Current status
     * @param desired   Desired status
     */
    public StatusDiff(Status current, Status desired) {
        JsonNode source = current == null ? PATCH_MAPPER.createObjectNode() : PATCH_MAPPER.valueToTree(current);
        JsonNode target = desired == null ? PATCH_MAPPER.createObjectNode() : PATCH_MAPPER.valueToTree(desired);
        JsonNode diff = JsonDiff.asJson(source, target);

        int num = 0;

        for (JsonNode d : diff) {
            String pathValue = d.get("path").asText();

            if (IGNORABLE_PATHS.matcher(pathValue).matches()) {
                LOGGER.debugOp("Ignoring Status diff {}", d);
                continue;
            }

            if (LOGGER.isDebugEnabled()) {
                LOGGER.debugOp("Status differs: {}", d);
                LOGGER.debugOp("Current Status path {} has value {}", pathValue, lookupPath(source, pathValue));
                LOGGER.debugOp("Desired Status path {} has value {}", pathValue, lookupPath(target, pathValue));
            }

            num++;
        }

        this.isEmpty = num == 0;
    }

    private static JsonNode lookupPath(JsonNode source, String path) {
        JsonNode node = source;
        for (String pathComponent : path.substring(1).split("/")) {
            if (node == null) {
                return null;
            }
            if (node.isArray()) {
                try {
                    node = node.path(Integer.parseInt(pathComponent));
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                node = node.get(pathComponent.replace("~1", "/").replace("~0", "~"));
            }
        }
        return node;
    }

    /**
     * Returns whether the Diff is empty or not
     *
     * @return true when the diffed statuses match
     */
    public boolean isEmpty() {
        return isEmpty;
    }
}
