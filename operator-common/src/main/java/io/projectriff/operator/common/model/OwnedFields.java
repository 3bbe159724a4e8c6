/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.projectriff.operator.common.ReconciliationLogger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compares and merges the fields a reconciler owns in a child resource. The API server and admission webhooks fill
 * in defaults (image pull policy, termination message path, readiness probes, ...) which never appear in the desired
 * child. A desired value matches an actual one when every field it sets has the same value in the actual resource,
 * so defaults added later do not count as drift.
 */
public class OwnedFields {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(OwnedFields.class.getName());
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Container fields which belong to the reconciler even when the desired container leaves them unset. Removing
     * one of them from the template removes it from the child.
     */
    static final Set<String> CONTAINER_OWNED_KEYS = Set.of("command", "args", "env", "envFrom", "ports",
            "volumeMounts", "workingDir", "resources");

    private static final String DEFAULT_SERVICE_ACCOUNT = "default";

    private OwnedFields() { }

    /**
     * @param desired   Desired value
     * @param actual    Actual value
     *
     * @return  True when every field set in the desired value has the same value in the actual one
     */
    public static boolean matches(Object desired, Object actual) {
        return isSubset(MAPPER.valueToTree(desired), MAPPER.valueToTree(actual));
    }

    static boolean isSubset(JsonNode desired, JsonNode actual) {
        if (desired == null || desired.isNull() || desired.isMissingNode()) {
            return true;
        }
        if (isEmpty(desired)) {
            return isEmpty(actual);
        }
        if (actual == null || actual.isNull() || actual.isMissingNode()) {
            return false;
        }

        if (desired.isObject()) {
            if (!actual.isObject()) {
                return false;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = desired.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!isSubset(field.getValue(), actual.get(field.getKey()))) {
                    return false;
                }
            }
            return true;
        } else if (desired.isArray()) {
            if (!actual.isArray() || desired.size() != actual.size()) {
                return false;
            }
            for (int i = 0; i < desired.size(); i++) {
                if (!isSubset(desired.get(i), actual.get(i))) {
                    return false;
                }
            }
            return true;
        } else {
            return desired.equals(actual);
        }
    }

    private static boolean isEmpty(JsonNode node) {
        return node == null
                || node.isNull()
                || node.isMissingNode()
                || (node.isContainerNode() && node.size() == 0)
                || (node.isTextual() && node.asText().isEmpty());
    }

    /**
     * Compares the containers, the service account and the volumes of two pod specs. Other pod level fields belong to
     * the API server.
     *
     * @param desired   Desired pod spec
     * @param actual    Actual pod spec, may be null
     *
     * @return  True when the owned pod fields match
     */
    public static boolean podSpecMatches(PodSpec desired, PodSpec actual) {
        if (actual == null) {
            return false;
        }

        if (!containersMatch(desired.getContainers(), actual.getContainers())) {
            return false;
        }

        if (!serviceAccountMatches(desired.getServiceAccountName(), actual.getServiceAccountName())) {
            LOGGER.debugOp("Service account differs: desired {}, actual {}", desired.getServiceAccountName(), actual.getServiceAccountName());
            return false;
        }

        if (!isSubset(MAPPER.valueToTree(nullSafeList(desired.getVolumes())), MAPPER.valueToTree(nullSafeList(actual.getVolumes())))) {
            LOGGER.debugOp("Volumes differ");
            return false;
        }

        return true;
    }

    private static boolean serviceAccountMatches(String desired, String actual) {
        if (desired == null || desired.isEmpty()) {
            return actual == null || actual.isEmpty() || DEFAULT_SERVICE_ACCOUNT.equals(actual);
        }
        return desired.equals(actual);
    }

    /**
     * Compares two lists of containers position by position
     *
     * @param desired   Desired containers
     * @param actual    Actual containers
     *
     * @return  True when the lists have the same size and every desired container matches the actual one at the same
     *          position
     */
    public static boolean containersMatch(List<Container> desired, List<Container> actual) {
        List<Container> desiredContainers = nullSafeList(desired);
        List<Container> actualContainers = nullSafeList(actual);

        if (desiredContainers.size() != actualContainers.size()) {
            LOGGER.debugOp("Number of containers differs: desired {}, actual {}", desiredContainers.size(), actualContainers.size());
            return false;
        }

        for (int i = 0; i < desiredContainers.size(); i++) {
            JsonNode d = MAPPER.valueToTree(desiredContainers.get(i));
            JsonNode a = MAPPER.valueToTree(actualContainers.get(i));

            for (String key : CONTAINER_OWNED_KEYS) {
                if (isEmpty(d.get(key)) && !isEmpty(a.get(key))) {
                    LOGGER.debugOp("Container {} has {} which is no longer desired", i, key);
                    return false;
                }
            }

            if (!isSubset(d, a)) {
                LOGGER.debugOp("Container {} differs: desired {}, actual {}", i, d, a);
                return false;
            }
        }

        return true;
    }

    /**
     * Writes the owned pod fields of the desired pod spec into the actual one
     *
     * @param desired   Desired pod spec
     * @param actual    Actual pod spec which is modified
     */
    public static void mergePodSpec(PodSpec desired, PodSpec actual) {
        actual.setContainers(mergeContainers(desired.getContainers(), actual.getContainers()));

        if (!serviceAccountMatches(desired.getServiceAccountName(), actual.getServiceAccountName())) {
            actual.setServiceAccountName(desired.getServiceAccountName());
            // deprecated alias, the API server copies it back from serviceAccountName
            actual.setServiceAccount(null);
        }

        actual.setVolumes(desired.getVolumes());
    }

    /**
     * Merges containers position by position. Every field the desired container sets replaces the actual one, the
     * owned fields it leaves unset are removed and everything else (the defaults) is kept.
     *
     * @param desired   Desired containers
     * @param actual    Actual containers
     *
     * @return  Merged containers
     */
    public static List<Container> mergeContainers(List<Container> desired, List<Container> actual) {
        List<Container> desiredContainers = nullSafeList(desired);
        List<Container> actualContainers = nullSafeList(actual);
        List<Container> merged = new ArrayList<>(desiredContainers.size());

        for (int i = 0; i < desiredContainers.size(); i++) {
            ObjectNode node = i < actualContainers.size()
                    ? (ObjectNode) MAPPER.valueToTree(actualContainers.get(i))
                    : MAPPER.createObjectNode();
            JsonNode d = MAPPER.valueToTree(desiredContainers.get(i));

            for (String key : CONTAINER_OWNED_KEYS) {
                if (isEmpty(d.get(key))) {
                    node.remove(key);
                }
            }

            Iterator<Map.Entry<String, JsonNode>> fields = d.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                node.set(field.getKey(), field.getValue());
            }

            merged.add(MAPPER.convertValue(node, Container.class));
        }

        return merged;
    }

    /**
     * @param desired   Desired labels or annotations
     * @param actual    Actual labels or annotations
     * @param ownedKeys Keys managed by the reconciler, their absence from the desired map is significant
     *
     * @return  True when every owned key has the same value in both maps
     */
    public static boolean mapMatches(Map<String, String> desired, Map<String, String> actual, Set<String> ownedKeys) {
        Map<String, String> desiredMap = nullSafeMap(desired);
        Map<String, String> actualMap = nullSafeMap(actual);

        for (String key : ownedKeys) {
            if (!Objects.equals(desiredMap.get(key), actualMap.get(key))) {
                return false;
            }
        }
        for (Map.Entry<String, String> entry : desiredMap.entrySet()) {
            if (!Objects.equals(entry.getValue(), actualMap.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    /**
     * @param desired   Desired labels or annotations
     * @param actual    Actual labels or annotations
     * @param ownedKeys Keys managed by the reconciler
     *
     * @return  The actual entries without the owned keys, overlaid with the desired entries
     */
    public static Map<String, String> mergeMap(Map<String, String> desired, Map<String, String> actual, Set<String> ownedKeys) {
        Map<String, String> merged = new HashMap<>(nullSafeMap(actual));
        merged.keySet().removeAll(ownedKeys);
        merged.putAll(nullSafeMap(desired));
        return merged;
    }

    private static <T> List<T> nullSafeList(List<T> list) {
        return list != null ? list : List.of();
    }

    private static Map<String, String> nullSafeMap(Map<String, String> map) {
        return map != null ? map : Map.of();
    }
}
