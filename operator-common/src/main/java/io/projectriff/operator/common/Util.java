/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common;

import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.KubernetesClientException;

import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Class with various utility methods shared between modules
 */
public class Util {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(Util.class);

    private Util() { }

    /**
     * Decode a text item from a Kubernetes Secret from base64
     *
     * @param secret    Kubernetes Secret
     * @param field     Field which should be retrieved and decoded
     * @return          Decoded value
     */
    public static String decodeBase64FieldFromSecret(Secret secret, String field) {
        Objects.requireNonNull(secret);
        String data = secret.getData() != null ? secret.getData().get(field) : null;
        if (data != null) {
            return new String(Base64.getDecoder().decode(data), StandardCharsets.UTF_8);
        } else {
            throw new RuntimeException(String.format("The Secret %s/%s is missing the field %s",
                    secret.getMetadata().getNamespace(),
                    secret.getMetadata().getName(),
                    field));
        }
    }

    /**
     * Logs environment variables into the regular log file.
     */
    public static void printEnvInfo() {
        Map<String, String> env = new HashMap<>(System.getenv());
        StringBuilder sb = new StringBuilder();

        for (Map.Entry<String, String> entry: env.entrySet()) {
            sb.append("\t").append(entry.getKey()).append(": ").append(maskPassword(entry.getKey(), entry.getValue())).append("\n");
        }

        LOGGER.infoOp("Using config:\n" + sb);
    }

    /**
     * Masks the value of environment variables which contain `PASSWORD` or `TOKEN` in their name.
     *
     * @param key   Name of the environment variable
     * @param value Value of the environment variable
     * @return      Value of the environment variable or masked text in case of a secret
     */
    /* test */ static String maskPassword(String key, String value)  {
        if (key.contains("PASSWORD") || key.contains("TOKEN"))  {
            return "********";
        } else {
            return value;
        }
    }

    /**
     * Merge two or more Maps together, should be used for merging multiple collections of Kubernetes labels or annotations
     *
     * @param base The base set of key value pairs that will be merged, if no overrides are present this will be returned.
     * @param overrides One or more Maps to merge with base, duplicate keys will be overwritten by last-in priority.
     *
     * @return A single Map of all the supplied maps merged together.
     */
    @SafeVarargs
    public static Map<String, String> mergeLabelsOrAnnotations(Map<String, String> base, Map<String, String>... overrides) {
        Map<String, String> merged = new HashMap<>();

        if (base != null) {
            merged.putAll(base);
        }

        if (overrides != null) {
            for (Map<String, String> toMerge : overrides) {
                if (toMerge != null) {
                    merged.putAll(toMerge);
                }
            }
        }

        return merged;
    }

    /**
     * @param error Any throwable
     * @return True when the error is a Kubernetes API error with the 404 Not Found code
     */
    public static boolean isNotFound(Throwable error) {
        return hasCode(error, HttpURLConnection.HTTP_NOT_FOUND);
    }

    /**
     * @param error Any throwable
     * @return True when the error is a Kubernetes API error with the 409 Conflict code, which the API server uses
     *         both for resource version conflicts and for resources which already exist
     */
    public static boolean isConflict(Throwable error) {
        return hasCode(error, HttpURLConnection.HTTP_CONFLICT);
    }

    /**
     * @param error Any throwable
     * @return True when the error reports a create of a resource which already exists
     */
    public static boolean isAlreadyExists(Throwable error) {
        return isConflict(error)
                && ((KubernetesClientException) error).getStatus() != null
                && "AlreadyExists".equals(((KubernetesClientException) error).getStatus().getReason());
    }

    private static boolean hasCode(Throwable error, int code) {
        return error instanceof KubernetesClientException kce && kce.getCode() == code;
    }
}
