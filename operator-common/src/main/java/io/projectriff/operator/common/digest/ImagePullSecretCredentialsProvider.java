/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.LocalObjectReference;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.operator.resource.ResourceOperator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads registry credentials from the image pull secrets of a service account. Both the
 * {@code kubernetes.io/dockerconfigjson} and the legacy {@code kubernetes.io/dockercfg} secret types are supported.
 * The first secret with an entry for the registry wins.
 */
public class ImagePullSecretCredentialsProvider implements RegistryCredentialsProvider {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ImagePullSecretCredentialsProvider.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Type of Secrets with a {@code .dockerconfigjson} key
     */
    public static final String TYPE_DOCKER_CONFIG_JSON = "kubernetes.io/dockerconfigjson";
    /**
     * Type of Secrets with a {@code .dockercfg} key
     */
    public static final String TYPE_DOCKER_CFG = "kubernetes.io/dockercfg";

    private final ResourceOperator<ServiceAccount> serviceAccountOperator;
    private final ResourceOperator<Secret> secretOperator;

    /**
     * Constructor
     *
     * @param serviceAccountOperator    Operator for reading the service accounts
     * @param secretOperator            Operator for reading the secrets
     */
    public ImagePullSecretCredentialsProvider(ResourceOperator<ServiceAccount> serviceAccountOperator, ResourceOperator<Secret> secretOperator) {
        this.serviceAccountOperator = serviceAccountOperator;
        this.secretOperator = secretOperator;
    }

    @Override
    public RegistryCredentials credentialsFor(RegistryAuthContext authContext, String registry) throws DigestResolutionException {
        ServiceAccount serviceAccount;
        try {
            serviceAccount = serviceAccountOperator.get(authContext.namespace(), authContext.serviceAccountName());
        } catch (KubernetesClientException e) {
            throw new DigestResolutionException("Failed to get service account " + authContext.serviceAccountName() + ": " + e.getMessage(), e);
        }

        if (serviceAccount == null) {
            throw new DigestResolutionException("Service account " + authContext.serviceAccountName() + " not found in namespace " + authContext.namespace());
        }

        if (serviceAccount.getImagePullSecrets() != null) {
            for (LocalObjectReference ref : serviceAccount.getImagePullSecrets()) {
                Secret secret;
                try {
                    secret = secretOperator.get(authContext.namespace(), ref.getName());
                } catch (KubernetesClientException e) {
                    throw new DigestResolutionException("Failed to get image pull secret " + ref.getName() + ": " + e.getMessage(), e);
                }

                if (secret == null) {
                    LOGGER.debugOp("Image pull secret {} of service account {} in namespace {} does not exist", ref.getName(), authContext.serviceAccountName(), authContext.namespace());
                    continue;
                }

                RegistryCredentials credentials = fromSecret(secret, registry);
                if (credentials != null) {
                    return credentials;
                }
            }
        }

        return RegistryCredentials.ANONYMOUS;
    }

    /* test */ static RegistryCredentials fromSecret(Secret secret, String registry) throws DigestResolutionException {
        JsonNode auths;
        try {
            if (TYPE_DOCKER_CONFIG_JSON.equals(secret.getType())) {
                auths = MAPPER.readTree(Util.decodeBase64FieldFromSecret(secret, ".dockerconfigjson")).path("auths");
            } else if (TYPE_DOCKER_CFG.equals(secret.getType())) {
                auths = MAPPER.readTree(Util.decodeBase64FieldFromSecret(secret, ".dockercfg"));
            } else {
                return null;
            }
        } catch (IOException | RuntimeException e) {
            throw new DigestResolutionException("Image pull secret " + secret.getMetadata().getName() + " is not valid: " + e.getMessage(), e);
        }

        Iterator<Map.Entry<String, JsonNode>> entries = auths.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (registry.equals(normalizeRegistry(entry.getKey()))) {
                return credentials(entry.getValue());
            }
        }

        return null;
    }

    private static RegistryCredentials credentials(JsonNode entry) {
        if (entry.hasNonNull("auth") && !entry.get("auth").asText().isEmpty()) {
            String decoded = new String(Base64.getDecoder().decode(entry.get("auth").asText()), StandardCharsets.UTF_8);
            int colon = decoded.indexOf(':');
            if (colon >= 0) {
                return new RegistryCredentials(decoded.substring(0, colon), decoded.substring(colon + 1));
            }
        }

        return new RegistryCredentials(entry.path("username").asText(null), entry.path("password").asText(null));
    }

    /**
     * Turns the keys used in Docker config files (for example {@code https://index.docker.io/v1/}) into registry
     * host names.
     *
     * @param key   Key of the Docker config entry
     *
     * @return  Registry host name
     */
    /* test */ static String normalizeRegistry(String key) {
        String registry = key;
        if (registry.startsWith("https://")) {
            registry = registry.substring("https://".length());
        } else if (registry.startsWith("http://")) {
            registry = registry.substring("http://".length());
        }

        int slash = registry.indexOf('/');
        if (slash >= 0) {
            registry = registry.substring(0, slash);
        }

        if ("docker.io".equals(registry) || "registry-1.docker.io".equals(registry)) {
            registry = ImageReference.DOCKER_HUB;
        }

        return registry;
    }
}
