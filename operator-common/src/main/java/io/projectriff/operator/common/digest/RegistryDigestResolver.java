/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.projectriff.operator.common.ReconciliationLogger;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves image digests through the Docker Registry HTTP API V2. The manifest is requested with a HEAD request and the
 * digest is read from the {@code Docker-Content-Digest} header. Registries which do not send the header get a GET
 * request and the digest is computed from the manifest body.
 * <p>
 * Anonymous access is attempted first. A 401 response is answered according to its {@code WWW-Authenticate} challenge:
 * {@code Bearer} challenges exchange the credentials for a pull token at the token realm and {@code Basic} challenges
 * send the credentials directly.
 */
public class RegistryDigestResolver implements DigestResolver {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(RegistryDigestResolver.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /* test */ static final String MANIFEST_ACCEPT = String.join(",",
            "application/vnd.docker.distribution.manifest.v2+json",
            "application/vnd.docker.distribution.manifest.list.v2+json",
            "application/vnd.oci.image.manifest.v1+json",
            "application/vnd.oci.image.index.v1+json");
    private static final String DIGEST_HEADER = "Docker-Content-Digest";
    private static final Pattern CHALLENGE_PARAM = Pattern.compile("(\\w+)=\"([^\"]*)\"");

    private final RegistryCredentialsProvider credentialsProvider;
    private final Set<String> insecureRegistries;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * Constructor
     *
     * @param credentialsProvider   Provides the credentials used when the registry asks for authentication
     * @param insecureRegistries    Registries which are accessed over plain HTTP
     * @param timeout               Timeout of each request to the registry
     */
    public RegistryDigestResolver(RegistryCredentialsProvider credentialsProvider, Set<String> insecureRegistries, Duration timeout) {
        this.credentialsProvider = credentialsProvider;
        this.insecureRegistries = insecureRegistries;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public String resolve(String imageRef, RegistryAuthContext authContext, Set<String> skipRegistries) throws DigestResolutionException {
        ImageReference image;
        try {
            image = ImageReference.parse(imageRef);
        } catch (IllegalArgumentException e) {
            throw new DigestResolutionException(e.getMessage(), e);
        }

        if (skipRegistries.contains(image.registry())) {
            LOGGER.debugOp("Registry {} of image {} is skipped", image.registry(), imageRef);
            return imageRef;
        }

        if (image.hasDigest()) {
            return imageRef;
        }

        try {
            String digest = fetchDigest(image, authContext);
            LOGGER.debugOp("Image {} resolved to digest {}", imageRef, digest);
            return image.withDigest(digest);
        } catch (IOException e) {
            throw new DigestResolutionException("Failed to reach registry " + image.registry() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DigestResolutionException("Interrupted while resolving " + imageRef, e);
        }
    }

    private String fetchDigest(ImageReference image, RegistryAuthContext authContext) throws IOException, InterruptedException, DigestResolutionException {
        URI manifestUri = URI.create(scheme(image.registry()) + "://" + image.registry() + "/v2/" + image.repository() + "/manifests/" + image.identifier());

        HttpResponse<byte[]> response = send(manifestUri, "HEAD", null);
        String authorization = null;

        if (response.statusCode() == 401) {
            String challenge = response.headers().firstValue("WWW-Authenticate").orElse(null);
            authorization = authorize(image, challenge, authContext);
            response = send(manifestUri, "HEAD", authorization);
        }

        checkStatus(image, response);

        String digest = response.headers().firstValue(DIGEST_HEADER).orElse(null);
        if (digest != null) {
            return digest;
        }

        response = send(manifestUri, "GET", authorization);
        checkStatus(image, response);
        return response.headers().firstValue(DIGEST_HEADER).orElse(sha256(response.body()));
    }

    private String authorize(ImageReference image, String challenge, RegistryAuthContext authContext) throws IOException, InterruptedException, DigestResolutionException {
        if (challenge == null) {
            throw new DigestResolutionException("Registry " + image.registry() + " requires authentication but sent no challenge");
        }

        RegistryCredentials credentials = credentialsProvider.credentialsFor(authContext, image.registry());

        if (challenge.regionMatches(true, 0, "Basic", 0, 5)) {
            if (credentials.isAnonymous()) {
                throw new DigestResolutionException("Registry " + image.registry() + " requires credentials for " + image.repository());
            }
            return credentials.basicAuthorization();
        } else if (challenge.regionMatches(true, 0, "Bearer", 0, 6)) {
            return "Bearer " + fetchToken(image, parseChallenge(challenge), credentials);
        } else {
            throw new DigestResolutionException("Unsupported authentication challenge from registry " + image.registry() + ": " + challenge);
        }
    }

    private String fetchToken(ImageReference image, Map<String, String> params, RegistryCredentials credentials) throws IOException, InterruptedException, DigestResolutionException {
        String realm = params.get("realm");
        if (realm == null) {
            throw new DigestResolutionException("Bearer challenge of registry " + image.registry() + " has no realm");
        }

        StringBuilder uri = new StringBuilder(realm)
                .append(realm.contains("?") ? '&' : '?')
                .append("scope=").append(encode("repository:" + image.repository() + ":pull"));
        if (params.containsKey("service")) {
            uri.append("&service=").append(encode(params.get("service")));
        }

        HttpResponse<byte[]> response = send(URI.create(uri.toString()), "GET", credentials.isAnonymous() ? null : credentials.basicAuthorization());
        if (response.statusCode() != 200) {
            throw new DigestResolutionException("Token request to " + realm + " failed with status " + response.statusCode());
        }

        JsonNode body = MAPPER.readTree(response.body());
        String token = body.path("token").asText(null);
        if (token == null || token.isEmpty()) {
            token = body.path("access_token").asText(null);
        }
        if (token == null || token.isEmpty()) {
            throw new DigestResolutionException("Token response from " + realm + " does not contain a token");
        }

        return token;
    }

    /* test */ static Map<String, String> parseChallenge(String challenge) {
        Map<String, String> params = new HashMap<>();
        Matcher matcher = CHALLENGE_PARAM.matcher(challenge);
        while (matcher.find()) {
            params.put(matcher.group(1), matcher.group(2));
        }
        return params;
    }

    private HttpResponse<byte[]> send(URI uri, String method, String authorization) throws IOException, InterruptedException {
        HttpRequest.Builder request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Accept", MANIFEST_ACCEPT)
                .method(method, HttpRequest.BodyPublishers.noBody());
        if (authorization != null) {
            request.header("Authorization", authorization);
        }

        return httpClient.send(request.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    private static void checkStatus(ImageReference image, HttpResponse<byte[]> response) throws DigestResolutionException {
        switch (response.statusCode()) {
            case 200:
                return;
            case 401:
            case 403:
                throw new DigestResolutionException("Access to " + image + " was denied with status " + response.statusCode());
            case 404:
                throw new DigestResolutionException("Manifest of " + image + " not found");
            default:
                throw new DigestResolutionException("Registry " + image.registry() + " responded with status " + response.statusCode());
        }
    }

    /* test */ String scheme(String registry) {
        String host = registry.contains(":") ? registry.substring(0, registry.indexOf(':')) : registry;
        if (insecureRegistries.contains(registry) || "localhost".equals(host) || "127.0.0.1".equals(host)) {
            return "http";
        } else {
            return "https";
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String sha256(byte[] body) throws DigestResolutionException {
        try {
            return "sha256:" + HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new DigestResolutionException("SHA-256 is not available", e);
        }
    }
}
