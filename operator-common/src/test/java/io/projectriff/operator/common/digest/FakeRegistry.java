/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import io.projectriff.test.TestUtils;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.util.Callback;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Docker Registry V2 serving manifests from memory. Access can be anonymous or protected by a Basic or a Bearer
 * challenge. The Bearer tokens are issued by the {@code /token} endpoint of the same server.
 */
class FakeRegistry {
    static final String TOKEN = "t0ken";
    static final String SERVICE = "fake-registry";

    enum Auth {
        ANONYMOUS, BASIC, BEARER
    }

    private final Server server;
    private final int port;
    private final Map<String, byte[]> manifests = new ConcurrentHashMap<>();

    final List<String> requests = new CopyOnWriteArrayList<>();
    final List<String> tokenQueries = new CopyOnWriteArrayList<>();

    volatile Auth auth = Auth.ANONYMOUS;
    volatile String expectedBasicAuthorization;
    volatile boolean sendDigestHeader = true;

    FakeRegistry() {
        this.port = TestUtils.getFreePort();
        this.server = new Server(port);
        this.server.setHandler(new RegistryHandler());
    }

    void start() throws Exception {
        server.start();
    }

    void stop() throws Exception {
        server.stop();
    }

    /**
     * @return  Registry host with port as used in image references
     */
    String host() {
        return "localhost:" + port;
    }

    /**
     * Adds a manifest under a tag
     *
     * @return  The digest of the manifest
     */
    String addManifest(String repository, String tag, String manifest) {
        byte[] body = manifest.getBytes(StandardCharsets.UTF_8);
        manifests.put(repository + ":" + tag, body);
        return sha256(body);
    }

    static String sha256(byte[] body) {
        try {
            return "sha256:" + HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    class RegistryHandler extends Handler.Abstract {
        @Override
        public boolean handle(Request request, Response response, Callback callback) {
            String path = request.getHttpURI().getPath();
            String authorization = request.getHeaders().get(HttpHeader.AUTHORIZATION);
            requests.add(request.getMethod() + " " + path + (authorization != null ? " " + authorization.split(" ")[0] : ""));

            if ("/token".equals(path)) {
                tokenQueries.add(request.getHttpURI().getQuery());

                if (expectedBasicAuthorization != null && !expectedBasicAuthorization.equals(authorization)) {
                    return respond(request, response, callback, HttpStatus.UNAUTHORIZED_401, null);
                }

                response.getHeaders().put(HttpHeader.CONTENT_TYPE, "application/json");
                return respond(request, response, callback, HttpStatus.OK_200, ("{\"token\": \"" + TOKEN + "\"}").getBytes(StandardCharsets.UTF_8));
            }

            if (auth == Auth.BEARER && !("Bearer " + TOKEN).equals(authorization)) {
                response.getHeaders().put(HttpHeader.WWW_AUTHENTICATE, "Bearer realm=\"http://" + host() + "/token\",service=\"" + SERVICE + "\"");
                return respond(request, response, callback, HttpStatus.UNAUTHORIZED_401, null);
            } else if (auth == Auth.BASIC && (authorization == null || !authorization.equals(expectedBasicAuthorization))) {
                response.getHeaders().put(HttpHeader.WWW_AUTHENTICATE, "Basic realm=\"" + SERVICE + "\"");
                return respond(request, response, callback, HttpStatus.UNAUTHORIZED_401, null);
            }

            int manifestsIndex = path.indexOf("/manifests/");
            if (!path.startsWith("/v2/") || manifestsIndex < 0) {
                return respond(request, response, callback, HttpStatus.NOT_FOUND_404, null);
            }

            String repository = path.substring("/v2/".length(), manifestsIndex);
            String tag = path.substring(manifestsIndex + "/manifests/".length());
            byte[] manifest = manifests.get(repository + ":" + tag);
            if (manifest == null) {
                return respond(request, response, callback, HttpStatus.NOT_FOUND_404, null);
            }

            response.getHeaders().put(HttpHeader.CONTENT_TYPE, "application/vnd.docker.distribution.manifest.v2+json");
            if (sendDigestHeader) {
                response.getHeaders().put("Docker-Content-Digest", sha256(manifest));
            }

            return respond(request, response, callback, HttpStatus.OK_200, manifest);
        }

        private boolean respond(Request request, Response response, Callback callback, int status, byte[] body) {
            response.setStatus(status);

            if (body == null || "HEAD".equals(request.getMethod())) {
                callback.succeeded();
            } else {
                response.write(true, ByteBuffer.wrap(body), callback);
            }

            return true;
        }
    }
}
