/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

public class RegistryDigestResolverTest {
    private static final String MANIFEST = "{\"schemaVersion\": 2, \"layers\": []}";
    private static final RegistryAuthContext AUTH_CONTEXT = new RegistryAuthContext("my-namespace", "builder");
    private static final RegistryCredentials CREDENTIALS = new RegistryCredentials("user", "secret");

    private FakeRegistry registry;
    private RegistryCredentialsProvider credentialsProvider;
    private RegistryDigestResolver resolver;

    @BeforeEach
    public void setUp() throws Exception {
        registry = new FakeRegistry();
        registry.start();

        credentialsProvider = mock(RegistryCredentialsProvider.class);
        when(credentialsProvider.credentialsFor(any(), any())).thenReturn(CREDENTIALS);

        resolver = new RegistryDigestResolver(credentialsProvider, Set.of(), Duration.ofSeconds(5));
    }

    @AfterEach
    public void tearDown() throws Exception {
        registry.stop();
    }

    @Test
    public void testAnonymousResolutionFromHeader() throws DigestResolutionException {
        String digest = registry.addManifest("riff/square", "v1", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + digest));
        assertThat(registry.requests, contains("HEAD /v2/riff/square/manifests/v1"));
        verifyNoInteractions(credentialsProvider);
    }

    @Test
    public void testDefaultTagIsLatest() throws DigestResolutionException {
        String digest = registry.addManifest("riff/square", "latest", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + digest));
    }

    @Test
    public void testDigestIsComputedWithoutHeader() throws DigestResolutionException {
        registry.sendDigestHeader = false;
        registry.addManifest("riff/square", "v1", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + FakeRegistry.sha256(MANIFEST.getBytes(StandardCharsets.UTF_8))));
        assertThat(registry.requests, contains("HEAD /v2/riff/square/manifests/v1", "GET /v2/riff/square/manifests/v1"));
    }

    @Test
    public void testBearerTokenFlow() throws DigestResolutionException {
        registry.auth = FakeRegistry.Auth.BEARER;
        registry.expectedBasicAuthorization = CREDENTIALS.basicAuthorization();
        String digest = registry.addManifest("riff/square", "v1", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + digest));
        assertThat(registry.requests, contains(
                "HEAD /v2/riff/square/manifests/v1",
                "GET /token Basic",
                "HEAD /v2/riff/square/manifests/v1 Bearer"));
        assertThat(registry.tokenQueries.get(0), containsString("scope=repository%3Ariff%2Fsquare%3Apull"));
        assertThat(registry.tokenQueries.get(0), containsString("service=" + FakeRegistry.SERVICE));
        verify(credentialsProvider).credentialsFor(eq(AUTH_CONTEXT), eq(registry.host()));
    }

    @Test
    public void testAnonymousBearerToken() throws DigestResolutionException {
        when(credentialsProvider.credentialsFor(any(), any())).thenReturn(RegistryCredentials.ANONYMOUS);
        registry.auth = FakeRegistry.Auth.BEARER;
        String digest = registry.addManifest("riff/square", "v1", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + digest));
        assertThat(registry.requests.get(1), is("GET /token"));
    }

    @Test
    public void testRejectedTokenRequest() {
        registry.auth = FakeRegistry.Auth.BEARER;
        registry.expectedBasicAuthorization = new RegistryCredentials("user", "other").basicAuthorization();
        registry.addManifest("riff/square", "v1", MANIFEST);

        DigestResolutionException e = assertThrows(DigestResolutionException.class,
            () -> resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of()));

        assertThat(e.getMessage(), containsString("failed with status 401"));
    }

    @Test
    public void testBasicAuthentication() throws DigestResolutionException {
        registry.auth = FakeRegistry.Auth.BASIC;
        registry.expectedBasicAuthorization = CREDENTIALS.basicAuthorization();
        String digest = registry.addManifest("riff/square", "v1", MANIFEST);

        String resolved = resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of());

        assertThat(resolved, is(registry.host() + "/riff/square@" + digest));
        assertThat(registry.requests, contains("HEAD /v2/riff/square/manifests/v1", "HEAD /v2/riff/square/manifests/v1 Basic"));
    }

    @Test
    public void testBasicAuthenticationWithoutCredentials() throws DigestResolutionException {
        when(credentialsProvider.credentialsFor(any(), any())).thenReturn(RegistryCredentials.ANONYMOUS);
        registry.auth = FakeRegistry.Auth.BASIC;
        registry.addManifest("riff/square", "v1", MANIFEST);

        DigestResolutionException e = assertThrows(DigestResolutionException.class,
            () -> resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of()));

        assertThat(e.getMessage(), containsString("requires credentials"));
    }

    @Test
    public void testMissingManifest() {
        DigestResolutionException e = assertThrows(DigestResolutionException.class,
            () -> resolver.resolve(registry.host() + "/riff/missing:v1", AUTH_CONTEXT, Set.of()));

        assertThat(e.getMessage(), containsString("not found"));
    }

    @Test
    public void testSkippedRegistryIsNotContacted() throws DigestResolutionException {
        assertThat(resolver.resolve("dev.local/square:v1", AUTH_CONTEXT, Set.of("ko.local", "dev.local")), is("dev.local/square:v1"));
        assertThat(resolver.resolve(registry.host() + "/riff/square:v1", AUTH_CONTEXT, Set.of(registry.host())), is(registry.host() + "/riff/square:v1"));

        assertThat(registry.requests, is(empty()));
        verifyNoInteractions(credentialsProvider);
    }

    @Test
    public void testDigestReferenceIsNotContacted() throws DigestResolutionException {
        String image = registry.host() + "/riff/square@sha256:" + "a".repeat(64);

        assertThat(resolver.resolve(image, AUTH_CONTEXT, Set.of()), is(image));
        assertThat(registry.requests, is(empty()));
    }

    @Test
    public void testInvalidReference() {
        assertThrows(DigestResolutionException.class, () -> resolver.resolve("Not A Valid/Image", AUTH_CONTEXT, Set.of()));
    }

    @Test
    public void testScheme() {
        RegistryDigestResolver insecure = new RegistryDigestResolver(credentialsProvider, Set.of("registry.internal:5000"), Duration.ofSeconds(1));

        assertThat(insecure.scheme("registry.internal:5000"), is("http"));
        assertThat(insecure.scheme("localhost:5000"), is("http"));
        assertThat(insecure.scheme("127.0.0.1"), is("http"));
        assertThat(insecure.scheme("gcr.io"), is("https"));
        assertThat(insecure.scheme("registry.internal"), is("https"));
    }

    @Test
    public void testParseChallenge() {
        Map<String, String> params = RegistryDigestResolver.parseChallenge("Bearer realm=\"https://auth.docker.io/token\",service=\"registry.docker.io\",scope=\"repository:library/ubuntu:pull\"");

        assertThat(params.get("realm"), is("https://auth.docker.io/token"));
        assertThat(params.get("service"), is("registry.docker.io"));
        assertThat(params.get("scope"), is("repository:library/ubuntu:pull"));
    }
}
