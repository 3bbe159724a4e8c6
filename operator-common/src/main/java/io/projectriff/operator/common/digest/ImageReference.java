/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.digest;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parsed container image reference: {@code [registry/]repository[:tag][@digest]}.
 * <ul>
 *     <li>The first path component is the registry when it contains a dot or a colon or is {@code localhost}. Other
 *     references point to Docker Hub.</li>
 *     <li>Single component Docker Hub repositories get the {@code library/} prefix.</li>
 *     <li>References without a tag and without a digest use the {@code latest} tag.</li>
 * </ul>
 */
public final class ImageReference {
    /**
     * Registry host used for references without a registry
     */
    public static final String DOCKER_HUB = "index.docker.io";
    private static final String DOCKER_HUB_ALIAS = "docker.io";
    private static final String DEFAULT_TAG = "latest";

    private static final Pattern REPOSITORY = Pattern.compile("[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*(?:/[a-z0-9]+(?:(?:[._]|__|-+)[a-z0-9]+)*)*");
    private static final Pattern TAG = Pattern.compile("\\w[\\w.-]{0,127}");
    private static final Pattern DIGEST = Pattern.compile("[a-z0-9]+(?:[.+_-][a-z0-9]+)*:[a-fA-F0-9]{32,}");

    private final String registry;
    private final String repository;
    private final String tag;
    private final String digest;

    private ImageReference(String registry, String repository, String tag, String digest) {
        this.registry = registry;
        this.repository = repository;
        this.tag = tag;
        this.digest = digest;
    }

    /**
     * Parses the reference
     *
     * @param reference Image reference
     *
     * @return  The parsed reference
     *
     * @throws IllegalArgumentException when the reference is not valid
     */
    public static ImageReference parse(String reference) {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Image reference cannot be empty");
        }

        String rest = reference;
        String digest = null;
        int at = rest.indexOf('@');
        if (at >= 0) {
            digest = rest.substring(at + 1);
            rest = rest.substring(0, at);
            if (!DIGEST.matcher(digest).matches()) {
                throw new IllegalArgumentException("Invalid digest in image reference " + reference);
            }
        }

        String registry = DOCKER_HUB;
        int slash = rest.indexOf('/');
        if (slash > 0) {
            String first = rest.substring(0, slash);
            if (first.contains(".") || first.contains(":") || "localhost".equals(first)) {
                registry = DOCKER_HUB_ALIAS.equals(first) ? DOCKER_HUB : first;
                rest = rest.substring(slash + 1);
            }
        }

        String tag = null;
        int colon = rest.lastIndexOf(':');
        if (colon > rest.lastIndexOf('/')) {
            tag = rest.substring(colon + 1);
            rest = rest.substring(0, colon);
            if (!TAG.matcher(tag).matches()) {
                throw new IllegalArgumentException("Invalid tag in image reference " + reference);
            }
        }

        if (tag == null && digest == null) {
            tag = DEFAULT_TAG;
        }

        String repository = rest;
        if (!REPOSITORY.matcher(repository).matches()) {
            throw new IllegalArgumentException("Invalid repository in image reference " + reference);
        }
        if (DOCKER_HUB.equals(registry) && !repository.contains("/")) {
            repository = "library/" + repository;
        }

        return new ImageReference(registry, repository, tag, digest);
    }

    /**
     * @return  Registry host, optionally with a port
     */
    public String registry() {
        return registry;
    }

    /**
     * @return  Repository within the registry
     */
    public String repository() {
        return repository;
    }

    /**
     * @return  Tag or null
     */
    public String tag() {
        return tag;
    }

    /**
     * @return  Digest or null
     */
    public String digest() {
        return digest;
    }

    /**
     * @return  True when the reference is pinned to a digest
     */
    public boolean hasDigest() {
        return digest != null;
    }

    /**
     * @return  The digest if present, the tag otherwise. Used to address the manifest in the registry API.
     */
    public String identifier() {
        return digest != null ? digest : tag;
    }

    /**
     * @param digest    Digest of the image
     *
     * @return  Fully qualified reference of the image pinned to the digest
     */
    public String withDigest(String digest) {
        return registry + "/" + repository + "@" + digest;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ImageReference that = (ImageReference) o;
        return registry.equals(that.registry)
                && repository.equals(that.repository)
                && Objects.equals(tag, that.tag)
                && Objects.equals(digest, that.digest);
    }

    @Override
    public int hashCode() {
        return Objects.hash(registry, repository, tag, digest);
    }

    @Override
    public String toString() {
        return registry + "/" + repository + (tag != null ? ":" + tag : "") + (digest != null ? "@" + digest : "");
    }
}
