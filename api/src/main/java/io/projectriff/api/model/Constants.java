/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.api.model;

/**
 * API groups and versions of the riff custom resources and of the third-party resources riff creates
 */
public class Constants {
    private Constants() { }

    public static final String V1ALPHA1 = "v1alpha1";
    public static final String V1 = "v1";

    public static final String BUILD_GROUP = "build.projectriff.io";
    public static final String KNATIVE_GROUP = "knative.projectriff.io";
    public static final String STREAMING_GROUP = "streaming.projectriff.io";

    public static final String KNATIVE_BUILD_GROUP = "build.knative.dev";
    public static final String KNATIVE_SERVING_GROUP = "serving.knative.dev";

    public static final String BUILD_API_VERSION = BUILD_GROUP + "/" + V1ALPHA1;
    public static final String KNATIVE_API_VERSION = KNATIVE_GROUP + "/" + V1ALPHA1;
    public static final String STREAMING_API_VERSION = STREAMING_GROUP + "/" + V1ALPHA1;
    public static final String KNATIVE_BUILD_API_VERSION = KNATIVE_BUILD_GROUP + "/" + V1ALPHA1;
    public static final String KNATIVE_SERVING_API_VERSION = KNATIVE_SERVING_GROUP + "/" + V1;
}
