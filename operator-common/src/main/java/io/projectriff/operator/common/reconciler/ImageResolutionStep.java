/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.common.reconciler;

import io.projectriff.operator.common.Reconciliation;
import io.projectriff.operator.common.ReconciliationException;
import io.projectriff.operator.common.ReconciliationLogger;
import io.projectriff.operator.common.digest.DigestResolutionException;
import io.projectriff.operator.common.digest.DigestResolver;
import io.projectriff.operator.common.digest.RegistryAuthContext;
import io.projectriff.operator.common.model.ConditionManager;

import java.util.Set;

/**
 * Resolves the image of an owner to a digest and records failures on a condition of the owner
 */
public class ImageResolutionStep {
    private static final ReconciliationLogger LOGGER = ReconciliationLogger.create(ImageResolutionStep.class);

    /**
     * Reason of the condition marked False when the image cannot be resolved
     */
    public static final String REASON_IMAGE_MISSING = "ImageMissing";

    private final DigestResolver digestResolver;
    private final Set<String> skipRegistries;

    /**
     * Constructor
     *
     * @param digestResolver    Resolver of the digests
     * @param skipRegistries    Registries whose images are used as they are
     */
    public ImageResolutionStep(DigestResolver digestResolver, Set<String> skipRegistries) {
        this.digestResolver = digestResolver;
        this.skipRegistries = skipRegistries;
    }

    /**
     * Resolves the image. On failure the condition is marked False with the {@code ImageMissing} reason.
     *
     * @param reconciliation    Reconciliation of the owner
     * @param image             Image to resolve
     * @param authContext       Service account whose pull secrets are used
     * @param conditions        Conditions of the owner
     * @param conditionType     Condition marked on failure
     *
     * @return  The resolved image
     *
     * @throws ReconciliationException when the image cannot be resolved
     */
    public String resolve(Reconciliation reconciliation, String image, RegistryAuthContext authContext,
                          ConditionManager conditions, String conditionType) throws ReconciliationException {
        try {
            String resolved = digestResolver.resolve(image, authContext, skipRegistries);
            LOGGER.debugCr(reconciliation, "Image {} resolved to {}", image, resolved);
            return resolved;
        } catch (DigestResolutionException e) {
            conditions.markFalse(conditionType, REASON_IMAGE_MISSING, "Unable to fetch image \"%s\": %s", image, e.getMessage());
            throw new ReconciliationException("Unable to fetch image " + image, e);
        }
    }
}
