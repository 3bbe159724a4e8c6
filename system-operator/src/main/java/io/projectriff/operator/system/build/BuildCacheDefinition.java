/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.build;

import io.fabric8.kubernetes.api.model.PersistentVolumeClaim;
import io.fabric8.kubernetes.api.model.PersistentVolumeClaimBuilder;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.reconciler.ChildDefinition;

import java.util.Map;
import java.util.Objects;

/**
 * Persistent volume claim caching the build layers of a function build. It exists only when the function build sets
 * a cache size. The owned fields are the resource requirements and the labels.
 */
class BuildCacheDefinition implements ChildDefinition<FunctionBuild, PersistentVolumeClaim> {
    static final String KIND = "PersistentVolumeClaim";

    static String buildCacheName(FunctionBuild functionBuild) {
        return functionBuild.getMetadata().getName() + "-build-cache";
    }

    @Override
    public String childKind() {
        return KIND;
    }

    @Override
    public Labels selector(FunctionBuild owner) {
        return Labels.forLabel(FunctionBuild.LABEL_KEY, owner.getMetadata().getName());
    }

    @Override
    public PersistentVolumeClaim desired(FunctionBuild owner) {
        if (owner.getSpec() == null || owner.getSpec().getCacheSize() == null) {
            return null;
        }

        Map<String, String> labels = Util.mergeLabelsOrAnnotations(owner.getMetadata().getLabels(), selector(owner).toMap());

        return new PersistentVolumeClaimBuilder()
                .withNewMetadata()
                    .withName(buildCacheName(owner))
                    .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                    .withAccessModes("ReadWriteOnce")
                    .withNewResources()
                        .addToRequests("storage", owner.getSpec().getCacheSize())
                    .endResources()
                .endSpec()
                .build();
    }

    @Override
    public boolean semanticEquals(PersistentVolumeClaim desired, PersistentVolumeClaim actual) {
        return actual.getSpec() != null
                && Objects.equals(desired.getSpec().getResources(), actual.getSpec().getResources())
                && Objects.equals(desired.getMetadata().getLabels(), actual.getMetadata().getLabels());
    }

    @Override
    public PersistentVolumeClaim mergeOwnedFields(PersistentVolumeClaim desired, PersistentVolumeClaim actualCopy) {
        actualCopy.getSpec().setResources(desired.getSpec().getResources());
        actualCopy.getMetadata().setLabels(desired.getMetadata().getLabels());
        return actualCopy;
    }
}
