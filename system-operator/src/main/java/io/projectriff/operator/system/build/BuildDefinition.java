/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.build;

import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.Volume;
import io.fabric8.kubernetes.api.model.VolumeBuilder;
import io.projectriff.api.model.build.FunctionBuild;
import io.projectriff.api.model.build.FunctionBuildSpec;
import io.projectriff.api.model.thirdparty.knative.build.ArgumentSpec;
import io.projectriff.api.model.thirdparty.knative.build.Build;
import io.projectriff.api.model.thirdparty.knative.build.BuildSpec;
import io.projectriff.api.model.thirdparty.knative.build.GitSourceSpec;
import io.projectriff.api.model.thirdparty.knative.build.SourceSpec;
import io.projectriff.api.model.thirdparty.knative.build.TemplateInstantiationSpec;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnedFields;
import io.projectriff.operator.common.reconciler.ChildDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Knative build running the Cloud Native Buildpacks template for a function build. The owned fields are the spec
 * and the labels.
 */
class BuildDefinition implements ChildDefinition<FunctionBuild, Build> {
    static final String CACHE_VOLUME = "cache";

    private final String serviceAccountName;
    private final String templateName;

    BuildDefinition(String serviceAccountName, String templateName) {
        this.serviceAccountName = serviceAccountName;
        this.templateName = templateName;
    }

    static String buildName(FunctionBuild functionBuild) {
        return functionBuild.getMetadata().getName() + "-build";
    }

    @Override
    public String childKind() {
        return Build.RESOURCE_KIND;
    }

    @Override
    public Labels selector(FunctionBuild owner) {
        return Labels.forLabel(FunctionBuild.LABEL_KEY, owner.getMetadata().getName());
    }

    @Override
    public Build desired(FunctionBuild owner) {
        FunctionBuildSpec spec = owner.getSpec();

        List<ArgumentSpec> arguments = new ArrayList<>();
        arguments.add(new ArgumentSpec("IMAGE", spec.getImage()));
        arguments.add(new ArgumentSpec("CACHE", CACHE_VOLUME));
        addArgument(arguments, "FUNCTION_ARTIFACT", spec.getArtifact());
        addArgument(arguments, "FUNCTION_HANDLER", spec.getHandler());
        addArgument(arguments, "FUNCTION_LANGUAGE", spec.getInvoker());

        TemplateInstantiationSpec template = new TemplateInstantiationSpec();
        template.setName(templateName);
        template.setKind("ClusterBuildTemplate");
        template.setArguments(arguments);

        BuildSpec buildSpec = new BuildSpec();
        buildSpec.setServiceAccountName(serviceAccountName);
        buildSpec.setTemplate(template);
        buildSpec.setSource(source(spec));
        buildSpec.setVolumes(List.of(cacheVolume(owner)));

        Build build = new Build();
        build.setMetadata(new ObjectMetaBuilder()
                .withName(buildName(owner))
                .withLabels(Util.mergeLabelsOrAnnotations(owner.getMetadata().getLabels(), selector(owner).toMap()))
                .build());
        build.setSpec(buildSpec);
        return build;
    }

    private static void addArgument(List<ArgumentSpec> arguments, String name, String value) {
        if (value != null && !value.isEmpty()) {
            arguments.add(new ArgumentSpec(name, value));
        }
    }

    private static SourceSpec source(FunctionBuildSpec spec) {
        if (spec.getSource() == null) {
            return null;
        }

        SourceSpec source = new SourceSpec();
        source.setSubPath(spec.getSource().getSubPath());

        if (spec.getSource().getGit() != null) {
            GitSourceSpec git = new GitSourceSpec();
            git.setUrl(spec.getSource().getGit().getUrl());
            git.setRevision(spec.getSource().getGit().getRevision());
            source.setGit(git);
        }

        return source;
    }

    private static Volume cacheVolume(FunctionBuild owner) {
        if (owner.getSpec().getCacheSize() != null) {
            return new VolumeBuilder()
                    .withName(CACHE_VOLUME)
                    .withNewPersistentVolumeClaim()
                        .withClaimName(BuildCacheDefinition.buildCacheName(owner))
                    .endPersistentVolumeClaim()
                    .build();
        } else {
            return new VolumeBuilder()
                    .withName(CACHE_VOLUME)
                    .withNewEmptyDir()
                    .endEmptyDir()
                    .build();
        }
    }

    @Override
    public boolean semanticEquals(Build desired, Build actual) {
        return OwnedFields.matches(desired.getSpec(), actual.getSpec())
                && Objects.equals(desired.getMetadata().getLabels(), actual.getMetadata().getLabels());
    }

    @Override
    public Build mergeOwnedFields(Build desired, Build actualCopy) {
        actualCopy.setSpec(desired.getSpec());
        actualCopy.getMetadata().setLabels(desired.getMetadata().getLabels());
        return actualCopy;
    }
}
