/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.knative;

import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.projectriff.api.model.knative.Deployer;
import io.projectriff.api.model.knative.IngressPolicy;
import io.projectriff.api.model.thirdparty.knative.serving.Configuration;
import io.projectriff.api.model.thirdparty.knative.serving.ConfigurationSpec;
import io.projectriff.api.model.thirdparty.knative.serving.RevisionTemplateSpec;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnedFields;
import io.projectriff.operator.common.model.ResourceUtils;
import io.projectriff.operator.common.reconciler.ChildDefinition;

import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Knative configuration running the image of a deployer. Configurations use generated names, so a deployer may find
 * several of them and keeps the newest. The owned fields are the pod fields compared by {@link OwnedFields}, the
 * labels in {@link #ownedLabelKeys(Map)} and the annotations in {@link #ownedAnnotationKeys(Map)}, on the
 * configuration as well as on its revision template.
 */
class ConfigurationDefinition implements ChildDefinition<Deployer, Configuration> {
    static final String ANNOTATION_MIN_SCALE = "autoscaling.knative.dev/minScale";
    static final String ANNOTATION_MAX_SCALE = "autoscaling.knative.dev/maxScale";
    static final String LABEL_VISIBILITY = "serving.knative.dev/visibility";
    static final String VISIBILITY_CLUSTER_LOCAL = "cluster-local";

    private static final Set<String> SCALE_ANNOTATIONS = Set.of(ANNOTATION_MIN_SCALE, ANNOTATION_MAX_SCALE);

    @Override
    public String childKind() {
        return Configuration.RESOURCE_KIND;
    }

    @Override
    public Labels selector(Deployer owner) {
        return Labels.forLabel(Deployer.LABEL_KEY, owner.getMetadata().getName());
    }

    @Override
    public Configuration desired(Deployer owner) {
        String image = owner.getStatus().getLatestImage();
        if (image == null || image.isEmpty()) {
            return null;
        }

        Map<String, String> labels = labels(owner);
        Map<String, String> annotations = annotations(owner);

        ObjectMeta templateMetadata = owner.getSpec().getTemplate().getMetadata();
        RevisionTemplateSpec template = new RevisionTemplateSpec();
        template.setMetadata(new ObjectMetaBuilder()
                .withLabels(Util.mergeLabelsOrAnnotations(templateMetadata != null ? templateMetadata.getLabels() : null, labels))
                .withAnnotations(Util.mergeLabelsOrAnnotations(templateMetadata != null ? templateMetadata.getAnnotations() : null, annotations))
                .build());

        PodSpec podSpec = ResourceUtils.deepCopy(owner.getSpec().getTemplate().getSpec());
        podSpec.getContainers().get(0).setImage(image);
        template.setSpec(podSpec);

        ConfigurationSpec spec = new ConfigurationSpec();
        spec.setTemplate(template);

        Configuration configuration = new Configuration();
        configuration.setMetadata(new ObjectMetaBuilder()
                .withGenerateName(owner.getMetadata().getName() + "-deployer-")
                .withLabels(labels)
                .withAnnotations(annotations)
                .build());
        configuration.setSpec(spec);
        return configuration;
    }

    private Map<String, String> labels(Deployer owner) {
        Map<String, String> labels = Util.mergeLabelsOrAnnotations(owner.getMetadata().getLabels(), selector(owner).toMap());
        if (owner.getSpec().getIngressPolicy() == IngressPolicy.ClusterLocal) {
            labels.put(LABEL_VISIBILITY, VISIBILITY_CLUSTER_LOCAL);
        }
        return labels;
    }

    private static Map<String, String> annotations(Deployer owner) {
        Map<String, String> annotations = Util.mergeLabelsOrAnnotations(owner.getMetadata().getAnnotations());
        if (owner.getSpec().getMinScale() != null) {
            annotations.put(ANNOTATION_MIN_SCALE, String.valueOf(owner.getSpec().getMinScale()));
        }
        if (owner.getSpec().getMaxScale() != null) {
            annotations.put(ANNOTATION_MAX_SCALE, String.valueOf(owner.getSpec().getMaxScale()));
        }
        return annotations;
    }

    /**
     * @param desiredAnnotations  Annotations of the desired configuration
     *
     * @return  Annotation keys managed by the deployer. The scale annotations are always managed so that they are
     *          removed when the scale bounds are unset.
     */
    static Set<String> ownedAnnotationKeys(Map<String, String> desiredAnnotations) {
        Set<String> keys = new HashSet<>(SCALE_ANNOTATIONS);
        if (desiredAnnotations != null) {
            keys.addAll(desiredAnnotations.keySet());
        }
        return keys;
    }

    /**
     * @param desiredLabels  Labels of the desired configuration
     *
     * @return  Label keys managed by the deployer. Knative adds its own labels (the route of a configuration) which
     *          are left alone.
     */
    static Set<String> ownedLabelKeys(Map<String, String> desiredLabels) {
        Set<String> keys = new HashSet<>(Set.of(LABEL_VISIBILITY));
        if (desiredLabels != null) {
            keys.addAll(desiredLabels.keySet());
        }
        return keys;
    }

    @Override
    public boolean semanticEquals(Configuration desired, Configuration actual) {
        ObjectMeta desiredMetadata = desired.getMetadata();
        ObjectMeta actualMetadata = actual.getMetadata();

        if (!OwnedFields.mapMatches(desiredMetadata.getLabels(), actualMetadata.getLabels(), ownedLabelKeys(desiredMetadata.getLabels()))
                || !OwnedFields.mapMatches(desiredMetadata.getAnnotations(), actualMetadata.getAnnotations(), ownedAnnotationKeys(desiredMetadata.getAnnotations()))) {
            return false;
        }

        RevisionTemplateSpec desiredTemplate = desired.getSpec().getTemplate();
        RevisionTemplateSpec actualTemplate = actual.getSpec() != null ? actual.getSpec().getTemplate() : null;
        if (actualTemplate == null) {
            return false;
        }

        ObjectMeta desiredTemplateMetadata = desiredTemplate.getMetadata();
        ObjectMeta actualTemplateMetadata = actualTemplate.getMetadata() != null ? actualTemplate.getMetadata() : new ObjectMeta();

        return OwnedFields.mapMatches(desiredTemplateMetadata.getLabels(), actualTemplateMetadata.getLabels(), ownedLabelKeys(desiredTemplateMetadata.getLabels()))
                && OwnedFields.mapMatches(desiredTemplateMetadata.getAnnotations(), actualTemplateMetadata.getAnnotations(), ownedAnnotationKeys(desiredTemplateMetadata.getAnnotations()))
                && OwnedFields.podSpecMatches(desiredTemplate.getSpec(), actualTemplate.getSpec());
    }

    @Override
    public Configuration mergeOwnedFields(Configuration desired, Configuration actualCopy) {
        ObjectMeta desiredMetadata = desired.getMetadata();
        ObjectMeta metadata = actualCopy.getMetadata();
        metadata.setLabels(OwnedFields.mergeMap(desiredMetadata.getLabels(), metadata.getLabels(), ownedLabelKeys(desiredMetadata.getLabels())));
        metadata.setAnnotations(OwnedFields.mergeMap(desiredMetadata.getAnnotations(), metadata.getAnnotations(), ownedAnnotationKeys(desiredMetadata.getAnnotations())));

        RevisionTemplateSpec desiredTemplate = desired.getSpec().getTemplate();
        RevisionTemplateSpec template = actualCopy.getSpec() != null ? actualCopy.getSpec().getTemplate() : null;
        if (template == null || template.getSpec() == null) {
            actualCopy.setSpec(desired.getSpec());
            return actualCopy;
        }

        ObjectMeta desiredTemplateMetadata = desiredTemplate.getMetadata();
        ObjectMeta templateMetadata = template.getMetadata() != null ? template.getMetadata() : new ObjectMeta();
        templateMetadata.setLabels(OwnedFields.mergeMap(desiredTemplateMetadata.getLabels(), templateMetadata.getLabels(), ownedLabelKeys(desiredTemplateMetadata.getLabels())));
        templateMetadata.setAnnotations(OwnedFields.mergeMap(desiredTemplateMetadata.getAnnotations(), templateMetadata.getAnnotations(), ownedAnnotationKeys(desiredTemplateMetadata.getAnnotations())));
        template.setMetadata(templateMetadata);

        OwnedFields.mergePodSpec(desiredTemplate.getSpec(), template.getSpec());
        return actualCopy;
    }
}
