/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.streaming;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.ContainerBuilder;
import io.fabric8.kubernetes.api.model.EnvVar;
import io.fabric8.kubernetes.api.model.EnvVarBuilder;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.DeploymentBuilder;
import io.projectriff.api.model.streaming.Processor;
import io.projectriff.api.model.streaming.StreamBinding;
import io.projectriff.operator.common.Util;
import io.projectriff.operator.common.model.Labels;
import io.projectriff.operator.common.model.OwnedFields;
import io.projectriff.operator.common.model.ResourceUtils;
import io.projectriff.operator.common.reconciler.ChildDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Deployment running the function of a processor next to the processor sidecar which reads the input streams, calls
 * the function and writes the output streams.
 */
class ProcessorDeploymentDefinition implements ChildDefinition<Processor, Deployment> {
    static final String KIND = "Deployment";
    static final String PROCESSOR_CONTAINER_NAME = "processor";
    static final String FUNCTION_ADDRESS = "localhost:8081";

    private final String processorImage;

    ProcessorDeploymentDefinition(String processorImage) {
        this.processorImage = processorImage;
    }

    static String deploymentName(Processor processor) {
        return processor.getMetadata().getName() + "-processor";
    }

    @Override
    public String childKind() {
        return KIND;
    }

    @Override
    public Labels selector(Processor owner) {
        return Labels.forLabel(Processor.LABEL_KEY, owner.getMetadata().getName());
    }

    @Override
    public Deployment desired(Processor owner) {
        String image = owner.getStatus().getLatestImage();
        if (image == null || image.isEmpty()) {
            return null;
        }

        Map<String, String> labels = Util.mergeLabelsOrAnnotations(owner.getMetadata().getLabels(), selector(owner).toMap());

        PodSpec podSpec = ResourceUtils.deepCopy(owner.getSpec().getTemplate());
        podSpec.getContainers().get(0).setImage(image);
        podSpec.getContainers().add(processorContainer(owner));

        return new DeploymentBuilder()
                .withNewMetadata()
                    .withName(deploymentName(owner))
                    .withLabels(labels)
                .endMetadata()
                .withNewSpec()
                    .withReplicas(1)
                    .withNewSelector()
                        .withMatchLabels(selector(owner).toMap())
                    .endSelector()
                    .withNewTemplate()
                        .withNewMetadata()
                            .withLabels(labels)
                        .endMetadata()
                        .withSpec(podSpec)
                    .endTemplate()
                .endSpec()
                .build();
    }

    private Container processorContainer(Processor owner) {
        List<StreamBinding> inputs = owner.getSpec().getInputs();
        List<StreamBinding> outputs = owner.getSpec().getOutputs() != null ? owner.getSpec().getOutputs() : List.of();

        List<EnvVar> env = new ArrayList<>();
        env.add(envVar("INPUTS", join(inputs, StreamBinding::getStream)));
        env.add(envVar("OUTPUTS", join(outputs, StreamBinding::getStream)));
        env.add(envVar("INPUT_NAMES", join(inputs, StreamBinding::getAlias)));
        env.add(envVar("OUTPUT_NAMES", join(outputs, StreamBinding::getAlias)));
        env.add(envVar("GROUP", owner.getMetadata().getName()));
        env.add(envVar("FUNCTION", FUNCTION_ADDRESS));

        return new ContainerBuilder()
                .withName(PROCESSOR_CONTAINER_NAME)
                .withImage(processorImage)
                .withEnv(env)
                .build();
    }

    private static EnvVar envVar(String name, String value) {
        return new EnvVarBuilder().withName(name).withValue(value).build();
    }

    private static String join(List<StreamBinding> bindings, Function<StreamBinding, String> field) {
        return bindings.stream().map(field).collect(Collectors.joining(","));
    }

    @Override
    public boolean semanticEquals(Deployment desired, Deployment actual) {
        if (actual.getSpec() == null || actual.getSpec().getTemplate() == null) {
            return false;
        }

        return OwnedFields.podSpecMatches(desired.getSpec().getTemplate().getSpec(), actual.getSpec().getTemplate().getSpec())
                && Objects.equals(templateLabels(desired), templateLabels(actual))
                && Objects.equals(desired.getMetadata().getLabels(), actual.getMetadata().getLabels());
    }

    @Override
    public Deployment mergeOwnedFields(Deployment desired, Deployment actualCopy) {
        if (actualCopy.getSpec() == null || actualCopy.getSpec().getTemplate() == null || actualCopy.getSpec().getTemplate().getSpec() == null) {
            actualCopy.setSpec(desired.getSpec());
        } else {
            OwnedFields.mergePodSpec(desired.getSpec().getTemplate().getSpec(), actualCopy.getSpec().getTemplate().getSpec());
            if (actualCopy.getSpec().getTemplate().getMetadata() == null) {
                actualCopy.getSpec().getTemplate().setMetadata(new ObjectMeta());
            }
            actualCopy.getSpec().getTemplate().getMetadata().setLabels(templateLabels(desired));
        }

        actualCopy.getMetadata().setLabels(desired.getMetadata().getLabels());
        return actualCopy;
    }

    private static Map<String, String> templateLabels(Deployment deployment) {
        ObjectMeta metadata = deployment.getSpec().getTemplate().getMetadata();
        return metadata != null ? metadata.getLabels() : null;
    }
}
