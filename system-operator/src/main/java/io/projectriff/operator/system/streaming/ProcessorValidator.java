/*
 * Copyright riff authors.
 * License: Apache License 2.0 (see the file LICENSE or http://apache.org/licenses/LICENSE-2.0.html).
 */
package io.projectriff.operator.system.streaming;

import io.fabric8.kubernetes.api.model.Container;
import io.fabric8.kubernetes.api.model.PodSpec;
import io.projectriff.api.model.streaming.ProcessorSpec;
import io.projectriff.api.model.streaming.StreamBinding;
import io.projectriff.operator.common.model.ResourceUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates the spec of a processor after the defaults were applied. Each error names the offending field with its
 * path from the {@code spec} root.
 */
public class ProcessorValidator {
    /**
     * Name the function container of a processor template must have
     */
    public static final String FUNCTION_CONTAINER_NAME = "function";

    /**
     * Validates the spec
     *
     * @param spec  Spec of the processor (may be null)
     *
     * @return  Field errors, empty when the spec is valid
     */
    public List<String> validate(ProcessorSpec spec) {
        List<String> errors = new ArrayList<>();

        if (spec == null || spec.equals(new ProcessorSpec())) {
            errors.add(missingField("spec"));
            return errors;
        }

        PodSpec template = spec.getTemplate();
        Container function = template != null && template.getContainers() != null && !template.getContainers().isEmpty()
                ? template.getContainers().get(0) : null;

        if (function == null) {
            errors.add(missingField("spec.template.containers[0]"));
        } else {
            if (hasDisallowedFields(template)) {
                errors.add("disallowed field(s): spec.template: only serviceAccountName, containers[0] and volumes may be set");
            }

            if (!FUNCTION_CONTAINER_NAME.equals(function.getName())) {
                errors.add("invalid value: " + function.getName() + ": spec.template.containers[0].name");
            }
        }

        boolean hasFunctionRef = !isEmpty(spec.getFunctionRef());
        boolean hasImage = function != null && !isEmpty(function.getImage());
        if (!hasFunctionRef && !hasImage) {
            errors.add("expected exactly one, got neither: spec.functionRef, spec.template.containers[0].image");
        } else if (hasFunctionRef && hasImage) {
            errors.add("expected exactly one, got both: spec.functionRef, spec.template.containers[0].image");
        }

        if (spec.getInputs() == null || spec.getInputs().isEmpty()) {
            errors.add(missingField("spec.inputs"));
        } else {
            validateBindings("spec.inputs", spec.getInputs(), errors);
        }

        if (spec.getOutputs() != null) {
            validateBindings("spec.outputs", spec.getOutputs(), errors);
        }

        return errors;
    }

    private static void validateBindings(String path, List<StreamBinding> bindings, List<String> errors) {
        for (int i = 0; i < bindings.size(); i++) {
            StreamBinding binding = bindings.get(i);
            if (binding == null || isEmpty(binding.getStream())) {
                errors.add(missingField(path + "[" + i + "].stream"));
            }
            if (binding == null || isEmpty(binding.getAlias())) {
                errors.add(missingField(path + "[" + i + "].alias"));
            }
        }
    }

    /**
     * @return  True when the template sets fields other than the service account, the first container and the volumes
     */
    private static boolean hasDisallowedFields(PodSpec template) {
        PodSpec rest = ResourceUtils.deepCopy(template);
        rest.setServiceAccountName(null);
        rest.setVolumes(null);
        rest.setContainers(new ArrayList<>(template.getContainers().subList(1, template.getContainers().size())));

        PodSpec empty = new PodSpec();
        empty.setVolumes(null);
        empty.setContainers(new ArrayList<>());

        return !Objects.equals(empty, rest);
    }

    private static String missingField(String path) {
        return "missing field(s): " + path;
    }

    private static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }
}
