package org.simprep.pipeline.tasks;

import java.util.regex.Pattern;

/**
 * A task as listed in a pipeline: its parameters and the label that appears in every
 * artifact name it produces.
 *
 * @param label artifact label, defaults to the kind's configuration key
 * @param spec kind-specific parameters
 */
public record TaskDescriptor(String label, TaskSpec spec) {

    private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9_.+]+");

    public TaskDescriptor {
        if (spec == null) {
            throw new IllegalArgumentException("Task descriptor needs parameters");
        }
        if (label == null) {
            label = spec.kind().configKey();
        }
        if (!LABEL.matcher(label).matches()) {
            throw new IllegalArgumentException("Task label '" + label + "' may only contain letters, digits, '_', '.' and '+'");
        }
    }

    public static TaskDescriptor of(TaskSpec spec) {
        return new TaskDescriptor(null, spec);
    }

    public TaskKind kind() {
        return spec.kind();
    }
}
