package org.simprep.pipeline;

import java.util.regex.Pattern;

/**
 * Derives the name of every intermediate artifact a pipeline writes.
 * <p>
 * Names have the form {@code CC-MT-ST_label[-extra][.ext]} where {@code CC} is the dotted
 * controller id, {@code MT} the task index and {@code ST} the subtask index, both zero-padded
 * to two digits. The controller id contains only digits and dots and the label starts after
 * the first underscore, so two distinct (controller, task, subtask) triples can never yield
 * the same name. All methods are pure.
 */
public final class ArtifactNames {

    /** Largest index representable in a two-digit field. */
    public static final int MAX_INDEX = 99;

    private static final Pattern LABEL = Pattern.compile("[A-Za-z0-9_.+]+");
    private static final Pattern EXTRA = Pattern.compile("[A-Za-z0-9_.+-]+");

    private ArtifactNames() {
    }

    /**
     * Returns the artifact name for the given position, label and extension.
     *
     * @param controllerId id of the controller running the task
     * @param taskIndex index of the task within its controller (0..99)
     * @param subtaskIndex index of the subtask within the task (0..99)
     * @param label task label
     * @param ext extension without the leading dot, or {@code null} for a bare basename
     * @return the derived file name
     * @throws IllegalArgumentException if an index is out of range or the label is not usable
     */
    public static String nameFor(ControllerId controllerId, int taskIndex, int subtaskIndex, String label, String ext) {
        return withExtension(basename(controllerId, taskIndex, subtaskIndex, label, null), ext);
    }

    /**
     * Returns the basename (no extension) for the given position and label.
     *
     * @param controllerId id of the controller running the task
     * @param taskIndex index of the task within its controller (0..99)
     * @param subtaskIndex index of the subtask within the task (0..99)
     * @param label task label
     * @param extraLabel optional suffix appended as {@code -extra}, or {@code null}
     * @return the derived basename
     */
    public static String basename(ControllerId controllerId, int taskIndex, int subtaskIndex, String label, String extraLabel) {
        if (controllerId == null) {
            throw new IllegalArgumentException("Controller id must not be null");
        }
        checkIndex("task index", taskIndex);
        checkIndex("subtask index", subtaskIndex);
        if (label == null || !LABEL.matcher(label).matches()) {
            throw new IllegalArgumentException("Invalid artifact label: '" + label + "'");
        }
        String name = String.format("%s-%02d-%02d_%s", controllerId, taskIndex, subtaskIndex, label);
        if (extraLabel != null && !extraLabel.isEmpty()) {
            if (!EXTRA.matcher(extraLabel).matches()) {
                throw new IllegalArgumentException("Invalid extra label: '" + extraLabel + "'");
            }
            name = name + "-" + extraLabel;
        }
        return name;
    }

    /**
     * Appends an extension to a basename.
     *
     * @param basename the basename
     * @param ext extension without the leading dot, or {@code null}/empty for none
     * @return the file name
     */
    public static String withExtension(String basename, String ext) {
        if (ext == null || ext.isEmpty()) {
            return basename;
        }
        return basename + "." + ext;
    }

    static void checkIndex(String what, int index) {
        if (index < 0 || index > MAX_INDEX) {
            throw new IllegalArgumentException(
                what + " " + index + " is outside 0.." + MAX_INDEX + "; this indicates an orchestration bug");
        }
    }
}
