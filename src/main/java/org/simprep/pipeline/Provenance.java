package org.simprep.pipeline;

/**
 * Identifies the task step that produced a {@link StateHandle}.
 *
 * @param controllerId controller that ran the producing task
 * @param taskIndex index of the producing task
 * @param subtaskIndex index of the subtask that wrote the handle's files
 */
public record Provenance(ControllerId controllerId, int taskIndex, int subtaskIndex) {

    /** Provenance of a handle that no task produced yet. */
    public static Provenance initial() {
        return new Provenance(ControllerId.root(), 0, 0);
    }

    @Override
    public String toString() {
        return String.format("%s-%02d-%02d", controllerId, taskIndex, subtaskIndex);
    }
}
