package org.simprep.pipeline.controller;

import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.tasks.TaskDescriptor;

/**
 * Observes task execution across the whole controller tree.
 */
public interface TaskListener {

    /** Listener that ignores all events. */
    TaskListener NONE = new TaskListener() {
    };

    /**
     * Called before a task starts, with the state it receives.
     */
    default void taskStarting(ControllerId controllerId, int taskIndex, TaskDescriptor task, StateHandle input) {
    }

    /**
     * Called after a task completed successfully, with the state it produced.
     */
    default void taskFinished(ControllerId controllerId, int taskIndex, TaskDescriptor task, StateHandle output) {
    }
}
