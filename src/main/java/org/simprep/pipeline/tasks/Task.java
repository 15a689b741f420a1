package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;

import java.io.IOException;

/**
 * A unit of work in a pipeline. Consumes one state and produces the next.
 */
public interface Task {

    /**
     * Runs the task.
     *
     * @param input state produced by the preceding task; never modified
     * @param context position of the task, working directory and engine access
     * @return the new state
     * @throws IOException if a file the task reads or writes cannot be accessed
     * @throws org.simprep.pipeline.PipelineException on any fatal task failure
     */
    StateHandle run(StateHandle input, TaskContext context) throws IOException;
}
