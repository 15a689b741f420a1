package org.simprep.pipeline.controller;

import org.simprep.pipeline.engines.EngineRunner;
import org.simprep.pipeline.tasks.TaskDispatcher;

import java.nio.file.Path;

/**
 * What every controller of one run shares: the working directory, the engine launcher,
 * the run settings, the task dispatcher and the listener.
 *
 * @param workDir directory holding every artifact of the run
 * @param engines launcher for external engines
 * @param settings run-wide settings
 * @param dispatcher maps task descriptors to task implementations
 * @param listener observer of task execution
 */
public record PipelineEnvironment(
    Path workDir,
    EngineRunner engines,
    PipelineSettings settings,
    TaskDispatcher dispatcher,
    TaskListener listener
) {

    public PipelineEnvironment(Path workDir, EngineRunner engines, PipelineSettings settings) {
        this(workDir, engines, settings, new TaskDispatcher(), TaskListener.NONE);
    }

    public PipelineEnvironment withListener(TaskListener listener) {
        return new PipelineEnvironment(workDir, engines, settings, dispatcher, listener);
    }
}
