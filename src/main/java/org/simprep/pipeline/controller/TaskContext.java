package org.simprep.pipeline.controller;

import org.simprep.pipeline.ArtifactNames;
import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.EngineFailureException;
import org.simprep.pipeline.Provenance;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.EngineInvocation;
import org.simprep.pipeline.engines.EngineResult;
import org.simprep.pipeline.engines.ScriptWriter;
import org.simprep.pipeline.tasks.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Everything a running task may use: its position, the working directory, artifact naming,
 * engine invocation and sub-controller spawning.
 * <p>
 * One context exists per task execution. It hands out subtask indices in sequence, so every
 * basename a task draws is distinct from every other basename of the run.
 */
public final class TaskContext {

    private static final Logger log = LoggerFactory.getLogger(TaskContext.class);

    private final Controller controller;
    private final PipelineEnvironment environment;
    private final int taskIndex;
    private final TaskDescriptor descriptor;
    private int nextSubtask;
    private int lastSubtask;

    TaskContext(Controller controller, PipelineEnvironment environment, int taskIndex, TaskDescriptor descriptor) {
        this.controller = controller;
        this.environment = environment;
        this.taskIndex = taskIndex;
        this.descriptor = descriptor;
    }

    public ControllerId controllerId() {
        return controller.getId();
    }

    public int taskIndex() {
        return taskIndex;
    }

    public String label() {
        return descriptor.label();
    }

    public Path workDir() {
        return environment.workDir();
    }

    public PipelineSettings settings() {
        return environment.settings();
    }

    /**
     * Draws the next subtask index and returns the basename for it.
     *
     * @return {@code CC-MT-ST_label}
     */
    public String nextBasename() {
        return nextBasename(null);
    }

    /**
     * Draws the next subtask index and returns the basename for it with an extra label.
     *
     * @param extraLabel suffix distinguishing the subtask's purpose, or null
     * @return {@code CC-MT-ST_label-extra}
     */
    public String nextBasename(String extraLabel) {
        String basename = ArtifactNames.basename(controllerId(), taskIndex, nextSubtask, label(), extraLabel);
        lastSubtask = nextSubtask;
        nextSubtask++;
        return basename;
    }

    /**
     * @return provenance of the most recently drawn basename
     */
    public Provenance provenance() {
        return new Provenance(controllerId(), taskIndex, lastSubtask);
    }

    /**
     * Resolves an artifact in the working directory.
     */
    public Path file(String basename, String ext) {
        return workDir().resolve(ArtifactNames.withExtension(basename, ext));
    }

    /**
     * Stamps a derived state with the basename of the files it names and the current provenance.
     */
    public StateHandle finish(StateHandle.Builder builder, String basename) {
        return builder.basename(basename).provenance(provenance()).build();
    }

    /**
     * Verifies that an engine wrote an artifact.
     *
     * @param artifact expected file
     * @return the same file
     * @throws EngineFailureException if the file does not exist
     */
    public Path requireArtifact(Path artifact) {
        if (!Files.isRegularFile(artifact)) {
            throw new EngineFailureException("Expected artifact " + artifact.getFileName() + " was not written",
                -1, null);
        }
        return artifact;
    }

    /**
     * Writes a script as {@code basename.<ext>} and runs it with the given engine, logging to
     * {@code basename.log}. Blocks until the engine exits.
     *
     * @param engine engine to run
     * @param script the generated input
     * @param basename basename of the script and log
     * @return the engine result
     * @throws IOException if the script cannot be written
     * @throws EngineFailureException if the engine fails
     */
    public EngineResult runScript(Engine engine, ScriptWriter script, String basename) throws IOException {
        Path scriptFile = script.writeTo(workDir(), basename);
        if (log.isDebugEnabled()) {
            log.debug("Generated {}:\n{}", scriptFile.getFileName(), String.join("\n", script.lines()));
        }
        boolean stdin = engine.readsScriptFromStdin();
        EngineInvocation invocation = new EngineInvocation(
            engine,
            stdin ? List.of() : List.of(scriptFile.getFileName().toString()),
            workDir(),
            stdin ? scriptFile : null,
            file(basename, "log"),
            engine.toleratedExitCodes());
        return environment.engines().run(invocation);
    }

    /**
     * Runs a nested task list as a sub-controller of the controller running this task and
     * returns its final state. The sub-controller is discarded when this method returns.
     *
     * @param tasks nested task list
     * @param initial state handed to the first nested task
     * @return final state of the nested list
     */
    public StateHandle runSubController(List<TaskDescriptor> tasks, StateHandle initial) {
        return controller.runSubController(tasks, initial);
    }
}
