package org.simprep.pipeline;

import java.nio.file.Path;

/**
 * Thrown when an external engine exits with a non-tolerated status, cannot be started,
 * or returns without writing an artifact the task expected.
 * <p>
 * Artifacts already written stay in the working directory for inspection.
 */
public class EngineFailureException extends PipelineException {

    private final int exitCode;
    private final Path logFile;

    /**
     * Creates an EngineFailureException for a failed engine process.
     *
     * @param message Description of the failure
     * @param exitCode Exit status of the process, or -1 if it never ran to completion
     * @param logFile Log file the engine wrote, or null if none
     */
    public EngineFailureException(String message, int exitCode, Path logFile) {
        super(message);
        this.exitCode = exitCode;
        this.logFile = logFile;
    }

    /**
     * Creates an EngineFailureException that adds context to another engine failure.
     *
     * @param message Description of the failure
     * @param cause The engine failure being wrapped
     */
    public EngineFailureException(String message, EngineFailureException cause) {
        super(message, cause);
        this.exitCode = cause.exitCode;
        this.logFile = cause.logFile;
    }

    /**
     * Creates an EngineFailureException for a process that could not be run.
     *
     * @param message Description of the failure
     * @param cause The underlying exception
     */
    public EngineFailureException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
        this.logFile = null;
    }

    public int getExitCode() {
        return exitCode;
    }

    public Path getLogFile() {
        return logFile;
    }
}
