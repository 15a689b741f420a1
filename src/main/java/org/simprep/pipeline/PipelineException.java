package org.simprep.pipeline;

/**
 * Base class of all fatal errors raised while a pipeline runs.
 * <p>
 * A pipeline error is raised by a task without knowing where in the controller tree it
 * runs. The controller that executes the failing task attaches the position (controller id,
 * task index and label) exactly once through {@link #locate(ControllerId, int, String)}; enclosing
 * controllers propagate the same instance unchanged, so the reported position is always the
 * innermost failing task.
 * <p>
 * This is a RuntimeException because none of these failures can be recovered from
 * automatically: engine runs may take hours and are never retried.
 */
public class PipelineException extends RuntimeException {

    private ControllerId controllerId;
    private int taskIndex = -1;
    private String taskLabel;

    /**
     * Creates a PipelineException with the specified message.
     *
     * @param message Description of the failure
     */
    public PipelineException(String message) {
        super(message);
    }

    /**
     * Creates a PipelineException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Attaches the position of the failing task. Has no effect if a position is already set.
     *
     * @param controllerId id of the controller running the task
     * @param taskIndex index of the task within that controller
     * @param taskLabel label of the task
     * @return this exception, for rethrowing
     */
    public PipelineException locate(ControllerId controllerId, int taskIndex, String taskLabel) {
        if (!isLocated()) {
            this.controllerId = controllerId;
            this.taskIndex = taskIndex;
            this.taskLabel = taskLabel;
        }
        return this;
    }

    public boolean isLocated() {
        return controllerId != null;
    }

    public ControllerId getControllerId() {
        return controllerId;
    }

    /**
     * @return the task index, or -1 if the error was raised outside any task
     */
    public int getTaskIndex() {
        return taskIndex;
    }

    public String getTaskLabel() {
        return taskLabel;
    }

    /**
     * Returns the human-readable report shown to the operator, naming the failing task's
     * position and label when known.
     *
     * @return the report line
     */
    public String describe() {
        if (!isLocated()) {
            return getMessage();
        }
        return String.format("Task %s:%02d '%s' failed: %s", controllerId, taskIndex, taskLabel, getMessage());
    }
}
