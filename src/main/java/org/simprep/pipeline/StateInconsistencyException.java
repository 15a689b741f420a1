package org.simprep.pipeline;

/**
 * Thrown when a task's precondition on its input {@link StateHandle} does not hold,
 * for example a ligation requested on a structure without unresolved loops.
 * Raised before the task invokes any engine.
 */
public class StateInconsistencyException extends PipelineException {

    public StateInconsistencyException(String message) {
        super(message);
    }
}
