package org.simprep.pipeline.tasks;

import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Base class for tasks: checks preconditions on the input state before any work starts,
 * then delegates to {@link #execute}. Open loops of the output are recorded next to its
 * connectivity file so that a run resumed from those files still sees them.
 *
 * @param <S> parameter record of the task kind
 */
public abstract class AbstractTask<S extends TaskSpec> implements Task {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final S spec;

    protected AbstractTask(S spec) {
        this.spec = spec;
    }

    @Override
    public final StateHandle run(StateHandle input, TaskContext context) throws IOException {
        checkPreconditions(input, context);
        StateHandle output = execute(input, context);
        if (output.hasPendingLoops() && output.psf() != null) {
            LoopGap.writeRecord(output.psf(), output.pendingLoopGaps());
        }
        return output;
    }

    /**
     * Verifies the input state meets this task's needs. No engine may be started here.
     *
     * @throws StateInconsistencyException if a precondition does not hold
     */
    protected void checkPreconditions(StateHandle input, TaskContext context) {
    }

    protected abstract StateHandle execute(StateHandle input, TaskContext context) throws IOException;

    protected void requireTopology(StateHandle input) {
        if (!input.hasTopology()) {
            throw new StateInconsistencyException(spec.kind().configKey()
                + " needs a built structure (psf and pdb) but none is present; run psfgen or restart first");
        }
    }

    protected void requireCoordinates(StateHandle input) {
        if (input.pdb() == null) {
            throw new StateInconsistencyException(spec.kind().configKey()
                + " needs a coordinate file but none is present; run fetch or restart first");
        }
    }

    protected void requireBox(StateHandle input) {
        if (!input.hasBox()) {
            throw new StateInconsistencyException(spec.kind().configKey()
                + " needs a periodic box but the system has none; solvate or build a membrane first");
        }
    }
}
