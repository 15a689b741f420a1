package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.structure.PeriodicBox;

import java.io.IOException;

/**
 * Hydrates the state of an interrupted dynamics run: structure, binary coordinates,
 * velocities and box, continuing the timestep count. When no first timestep is configured
 * it is taken from the step field of the box file.
 */
public class ContinuationTask extends AbstractTask<TaskSpec.Continuation> {

    public ContinuationTask(TaskSpec.Continuation spec) {
        super(spec);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        StateHandle state = StateHydrator.hydrate(context.workDir(), spec.psf(), spec.pdb(), spec.xsc(),
            spec.coor(), spec.vel(), 0L, context.provenance());
        long firstTimestep = spec.firstTimestep() >= 0 ? spec.firstTimestep() : PeriodicBox.readStep(state.xsc());
        log.info("Continuing dynamics of {} at timestep {}", state.basename(), firstTimestep);
        return state.toBuilder().firstTimestep(firstTimestep).build();
    }
}
