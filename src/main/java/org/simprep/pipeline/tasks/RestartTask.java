package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;

import java.io.IOException;

/**
 * Replaces the current state with one read from existing files. No engine is run.
 */
public class RestartTask extends AbstractTask<TaskSpec.Restart> {

    public RestartTask(TaskSpec.Restart spec) {
        super(spec);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        StateHandle state = StateHydrator.hydrate(context.workDir(), spec.psf(), spec.pdb(), spec.xsc(),
            spec.coor(), spec.vel(), 0L, context.provenance());
        log.info("Restarting from {} / {}{}", state.psf().getFileName(), state.pdb().getFileName(),
            state.hasBox() ? " with box " + state.xsc().getFileName() : "");
        return state;
    }
}
