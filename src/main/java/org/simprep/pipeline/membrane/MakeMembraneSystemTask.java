package org.simprep.pipeline.membrane;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.tasks.AbstractTask;
import org.simprep.pipeline.tasks.TaskSpec;

import java.io.IOException;

/**
 * Builds a membrane system, optionally around the structure carried by the input state.
 * <p>
 * Compositions and templates are checked before anything runs.
 */
public class MakeMembraneSystemTask extends AbstractTask<TaskSpec.MakeMembraneSystem> {

    private MembranePatchBuilder builder;

    public MakeMembraneSystemTask(TaskSpec.MakeMembraneSystem spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        if (spec.embed() != null) {
            requireTopology(input);
        }
        spec.bilayer().validate();
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        builder = new MembranePatchBuilder(spec.bilayer(), context);
        builder.prepare();
        log.info("Building {} bilayer", spec.bilayer().isAsymmetric() ? "asymmetric" : "symmetric");
        StateHandle output = builder.build(input);
        log.info("Membrane system ready: {}", output.basename());
        return output;
    }

    /**
     * @return the builder of the last run, or null before the task has run
     */
    MembranePatchBuilder builder() {
        return builder;
    }
}
