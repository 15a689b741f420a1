package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Removes every residue outside the keep selection and drops the periodic box.
 */
public class DesolvateTask extends AbstractTask<TaskSpec.Desolvate> {

    public DesolvateTask(TaskSpec.Desolvate spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        String basename = context.nextBasename();
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.loadState(input);
        script.addline("set drop [atomselect top \"not (" + spec.keepSelection() + ")\"]");
        script.addline("foreach sr [lsort -unique [$drop get {segname resid}]] {");
        script.addline("delatom [lindex $sr 0] [lindex $sr 1]", 1);
        script.addline("}");
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        log.info("Kept '{}'; box removed", spec.keepSelection());
        return context.finish(input.toBuilder().structure(psf, pdb).xsc(null), basename);
    }
}
