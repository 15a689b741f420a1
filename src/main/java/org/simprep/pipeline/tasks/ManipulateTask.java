package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Applies rigid-body transforms to the coordinates. Connectivity is unchanged, so the
 * output keeps the input psf and gets a new pdb.
 */
public class ManipulateTask extends AbstractTask<TaskSpec.Manipulate> {

    public ManipulateTask(TaskSpec.Manipulate spec) {
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
        script.loadState(input);
        script.addline("set all [atomselect top all]");
        if (spec.orient()) {
            script.addline("package require Orient");
            script.addline("namespace import Orient::orient");
            script.addline("set I [draw principalaxes $all]");
            script.addline("$all move [orient $all [lindex $I 2] {0 0 1}]");
        }
        if (spec.center()) {
            script.addline("$all moveby [vecinvert [measure center $all weight mass]]");
        }
        double[] t = {spec.translate().get(0), spec.translate().get(1), spec.translate().get(2)};
        if (t[0] != 0 || t[1] != 0 || t[2] != 0) {
            script.addline(String.format(Locale.ROOT, "$all moveby {%.4f %.4f %.4f}", t[0], t[1], t[2]));
        }
        script.addline("$all writepdb " + basename + ".pdb");
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        return context.finish(input.toBuilder().structure(input.psf(), pdb), basename);
    }
}
