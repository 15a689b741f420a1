package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.structure.PeriodicBox;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Solvates and ionizes the system, then derives the periodic box from the extent of the
 * solvated coordinates.
 */
public class SolvateTask extends AbstractTask<TaskSpec.Solvate> {

    public SolvateTask(TaskSpec.Solvate spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        String basename = context.nextBasename();
        String solvated = basename + "-solv";
        String ionized = basename + "-ion";

        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.addline("package require solvate");
        script.addline("package require autoionize");
        script.addline(String.format(Locale.ROOT, "solvate %s %s -t %.3f -o %s",
            PsfgenScript.fileName(input.psf()), PsfgenScript.fileName(input.pdb()), spec.pad(), solvated));
        String salt = spec.saltConcentration() > 0
            ? String.format(Locale.ROOT, "-sc %.4f", spec.saltConcentration())
            : "-neutralize";
        script.addline(String.format("autoionize -psf %s.psf -pdb %s.pdb %s -cation %s -anion %s -o %s",
            solvated, solvated, salt, spec.cation(), spec.anion(), ionized));
        script.addline("resetpsf");
        script.addline("readpsf " + ionized + ".psf pdb " + ionized + ".pdb");
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));

        double[] e = PdbStructure.read(pdb).extent();
        PeriodicBox box = new PeriodicBox(e[3] - e[0], e[4] - e[1], e[5] - e[2],
            (e[0] + e[3]) / 2, (e[1] + e[4]) / 2, (e[2] + e[5]) / 2);
        Path xsc = context.file(basename, "xsc");
        box.write(xsc);
        log.info(String.format(Locale.ROOT, "Solvated box %.2f x %.2f x %.2f A", box.ax(), box.by(), box.cz()));

        return context.finish(input.toBuilder().structure(psf, pdb).xsc(xsc), basename);
    }
}
