package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PdbStructure;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * Exchanges a residue range between two chains and rebuilds the affected segments.
 */
public class DomainSwapTask extends AbstractTask<TaskSpec.DomainSwap> {

    public DomainSwapTask(TaskSpec.DomainSwap spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
        if (spec.chainA().equals(spec.chainB())) {
            throw new StateInconsistencyException("Cannot swap a domain of chain " + spec.chainA() + " with itself");
        }
        Set<String> chains;
        try {
            chains = PdbStructure.read(input.pdb()).chainIds();
        } catch (IOException e) {
            throw new StateInconsistencyException("Cannot read " + input.pdb().getFileName() + ": " + e.getMessage());
        }
        if (!chains.contains(spec.chainA()) || !chains.contains(spec.chainB())) {
            throw new StateInconsistencyException("Domain swap needs chains " + spec.chainA() + " and "
                + spec.chainB() + " but the structure has " + String.join(",", chains));
        }
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        String basename = context.nextBasename();
        String range = "resid " + spec.first() + " to " + spec.last();
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.loadState(input);
        script.addline("set a [atomselect top \"segname " + spec.chainA() + " and " + range + "\"]");
        script.addline("set b [atomselect top \"segname " + spec.chainB() + " and " + range + "\"]");
        script.addline("$a set segname " + spec.chainB());
        script.addline("$a set chain " + spec.chainB());
        script.addline("$b set segname " + spec.chainA());
        script.addline("$b set chain " + spec.chainA());
        script.addline("resetpsf");
        script.addline("set all [atomselect top all]");
        script.addline("foreach seg [lsort -unique [$all get segname]] {");
        script.addline("set s [atomselect top \"segname $seg\"]", 1);
        script.addline("$s writepdb " + basename + "-$seg.pdb", 1);
        script.addline("segment $seg { pdb " + basename + "-$seg.pdb }", 1);
        script.addline("coordpdb " + basename + "-$seg.pdb $seg", 1);
        script.addline("}");
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        log.info("Swapped residues {}-{} between chains {} and {}", spec.first(), spec.last(), spec.chainA(), spec.chainB());
        return context.finish(input.toBuilder().structure(psf, pdb), basename);
    }
}
