package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.ChainIdAllocator;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.tasks.Modifications.Site;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;

/**
 * Splits chains after the configured residues. Each C-terminal fragment becomes a new
 * segment whose chain id is drawn from an allocator seeded with the chains in use.
 */
public class CleaveTask extends AbstractTask<TaskSpec.Cleave> {

    private Set<String> chains;

    public CleaveTask(TaskSpec.Cleave spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
        try {
            chains = PdbStructure.read(input.pdb()).chainIds();
        } catch (IOException e) {
            throw new StateInconsistencyException("Cannot read " + input.pdb().getFileName() + ": " + e.getMessage());
        }
        for (Site site : spec.sites()) {
            if (!chains.contains(site.chain())) {
                throw new StateInconsistencyException("Cleavage site " + site.chain() + ":" + site.resid()
                    + " is on a chain that does not exist");
            }
        }
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        Set<String> inUse = new HashSet<>(chains);
        inUse.addAll(input.chainIdMap().values());
        ChainIdAllocator allocator = new ChainIdAllocator(inUse);
        StateHandle.Builder builder = input.toBuilder();

        String basename = context.nextBasename();
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.loadState(input);
        for (Site site : spec.sites()) {
            String fragment = allocator.next();
            String fragmentPdb = basename + "-" + fragment + ".pdb";
            script.comment("cleave " + site.chain() + " after " + site.resid() + " into new chain " + fragment);
            script.addline("set frag [atomselect top \"segname " + site.chain() + " and resid > " + site.resid() + "\"]");
            script.addline("$frag set chain " + fragment);
            script.addline("$frag set segname " + fragment);
            script.addline("$frag writepdb " + fragmentPdb);
            script.addline("foreach r [lsort -unique -integer [$frag get resid]] { delatom " + site.chain() + " $r }");
            script.addline("segment " + fragment + " {");
            script.addline("first NTER", 1);
            script.addline("last CTER", 1);
            script.addline("pdb " + fragmentPdb, 1);
            script.addline("}");
            script.addline("coordpdb " + fragmentPdb + " " + fragment);
            builder.chainId(site.chain() + ":" + (site.resid() + 1), fragment);
        }
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        return context.finish(builder.structure(psf, pdb), basename);
    }
}
