package org.simprep.pipeline.tasks;

import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.ChainIdAllocator;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.tasks.Modifications.Disulfide;
import org.simprep.pipeline.tasks.Modifications.Graft;
import org.simprep.pipeline.tasks.Modifications.Mutation;
import org.simprep.pipeline.tasks.Modifications.ResidueRange;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds connectivity and coordinates from the source structure with psfgen.
 * <p>
 * Each source chain becomes one segment, with deletions cut out of its coordinates and
 * mutations applied inside the segment. Grafts become new segments whose chain ids come from
 * a {@link ChainIdAllocator} owned by this task run. Configured loops are left open and
 * recorded in the output state so a ligation can close them.
 */
public class BuildTopologyTask extends AbstractTask<TaskSpec.BuildTopology> {

    private Set<String> sourceChains;

    public BuildTopologyTask(TaskSpec.BuildTopology spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireCoordinates(input);
        try {
            sourceChains = PdbStructure.read(input.pdb()).chainIds();
        } catch (IOException e) {
            throw new StateInconsistencyException("Cannot read source structure " + input.pdb().getFileName()
                + ": " + e.getMessage());
        }
        for (Mutation m : spec.mutations()) {
            requireChain(m.chain(), "mutation");
        }
        for (ResidueRange d : spec.deletions()) {
            requireChain(d.chain(), "deletion");
        }
        for (Disulfide s : spec.disulfides()) {
            requireChain(s.chainA(), "disulfide");
            requireChain(s.chainB(), "disulfide");
        }
        for (Graft g : spec.grafts()) {
            requireChain(g.chain(), "graft");
        }
        for (LoopGap gap : spec.loops()) {
            requireChain(gap.chainId(), "loop");
        }
    }

    private void requireChain(String chain, String what) {
        if (!sourceChains.contains(chain)) {
            throw new StateInconsistencyException("The " + what + " refers to chain " + chain
                + " which is not in the structure (chains: " + String.join(",", sourceChains) + ")");
        }
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        ChainIdAllocator allocator = new ChainIdAllocator(sourceChains);
        Map<String, String> chainMap = new LinkedHashMap<>();

        String basename = context.nextBasename();
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.loadCoordinates(input.pdb());

        for (String chain : sourceChains) {
            buildChain(script, basename, chain);
            chainMap.put(chain, input.chainIdMap().getOrDefault(chain, chain));
        }
        for (Graft graft : spec.grafts()) {
            String glycanChain = allocator.next();
            String glycanFile = graft.source().getFileName().toString();
            script.comment("graft " + glycanFile + " onto " + graft.chain() + ":" + graft.resid());
            script.addline("segment " + glycanChain + " {");
            script.addline("pdb " + context.workDir().resolve(graft.source()), 1);
            script.addline("}");
            script.addline("coordpdb " + context.workDir().resolve(graft.source()) + " " + glycanChain);
            script.addline("patch NGLB " + graft.chain() + ":" + graft.resid() + " " + glycanChain + ":1");
            chainMap.put(graft.chain() + ":" + graft.resid(), glycanChain);
        }
        for (Disulfide ss : spec.disulfides()) {
            script.addline("patch DISU " + ss.chainA() + ":" + ss.residA() + " " + ss.chainB() + ":" + ss.residB());
        }
        for (LoopGap gap : spec.loops()) {
            script.comment("open loop " + gap + " left for ligation");
        }
        script.addline("guesscoord");
        script.writeState(basename);
        script.exit();

        context.runScript(Engine.PSFGEN, script, basename);
        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        if (!spec.loops().isEmpty()) {
            log.info("{} open loop(s) await ligation: {}", spec.loops().size(), spec.loops());
        }

        StateHandle.Builder builder = input.toBuilder()
            .structure(psf, pdb)
            .xsc(null)
            .chainIdMap(chainMap)
            .pendingLoopGaps(spec.loops());
        return context.finish(builder, basename);
    }

    private void buildChain(PsfgenScript script, String basename, String chain) {
        StringBuilder selection = new StringBuilder("chain " + chain + " and not water");
        for (ResidueRange d : spec.deletions()) {
            if (d.chain().equals(chain)) {
                selection.append(" and not (resid ").append(d.first()).append(" to ").append(d.last()).append(")");
            }
        }
        String chainPdb = basename + "-" + chain + ".pdb";
        script.addline("set sel [atomselect top \"" + selection + "\"]");
        script.addline("$sel writepdb " + chainPdb);
        script.addline("segment " + chain + " {");
        script.addline("pdb " + chainPdb, 1);
        for (Mutation m : spec.mutations()) {
            if (m.chain().equals(chain)) {
                script.addline("mutate " + m.resid() + " " + m.resname(), 1);
            }
        }
        script.addline("}");
        script.addline("coordpdb " + chainPdb + " " + chain);
    }
}
