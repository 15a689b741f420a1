package org.simprep.pipeline.tasks;

import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.ColvarsConfig;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.NamdConfig;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PdbAtom;
import org.simprep.pipeline.structure.PdbStructure;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Closes the open loops left by topology building.
 * <p>
 * For each pending gap the carbonyl carbon of the gap's last residue and the amide nitrogen
 * of the following residue are pulled together by steered dynamics. A psfgen step then
 * patches the peptide bond across each gap. The output state has no pending gaps.
 */
public class LigateTask extends AbstractTask<TaskSpec.Ligate> {

    public LigateTask(TaskSpec.Ligate spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
        if (!input.hasPendingLoops()) {
            throw new StateInconsistencyException(
                "ligate needs at least one unresolved loop left by psfgen, but the structure has none");
        }
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        PdbStructure structure = PdbStructure.read(input.pdb());
        List<PdbAtom> atoms = structure.atoms();

        String steerName = context.nextBasename("steer");
        ColvarsConfig colvars = new ColvarsConfig();
        colvars.banner(steerName);
        List<String> names = new ArrayList<>();
        List<Double> starts = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (LoopGap gap : input.pendingLoopGaps()) {
            int carbon = atomNumber(atoms, gap.chainId(), gap.lastResid(), "C");
            int nitrogen = atomNumber(atoms, gap.chainId(), gap.lastResid() + 1, "N");
            String name = "gap_" + gap.chainId() + "_" + gap.lastResid();
            colvars.distance(name, carbon, nitrogen);
            names.add(name);
            starts.add(atoms.get(carbon - 1).distanceTo(atoms.get(nitrogen - 1)));
            targets.add(spec.targetDistance());
        }
        colvars.movingHarmonic(names, starts, targets, spec.forceConstant(), spec.steerSteps());
        Path colvarsFile = colvars.writeTo(context.workDir(), steerName);

        NamdConfig steer = new NamdConfig();
        steer.banner(steerName);
        DynamicsConfigs.standardSections(steer, input, context.settings().parameterFiles(), steerName,
            spec.temperature(), 1.0);
        steer.set("langevin", true);
        steer.set("langevinDamping", 5.0);
        steer.set("langevinTemp", spec.temperature());
        steer.set("colvars", true);
        steer.set("colvarsConfig", colvarsFile.getFileName());
        steer.set("run", spec.steerSteps());
        context.runScript(Engine.NAMD, steer, steerName);
        Path steeredCoor = context.requireArtifact(context.file(steerName, "coor"));
        log.info("Steered {} gap(s) to {} A", names.size(), spec.targetDistance());

        StateHandle steered = input.toBuilder().coor(steeredCoor).vel(null).build();
        String healName = context.nextBasename("heal");
        PsfgenScript heal = new PsfgenScript();
        heal.banner(healName);
        heal.begin(context.settings().topologies());
        heal.loadState(steered);
        for (LoopGap gap : input.pendingLoopGaps()) {
            String c = gap.chainId();
            int r = gap.lastResid();
            heal.addline(String.format("patch HEAL %s:%d %s:%d %s:%d %s:%d", c, r - 1, c, r, c, r + 1, c, r + 2));
        }
        heal.writeState(healName);
        heal.exit();
        context.runScript(Engine.PSFGEN, heal, healName);

        Path psf = context.requireArtifact(context.file(healName, "psf"));
        Path pdb = context.requireArtifact(context.file(healName, "pdb"));
        StateHandle.Builder builder = input.toBuilder()
            .structure(psf, pdb)
            .pendingLoopGaps(List.of());
        return context.finish(builder, healName);
    }

    private static int atomNumber(List<PdbAtom> atoms, String chain, int resid, String name) {
        for (int i = 0; i < atoms.size(); i++) {
            PdbAtom a = atoms.get(i);
            if (a.resid() == resid && a.name().equals(name)
                && (chain.equals(a.chain()) || chain.equals(a.segname()))) {
                return i + 1;
            }
        }
        throw new StateInconsistencyException("No atom " + name + " in residue " + chain + ":" + resid
            + " to ligate across");
    }
}
