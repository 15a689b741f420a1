package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.NamdConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.TreeMap;

/**
 * Runs one minimization or dynamics stage with NAMD.
 * <p>
 * The stage starts from the binary coordinates and velocities of the previous stage when
 * present and continues its timestep count. Pressure-controlled ensembles need a periodic
 * box; NPT and NPAT use a flexible cell with constant xy ratio, NPAT additionally holds the
 * lateral area fixed.
 */
public class RunDynamicsTask extends AbstractTask<TaskSpec.RunDynamics> {

    public RunDynamicsTask(TaskSpec.RunDynamics spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
        if (spec.ensemble().isPressureControlled()) {
            requireBox(input);
        }
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        String basename = context.nextBasename();
        NamdConfig config = new NamdConfig();
        config.banner(basename + " " + spec.ensemble());
        DynamicsConfigs.standardSections(config, input, context.settings().parameterFiles(), basename,
            spec.temperature(), spec.timestep());
        ensembleSection(config);

        Map<String, String> extra = new TreeMap<>(spec.otherParameters());
        if (!extra.isEmpty()) {
            config.comment("user parameters");
            extra.forEach(config::set);
        }

        config.comment("run");
        if (spec.ensemble() == Ensemble.MINIMIZE) {
            config.set("minimize", spec.nsteps());
        } else {
            config.set("run", spec.nsteps());
        }

        context.runScript(Engine.NAMD, config, basename);

        Path coor = context.requireArtifact(context.file(basename, "coor"));
        Path vel = context.requireArtifact(context.file(basename, "vel"));
        Path xsc = input.hasBox() ? context.requireArtifact(context.file(basename, "xsc")) : null;
        log.info("{} of {} steps done; outputs {}", spec.ensemble(), spec.nsteps(), basename);

        StateHandle.Builder builder = input.toBuilder()
            .coor(coor)
            .vel(vel)
            .xsc(xsc)
            .firstTimestep(input.firstTimestep() + spec.nsteps());
        return context.finish(builder, basename);
    }

    private void ensembleSection(NamdConfig config) {
        Ensemble ensemble = spec.ensemble();
        if (ensemble == Ensemble.MINIMIZE) {
            return;
        }
        config.comment("thermostat");
        config.set("langevin", true);
        config.set("langevinDamping", 5.0);
        config.set("langevinTemp", spec.temperature());
        config.set("langevinHydrogen", false);
        if (!ensemble.isPressureControlled()) {
            return;
        }
        config.comment("barostat");
        config.set("useGroupPressure", true);
        config.set("useFlexibleCell", true);
        config.set("useConstantRatio", true);
        if (ensemble.isConstantArea()) {
            config.set("useConstantArea", true);
        }
        config.set("langevinPiston", true);
        config.set("langevinPistonTarget", spec.pressure());
        config.set("langevinPistonPeriod", 100.0);
        config.set("langevinPistonDecay", 50.0);
        config.set("langevinPistonTemp", spec.temperature());
    }
}
