package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.engines.NamdConfig;
import org.simprep.pipeline.engines.PsfgenScript;

import java.nio.file.Path;
import java.util.List;

/**
 * Sections shared by every generated NAMD configuration.
 */
final class DynamicsConfigs {

    private DynamicsConfigs() {
    }

    /**
     * Writes input files, force field, nonbonded and output settings.
     *
     * @param config configuration to fill
     * @param input state the run starts from
     * @param parameterFiles force-field parameter files
     * @param outputName basename of the run's outputs
     * @param temperature initial temperature when no velocities are available
     * @param timestep timestep in fs
     */
    static void standardSections(NamdConfig config, StateHandle input, List<Path> parameterFiles,
                                 String outputName, double temperature, double timestep) {
        config.comment("input");
        config.set("structure", PsfgenScript.fileName(input.psf()));
        config.set("coordinates", PsfgenScript.fileName(input.pdb()));
        if (input.coor() != null) {
            config.set("bincoordinates", PsfgenScript.fileName(input.coor()));
        }
        if (input.vel() != null) {
            config.set("binvelocities", PsfgenScript.fileName(input.vel()));
        } else {
            config.set("temperature", temperature);
        }
        config.set("firsttimestep", input.firstTimestep());

        config.comment("force field");
        config.set("paraTypeCharmm", true);
        for (Path parameters : parameterFiles) {
            config.set("parameters", parameters);
        }
        config.set("exclude", "scaled1-4");
        config.set("1-4scaling", 1.0);
        config.set("cutoff", 12.0);
        config.set("switching", true);
        config.set("switchdist", 10.0);
        config.set("pairlistdist", 14.0);
        config.set("timestep", timestep);
        config.set("rigidBonds", "all");
        config.set("nonbondedFreq", 1);
        config.set("fullElectFrequency", 2);
        config.set("stepspercycle", 20);

        if (input.hasBox()) {
            config.comment("periodic cell");
            config.set("extendedSystem", PsfgenScript.fileName(input.xsc()));
            config.set("wrapAll", true);
            config.set("wrapWater", true);
            config.set("PME", true);
            config.set("PMEGridSpacing", 1.0);
        }

        config.comment("output");
        config.set("outputName", outputName);
        config.set("restartfreq", 1000);
        config.set("dcdfreq", 1000);
        config.set("xstFreq", 1000);
        config.set("outputEnergies", 100);
    }
}
