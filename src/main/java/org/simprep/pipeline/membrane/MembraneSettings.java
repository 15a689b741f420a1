package org.simprep.pipeline.membrane;

import com.typesafe.config.Config;
import org.simprep.pipeline.ConfigurationException;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Species data for membrane building: where the template conformers live, which atoms
 * mark lipid heads and tails, and molecular weights used to size the solvent chambers.
 *
 * @param templateDir directory holding {@code <NAME>/<NAME>-<conformer>.pdb}
 * @param solutionDensity density of the chamber solution in g/cm^3
 * @param species data per residue name
 */
public record MembraneSettings(Path templateDir, double solutionDensity, Map<String, Species> species) {

    private static final double AVOGADRO_PER_A3_CC = 0.60221408;

    /**
     * @param headAtoms atom names marking the head group, empty for solvent and ions
     * @param tailAtoms atom names marking the tail ends, empty for solvent and ions
     * @param mass molecular weight in g/mol
     */
    public record Species(List<String> headAtoms, List<String> tailAtoms, double mass) {
        public Species {
            headAtoms = List.copyOf(headAtoms);
            tailAtoms = List.copyOf(tailAtoms);
        }
    }

    public MembraneSettings {
        species = Map.copyOf(species);
    }

    /**
     * Reads the {@code simprep.membrane} section.
     */
    public static MembraneSettings fromConfig(Config membrane) {
        Map<String, Species> species = new LinkedHashMap<>();
        Config speciesConfig = membrane.getConfig("species");
        for (String name : speciesConfig.root().keySet()) {
            Config c = speciesConfig.getConfig(name);
            species.put(name, new Species(
                c.hasPath("head") ? c.getStringList("head") : List.of(),
                c.hasPath("tail") ? c.getStringList("tail") : List.of(),
                c.getDouble("mass")));
        }
        return new MembraneSettings(Path.of(membrane.getString("template-dir")),
            membrane.getDouble("solution-density"), species);
    }

    /**
     * @param name residue name
     * @return the species data
     * @throws ConfigurationException if the species is not configured
     */
    public Species species(String name) {
        Species s = species.get(name);
        if (s == null) {
            throw new ConfigurationException("No species data for " + name + "; add it under simprep.membrane.species");
        }
        return s;
    }

    /**
     * @return volume one molecule of the species occupies in solution, in cubic Angstrom
     */
    public double molecularVolume(String name) {
        return species(name).mass() / (solutionDensity * AVOGADRO_PER_A3_CC);
    }
}
