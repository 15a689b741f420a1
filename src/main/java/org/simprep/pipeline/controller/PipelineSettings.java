package org.simprep.pipeline.controller;

import com.typesafe.config.Config;
import org.simprep.pipeline.membrane.MembraneSettings;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Run-wide settings shared by all tasks.
 *
 * @param topologies force-field topology files loaded by every structure-building script
 * @param parameterFiles force-field parameter files used by dynamics and shipped in the package
 * @param structureCache directory searched by fetch tasks for {@code <id>.pdb} or {@code <id>.cif}
 * @param checkAtomCounts verify psf/pdb atom counts agree before each task
 * @param membrane lipid templates and solvent data for membrane building
 */
public record PipelineSettings(
    List<Path> topologies,
    List<Path> parameterFiles,
    Path structureCache,
    boolean checkAtomCounts,
    MembraneSettings membrane
) {

    public PipelineSettings {
        topologies = List.copyOf(topologies);
        parameterFiles = List.copyOf(parameterFiles);
    }

    /**
     * Reads the settings from the {@code simprep} section of the configuration.
     *
     * @param config the resolved application configuration
     * @return the settings
     */
    public static PipelineSettings fromConfig(Config config) {
        Config root = config.getConfig("simprep");
        Path charmmDir = Path.of(root.getString("charmm.directory"));
        return new PipelineSettings(
            resolveAll(charmmDir, root.getStringList("charmm.topologies")),
            resolveAll(charmmDir, root.getStringList("charmm.parameters")),
            Path.of(root.getString("fetch.cache-dir")),
            root.getBoolean("pipeline.check-atom-counts"),
            MembraneSettings.fromConfig(root.getConfig("membrane"))
        );
    }

    private static List<Path> resolveAll(Path directory, List<String> names) {
        return names.stream().map(directory::resolve).collect(Collectors.toList());
    }
}
