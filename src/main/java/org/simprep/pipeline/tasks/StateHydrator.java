package org.simprep.pipeline.tasks;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.Provenance;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.structure.PdbStructure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Builds a {@link StateHandle} from files that already exist, as needed to resume a run.
 * Open loops recorded next to the connectivity file are restored as pending gaps.
 */
public final class StateHydrator {

    private StateHydrator() {
    }

    /**
     * Hydrates a state. Relative paths are resolved against the working directory.
     *
     * @param workDir the working directory
     * @param psf connectivity file, required
     * @param pdb coordinate file, required
     * @param xsc box file, or null
     * @param coor binary coordinates, or null
     * @param vel binary velocities, or null
     * @param firstTimestep timestep the next dynamics stage starts at
     * @param provenance provenance recorded in the handle
     * @return the hydrated state
     * @throws ConfigurationException if a required file is not given, any given file does not exist
     *                                or the loop record is malformed
     * @throws IOException if the coordinate file cannot be read
     */
    public static StateHandle hydrate(Path workDir, Path psf, Path pdb, Path xsc, Path coor, Path vel,
                                      long firstTimestep, Provenance provenance) throws IOException {
        if (psf == null || pdb == null) {
            throw new ConfigurationException("Resuming needs both a psf and a pdb file");
        }
        Path psfFile = existing(workDir, psf);
        Path pdbFile = existing(workDir, pdb);
        StateHandle.Builder builder = StateHandle.empty().toBuilder()
            .psf(psfFile)
            .pdb(pdbFile)
            .xsc(xsc == null ? null : existing(workDir, xsc))
            .coor(coor == null ? null : existing(workDir, coor))
            .vel(vel == null ? null : existing(workDir, vel))
            .firstTimestep(firstTimestep)
            .provenance(provenance)
            .basename(stem(psfFile))
            .pendingLoopGaps(loops(psfFile));
        for (String chain : PdbStructure.read(pdbFile).chainIds()) {
            builder.chainId(chain, chain);
        }
        return builder.build();
    }

    private static List<LoopGap> loops(Path psf) throws IOException {
        try {
            return LoopGap.readRecord(psf);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Loop record " + LoopGap.recordFor(psf).getFileName() + ": "
                + e.getMessage(), e);
        }
    }

    private static Path existing(Path workDir, Path file) {
        Path resolved = workDir.resolve(file);
        if (!Files.isRegularFile(resolved)) {
            throw new ConfigurationException("File to resume from does not exist: " + resolved);
        }
        return resolved;
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
