package org.simprep.pipeline.engines;

import org.simprep.pipeline.StateHandle;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Tcl script for the psfgen structure builder running inside VMD.
 * <p>
 * Paths handed to the script are reduced to file names since the engine runs in the
 * working directory that holds every artifact.
 */
public class PsfgenScript extends ScriptWriter {

    public PsfgenScript() {
        super("#");
    }

    @Override
    public String extension() {
        return "tcl";
    }

    /**
     * Loads psfgen and the topology files, and sets the residue and atom aliases that map
     * PDB naming onto force-field naming.
     */
    public PsfgenScript begin(List<Path> topologies) {
        addline("package require psfgen");
        addline("psfcontext reset");
        for (Path topology : topologies) {
            addline("topology " + topology);
        }
        addline("pdbalias residue HIS HSD");
        addline("pdbalias residue HOH TIP3");
        addline("pdbalias atom ILE CD1 CD");
        addline("pdbalias atom HOH O OH2");
        return this;
    }

    /**
     * Reads the handle's structure into psfgen and VMD as molecule {@code top}. Binary
     * coordinates, when present, replace the coordinates of the pdb.
     */
    public PsfgenScript loadState(StateHandle state) {
        String psf = fileName(state.psf());
        String pdb = fileName(state.pdb());
        if (state.coor() != null) {
            String coor = fileName(state.coor());
            addline("readpsf " + psf + " pdb " + pdb + " namdbin " + coor);
            addline("mol new " + psf);
            addline("mol addfile " + coor + " type namdbin waitfor all");
        } else {
            addline("readpsf " + psf + " pdb " + pdb);
            addline("mol new " + psf);
            addline("mol addfile " + pdb + " waitfor all");
        }
        return this;
    }

    /**
     * Loads a plain coordinate file into VMD only, as molecule {@code top}.
     */
    public PsfgenScript loadCoordinates(Path file) {
        addline("mol new " + fileName(file) + " waitfor all");
        return this;
    }

    public PsfgenScript writeState(String basename) {
        addline("regenerate angles dihedrals");
        addline("writepsf " + basename + ".psf");
        addline("writepdb " + basename + ".pdb");
        return this;
    }

    public PsfgenScript deleteResidue(String segname, int resid) {
        addline(String.format(Locale.ROOT, "delatom %s %d", segname, resid));
        return this;
    }

    public PsfgenScript exit() {
        addline("exit");
        return this;
    }

    public static String fileName(Path path) {
        return path.getFileName().toString();
    }
}
