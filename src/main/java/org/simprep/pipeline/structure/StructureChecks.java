package org.simprep.pipeline.structure;

import org.simprep.pipeline.StateHandle;

import java.io.IOException;
import java.util.Optional;

/**
 * Consistency checks between the files of a {@link StateHandle}.
 */
public final class StructureChecks {

    private StructureChecks() {
    }

    /**
     * Compares the atom counts of the connectivity and coordinate files.
     *
     * @param state a state with topology
     * @return a description of the mismatch, or empty if the counts agree
     * @throws IOException if either file cannot be read
     */
    public static Optional<String> atomCountMismatch(StateHandle state) throws IOException {
        int psfAtoms = PsfFile.atomCount(state.psf());
        int pdbAtoms = PdbStructure.read(state.pdb()).atomCount();
        if (psfAtoms != pdbAtoms) {
            return Optional.of(String.format("%s declares %d atoms but %s holds %d",
                state.psf().getFileName(), psfAtoms, state.pdb().getFileName(), pdbAtoms));
        }
        return Optional.empty();
    }
}
