package org.simprep.pipeline.structure;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PsfFileTest {

    @TempDir
    Path dir;

    @Test
    void countsAndWeighsTheAtomSection() throws Exception {
        Path psf = dir.resolve("p.psf");
        TestStructures.writePsf(psf, TestStructures.peptide("A"));

        assertThat(PsfFile.atomCount(psf)).isEqualTo(9);
        assertThat(PsfFile.totalMass(psf)).isCloseTo(108.0, within(1e-9));
    }

    @Test
    void truncatedAtomSectionIsAnError() throws Exception {
        Path psf = dir.resolve("short.psf");
        Files.write(psf, List.of("PSF", "", "         3 !NATOM",
            "         1 A        1        ALA      N        NH1   -0.470000       14.0070           0"));

        assertThatThrownBy(() -> PsfFile.totalMass(psf))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("after 1 of 3 atoms");
    }

    @Test
    void missingHeaderIsAnError() throws Exception {
        Path psf = dir.resolve("none.psf");
        Files.write(psf, List.of("PSF", "nothing"));

        assertThatThrownBy(() -> PsfFile.atomCount(psf)).hasMessageContaining("no !NATOM");
    }

    @Test
    void readsBondsAsZeroBasedPairsAcrossLines() throws Exception {
        Path psf = dir.resolve("bonded.psf");
        List<int[]> bonds = List.of(new int[]{0, 1}, new int[]{1, 2}, new int[]{2, 3}, new int[]{3, 4},
            new int[]{4, 5}, new int[]{6, 7});
        TestStructures.writePsf(psf, TestStructures.peptide("A"), bonds);

        List<int[]> read = PsfFile.bonds(psf);

        assertThat(read).hasSize(6);
        assertThat(read.get(0)).containsExactly(0, 1);
        assertThat(read.get(4)).containsExactly(4, 5);
        assertThat(read.get(5)).containsExactly(6, 7);
    }

    @Test
    void bondToAMissingAtomIsAnError() throws Exception {
        Path psf = dir.resolve("dangling.psf");
        TestStructures.writePsf(psf, TestStructures.peptide("A"), List.of(new int[]{0, 12}));

        assertThatThrownBy(() -> PsfFile.bonds(psf))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("bond names atom 13 of 9");
    }
}
