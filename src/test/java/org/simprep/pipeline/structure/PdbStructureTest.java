package org.simprep.pipeline.structure;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.pipeline.structure.PdbStructure.ResidueKey;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PdbStructureTest {

    @TempDir
    Path dir;

    @Test
    void readsFixedColumnsIncludingSegmentName() throws Exception {
        Path pdb = dir.resolve("p.pdb");
        TestStructures.writePdb(pdb, TestStructures.peptide("A"));

        PdbStructure structure = PdbStructure.read(pdb);

        assertThat(structure.atomCount()).isEqualTo(9);
        PdbAtom ca = structure.atoms().get(1);
        assertThat(ca.name()).isEqualTo("CA");
        assertThat(ca.resname()).isEqualTo("ALA");
        assertThat(ca.segname()).isEqualTo("A");
        assertThat(ca.x()).isCloseTo(5.4, within(1e-3));
        assertThat(structure.residues().keySet())
            .containsExactly(new ResidueKey("A", 1), new ResidueKey("A", 2), new ResidueKey("A", 3));
    }

    @Test
    void stopsAtTheEndOfTheFirstModel() throws Exception {
        Path pdb = dir.resolve("models.pdb");
        TestStructures.writePdb(pdb, TestStructures.peptide("A"));
        List<String> lines = Files.readAllLines(pdb);
        lines.add(4, "ENDMDL");
        Files.write(pdb, lines);

        assertThat(PdbStructure.read(pdb).atomCount()).isEqualTo(3);
    }

    @Test
    void chainIdsKeepFirstAppearanceOrderAndSkipBlanks() throws Exception {
        Path pdb = dir.resolve("chains.pdb");
        List<PdbAtom> atoms = new ArrayList<>(TestStructures.peptide("B"));
        atoms.addAll(TestStructures.peptide("A"));
        atoms.addAll(TestStructures.bilayer("POPC", "POPC", 1));
        TestStructures.writePdb(pdb, atoms);

        assertThat(PdbStructure.read(pdb).chainIds()).containsExactly("B", "A");
    }

    @Test
    void extentSpansAllAtoms() throws Exception {
        Path pdb = dir.resolve("bilayer.pdb");
        TestStructures.writePdb(pdb, TestStructures.bilayer("POPC", "POPE", 4));

        double[] e = PdbStructure.read(pdb).extent();

        assertThat(e).containsExactly(new double[]{0.0, 0.0, -20.0, 8.0, 8.0, 20.0}, within(1e-6));
    }

    @Test
    void malformedCoordinateNamesTheLine() throws IOException {
        Path pdb = dir.resolve("bad.pdb");
        Files.write(pdb, List.of("REMARK x",
            "ATOM      1 N    ALA A   1       abcdefgh   1.000   2.000  1.00  0.00      A"));

        assertThatThrownBy(() -> PdbStructure.read(pdb))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("bad.pdb:2");
    }
}
