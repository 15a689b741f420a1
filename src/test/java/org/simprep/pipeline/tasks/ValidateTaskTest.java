package org.simprep.pipeline.tasks;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.ValidationFailureException;
import org.simprep.pipeline.controller.Controller;
import org.simprep.pipeline.controller.TestPipelines;
import org.simprep.pipeline.engines.FakeEngineRunner;
import org.simprep.pipeline.structure.NamdBinCoordinates;
import org.simprep.pipeline.structure.PdbAtom;
import org.simprep.pipeline.structure.TestStructures;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

@Tag("unit")
class ValidateTaskTest {

    @TempDir
    Path workDir;

    private StateHandle stateOf(List<PdbAtom> atoms) throws Exception {
        Path pdb = workDir.resolve("input.pdb");
        TestStructures.writePdb(pdb, atoms);
        return StateHandle.empty().toBuilder().pdb(pdb).basename("input").chainId("A", "A").build();
    }

    private static List<PdbAtom> withClash() {
        List<PdbAtom> atoms = new ArrayList<>(TestStructures.peptide("A"));
        PdbAtom ca = atoms.get(1);
        atoms.add(new PdbAtom(atoms.size() + 1, "CB", "ALA", "A", ca.resid(), ca.x() + 0.1, ca.y(), ca.z(), "A"));
        return atoms;
    }

    private StateHandle run(TaskSpec.Validate spec, StateHandle input) {
        return Controller.root(List.of(TaskDescriptor.of(spec)),
            TestPipelines.environment(workDir, new FakeEngineRunner())).run(input);
    }

    @Test
    void cleanStructurePassesThroughUnchanged() throws Exception {
        StateHandle input = stateOf(TestStructures.peptide("A"));

        assertThat(run(new TaskSpec.Validate(0.5, true, true, 3.5), input)).isEqualTo(input);
    }

    @Test
    void closeContactFailsTheRun() throws Exception {
        StateHandle input = stateOf(withClash());

        ValidationFailureException e = catchThrowableOfType(
            () -> run(new TaskSpec.Validate(0.5, true, true, 3.5), input), ValidationFailureException.class);

        assertThat(e.getFindings()).hasSize(1);
        assertThat(e.getFindings().get(0)).contains("CA").contains("CB").contains("A:1");
        assertThat(e.getMessage()).startsWith("1 structural problem(s) found in input");
        assertThat(e.describe()).startsWith("Task 00:00 'validate' failed");
    }

    @Test
    void findingsOnlyWarnWhenFailOnErrorIsOff() throws Exception {
        StateHandle input = stateOf(withClash());

        assertThat(run(new TaskSpec.Validate(0.5, false, true, 3.5), input)).isEqualTo(input);
    }

    @Test
    void atomsStackedAtTheOriginAreReported() throws Exception {
        List<PdbAtom> atoms = new ArrayList<>(TestStructures.peptide("A"));
        atoms.add(new PdbAtom(10, "N", "GLY", "A", 4, 0.0, 0.0, 0.0, "A"));
        atoms.add(new PdbAtom(11, "N", "GLY", "A", 5, 0.0, 0.0, 0.0, "A"));
        StateHandle input = stateOf(atoms);

        ValidationFailureException e = catchThrowableOfType(
            () -> run(new TaskSpec.Validate(0.5, true, true, 3.5), input), ValidationFailureException.class);

        assertThat(e.getFindings()).anyMatch(f -> f.contains("2 atoms sit exactly at the origin"));
    }

    @Test
    void closeContactsAreMeasuredOnTheBinaryCoordinates() throws Exception {
        List<PdbAtom> atoms = TestStructures.peptide("A");
        double[][] collapsed = new double[atoms.size()][];
        for (int i = 0; i < collapsed.length; i++) {
            collapsed[i] = new double[]{5.0, 5.0, 5.0};
        }
        Path coor = workDir.resolve("input.coor");
        NamdBinCoordinates.write(coor, collapsed);
        StateHandle input = stateOf(atoms).toBuilder().coor(coor).build();

        ValidationFailureException e = catchThrowableOfType(
            () -> run(new TaskSpec.Validate(0.5, true, false, 3.5), input), ValidationFailureException.class);

        assertThat(e.getFindings()).hasSize(9);
        assertThat(e.getFindings()).allMatch(f -> f.contains("0.000 A apart"));
        assertThat(e.getFindings()).anyMatch(f -> f.contains("A:3"));
    }

    private StateHandle ringState() throws Exception {
        List<PdbAtom> atoms = new ArrayList<>();
        List<int[]> bonds = new ArrayList<>();
        for (int k = 0; k < 6; k++) {
            double angle = Math.toRadians(60.0 * k);
            atoms.add(new PdbAtom(k + 1, "C" + (k + 1), "BEN", "", 1,
                10 + 1.4 * Math.cos(angle), 10 + 1.4 * Math.sin(angle), 10, "RING"));
            bonds.add(new int[]{k, (k + 1) % 6});
        }
        atoms.add(new PdbAtom(7, "C1", "ROD", "", 2, 10, 10, 9.2, "LIP"));
        atoms.add(new PdbAtom(8, "C2", "ROD", "", 2, 10, 10, 10.8, "LIP"));
        bonds.add(new int[]{6, 7});
        Path psf = workDir.resolve("input.psf");
        TestStructures.writePsf(psf, atoms, bonds);
        return stateOf(atoms).toBuilder().psf(psf).build();
    }

    @Test
    void piercedRingFailsTheRun() throws Exception {
        StateHandle input = ringState();

        ValidationFailureException e = catchThrowableOfType(
            () -> run(new TaskSpec.Validate(0.5, true, true, 3.5), input), ValidationFailureException.class);

        assertThat(e.getFindings()).containsExactly("Ring of RING:1 is pierced by a bond of LIP:2");
    }

    @Test
    void piercedRingIsIgnoredWhenRingCheckIsOff() throws Exception {
        StateHandle input = ringState();

        assertThat(run(new TaskSpec.Validate(0.5, true, false, 3.5), input)).isEqualTo(input);
    }
}
