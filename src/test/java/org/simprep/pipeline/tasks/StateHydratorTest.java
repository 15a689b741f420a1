package org.simprep.pipeline.tasks;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.Provenance;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.structure.TestStructures;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class StateHydratorTest {

    @TempDir
    Path workDir;

    private final Provenance provenance = new Provenance(ControllerId.root(), 3, 0);

    @Test
    void hydratesRelativePathsAgainstTheWorkDirectory() throws Exception {
        TestStructures.writeStructure(workDir.resolve("00-02-00_solvate.psf"), workDir.resolve("00-02-00_solvate.pdb"),
            TestStructures.peptide("B"));

        StateHandle state = StateHydrator.hydrate(workDir, Path.of("00-02-00_solvate.psf"),
            Path.of("00-02-00_solvate.pdb"), null, null, null, 0, provenance);

        assertThat(state.psf()).isEqualTo(workDir.resolve("00-02-00_solvate.psf"));
        assertThat(state.basename()).isEqualTo("00-02-00_solvate");
        assertThat(state.chainIdMap()).containsEntry("B", "B");
        assertThat(state.coor()).isNull();
        assertThat(state.provenance()).isEqualTo(provenance);
    }

    @Test
    void missingFileIsAConfigurationError() throws Exception {
        TestStructures.writeStructure(workDir.resolve("a.psf"), workDir.resolve("a.pdb"), TestStructures.peptide("A"));

        assertThatThrownBy(() -> StateHydrator.hydrate(workDir, Path.of("a.psf"), Path.of("a.pdb"), null,
            Path.of("a.coor"), null, 0, provenance))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("a.coor");
    }

    @Test
    void restoresOpenLoopsRecordedBesideTheConnectivity() throws Exception {
        TestStructures.writeStructure(workDir.resolve("b.psf"), workDir.resolve("b.pdb"), TestStructures.peptide("A"));
        Files.writeString(workDir.resolve("b.loops"), "A:3-5\nA:9-9\n");

        StateHandle state = StateHydrator.hydrate(workDir, Path.of("b.psf"), Path.of("b.pdb"), null, null, null, 0,
            provenance);

        assertThat(state.pendingLoopGaps()).containsExactly(new LoopGap("A", 3, 5), new LoopGap("A", 9, 9));
    }

    @Test
    void malformedLoopRecordIsAConfigurationError() throws Exception {
        TestStructures.writeStructure(workDir.resolve("c.psf"), workDir.resolve("c.pdb"), TestStructures.peptide("A"));
        Files.writeString(workDir.resolve("c.loops"), "A:3\n");

        assertThatThrownBy(() -> StateHydrator.hydrate(workDir, Path.of("c.psf"), Path.of("c.pdb"), null, null, null,
            0, provenance))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("c.loops");
    }

    @Test
    void psfAndPdbAreBothRequired() {
        assertThatThrownBy(() -> StateHydrator.hydrate(workDir, Path.of("a.psf"), null, null, null, null, 0,
            provenance))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void stemDropsOnlyTheLastExtension() {
        assertThat(StateHydrator.stem(Path.of("dir/00-01-00_md.run.psf"))).isEqualTo("00-01-00_md.run");
    }
}
