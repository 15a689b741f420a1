package org.simprep.pipeline.tasks;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.Controller;
import org.simprep.pipeline.controller.TestPipelines;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.FakeEngineRunner;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class RunDynamicsTaskTest {

    @TempDir
    Path workDir;

    @Test
    void pressureControlWithoutBoxFailsBeforeNamdStarts() throws Exception {
        FakeEngineRunner engines = new FakeEngineRunner();
        Controller root = Controller.root(List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.NPT, 100)),
            TestPipelines.environment(workDir, engines));

        assertThatThrownBy(() -> root.run(TestPipelines.fetched(workDir)))
            .isInstanceOf(StateInconsistencyException.class);
        assertThat(engines.invocations(Engine.NAMD)).isEmpty();
    }

    @Test
    void minimizationWritesMinimizeAndAdvancesTheTimestep() throws Exception {
        Controller root = Controller.root(List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.MINIMIZE, 250)),
            TestPipelines.environment(workDir, new FakeEngineRunner()));

        StateHandle result = root.run(TestPipelines.fetched(workDir));

        String config = Files.readString(workDir.resolve("00-01-00_md.namd"));
        assertThat(config).containsPattern("(?m)^minimize\\s+250$").doesNotContainPattern("(?m)^run\\s");
        assertThat(result.firstTimestep()).isEqualTo(250);
        assertThat(result.vel().getFileName().toString()).isEqualTo("00-01-00_md.vel");
    }

    @Test
    void extraParametersAreWrittenVerbatim() throws Exception {
        TaskDescriptor md = TaskDescriptor.of(new TaskSpec.RunDynamics(Ensemble.NVT, 100, 310.0, 1.01325, 2.0,
            Map.of("outputEnergies", "50")));
        Controller root = Controller.root(List.of(TestPipelines.psfgen(), md),
            TestPipelines.environment(workDir, new FakeEngineRunner()));

        root.run(TestPipelines.fetched(workDir));

        assertThat(Files.readString(workDir.resolve("00-01-00_md.namd")))
            .containsPattern("(?m)^outputEnergies\\s+50$")
            .containsPattern("(?m)^run\\s+100$");
    }
}
