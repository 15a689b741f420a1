package org.simprep.pipeline.tasks;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.Controller;
import org.simprep.pipeline.controller.TestPipelines;
import org.simprep.pipeline.engines.FakeEngineRunner;

import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("integration")
class TerminateTaskTest {

    @TempDir
    Path workDir;

    private StateHandle runToPackage(boolean archive) throws Exception {
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.MINIMIZE, 100),
            TaskDescriptor.of(new TaskSpec.Terminate("my_system", archive)));
        return Controller.root(tasks, TestPipelines.environment(workDir, new FakeEngineRunner()))
            .run(TestPipelines.fetched(workDir));
    }

    @Test
    void finalFilesCarryTheConfiguredBasename() throws Exception {
        StateHandle result = runToPackage(false);

        assertThat(result.basename()).isEqualTo("my_system");
        assertThat(result.files()).extracting(p -> p.getFileName().toString())
            .containsExactlyInAnyOrder("my_system.psf", "my_system.pdb", "my_system.coor", "my_system.vel");
        assertThat(Files.readAllBytes(result.coor()))
            .isEqualTo(Files.readAllBytes(workDir.resolve("00-01-00_md.coor")));
        assertThat(workDir.resolve("my_system.zip")).doesNotExist();
    }

    @Test
    void archiveHoldsFilesParametersAndManifest() throws Exception {
        Files.writeString(workDir.resolve("par_all36m_prot.prm"), "* parameters\n");

        runToPackage(true);

        List<String> entries = new ArrayList<>();
        JsonObject manifest;
        try (ZipFile zip = new ZipFile(workDir.resolve("my_system.zip").toFile())) {
            Collections.list(zip.entries()).forEach(e -> entries.add(e.getName()));
            ZipEntry entry = zip.getEntry(TerminateTask.MANIFEST);
            try (InputStream in = zip.getInputStream(entry)) {
                manifest = JsonParser.parseString(new String(in.readAllBytes(), StandardCharsets.UTF_8))
                    .getAsJsonObject();
            }
        }

        assertThat(entries).contains("my_system.psf", "my_system.pdb", "my_system.coor", "my_system.vel",
            "parameters/par_all36m_prot.prm", "manifest.json");
        assertThat(manifest.get("basename").getAsString()).isEqualTo("my_system");
        assertThat(manifest.get("firstTimestep").getAsLong()).isEqualTo(100);
        assertThat(manifest.getAsJsonObject("chainIds").get("A").getAsString()).isEqualTo("A");
        assertThat(manifest.has("missingParameterFiles")).isFalse();
    }

    @Test
    void missingParameterFilesAreListedInTheManifest() throws Exception {
        runToPackage(false);

        JsonObject manifest = JsonParser.parseString(
            Files.readString(workDir.resolve("my_system-manifest.json"))).getAsJsonObject();

        assertThat(manifest.getAsJsonArray("missingParameterFiles").get(0).getAsString())
            .isEqualTo("par_all36m_prot.prm");
        assertThat(manifest.getAsJsonArray("parameterFiles")).isEmpty();
    }
}
