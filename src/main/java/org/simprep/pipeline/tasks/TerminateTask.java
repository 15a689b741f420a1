package org.simprep.pipeline.tasks;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Writes the final system under the configured basename and bundles it for production.
 * <p>
 * The structure is rewritten by psfgen so the pdb carries the latest coordinates; binary
 * coordinates, velocities and box are copied. The package consists of these files, the
 * force-field parameter files and a {@code manifest.json}; with {@code archive} on, all of
 * it is also zipped into {@code <basename>.zip}.
 */
public class TerminateTask extends AbstractTask<TaskSpec.Terminate> {

    static final String MANIFEST = "manifest.json";
    private static final String PARAMETER_DIR = "parameters/";

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public TerminateTask(TaskSpec.Terminate spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireTopology(input);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        String scriptName = context.nextBasename();
        String finalName = spec.basename();

        PsfgenScript script = new PsfgenScript();
        script.banner(scriptName);
        script.begin(context.settings().topologies());
        script.loadState(input);
        script.writeState(finalName);
        script.exit();
        context.runScript(Engine.PSFGEN, script, scriptName);

        StateHandle.Builder builder = input.toBuilder()
            .psf(context.requireArtifact(context.file(finalName, "psf")))
            .pdb(context.requireArtifact(context.file(finalName, "pdb")))
            .coor(copy(input.coor(), context.file(finalName, "coor")))
            .vel(copy(input.vel(), context.file(finalName, "vel")))
            .xsc(copy(input.xsc(), context.file(finalName, "xsc")));
        StateHandle output = context.finish(builder, finalName);

        Set<Path> parameters = new LinkedHashSet<>(context.settings().parameterFiles());
        parameters.addAll(input.parameterFiles());
        List<Path> present = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (Path p : parameters) {
            Path resolved = context.workDir().resolve(p);
            if (Files.isRegularFile(resolved)) {
                present.add(resolved);
            } else {
                missing.add(p.toString());
            }
        }
        if (!missing.isEmpty()) {
            log.warn("{} parameter file(s) not found and left out of the package: {}", missing.size(), missing);
        }

        Path manifest = context.file(finalName + "-manifest", "json");
        Files.writeString(manifest, gson.toJson(manifestOf(output, present, missing)), StandardCharsets.UTF_8);

        if (spec.archive()) {
            Path archive = context.file(finalName, "zip");
            writeArchive(archive, output.files(), present, manifest);
            log.info("Packaged {} structure file(s) and {} parameter file(s) into {}", output.files().size(),
                present.size(), archive.getFileName());
        } else {
            log.info("Final system written as {}.*", finalName);
        }
        return output;
    }

    private static Path copy(Path source, Path target) throws IOException {
        if (source == null) {
            return null;
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        return target;
    }

    private Map<String, Object> manifestOf(StateHandle output, List<Path> parameters, List<String> missing) {
        Map<String, Object> manifest = new LinkedHashMap<>();
        manifest.put("basename", output.basename());
        manifest.put("created", Instant.now().toString());
        manifest.put("producedBy", output.provenance().toString());
        manifest.put("firstTimestep", output.firstTimestep());
        List<String> files = new ArrayList<>();
        output.files().forEach(f -> files.add(f.getFileName().toString()));
        manifest.put("files", files);
        List<String> params = new ArrayList<>();
        parameters.forEach(p -> params.add(PARAMETER_DIR + p.getFileName()));
        manifest.put("parameterFiles", params);
        if (!missing.isEmpty()) {
            manifest.put("missingParameterFiles", missing);
        }
        manifest.put("chainIds", output.chainIdMap());
        return manifest;
    }

    private static void writeArchive(Path archive, List<Path> files, List<Path> parameters, Path manifest)
            throws IOException {
        try (OutputStream out = Files.newOutputStream(archive);
             ZipOutputStream zip = new ZipOutputStream(out)) {
            for (Path file : files) {
                addEntry(zip, file.getFileName().toString(), file);
            }
            for (Path parameter : parameters) {
                addEntry(zip, PARAMETER_DIR + parameter.getFileName(), parameter);
            }
            addEntry(zip, MANIFEST, manifest);
        }
    }

    private static void addEntry(ZipOutputStream zip, String name, Path file) throws IOException {
        zip.putNextEntry(new ZipEntry(name));
        Files.copy(file, zip);
        zip.closeEntry();
    }
}
