package org.simprep.pipeline.tasks;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.structure.PdbStructure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Locale;

/**
 * Copies the source structure into the working directory under its artifact name.
 * <p>
 * The structure is taken from the configured source file or, without one, from
 * {@code <cache>/<id>.pdb} or {@code <cache>/<id>.cif}. Remote downloads are not performed.
 */
public class FetchTask extends AbstractTask<TaskSpec.Fetch> {

    public FetchTask(TaskSpec.Fetch spec) {
        super(spec);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        Path source = locateSource(context);
        String extension = source.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".cif") ? "cif" : "pdb";

        String basename = context.nextBasename();
        Path target = context.file(basename, extension);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
        log.info("Fetched {} from {} as {}", spec.id(), source, target.getFileName());

        StateHandle.Builder builder = StateHandle.empty().toBuilder().pdb(target);
        if ("pdb".equals(extension)) {
            for (String chain : PdbStructure.read(target).chainIds()) {
                builder.chainId(chain, chain);
            }
        }
        return context.finish(builder, basename);
    }

    private Path locateSource(TaskContext context) {
        if (spec.source() != null) {
            Path source = context.workDir().resolve(spec.source());
            if (!Files.isRegularFile(source)) {
                throw new ConfigurationException("Structure source " + source + " does not exist");
            }
            return source;
        }
        Path cache = context.workDir().resolve(context.settings().structureCache());
        for (String ext : new String[]{"pdb", "cif"}) {
            Path candidate = cache.resolve(spec.id() + "." + ext);
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new ConfigurationException("Structure " + spec.id() + " is not in the structure cache " + cache
            + " and no source file was given");
    }
}
