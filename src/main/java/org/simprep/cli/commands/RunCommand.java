package org.simprep.cli.commands;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import org.simprep.cli.CommandLineInterface;
import org.simprep.cli.config.LoggingConfigurator;
import org.simprep.cli.config.TaskListParser;
import org.simprep.pipeline.PipelineException;
import org.simprep.pipeline.Provenance;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.Controller;
import org.simprep.pipeline.controller.PipelineEnvironment;
import org.simprep.pipeline.controller.PipelineSettings;
import org.simprep.pipeline.engines.EngineRunner;
import org.simprep.pipeline.engines.EngineSettings;
import org.simprep.pipeline.engines.ProcessEngineRunner;
import org.simprep.pipeline.structure.PeriodicBox;
import org.simprep.pipeline.tasks.StateHydrator;
import org.simprep.pipeline.tasks.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs the configured task list in a working directory.
 * <p>
 * With {@code --from-index K} the run resumes: the state is hydrated from the given files
 * and tasks {@code K..n-1} run under their original indices, so the artifacts they write
 * carry the same names as in a full run.
 */
@Command(
    name = "run",
    description = "Run the configured task list"
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Option(
        names = {"--work-dir"},
        description = "Directory all artifacts are written to (default: current directory)"
    )
    private File workDir = new File(".");

    @Option(
        names = {"--from-index"},
        description = "Index of the first task to run; requires --psf and --pdb"
    )
    private Integer fromIndex;

    @Option(names = {"--psf"}, description = "Topology to resume from")
    private Path psf;

    @Option(names = {"--pdb"}, description = "Coordinates to resume from")
    private Path pdb;

    @Option(names = {"--xsc"}, description = "Periodic box to resume from")
    private Path xsc;

    @Option(names = {"--coor"}, description = "Binary coordinates to resume from")
    private Path coor;

    @Option(names = {"--vel"}, description = "Binary velocities to resume from")
    private Path vel;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private EngineRunner engineRunner;

    /**
     * Replaces the process-launching engine runner, e.g. with a test double.
     */
    public void setEngineRunner(EngineRunner engineRunner) {
        this.engineRunner = engineRunner;
    }

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            List<TaskDescriptor> tasks = new TaskListParser(config).parse();
            PipelineSettings settings = PipelineSettings.fromConfig(config);
            EngineRunner runner = engineRunner != null
                ? engineRunner
                : new ProcessEngineRunner(EngineSettings.fromConfig(config));

            Path directory = workDir.toPath().toAbsolutePath().normalize();
            Files.createDirectories(directory);
            LoggingConfigurator.attachRunLog(config, directory);
            Controller root = Controller.root(tasks, new PipelineEnvironment(directory, runner, settings));
            log.info("Running {} tasks in {}", tasks.size(), directory);

            StateHandle result;
            if (fromIndex != null) {
                StateHandle initial = StateHydrator.hydrate(directory, psf, pdb, xsc, coor, vel, 0,
                    Provenance.initial());
                if (initial.xsc() != null) {
                    initial = initial.toBuilder().firstTimestep(PeriodicBox.readStep(initial.xsc())).build();
                }
                result = root.runFrom(fromIndex, initial);
            } else {
                result = root.run(StateHandle.empty());
            }

            out.println("Final system: " + directory.resolve(result.basename()));
            out.flush();
            return 0;
        } catch (PipelineException e) {
            log.error(e.describe());
            err.println(e.describe());
            return 1;
        } catch (IOException e) {
            log.error("Run failed: {}", e.getMessage());
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (com.typesafe.config.ConfigException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
