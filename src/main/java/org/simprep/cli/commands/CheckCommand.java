package org.simprep.cli.commands;

import java.util.List;
import java.util.concurrent.Callable;

import org.simprep.cli.CommandLineInterface;
import org.simprep.cli.config.TaskListParser;
import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.PipelineException;
import org.simprep.pipeline.controller.PipelineSettings;
import org.simprep.pipeline.tasks.TaskDescriptor;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Parses and validates the configured task list without running any engine.
 */
@Command(
    name = "check",
    description = "Validate the configured task list without running it"
)
public class CheckCommand implements Callable<Integer> {

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        var err = spec.commandLine().getErr();

        try {
            Config config = parent.getConfig();
            List<TaskDescriptor> tasks = new TaskListParser(config).parse();
            PipelineSettings.fromConfig(config);
            for (int i = 0; i < tasks.size(); i++) {
                TaskDescriptor task = tasks.get(i);
                out.printf("%s:%02d  %-22s %s%n", ControllerId.root(), i, task.kind().configKey(), task.label());
            }
            out.printf("%d tasks OK%n", tasks.size());
            out.flush();
            return 0;
        } catch (PipelineException e) {
            err.println(e.describe());
            return 1;
        } catch (com.typesafe.config.ConfigException e) {
            err.println("Error: invalid configuration: " + e.getMessage());
            return 1;
        }
    }
}
