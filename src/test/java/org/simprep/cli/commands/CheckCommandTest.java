package org.simprep.cli.commands;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.simprep.cli.CommandLineInterface;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Smoke tests for the check command.
 */
@Tag("unit")
class CheckCommandTest {

    @TempDir
    Path dir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int check(String tasks) throws Exception {
        Path config = dir.resolve("simprep.conf");
        Files.writeString(config, "logging.format = PLAIN\ntasks = [\n" + tasks + "\n]\n");
        CommandLine cmdLine = CommandLineInterface.createCommandLine();
        cmdLine.setOut(new PrintWriter(out));
        cmdLine.setErr(new PrintWriter(err));
        return cmdLine.execute("-c", config.toString(), "check");
    }

    @Test
    void testCommandParses() {
        assertThat(CommandLineInterface.createCommandLine().getSubcommands()).containsKey("check");
    }

    @Test
    void listsEveryTaskWithItsPosition() throws Exception {
        int exitCode = check("{ fetch { id = 6pti } }\n{ psfgen {} }\n{ md { label = relax } }");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("00:00  fetch")
            .contains("00:02  md")
            .contains("relax")
            .contains("00:03  terminate")
            .contains("4 tasks OK");
    }

    @Test
    void reportsTheFirstMalformedEntry() throws Exception {
        int exitCode = check("{ psfgen {} }\n{ md { ensemble = sideways } }");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("tasks[1] (md)").contains("sideways");
    }

    @Test
    void validatesMembraneCompositions() throws Exception {
        int exitCode = check("{ make_membrane_system { bilayer { composition { upper_leaflet = "
            + "[ { name = POPC, frac = 0.5 }, { name = POPE, frac = 0.3 } ] } } } }");

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("upper leaflet");
    }
}
