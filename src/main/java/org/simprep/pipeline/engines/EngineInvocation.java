package org.simprep.pipeline.engines;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * One blocking run of an external engine.
 *
 * @param engine the engine to launch
 * @param arguments arguments appended to the configured command (usually the script name)
 * @param workDir directory the engine runs in; all file names are relative to it
 * @param stdin file fed to the engine's standard input, or null
 * @param logFile file receiving the engine's combined output
 * @param toleratedExitCodes non-zero exit codes that still count as success
 */
public record EngineInvocation(
    Engine engine,
    List<String> arguments,
    Path workDir,
    Path stdin,
    Path logFile,
    Set<Integer> toleratedExitCodes
) {

    public EngineInvocation {
        arguments = List.copyOf(arguments);
        toleratedExitCodes = Set.copyOf(toleratedExitCodes);
    }

    public boolean isSuccess(int exitCode) {
        return exitCode == 0 || toleratedExitCodes.contains(exitCode);
    }
}
