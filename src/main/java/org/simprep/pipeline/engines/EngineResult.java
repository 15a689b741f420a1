package org.simprep.pipeline.engines;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Outcome of a successful engine run.
 *
 * @param exitCode exit status, zero or tolerated
 * @param logFile file holding the engine's output
 * @param elapsed wall time of the run
 */
public record EngineResult(int exitCode, Path logFile, Duration elapsed) {
}
