package org.simprep.pipeline.engines;

import org.simprep.pipeline.EngineFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * {@link EngineRunner} that starts each engine as a subprocess of this JVM.
 * <p>
 * The process runs in the invocation's working directory with stdout and stderr merged into
 * the invocation's log file. The calling thread waits for the process to exit; no timeout
 * is applied since dynamics runs may legitimately take hours.
 */
public class ProcessEngineRunner implements EngineRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessEngineRunner.class);

    private final EngineSettings settings;

    public ProcessEngineRunner(EngineSettings settings) {
        this.settings = settings;
    }

    @Override
    public EngineResult run(EngineInvocation invocation) {
        List<String> command = settings.commandFor(invocation.engine(), invocation.arguments());
        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(invocation.workDir().toFile())
            .redirectErrorStream(true)
            .redirectOutput(invocation.logFile().toFile());
        if (invocation.stdin() != null) {
            builder.redirectInput(invocation.stdin().toFile());
        }

        log.info("Running {}: {} (log: {})", invocation.engine().configKey(), String.join(" ", command),
            invocation.logFile().getFileName());
        long start = System.nanoTime();
        int exitCode;
        try {
            Process process = builder.start();
            exitCode = process.waitFor();
        } catch (IOException e) {
            throw new EngineFailureException("Could not start " + invocation.engine().configKey()
                + " (" + command.get(0) + "): " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineFailureException("Interrupted while waiting for "
                + invocation.engine().configKey(), e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        if (!invocation.isSuccess(exitCode)) {
            throw new EngineFailureException(invocation.engine().configKey() + " exited with status " + exitCode
                + "; see " + invocation.logFile().getFileName(), exitCode, invocation.logFile());
        }
        if (exitCode != 0) {
            log.warn("{} exited with tolerated status {}", invocation.engine().configKey(), exitCode);
        }
        log.debug("{} finished in {} s", invocation.engine().configKey(), elapsed.toSeconds());
        return new EngineResult(exitCode, invocation.logFile(), elapsed);
    }
}
