package org.simprep.pipeline.engines;

/**
 * Launches external engines. Implementations block until the engine exits.
 */
public interface EngineRunner {

    /**
     * Runs the engine and waits for it to finish.
     *
     * @param invocation what to run and where
     * @return the result of a successful run
     * @throws org.simprep.pipeline.EngineFailureException if the engine cannot be started or
     *         exits with a status that is neither zero nor tolerated
     */
    EngineResult run(EngineInvocation invocation);
}
