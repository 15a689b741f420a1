package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.membrane.MakeMembraneSystemTask;

import java.io.IOException;

/**
 * Maps each task descriptor to the implementation of its kind.
 * <p>
 * The switch covers every {@link TaskKind} without a default branch, so adding a kind
 * does not compile until it is handled here.
 */
public class TaskDispatcher {

    /**
     * Creates the task implementation for a descriptor.
     *
     * @param descriptor the task to run
     * @return a fresh task instance
     */
    public Task taskFor(TaskDescriptor descriptor) {
        TaskSpec spec = descriptor.spec();
        return switch (descriptor.kind()) {
            case FETCH -> new FetchTask((TaskSpec.Fetch) spec);
            case BUILD_TOPOLOGY -> new BuildTopologyTask((TaskSpec.BuildTopology) spec);
            case LIGATE -> new LigateTask((TaskSpec.Ligate) spec);
            case CLEAVE -> new CleaveTask((TaskSpec.Cleave) spec);
            case DOMAIN_SWAP -> new DomainSwapTask((TaskSpec.DomainSwap) spec);
            case MANIPULATE -> new ManipulateTask((TaskSpec.Manipulate) spec);
            case SOLVATE -> new SolvateTask((TaskSpec.Solvate) spec);
            case DESOLVATE -> new DesolvateTask((TaskSpec.Desolvate) spec);
            case MAKE_MEMBRANE_SYSTEM -> new MakeMembraneSystemTask((TaskSpec.MakeMembraneSystem) spec);
            case RUN_DYNAMICS -> new RunDynamicsTask((TaskSpec.RunDynamics) spec);
            case PLOT -> new PlotTask((TaskSpec.Plot) spec);
            case VALIDATE -> new ValidateTask((TaskSpec.Validate) spec);
            case PACKAGE -> new TerminateTask((TaskSpec.Terminate) spec);
            case RESTART -> new RestartTask((TaskSpec.Restart) spec);
            case CONTINUATION -> new ContinuationTask((TaskSpec.Continuation) spec);
        };
    }

    /**
     * Runs one task on the given state.
     *
     * @param descriptor the task
     * @param input state handed to the task
     * @param context the task's context
     * @return the state the task produced
     * @throws IOException if the task fails to read or write a file
     */
    public StateHandle run(TaskDescriptor descriptor, StateHandle input, TaskContext context) throws IOException {
        return taskFor(descriptor).run(input, context);
    }
}
