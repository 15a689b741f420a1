package org.simprep.pipeline.tasks;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TaskDispatcherTest {

    static Stream<Arguments> specs() {
        Path p = Path.of("x");
        return Stream.of(
            Arguments.of(new TaskSpec.Fetch("1abc", null), FetchTask.class),
            Arguments.of(new TaskSpec.BuildTopology(List.of(), List.of(), List.of(), List.of(), List.of()),
                BuildTopologyTask.class),
            Arguments.of(new TaskSpec.Ligate(100, 10.0, 1.33, 310.0), LigateTask.class),
            Arguments.of(new TaskSpec.Cleave(List.of()), CleaveTask.class),
            Arguments.of(new TaskSpec.DomainSwap("A", "B", 10, 20), DomainSwapTask.class),
            Arguments.of(new TaskSpec.Manipulate(true, true, List.of(0.0, 0.0, 0.0)), ManipulateTask.class),
            Arguments.of(new TaskSpec.Solvate(10.0, "SOD", "CLA", 0.15), SolvateTask.class),
            Arguments.of(new TaskSpec.Desolvate("protein"), DesolvateTask.class),
            Arguments.of(new TaskSpec.RunDynamics(Ensemble.NVT, 10, 310.0, 1.0, 2.0, Map.of()),
                RunDynamicsTask.class),
            Arguments.of(new TaskSpec.Plot(List.of("density")), PlotTask.class),
            Arguments.of(new TaskSpec.Validate(0.5, true, true, 3.5), ValidateTask.class),
            Arguments.of(new TaskSpec.Terminate("final", true), TerminateTask.class),
            Arguments.of(new TaskSpec.Restart(p, p, null, null, null), RestartTask.class),
            Arguments.of(new TaskSpec.Continuation(p, p, p, p, p, -1), ContinuationTask.class));
    }

    @ParameterizedTest
    @MethodSource("specs")
    void eachKindMapsToItsTask(TaskSpec spec, Class<? extends Task> expected) {
        assertThat(new TaskDispatcher().taskFor(TaskDescriptor.of(spec))).isInstanceOf(expected);
    }
}
