package org.simprep.pipeline.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.EngineFailureException;
import org.simprep.pipeline.PipelineException;
import org.simprep.pipeline.Provenance;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.FakeEngineRunner;
import org.simprep.pipeline.tasks.Ensemble;
import org.simprep.pipeline.tasks.StateHydrator;
import org.simprep.pipeline.tasks.Task;
import org.simprep.pipeline.tasks.TaskDescriptor;
import org.simprep.pipeline.tasks.TaskDispatcher;
import org.simprep.pipeline.tasks.TaskSpec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("integration")
@ExtendWith(MockitoExtension.class)
class ControllerTest {

    @TempDir
    Path workDir;

    @Mock
    TaskListener listener;

    @Test
    @DisplayName("Build-topology then minimize: indices 00 and 01, minimize reads the built psf")
    void twoTaskListNamesArtifactsByPosition() {
        FakeEngineRunner engines = new FakeEngineRunner();
        Controller root = Controller.root(List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.MINIMIZE, 100)),
            TestPipelines.environment(workDir, engines).withListener(listener));

        StateHandle result = root.run(fetchedState());

        ArgumentCaptor<StateHandle> built = ArgumentCaptor.forClass(StateHandle.class);
        ArgumentCaptor<StateHandle> mdInput = ArgumentCaptor.forClass(StateHandle.class);
        verify(listener).taskFinished(eq(ControllerId.root()), eq(0), any(), built.capture());
        verify(listener).taskStarting(eq(ControllerId.root()), eq(1), any(), mdInput.capture());

        assertThat(built.getValue().psf().getFileName().toString()).isEqualTo("00-00-00_psfgen.psf");
        assertThat(mdInput.getValue().psf()).isEqualTo(built.getValue().psf());
        assertThat(result.coor().getFileName().toString()).isEqualTo("00-01-00_md.coor");
        assertThat(result.provenance()).isEqualTo(new Provenance(ControllerId.root(), 1, 0));
        assertThat(engines.invocations()).extracting(i -> i.engine()).containsExactly(Engine.PSFGEN, Engine.NAMD);
    }

    @Test
    void eachTaskReceivesTheStateItsPredecessorProduced() {
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.MINIMIZE, 100),
            TestPipelines.md(Ensemble.NVT, 200), TestPipelines.md(Ensemble.NVT, 300));
        Controller root = Controller.root(tasks,
            TestPipelines.environment(workDir, new FakeEngineRunner()).withListener(listener));

        root.run(fetchedState());

        ArgumentCaptor<StateHandle> inputs = ArgumentCaptor.forClass(StateHandle.class);
        ArgumentCaptor<StateHandle> outputs = ArgumentCaptor.forClass(StateHandle.class);
        InOrder order = inOrder(listener);
        for (int i = 0; i < tasks.size(); i++) {
            order.verify(listener).taskStarting(eq(ControllerId.root()), eq(i), eq(tasks.get(i)), inputs.capture());
            order.verify(listener).taskFinished(eq(ControllerId.root()), eq(i), eq(tasks.get(i)), outputs.capture());
        }
        for (int i = 0; i + 1 < tasks.size(); i++) {
            assertThat(inputs.getAllValues().get(i + 1)).isSameAs(outputs.getAllValues().get(i));
        }
        assertThat(outputs.getAllValues().get(3).firstTimestep()).isEqualTo(600);
    }

    @Test
    void failingTaskStopsTheRunAndReportsItsPosition() {
        FakeEngineRunner engines = new FakeEngineRunner().withExitCode(Engine.NAMD, 1);
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(),
            new TaskDescriptor("heat", new TaskSpec.RunDynamics(Ensemble.NVT, 100, 310.0, 1.0, 2.0, java.util.Map.of())),
            TestPipelines.md(Ensemble.NVT, 100));
        Controller root = Controller.root(tasks, TestPipelines.environment(workDir, engines).withListener(listener));

        EngineFailureException e = catchThrowableOfType(() -> root.run(fetchedState()), EngineFailureException.class);

        assertThat(e).isNotNull();
        assertThat(e.describe()).startsWith("Task 00:01 'heat' failed:");
        assertThat(e.getExitCode()).isEqualTo(1);
        assertThat(engines.invocations(Engine.NAMD)).hasSize(1);
        verify(listener, never()).taskStarting(any(), eq(2), any(), any());
    }

    @Test
    @DisplayName("Resuming at index k from hydrated files ends in the same state as a full run")
    void resumedRunMatchesFullRun() throws Exception {
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(), TestPipelines.md(Ensemble.MINIMIZE, 100),
            TestPipelines.md(Ensemble.NVT, 200), TestPipelines.md(Ensemble.NVT, 300));
        StateHandle full = Controller.root(tasks, TestPipelines.environment(workDir, new FakeEngineRunner()))
            .run(fetchedState());

        StateHandle hydrated = StateHydrator.hydrate(workDir, Path.of("00-00-00_psfgen.psf"),
            Path.of("00-00-00_psfgen.pdb"), null, Path.of("00-01-00_md.coor"), Path.of("00-01-00_md.vel"),
            100, Provenance.initial());
        FakeEngineRunner resumedEngines = new FakeEngineRunner();
        StateHandle resumed = Controller.root(tasks, TestPipelines.environment(workDir, resumedEngines))
            .runFrom(2, hydrated);

        assertThat(resumed).isEqualTo(full);
        assertThat(resumedEngines.invocations()).hasSize(2).allMatch(i -> i.engine() == Engine.NAMD);
    }

    @Test
    void subControllersAreNumberedFromOneUnderTheirParent() {
        List<String> controllers = Collections.synchronizedList(new ArrayList<>());
        TaskDispatcher dispatcher = new TaskDispatcher() {
            @Override
            public Task taskFor(TaskDescriptor descriptor) {
                if (!"nest".equals(descriptor.label())) {
                    return super.taskFor(descriptor);
                }
                return (input, context) -> {
                    StateHandle first = context.runSubController(List.of(TestPipelines.md(Ensemble.MINIMIZE, 10)), input);
                    return context.runSubController(List.of(TestPipelines.md(Ensemble.MINIMIZE, 10)), first);
                };
            }
        };
        TaskListener recorder = new TaskListener() {
            @Override
            public void taskFinished(ControllerId id, int index, TaskDescriptor task, StateHandle output) {
                controllers.add(id + ":" + output.basename());
            }
        };
        PipelineEnvironment env = new PipelineEnvironment(workDir, new FakeEngineRunner(), TestPipelines.settings(),
            dispatcher, recorder);

        Controller.root(List.of(TestPipelines.psfgen(), new TaskDescriptor("nest", new TaskSpec.Plot(List.of()))), env)
            .run(fetchedState());

        assertThat(controllers).containsExactly(
            "00:00-00-00_psfgen",
            "00.01:00.01-00-00_md",
            "00.02:00.02-00-00_md",
            "00:00.02-00-00_md");
    }

    @Test
    @DisplayName("Resuming after a composite task continues the sub-controller numbering of the full run")
    void resumeAfterCompositeTaskKeepsSubControllerIds() throws Exception {
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(), nest(), nest());
        StateHandle full = Controller.root(tasks, nestingEnvironment(new FakeEngineRunner())).run(fetchedState());

        assertThat(full.coor().getFileName().toString()).isEqualTo("00.02-00-00_md.coor");
        assertThat(Files.readAllLines(workDir.resolve("00-subcontrollers.ledger")))
            .containsExactly("1 1", "2 2");

        StateHandle hydrated = StateHydrator.hydrate(workDir, Path.of("00-00-00_psfgen.psf"),
            Path.of("00-00-00_psfgen.pdb"), null, Path.of("00.01-00-00_md.coor"), Path.of("00.01-00-00_md.vel"),
            10, Provenance.initial());
        StateHandle resumed = Controller.root(tasks, nestingEnvironment(new FakeEngineRunner())).runFrom(2, hydrated);

        assertThat(resumed.coor()).isEqualTo(full.coor());
        assertThat(resumed.basename()).isEqualTo(full.basename());
        assertThat(Files.readAllLines(workDir.resolve("00-subcontrollers.ledger")))
            .containsExactly("1 1", "2 2");
    }

    @Test
    void resumeWithoutLedgerNumbersAfterSubControllersOnDisk() throws Exception {
        List<TaskDescriptor> tasks = List.of(TestPipelines.psfgen(), nest(), nest());
        Controller.root(tasks, nestingEnvironment(new FakeEngineRunner())).run(fetchedState());
        Files.delete(workDir.resolve("00-subcontrollers.ledger"));

        StateHandle hydrated = StateHydrator.hydrate(workDir, Path.of("00-00-00_psfgen.psf"),
            Path.of("00-00-00_psfgen.pdb"), null, null, null, 0, Provenance.initial());
        StateHandle resumed = Controller.root(tasks, nestingEnvironment(new FakeEngineRunner())).runFrom(2, hydrated);

        assertThat(resumed.coor().getFileName().toString()).isEqualTo("00.03-00-00_md.coor");
    }

    private static TaskDescriptor nest() {
        return new TaskDescriptor("nest", new TaskSpec.Plot(List.of()));
    }

    private PipelineEnvironment nestingEnvironment(FakeEngineRunner engines) {
        TaskDispatcher dispatcher = new TaskDispatcher() {
            @Override
            public Task taskFor(TaskDescriptor descriptor) {
                if (!"nest".equals(descriptor.label())) {
                    return super.taskFor(descriptor);
                }
                return (input, context) -> context.runSubController(List.of(TestPipelines.md(Ensemble.MINIMIZE, 10)),
                    input);
            }
        };
        return new PipelineEnvironment(workDir, engines, TestPipelines.settings(), dispatcher, TaskListener.NONE);
    }

    @Test
    void rejectsListsLongerThanTheIndexRange() {
        List<TaskDescriptor> tasks = Collections.nCopies(101, TestPipelines.md(Ensemble.MINIMIZE, 10));

        assertThatThrownBy(() -> Controller.root(tasks, TestPipelines.environment(workDir, new FakeEngineRunner())))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void runFromRejectsIndexOutsideTheList() {
        Controller root = Controller.root(List.of(TestPipelines.psfgen()),
            TestPipelines.environment(workDir, new FakeEngineRunner()));

        assertThatThrownBy(() -> root.runFrom(2, StateHandle.empty())).isInstanceOf(PipelineException.class);
    }

    private StateHandle fetchedState() {
        try {
            return TestPipelines.fetched(workDir);
        } catch (java.io.IOException e) {
            throw new java.io.UncheckedIOException(e);
        }
    }
}
