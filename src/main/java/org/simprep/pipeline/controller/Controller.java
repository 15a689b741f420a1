package org.simprep.pipeline.controller;

import org.simprep.pipeline.ArtifactNames;
import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.ControllerId;
import org.simprep.pipeline.PipelineException;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.structure.StructureChecks;
import org.simprep.pipeline.tasks.TaskDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Runs an ordered list of tasks, threading the state from each task into the next.
 * <p>
 * Execution is strictly serial on the calling thread. The first failing task aborts the
 * remaining list; its {@link PipelineException} carries this controller's id, the task index
 * and label and is rethrown to the caller. Artifacts written so far stay on disk.
 * <p>
 * A composite task may run a nested task list through
 * {@link TaskContext#runSubController(List, StateHandle)}. The nested controller gets the id
 * {@code <this id>.<n>} where {@code n} counts the sub-controllers spawned by this controller,
 * starting at 01, and exists only while the composite task waits for it. Each spawn is
 * appended to the ledger {@code <this id>-subcontrollers.ledger} as {@code <task index> <n>},
 * so that a run resumed at a later task continues the numbering where the full run would.
 */
public class Controller {

    private static final Logger log = LoggerFactory.getLogger(Controller.class);
    private static final String LEDGER_SUFFIX = "-subcontrollers.ledger";

    private final ControllerId id;
    private final List<TaskDescriptor> tasks;
    private final PipelineEnvironment environment;
    private int subControllerCount;
    private int runningTaskIndex;

    /**
     * Creates a controller.
     *
     * @param id controller id
     * @param tasks tasks in execution order
     * @param environment shared run environment
     * @throws ConfigurationException if the list holds more tasks than the two-digit task index can name
     */
    public Controller(ControllerId id, List<TaskDescriptor> tasks, PipelineEnvironment environment) {
        if (tasks.size() > ArtifactNames.MAX_INDEX + 1) {
            throw new ConfigurationException("A task list may hold at most " + (ArtifactNames.MAX_INDEX + 1)
                + " tasks, got " + tasks.size());
        }
        this.id = id;
        this.tasks = List.copyOf(tasks);
        this.environment = environment;
    }

    /**
     * Creates the root controller of a run, id {@code 00}.
     */
    public static Controller root(List<TaskDescriptor> tasks, PipelineEnvironment environment) {
        return new Controller(ControllerId.root(), tasks, environment);
    }

    public ControllerId getId() {
        return id;
    }

    public List<TaskDescriptor> getTasks() {
        return tasks;
    }

    /**
     * Runs every task.
     *
     * @param initial state handed to the first task
     * @return state produced by the last task
     * @throws PipelineException from the first failing task
     */
    public StateHandle run(StateHandle initial) {
        return runFrom(0, initial);
    }

    /**
     * Runs the tasks from {@code firstIndex} on, keeping their original indices so that
     * their artifact names equal those of a full run.
     *
     * @param firstIndex index of the first task to run
     * @param initial state handed to that task
     * @return state produced by the last task
     * @throws ConfigurationException if {@code firstIndex} is outside the list
     * @throws PipelineException from the first failing task
     */
    public StateHandle runFrom(int firstIndex, StateHandle initial) {
        if (firstIndex < 0 || firstIndex > tasks.size()) {
            throw new ConfigurationException("Cannot start at task " + firstIndex + " of a list with "
                + tasks.size() + " tasks");
        }
        if (firstIndex > 0) {
            log.info("Controller {} resuming at task {} of {}", id, String.format("%02d", firstIndex), tasks.size());
        }
        restoreSubControllerCount(firstIndex);
        StateHandle state = initial;
        for (int index = firstIndex; index < tasks.size(); index++) {
            state = runTask(index, tasks.get(index), state);
        }
        return state;
    }

    private StateHandle runTask(int index, TaskDescriptor descriptor, StateHandle input) {
        runningTaskIndex = index;
        TaskContext context = new TaskContext(this, environment, index, descriptor);
        String position = String.format("%s:%02d", id, index);
        try {
            checkAtomCounts(input);
            environment.listener().taskStarting(id, index, descriptor, input);
            log.info("Task {} '{}' ({}) starting", position, descriptor.label(), descriptor.kind().configKey());
            long start = System.currentTimeMillis();

            StateHandle output = environment.dispatcher().run(descriptor, input, context);

            log.info("Task {} '{}' finished in {} s; state basename {}", position, descriptor.label(),
                (System.currentTimeMillis() - start) / 1000, output.basename());
            environment.listener().taskFinished(id, index, descriptor, output);
            return output;
        } catch (PipelineException e) {
            boolean innermost = !e.isLocated();
            e.locate(id, index, descriptor.label());
            if (innermost) {
                log.error(e.describe());
            }
            throw e;
        } catch (IOException e) {
            PipelineException wrapped = new PipelineException("I/O error: " + e.getMessage(), e)
                .locate(id, index, descriptor.label());
            log.error(wrapped.describe());
            throw wrapped;
        }
    }

    private void checkAtomCounts(StateHandle state) throws IOException {
        if (!environment.settings().checkAtomCounts() || !state.hasTopology()) {
            return;
        }
        Optional<String> mismatch = StructureChecks.atomCountMismatch(state);
        if (mismatch.isPresent()) {
            throw new StateInconsistencyException("Input structure is inconsistent: " + mismatch.get());
        }
    }

    /**
     * Runs a nested task list to completion as a sub-controller of this controller.
     */
    StateHandle runSubController(List<TaskDescriptor> subTasks, StateHandle initial) {
        subControllerCount++;
        try {
            Files.writeString(ledger(), runningTaskIndex + " " + subControllerCount + System.lineSeparator(),
                StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new PipelineException("Cannot record sub-controller in " + ledger().getFileName() + ": "
                + e.getMessage(), e);
        }
        Controller child = new Controller(id.child(subControllerCount), subTasks, environment);
        log.debug("Controller {} spawning sub-controller {} with {} tasks", id, child.id, subTasks.size());
        return child.run(initial);
    }

    Path ledger() {
        return environment.workDir().resolve(id + LEDGER_SUFFIX);
    }

    /**
     * Sets the sub-controller count to what the tasks before {@code firstIndex} spawned and
     * forgets the spawns of later tasks, which are about to run again. Without a ledger the
     * count continues after the highest sub-controller id found among the artifacts, so no
     * existing artifact is overwritten.
     */
    private void restoreSubControllerCount(int firstIndex) {
        subControllerCount = 0;
        Path ledger = ledger();
        try {
            if (firstIndex == 0) {
                Files.deleteIfExists(ledger);
                return;
            }
            if (!Files.isRegularFile(ledger)) {
                subControllerCount = highestChildOnDisk();
                if (subControllerCount > 0) {
                    log.warn("No {} found; numbering sub-controllers of {} after {} found on disk",
                        ledger.getFileName(), id, id.child(subControllerCount));
                }
                return;
            }
            List<String> kept = new ArrayList<>();
            for (String line : Files.readAllLines(ledger, StandardCharsets.UTF_8)) {
                String[] fields = line.trim().split("\\s+");
                if (fields.length != 2) {
                    continue;
                }
                if (Integer.parseInt(fields[0]) < firstIndex) {
                    subControllerCount = Math.max(subControllerCount, Integer.parseInt(fields[1]));
                    kept.add(line.trim());
                }
            }
            Files.write(ledger, kept, StandardCharsets.UTF_8);
        } catch (IOException | NumberFormatException e) {
            throw new PipelineException("Cannot read sub-controller ledger " + ledger.getFileName() + ": "
                + e.getMessage(), e);
        }
    }

    private int highestChildOnDisk() throws IOException {
        Pattern childPrefix = Pattern.compile(Pattern.quote(id.toString()) + "\\.(\\d{2})[-.].*");
        int highest = 0;
        try (Stream<Path> files = Files.list(environment.workDir())) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher m = childPrefix.matcher(file.getFileName().toString());
                if (m.matches()) {
                    highest = Math.max(highest, Integer.parseInt(m.group(1)));
                }
            }
        }
        return highest;
    }
}
