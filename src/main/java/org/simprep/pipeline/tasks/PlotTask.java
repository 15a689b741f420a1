package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.logs.NamdLogParser;
import org.simprep.pipeline.logs.TimeSeries;
import org.simprep.pipeline.structure.PsfFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Gathers the energy tables of all dynamics stages that ran earlier in the same controller
 * and writes the requested traces to a CSV file. The state passes through unchanged.
 * <p>
 * Logs are found by artifact name, so only stages of this controller with a lower task index
 * are included, in execution order. The {@code density} trace is derived from the
 * {@code VOLUME} column and the total mass of the current structure.
 */
public class PlotTask extends AbstractTask<TaskSpec.Plot> {

    /** Converts amu per cubic Angstrom to g/cm^3. */
    private static final double AMU_PER_A3_TO_G_PER_CC = 1.66053907;

    public PlotTask(TaskSpec.Plot spec) {
        super(spec);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        List<Path> logs = precedingLogs(context);
        TimeSeries combined = null;
        for (Path logFile : logs) {
            TimeSeries series = NamdLogParser.parse(logFile);
            if (series.isEmpty()) {
                continue;
            }
            if (combined == null) {
                combined = new TimeSeries(series.columns());
            }
            combined.append(series);
        }
        String basename = context.nextBasename();
        Path csv = context.file(basename, "csv");
        if (combined == null) {
            log.warn("No dynamics logs with energy output precede this task; writing empty {}", csv.getFileName());
            TimeSeries.writeCsv(csv, List.of("TS"), List.of(List.of()));
            return input;
        }

        List<String> names = new ArrayList<>();
        List<List<Double>> columns = new ArrayList<>();
        names.add("TS");
        columns.add(combined.column("TS"));
        for (String trace : spec.traces()) {
            names.add(trace);
            columns.add(trace(combined, trace, input));
        }
        TimeSeries.writeCsv(csv, names, columns);
        log.info("Wrote {} samples of {} from {} log(s) to {}", combined.size(), spec.traces(), logs.size(),
            csv.getFileName());
        return input;
    }

    private List<Double> trace(TimeSeries series, String trace, StateHandle input) throws IOException {
        if ("density".equalsIgnoreCase(trace)) {
            if (input.psf() == null || !series.hasColumn("VOLUME")) {
                throw new StateInconsistencyException("The density trace needs a structure and constant-pressure logs with VOLUME");
            }
            double mass = PsfFile.totalMass(input.psf());
            return series.column("VOLUME").stream()
                .map(v -> v > 0 ? mass * AMU_PER_A3_TO_G_PER_CC / v : Double.NaN)
                .collect(Collectors.toList());
        }
        if (!series.hasColumn(trace)) {
            throw new StateInconsistencyException("No trace '" + trace + "' in the dynamics logs; available: " + series.columns());
        }
        return series.column(trace);
    }

    private List<Path> precedingLogs(TaskContext context) throws IOException {
        Pattern pattern = Pattern.compile(Pattern.quote(context.controllerId().toString()) + "-(\\d{2})-\\d{2}_.+\\.log");
        try (Stream<Path> files = Files.list(context.workDir())) {
            return files
                .filter(p -> {
                    Matcher m = pattern.matcher(p.getFileName().toString());
                    return m.matches() && Integer.parseInt(m.group(1)) < context.taskIndex();
                })
                .sorted()
                .collect(Collectors.toList());
        }
    }
}
