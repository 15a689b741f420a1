package org.simprep.pipeline.logs;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Extracts the energy table from a NAMD log: the {@code ETITLE:} line names the columns and
 * each {@code ENERGY:} line holds one sample.
 */
public final class NamdLogParser {

    private static final String TITLE = "ETITLE:";
    private static final String ENERGY = "ENERGY:";

    private NamdLogParser() {
    }

    /**
     * @param log NAMD log file
     * @return the energy samples; empty if the log holds none
     * @throws IOException if the log cannot be read or a sample line is malformed
     */
    public static TimeSeries parse(Path log) throws IOException {
        TimeSeries series = null;
        try (BufferedReader reader = Files.newBufferedReader(log, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.startsWith(TITLE)) {
                    if (series == null) {
                        series = new TimeSeries(tokens(line, TITLE));
                    }
                } else if (line.startsWith(ENERGY) && series != null) {
                    List<String> values = tokens(line, ENERGY);
                    if (values.size() != series.columns().size()) {
                        throw new IOException(log.getFileName() + ": energy line has " + values.size()
                            + " fields, title has " + series.columns().size());
                    }
                    double[] row = new double[values.size()];
                    for (int i = 0; i < row.length; i++) {
                        try {
                            row[i] = Double.parseDouble(values.get(i));
                        } catch (NumberFormatException e) {
                            throw new IOException(log.getFileName() + ": unreadable value '" + values.get(i) + "'", e);
                        }
                    }
                    series.addRow(row);
                }
            }
        }
        return series == null ? new TimeSeries(List.of()) : series;
    }

    private static List<String> tokens(String line, String prefix) {
        String rest = line.substring(prefix.length()).trim();
        return rest.isEmpty() ? List.of() : Arrays.asList(rest.split("\\s+"));
    }
}
