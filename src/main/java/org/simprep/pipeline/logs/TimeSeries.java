package org.simprep.pipeline.logs;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Scalar columns sampled at a common sequence of timesteps.
 */
public class TimeSeries {

    private final List<String> columns;
    private final List<double[]> rows = new ArrayList<>();

    public TimeSeries(List<String> columns) {
        this.columns = List.copyOf(columns);
    }

    public List<String> columns() {
        return columns;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public void addRow(double[] values) {
        if (values.length != columns.size()) {
            throw new IllegalArgumentException("Row has " + values.length + " values for " + columns.size() + " columns");
        }
        rows.add(values.clone());
    }

    public boolean hasColumn(String name) {
        return indexOf(name) >= 0;
    }

    /**
     * @param name column name, matched case-insensitively
     * @return the column's values in row order
     * @throws IllegalArgumentException if there is no such column
     */
    public List<Double> column(String name) {
        int index = indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No column '" + name + "' among " + columns);
        }
        List<Double> values = new ArrayList<>(rows.size());
        for (double[] row : rows) {
            values.add(row[index]);
        }
        return Collections.unmodifiableList(values);
    }

    private int indexOf(String name) {
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).equalsIgnoreCase(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Appends the rows of another series with the same columns.
     */
    public void append(TimeSeries other) {
        if (!columns.equals(other.columns)) {
            throw new IllegalArgumentException("Cannot append series with columns " + other.columns + " to " + columns);
        }
        rows.addAll(other.rows);
    }

    /**
     * Writes the given columns as CSV with a header line.
     *
     * @param file target file
     * @param names columns to write, in order
     * @param series values per column, each of length {@link #size()}
     * @throws IOException if the file cannot be written
     */
    public static void writeCsv(Path file, List<String> names, List<List<Double>> series) throws IOException {
        try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writer.write(String.join(",", names));
            writer.newLine();
            int n = series.isEmpty() ? 0 : series.get(0).size();
            for (int i = 0; i < n; i++) {
                List<String> cells = new ArrayList<>(series.size());
                for (List<Double> s : series) {
                    cells.add(String.format(Locale.ROOT, "%.6g", s.get(i)));
                }
                writer.write(String.join(",", cells));
                writer.newLine();
            }
        }
    }
}
