package org.simprep.pipeline.structure;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Orthorhombic periodic cell as stored in a NAMD extended-system (xsc) file.
 *
 * @param ax cell length along x
 * @param by cell length along y
 * @param cz cell length along z
 * @param ox origin x
 * @param oy origin y
 * @param oz origin z
 */
public record PeriodicBox(double ax, double by, double cz, double ox, double oy, double oz) {

    private static final String LABELS =
        "#$LABELS step a_x a_y a_z b_x b_y b_z c_x c_y c_z o_x o_y o_z s_x s_y s_z s_u s_v s_w";

    /**
     * Returns a box with the given lengths, centred on the middle of the cell.
     */
    public static PeriodicBox centered(double ax, double by, double cz) {
        return new PeriodicBox(ax, by, cz, ax / 2, by / 2, cz / 2);
    }

    /**
     * @return lateral (xy) area of the cell
     */
    public double area() {
        return ax * by;
    }

    public double volume() {
        return ax * by * cz;
    }

    /**
     * Reads the last data line of an xsc file.
     *
     * @param xsc the extended-system file
     * @return the box
     * @throws IOException if the file cannot be read or holds no data line
     */
    public static PeriodicBox read(Path xsc) throws IOException {
        String[] t = lastDataLine(xsc);
        if (t.length < 13) {
            throw new IOException(xsc.getFileName() + ": box line has " + t.length + " fields, expected 13 or more");
        }
        try {
            return new PeriodicBox(Double.parseDouble(t[1]), Double.parseDouble(t[5]), Double.parseDouble(t[9]),
                Double.parseDouble(t[10]), Double.parseDouble(t[11]), Double.parseDouble(t[12]));
        } catch (NumberFormatException e) {
            throw new IOException(xsc.getFileName() + ": unreadable box line '" + String.join(" ", t) + "'", e);
        }
    }

    private static String[] lastDataLine(Path xsc) throws IOException {
        List<String> lines = Files.readAllLines(xsc, StandardCharsets.UTF_8);
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i).trim();
            if (!line.isEmpty() && !line.startsWith("#")) {
                return line.split("\\s+");
            }
        }
        throw new IOException(xsc.getFileName() + ": no box data");
    }

    /**
     * Reads the timestep recorded on the last data line of an xsc file.
     *
     * @param xsc the extended-system file
     * @return the step
     * @throws IOException if the file cannot be read or holds no data line
     */
    public static long readStep(Path xsc) throws IOException {
        String[] t = lastDataLine(xsc);
        try {
            return (long) Double.parseDouble(t[0]);
        } catch (NumberFormatException e) {
            throw new IOException(xsc.getFileName() + ": unreadable step '" + t[0] + "'", e);
        }
    }

    /**
     * Writes this box as a step-0 xsc file.
     *
     * @param xsc target file
     * @throws IOException if the file cannot be written
     */
    public void write(Path xsc) throws IOException {
        String data = String.format(Locale.ROOT,
            "0 %.6f 0 0 0 %.6f 0 0 0 %.6f %.6f %.6f %.6f 0 0 0 0 0 0", ax, by, cz, ox, oy, oz);
        Files.write(xsc, List.of("# simprep generated xsc", LABELS, data), StandardCharsets.UTF_8);
    }
}
