package org.simprep.pipeline.structure;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the atom and bond sections of a connectivity (PSF) file.
 */
public final class PsfFile {

    private PsfFile() {
    }

    /**
     * Returns the atom count declared by the {@code !NATOM} section header.
     *
     * @param psf the connectivity file
     * @return number of atoms
     * @throws IOException if the file cannot be read or has no atom section
     */
    public static int atomCount(Path psf) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(psf, StandardCharsets.UTF_8)) {
            return readAtomHeader(reader, psf);
        }
    }

    /**
     * Sums the masses of all atoms.
     *
     * @param psf the connectivity file
     * @return total mass in atomic mass units
     * @throws IOException if the file cannot be read or the atom section is malformed
     */
    public static double totalMass(Path psf) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(psf, StandardCharsets.UTF_8)) {
            int natom = readAtomHeader(reader, psf);
            double mass = 0.0;
            for (int i = 0; i < natom; i++) {
                String line = reader.readLine();
                if (line == null) {
                    throw new IOException(psf.getFileName() + ": atom section ends after " + i + " of " + natom + " atoms");
                }
                String[] tokens = line.trim().split("\\s+");
                if (tokens.length < 8) {
                    throw new IOException(psf.getFileName() + ": malformed atom line '" + line + "'");
                }
                try {
                    mass += Double.parseDouble(tokens[7]);
                } catch (NumberFormatException e) {
                    throw new IOException(psf.getFileName() + ": unreadable mass in '" + line + "'", e);
                }
            }
            return mass;
        }
    }

    /**
     * Reads the bond section.
     *
     * @param psf the connectivity file
     * @return bonded atom pairs as 0-based atom indices, in file order
     * @throws IOException if the file cannot be read or the bond section is malformed
     */
    public static List<int[]> bonds(Path psf) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(psf, StandardCharsets.UTF_8)) {
            int natom = readAtomHeader(reader, psf);
            for (int i = 0; i < natom; i++) {
                if (reader.readLine() == null) {
                    throw new IOException(psf.getFileName() + ": atom section ends after " + i + " of " + natom + " atoms");
                }
            }
            String line;
            int nbond = -1;
            while ((line = reader.readLine()) != null) {
                if (line.contains("!NBOND")) {
                    nbond = parseCount(line, psf);
                    break;
                }
            }
            if (nbond < 0) {
                throw new IOException(psf.getFileName() + ": no !NBOND section");
            }
            List<int[]> bonds = new ArrayList<>(nbond);
            int[] pending = null;
            while (bonds.size() < nbond && (line = reader.readLine()) != null) {
                for (String token : line.trim().split("\\s+")) {
                    if (token.isEmpty()) {
                        continue;
                    }
                    int atom = parseAtomIndex(token, natom, psf);
                    if (pending == null) {
                        pending = new int[]{atom, -1};
                    } else {
                        pending[1] = atom;
                        bonds.add(pending);
                        pending = null;
                    }
                }
            }
            if (bonds.size() < nbond) {
                throw new IOException(psf.getFileName() + ": bond section ends after " + bonds.size() + " of "
                    + nbond + " bonds");
            }
            return bonds;
        }
    }

    private static int parseAtomIndex(String token, int natom, Path psf) throws IOException {
        try {
            int serial = Integer.parseInt(token);
            if (serial < 1 || serial > natom) {
                throw new IOException(psf.getFileName() + ": bond names atom " + serial + " of " + natom);
            }
            return serial - 1;
        } catch (NumberFormatException e) {
            throw new IOException(psf.getFileName() + ": unreadable bond entry '" + token + "'", e);
        }
    }

    private static int parseCount(String header, Path psf) throws IOException {
        String count = header.trim().split("\\s+")[0];
        try {
            return Integer.parseInt(count);
        } catch (NumberFormatException e) {
            throw new IOException(psf.getFileName() + ": unreadable count '" + count + "'", e);
        }
    }

    private static int readAtomHeader(BufferedReader reader, Path psf) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.contains("!NATOM")) {
                String count = line.trim().split("\\s+")[0];
                try {
                    return Integer.parseInt(count);
                } catch (NumberFormatException e) {
                    throw new IOException(psf.getFileName() + ": unreadable atom count '" + count + "'", e);
                }
            }
        }
        throw new IOException(psf.getFileName() + ": no !NATOM section");
    }
}
