package org.simprep.pipeline.structure;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Minimal fixed-column reader for PDB coordinate files as written by psfgen and packmol.
 * <p>
 * Residue names are read from columns 18-21 so that four-character CHARMM names such as
 * {@code TIP3} survive, and the segment name from columns 73-76.
 */
public final class PdbStructure {

    private final List<PdbAtom> atoms;

    private PdbStructure(List<PdbAtom> atoms) {
        this.atoms = Collections.unmodifiableList(atoms);
    }

    /**
     * Reads every ATOM and HETATM record of the file. Only the first model is read.
     *
     * @param file the coordinate file
     * @return the structure
     * @throws IOException if the file cannot be read or a record is malformed
     */
    public static PdbStructure read(Path file) throws IOException {
        List<PdbAtom> atoms = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.startsWith("ENDMDL")) {
                    break;
                }
                if (line.startsWith("ATOM") || line.startsWith("HETATM")) {
                    atoms.add(parseAtom(line, atoms.size() + 1, file, lineNumber));
                }
            }
        }
        return new PdbStructure(atoms);
    }

    private static PdbAtom parseAtom(String line, int position, Path file, int lineNumber) throws IOException {
        if (line.length() < 54) {
            throw new IOException(file.getFileName() + ":" + lineNumber + ": truncated atom record");
        }
        try {
            int serial = parseIntOr(column(line, 6, 11), position);
            String name = column(line, 12, 16);
            String resname = column(line, 17, 21);
            String chain = column(line, 21, 22);
            int resid = Integer.parseInt(column(line, 22, 26));
            double x = Double.parseDouble(column(line, 30, 38));
            double y = Double.parseDouble(column(line, 38, 46));
            double z = Double.parseDouble(column(line, 46, 54));
            String segname = column(line, 72, 76);
            return new PdbAtom(serial, name, resname, chain, resid, x, y, z, segname);
        } catch (NumberFormatException e) {
            throw new IOException(file.getFileName() + ":" + lineNumber + ": malformed atom record", e);
        }
    }

    private static String column(String line, int from, int to) {
        if (from >= line.length()) {
            return "";
        }
        return line.substring(from, Math.min(to, line.length())).trim();
    }

    private static int parseIntOr(String text, int fallback) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            // serials overflow the column in large systems
            return fallback;
        }
    }

    public List<PdbAtom> atoms() {
        return atoms;
    }

    public int atomCount() {
        return atoms.size();
    }

    /**
     * @return chain identifiers in order of first appearance, excluding blanks
     */
    public Set<String> chainIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (PdbAtom atom : atoms) {
            if (!atom.chain().isEmpty()) {
                ids.add(atom.chain());
            }
        }
        return ids;
    }

    /**
     * Groups atoms into residues keyed by segment name (or chain when the segment is blank)
     * and residue number, preserving file order.
     *
     * @return residues in order of first appearance
     */
    public Map<ResidueKey, List<PdbAtom>> residues() {
        return residues(atoms);
    }

    /**
     * Groups the given atoms into residues the way {@link #residues()} does.
     *
     * @param atoms atoms in file order
     * @return residues in order of first appearance
     */
    public static Map<ResidueKey, List<PdbAtom>> residues(List<PdbAtom> atoms) {
        Map<ResidueKey, List<PdbAtom>> residues = new LinkedHashMap<>();
        for (PdbAtom atom : atoms) {
            residues.computeIfAbsent(residueKey(atom), k -> new ArrayList<>()).add(atom);
        }
        return residues;
    }

    /**
     * @return the residue an atom belongs to
     */
    public static ResidueKey residueKey(PdbAtom atom) {
        String seg = atom.segname().isEmpty() ? atom.chain() : atom.segname();
        return new ResidueKey(seg, atom.resid());
    }

    /**
     * @return {min x, min y, min z, max x, max y, max z}; all zero for an empty structure
     */
    public double[] extent() {
        if (atoms.isEmpty()) {
            return new double[6];
        }
        double[] e = {Double.MAX_VALUE, Double.MAX_VALUE, Double.MAX_VALUE,
            -Double.MAX_VALUE, -Double.MAX_VALUE, -Double.MAX_VALUE};
        for (PdbAtom a : atoms) {
            e[0] = Math.min(e[0], a.x());
            e[1] = Math.min(e[1], a.y());
            e[2] = Math.min(e[2], a.z());
            e[3] = Math.max(e[3], a.x());
            e[4] = Math.max(e[4], a.y());
            e[5] = Math.max(e[5], a.z());
        }
        return e;
    }

    /**
     * Identifies a residue by segment and residue number.
     *
     * @param segname segment name
     * @param resid residue number
     */
    public record ResidueKey(String segname, int resid) {
    }
}
