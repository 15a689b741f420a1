package org.simprep.pipeline.structure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Small coordinate and connectivity files for tests.
 */
public final class TestStructures {

    private TestStructures() {
    }

    /**
     * Three alanines on one chain, backbone atoms only, spaced along x.
     */
    public static List<PdbAtom> peptide(String chain) {
        List<PdbAtom> atoms = new ArrayList<>();
        String[] names = {"N", "CA", "C"};
        for (int resid = 1; resid <= 3; resid++) {
            for (int k = 0; k < names.length; k++) {
                double x = 4.0 * resid + 1.4 * k;
                atoms.add(new PdbAtom(atoms.size() + 1, names[k], "ALA", chain, resid, x, 1.0, 2.0, chain));
            }
        }
        return atoms;
    }

    /**
     * A bilayer of two-atom lipids on a square grid: {@code perLeaflet} residues of
     * {@code upperName} with z around +15 and as many of {@code lowerName} around -15,
     * one segment per leaflet ({@code UPL} and {@code LOL}).
     */
    public static List<PdbAtom> bilayer(String upperName, String lowerName, int perLeaflet) {
        List<PdbAtom> atoms = new ArrayList<>();
        int side = (int) Math.ceil(Math.sqrt(perLeaflet));
        for (int leaflet = 0; leaflet < 2; leaflet++) {
            String resname = leaflet == 0 ? upperName : lowerName;
            String seg = leaflet == 0 ? "UPL" : "LOL";
            double sign = leaflet == 0 ? 1.0 : -1.0;
            for (int i = 0; i < perLeaflet; i++) {
                double x = 8.0 * (i % side);
                double y = 8.0 * (i / side);
                int resid = i + 1;
                atoms.add(new PdbAtom(atoms.size() + 1, "P", resname, "", resid, x, y, sign * 20.0, seg));
                atoms.add(new PdbAtom(atoms.size() + 1, "C218", resname, "", resid, x, y, sign * 5.0, seg));
            }
        }
        return atoms;
    }

    public static void writePdb(Path file, List<PdbAtom> atoms) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("REMARK test structure");
        for (PdbAtom a : atoms) {
            lines.add(String.format(Locale.ROOT, "ATOM  %5d %-4s %-4s%1s%4d    %8.3f%8.3f%8.3f  1.00  0.00      %-4s",
                a.serial(), a.name(), a.resname(), a.chain(), a.resid(), a.x(), a.y(), a.z(), a.segname()));
        }
        lines.add("END");
        Files.write(file, lines);
    }

    /**
     * Writes a connectivity file whose atom section matches the given atoms; every atom
     * weighs 12 amu.
     */
    public static void writePsf(Path file, List<PdbAtom> atoms) throws IOException {
        writePsf(file, atoms, List.of());
    }

    /**
     * Writes a connectivity file with the given bonds, pairs of 0-based atom indices.
     */
    public static void writePsf(Path file, List<PdbAtom> atoms, List<int[]> bonds) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("PSF EXT");
        lines.add("");
        lines.add("         1 !NTITLE");
        lines.add(" REMARKS test connectivity");
        lines.add("");
        lines.add(String.format(Locale.ROOT, "%10d !NATOM", atoms.size()));
        for (PdbAtom a : atoms) {
            String seg = a.segname().isEmpty() ? (a.chain().isEmpty() ? "X" : a.chain()) : a.segname();
            lines.add(String.format(Locale.ROOT, "%10d %-8s %-8d %-8s %-8s %-6s %10.6f %13.4f %11d",
                a.serial(), seg, a.resid(), a.resname(), a.name(), a.name(), 0.0, 12.0, 0));
        }
        lines.add("");
        lines.add(String.format(Locale.ROOT, "%10d !NBOND: bonds", bonds.size()));
        StringBuilder row = new StringBuilder();
        for (int i = 0; i < bonds.size(); i++) {
            row.append(String.format(Locale.ROOT, "%10d%10d", bonds.get(i)[0] + 1, bonds.get(i)[1] + 1));
            if (i % 4 == 3 || i == bonds.size() - 1) {
                lines.add(row.toString());
                row.setLength(0);
            }
        }
        Files.write(file, lines);
    }

    public static void writeStructure(Path psf, Path pdb, List<PdbAtom> atoms) throws IOException {
        writePsf(psf, atoms);
        writePdb(pdb, atoms);
    }
}
