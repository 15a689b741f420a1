package org.simprep.pipeline.membrane;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.structure.PdbAtom;
import org.simprep.pipeline.structure.PdbStructure;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * A template conformer packed by the packing engine, with the geometry that decides how
 * it is oriented in its leaflet.
 *
 * @param name residue name
 * @param conformer conformer index
 * @param file template coordinate file
 * @param headAtoms 1-based atom numbers of the head markers
 * @param tailAtoms 1-based atom numbers of the tail markers
 * @param maxLength largest distance between two atoms of the conformer
 * @param headTailLength distance between the head and tail marker centroids
 */
public record LipidTemplate(String name, int conformer, Path file, List<Integer> headAtoms, List<Integer> tailAtoms,
                            double maxLength, double headTailLength) {

    /**
     * Loads and measures a template.
     *
     * @param settings species data and template location
     * @param workDir directory the template directory is relative to
     * @param name residue name
     * @param conformer conformer index
     * @return the template
     * @throws ConfigurationException if the template file is missing or lacks a marker atom
     * @throws IOException if the template cannot be read
     */
    public static LipidTemplate load(MembraneSettings settings, Path workDir, String name, int conformer)
            throws IOException {
        MembraneSettings.Species species = settings.species(name);
        Path file = workDir.resolve(settings.templateDir()).resolve(name).resolve(name + "-" + conformer + ".pdb");
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("No template for " + name + " conformer " + conformer + " at " + file);
        }
        List<PdbAtom> atoms = PdbStructure.read(file).atoms();
        List<Integer> heads = markers(atoms, species.headAtoms(), name, file);
        List<Integer> tails = markers(atoms, species.tailAtoms(), name, file);

        double maxLength = 0.0;
        for (int i = 0; i < atoms.size(); i++) {
            for (int j = i + 1; j < atoms.size(); j++) {
                maxLength = Math.max(maxLength, atoms.get(i).distanceTo(atoms.get(j)));
            }
        }
        double headTail = heads.isEmpty() || tails.isEmpty() ? 0.0
            : distance(centroid(atoms, heads), centroid(atoms, tails));
        return new LipidTemplate(name, conformer, file, heads, tails, maxLength, headTail);
    }

    public boolean isLipid() {
        return !headAtoms.isEmpty() && !tailAtoms.isEmpty();
    }

    private static List<Integer> markers(List<PdbAtom> atoms, List<String> names, String species, Path file) {
        List<Integer> numbers = new ArrayList<>();
        for (String marker : names) {
            int found = -1;
            for (int i = 0; i < atoms.size(); i++) {
                if (atoms.get(i).name().equals(marker)) {
                    found = i + 1;
                    break;
                }
            }
            if (found < 0) {
                throw new ConfigurationException("Template " + file.getFileName() + " of " + species
                    + " has no marker atom " + marker);
            }
            numbers.add(found);
        }
        return numbers;
    }

    private static double[] centroid(List<PdbAtom> atoms, List<Integer> numbers) {
        double[] c = new double[3];
        for (int n : numbers) {
            PdbAtom a = atoms.get(n - 1);
            c[0] += a.x();
            c[1] += a.y();
            c[2] += a.z();
        }
        for (int k = 0; k < 3; k++) {
            c[k] /= numbers.size();
        }
        return c;
    }

    private static double distance(double[] a, double[] b) {
        double dx = a[0] - b[0];
        double dy = a[1] - b[1];
        double dz = a[2] - b[2];
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
