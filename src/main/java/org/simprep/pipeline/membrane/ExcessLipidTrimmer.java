package org.simprep.pipeline.membrane;

import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.structure.PdbAtom;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.structure.PdbStructure.ResidueKey;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Chooses the lipids removed from the sparse leaflet of an asymmetric quilt.
 * <p>
 * A lipid belongs to the upper leaflet when the mean z of its atoms lies above the bilayer
 * midplane, taken as the mean z of all lipid atoms. Candidates are shuffled with a
 * {@link Random} seeded from the bilayer seed, so the same quilt and seed always lose the
 * same lipids.
 */
public final class ExcessLipidTrimmer {

    private static final Comparator<ResidueKey> BY_SEGMENT_AND_RESID =
        Comparator.comparing(ResidueKey::segname).thenComparingInt(ResidueKey::resid);

    private ExcessLipidTrimmer() {
    }

    /**
     * Selects the residues to delete.
     *
     * @param quilt coordinates of the replicated quilt
     * @param lipidNames residue names of every lipid species in the bilayer
     * @param trimmedSpecies residue names of the species making up the trimmed leaflet
     * @param plan leaflet and number of lipids to remove
     * @param seed selection seed
     * @return residues to delete, sorted by segment and residue number
     * @throws StateInconsistencyException if the leaflet holds fewer candidates than the excess
     */
    public static List<ResidueKey> select(PdbStructure quilt, Set<String> lipidNames, Set<String> trimmedSpecies,
                                          TrimPlan plan, long seed) {
        if (!plan.isNeeded()) {
            return List.of();
        }
        Map<ResidueKey, List<PdbAtom>> residues = quilt.residues();
        double midplane = midplane(residues, lipidNames);

        List<ResidueKey> candidates = new ArrayList<>();
        for (Map.Entry<ResidueKey, List<PdbAtom>> residue : residues.entrySet()) {
            List<PdbAtom> atoms = residue.getValue();
            if (!trimmedSpecies.contains(atoms.get(0).resname())) {
                continue;
            }
            Leaflet side = meanZ(atoms) > midplane ? Leaflet.UPPER : Leaflet.LOWER;
            if (side == plan.leaflet()) {
                candidates.add(residue.getKey());
            }
        }
        if (candidates.size() < plan.excess()) {
            throw new StateInconsistencyException("Cannot trim " + plan.excess() + " lipids from the "
                + plan.leaflet().name().toLowerCase(Locale.ROOT) + " leaflet: only " + candidates.size() + " found");
        }

        candidates.sort(BY_SEGMENT_AND_RESID);
        Collections.shuffle(candidates, new Random(seed));
        List<ResidueKey> chosen = new ArrayList<>(candidates.subList(0, plan.excess()));
        chosen.sort(BY_SEGMENT_AND_RESID);
        return chosen;
    }

    static double midplane(Map<ResidueKey, List<PdbAtom>> residues, Set<String> lipidNames) {
        double sum = 0.0;
        int n = 0;
        for (List<PdbAtom> atoms : residues.values()) {
            if (!lipidNames.contains(atoms.get(0).resname())) {
                continue;
            }
            for (PdbAtom a : atoms) {
                sum += a.z();
                n++;
            }
        }
        if (n == 0) {
            throw new StateInconsistencyException("Quilt holds no lipids");
        }
        return sum / n;
    }

    private static double meanZ(List<PdbAtom> atoms) {
        return atoms.stream().mapToDouble(PdbAtom::z).average().orElse(0.0);
    }
}
