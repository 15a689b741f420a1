package org.simprep.pipeline.membrane;

import org.simprep.pipeline.ConfigurationException;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lipid species making up one leaflet.
 *
 * @param lipids species with their mole fractions; names are unique
 */
public record LeafletComposition(List<LipidSpec> lipids) {

    /** Allowed deviation of the fraction sum from one. */
    public static final double FRACTION_TOLERANCE = 0.01;

    public LeafletComposition {
        lipids = List.copyOf(lipids);
    }

    public double fractionSum() {
        return lipids.stream().mapToDouble(LipidSpec::fraction).sum();
    }

    /**
     * Checks that the leaflet is non-empty, names are unique, fractions are positive and
     * sum to one within {@link #FRACTION_TOLERANCE}.
     *
     * @param leaflet name of the leaflet for the error message
     * @throws ConfigurationException if any check fails
     */
    public void validate(String leaflet) {
        if (lipids.isEmpty()) {
            throw new ConfigurationException("The " + leaflet + " leaflet has no lipids");
        }
        Set<String> names = new HashSet<>();
        for (LipidSpec lipid : lipids) {
            if (!names.add(lipid.name())) {
                throw new ConfigurationException("Lipid " + lipid.name() + " listed twice in the " + leaflet + " leaflet");
            }
            if (!(lipid.fraction() > 0.0)) {
                throw new ConfigurationException("Lipid " + lipid.name() + " in the " + leaflet
                    + " leaflet has non-positive fraction " + lipid.fraction());
            }
        }
        double sum = fractionSum();
        if (Math.abs(sum - 1.0) > FRACTION_TOLERANCE) {
            throw new ConfigurationException(String.format(
                "Mole fractions of the %s leaflet sum to %.4f, expected 1.0", leaflet, sum));
        }
    }

    /**
     * Splits a leaflet lipid count among the species: each gets the floor of its share and
     * the remainder goes to the most abundant species (first listed on ties), so the counts
     * always add up to {@code total}.
     *
     * @param total number of lipids in the leaflet
     * @return lipid count per species name, in listing order
     */
    public Map<String, Integer> speciesCounts(int total) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        int assigned = 0;
        LipidSpec major = null;
        for (LipidSpec lipid : lipids) {
            int n = (int) Math.floor(lipid.fraction() * total);
            counts.put(lipid.name(), n);
            assigned += n;
            if (major == null || lipid.fraction() > major.fraction()) {
                major = lipid;
            }
        }
        if (major != null && assigned != total) {
            counts.merge(major.name(), total - assigned, Integer::sum);
        }
        return counts;
    }

    /**
     * Compares two leaflets as sets of (name, fraction, conformer), ignoring listing order.
     *
     * @param other the other leaflet
     * @return true if both leaflets hold the same species at the same fractions and conformers
     */
    public boolean sameComposition(LeafletComposition other) {
        return Set.copyOf(lipids).equals(Set.copyOf(other.lipids));
    }

    public Set<String> lipidNames() {
        Set<String> names = new HashSet<>();
        lipids.forEach(l -> names.add(l.name()));
        return names;
    }

    public int conformerOf(String name) {
        return lipids.stream().filter(l -> l.name().equals(name)).findFirst()
            .map(LipidSpec::conformer).orElse(0);
    }
}
