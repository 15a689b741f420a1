package org.simprep.pipeline.membrane;

/**
 * One lipid species of a leaflet.
 *
 * @param name residue name of the lipid, e.g. {@code POPC}
 * @param fraction mole fraction of the species within its leaflet
 * @param conformer index of the template conformer to pack
 */
public record LipidSpec(String name, double fraction, int conformer) {

    public LipidSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Lipid name must not be blank");
        }
        if (conformer < 0) {
            throw new IllegalArgumentException("Conformer index of " + name + " must not be negative");
        }
    }
}
