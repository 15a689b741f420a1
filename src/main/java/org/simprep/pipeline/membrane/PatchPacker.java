package org.simprep.pipeline.membrane;

import org.simprep.pipeline.engines.PackmolInput;

import java.util.Locale;
import java.util.Map;

/**
 * Writes the packing-engine input for one bilayer patch.
 * <p>
 * Lipids no longer than their leaflet slab are packed with restrained rotation, upper leaflet
 * heads up and lower leaflet heads down. The longest lipids instead get their head and tail
 * markers pinned near the slab faces. Solvent and ions fill the two chambers.
 */
final class PatchPacker {

    /** Distance from a slab face within which head and tail markers are held. */
    static final double FACE_MARGIN = 2.0;

    private final BilayerSpec bilayer;
    private final Map<String, LipidTemplate> templates;

    PatchPacker(BilayerSpec bilayer, Map<String, LipidTemplate> templates) {
        this.bilayer = bilayer;
        this.templates = templates;
    }

    /**
     * @param output basename of the packed coordinate file
     * @param geometry patch layout
     * @param composition composition of both leaflets
     * @param lipidsPerLeaflet lipids in each leaflet
     * @param solventPerChamber solvent molecules per chamber
     * @param ionsPerChamber cations and anions per chamber
     * @return the packing input
     */
    PackmolInput write(String output, PatchGeometry geometry, LeafletComposition composition, int lipidsPerLeaflet,
                       int solventPerChamber, int ionsPerChamber) {
        PackmolInput input = new PackmolInput();
        input.banner(output);
        input.line("tolerance %.2f", bilayer.tolerance());
        input.line("seed %d", bilayer.seed());
        input.line("nloop %d", bilayer.nloopAll());
        input.line("filetype pdb");
        input.line("output %s.pdb", output);
        input.line("pbc 0. 0. 0. %s %s %s", num(geometry.lx()), num(geometry.ly()), num(geometry.height()));

        Map<String, Integer> counts = composition.speciesCounts(lipidsPerLeaflet);
        for (Leaflet leaflet : Leaflet.values()) {
            double bottom = leaflet == Leaflet.UPPER ? geometry.upperLeafletBottom() : geometry.lowerChamberTop();
            double top = leaflet == Leaflet.UPPER ? geometry.upperLeafletTop() : geometry.lowerLeafletTop();
            for (Map.Entry<String, Integer> species : counts.entrySet()) {
                if (species.getValue() > 0) {
                    lipid(input, geometry, templates.get(species.getKey()), species.getValue(), leaflet, bottom, top);
                }
            }
        }

        chamber(input, geometry, 0.0, geometry.lowerChamberTop(), solventPerChamber, ionsPerChamber);
        chamber(input, geometry, geometry.upperLeafletTop(), geometry.height(), solventPerChamber, ionsPerChamber);
        return input;
    }

    private void lipid(PackmolInput input, PatchGeometry geometry, LipidTemplate template, int count, Leaflet leaflet,
                       double bottom, double top) {
        input.line("structure %s", template.file().toAbsolutePath());
        input.indented("number %d", count);
        input.indented("inside box 0. 0. %s %s %s %s", num(bottom), num(geometry.lx()), num(geometry.ly()), num(top));
        if (template.maxLength() < top - bottom) {
            int angle = leaflet == Leaflet.UPPER ? 0 : 180;
            input.indented("constrain_rotation x %d %s", angle, num(bilayer.rotationPm()));
            input.indented("constrain_rotation y %d %s", angle, num(bilayer.rotationPm()));
        } else {
            boolean up = leaflet == Leaflet.UPPER;
            double headPlane = up ? top - FACE_MARGIN : bottom + FACE_MARGIN;
            double tailPlane = up ? bottom + FACE_MARGIN : top - FACE_MARGIN;
            markers(input, template, true, up ? "over" : "below", headPlane);
            markers(input, template, false, up ? "below" : "over", tailPlane);
        }
        input.indented("nloop %d", bilayer.nloop());
        input.line("end structure");
    }

    private static void markers(PackmolInput input, LipidTemplate template, boolean head, String side, double z) {
        StringBuilder atoms = new StringBuilder();
        for (int n : head ? template.headAtoms() : template.tailAtoms()) {
            atoms.append(' ').append(n);
        }
        input.indented("atoms%s", atoms);
        input.indented("  %s plane 0. 0. 1. %s", side, num(z));
        input.indented("end atoms");
    }

    private void chamber(PackmolInput input, PatchGeometry geometry, double bottom, double top, int solvent, int ions) {
        String box = String.format(Locale.ROOT, "inside box 0. 0. %s %s %s %s",
            num(bottom), num(geometry.lx()), num(geometry.ly()), num(top));
        structure(input, templates.get(bilayer.solvent()), solvent, box);
        structure(input, templates.get(bilayer.cation()), ions, box);
        structure(input, templates.get(bilayer.anion()), ions, box);
    }

    private void structure(PackmolInput input, LipidTemplate template, int count, String box) {
        if (count < 1) {
            return;
        }
        input.line("structure %s", template.file().toAbsolutePath());
        input.indented("number %d", count);
        input.indented(box);
        input.indented("nloop %d", bilayer.nloop());
        input.line("end structure");
    }

    private static String num(double value) {
        return String.format(Locale.ROOT, "%.3f", value);
    }
}
