package org.simprep.pipeline.membrane;

/**
 * Lateral size and z-layering of a packed bilayer patch, bottom to top: lower chamber,
 * lower leaflet, midplane gap, upper leaflet, upper chamber. z starts at zero.
 *
 * @param lx patch length along x
 * @param ly patch length along y
 * @param lowerChamberTop top of the lower solvent chamber
 * @param lowerLeafletTop top of the lower leaflet
 * @param midplane z of the bilayer midplane
 * @param upperLeafletBottom bottom of the upper leaflet
 * @param upperLeafletTop top of the upper leaflet
 * @param height total patch height (top of the upper chamber)
 */
public record PatchGeometry(double lx, double ly, double lowerChamberTop, double lowerLeafletTop, double midplane,
                            double upperLeafletBottom, double upperLeafletTop, double height) {

    /**
     * Lays out a patch.
     *
     * @param sapl target surface area per lipid
     * @param lipidsPerLeaflet lipids in each leaflet
     * @param aspect y/x aspect ratio
     * @param lowerLipidLength longest lipid of the lower leaflet
     * @param upperLipidLength longest lipid of the upper leaflet
     * @param lowerChamberVolume solution volume of the lower chamber
     * @param upperChamberVolume solution volume of the upper chamber
     * @param halfMidZgap half the gap at the midplane
     * @param rotationPm allowed tilt in degrees, which shortens the leaflet slabs
     * @return the layout
     */
    public static PatchGeometry compute(double sapl, int lipidsPerLeaflet, double aspect,
                                        double lowerLipidLength, double upperLipidLength,
                                        double lowerChamberVolume, double upperChamberVolume,
                                        double halfMidZgap, double rotationPm) {
        double area = sapl * lipidsPerLeaflet;
        double lx = Math.sqrt(area / aspect);
        double ly = aspect * lx;
        double tilt = Math.cos(Math.toRadians(rotationPm));
        double lowerChamberTop = lowerChamberVolume / area;
        double lowerLeafletTop = lowerChamberTop + tilt * lowerLipidLength;
        double midplane = lowerLeafletTop + halfMidZgap;
        double upperLeafletBottom = lowerLeafletTop + 2 * halfMidZgap;
        double upperLeafletTop = upperLeafletBottom + tilt * upperLipidLength;
        double height = upperLeafletTop + upperChamberVolume / area;
        return new PatchGeometry(lx, ly, lowerChamberTop, lowerLeafletTop, midplane, upperLeafletBottom,
            upperLeafletTop, height);
    }

    public double area() {
        return lx * ly;
    }
}
