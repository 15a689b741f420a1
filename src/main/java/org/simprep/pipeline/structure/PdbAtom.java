package org.simprep.pipeline.structure;

/**
 * One ATOM or HETATM record of a coordinate file.
 *
 * @param serial atom serial number as written, or the 1-based position if unreadable
 * @param name atom name
 * @param resname residue name (up to four characters)
 * @param chain chain identifier, may be empty
 * @param resid residue number
 * @param x x coordinate in Angstrom
 * @param y y coordinate in Angstrom
 * @param z z coordinate in Angstrom
 * @param segname segment name, may be empty
 */
public record PdbAtom(int serial, String name, String resname, String chain, int resid,
                      double x, double y, double z, String segname) {

    public boolean hasFiniteCoordinates() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }

    public double distanceTo(PdbAtom other) {
        double dx = x - other.x;
        double dy = y - other.y;
        double dz = z - other.z;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }
}
