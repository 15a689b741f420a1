package org.simprep.pipeline.membrane;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * How many lipids to remove from which leaflet of an asymmetric quilt.
 * <p>
 * The hybrid patch takes its box from the patch with the larger relaxed area. The leaflet
 * that came from that patch is the sparser one and loses
 * {@code round(quiltLeafletCount * (largerArea / smallerArea - 1))} lipids, rounded half up.
 * The product is first rounded to six decimals so floating-point noise cannot move an exact
 * half below the tie.
 *
 * @param leaflet leaflet to trim, or null if both patches have the same area
 * @param excess number of lipids to remove
 * @param quiltLeafletCount lipids in the trimmed leaflet of the whole quilt before trimming
 * @param largerArea larger relaxed patch area
 * @param smallerArea smaller relaxed patch area
 */
public record TrimPlan(Leaflet leaflet, int excess, int quiltLeafletCount, double largerArea, double smallerArea) {

    /**
     * Plans the trim.
     *
     * @param upperPatch relaxed patch with the upper composition
     * @param lowerPatch relaxed patch with the lower composition
     * @param replicas number of patch copies in the quilt
     * @return the plan
     */
    public static TrimPlan compute(PatchRecord upperPatch, PatchRecord lowerPatch, int replicas) {
        if (!(upperPatch.area() > 0) || !(lowerPatch.area() > 0)) {
            throw new IllegalArgumentException("Patch areas must be positive: U=" + upperPatch.area()
                + " L=" + lowerPatch.area());
        }
        if (upperPatch.area() == lowerPatch.area()) {
            return new TrimPlan(null, 0, upperPatch.lipidsPerLeaflet() * replicas, upperPatch.area(), lowerPatch.area());
        }
        boolean lowerLarger = lowerPatch.area() > upperPatch.area();
        PatchRecord larger = lowerLarger ? lowerPatch : upperPatch;
        PatchRecord smaller = lowerLarger ? upperPatch : lowerPatch;
        int count = larger.lipidsPerLeaflet() * replicas;
        int excess = excess(count, larger.area(), smaller.area());
        return new TrimPlan(lowerLarger ? Leaflet.LOWER : Leaflet.UPPER, excess, count, larger.area(), smaller.area());
    }

    /**
     * @return {@code round-half-up(count * (larger / smaller - 1))}
     */
    static int excess(int count, double larger, double smaller) {
        double raw = count * (larger / smaller - 1.0);
        return BigDecimal.valueOf(raw)
            .setScale(6, RoundingMode.HALF_UP)
            .setScale(0, RoundingMode.HALF_UP)
            .intValueExact();
    }

    public boolean isNeeded() {
        return leaflet != null && excess > 0;
    }
}
