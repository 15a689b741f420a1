package org.simprep.pipeline.membrane;

import org.simprep.pipeline.StateHandle;

/**
 * A bilayer patch and its measured lateral size.
 *
 * @param identity {@code symmetric}, {@code U}, {@code L} or {@code hybrid}
 * @param lipidsPerLeaflet lipids in each leaflet
 * @param area lateral area; measured from the box after relaxation
 * @param sapl surface area per lipid, {@code area / lipidsPerLeaflet}
 * @param symmetric whether both leaflets share one composition
 * @param state files of the patch
 */
public record PatchRecord(String identity, int lipidsPerLeaflet, double area, double sapl, boolean symmetric,
                          StateHandle state) {

    public static PatchRecord of(String identity, int lipidsPerLeaflet, double area, boolean symmetric, StateHandle state) {
        return new PatchRecord(identity, lipidsPerLeaflet, area, area / lipidsPerLeaflet, symmetric, state);
    }
}
