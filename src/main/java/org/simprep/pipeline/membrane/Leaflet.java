package org.simprep.pipeline.membrane;

/**
 * One of the two monolayers of a bilayer.
 */
public enum Leaflet {
    UPPER,
    LOWER
}
