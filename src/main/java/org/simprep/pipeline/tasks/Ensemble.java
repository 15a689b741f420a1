package org.simprep.pipeline.tasks;

import java.util.Locale;

/**
 * Dynamics protocols a run-dynamics task can perform.
 */
public enum Ensemble {
    MINIMIZE(false, false),
    NVT(false, false),
    NPT(true, false),
    NPAT(true, true);

    private final boolean pressureControlled;
    private final boolean constantArea;

    Ensemble(boolean pressureControlled, boolean constantArea) {
        this.pressureControlled = pressureControlled;
        this.constantArea = constantArea;
    }

    /**
     * @return true if the ensemble couples the box to a barostat and so needs a periodic cell
     */
    public boolean isPressureControlled() {
        return pressureControlled;
    }

    public boolean isConstantArea() {
        return constantArea;
    }

    public static Ensemble parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown ensemble '" + text + "', expected minimize, NVT, NPT or NPAT", e);
        }
    }
}
