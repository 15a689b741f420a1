package org.simprep.pipeline.membrane;

/**
 * Stages of membrane construction. {@link #MERGED} and {@link #EXCESS_TRIMMED} occur only for
 * asymmetric bilayers, {@link #EMBEDDED} only when a protein is inserted.
 */
public enum BuildStage {
    NOT_STARTED,
    PATCH_BUILT,
    PATCH_RELAXED,
    MERGED,
    REPLICATED,
    EXCESS_TRIMMED,
    EMBEDDED,
    FINAL_RELAXED
}
