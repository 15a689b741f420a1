package org.simprep.pipeline.membrane;

/**
 * How a protein is placed into the membrane.
 *
 * @param headSelection atom selection that sits at the upper head-group plane
 * @param tailSelection atom selection that sits at the lower head-group plane
 * @param noOrient skip aligning the head-to-tail vector with z
 * @param overlapCutoff lipids and solvent with any atom closer than this to the protein are removed
 */
public record EmbedSpec(String headSelection, String tailSelection, boolean noOrient, double overlapCutoff) {
}
