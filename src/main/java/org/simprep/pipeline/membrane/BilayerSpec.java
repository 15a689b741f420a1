package org.simprep.pipeline.membrane;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.tasks.TaskDescriptor;

import java.util.List;

/**
 * Everything needed to build a membrane system.
 *
 * @param upper composition of the upper leaflet
 * @param lower composition of the lower leaflet
 * @param solvent residue name of the solvent packed in both chambers
 * @param solventToLipidRatio solvent molecules per lipid in the adjacent leaflet
 * @param sapl target surface area per lipid used to size the packed patch
 * @param upperPatchLipids lipids per leaflet in the upper-composition patch
 * @param lowerPatchLipids lipids per leaflet in the lower-composition patch
 * @param quiltSize replication target
 * @param xyAspectRatio patch y/x aspect ratio
 * @param seed seed for packing and for choosing lipids to trim
 * @param tolerance packing tolerance in Angstrom
 * @param nloop packing iterations per species
 * @param nloopAll packing iterations for the whole patch
 * @param halfMidZgap half the gap between the leaflets at the midplane
 * @param rotationPm allowed tilt in degrees around the packing orientation
 * @param cation cation residue name
 * @param anion anion residue name
 * @param saltConcentration salt concentration of the chambers in mol/L
 * @param patchProtocol relaxation tasks run on each packed patch
 * @param quiltProtocol relaxation tasks run on the final quilt
 * @param embed protein placement, or null to build a bare membrane
 */
public record BilayerSpec(
    LeafletComposition upper,
    LeafletComposition lower,
    String solvent,
    double solventToLipidRatio,
    double sapl,
    int upperPatchLipids,
    int lowerPatchLipids,
    QuiltSize quiltSize,
    double xyAspectRatio,
    long seed,
    double tolerance,
    int nloop,
    int nloopAll,
    double halfMidZgap,
    double rotationPm,
    String cation,
    String anion,
    double saltConcentration,
    List<TaskDescriptor> patchProtocol,
    List<TaskDescriptor> quiltProtocol,
    EmbedSpec embed
) {

    public BilayerSpec {
        patchProtocol = List.copyOf(patchProtocol);
        quiltProtocol = List.copyOf(quiltProtocol);
    }

    /**
     * @return true if the leaflets differ in species, fractions or conformers
     */
    public boolean isAsymmetric() {
        return !upper.sameComposition(lower);
    }

    /**
     * Checks compositions and sizes. Runs before any engine is invoked.
     *
     * @throws ConfigurationException on the first violated constraint
     */
    public void validate() {
        upper.validate("upper");
        lower.validate("lower");
        if (!(sapl > 0)) {
            throw new ConfigurationException("SAPL must be positive, got " + sapl);
        }
        if (upperPatchLipids < 1 || lowerPatchLipids < 1) {
            throw new ConfigurationException("Patch lipid counts must be positive, got upper="
                + upperPatchLipids + " lower=" + lowerPatchLipids);
        }
        if (!(xyAspectRatio > 0)) {
            throw new ConfigurationException("xy_aspect_ratio must be positive, got " + xyAspectRatio);
        }
        if (solventToLipidRatio < 0 || saltConcentration < 0) {
            throw new ConfigurationException("Solvent ratio and salt concentration must not be negative");
        }
    }
}
