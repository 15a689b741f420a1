package org.simprep.pipeline.tasks;

import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.ValidationFailureException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.structure.NamdBinCoordinates;
import org.simprep.pipeline.structure.PdbAtom;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.structure.PdbStructure.ResidueKey;
import org.simprep.pipeline.structure.PeriodicBox;
import org.simprep.pipeline.structure.PsfFile;
import org.simprep.pipeline.structure.RingPiercings;
import org.simprep.pipeline.structure.StructureChecks;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks the current structure for defects that would otherwise surface only in later
 * stages:
 * <ul>
 *   <li>connectivity and coordinates disagree on the atom count</li>
 *   <li>coordinates that are not finite</li>
 *   <li>more than one atom exactly at the origin, the mark psfgen leaves on unplaced atoms</li>
 *   <li>two atoms of one residue closer than the configured minimum distance</li>
 *   <li>a bond threaded through a ring of another residue, when {@code ring-check} is on</li>
 * </ul>
 * Distances are measured on the current coordinates, the binary coordinates when present.
 * Findings are logged as a summary. Unless {@code fail-on-error} is switched off, any finding
 * aborts the run. The state passes through unchanged.
 */
public class ValidateTask extends AbstractTask<TaskSpec.Validate> {

    private static final int MAX_REPORTED = 20;

    public ValidateTask(TaskSpec.Validate spec) {
        super(spec);
    }

    @Override
    protected void checkPreconditions(StateHandle input, TaskContext context) {
        requireCoordinates(input);
    }

    @Override
    protected StateHandle execute(StateHandle input, TaskContext context) throws IOException {
        List<String> findings = new ArrayList<>();
        if (input.psf() != null) {
            StructureChecks.atomCountMismatch(input).ifPresent(findings::add);
        }
        List<PdbAtom> atoms = currentAtoms(input, findings);

        int atOrigin = 0;
        for (PdbAtom atom : atoms) {
            if (!atom.hasFiniteCoordinates()) {
                findings.add("Atom " + atom.serial() + " (" + atom.name() + ") has non-finite coordinates");
            } else if (atom.x() == 0.0 && atom.y() == 0.0 && atom.z() == 0.0) {
                atOrigin++;
            }
        }
        if (atOrigin > 1) {
            findings.add(atOrigin + " atoms sit exactly at the origin and were probably never placed");
        }

        Map<ResidueKey, List<PdbAtom>> residues = PdbStructure.residues(atoms);
        for (Map.Entry<ResidueKey, List<PdbAtom>> residue : residues.entrySet()) {
            checkContacts(residue.getKey(), residue.getValue(), findings);
        }
        if (spec.ringCheck() && input.psf() != null) {
            checkRings(input, atoms, findings);
        }

        log.info("Validation of {}: {} atoms, {} residues, {} finding(s)", input.basename(), atoms.size(),
            residues.size(), findings.size());
        findings.stream().limit(MAX_REPORTED).forEach(f -> log.warn("  {}", f));
        if (findings.size() > MAX_REPORTED) {
            log.warn("  ... and {} more", findings.size() - MAX_REPORTED);
        }
        if (!findings.isEmpty() && spec.failOnError()) {
            throw new ValidationFailureException(findings.size() + " structural problem(s) found in "
                + input.basename() + "; first: " + findings.get(0), findings);
        }
        return input;
    }

    private List<PdbAtom> currentAtoms(StateHandle input, List<String> findings) throws IOException {
        List<PdbAtom> atoms = PdbStructure.read(input.pdb()).atoms();
        if (input.coor() == null) {
            return atoms;
        }
        double[][] xyz = NamdBinCoordinates.read(input.coor());
        if (xyz.length != atoms.size()) {
            findings.add(input.coor().getFileName() + " holds " + xyz.length + " atoms but "
                + input.pdb().getFileName() + " holds " + atoms.size());
            return atoms;
        }
        List<PdbAtom> moved = new ArrayList<>(atoms.size());
        for (int i = 0; i < xyz.length; i++) {
            PdbAtom a = atoms.get(i);
            moved.add(new PdbAtom(a.serial(), a.name(), a.resname(), a.chain(), a.resid(),
                xyz[i][0], xyz[i][1], xyz[i][2], a.segname()));
        }
        return moved;
    }

    private void checkRings(StateHandle input, List<PdbAtom> atoms, List<String> findings) throws IOException {
        List<int[]> bonds = PsfFile.bonds(input.psf());
        if (bonds.stream().anyMatch(b -> b[0] >= atoms.size() || b[1] >= atoms.size())) {
            // already reported as an atom count mismatch
            return;
        }
        PeriodicBox box = input.xsc() == null ? null : PeriodicBox.read(input.xsc());
        for (RingPiercings.Piercing piercing : new RingPiercings(atoms, bonds, box, spec.ringCutoff()).find()) {
            findings.add(piercing.toString());
        }
    }

    private void checkContacts(ResidueKey key, List<PdbAtom> atoms, List<String> findings) {
        for (int i = 0; i < atoms.size(); i++) {
            for (int j = i + 1; j < atoms.size(); j++) {
                double d = atoms.get(i).distanceTo(atoms.get(j));
                if (d < spec.minDistance()) {
                    findings.add(String.format(Locale.ROOT, "Atoms %s and %s of %s:%d are %.3f A apart",
                        atoms.get(i).name(), atoms.get(j).name(), key.segname(), key.resid(), d));
                }
            }
        }
    }
}
