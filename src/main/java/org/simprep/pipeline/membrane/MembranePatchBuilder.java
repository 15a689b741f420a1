package org.simprep.pipeline.membrane;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.EngineFailureException;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.StateInconsistencyException;
import org.simprep.pipeline.controller.TaskContext;
import org.simprep.pipeline.engines.Engine;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PdbStructure;
import org.simprep.pipeline.structure.PdbStructure.ResidueKey;
import org.simprep.pipeline.structure.PeriodicBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds a solvated bilayer from leaflet compositions.
 * <p>
 * A symmetric bilayer is packed as a single patch, relaxed, and tiled into the quilt. An
 * asymmetric bilayer is packed as two patches, one per leaflet composition, each relaxed on
 * its own. Their leaflets are merged into a hybrid patch on the box of the larger patch, the
 * hybrid is tiled, and lipids are removed from the leaflet that came from the larger patch
 * until both leaflets have the same area per lipid. The quilt is relaxed last, after the
 * protein has been embedded if one is requested.
 * <p>
 * Every relaxation runs as a sub-controller of the controller running the membrane task.
 * A builder is used once.
 */
public class MembranePatchBuilder {

    private static final Logger log = LoggerFactory.getLogger(MembranePatchBuilder.class);

    /** Molarity of pure water, used to turn a salt concentration into an ion count. */
    static final double WATER_MOLARITY = 55.5;

    private final BilayerSpec bilayer;
    private final TaskContext context;
    private final Map<String, LipidTemplate> templates = new LinkedHashMap<>();
    private final List<BuildStage> history = new ArrayList<>();
    private final List<PatchRecord> patches = new ArrayList<>();
    private TrimPlan trimPlan;

    public MembranePatchBuilder(BilayerSpec bilayer, TaskContext context) {
        this.bilayer = bilayer;
        this.context = context;
        history.add(BuildStage.NOT_STARTED);
    }

    /**
     * Validates the compositions and loads every template. Runs no engine, so configuration
     * errors surface before any packing starts.
     *
     * @throws ConfigurationException if a composition or template is invalid
     * @throws IOException if a template cannot be read
     */
    public void prepare() throws IOException {
        if (!templates.isEmpty()) {
            return;
        }
        bilayer.validate();
        MembraneSettings settings = context.settings().membrane();
        for (LeafletComposition leaflet : List.of(bilayer.upper(), bilayer.lower())) {
            for (LipidSpec lipid : leaflet.lipids()) {
                if (!templates.containsKey(lipid.name())) {
                    LipidTemplate template = LipidTemplate.load(settings, context.workDir(), lipid.name(), lipid.conformer());
                    if (!template.isLipid()) {
                        throw new ConfigurationException(
                            lipid.name() + " has no head and tail markers configured");
                    }
                    templates.put(lipid.name(), template);
                }
            }
        }
        for (String name : List.of(bilayer.solvent(), bilayer.cation(), bilayer.anion())) {
            templates.putIfAbsent(name, LipidTemplate.load(settings, context.workDir(), name, 0));
        }
    }

    /**
     * Runs all stages.
     *
     * @param input state before the membrane task; its structure is embedded when the
     *              bilayer asks for it
     * @return the relaxed membrane system
     * @throws IOException if an intermediate file cannot be read or written
     */
    public StateHandle build(StateHandle input) throws IOException {
        prepare();
        double[] proteinExtent = embedsProtein(input) ? PdbStructure.read(input.pdb()).extent() : null;

        PatchRecord tile;
        if (bilayer.isAsymmetric()) {
            PatchRecord upper = relax(pack("U", bilayer.upper(), bilayer.upperPatchLipids()));
            PatchRecord lower = relax(pack("L", bilayer.lower(), bilayer.lowerPatchLipids()));
            tile = merge(upper, lower);
        } else {
            tile = relax(pack("symmetric", bilayer.upper(), bilayer.upperPatchLipids()));
        }

        PeriodicBox tileBox = PeriodicBox.read(tile.state().xsc());
        int[] n = bilayer.quiltSize().resolve(tileBox.ax(), tileBox.by(), proteinExtent);
        StateHandle quilt = replicate(tile.state(), tileBox, n[0], n[1]);

        if (bilayer.isAsymmetric()) {
            trimPlan = TrimPlan.compute(patches.get(0), patches.get(1), n[0] * n[1]);
            log.info(String.format(Locale.ROOT, "Trim plan: %d of %d lipids from the %s leaflet (areas %.2f / %.2f)",
                trimPlan.excess(), trimPlan.quiltLeafletCount(),
                trimPlan.leaflet() == null ? "neither" : trimPlan.leaflet().name().toLowerCase(Locale.ROOT),
                trimPlan.largerArea(), trimPlan.smallerArea()));
            if (trimPlan.isNeeded()) {
                quilt = trim(quilt, trimPlan);
            }
        }

        if (proteinExtent != null) {
            quilt = embed(input, quilt);
        }

        StateHandle relaxed = bilayer.quiltProtocol().isEmpty()
            ? quilt
            : context.runSubController(bilayer.quiltProtocol(), quilt);
        advance(BuildStage.FINAL_RELAXED);

        return input.toBuilder()
            .structure(relaxed.psf(), relaxed.pdb())
            .coor(relaxed.coor())
            .vel(relaxed.vel())
            .xsc(relaxed.xsc())
            .pendingLoopGaps(List.of())
            .firstTimestep(0)
            .basename(relaxed.basename())
            .provenance(context.provenance())
            .build();
    }

    public BuildStage stage() {
        return history.get(history.size() - 1);
    }

    /**
     * @return every stage reached so far, in order, starting with {@link BuildStage#NOT_STARTED}
     */
    public List<BuildStage> history() {
        return Collections.unmodifiableList(history);
    }

    /**
     * @return the relaxed patches: one for a symmetric bilayer, upper then lower for an asymmetric one
     */
    public List<PatchRecord> patches() {
        return Collections.unmodifiableList(patches);
    }

    public Optional<TrimPlan> trimPlan() {
        return Optional.ofNullable(trimPlan);
    }

    private boolean embedsProtein(StateHandle input) {
        return bilayer.embed() != null && input.hasTopology();
    }

    PatchRecord pack(String identity, LeafletComposition composition, int lipidsPerLeaflet) throws IOException {
        MembraneSettings settings = context.settings().membrane();
        int solvent = (int) Math.round(bilayer.solventToLipidRatio() * lipidsPerLeaflet);
        int ions = (int) Math.round(bilayer.saltConcentration() * solvent / WATER_MOLARITY);
        double chamberVolume = solvent * settings.molecularVolume(bilayer.solvent())
            + ions * (settings.molecularVolume(bilayer.cation()) + settings.molecularVolume(bilayer.anion()));
        double lipidLength = composition.lipidNames().stream()
            .mapToDouble(name -> templates.get(name).maxLength()).max().orElse(0.0);
        PatchGeometry geometry = PatchGeometry.compute(bilayer.sapl(), lipidsPerLeaflet, bilayer.xyAspectRatio(),
            lipidLength, lipidLength, chamberVolume, chamberVolume, bilayer.halfMidZgap(), bilayer.rotationPm());
        log.info(String.format(Locale.ROOT,
            "Packing patch %s: %d lipids per leaflet, %d %s and %d ion pairs per chamber, %.2f x %.2f x %.2f A",
            identity, lipidsPerLeaflet, solvent, bilayer.solvent(), ions, geometry.lx(), geometry.ly(), geometry.height()));

        String packed = context.nextBasename("packmol-" + identity);
        try {
            context.runScript(Engine.PACKMOL,
                new PatchPacker(bilayer, templates).write(packed, geometry, composition, lipidsPerLeaflet, solvent, ions),
                packed);
            context.requireArtifact(context.file(packed, "pdb"));
        } catch (EngineFailureException e) {
            throw new EngineFailureException("Packing of patch " + identity + " did not finish: " + e.getMessage(), e);
        }

        String basename = context.nextBasename("patch-" + identity);
        Map<String, String> segments = new LinkedHashMap<>();
        int k = 0;
        for (String lipid : MembraneScripts.sorted(composition.lipidNames())) {
            segments.put(lipid, "L" + (++k));
        }
        segments.put(bilayer.solvent(), "W");
        segments.putIfAbsent(bilayer.cation(), "I1");
        segments.putIfAbsent(bilayer.anion(), "I2");

        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        MembraneScripts.segmentsFromPacked(script, packed + ".pdb", basename, segments);
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        Path xsc = context.file(basename, "xsc");
        new PeriodicBox(geometry.lx(), geometry.ly(), geometry.height(),
            geometry.lx() / 2, geometry.ly() / 2, geometry.height() / 2).write(xsc);

        StateHandle state = context.finish(StateHandle.empty().toBuilder().structure(psf, pdb).xsc(xsc), basename);
        advance(BuildStage.PATCH_BUILT);
        return PatchRecord.of(identity, lipidsPerLeaflet, geometry.area(), true, state);
    }

    PatchRecord relax(PatchRecord patch) throws IOException {
        StateHandle relaxed = bilayer.patchProtocol().isEmpty()
            ? patch.state()
            : context.runSubController(bilayer.patchProtocol(), patch.state());
        if (!relaxed.hasBox()) {
            throw new StateInconsistencyException("Relaxation of patch " + patch.identity() + " lost the periodic box");
        }
        double area = PeriodicBox.read(relaxed.xsc()).area();
        PatchRecord result = PatchRecord.of(patch.identity(), patch.lipidsPerLeaflet(), area, true, relaxed);
        log.info(String.format(Locale.ROOT, "Patch %s relaxed: area %.2f A^2, %.2f A^2 per lipid (target %.2f)",
            patch.identity(), area, result.sapl(), bilayer.sapl()));
        patches.add(result);
        advance(BuildStage.PATCH_RELAXED);
        return result;
    }

    PatchRecord merge(PatchRecord upper, PatchRecord lower) throws IOException {
        PeriodicBox upperBox = PeriodicBox.read(upper.state().xsc());
        PeriodicBox lowerBox = PeriodicBox.read(lower.state().xsc());
        PatchRecord larger = lower.area() > upper.area() ? lower : upper;
        PeriodicBox largerBox = larger == lower ? lowerBox : upperBox;

        String basename = context.nextBasename("hybrid");
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        MembraneScripts.merge(script, upper.state(), lower.state(), upperBox, lowerBox, lipidNames(), basename);
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        Path xsc = context.file(basename, "xsc");
        new PeriodicBox(largerBox.ax(), largerBox.by(), Math.max(upperBox.cz(), lowerBox.cz()),
            largerBox.ox(), largerBox.oy(), largerBox.oz()).write(xsc);

        StateHandle state = context.finish(StateHandle.empty().toBuilder().structure(psf, pdb).xsc(xsc), basename);
        log.info("Merged upper leaflet of patch U and lower leaflet of patch L on the box of patch {}",
            larger.identity());
        advance(BuildStage.MERGED);
        return PatchRecord.of("hybrid", larger.lipidsPerLeaflet(), larger.area(), false, state);
    }

    StateHandle replicate(StateHandle tile, PeriodicBox box, int nx, int ny) throws IOException {
        String basename = context.nextBasename("quilt");
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        MembraneScripts.replicate(script, tile, segmentCount(tile), box, nx, ny, basename);
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        Path xsc = context.file(basename, "xsc");
        new PeriodicBox(nx * box.ax(), ny * box.by(), box.cz(),
            box.ox() + (nx - 1) * box.ax() / 2, box.oy() + (ny - 1) * box.by() / 2, box.oz()).write(xsc);
        log.info("Replicated patch into a {} x {} quilt", nx, ny);
        advance(BuildStage.REPLICATED);
        return context.finish(StateHandle.empty().toBuilder().structure(psf, pdb).xsc(xsc), basename);
    }

    private static int segmentCount(StateHandle state) throws IOException {
        return (int) PdbStructure.read(state.pdb()).atoms().stream()
            .map(a -> a.segname().isEmpty() ? a.chain() : a.segname())
            .distinct()
            .count();
    }

    StateHandle trim(StateHandle quilt, TrimPlan plan) throws IOException {
        LeafletComposition trimmed = plan.leaflet() == Leaflet.UPPER ? bilayer.upper() : bilayer.lower();
        List<ResidueKey> doomed = ExcessLipidTrimmer.select(PdbStructure.read(quilt.pdb()), lipidNames(),
            trimmed.lipidNames(), plan, bilayer.seed());

        String basename = context.nextBasename("trim");
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        script.loadState(quilt);
        for (ResidueKey residue : doomed) {
            script.deleteResidue(residue.segname(), residue.resid());
        }
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        log.info("Removed {} lipids from the {} leaflet", doomed.size(), plan.leaflet().name().toLowerCase(Locale.ROOT));
        advance(BuildStage.EXCESS_TRIMMED);
        return context.finish(quilt.toBuilder().structure(psf, pdb), basename);
    }

    StateHandle embed(StateHandle protein, StateHandle quilt) throws IOException {
        String basename = context.nextBasename("embed");
        PsfgenScript script = new PsfgenScript();
        script.banner(basename);
        script.begin(context.settings().topologies());
        MembraneScripts.embed(script, protein, quilt, bilayer.embed(), lipidNames(), basename);
        script.writeState(basename);
        script.exit();
        context.runScript(Engine.PSFGEN, script, basename);

        Path psf = context.requireArtifact(context.file(basename, "psf"));
        Path pdb = context.requireArtifact(context.file(basename, "pdb"));
        advance(BuildStage.EMBEDDED);
        return context.finish(quilt.toBuilder().structure(psf, pdb), basename);
    }

    private Set<String> lipidNames() {
        Set<String> names = new TreeSet<>(bilayer.upper().lipidNames());
        names.addAll(bilayer.lower().lipidNames());
        return names;
    }

    private void advance(BuildStage next) {
        log.debug("Membrane build stage {} -> {}", stage(), next);
        history.add(next);
    }
}
