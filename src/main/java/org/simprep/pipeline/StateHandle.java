package org.simprep.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable description of the molecular system between two tasks.
 * <p>
 * A task receives one handle and returns a new one; it never mutates its input. The handle
 * names the current files in the working directory:
 * <ul>
 *   <li><b>psf</b> - connectivity; {@code null} only before topology has been built</li>
 *   <li><b>pdb</b> - coordinates in the same atom order as the psf</li>
 *   <li><b>coor/vel</b> - binary coordinates and velocities from the last dynamics stage, or null</li>
 *   <li><b>xsc</b> - periodic box, or null for a non-periodic system</li>
 * </ul>
 * Whenever psf and pdb are both set they describe the same atoms in the same order.
 *
 * @param psf connectivity file
 * @param pdb coordinate file
 * @param coor binary coordinate file, nullable
 * @param vel binary velocity file, nullable
 * @param xsc box file, nullable
 * @param chainIdMap maps source chain ids, or the site shortcode of a graft or cleaved fragment,
 *                   to the chain id used in the built system
 * @param basename basename of the files above
 * @param provenance task step that produced this handle
 * @param pendingLoopGaps unresolved loops awaiting ligation
 * @param parameterFiles extra parameter files the final package must carry
 * @param firstTimestep timestep at which the next dynamics stage starts
 */
public record StateHandle(
    Path psf,
    Path pdb,
    Path coor,
    Path vel,
    Path xsc,
    Map<String, String> chainIdMap,
    String basename,
    Provenance provenance,
    List<LoopGap> pendingLoopGaps,
    List<Path> parameterFiles,
    long firstTimestep
) {

    public StateHandle {
        chainIdMap = Map.copyOf(chainIdMap);
        pendingLoopGaps = List.copyOf(pendingLoopGaps);
        parameterFiles = List.copyOf(parameterFiles);
        Objects.requireNonNull(provenance, "provenance");
        if (firstTimestep < 0) {
            throw new IllegalArgumentException("firstTimestep must not be negative: " + firstTimestep);
        }
    }

    /**
     * Returns the handle a fresh run starts from: no files, nothing pending.
     *
     * @return the empty handle
     */
    public static StateHandle empty() {
        return new StateHandle(null, null, null, null, null, Map.of(), null,
            Provenance.initial(), List.of(), List.of(), 0L);
    }

    public boolean hasTopology() {
        return psf != null && pdb != null;
    }

    public boolean hasBox() {
        return xsc != null;
    }

    public boolean hasPendingLoops() {
        return !pendingLoopGaps.isEmpty();
    }

    /**
     * @return every non-null structure file of this handle, psf first
     */
    public List<Path> files() {
        List<Path> files = new ArrayList<>();
        for (Path p : new Path[]{psf, pdb, coor, vel, xsc}) {
            if (p != null) {
                files.add(p);
            }
        }
        return files;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Derives a new handle from an existing one.
     */
    public static final class Builder {
        private Path psf;
        private Path pdb;
        private Path coor;
        private Path vel;
        private Path xsc;
        private final Map<String, String> chainIdMap;
        private String basename;
        private Provenance provenance;
        private final List<LoopGap> pendingLoopGaps;
        private final List<Path> parameterFiles;
        private long firstTimestep;

        private Builder(StateHandle from) {
            this.psf = from.psf;
            this.pdb = from.pdb;
            this.coor = from.coor;
            this.vel = from.vel;
            this.xsc = from.xsc;
            this.chainIdMap = new LinkedHashMap<>(from.chainIdMap);
            this.basename = from.basename;
            this.provenance = from.provenance;
            this.pendingLoopGaps = new ArrayList<>(from.pendingLoopGaps);
            this.parameterFiles = new ArrayList<>(from.parameterFiles);
            this.firstTimestep = from.firstTimestep;
        }

        /**
         * Replaces the structure. Binary coordinates and velocities are dropped since they
         * describe the previous atom set.
         */
        public Builder structure(Path psf, Path pdb) {
            this.psf = psf;
            this.pdb = pdb;
            this.coor = null;
            this.vel = null;
            return this;
        }

        public Builder psf(Path psf) {
            this.psf = psf;
            return this;
        }

        public Builder pdb(Path pdb) {
            this.pdb = pdb;
            return this;
        }

        public Builder coor(Path coor) {
            this.coor = coor;
            return this;
        }

        public Builder vel(Path vel) {
            this.vel = vel;
            return this;
        }

        public Builder xsc(Path xsc) {
            this.xsc = xsc;
            return this;
        }

        public Builder basename(String basename) {
            this.basename = basename;
            return this;
        }

        public Builder provenance(Provenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public Builder chainId(String sourceChain, String builtChain) {
            this.chainIdMap.put(sourceChain, builtChain);
            return this;
        }

        public Builder chainIdMap(Map<String, String> map) {
            this.chainIdMap.clear();
            this.chainIdMap.putAll(map);
            return this;
        }

        public Builder pendingLoopGaps(List<LoopGap> gaps) {
            this.pendingLoopGaps.clear();
            this.pendingLoopGaps.addAll(gaps);
            return this;
        }

        public Builder parameterFile(Path file) {
            if (!this.parameterFiles.contains(file)) {
                this.parameterFiles.add(file);
            }
            return this;
        }

        public Builder firstTimestep(long firstTimestep) {
            this.firstTimestep = firstTimestep;
            return this;
        }

        public StateHandle build() {
            return new StateHandle(psf, pdb, coor, vel, xsc, chainIdMap, basename, provenance,
                pendingLoopGaps, parameterFiles, firstTimestep);
        }
    }
}
