package org.simprep.pipeline.structure;

import org.simprep.pipeline.structure.PdbStructure.ResidueKey;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds bonds threaded through rings, the typical defect of packed or overlaid lipids and
 * glycans that minimization cannot undo.
 * <p>
 * Rings are the smallest cycles of three to seven atoms through each bond inside one residue.
 * A bond that shares no atom with a ring pierces it when its midpoint lies within the cutoff
 * of the ring centre and within half the bond length of it, and the ring, projected onto the
 * plane through the midpoint normal to the bond, winds once around the midpoint. Bonds are
 * looked up in a grid of cells the size of the cutoff. With a periodic box, coordinates are
 * compared under the minimum-image convention.
 */
public final class RingPiercings {

    /** Largest ring examined. */
    static final int MAX_RING_SIZE = 7;

    private static final double WINDING_TOLERANCE = 1e-5;

    private final List<PdbAtom> atoms;
    private final List<int[]> bonds;
    private final PeriodicBox box;
    private final double cutoff;

    /**
     * A residue whose ring is pierced and the residue owning the piercing bond.
     *
     * @param ring residue owning the ring
     * @param piercer residue owning the bond
     */
    public record Piercing(ResidueKey ring, ResidueKey piercer) {
        @Override
        public String toString() {
            return "Ring of " + ring.segname() + ":" + ring.resid() + " is pierced by a bond of "
                + piercer.segname() + ":" + piercer.resid();
        }
    }

    /**
     * @param atoms atoms with current coordinates
     * @param bonds bonded pairs of 0-based atom indices
     * @param box periodic box, or null for a non-periodic system
     * @param cutoff largest ring-centre to bond-midpoint distance examined
     */
    public RingPiercings(List<PdbAtom> atoms, List<int[]> bonds, PeriodicBox box, double cutoff) {
        if (!(cutoff > 0)) {
            throw new IllegalArgumentException("Ring cutoff must be positive, got " + cutoff);
        }
        this.atoms = atoms;
        this.bonds = bonds;
        this.box = box;
        this.cutoff = cutoff;
    }

    /**
     * @return every pierced ring with its piercing residue, one entry per ring and residue
     */
    public List<Piercing> find() {
        List<int[]> rings = rings();
        if (rings.isEmpty()) {
            return List.of();
        }
        Map<Long, List<Integer>> grid = new HashMap<>();
        for (int b = 0; b < bonds.size(); b++) {
            double[] mid = midpoint(bonds.get(b));
            grid.computeIfAbsent(cellKey(cellOf(mid)), k -> new ArrayList<>()).add(b);
        }

        Set<Piercing> found = new LinkedHashSet<>();
        for (int[] ring : rings) {
            double[][] points = ringPoints(ring);
            double[] centre = mean(points);
            Set<Integer> members = new HashSet<>();
            for (int a : ring) {
                members.add(a);
            }
            for (int b : nearbyBonds(grid, centre)) {
                int[] bond = bonds.get(b);
                if (members.contains(bond[0]) || members.contains(bond[1])) {
                    continue;
                }
                if (pierces(points, centre, bond)) {
                    found.add(new Piercing(PdbStructure.residueKey(atoms.get(ring[0])), PdbStructure.residueKey(atoms.get(bond[0]))));
                }
            }
        }
        return new ArrayList<>(found);
    }

    /**
     * Returns the smallest ring through each intra-residue bond, each ring once, as atom
     * indices in cyclic order.
     */
    List<int[]> rings() {
        Map<Integer, List<Integer>> neighbours = new HashMap<>();
        for (int[] bond : bonds) {
            if (PdbStructure.residueKey(atoms.get(bond[0])).equals(PdbStructure.residueKey(atoms.get(bond[1])))) {
                neighbours.computeIfAbsent(bond[0], k -> new ArrayList<>()).add(bond[1]);
                neighbours.computeIfAbsent(bond[1], k -> new ArrayList<>()).add(bond[0]);
            }
        }
        Map<String, int[]> rings = new LinkedHashMap<>();
        for (int[] bond : bonds) {
            if (!neighbours.containsKey(bond[0]) || !neighbours.get(bond[0]).contains(bond[1])) {
                continue;
            }
            int[] path = shortestPathAvoiding(neighbours, bond[0], bond[1]);
            if (path != null && path.length >= 3) {
                int[] sorted = path.clone();
                Arrays.sort(sorted);
                rings.putIfAbsent(Arrays.toString(sorted), path);
            }
        }
        return new ArrayList<>(rings.values());
    }

    private static int[] shortestPathAvoiding(Map<Integer, List<Integer>> neighbours, int from, int to) {
        Map<Integer, Integer> previous = new HashMap<>();
        Map<Integer, Integer> depth = new HashMap<>();
        Deque<Integer> queue = new ArrayDeque<>();
        previous.put(from, -1);
        depth.put(from, 1);
        queue.add(from);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            if (depth.get(current) >= MAX_RING_SIZE) {
                continue;
            }
            for (int next : neighbours.getOrDefault(current, List.of())) {
                if (current == from && next == to) {
                    continue;
                }
                if (previous.containsKey(next)) {
                    continue;
                }
                previous.put(next, current);
                depth.put(next, depth.get(current) + 1);
                if (next == to) {
                    int[] path = new int[depth.get(next)];
                    int node = to;
                    for (int i = path.length - 1; i >= 0; i--) {
                        path[i] = node;
                        node = previous.get(node);
                    }
                    return path;
                }
                queue.add(next);
            }
        }
        return null;
    }

    private boolean pierces(double[][] ring, double[] centre, int[] bond) {
        double[] a = position(bond[0]);
        double[] b = image(position(bond[1]), a);
        double[] mid = {(a[0] + b[0]) / 2, (a[1] + b[1]) / 2, (a[2] + b[2]) / 2};
        double[] shift = subtract(image(mid, centre), mid);
        mid = add(mid, shift);
        double[] axis = subtract(b, a);
        double length = norm(axis);
        if (length == 0.0) {
            return false;
        }
        double dist = norm(subtract(mid, centre));
        if (dist > cutoff || dist > 0.5 * length) {
            return false;
        }
        double[] u = {axis[0] / length, axis[1] / length, axis[2] / length};
        double[][] projected = new double[ring.length][];
        for (int i = 0; i < ring.length; i++) {
            double[] p = ring[i];
            double along = dot(u, subtract(mid, p));
            projected[i] = subtract(add(p, scale(u, along)), mid);
        }
        double winding = 0.0;
        for (int i = 0; i < projected.length; i++) {
            double[] p = projected[i];
            double[] q = projected[(i + 1) % projected.length];
            double denominator = norm(p) * norm(q);
            if (denominator == 0.0) {
                return false;
            }
            winding += Math.acos(Math.max(-1.0, Math.min(1.0, dot(p, q) / denominator)));
        }
        return Math.abs(winding - 2 * Math.PI) < WINDING_TOLERANCE;
    }

    private double[][] ringPoints(int[] ring) {
        double[][] points = new double[ring.length][];
        points[0] = position(ring[0]);
        for (int i = 1; i < ring.length; i++) {
            points[i] = image(position(ring[i]), points[i - 1]);
        }
        return points;
    }

    private List<Integer> nearbyBonds(Map<Long, List<Integer>> grid, double[] centre) {
        int[] cell = cellOf(image(centre, centre));
        int[] counts = cellCounts();
        Set<Long> visited = new HashSet<>();
        List<Integer> result = new ArrayList<>();
        for (int dx = -1; dx <= 1; dx++) {
            for (int dy = -1; dy <= 1; dy++) {
                for (int dz = -1; dz <= 1; dz++) {
                    int[] c = {cell[0] + dx, cell[1] + dy, cell[2] + dz};
                    if (counts != null) {
                        for (int k = 0; k < 3; k++) {
                            c[k] = Math.floorMod(c[k], counts[k]);
                        }
                    }
                    long key = cellKey(c);
                    if (visited.add(key)) {
                        result.addAll(grid.getOrDefault(key, List.of()));
                    }
                }
            }
        }
        return result;
    }

    private double[] midpoint(int[] bond) {
        double[] a = position(bond[0]);
        double[] b = image(position(bond[1]), a);
        return new double[]{(a[0] + b[0]) / 2, (a[1] + b[1]) / 2, (a[2] + b[2]) / 2};
    }

    private int[] cellCounts() {
        if (box == null) {
            return null;
        }
        return new int[]{
            Math.max(1, (int) Math.floor(box.ax() / cutoff)),
            Math.max(1, (int) Math.floor(box.by() / cutoff)),
            Math.max(1, (int) Math.floor(box.cz() / cutoff))};
    }

    private int[] cellOf(double[] p) {
        if (box == null) {
            return new int[]{
                (int) Math.floor(p[0] / cutoff), (int) Math.floor(p[1] / cutoff), (int) Math.floor(p[2] / cutoff)};
        }
        int[] counts = cellCounts();
        double[] lengths = {box.ax(), box.by(), box.cz()};
        double[] low = {box.ox() - box.ax() / 2, box.oy() - box.by() / 2, box.oz() - box.cz() / 2};
        int[] cell = new int[3];
        for (int k = 0; k < 3; k++) {
            double fraction = (p[k] - low[k]) / lengths[k];
            fraction -= Math.floor(fraction);
            cell[k] = Math.min(counts[k] - 1, (int) Math.floor(fraction * counts[k]));
        }
        return cell;
    }

    private static long cellKey(int[] c) {
        return ((c[0] & 0x1FFFFFL) << 42) | ((c[1] & 0x1FFFFFL) << 21) | (c[2] & 0x1FFFFFL);
    }

    /**
     * Returns the periodic image of {@code p} nearest to {@code reference}.
     */
    private double[] image(double[] p, double[] reference) {
        if (box == null) {
            return p;
        }
        double[] lengths = {box.ax(), box.by(), box.cz()};
        double[] result = new double[3];
        for (int k = 0; k < 3; k++) {
            double d = p[k] - reference[k];
            result[k] = lengths[k] > 0 ? p[k] - lengths[k] * Math.rint(d / lengths[k]) : p[k];
        }
        return result;
    }

    private double[] position(int index) {
        PdbAtom a = atoms.get(index);
        return new double[]{a.x(), a.y(), a.z()};
    }

    private static double[] mean(double[][] points) {
        double[] m = new double[3];
        for (double[] p : points) {
            m[0] += p[0];
            m[1] += p[1];
            m[2] += p[2];
        }
        return scale(m, 1.0 / points.length);
    }

    private static double[] add(double[] a, double[] b) {
        return new double[]{a[0] + b[0], a[1] + b[1], a[2] + b[2]};
    }

    private static double[] subtract(double[] a, double[] b) {
        return new double[]{a[0] - b[0], a[1] - b[1], a[2] - b[2]};
    }

    private static double[] scale(double[] a, double f) {
        return new double[]{a[0] * f, a[1] * f, a[2] * f};
    }

    private static double dot(double[] a, double[] b) {
        return a[0] * b[0] + a[1] * b[1] + a[2] * b[2];
    }

    private static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }
}
