package org.simprep.pipeline.membrane;

import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PeriodicBox;

import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structure-building script fragments for the membrane stages. Each fragment expects
 * {@link PsfgenScript#begin} to have run and leaves writing the result to the caller.
 */
final class MembraneScripts {

    /** Segment names left for tiled copies once one letter of the source name is kept. */
    static final int MAX_TILE_SEGMENTS = 36 * 36 * 36 - 1;

    private static final String BASE36 = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private MembraneScripts() {
    }

    /**
     * Loads a state into VMD only and stores its molecule id in a Tcl variable.
     */
    static void loadMolecule(PsfgenScript script, StateHandle state, String var) {
        script.addline("mol new " + PsfgenScript.fileName(state.psf()));
        if (state.coor() != null) {
            script.addline("mol addfile " + PsfgenScript.fileName(state.coor()) + " type namdbin waitfor all");
        } else {
            script.addline("mol addfile " + PsfgenScript.fileName(state.pdb()) + " waitfor all");
        }
        script.addline("set " + var + " [molinfo top]");
    }

    /**
     * Splits the packed coordinates into one segment per residue name and renumbers the
     * residues of each segment from one.
     *
     * @param packedPdb packed coordinate file name
     * @param basename prefix of the per-segment files
     * @param segments segment name per residue name
     */
    static void segmentsFromPacked(PsfgenScript script, String packedPdb, String basename,
                                   Map<String, String> segments) {
        script.addline("mol new " + packedPdb + " waitfor all");
        String pairs = segments.entrySet().stream()
            .map(e -> e.getKey() + " " + e.getValue())
            .collect(Collectors.joining(" "));
        script.addline("foreach {resname seg} {" + pairs + "} {");
        script.addline("set sel [atomselect top \"resname $resname\"]", 1);
        script.addline("if {[$sel num] == 0} continue", 1);
        script.addline("set n 0", 1);
        script.addline("set ids [dict create]", 1);
        script.addline("set resids {}", 1);
        script.addline("foreach r [$sel get residue] {", 1);
        script.addline("if {![dict exists $ids $r]} { dict set ids $r [incr n] }", 2);
        script.addline("lappend resids [dict get $ids $r]", 2);
        script.addline("}", 1);
        script.addline("$sel set resid $resids", 1);
        script.addline("$sel set segname $seg", 1);
        writeSegment(script, "$sel", basename, "$seg", 1);
        script.addline("}");
    }

    /**
     * Builds the hybrid patch: everything above the upper patch's midplane and everything
     * below the lower patch's midplane. The smaller patch is stretched laterally onto the box
     * of the larger one and shifted so both midplanes coincide.
     *
     * @param upper relaxed upper-composition patch
     * @param lower relaxed lower-composition patch
     * @param upperBox box of the upper patch
     * @param lowerBox box of the lower patch
     * @param lipidNames residue names of all lipid species
     * @param basename prefix of the per-segment files
     */
    static void merge(PsfgenScript script, StateHandle upper, StateHandle lower, PeriodicBox upperBox,
                      PeriodicBox lowerBox, Collection<String> lipidNames, String basename) {
        String lipids = String.join(" ", lipidNames);
        loadMolecule(script, upper, "u");
        loadMolecule(script, lower, "l");
        script.addline("set uz [vecmean [[atomselect $u \"resname " + lipids + "\"] get z]]");
        script.addline("set lz [vecmean [[atomselect $l \"resname " + lipids + "\"] get z]]");
        script.addline("set upperHalf [atomselect $u \"same residue as (z > $uz)\"]");
        script.addline("set lowerHalf [atomselect $l \"same residue as (z < $lz)\"]");
        script.addline("$lowerHalf moveby [list 0 0 [expr {$uz - $lz}]]");

        boolean lowerLarger = lowerBox.area() > upperBox.area();
        PeriodicBox larger = lowerLarger ? lowerBox : upperBox;
        PeriodicBox smaller = lowerLarger ? upperBox : lowerBox;
        String stretched = lowerLarger ? "$upperHalf" : "$lowerHalf";
        if (larger.area() != smaller.area()) {
            script.comment("stretch the smaller patch onto the larger box");
            script.addline(String.format(Locale.ROOT, "%s moveby {%.4f %.4f 0}", stretched, -smaller.ox(), -smaller.oy()));
            script.addline(String.format(Locale.ROOT, "%s set x [vecscale %.6f [%s get x]]",
                stretched, larger.ax() / smaller.ax(), stretched));
            script.addline(String.format(Locale.ROOT, "%s set y [vecscale %.6f [%s get y]]",
                stretched, larger.by() / smaller.by(), stretched));
            script.addline(String.format(Locale.ROOT, "%s moveby {%.4f %.4f 0}", stretched, larger.ox(), larger.oy()));
        }

        script.addline("foreach {mol tag half} [list $u U $upperHalf $l L $lowerHalf] {");
        script.addline("foreach seg [lsort -unique [$half get segname]] {", 1);
        script.addline("set s [atomselect $mol \"segname $seg and index [$half get index]\"]", 2);
        writeSegment(script, "$s", basename, "$tag$seg", 2);
        script.addline("}", 1);
        script.addline("}");
    }

    /**
     * Tiles a patch {@code nx} by {@code ny} times. Every copy of every segment gets a new
     * segment name made of the source segment's first letter and a running three-digit base-36
     * number, see {@link #tileSegment}.
     *
     * @param source patch to tile
     * @param segments number of segments in the patch
     * @param box box of the patch, giving the translation between copies
     * @param basename prefix of the per-segment files
     * @throws ConfigurationException if the quilt needs more segment names than fit in four characters
     */
    static void replicate(PsfgenScript script, StateHandle source, int segments, PeriodicBox box, int nx, int ny,
                          String basename) {
        long needed = (long) nx * ny * segments;
        if (needed > MAX_TILE_SEGMENTS) {
            throw new ConfigurationException(String.format(
                "A %d x %d quilt of a patch with %d segments needs %d segment names, at most %d are available",
                nx, ny, segments, needed, MAX_TILE_SEGMENTS));
        }
        script.addline("proc tileseg {seg n} {");
        script.addline("set digits " + BASE36, 1);
        script.addline("set s \"\"", 1);
        script.addline("for {set k 0} {$k < 3} {incr k} {", 1);
        script.addline("set s [string index $digits [expr {$n % 36}]]$s", 2);
        script.addline("set n [expr {$n / 36}]", 2);
        script.addline("}", 1);
        script.addline("return [string index $seg 0]$s", 1);
        script.addline("}");
        loadMolecule(script, source, "src");
        script.addline("set all [atomselect $src all]");
        script.addline("set segs [lsort -unique [$all get segname]]");
        script.addline("set n 0");
        script.addline(String.format("for {set i 0} {$i < %d} {incr i} {", nx));
        script.addline(String.format("for {set j 0} {$j < %d} {incr j} {", ny), 1);
        script.addline(String.format(Locale.ROOT, "set d [list [expr {$i * %.4f}] [expr {$j * %.4f}] 0]",
            box.ax(), box.by()), 2);
        script.addline("$all moveby $d", 2);
        script.addline("foreach seg $segs {", 2);
        script.addline("set newseg [tileseg $seg [incr n]]", 3);
        script.addline("set s [atomselect $src \"segname $seg\"]", 3);
        writeSegment(script, "$s", basename, "$newseg", 3);
        script.addline("}", 2);
        script.addline("$all moveby [vecinvert $d]", 2);
        script.addline("}", 1);
        script.addline("}");
    }

    /**
     * Places the protein at the quilt's lateral center with the midpoint of its head and tail
     * selections on the bilayer midplane, combines both structures and deletes every
     * non-protein residue within the overlap cutoff of the protein.
     */
    static void embed(PsfgenScript script, StateHandle protein, StateHandle quilt, EmbedSpec embed,
                      Collection<String> lipidNames, String basename) {
        loadMolecule(script, protein, "p");
        loadMolecule(script, quilt, "q");
        script.addline("set prot [atomselect $p all]");
        script.addline("set psegs [lsort -unique [$prot get segname]]");
        script.addline("set mid [vecmean [[atomselect $q \"resname " + String.join(" ", lipidNames) + "\"] get z]]");
        script.addline("set qc [measure center [atomselect $q all]]");
        String head = "[measure center [atomselect $p \"" + embed.headSelection() + "\"]]";
        String tail = "[measure center [atomselect $p \"" + embed.tailSelection() + "\"]]";
        if (!embed.noOrient()) {
            script.comment("align the tail-to-head vector with +z");
            script.addline("$prot move [transvecinv [vecsub " + head + " " + tail + "]]");
            script.addline("$prot move [transaxis y -90]");
        }
        script.addline("set pc [vecscale 0.5 [vecadd " + head + " " + tail + "]]");
        script.addline("$prot moveby [vecsub [list [lindex $qc 0] [lindex $qc 1] $mid] $pc]");
        script.addline("$prot writepdb " + basename + "-protein.pdb");
        script.addline("readpsf " + PsfgenScript.fileName(protein.psf()) + " pdb " + basename + "-protein.pdb");
        script.addline("readpsf " + PsfgenScript.fileName(quilt.psf()) + " pdb " + PsfgenScript.fileName(quilt.pdb()));
        script.addline("writepsf " + basename + "-combined.psf");
        script.addline("writepdb " + basename + "-combined.pdb");
        script.addline("mol new " + basename + "-combined.psf");
        script.addline("mol addfile " + basename + "-combined.pdb waitfor all");
        script.addline(String.format(Locale.ROOT,
            "set clash [atomselect top \"not segname $psegs and same residue as within %.3f of segname $psegs\"]",
            embed.overlapCutoff()));
        script.addline("set gone [dict create]");
        script.addline("foreach s [$clash get segname] r [$clash get resid] { dict set gone \"$s $r\" 1 }");
        script.addline("foreach key [dict keys $gone] { delatom {*}$key }");
    }

    /**
     * Names the {@code n}-th tiled segment: the first letter of the source segment followed by
     * {@code n} as three upper-case base-36 digits, e.g. {@code L001}, {@code L00Z}, {@code L010}.
     * Matches the {@code tileseg} procedure of the tiling script.
     *
     * @throws ConfigurationException if {@code n} is outside 1 to {@value #MAX_TILE_SEGMENTS}
     */
    static String tileSegment(String source, int n) {
        if (n < 1 || n > MAX_TILE_SEGMENTS) {
            throw new ConfigurationException("Tiled segment number " + n + " is outside 1.." + MAX_TILE_SEGMENTS);
        }
        char[] digits = new char[3];
        int rest = n;
        for (int k = 2; k >= 0; k--) {
            digits[k] = BASE36.charAt(rest % 36);
            rest /= 36;
        }
        return source.substring(0, 1) + new String(digits);
    }

    static void writeSegment(PsfgenScript script, String selection, String basename, String segment, int indent) {
        String file = basename + "-" + segment + ".pdb";
        script.addline(selection + " writepdb " + file, indent);
        script.addline("segment " + segment + " { first none; last none; auto none; pdb " + file + " }", indent);
        script.addline("coordpdb " + file + " " + segment, indent);
    }

    static List<String> sorted(Collection<String> names) {
        return names.stream().sorted().collect(Collectors.toList());
    }
}
