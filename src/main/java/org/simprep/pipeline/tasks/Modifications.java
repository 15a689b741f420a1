package org.simprep.pipeline.tasks;

import java.nio.file.Path;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Topology edit directives and their shortcode syntax.
 */
public final class Modifications {

    private static final String CHAIN = "([A-Za-z0-9]{1,4})";
    private static final String RESID = "(-?\\d+)";

    private static final Pattern MUTATION = Pattern.compile(CHAIN + ":" + RESID + ":([A-Z0-9]{1,4})");
    private static final Pattern RANGE = Pattern.compile(CHAIN + ":" + RESID + "-" + RESID);
    private static final Pattern DISULFIDE = Pattern.compile(CHAIN + ":" + RESID + "-" + CHAIN + ":" + RESID);
    private static final Pattern SITE = Pattern.compile(CHAIN + ":" + RESID);
    private static final Pattern GRAFT = Pattern.compile(CHAIN + ":" + RESID + ":(.+)");

    private Modifications() {
    }

    /**
     * Point mutation, shortcode {@code A:123:ALA}.
     */
    public record Mutation(String chain, int resid, String resname) {
        public static Mutation parse(String code) {
            Matcher m = match(MUTATION, code, "C:resid:RESNAME");
            return new Mutation(m.group(1), Integer.parseInt(m.group(2)), m.group(3));
        }
    }

    /**
     * Inclusive residue range within one chain, shortcode {@code A:10-20}.
     */
    public record ResidueRange(String chain, int first, int last) {
        public ResidueRange {
            if (last < first) {
                throw new IllegalArgumentException("Residue range " + chain + ":" + first + "-" + last + " is empty");
            }
        }

        public static ResidueRange parse(String code) {
            Matcher m = match(RANGE, code, "C:first-last");
            return new ResidueRange(m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
        }
    }

    /**
     * Disulfide bond between two cysteines, shortcode {@code A:10-B:20}.
     */
    public record Disulfide(String chainA, int residA, String chainB, int residB) {
        public static Disulfide parse(String code) {
            Matcher m = match(DISULFIDE, code, "C:resid-C:resid");
            return new Disulfide(m.group(1), Integer.parseInt(m.group(2)), m.group(3), Integer.parseInt(m.group(4)));
        }
    }

    /**
     * Residue position, shortcode {@code A:123}; used for cleavage sites.
     */
    public record Site(String chain, int resid) {
        public static Site parse(String code) {
            Matcher m = match(SITE, code, "C:resid");
            return new Site(m.group(1), Integer.parseInt(m.group(2)));
        }
    }

    /**
     * Glycan graft attached to an asparagine, shortcode {@code A:123:glycan.pdb}.
     */
    public record Graft(String chain, int resid, Path source) {
        public static Graft parse(String code) {
            Matcher m = match(GRAFT, code, "C:resid:file");
            return new Graft(m.group(1), Integer.parseInt(m.group(2)), Path.of(m.group(3)));
        }
    }

    private static Matcher match(Pattern pattern, String code, String expected) {
        Matcher m = pattern.matcher(code.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed shortcode '" + code + "', expected " + expected);
        }
        return m;
    }
}
