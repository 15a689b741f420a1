package org.simprep.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An unresolved loop left in a chain by topology building: residues
 * {@code firstResid..lastResid} of chain {@code chainId} were built as an open gap and
 * still need to be ligated.
 *
 * @param chainId chain identifier
 * @param firstResid first residue number of the gap
 * @param lastResid last residue number of the gap
 */
public record LoopGap(String chainId, int firstResid, int lastResid) {

    private static final Pattern SHORTCODE = Pattern.compile("([A-Za-z0-9]{1,4}):(-?\\d+)-(-?\\d+)");

    public LoopGap {
        if (lastResid < firstResid) {
            throw new IllegalArgumentException(
                "Loop gap " + chainId + ":" + firstResid + "-" + lastResid + " ends before it starts");
        }
    }

    /**
     * Parses the shortcode {@code C:first-last}.
     *
     * @param shortcode the shortcode
     * @return the gap
     * @throws IllegalArgumentException if the shortcode is malformed
     */
    public static LoopGap parse(String shortcode) {
        Matcher m = SHORTCODE.matcher(shortcode.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed loop shortcode '" + shortcode + "', expected C:first-last");
        }
        return new LoopGap(m.group(1), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
    }

    /**
     * Returns the file that records the open loops of a connectivity file: the same name with
     * the extension {@code .loops}.
     */
    public static Path recordFor(Path psf) {
        String name = psf.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return psf.resolveSibling((dot > 0 ? name.substring(0, dot) : name) + ".loops");
    }

    /**
     * Writes the open loops of a connectivity file next to it, one shortcode per line.
     *
     * @param psf connectivity file the loops belong to
     * @param gaps the open loops
     * @return the record file
     * @throws IOException if the file cannot be written
     */
    public static Path writeRecord(Path psf, List<LoopGap> gaps) throws IOException {
        List<String> lines = new ArrayList<>();
        for (LoopGap gap : gaps) {
            lines.add(gap.toString());
        }
        return Files.write(recordFor(psf), lines, StandardCharsets.UTF_8);
    }

    /**
     * Reads the open loops recorded for a connectivity file.
     *
     * @param psf connectivity file
     * @return the recorded loops, empty if there is no record
     * @throws IOException if the record exists but cannot be read
     * @throws IllegalArgumentException if a line is not a loop shortcode
     */
    public static List<LoopGap> readRecord(Path psf) throws IOException {
        Path record = recordFor(psf);
        if (!Files.isRegularFile(record)) {
            return List.of();
        }
        List<LoopGap> gaps = new ArrayList<>();
        for (String line : Files.readAllLines(record, StandardCharsets.UTF_8)) {
            if (!line.isBlank()) {
                gaps.add(parse(line));
            }
        }
        return gaps;
    }

    public int length() {
        return lastResid - firstResid + 1;
    }

    @Override
    public String toString() {
        return chainId + ":" + firstResid + "-" + lastResid;
    }
}
