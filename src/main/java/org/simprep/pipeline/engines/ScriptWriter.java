package org.simprep.pipeline.engines;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates the lines of a generated engine input file and writes it in one go.
 */
public abstract class ScriptWriter {

    private static final String INDENT = "    ";

    private final String commentChar;
    private final List<String> lines = new ArrayList<>();

    protected ScriptWriter(String commentChar) {
        this.commentChar = commentChar;
    }

    /**
     * @return the file extension of this kind of script, without the dot
     */
    public abstract String extension();

    public ScriptWriter addline(String line) {
        return addline(line, 0);
    }

    public ScriptWriter addline(String line, int indents) {
        lines.add(INDENT.repeat(indents) + line);
        return this;
    }

    public ScriptWriter comment(String text) {
        lines.add(commentChar + " " + text);
        return this;
    }

    /**
     * Adds a boxed comment naming the generated file and its creation time.
     */
    public ScriptWriter banner(String title) {
        String rule = commentChar.repeat(Math.max(1, 60 / commentChar.length()));
        lines.add(rule);
        lines.add(commentChar + " " + title);
        lines.add(commentChar + " generated by simprep " + LocalDateTime.now().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        lines.add(rule);
        return this;
    }

    public List<String> lines() {
        return Collections.unmodifiableList(lines);
    }

    /**
     * Writes the accumulated lines to {@code directory/basename.extension}.
     *
     * @param directory target directory
     * @param basename basename of the script
     * @return path of the written file
     * @throws IOException if the file cannot be written
     */
    public Path writeTo(Path directory, String basename) throws IOException {
        Path target = directory.resolve(basename + "." + extension());
        Files.write(target, lines, StandardCharsets.UTF_8);
        return target;
    }
}
