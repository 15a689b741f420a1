package org.simprep.pipeline.engines;

import java.util.Locale;

/**
 * Run configuration for the NAMD dynamics engine: one {@code keyword value} pair per line.
 */
public class NamdConfig extends ScriptWriter {

    public NamdConfig() {
        super("#");
    }

    @Override
    public String extension() {
        return "namd";
    }

    public NamdConfig set(String keyword, Object value) {
        addline(String.format(Locale.ROOT, "%-24s %s", keyword, format(value)));
        return this;
    }

    private static String format(Object value) {
        if (value instanceof Double d) {
            return String.format(Locale.ROOT, "%.6g", d);
        }
        if (value instanceof Boolean b) {
            return b ? "on" : "off";
        }
        return String.valueOf(value);
    }
}
