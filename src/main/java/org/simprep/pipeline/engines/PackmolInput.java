package org.simprep.pipeline.engines;

import java.util.Locale;

/**
 * Packing specification for packmol, fed to the engine on stdin.
 */
public class PackmolInput extends ScriptWriter {

    public PackmolInput() {
        super("#");
    }

    @Override
    public String extension() {
        return "inp";
    }

    public PackmolInput line(String format, Object... args) {
        addline(String.format(Locale.ROOT, format, args));
        return this;
    }

    public PackmolInput indented(String format, Object... args) {
        addline(String.format(Locale.ROOT, format, args), 1);
        return this;
    }
}
