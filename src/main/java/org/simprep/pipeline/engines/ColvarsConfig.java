package org.simprep.pipeline.engines;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Collective-variable definitions for biased dynamics, referenced from a NAMD configuration.
 */
public class ColvarsConfig extends ScriptWriter {

    public ColvarsConfig() {
        super("#");
    }

    @Override
    public String extension() {
        return "colvars";
    }

    /**
     * Adds a distance variable between two single atoms, by 1-based atom number.
     */
    public ColvarsConfig distance(String name, int atomA, int atomB) {
        addline("colvar {");
        addline("name " + name, 1);
        addline("distance {", 1);
        addline("group1 { atomNumbers " + atomA + " }", 2);
        addline("group2 { atomNumbers " + atomB + " }", 2);
        addline("}", 1);
        addline("}");
        return this;
    }

    /**
     * Adds a harmonic bias moving the given variables from their start to their target
     * centers over {@code steps} steps.
     */
    public ColvarsConfig movingHarmonic(List<String> colvars, List<Double> starts, List<Double> targets,
                                        double forceConstant, int steps) {
        addline("harmonic {");
        addline("colvars " + String.join(" ", colvars), 1);
        addline("centers " + join(starts), 1);
        addline("targetCenters " + join(targets), 1);
        addline(String.format(Locale.ROOT, "forceConstant %.4f", forceConstant), 1);
        addline("targetNumSteps " + steps, 1);
        addline("}");
        return this;
    }

    private static String join(List<Double> values) {
        return values.stream().map(v -> String.format(Locale.ROOT, "%.4f", v)).collect(Collectors.joining(" "));
    }
}
