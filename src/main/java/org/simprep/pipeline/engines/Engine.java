package org.simprep.pipeline.engines;

import java.util.Set;

/**
 * External programs the pipeline drives. Each is configured under
 * {@code simprep.engines.<configKey>} with the command line that launches it.
 */
public enum Engine {
    /** Structure builder (psfgen inside VMD); consumes a Tcl script. */
    PSFGEN("psfgen", Set.of()),
    /** Molecular dynamics engine; consumes a run configuration. */
    NAMD("namd", Set.of()),
    /**
     * Molecular packing engine; reads its input specification from stdin. Exit status 173
     * reports an imperfect but written packing and is accepted.
     */
    PACKMOL("packmol", Set.of(173));

    private final String configKey;
    private final Set<Integer> toleratedExitCodes;

    Engine(String configKey, Set<Integer> toleratedExitCodes) {
        this.configKey = configKey;
        this.toleratedExitCodes = toleratedExitCodes;
    }

    public Set<Integer> toleratedExitCodes() {
        return toleratedExitCodes;
    }

    /**
     * @return true if the engine reads its script from stdin rather than as an argument
     */
    public boolean readsScriptFromStdin() {
        return this == PACKMOL;
    }

    public String configKey() {
        return configKey;
    }
}
