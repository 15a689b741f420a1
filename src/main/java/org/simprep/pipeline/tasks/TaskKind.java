package org.simprep.pipeline.tasks;

import java.util.Arrays;
import java.util.Optional;

/**
 * The closed set of task kinds a pipeline can run. Each constant names the configuration
 * key that introduces a task of that kind in a task list.
 */
public enum TaskKind {
    FETCH("fetch"),
    BUILD_TOPOLOGY("psfgen"),
    LIGATE("ligate"),
    CLEAVE("cleave"),
    DOMAIN_SWAP("domainswap"),
    MANIPULATE("manipulate"),
    SOLVATE("solvate"),
    DESOLVATE("desolvate"),
    MAKE_MEMBRANE_SYSTEM("make_membrane_system"),
    RUN_DYNAMICS("md"),
    PLOT("mdplot"),
    VALIDATE("validate"),
    PACKAGE("terminate"),
    RESTART("restart"),
    CONTINUATION("continuation");

    private final String configKey;

    TaskKind(String configKey) {
        this.configKey = configKey;
    }

    public String configKey() {
        return configKey;
    }

    /**
     * Looks up a kind by configuration key. {@code package} is accepted as an alias of
     * {@code terminate}.
     *
     * @param key the configuration key
     * @return the kind, or empty if the key names no task kind
     */
    public static Optional<TaskKind> fromConfigKey(String key) {
        if ("package".equals(key)) {
            return Optional.of(PACKAGE);
        }
        return Arrays.stream(values()).filter(k -> k.configKey.equals(key)).findFirst();
    }
}
