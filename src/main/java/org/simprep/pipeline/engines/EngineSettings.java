package org.simprep.pipeline.engines;

import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Command lines used to launch each {@link Engine}.
 *
 * @param commands launch command per engine, split into program and leading arguments
 */
public record EngineSettings(Map<Engine, List<String>> commands) {

    public EngineSettings {
        EnumMap<Engine, List<String>> copy = new EnumMap<>(Engine.class);
        commands.forEach((engine, command) -> copy.put(engine, List.copyOf(command)));
        commands = copy;
    }

    /**
     * Reads engine commands from {@code simprep.engines}. Each entry is a whitespace-separated
     * command line, e.g. {@code psfgen = "vmd -dispdev text -e"}.
     *
     * @param config the resolved application configuration
     * @return the settings
     * @throws com.typesafe.config.ConfigException.Missing if an engine entry is absent
     */
    public static EngineSettings fromConfig(Config config) {
        Config engines = config.getConfig("simprep.engines");
        Map<Engine, List<String>> commands = new EnumMap<>(Engine.class);
        for (Engine engine : Engine.values()) {
            String line = engines.getString(engine.configKey()).trim();
            commands.put(engine, Arrays.asList(line.split("\\s+")));
        }
        return new EngineSettings(commands);
    }

    /**
     * Builds the full command for one invocation.
     *
     * @param engine the engine to launch
     * @param arguments invocation-specific arguments appended to the configured command
     * @return the command line
     */
    public List<String> commandFor(Engine engine, List<String> arguments) {
        List<String> base = commands.get(engine);
        if (base == null || base.isEmpty()) {
            throw new IllegalStateException("No command configured for engine " + engine.configKey());
        }
        List<String> command = new ArrayList<>(base);
        command.addAll(arguments);
        return command;
    }
}
