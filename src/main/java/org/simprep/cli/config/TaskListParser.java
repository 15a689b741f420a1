package org.simprep.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigObject;
import org.simprep.pipeline.ArtifactNames;
import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.LoopGap;
import org.simprep.pipeline.membrane.BilayerSpec;
import org.simprep.pipeline.membrane.EmbedSpec;
import org.simprep.pipeline.membrane.LeafletComposition;
import org.simprep.pipeline.membrane.LipidSpec;
import org.simprep.pipeline.membrane.QuiltSize;
import org.simprep.pipeline.tasks.Ensemble;
import org.simprep.pipeline.tasks.Modifications;
import org.simprep.pipeline.tasks.TaskDescriptor;
import org.simprep.pipeline.tasks.TaskKind;
import org.simprep.pipeline.tasks.TaskSpec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Turns the {@code tasks} list of the run configuration into task descriptors.
 * <p>
 * Each list entry is an object with a single key, the task kind's configuration key, whose
 * value holds the task's parameters:
 * <pre>
 * tasks = [
 *   { fetch { id = 6pti } }
 *   { psfgen { loops = ["A:25-30"] } }
 *   { md { ensemble = NVT, nsteps = 1000, label = heat } }
 * ]
 * </pre>
 * Parameters not given fall back to {@code simprep.defaults.<key>}. A list that does not end
 * with a package task gets a default {@code terminate} appended. Every problem is reported as
 * a {@link ConfigurationException} naming the position of the offending entry.
 */
public final class TaskListParser {

    private static final String TASKS = "tasks";
    private static final String DEFAULTS = "simprep.defaults";
    private static final String LABEL = "label";

    private final Config config;

    /**
     * @param config the resolved application configuration
     */
    public TaskListParser(Config config) {
        this.config = config;
    }

    /**
     * Parses the run's task list.
     *
     * @return descriptors in run order, ending with a package task
     * @throws ConfigurationException if an entry is malformed
     */
    public List<TaskDescriptor> parse() {
        List<? extends ConfigObject> entries;
        try {
            entries = config.hasPath(TASKS) ? config.getObjectList(TASKS) : List.of();
        } catch (ConfigException e) {
            throw new ConfigurationException("'" + TASKS + "' must be a list of single-key objects: " + e.getMessage(), e);
        }
        List<TaskDescriptor> tasks = parseList(entries, TASKS);
        for (int i = 0; i < tasks.size() - 1; i++) {
            if (tasks.get(i).kind() == TaskKind.PACKAGE) {
                throw new ConfigurationException(String.format("%s[%d] (%s): the package task must be the last task",
                    TASKS, i, tasks.get(i).label()));
            }
        }
        if (tasks.isEmpty() || tasks.get(tasks.size() - 1).kind() != TaskKind.PACKAGE) {
            tasks.add(descriptor(TaskKind.PACKAGE, defaults(TaskKind.PACKAGE), TASKS + "[" + tasks.size() + "]"));
        }
        if (tasks.size() > ArtifactNames.MAX_INDEX + 1) {
            throw new ConfigurationException("A task list may hold at most " + (ArtifactNames.MAX_INDEX + 1)
                + " tasks including the final package task, got " + tasks.size());
        }
        return tasks;
    }

    List<TaskDescriptor> parseList(List<? extends ConfigObject> entries, String where) {
        List<TaskDescriptor> tasks = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            String position = where + "[" + i + "]";
            ConfigObject entry = entries.get(i);
            if (entry.size() != 1) {
                throw new ConfigurationException(position + ": expected one task key, found " + entry.keySet());
            }
            String key = entry.keySet().iterator().next();
            TaskKind kind = TaskKind.fromConfigKey(key)
                .orElseThrow(() -> new ConfigurationException(position + ": unknown task '" + key + "'"));
            Config parameters;
            try {
                parameters = entry.toConfig().getConfig(quote(key)).withFallback(defaults(kind));
            } catch (ConfigException e) {
                throw new ConfigurationException(position + " (" + key + "): parameters must be an object", e);
            }
            tasks.add(descriptor(kind, parameters, position + " (" + key + ")"));
        }
        return tasks;
    }

    private TaskDescriptor descriptor(TaskKind kind, Config c, String position) {
        try {
            String label = c.hasPath(LABEL) ? c.getString(LABEL) : null;
            return new TaskDescriptor(label, spec(kind, c, position));
        } catch (ConfigException | IllegalArgumentException e) {
            throw new ConfigurationException(position + ": " + e.getMessage(), e);
        }
    }

    private TaskSpec spec(TaskKind kind, Config c, String position) {
        return switch (kind) {
            case FETCH -> new TaskSpec.Fetch(c.getString("id"), optionalPath(c, "source"));
            case BUILD_TOPOLOGY -> new TaskSpec.BuildTopology(
                codes(c, "mutations", Modifications.Mutation::parse),
                codes(c, "deletions", Modifications.ResidueRange::parse),
                codes(c, "ssbonds", Modifications.Disulfide::parse),
                codes(c, "grafts", Modifications.Graft::parse),
                codes(c, "loops", LoopGap::parse));
            case LIGATE -> new TaskSpec.Ligate(c.getInt("steer-steps"), c.getDouble("force-constant"),
                c.getDouble("target-distance"), c.getDouble("temperature"));
            case CLEAVE -> new TaskSpec.Cleave(codes(c, "sites", Modifications.Site::parse));
            case DOMAIN_SWAP -> new TaskSpec.DomainSwap(c.getString("chain-a"), c.getString("chain-b"),
                c.getInt("first"), c.getInt("last"));
            case MANIPULATE -> new TaskSpec.Manipulate(c.getBoolean("orient"), c.getBoolean("center"),
                c.getDoubleList("translate"));
            case SOLVATE -> new TaskSpec.Solvate(c.getDouble("pad"), c.getString("cation"), c.getString("anion"),
                c.getDouble("salt-con"));
            case DESOLVATE -> new TaskSpec.Desolvate(c.getString("keepatselstr"));
            case MAKE_MEMBRANE_SYSTEM -> new TaskSpec.MakeMembraneSystem(bilayer(c.getConfig("bilayer"), position));
            case RUN_DYNAMICS -> new TaskSpec.RunDynamics(Ensemble.parse(c.getString("ensemble")), c.getInt("nsteps"),
                c.getDouble("temperature"), c.getDouble("pressure"), c.getDouble("timestep"),
                stringMap(c.getConfig("other-parameters")));
            case PLOT -> new TaskSpec.Plot(c.getStringList("traces"));
            case VALIDATE -> new TaskSpec.Validate(c.getDouble("min-distance"), c.getBoolean("fail-on-error"),
                c.getBoolean("ring-check"), c.getDouble("ring-cutoff"));
            case PACKAGE -> new TaskSpec.Terminate(c.getString("basename"), c.getBoolean("archive"));
            case RESTART -> new TaskSpec.Restart(Path.of(c.getString("psf")), Path.of(c.getString("pdb")),
                optionalPath(c, "xsc"), optionalPath(c, "coor"), optionalPath(c, "vel"));
            case CONTINUATION -> new TaskSpec.Continuation(Path.of(c.getString("psf")), Path.of(c.getString("pdb")),
                Path.of(c.getString("xsc")), Path.of(c.getString("coor")), Path.of(c.getString("vel")),
                c.getLong("firsttimestep"));
        };
    }

    private BilayerSpec bilayer(Config b, String position) {
        LeafletComposition upper = leaflet(b, "composition.upper_leaflet");
        LeafletComposition lower = b.hasPath("composition.lower_leaflet")
            ? leaflet(b, "composition.lower_leaflet")
            : upper;

        QuiltSize quilt;
        if (b.hasPath("npatch")) {
            List<Integer> n = pair(b.getIntList("npatch"), "npatch");
            quilt = QuiltSize.patches(n.get(0), n.get(1));
        } else if (b.hasPath("dims")) {
            List<Double> d = pair(b.getDoubleList("dims"), "dims");
            quilt = QuiltSize.dimensions(d.get(0), d.get(1));
        } else {
            quilt = QuiltSize.aroundProtein(b.getDouble("margin"));
        }

        EmbedSpec embed = null;
        if (b.hasPath("embed")) {
            Config e = b.getConfig("embed");
            embed = new EmbedSpec(e.getString("z_head_group"), e.getString("z_tail_group"),
                e.hasPath("no_orient") && e.getBoolean("no_orient"),
                e.hasPath("overlap_cutoff") ? e.getDouble("overlap_cutoff") : 1.0);
        }

        String where = position + " bilayer.relaxation_protocols";
        BilayerSpec spec = new BilayerSpec(
            upper,
            lower,
            b.getString("solvent"),
            b.getDouble("solvent_to_lipid_ratio"),
            b.getDouble("SAPL"),
            b.getInt("patch_nlipids.upper"),
            b.getInt("patch_nlipids.lower"),
            quilt,
            b.getDouble("xy_aspect_ratio"),
            b.getLong("seed"),
            b.getDouble("tolerance"),
            b.getInt("nloop"),
            b.getInt("nloop_all"),
            b.getDouble("half_mid_zgap"),
            b.getDouble("rotation_pm"),
            b.getString("cation"),
            b.getString("anion"),
            b.getDouble("salt_con"),
            parseList(b.getObjectList("relaxation_protocols.patch"), where + ".patch"),
            parseList(b.getObjectList("relaxation_protocols.quilt"), where + ".quilt"),
            embed);
        try {
            spec.validate();
        } catch (ConfigurationException e) {
            throw new ConfigurationException(position + ": " + e.getMessage(), e);
        }
        return spec;
    }

    private static LeafletComposition leaflet(Config b, String path) {
        List<LipidSpec> lipids = new ArrayList<>();
        for (Config lipid : b.getConfigList(path)) {
            lipids.add(new LipidSpec(
                lipid.getString("name"),
                lipid.hasPath("frac") ? lipid.getDouble("frac") : 1.0,
                lipid.hasPath("conf") ? lipid.getInt("conf") : 0));
        }
        return new LeafletComposition(lipids);
    }

    private Config defaults(TaskKind kind) {
        String path = DEFAULTS + "." + quote(kind.configKey());
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    private static <T> List<T> codes(Config c, String path, Function<String, T> parser) {
        return c.getStringList(path).stream().map(parser).collect(Collectors.toList());
    }

    private static Path optionalPath(Config c, String path) {
        return c.hasPath(path) ? Path.of(c.getString(path)) : null;
    }

    private static Map<String, String> stringMap(Config c) {
        Map<String, String> map = new LinkedHashMap<>();
        c.root().forEach((key, value) -> map.put(key, String.valueOf(value.unwrapped())));
        return map;
    }

    private static <T> List<T> pair(List<T> values, String name) {
        if (values.size() != 2) {
            throw new IllegalArgumentException(name + " needs two values, got " + values.size());
        }
        return values;
    }

    private static String quote(String key) {
        return "\"" + key + "\"";
    }
}
