package org.simprep.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies the configuration precedence: system properties over environment over the run
 * file over {@code reference.conf}.
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("simprep.md.temperature");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should merge the run file over the defaults")
    void loadFromFile_shouldMergeFileOverDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("namd3 +p4", config.getString("simprep.engines.namd"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("Overriding the md temperature should reach every task default that references it")
    void loadFromFile_overrideShouldPropagateThroughSubstitutions() {
        Config config = ConfigLoader.loadFromFile(testResource("override-md.conf"));

        assertEquals(300.0, config.getDouble("simprep.defaults.md.temperature"));
        assertEquals(300.0, config.getDouble("simprep.defaults.ligate.temperature"));
    }

    @Test
    @DisplayName("System property should win over the run file for substituted values too")
    void loadFromFile_systemPropertyShouldWinOverFileForSubstitutions() {
        System.setProperty("simprep.md.temperature", "320.0");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("override-md.conf"));

        assertEquals(320.0, config.getDouble("simprep.defaults.md.temperature"));
    }

    @Test
    @DisplayName("loadDefaults should hold an empty task list")
    void loadDefaults_shouldReturnValidConfig() {
        Config config = ConfigLoader.loadDefaults();

        assertNotNull(config);
        assertFalse(config.hasPath("tasks"));
        assertTrue(config.getBoolean("simprep.pipeline.check-atom-counts"));
    }

    @Test
    @DisplayName("An explicit file that does not exist should be rejected")
    void resolve_missingExplicitFileShouldThrow() {
        File missing = new File("does-not-exist/simprep.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> ConfigLoader.resolve(missing, (level, message) -> { }));
        assertTrue(e.getMessage().contains("simprep.conf"));
    }

    @Test
    @DisplayName("An explicit file should be announced through the message handler")
    void resolve_explicitFileShouldBeReported() {
        List<String> messages = new ArrayList<>();

        Config config = ConfigLoader.resolve(testResource("test-config.conf"),
            (level, message) -> messages.add(level + " " + message));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).startsWith("INFO Using configuration file specified via --config"));
    }

    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
