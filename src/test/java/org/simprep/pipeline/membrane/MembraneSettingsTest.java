package org.simprep.pipeline.membrane;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.simprep.pipeline.ConfigurationException;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class MembraneSettingsTest {

    private static final Config MEMBRANE = ConfigFactory.parseString(
        "template-dir = templates\n"
            + "solution-density = 1.0\n"
            + "species {\n"
            + "  POPC { head = [P], tail = [C218, C316], mass = 760.076 }\n"
            + "  TIP3 { mass = 18.015 }\n"
            + "}\n");

    @Test
    void readsSpeciesWithOptionalMarkers() {
        MembraneSettings settings = MembraneSettings.fromConfig(MEMBRANE);

        assertThat(settings.templateDir()).isEqualTo(Path.of("templates"));
        assertThat(settings.species("POPC").tailAtoms()).containsExactly("C218", "C316");
        assertThat(settings.species("TIP3").headAtoms()).isEmpty();
    }

    @Test
    void molecularVolumeFollowsFromMassAndDensity() {
        MembraneSettings settings = MembraneSettings.fromConfig(MEMBRANE);

        assertThat(settings.molecularVolume("TIP3")).isCloseTo(29.915, within(1e-3));
    }

    @Test
    void unknownSpeciesIsAConfigurationError() {
        MembraneSettings settings = MembraneSettings.fromConfig(MEMBRANE);

        assertThatThrownBy(() -> settings.species("DPPC"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("DPPC");
    }
}
