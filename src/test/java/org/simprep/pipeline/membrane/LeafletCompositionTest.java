package org.simprep.pipeline.membrane;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.simprep.pipeline.ConfigurationException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class LeafletCompositionTest {

    private static LeafletComposition mix(double popc, double pope) {
        return new LeafletComposition(List.of(new LipidSpec("POPC", popc, 0), new LipidSpec("POPE", pope, 0)));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.3, 0.8})
    void fractionsMustSumToOne(double pope) {
        assertThatThrownBy(() -> mix(0.5, pope).validate("upper"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("upper leaflet");
    }

    @Test
    void smallRoundingErrorIsAccepted() {
        assertThatCode(() -> mix(0.333, 0.666).validate("lower")).doesNotThrowAnyException();
    }

    @Test
    void duplicateSpeciesIsRejected() {
        LeafletComposition twice = new LeafletComposition(
            List.of(new LipidSpec("POPC", 0.5, 0), new LipidSpec("POPC", 0.5, 1)));

        assertThatThrownBy(() -> twice.validate("upper")).hasMessageContaining("listed twice");
    }

    @Test
    void emptyLeafletIsRejected() {
        assertThatThrownBy(() -> new LeafletComposition(List.of()).validate("lower"))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void remainderOfTheSplitGoesToTheMajorSpecies() {
        assertThat(mix(0.3, 0.7).speciesCounts(101)).containsEntry("POPC", 30).containsEntry("POPE", 71);
        assertThat(mix(0.5, 0.5).speciesCounts(3)).containsEntry("POPC", 2).containsEntry("POPE", 1);
    }

    @Test
    void sameCompositionIgnoresListingOrder() {
        LeafletComposition reversed = new LeafletComposition(
            List.of(new LipidSpec("POPE", 0.7, 0), new LipidSpec("POPC", 0.3, 0)));

        assertThat(mix(0.3, 0.7).sameComposition(reversed)).isTrue();
        assertThat(mix(0.3, 0.7).sameComposition(mix(0.4, 0.6))).isFalse();
    }
}
