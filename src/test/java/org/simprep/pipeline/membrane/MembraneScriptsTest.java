package org.simprep.pipeline.membrane;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.simprep.pipeline.ConfigurationException;
import org.simprep.pipeline.StateHandle;
import org.simprep.pipeline.engines.PsfgenScript;
import org.simprep.pipeline.structure.PeriodicBox;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class MembraneScriptsTest {

    private static final StateHandle TILE = StateHandle.empty().toBuilder()
        .structure(Path.of("tile.psf"), Path.of("tile.pdb")).build();

    @ParameterizedTest
    @CsvSource({"UPL, 1, U001", "LOL, 35, L00Z", "LOL, 36, L010", "UPL, 1000, U0RS", "UPL, 46655, UZZZ"})
    void tiledSegmentNamesStayWithinFourCharacters(String source, int n, String expected) {
        assertThat(MembraneScripts.tileSegment(source, n)).isEqualTo(expected).hasSizeLessThanOrEqualTo(4);
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 46656})
    void segmentNumberOutsideTheBase36RangeIsRejected(int n) {
        assertThatThrownBy(() -> MembraneScripts.tileSegment("UPL", n))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void tilingScriptNamesSegmentsInBase36() {
        PsfgenScript script = new PsfgenScript();

        MembraneScripts.replicate(script, TILE, 40, PeriodicBox.centered(60, 60, 80), 5, 6, "00-00-00_quilt");

        assertThat(script.lines()).anyMatch(l -> l.contains("proc tileseg {seg n}"));
        assertThat(script.lines()).anyMatch(l -> l.contains("set newseg [tileseg $seg [incr n]]"));
        assertThat(script.lines()).noneMatch(l -> l.contains("%03d"));
    }

    @Test
    void quiltNeedingMoreSegmentNamesThanAvailableIsRejected() {
        PsfgenScript script = new PsfgenScript();

        assertThatThrownBy(() -> MembraneScripts.replicate(script, TILE, 2000, PeriodicBox.centered(60, 60, 80),
            5, 5, "00-00-00_quilt"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("needs 50000 segment names")
            .hasMessageContaining("at most 46655");
        assertThat(script.lines()).isEmpty();
    }
}
