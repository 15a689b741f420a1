package org.simprep.pipeline.logs;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class NamdLogParserTest {

    @TempDir
    Path dir;

    @Test
    void readsEnergyLinesUnderTheFirstTitle() throws Exception {
        Path log = dir.resolve("md.log");
        Files.write(log, List.of(
            "Info: startup",
            "ETITLE:      TS           BOND          ANGLE         VOLUME",
            "ENERGY:       0        10.5000        20.2500     125000.0000",
            "TIMING: 100  CPU: 1.2",
            "ETITLE:      TS           BOND          ANGLE         VOLUME",
            "ENERGY:     100         9.7500        19.0000     124800.0000"));

        TimeSeries series = NamdLogParser.parse(log);

        assertThat(series.columns()).containsExactly("TS", "BOND", "ANGLE", "VOLUME");
        assertThat(series.size()).isEqualTo(2);
        assertThat(series.column("ts")).containsExactly(0.0, 100.0);
        assertThat(series.column("VOLUME")).containsExactly(125000.0, 124800.0);
    }

    @Test
    void logWithoutEnergyTableIsEmpty() throws Exception {
        Path log = dir.resolve("psfgen.log");
        Files.write(log, List.of("psfgen) building segment A"));

        TimeSeries series = NamdLogParser.parse(log);

        assertThat(series.isEmpty()).isTrue();
        assertThat(series.columns()).isEmpty();
    }

    @Test
    void energyLineWithWrongFieldCountIsAnError() throws Exception {
        Path log = dir.resolve("broken.log");
        Files.write(log, List.of("ETITLE: TS BOND", "ENERGY: 0 1.0 2.0"));

        assertThatThrownBy(() -> NamdLogParser.parse(log))
            .isInstanceOf(IOException.class)
            .hasMessageContaining("3 fields");
    }

    @Test
    void csvHasOneRowPerSample() throws Exception {
        Path csv = dir.resolve("out.csv");

        TimeSeries.writeCsv(csv, List.of("TS", "BOND"), List.of(List.of(0.0, 100.0), List.of(1.5, 2.5)));

        assertThat(Files.readAllLines(csv)).containsExactly("TS,BOND", "0.00000,1.50000", "100.000,2.50000");
    }
}
