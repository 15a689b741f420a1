package org.simprep.pipeline.membrane;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TrimPlanTest {

    private static PatchRecord patch(String identity, double area) {
        return PatchRecord.of(identity, 100, area, true, null);
    }

    @Test
    void largerLowerPatchLosesLipidsFromTheLowerLeaflet() {
        TrimPlan plan = TrimPlan.compute(patch("U", 6500.0), patch("L", 7800.0), 1);

        assertThat(plan.leaflet()).isEqualTo(Leaflet.LOWER);
        assertThat(plan.excess()).isEqualTo(20);
        assertThat(plan.quiltLeafletCount()).isEqualTo(100);
        assertThat(plan.isNeeded()).isTrue();
    }

    @Test
    void largerUpperPatchLosesLipidsFromTheUpperLeafletOfEveryReplica() {
        TrimPlan plan = TrimPlan.compute(patch("U", 7000.0), patch("L", 6500.0), 4);

        assertThat(plan.leaflet()).isEqualTo(Leaflet.UPPER);
        assertThat(plan.quiltLeafletCount()).isEqualTo(400);
        assertThat(plan.excess()).isEqualTo(31);
    }

    @Test
    void exactHalvesRoundUp() {
        assertThat(TrimPlan.excess(10, 1.25, 1.0)).isEqualTo(3);
        assertThat(TrimPlan.excess(2, 1.25, 1.0)).isEqualTo(1);
        assertThat(TrimPlan.excess(100, 66.3, 65.0)).isEqualTo(2);
    }

    @Test
    void equalAreasNeedNoTrim() {
        TrimPlan plan = TrimPlan.compute(patch("U", 6500.0), patch("L", 6500.0), 2);

        assertThat(plan.leaflet()).isNull();
        assertThat(plan.excess()).isZero();
        assertThat(plan.isNeeded()).isFalse();
    }

    @Test
    void tinyDifferenceRoundsToNoTrim() {
        TrimPlan plan = TrimPlan.compute(patch("U", 6500.0), patch("L", 6510.0), 1);

        assertThat(plan.leaflet()).isEqualTo(Leaflet.LOWER);
        assertThat(plan.excess()).isZero();
        assertThat(plan.isNeeded()).isFalse();
    }

    @Test
    void nonPositiveAreaIsRejected() {
        assertThatThrownBy(() -> TrimPlan.compute(patch("U", 0.0), patch("L", 6500.0), 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
