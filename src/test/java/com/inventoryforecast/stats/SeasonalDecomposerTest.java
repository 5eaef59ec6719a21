package com.inventoryforecast.stats;

import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.SeasonalDecompositionResult;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SeasonalDecomposerTest {

    private static final double[] WEEKLY_PATTERN = {-3.0, -2.0, -1.0, 0.0, 1.0, 2.0, 3.0};

    private final SeasonalDecomposer decomposer = new SeasonalDecomposer();

    @Test
    void decompose_pureWeeklyPattern_isFullySeasonal() {
        double[] values = new double[28];
        for (int i = 0; i < values.length; i++) {
            values[i] = 20.0 + WEEKLY_PATTERN[i % 7];
        }

        SeasonalDecompositionResult result = decomposer.decompose(values, 7);

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getPeriod()).isEqualTo(7);
        assertThat(result.getTrend()).hasSize(28).allSatisfy(t -> assertThat(t).isCloseTo(20.0, within(1e-3)));
        assertThat(result.getSeasonal().get(6)).isCloseTo(3.0, within(1e-3));
        assertThat(result.getResidual()).allSatisfy(r -> assertThat(r).isCloseTo(0.0, within(1e-3)));
        assertThat(result.getSeasonalStrength()).isCloseTo(1.0, within(1e-3));
    }

    @Test
    void decompose_fewerThanTwoCycles_throwsDiagnosticsException() {
        assertThatThrownBy(() -> decomposer.decompose(new double[10], 7))
            .isInstanceOf(DiagnosticsException.class)
            .hasMessageContaining("two complete cycles");
    }

    @Test
    void decompose_periodBelowTwo_throwsDiagnosticsException() {
        assertThatThrownBy(() -> decomposer.decompose(new double[10], 1))
            .isInstanceOf(DiagnosticsException.class);
    }

    @Test
    void seasonalStrength_noResidualVariance_isOne() {
        assertThat(decomposer.seasonalStrength(new double[]{1.0, -1.0}, new double[]{0.0, 0.0})).isEqualTo(1.0);
    }
}
