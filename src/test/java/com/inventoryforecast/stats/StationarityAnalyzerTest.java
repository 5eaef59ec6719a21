package com.inventoryforecast.stats;

import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.StationarityResult;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.*;

class StationarityAnalyzerTest {

    private final StationarityAnalyzer analyzer = new StationarityAnalyzer();

    @Test
    void analyze_whiteNoise_isStationary() {
        Random random = new Random(7);
        double[] noise = new double[200];
        for (int i = 0; i < noise.length; i++) {
            noise[i] = 50.0 + random.nextGaussian();
        }

        StationarityResult result = analyzer.analyze(noise);

        assertThat(result.isStationary()).isTrue();
        assertThat(result.getPValue()).isLessThan(0.05);
        assertThat(result.getCriticalValues()).containsKeys("1%", "5%", "10%");
        assertThat(result.getCriticalValues().get("5%")).isCloseTo(-2.87, within(0.02));
        assertThat(result.getInterpretation()).isEqualTo("Series is stationary");
    }

    @Test
    void analyze_tooShort_throwsDiagnosticsException() {
        assertThatThrownBy(() -> analyzer.analyze(new double[]{1.0, 2.0, 3.0}))
            .isInstanceOf(DiagnosticsException.class);
    }

    @Test
    void pValue_atFivePercentCriticalValue_isAboutFivePercent() {
        assertThat(analyzer.pValue(-2.86)).isCloseTo(0.05, within(0.01));
    }

    @Test
    void pValue_followsStatisticMonotonically() {
        assertThat(analyzer.pValue(-5.0)).isLessThan(0.01);
        assertThat(analyzer.pValue(0.0)).isGreaterThan(0.5);
        assertThat(analyzer.pValue(3.0)).isEqualTo(1.0);
        assertThat(analyzer.pValue(-20.0)).isZero();
    }
}
