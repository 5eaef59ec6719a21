package com.inventoryforecast.backend;

import com.inventoryforecast.client.LeastSquaresDecompositionLibrary;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.CrossValidationSummary;
import com.inventoryforecast.model.DecompositionConfig;
import com.inventoryforecast.model.DemandSeries;
import com.inventoryforecast.service.DiagnosticsService;
import com.inventoryforecast.stats.SeasonalDecomposer;
import com.inventoryforecast.stats.StationarityAnalyzer;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;

class DecompositionCrossValidatorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final ForecastProperties properties = new ForecastProperties();
    private final LeastSquaresDecompositionLibrary library = new LeastSquaresDecompositionLibrary();
    private final DecompositionCrossValidator validator = new DecompositionCrossValidator(library,
        new DiagnosticsService(new StationarityAnalyzer(), new SeasonalDecomposer(), properties), properties);

    private static DemandSeries series(int n) {
        List<LocalDate> dates = IntStream.range(0, n).mapToObj(START::plusDays).toList();
        double[] values = IntStream.range(0, n).mapToDouble(i -> 40.0 + 0.2 * i + (i % 7 == 5 ? 8.0 : 0.0)).toArray();
        return new DemandSeries(dates, values, 0, 0, false);
    }

    @Test
    void cutoffs_stepBackFromHorizonWhileInitialHistoryRemains() {
        List<LocalDate> cutoffs = DecompositionCrossValidator.cutoffs(series(40), 15, 7, 7);

        assertThat(cutoffs).containsExactly(START.plusDays(18), START.plusDays(25), START.plusDays(32));
    }

    @Test
    void cutoffs_historyShorterThanInitialWindow_isEmpty() {
        assertThat(DecompositionCrossValidator.cutoffs(series(20), 15, 7, 7)).isEmpty();
    }

    @Test
    void crossValidate_poolsEveryCutoff() {
        CrossValidationSummary summary = validator.crossValidate(series(40), DecompositionConfig.defaults());

        assertThat(summary.isCrossValidation()).isTrue();
        assertThat(summary.getCvPeriods()).isEqualTo(3);
        assertThat(summary.getMape()).isNotNull().isGreaterThanOrEqualTo(0.0);
        assertThat(summary.getCoverage()).isBetween(0.0, 1.0);
    }

    @Test
    void crossValidate_noUsableCutoff_throwsDiagnosticsException() {
        assertThatThrownBy(() -> validator.crossValidate(series(20), DecompositionConfig.defaults()))
            .isInstanceOf(DiagnosticsException.class);
    }
}
