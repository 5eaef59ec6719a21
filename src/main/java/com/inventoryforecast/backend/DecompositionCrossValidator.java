package com.inventoryforecast.backend;

import com.inventoryforecast.client.DecompositionLibrary;
import com.inventoryforecast.client.FittedDecomposition;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.CrossValidationSummary;
import com.inventoryforecast.model.DecompositionConfig;
import com.inventoryforecast.model.DecompositionPoint;
import com.inventoryforecast.model.DemandSeries;
import com.inventoryforecast.service.DiagnosticsService;
import com.inventoryforecast.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Rolling-origin cross-validation for the decomposition model. Cutoffs step back from
 * {@code end - horizon} by {@code period} days while at least {@code initial} days of history remain.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecompositionCrossValidator {

    private final DecompositionLibrary decompositionLibrary;
    private final DiagnosticsService diagnosticsService;
    private final ForecastProperties properties;

    public CrossValidationSummary crossValidate(DemandSeries series, DecompositionConfig config) {
        ForecastProperties.Decomposition settings = properties.getDecomposition();
        List<LocalDate> cutoffs = cutoffs(series, settings.getCvInitialDays(),
                                          settings.getCvPeriodDays(), settings.getCvHorizonDays());
        List<Double> actual = new ArrayList<>();
        List<Double> predicted = new ArrayList<>();
        int covered = 0;
        int used = 0;

        for (LocalDate cutoff : cutoffs) {
            LocalDate horizonEnd = cutoff.plusDays(settings.getCvHorizonDays());
            List<LocalDate> trainDates = new ArrayList<>();
            List<Double> trainValues = new ArrayList<>();
            List<LocalDate> testDates = new ArrayList<>();
            List<Double> testValues = new ArrayList<>();
            for (int i = 0; i < series.size(); i++) {
                LocalDate date = series.dateAt(i);
                if (!date.isAfter(cutoff)) {
                    trainDates.add(date);
                    trainValues.add(series.valueAt(i));
                } else if (!date.isAfter(horizonEnd)) {
                    testDates.add(date);
                    testValues.add(series.valueAt(i));
                }
            }
            if (testDates.isEmpty() || trainDates.size() < 2) {
                continue;
            }
            FittedDecomposition model = decompositionLibrary.fit(trainDates,
                trainValues.stream().mapToDouble(Double::doubleValue).toArray(), config);
            List<DecompositionPoint> points = model.predict(testDates);
            for (int i = 0; i < points.size(); i++) {
                DecompositionPoint point = points.get(i);
                double y = testValues.get(i);
                actual.add(y);
                predicted.add(point.getYhat());
                if (y >= point.getLower() && y <= point.getUpper()) {
                    covered++;
                }
            }
            used++;
        }

        if (used == 0) {
            throw new DiagnosticsException("No cross-validation cutoff has data in its horizon");
        }
        double[] a = actual.stream().mapToDouble(Double::doubleValue).toArray();
        double[] p = predicted.stream().mapToDouble(Double::doubleValue).toArray();
        log.debug("Decomposition cross-validated | cutoffs={} | predictions={}", used, a.length);
        return CrossValidationSummary.builder()
            .crossValidation(true)
            .mape(Numbers.round(diagnosticsService.mape(a, p)))
            .mae(Numbers.round(diagnosticsService.mae(a, p)))
            .rmse(Numbers.round(diagnosticsService.rmse(a, p)))
            .coverage(Numbers.round((double) covered / a.length))
            .cvPeriods(used)
            .build();
    }

    static List<LocalDate> cutoffs(DemandSeries series, int initialDays, int periodDays, int horizonDays) {
        LocalDate earliest = series.startDate().plusDays(initialDays);
        List<LocalDate> cutoffs = new ArrayList<>();
        for (LocalDate cutoff = series.endDate().minusDays(horizonDays);
             !cutoff.isBefore(earliest);
             cutoff = cutoff.minusDays(periodDays)) {
            cutoffs.add(0, cutoff);
        }
        return cutoffs;
    }
}
