package com.inventoryforecast.service;

import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.AccuracyMetrics;
import com.inventoryforecast.model.FeatureImportance;
import com.inventoryforecast.model.OverfittingCheck;
import com.inventoryforecast.model.SeasonalDecompositionResult;
import com.inventoryforecast.model.StationarityResult;
import com.inventoryforecast.stats.SeasonalDecomposer;
import com.inventoryforecast.stats.StationarityAnalyzer;
import com.inventoryforecast.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Accuracy metrics, overfitting signal, stationarity and decomposition checks and feature
 * importance analysis shared by all backends.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DiagnosticsService {

    public static final double OVERFITTING_RATIO = 1.5;
    public static final int DIAGNOSTIC_TOP_FEATURES = 10;
    public static final int ANALYSIS_TOP_FEATURES = 15;

    static final List<String> CATEGORIES =
        List.of("temporal", "statistical", "seasonal", "trend", "external", "other");

    private final StationarityAnalyzer stationarityAnalyzer;
    private final SeasonalDecomposer seasonalDecomposer;
    private final ForecastProperties properties;

    public AccuracyMetrics evaluate(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);
        int n = actual.length;
        double absolute = 0.0;
        double squared = 0.0;
        for (int i = 0; i < n; i++) {
            double err = actual[i] - predicted[i];
            absolute += Math.abs(err);
            squared += err * err;
        }
        return AccuracyMetrics.builder()
            .sampleCount(n)
            .mae(Numbers.round(absolute / n))
            .rmse(Numbers.round(Math.sqrt(squared / n)))
            .mape(Numbers.round(mape(actual, predicted)))
            .r2(Numbers.round(r2(actual, predicted)))
            .build();
    }

    /** Mean absolute percentage error over non-zero actuals, in percent. */
    public double mape(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);
        double sum = 0.0;
        int count = 0;
        for (int i = 0; i < actual.length; i++) {
            if (actual[i] != 0.0) {
                sum += Math.abs((actual[i] - predicted[i]) / actual[i]);
                count++;
            }
        }
        return count == 0 ? 100.0 : sum / count * 100.0;
    }

    public double mae(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            sum += Math.abs(actual[i] - predicted[i]);
        }
        return sum / actual.length;
    }

    public double rmse(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);
        double sum = 0.0;
        for (int i = 0; i < actual.length; i++) {
            double err = actual[i] - predicted[i];
            sum += err * err;
        }
        return Math.sqrt(sum / actual.length);
    }

    public double r2(double[] actual, double[] predicted) {
        requireAligned(actual, predicted);
        double mean = Numbers.mean(actual);
        double residual = 0.0;
        double total = 0.0;
        for (int i = 0; i < actual.length; i++) {
            residual += (actual[i] - predicted[i]) * (actual[i] - predicted[i]);
            total += (actual[i] - mean) * (actual[i] - mean);
        }
        if (total == 0.0) {
            return residual == 0.0 ? 1.0 : 0.0;
        }
        return 1.0 - residual / total;
    }

    public OverfittingCheck overfitting(double trainMae, double validationMae) {
        double ratio = trainMae > 0 ? validationMae / trainMae : 1.0;
        return new OverfittingCheck(ratio, ratio > OVERFITTING_RATIO);
    }

    /** Index of the first validation row for a time-ordered holdout. */
    public int splitIndex(int n) {
        return (int) Math.floor(n * (1.0 - properties.getValidationFraction()) + 1e-9);
    }

    public double bic(double logLikelihood, int parameters, int observations) {
        return -2.0 * logLikelihood + parameters * Math.log(observations);
    }

    public StationarityResult stationarity(double[] values) {
        try {
            return stationarityAnalyzer.analyze(values);
        } catch (DiagnosticsException e) {
            log.warn("Stationarity test failed | reason={}", e.getMessage());
            return StationarityResult.failed(e.getMessage());
        }
    }

    public SeasonalDecompositionResult decompose(double[] values, int period) {
        try {
            return seasonalDecomposer.decompose(values, period);
        } catch (DiagnosticsException e) {
            log.warn("Seasonal decomposition failed | period={} | reason={}", period, e.getMessage());
            return SeasonalDecompositionResult.failed(e.getMessage());
        }
    }

    public List<FeatureImportance> rankImportances(Map<String, Double> importances, int limit) {
        return importances.entrySet().stream()
            .map(e -> new FeatureImportance(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingDouble(FeatureImportance::importance).reversed())
            .limit(limit)
            .toList();
    }

    /** Groups importances by name pattern; each category is sorted by importance, descending. */
    public Map<String, List<FeatureImportance>> categorize(Map<String, Double> importances) {
        Map<String, List<FeatureImportance>> grouped = new LinkedHashMap<>();
        CATEGORIES.forEach(c -> grouped.put(c, new ArrayList<>()));
        for (FeatureImportance fi : rankImportances(importances, Integer.MAX_VALUE)) {
            grouped.get(category(fi.feature())).add(fi);
        }
        return grouped;
    }

    static String category(String feature) {
        if (containsAny(feature, "month", "day", "year", "quarter", "week")) {
            return "temporal";
        }
        if (containsAny(feature, "lag_", "rolling_", "pct_change")) {
            return "statistical";
        }
        if (containsAny(feature, "sin_", "cos_", "seasonal", "holiday")) {
            return "seasonal";
        }
        if (containsAny(feature, "trend", "macd", "rsi")) {
            return "trend";
        }
        if (feature.startsWith(FeatureEngineeringService.EXTERNAL_PREFIX)) {
            return "external";
        }
        return "other";
    }

    private static boolean containsAny(String value, String... fragments) {
        for (String fragment : fragments) {
            if (value.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private static void requireAligned(double[] actual, double[] predicted) {
        if (actual.length == 0) {
            throw new DiagnosticsException("Cannot compute metrics on an empty sample");
        }
        if (actual.length != predicted.length) {
            throw new DiagnosticsException("Actual and predicted lengths differ: "
                + actual.length + " vs " + predicted.length);
        }
    }
}
