package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * One forecasting run with every default already resolved.
 */
@Value
@Builder
public class ForecastJob {
    String                    requestId;
    ForecastBackendType       backend;
    List<Double>              values;
    List<LocalDate>           dates;
    int                       horizon;
    double                    confidenceLevel;
    boolean                   seasonal;
    int                       seasonalPeriod;
    Map<String, List<Double>> externalFeatures;
    TreeHyperparameters       hyperparameters;
    boolean                   optimizeHyperparameters;
    boolean                   includeFeatureAnalysis;
    boolean                   includeTrendAnalysis;
    DecompositionConfig       decompositionConfig;
}
