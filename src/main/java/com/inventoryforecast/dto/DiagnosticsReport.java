package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryforecast.model.AccuracyMetrics;
import com.inventoryforecast.model.CrossValidationSummary;
import com.inventoryforecast.model.FeatureImportance;
import com.inventoryforecast.model.HyperparameterSearchSummary;
import com.inventoryforecast.model.OverfittingCheck;
import com.inventoryforecast.model.SeasonalityComponent;
import com.inventoryforecast.model.TreeHyperparameters;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Backend-tagged fit diagnostics. Only the fields the serving backend computes are present.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DiagnosticsReport {
    boolean success;
    String  modelType;

    // autoregressive
    List<Integer> order;
    List<Integer> seasonalOrder;
    String        selectionMethod;
    Boolean       fallbackUsed;
    Integer       candidatesEvaluated;
    List<String>  selectionFailures;
    Double        aic;
    Double        bic;
    Double        logLikelihood;
    Double        residualStd;
    Double        residualMean;
    Double        mape;
    String        modelSummary;

    // decomposable
    List<SeasonalityComponent> seasonalityComponents;
    Integer                    totalSeasonalities;
    Integer                    changepointCount;
    CrossValidationSummary     performance;

    // tree
    Integer                     trainingSamples;
    Integer                     validationSamples;
    Integer                     featuresCount;
    List<FeatureImportance>     featureImportance;
    TreeHyperparameters         hyperparameters;
    HyperparameterSearchSummary hyperparameterSearch;

    AccuracyMetrics  trainMetrics;
    AccuracyMetrics  validationMetrics;
    OverfittingCheck overfittingCheck;
    String           diagnosticsError;
}
