package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Uniform result envelope. On failure only the error fields and recommendations are set.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastResponse {
    boolean           success;
    String            modelType;
    DataQuality       dataQuality;
    DiagnosticsReport modelDiagnostics;
    ForecastBlock     forecasts;
    TrendAnalysis     trendAnalysis;
    FeatureAnalysis   featureAnalysis;
    BusinessContext   businessContext;
    List<String>      recommendations;

    String error;
    String errorType;
    String errorCode;
    String requiredAction;
    String fallbackRecommendation;
    String requestId;
}
