package com.inventoryforecast.service;

import com.inventoryforecast.backend.BackendReport;
import com.inventoryforecast.dto.ForecastBlock;
import com.inventoryforecast.dto.ForecastResponse;
import com.inventoryforecast.exception.ForecastException;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.StepResult;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds the success and failure envelopes shared by every backend.
 */
@Component
public class ResultAssembler {

    public static final String REQUIRED_ACTION = "Collect more historical sales data";
    public static final String FALLBACK_RECOMMENDATION = "Use simpler forecasting method";
    public static final String UNEXPECTED_ERROR_CODE = "INTERNAL_ERROR";

    public ForecastResponse success(ForecastBackendType backend, List<StepResult> steps, double confidenceLevel,
                                    BackendReport report, String requestId) {
        List<ForecastPoint> points = ForecastGenerator.render(steps);
        long failed = steps.stream().filter(s -> !s.isSuccess()).count();
        ForecastBlock block = ForecastBlock.builder()
            .forecasts(points)
            .forecastHorizon(points.size())
            .modelType(backend.getModelType())
            .confidenceLevel(confidenceLevel)
            .failedSteps(failed > 0 ? (int) failed : null)
            .componentsIncluded(report.getForecastComponents())
            .build();

        return ForecastResponse.builder()
            .success(true)
            .modelType(backend.getModelType())
            .dataQuality(report.getDataQuality())
            .modelDiagnostics(report.getDiagnostics())
            .forecasts(block)
            .trendAnalysis(report.getTrendAnalysis())
            .featureAnalysis(report.getFeatureAnalysis())
            .businessContext(report.getBusinessContext())
            .recommendations(report.getRecommendations())
            .requestId(requestId)
            .build();
    }

    public ForecastResponse insufficientData(ForecastException e, List<String> recommendations, String requestId) {
        return failureBuilder(e, recommendations, requestId)
            .requiredAction(REQUIRED_ACTION)
            .build();
    }

    public ForecastResponse fitFailure(ForecastBackendType backend, String error, List<String> recommendations,
                                       String requestId) {
        return ForecastResponse.builder()
            .success(false)
            .modelType(backend.getModelType())
            .error(error)
            .errorType("ModelFitException")
            .errorCode("FIT_ERROR")
            .fallbackRecommendation(FALLBACK_RECOMMENDATION)
            .recommendations(recommendations)
            .requestId(requestId)
            .build();
    }

    public ForecastResponse failure(ForecastException e, List<String> recommendations, String requestId) {
        return failureBuilder(e, recommendations, requestId).build();
    }

    public ForecastResponse unexpected(RuntimeException e, List<String> recommendations, String requestId) {
        return ForecastResponse.builder()
            .success(false)
            .error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
            .errorType(e.getClass().getSimpleName())
            .errorCode(UNEXPECTED_ERROR_CODE)
            .recommendations(recommendations)
            .requestId(requestId)
            .build();
    }

    private ForecastResponse.ForecastResponseBuilder failureBuilder(ForecastException e, List<String> recommendations,
                                                                    String requestId) {
        return ForecastResponse.builder()
            .success(false)
            .error(e.getMessage())
            .errorType(e.getClass().getSimpleName())
            .errorCode(e.getErrorCode())
            .recommendations(recommendations)
            .requestId(requestId);
    }
}
