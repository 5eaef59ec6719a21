package com.inventoryforecast.service;

import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.dto.ForecastRequest;
import com.inventoryforecast.model.DecompositionConfig;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.SeasonalityMode;
import com.inventoryforecast.model.TreeHyperparameters;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves every request default once, so backends only ever see complete jobs.
 */
@Component
@RequiredArgsConstructor
public class ForecastJobFactory {

    private final ForecastProperties properties;

    public ForecastJob create(ForecastBackendType backend, ForecastRequest request, String requestId) {
        double confidence = orDefault(request.getConfidenceLevel(), properties.getDefaultConfidenceLevel());
        return ForecastJob.builder()
            .requestId(requestId)
            .backend(backend)
            .values(request.getDataPoints())
            .dates(request.getDates())
            .horizon(orDefault(request.getForecastSteps(), defaultSteps(backend)))
            .confidenceLevel(confidence)
            .seasonal(orDefault(request.getSeasonal(), false))
            .seasonalPeriod(orDefault(request.getSeasonalPeriod(), properties.getArima().getDefaultSeasonalPeriod()))
            .externalFeatures(request.getExternalFeatures())
            .hyperparameters(hyperparameters(request.getHyperparameters()))
            .optimizeHyperparameters(orDefault(request.getOptimizeHyperparameters(), true))
            .includeFeatureAnalysis(orDefault(request.getIncludeFeatureAnalysis(), true))
            .includeTrendAnalysis(orDefault(request.getIncludeTrendAnalysis(), true))
            .decompositionConfig(decompositionConfig(request.getSeasonalityConfig(), confidence))
            .build();
    }

    int defaultSteps(ForecastBackendType backend) {
        return switch (backend) {
            case AUTOREGRESSIVE -> properties.getArima().getDefaultSteps();
            case DECOMPOSABLE -> properties.getDecomposition().getDefaultSteps();
            case GRADIENT_BOOSTED -> properties.getTree().getDefaultSteps();
        };
    }

    // Null when the request carries no overrides, so the backend knows to search.
    private static TreeHyperparameters hyperparameters(ForecastRequest.TreeHyperparameterOverrides o) {
        if (o == null) {
            return null;
        }
        TreeHyperparameters defaults = TreeHyperparameters.defaults();
        return TreeHyperparameters.builder()
            .learningRate(orDefault(o.getLearningRate(), defaults.getLearningRate()))
            .maxDepth(orDefault(o.getMaxDepth(), defaults.getMaxDepth()))
            .estimators(orDefault(o.getEstimators(), defaults.getEstimators()))
            .minChildWeight(orDefault(o.getMinChildWeight(), defaults.getMinChildWeight()))
            .subsample(orDefault(o.getSubsample(), defaults.getSubsample()))
            .colsampleBytree(orDefault(o.getColsampleBytree(), defaults.getColsampleBytree()))
            .seed(orDefault(o.getSeed(), defaults.getSeed()))
            .build();
    }

    private static DecompositionConfig decompositionConfig(ForecastRequest.SeasonalityOverrides o, double confidence) {
        DecompositionConfig defaults = DecompositionConfig.defaults();
        DecompositionConfig.DecompositionConfigBuilder builder = defaults.toBuilder().intervalWidth(confidence);
        if (o == null) {
            return builder.build();
        }
        return builder
            .yearlySeasonality(orDefault(o.getYearlySeasonality(), defaults.isYearlySeasonality()))
            .weeklySeasonality(orDefault(o.getWeeklySeasonality(), defaults.isWeeklySeasonality()))
            .dailySeasonality(orDefault(o.getDailySeasonality(), defaults.isDailySeasonality()))
            .seasonalityMode(o.getSeasonalityMode() != null
                ? SeasonalityMode.fromLabel(o.getSeasonalityMode()) : defaults.getSeasonalityMode())
            .seasonalityPriorScale(orDefault(o.getSeasonalityPriorScale(), defaults.getSeasonalityPriorScale()))
            .holidaysPriorScale(orDefault(o.getHolidaysPriorScale(), defaults.getHolidaysPriorScale()))
            .changepointPriorScale(orDefault(o.getChangepointPriorScale(), defaults.getChangepointPriorScale()))
            .intervalWidth(orDefault(o.getIntervalWidth(), confidence))
            .build();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
