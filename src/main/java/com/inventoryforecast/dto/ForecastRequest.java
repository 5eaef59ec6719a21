package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@Value
@Builder
@Jacksonized
public class ForecastRequest {

    List<Double> dataPoints;

    List<LocalDate> dates;

    @JsonAlias("forecast_horizon")
    @Positive(message = "forecast_steps must be positive")
    Integer forecastSteps;

    @DecimalMin(value = "0.0", inclusive = false, message = "confidence_level must be between 0 and 1")
    @DecimalMax(value = "1.0", inclusive = false, message = "confidence_level must be between 0 and 1")
    Double confidenceLevel;

    Boolean seasonal;

    @Min(value = 2, message = "seasonal_period must be at least 2")
    Integer seasonalPeriod;

    Map<String, List<Double>> externalFeatures;

    @Valid
    TreeHyperparameterOverrides hyperparameters;

    Boolean optimizeHyperparameters;

    Boolean includeFeatureAnalysis;

    Boolean includeTrendAnalysis;

    @Valid
    SeasonalityOverrides seasonalityConfig;

    @Value
    @Builder
    @Jacksonized
    public static class TreeHyperparameterOverrides {

        @DecimalMin(value = "0.0", inclusive = false, message = "learning_rate must be positive")
        Double learningRate;

        @Positive(message = "max_depth must be positive")
        Integer maxDepth;

        @JsonProperty("n_estimators")
        @Positive(message = "n_estimators must be positive")
        Integer estimators;

        @DecimalMin(value = "0.0", message = "min_child_weight must be >= 0")
        Double minChildWeight;

        @DecimalMin(value = "0.0", inclusive = false, message = "subsample must be in (0, 1]")
        @DecimalMax(value = "1.0", message = "subsample must be in (0, 1]")
        Double subsample;

        @DecimalMin(value = "0.0", inclusive = false, message = "colsample_bytree must be in (0, 1]")
        @DecimalMax(value = "1.0", message = "colsample_bytree must be in (0, 1]")
        Double colsampleBytree;

        Long seed;
    }

    @Value
    @Builder
    @Jacksonized
    public static class SeasonalityOverrides {
        Boolean yearlySeasonality;
        Boolean weeklySeasonality;
        Boolean dailySeasonality;
        @Pattern(regexp = "(?i)additive|multiplicative",
                 message = "seasonality_mode must be one of: additive, multiplicative")
        String  seasonalityMode;

        @Positive(message = "seasonality_prior_scale must be positive")
        Double seasonalityPriorScale;

        @Positive(message = "holidays_prior_scale must be positive")
        Double holidaysPriorScale;

        @Positive(message = "changepoint_prior_scale must be positive")
        Double changepointPriorScale;

        @DecimalMin(value = "0.0", inclusive = false, message = "interval_width must be between 0 and 1")
        @DecimalMax(value = "1.0", inclusive = false, message = "interval_width must be between 0 and 1")
        Double intervalWidth;
    }
}
