package com.inventoryforecast.backend;

import com.inventoryforecast.client.DecompositionLibrary;
import com.inventoryforecast.client.FittedDecomposition;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.dto.BusinessContext;
import com.inventoryforecast.dto.DataQuality;
import com.inventoryforecast.dto.DiagnosticsReport;
import com.inventoryforecast.dto.TrendAnalysis;
import com.inventoryforecast.exception.ForecastStepException;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.CrossValidationSummary;
import com.inventoryforecast.model.DecompositionPoint;
import com.inventoryforecast.model.DemandSeries;
import com.inventoryforecast.model.FitOutcome;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.StepEstimate;
import com.inventoryforecast.model.StepResult;
import com.inventoryforecast.model.TrendChangepoint;
import com.inventoryforecast.service.DataPreparationService;
import com.inventoryforecast.service.DiagnosticsService;
import com.inventoryforecast.service.ForecastGenerator;
import com.inventoryforecast.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Trend plus seasonality plus holiday decomposition with the regional business calendar.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DecomposableBackend implements ForecastBackend<DemandSeries, FittedDecomposition> {

    static final List<String> RECOMMENDATIONS = List.of(
        "Monitor trend changes and seasonality shifts",
        "Retrain model monthly with new data",
        "Use trend analysis for strategic planning");

    static final List<String> SEASONALITY_PATTERNS = List.of(
        "yearly_business_cycle", "weekly_shopping_pattern", "monthly_payday_effect", "ramadan_effect");

    static final List<String> COMPONENTS = List.of("trend", "seasonal", "holidays");

    private final DataPreparationService preparationService;
    private final DecompositionLibrary decompositionLibrary;
    private final DecompositionCrossValidator crossValidator;
    private final ForecastGenerator forecastGenerator;
    private final DiagnosticsService diagnosticsService;
    private final ForecastProperties properties;

    @Override
    public ForecastBackendType type() {
        return ForecastBackendType.DECOMPOSABLE;
    }

    @Override
    public DemandSeries prepare(ForecastJob job) {
        return preparationService.prepare(job.getValues(), job.getDates(),
            new DataPreparationService.Policy(minimumPoints(), true, false));
    }

    @Override
    public FitOutcome<FittedDecomposition> fit(DemandSeries series, ForecastJob job) {
        try {
            return FitOutcome.success(
                decompositionLibrary.fit(series.dates(), series.values(), job.getDecompositionConfig()));
        } catch (ModelFitException e) {
            log.warn("Decomposition fit failed | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            return FitOutcome.failure(e);
        }
    }

    @Override
    public List<StepResult> forecast(FittedDecomposition model, DemandSeries series, ForecastJob job) {
        int horizon = job.getHorizon();
        LocalDate end = series.endDate();
        List<LocalDate> future = IntStream.rangeClosed(1, horizon).mapToObj(end::plusDays).toList();
        List<DecompositionPoint> predicted;
        String predictionError = null;
        try {
            predicted = model.predict(future);
        } catch (RuntimeException e) {
            log.warn("Decomposition prediction failed | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            predicted = List.of();
            predictionError = e.getMessage();
        }
        List<DecompositionPoint> points = predicted;
        String error = predictionError;
        return forecastGenerator.generate(horizon, job.getConfidenceLevel(), step -> end.plusDays(step), step -> {
            if (points.size() < step) {
                throw new ForecastStepException(step, error != null
                    ? "Decomposition prediction unavailable: " + error
                    : "No decomposition estimate for step " + step);
            }
            DecompositionPoint p = points.get(step - 1);
            return StepEstimate.builder()
                .point(p.getYhat())
                .lower(p.getLower())
                .upper(p.getUpper())
                .trend(Numbers.round(p.getTrend()))
                .seasonal(Numbers.round(p.getSeasonal()))
                .yearly(p.getYearly() == null ? null : Numbers.round(p.getYearly()))
                .weekly(p.getWeekly() == null ? null : Numbers.round(p.getWeekly()))
                .build();
        });
    }

    @Override
    public BackendReport diagnose(FittedDecomposition model, DemandSeries series, ForecastJob job) {
        List<TrendChangepoint> changepoints = model.changepoints();
        DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder()
            .success(true)
            .modelType(type().getModelType())
            .seasonalityComponents(model.seasonalities())
            .totalSeasonalities(model.seasonalities().size())
            .changepointCount(changepoints.size());

        List<String> errors = new ArrayList<>();
        try {
            report.performance(performance(model, series, job));
        } catch (RuntimeException e) {
            log.warn("Decomposition performance unavailable | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            errors.add("performance: " + e.getMessage());
        }
        try {
            holdout(series, job, report);
        } catch (RuntimeException e) {
            log.warn("Decomposition holdout unavailable | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            errors.add("holdout: " + e.getMessage());
        }
        if (!errors.isEmpty()) {
            report.diagnosticsError(String.join("; ", errors));
        }

        TrendAnalysis trend = null;
        if (job.isIncludeTrendAnalysis()) {
            trend = TrendAnalysis.builder()
                .success(true)
                .changepoints(changepoints)
                .totalChangepoints(changepoints.size())
                .trendAnalysis("Available")
                .build();
        }

        return BackendReport.builder()
            .dataQuality(DataQuality.builder()
                .dataPoints(series.size())
                .dateRange(DataQuality.DateRange.builder().start(series.startDate()).end(series.endDate()).build())
                .filledValues(series.getFilledCount())
                .clampedValues(series.getClampedCount())
                .syntheticDates(series.isSyntheticDates())
                .build())
            .diagnostics(report.build())
            .trendAnalysis(trend)
            .businessContext(BusinessContext.builder()
                .businessCalendarApplied(true)
                .holidaysIncluded(!job.getDecompositionConfig().getHolidays().isEmpty())
                .seasonalityPatterns(SEASONALITY_PATTERNS)
                .build())
            .recommendations(RECOMMENDATIONS)
            .forecastComponents(COMPONENTS)
            .build();
    }

    // Short series are scored in-sample; longer ones with rolling-origin cross-validation.
    private CrossValidationSummary performance(FittedDecomposition model, DemandSeries series, ForecastJob job) {
        if (series.size() >= properties.getDecomposition().getCrossValidationThreshold()) {
            return crossValidator.crossValidate(series, job.getDecompositionConfig());
        }
        double[] actual = series.values();
        double[] predicted = model.predict(series.dates()).stream().mapToDouble(DecompositionPoint::getYhat).toArray();
        return CrossValidationSummary.builder()
            .crossValidation(false)
            .mape(Numbers.round(diagnosticsService.mape(actual, predicted)))
            .mae(Numbers.round(diagnosticsService.mae(actual, predicted)))
            .rmse(Numbers.round(diagnosticsService.rmse(actual, predicted)))
            .inSampleOnly(true)
            .build();
    }

    private void holdout(DemandSeries series, ForecastJob job, DiagnosticsReport.DiagnosticsReportBuilder report) {
        int split = diagnosticsService.splitIndex(series.size());
        DemandSeries train = series.head(split);
        List<LocalDate> validationDates = series.dates().subList(split, series.size());
        double[] validation = series.tail(split);

        FittedDecomposition trainModel = decompositionLibrary.fit(train.dates(), train.values(), job.getDecompositionConfig());
        double[] trainPredicted = yhat(trainModel.predict(train.dates()));
        double[] validationPredicted = yhat(trainModel.predict(validationDates));
        double[] trainActual = train.values();

        report.trainMetrics(diagnosticsService.evaluate(trainActual, trainPredicted))
              .validationMetrics(diagnosticsService.evaluate(validation, validationPredicted))
              .overfittingCheck(diagnosticsService.overfitting(
                  diagnosticsService.mae(trainActual, trainPredicted),
                  diagnosticsService.mae(validation, validationPredicted)));
    }

    private static double[] yhat(List<DecompositionPoint> points) {
        return points.stream().mapToDouble(DecompositionPoint::getYhat).toArray();
    }

    @Override
    public List<String> failureRecommendations() {
        return List.of("Check data format and quality",
                       "Ensure sufficient historical data",
                       "Try additive seasonality_mode for series with many zero values");
    }

    @Override
    public int minimumPoints() {
        return properties.getDecomposition().getMinDataPoints();
    }

    @Override
    public int defaultHorizon() {
        return properties.getDecomposition().getDefaultSteps();
    }
}
