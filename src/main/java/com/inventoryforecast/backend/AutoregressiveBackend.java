package com.inventoryforecast.backend;

import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.client.FittedArima;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.dto.BusinessContext;
import com.inventoryforecast.dto.DataQuality;
import com.inventoryforecast.dto.DiagnosticsReport;
import com.inventoryforecast.exception.ForecastStepException;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.AccuracyMetrics;
import com.inventoryforecast.model.ArimaConfig;
import com.inventoryforecast.model.DemandSeries;
import com.inventoryforecast.model.FitOutcome;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.StepEstimate;
import com.inventoryforecast.model.StepResult;
import com.inventoryforecast.search.ArimaOrderSearch;
import com.inventoryforecast.search.OrderSearchContext;
import com.inventoryforecast.search.OrderSelection;
import com.inventoryforecast.service.DataPreparationService;
import com.inventoryforecast.service.DiagnosticsService;
import com.inventoryforecast.service.ForecastGenerator;
import com.inventoryforecast.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * ARIMA / seasonal ARIMA with automatic order selection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutoregressiveBackend implements ForecastBackend<DemandSeries, OrderSelection> {

    static final List<String> RECOMMENDATIONS = List.of(
        "Model ready for production use",
        "Monitor forecast accuracy over time",
        "Retrain model monthly with new data");

    private final DataPreparationService preparationService;
    private final ArimaOrderSearch orderSearch;
    private final ArimaLibrary arimaLibrary;
    private final ForecastGenerator forecastGenerator;
    private final DiagnosticsService diagnosticsService;
    private final ForecastProperties properties;

    @Override
    public ForecastBackendType type() {
        return ForecastBackendType.AUTOREGRESSIVE;
    }

    @Override
    public DemandSeries prepare(ForecastJob job) {
        return preparationService.prepare(job.getValues(), job.getDates(),
            new DataPreparationService.Policy(minimumPoints(), false, false));
    }

    @Override
    public FitOutcome<OrderSelection> fit(DemandSeries series, ForecastJob job) {
        try {
            OrderSearchContext context = new OrderSearchContext(job.isSeasonal(), job.getSeasonalPeriod());
            return FitOutcome.success(orderSearch.search(series.values(), context));
        } catch (ModelFitException e) {
            log.warn("ARIMA fit failed | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            return FitOutcome.failure(e);
        }
    }

    @Override
    public List<StepResult> forecast(OrderSelection selection, DemandSeries series, ForecastJob job) {
        int horizon = job.getHorizon();
        double confidence = job.getConfidenceLevel();
        FittedArima.Prediction prediction;
        String predictionError = null;
        try {
            prediction = selection.model().forecast(horizon, 1.0 - confidence);
        } catch (RuntimeException e) {
            log.warn("ARIMA prediction failed | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            prediction = null;
            predictionError = e.getMessage();
        }
        FittedArima.Prediction result = prediction;
        String error = predictionError;
        return forecastGenerator.generate(horizon, confidence, step -> series.endDate().plusDays(step), step -> {
            if (result == null) {
                throw new ForecastStepException(step, "ARIMA prediction unavailable: " + error);
            }
            return estimate(result, step);
        });
    }

    private static StepEstimate estimate(FittedArima.Prediction prediction, int step) {
        double[] points = prediction.pointEstimates();
        if (points == null || points.length < step) {
            throw new ForecastStepException(step, "No ARIMA point estimate for step " + step);
        }
        return StepEstimate.builder()
            .point(points[step - 1])
            .lower(valueAt(prediction.lower(), step))
            .upper(valueAt(prediction.upper(), step))
            .build();
    }

    private static Double valueAt(double[] values, int step) {
        return values != null && values.length >= step ? values[step - 1] : null;
    }

    @Override
    public BackendReport diagnose(OrderSelection selection, DemandSeries series, ForecastJob job) {
        double[] values = series.values();
        FittedArima fitted = selection.model();
        ArimaConfig config = fitted.config();

        DataQuality.DataQualityBuilder quality = DataQuality.builder()
            .dataPoints(series.size())
            .dateRange(DataQuality.DateRange.builder().start(series.startDate()).end(series.endDate()).build())
            .filledValues(series.getFilledCount())
            .syntheticDates(series.isSyntheticDates())
            .stationarity(diagnosticsService.stationarity(values));
        if (job.isSeasonal()) {
            quality.seasonalAnalysis(diagnosticsService.decompose(values, job.getSeasonalPeriod()));
        }

        DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder()
            .success(true)
            .modelType(type().getModelType())
            .order(config.order())
            .seasonalOrder(config.seasonalOrder())
            .selectionMethod(selection.method())
            .fallbackUsed(selection.fallback())
            .candidatesEvaluated(selection.candidatesEvaluated())
            .selectionFailures(selection.failures().isEmpty() ? null : selection.failures())
            .aic(Numbers.round(fitted.aic()))
            .bic(Numbers.round(diagnosticsService.bic(fitted.logLikelihood(), config.parameterCount() + 1, values.length)))
            .logLikelihood(Numbers.round(fitted.logLikelihood()))
            .modelSummary(fitted.summary());

        try {
            double[] residuals = fitted.residuals();
            report.residualStd(Numbers.round(Numbers.std(residuals)))
                  .residualMean(Numbers.round(Numbers.mean(residuals)))
                  .mape(Numbers.round(diagnosticsService.mape(values, aligned(fitted.fittedValues(), values.length))));
            holdout(config, values, report);
        } catch (RuntimeException e) {
            log.warn("ARIMA diagnostics incomplete | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            report.diagnosticsError(e.getMessage());
        }

        return BackendReport.builder()
            .dataQuality(quality.build())
            .diagnostics(report.build())
            .businessContext(BusinessContext.builder().businessCalendarApplied(true).build())
            .recommendations(RECOMMENDATIONS)
            .build();
    }

    // Refits the selected order on the leading rows and scores the held-out tail.
    private void holdout(ArimaConfig config, double[] values, DiagnosticsReport.DiagnosticsReportBuilder report) {
        int split = diagnosticsService.splitIndex(values.length);
        double[] train = Arrays.copyOf(values, split);
        double[] validation = Arrays.copyOfRange(values, split, values.length);
        FittedArima trainModel = arimaLibrary.fit(train, config);
        double[] trainPredicted = aligned(trainModel.fittedValues(), train.length);
        double[] validationPredicted = Arrays.copyOf(
            trainModel.forecast(validation.length, 1.0 - properties.getDefaultConfidenceLevel()).pointEstimates(),
            validation.length);

        AccuracyMetrics trainMetrics = diagnosticsService.evaluate(train, trainPredicted);
        AccuracyMetrics validationMetrics = diagnosticsService.evaluate(validation, validationPredicted);
        report.trainMetrics(trainMetrics)
              .validationMetrics(validationMetrics)
              .overfittingCheck(diagnosticsService.overfitting(
                  diagnosticsService.mae(train, trainPredicted),
                  diagnosticsService.mae(validation, validationPredicted)));
    }

    // Fitted series can be shorter than the input when the library drops differenced rows.
    private static double[] aligned(double[] fitted, int length) {
        if (fitted.length == length) {
            return fitted;
        }
        double[] out = new double[length];
        Arrays.fill(out, Double.NaN);
        int offset = length - fitted.length;
        for (int i = Math.max(0, -offset); i < fitted.length; i++) {
            if (i + offset >= 0) {
                out[i + offset] = fitted[i];
            }
        }
        return out;
    }

    @Override
    public List<String> failureRecommendations() {
        return List.of("Check data format and quality",
                       "Ensure sufficient historical data",
                       "Try seasonal=false or a shorter seasonal_period");
    }

    @Override
    public int minimumPoints() {
        return properties.getArima().getMinDataPoints();
    }

    @Override
    public int defaultHorizon() {
        return properties.getArima().getDefaultSteps();
    }
}
