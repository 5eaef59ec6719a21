package com.inventoryforecast.backend;

import com.inventoryforecast.client.FittedRegressor;
import com.inventoryforecast.client.GradientBoostingLibrary;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.dto.BusinessContext;
import com.inventoryforecast.dto.DataQuality;
import com.inventoryforecast.dto.DiagnosticsReport;
import com.inventoryforecast.dto.FeatureAnalysis;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.FeatureFrame;
import com.inventoryforecast.model.FitOutcome;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.HyperparameterSearchSummary;
import com.inventoryforecast.model.StepEstimate;
import com.inventoryforecast.model.StepResult;
import com.inventoryforecast.model.TreeHyperparameters;
import com.inventoryforecast.search.TreeHyperparameterSearch;
import com.inventoryforecast.service.DataPreparationService;
import com.inventoryforecast.service.DiagnosticsService;
import com.inventoryforecast.service.FeatureEngineeringService;
import com.inventoryforecast.service.ForecastGenerator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Gradient-boosted trees over engineered calendar, lag, rolling and momentum features.
 * Trained on the leading rows only; the tail is kept for validation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TreeBackend implements ForecastBackend<FeatureFrame, TreeBackend.TreeFit> {

    static final double TREE_CONFIDENCE = 0.95;
    static final double Z_95 = 1.96;

    static final List<String> RECOMMENDATIONS = List.of(
        "Monitor feature importance for business insights",
        "Retrain model bi-weekly with new data",
        "Use ensemble with ARIMA/decomposition for robust predictions");

    static final List<String> FEATURES_INCLUDED = List.of(
        "temporal_patterns", "statistical_indicators", "seasonal_cycles",
        "regional_holidays", "payday_effects", "ramadan_patterns");

    public static final String OVERRIDE_METHOD = "request_override";

    private final DataPreparationService preparationService;
    private final FeatureEngineeringService featureService;
    private final GradientBoostingLibrary gradientBoostingLibrary;
    private final TreeHyperparameterSearch hyperparameterSearch;
    private final ForecastGenerator forecastGenerator;
    private final DiagnosticsService diagnosticsService;
    private final ForecastProperties properties;

    /**
     * Trained ensemble plus how its hyperparameters were chosen.
     */
    public record TreeFit(FittedRegressor regressor, TreeHyperparameters hyperparameters,
                          HyperparameterSearchSummary search, int trainingRows) {}

    @Override
    public ForecastBackendType type() {
        return ForecastBackendType.GRADIENT_BOOSTED;
    }

    @Override
    public FeatureFrame prepare(ForecastJob job) {
        return featureService.derive(
            preparationService.prepare(job.getValues(), job.getDates(),
                new DataPreparationService.Policy(minimumPoints(), true, true)),
            job.getExternalFeatures());
    }

    @Override
    public FitOutcome<TreeFit> fit(FeatureFrame frame, ForecastJob job) {
        int split = diagnosticsService.splitIndex(frame.size());
        List<String> names = frame.featureNames();
        double[][] rows = frame.rows(0, split);
        double[] targets = frame.targets(0, split);
        try {
            TreeHyperparameters hp;
            HyperparameterSearchSummary search;
            if (job.getHyperparameters() != null) {
                hp = job.getHyperparameters();
                search = HyperparameterSearchSummary.builder().method(OVERRIDE_METHOD).build();
            } else if (job.isOptimizeHyperparameters() && split > properties.getTree().getOptimizationThreshold()) {
                TreeHyperparameterSearch.Result result = hyperparameterSearch.search(names, rows, targets);
                hp = result.hyperparameters();
                search = result.summary();
            } else {
                hp = TreeHyperparameters.defaults();
                search = HyperparameterSearchSummary.builder().method(TreeHyperparameterSearch.DEFAULTS_METHOD).build();
            }
            FittedRegressor regressor = gradientBoostingLibrary.fit(names, rows, targets, hp);
            log.info("Tree model trained | rows={} | features={} | method={} | requestId={}",
                     split, names.size(), search.getMethod(), job.getRequestId());
            return FitOutcome.success(new TreeFit(regressor, hp, search, split));
        } catch (ModelFitException e) {
            log.warn("Tree fit failed | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            return FitOutcome.failure(e);
        }
    }

    @Override
    public List<StepResult> forecast(TreeFit model, FeatureFrame frame, ForecastJob job) {
        LocalDate end = frame.series().endDate();
        int lastIndex = frame.size() - 1;
        double fraction = properties.getTree().getIntervalFraction();
        return forecastGenerator.generate(job.getHorizon(), TREE_CONFIDENCE, step -> end.plusDays(step), step -> {
            double[] row = featureService.futureRow(frame, end.plusDays(step), lastIndex + step);
            double point = model.regressor().predict(row);
            double spread = Z_95 * fraction * point;
            return StepEstimate.builder()
                .point(point)
                .lower(point - spread)
                .upper(point + spread)
                .confidenceLevel(TREE_CONFIDENCE)
                .build();
        });
    }

    @Override
    public BackendReport diagnose(TreeFit model, FeatureFrame frame, ForecastJob job) {
        int split = model.trainingRows();
        Map<String, Double> importances = model.regressor().featureImportances();
        DiagnosticsReport.DiagnosticsReportBuilder report = DiagnosticsReport.builder()
            .success(true)
            .modelType(type().getModelType())
            .trainingSamples(split)
            .validationSamples(frame.size() - split)
            .featuresCount(frame.width())
            .featureImportance(diagnosticsService.rankImportances(importances, DiagnosticsService.DIAGNOSTIC_TOP_FEATURES))
            .hyperparameters(model.hyperparameters())
            .hyperparameterSearch(model.search());

        try {
            double[] trainActual = frame.targets(0, split);
            double[] trainPredicted = model.regressor().predict(frame.rows(0, split));
            double[] validationActual = frame.targets(split, frame.size());
            double[] validationPredicted = model.regressor().predict(frame.rows(split, frame.size()));
            report.trainMetrics(diagnosticsService.evaluate(trainActual, trainPredicted))
                  .validationMetrics(diagnosticsService.evaluate(validationActual, validationPredicted))
                  .overfittingCheck(diagnosticsService.overfitting(
                      diagnosticsService.mae(trainActual, trainPredicted),
                      diagnosticsService.mae(validationActual, validationPredicted)));
        } catch (RuntimeException e) {
            log.warn("Tree diagnostics incomplete | requestId={} | reason={}", job.getRequestId(), e.getMessage());
            report.diagnosticsError(e.getMessage());
        }

        FeatureAnalysis analysis = null;
        if (job.isIncludeFeatureAnalysis()) {
            analysis = FeatureAnalysis.builder()
                .success(true)
                .totalFeatures(importances.size())
                .featureCategories(diagnosticsService.categorize(importances))
                .topFeatures(diagnosticsService.rankImportances(importances, DiagnosticsService.ANALYSIS_TOP_FEATURES))
                .build();
        }

        return BackendReport.builder()
            .dataQuality(DataQuality.builder()
                .dataPoints(frame.size())
                .dateRange(DataQuality.DateRange.builder()
                    .start(frame.series().startDate())
                    .end(frame.series().endDate())
                    .build())
                .filledValues(frame.series().getFilledCount())
                .clampedValues(frame.series().getClampedCount())
                .syntheticDates(frame.series().isSyntheticDates())
                .featuresEngineered(frame.width())
                .build())
            .diagnostics(report.build())
            .featureAnalysis(analysis)
            .businessContext(BusinessContext.builder()
                .businessCalendarApplied(true)
                .featuresIncluded(FEATURES_INCLUDED)
                .build())
            .recommendations(RECOMMENDATIONS)
            .build();
    }

    @Override
    public List<String> failureRecommendations() {
        return List.of("Check data format and quality",
                       "Ensure sufficient historical data (minimum " + minimumPoints() + " points)",
                       "Verify the gradient boosting native library is available");
    }

    @Override
    public int minimumPoints() {
        return properties.getTree().getMinDataPoints();
    }

    @Override
    public int defaultHorizon() {
        return properties.getTree().getDefaultSteps();
    }
}
