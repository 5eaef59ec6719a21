package com.inventoryforecast.service;

import com.inventoryforecast.backend.AutoregressiveBackend;
import com.inventoryforecast.backend.DecomposableBackend;
import com.inventoryforecast.backend.DecompositionCrossValidator;
import com.inventoryforecast.backend.ForecastBackend;
import com.inventoryforecast.backend.TreeBackend;
import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.client.DecompositionLibrary;
import com.inventoryforecast.client.FittedRegressor;
import com.inventoryforecast.client.GradientBoostingLibrary;
import com.inventoryforecast.client.LeastSquaresDecompositionLibrary;
import com.inventoryforecast.client.SignafloArimaLibrary;
import com.inventoryforecast.client.TribuoGradientBoostingLibrary;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.dto.BackendInfoResponse;
import com.inventoryforecast.dto.DiagnosticsReport;
import com.inventoryforecast.dto.ForecastRequest;
import com.inventoryforecast.dto.ForecastResponse;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.FeatureImportance;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.SeasonalityComponent;
import com.inventoryforecast.model.TreeHyperparameters;
import com.inventoryforecast.search.ArimaOrderSearch;
import com.inventoryforecast.search.FixedOrderSelection;
import com.inventoryforecast.search.GridSearchOrderSelection;
import com.inventoryforecast.search.StepwiseOrderSelection;
import com.inventoryforecast.search.TreeHyperparameterSearch;
import com.inventoryforecast.stats.SeasonalDecomposer;
import com.inventoryforecast.stats.StationarityAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs whole requests through the real preparation, search and diagnostics stack. The gradient
 * boosting library is replaced by a mean predictor so no native code is loaded.
 */
class ForecastServiceTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 30);
    private static final String REQUEST_ID = "req-123";
    private static final List<Double> SCENARIO_A =
        List.of(10.0, 12.0, 11.0, 13.0, 12.0, 14.0, 13.0, 15.0, 14.0, 16.0);

    private ForecastProperties properties;
    private DataPreparationService preparationService;
    private DiagnosticsService diagnosticsService;
    private ForecastGenerator forecastGenerator;
    private StationarityAnalyzer stationarityAnalyzer;
    private ForecastService service;

    private static final GradientBoostingLibrary MEAN_REGRESSOR = (names, rows, targets, hp) -> {
        double mean = 0.0;
        for (double t : targets) {
            mean += t / targets.length;
        }
        double prediction = mean;
        Map<String, Double> importances = new LinkedHashMap<>();
        names.forEach(n -> importances.put(n, 1.0 / names.size()));
        return new FittedRegressor() {
            @Override
            public double predict(double[] row) {
                return prediction;
            }

            @Override
            public Map<String, Double> featureImportances() {
                return importances;
            }
        };
    };

    @BeforeEach
    void setUp() {
        properties = new ForecastProperties();
        preparationService = new DataPreparationService(
            Clock.fixed(Instant.parse("2024-06-30T12:00:00Z"), ZoneOffset.UTC));
        stationarityAnalyzer = new StationarityAnalyzer();
        diagnosticsService = new DiagnosticsService(stationarityAnalyzer, new SeasonalDecomposer(), properties);
        forecastGenerator = new ForecastGenerator();

        DecompositionLibrary decompositionLibrary = new LeastSquaresDecompositionLibrary();
        DecomposableBackend decomposable = new DecomposableBackend(preparationService, decompositionLibrary,
            new DecompositionCrossValidator(decompositionLibrary, diagnosticsService, properties),
            forecastGenerator, diagnosticsService, properties);
        TreeBackend tree = treeBackend(MEAN_REGRESSOR);

        service = serviceWith(autoregressive(new SignafloArimaLibrary()), decomposable, tree);
    }

    private AutoregressiveBackend autoregressive(ArimaLibrary library) {
        ArimaOrderSearch search = new ArimaOrderSearch(
            new StepwiseOrderSelection(library, stationarityAnalyzer, properties),
            new GridSearchOrderSelection(library),
            new FixedOrderSelection(library),
            properties);
        return new AutoregressiveBackend(preparationService, search, library, forecastGenerator,
                                         diagnosticsService, properties);
    }

    private ForecastService serviceWith(ForecastBackend<?, ?>... backends) {
        return new ForecastService(List.of(backends), new ForecastJobFactory(properties), new ResultAssembler());
    }

    private TreeBackend treeBackend(GradientBoostingLibrary library) {
        return new TreeBackend(preparationService, new FeatureEngineeringService(), library,
            new TreeHyperparameterSearch(library, properties), forecastGenerator, diagnosticsService, properties);
    }

    private static void assertOrderedAndNonNegative(List<ForecastPoint> points) {
        assertThat(points).isNotEmpty().allSatisfy(p -> {
            assertThat(p.getLowerBound()).isGreaterThanOrEqualTo(0.0);
            assertThat(p.getLowerBound()).isLessThanOrEqualTo(p.getForecast());
            assertThat(p.getForecast()).isLessThanOrEqualTo(p.getUpperBound());
        });
    }

    // XGBoost ships a native library; skip where the platform has no build of it.
    private static void assumeNativeBoostingAvailable(GradientBoostingLibrary library) {
        try {
            library.fit(List.of("x"), new double[][]{{0.0}, {1.0}}, new double[]{1.0, 2.0},
                        TreeHyperparameters.defaults());
        } catch (ModelFitException e) {
            for (Throwable t = e; t != null; t = t.getCause()) {
                assumeTrue(!(t instanceof LinkageError), "XGBoost native library unavailable");
            }
            throw e;
        }
    }

    private static List<Double> weeklyWithSpike(int n, int spikeAt) {
        double[] pattern = {0.0, 4.0, 6.0, 5.0, 3.0, -8.0, -10.0};
        return IntStream.range(0, n)
            .mapToObj(i -> (100.0 + 0.3 * i + pattern[i % 7]) * (i == spikeAt ? 3.0 : 1.0))
            .toList();
    }

    @Test
    void forecast_arimaTenPoints_returnsThirtyNonNegativeSteps() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(SCENARIO_A).build();

        ForecastResponse response = service.forecast(ForecastBackendType.AUTOREGRESSIVE, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getModelType()).isEqualTo("ARIMA");
        assertThat(response.getRequestId()).isEqualTo(REQUEST_ID);
        assertThat(response.getForecasts().getForecastHorizon()).isEqualTo(30);
        assertThat(response.getForecasts().getConfidenceLevel()).isEqualTo(0.95);
        List<ForecastPoint> points = response.getForecasts().getForecasts();
        assertThat(points).hasSize(30).allSatisfy(p -> {
            assertThat(p.getForecast()).isGreaterThanOrEqualTo(0.0);
            assertThat(p.getLowerBound()).isLessThanOrEqualTo(p.getForecast());
            assertThat(p.getUpperBound()).isGreaterThanOrEqualTo(p.getForecast());
        });
        assertThat(points.get(0).getDate()).isEqualTo(TODAY.plusDays(1));
        assertThat(points.get(29).getStep()).isEqualTo(30);

        assertThat(response.getDataQuality().getDataPoints()).isEqualTo(10);
        assertThat(response.getDataQuality().getSyntheticDates()).isTrue();
        assertThat(response.getDataQuality().getDateRange().getEnd()).isEqualTo(TODAY);

        DiagnosticsReport diagnostics = response.getModelDiagnostics();
        assertThat(diagnostics.getOrder()).hasSize(3);
        assertThat(diagnostics.getSelectionMethod())
            .isIn(StepwiseOrderSelection.METHOD, GridSearchOrderSelection.METHOD, FixedOrderSelection.METHOD);
        assertThat(diagnostics.getCandidatesEvaluated()).isPositive();
        assertThat(response.getRecommendations()).hasSize(3);
    }

    @Test
    void forecast_arimaCustomHorizonAndConfidence_areHonoured() {
        ForecastRequest request = ForecastRequest.builder()
            .dataPoints(SCENARIO_A)
            .forecastSteps(5)
            .confidenceLevel(0.8)
            .build();

        ForecastResponse response = service.forecast(ForecastBackendType.AUTOREGRESSIVE, request, REQUEST_ID);

        assertThat(response.getForecasts().getForecasts()).hasSize(5)
            .allSatisfy(p -> assertThat(p.getConfidenceLevel()).isEqualTo(0.8));
    }

    @Test
    void forecast_arimaNegativeDemand_isPreparationError() {
        List<Double> values = List.of(10.0, 12.0, -1.0, 13.0, 12.0, 14.0, 13.0, 15.0, 14.0, 16.0);

        ForecastResponse response = service.forecast(ForecastBackendType.AUTOREGRESSIVE,
            ForecastRequest.builder().dataPoints(values).build(), REQUEST_ID);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorCode()).isEqualTo("PREPARATION_ERROR");
        assertThat(response.getForecasts()).isNull();
    }

    @Test
    void forecast_arimaLibraryAlwaysFails_returnsFitFailureEnvelope() {
        ArimaLibrary failing = mock(ArimaLibrary.class);
        when(failing.fit(any(), any())).thenThrow(new ModelFitException("optimizer diverged"));
        ForecastService failingService = serviceWith(autoregressive(failing));

        ForecastResponse response = failingService.forecast(ForecastBackendType.AUTOREGRESSIVE,
            ForecastRequest.builder().dataPoints(SCENARIO_A).build(), REQUEST_ID);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorCode()).isEqualTo("FIT_ERROR");
        assertThat(response.getErrorType()).isEqualTo("ModelFitException");
        assertThat(response.getError()).contains("No ARIMA order could be fitted");
        assertThat(response.getFallbackRecommendation()).isEqualTo(ResultAssembler.FALLBACK_RECOMMENDATION);
        assertThat(response.getForecasts()).isNull();
    }

    @Test
    void forecast_ninePoints_isRejectedByEveryBackend() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(SCENARIO_A.subList(0, 9)).build();

        for (ForecastBackendType type : ForecastBackendType.values()) {
            ForecastResponse response = service.forecast(type, request, REQUEST_ID);

            assertThat(response.isSuccess()).as(type.getPath()).isFalse();
            assertThat(response.getError()).containsIgnoringCase("insufficient data");
            assertThat(response.getErrorCode()).isEqualTo("INSUFFICIENT_DATA");
            assertThat(response.getRequiredAction()).isEqualTo(ResultAssembler.REQUIRED_ACTION);
            assertThat(response.getForecasts()).isNull();
            assertThat(response.getRecommendations()).isNotEmpty();
        }
    }

    @Test
    void forecast_treeWithFourteenPoints_needsFifteen() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(Collections.nCopies(14, 5.0)).build();

        ForecastResponse response = service.forecast(ForecastBackendType.GRADIENT_BOOSTED, request, REQUEST_ID);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getError()).contains("minimum 15");
    }

    @Test
    void forecast_treeIdenticalValues_fitsWithFiniteValidationError() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(Collections.nCopies(15, 5.0)).build();

        ForecastResponse response = service.forecast(ForecastBackendType.GRADIENT_BOOSTED, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getForecasts().getForecastHorizon()).isEqualTo(1);
        assertThat(response.getForecasts().getConfidenceLevel()).isEqualTo(0.95);
        ForecastPoint point = response.getForecasts().getForecasts().get(0);
        assertThat(point.getForecast()).isCloseTo(5.0, within(1e-9));
        assertThat(point.getLowerBound()).isCloseTo(5.0 - 1.96 * 0.15 * 5.0, within(1e-6));

        DiagnosticsReport diagnostics = response.getModelDiagnostics();
        assertThat(diagnostics.getTrainingSamples()).isEqualTo(12);
        assertThat(diagnostics.getValidationSamples()).isEqualTo(3);
        assertThat(diagnostics.getFeatureImportance()).hasSizeLessThanOrEqualTo(10)
            .allSatisfy(f -> assertThat(f.importance()).isGreaterThanOrEqualTo(0.0));
        assertThat(diagnostics.getValidationMetrics().getMape()).isNotNull().isFinite();
        assertThat(diagnostics.getHyperparameterSearch().getMethod()).isEqualTo(TreeHyperparameterSearch.DEFAULTS_METHOD);

        assertThat(response.getFeatureAnalysis().getTopFeatures()).hasSizeLessThanOrEqualTo(15);
        assertThat(response.getFeatureAnalysis().getFeatureCategories())
            .containsKeys("temporal", "statistical", "seasonal", "trend", "external", "other");
        assertThat(response.getDataQuality().getFeaturesEngineered()).isPositive();
    }

    @Test
    void forecast_treeIdenticalValuesWithXgboost_predictsTheConstant() {
        GradientBoostingLibrary xgboost = new TribuoGradientBoostingLibrary(properties);
        assumeNativeBoostingAvailable(xgboost);
        ForecastService xgboostService = serviceWith(treeBackend(xgboost));
        ForecastRequest request = ForecastRequest.builder().dataPoints(Collections.nCopies(15, 5.0)).build();

        ForecastResponse response = xgboostService.forecast(ForecastBackendType.GRADIENT_BOOSTED, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        List<ForecastPoint> points = response.getForecasts().getForecasts();
        assertThat(points).hasSize(1);
        assertOrderedAndNonNegative(points);
        assertThat(points.get(0).getForecast()).isCloseTo(5.0, within(0.1));

        DiagnosticsReport diagnostics = response.getModelDiagnostics();
        assertThat(diagnostics.getFeatureImportance())
            .allSatisfy(f -> assertThat(f.importance()).isGreaterThanOrEqualTo(0.0));
        assertThat(diagnostics.getValidationMetrics().getMape()).isNotNull().isFinite().isLessThan(5.0);
        assertThat(diagnostics.getDiagnosticsError()).isNull();
    }

    @Test
    void forecast_treeLongHistory_searchesHyperparameters() {
        ForecastRequest request = ForecastRequest.builder()
            .dataPoints(weeklyWithSpike(45, -1))
            .forecastSteps(3)
            .build();

        ForecastResponse response = service.forecast(ForecastBackendType.GRADIENT_BOOSTED, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getModelDiagnostics().getHyperparameterSearch().getMethod())
            .isEqualTo(TreeHyperparameterSearch.METHOD);
        assertThat(response.getForecasts().getForecasts()).hasSize(3);
        assertOrderedAndNonNegative(response.getForecasts().getForecasts());
    }

    @Test
    void forecast_treeHyperparameterOverride_skipsSearch() {
        ForecastRequest request = ForecastRequest.builder()
            .dataPoints(weeklyWithSpike(45, -1))
            .hyperparameters(ForecastRequest.TreeHyperparameterOverrides.builder().maxDepth(3).build())
            .includeFeatureAnalysis(false)
            .build();

        ForecastResponse response = service.forecast(ForecastBackendType.GRADIENT_BOOSTED, request, REQUEST_ID);

        DiagnosticsReport diagnostics = response.getModelDiagnostics();
        assertThat(diagnostics.getHyperparameterSearch().getMethod()).isEqualTo(TreeBackend.OVERRIDE_METHOD);
        assertThat(diagnostics.getHyperparameters().getMaxDepth()).isEqualTo(3);
        assertThat(diagnostics.getHyperparameters().getLearningRate()).isEqualTo(0.1);
        assertThat(response.getFeatureAnalysis()).isNull();
    }

    @Test
    void forecast_decompositionWithSpike_reportsChangepoints() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(weeklyWithSpike(60, 30)).build();

        ForecastResponse response = service.forecast(ForecastBackendType.DECOMPOSABLE, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getTrendAnalysis().getTotalChangepoints()).isGreaterThanOrEqualTo(1);
        assertThat(response.getTrendAnalysis().getChangepoints()).isNotEmpty();
        assertThat(response.getForecasts().getForecasts()).hasSize(30)
            .allSatisfy(p -> assertThat(p.getTrend()).isNotNull());
        assertThat(response.getForecasts().getComponentsIncluded()).containsExactly("trend", "seasonal", "holidays");
        assertOrderedAndNonNegative(response.getForecasts().getForecasts());
        assertThat(response.getModelDiagnostics().getSeasonalityComponents())
            .extracting(SeasonalityComponent::name)
            .containsExactly("weekly", "monthly_payday");
        assertThat(response.getBusinessContext().getHolidaysIncluded()).isTrue();
    }

    @Test
    void forecast_decompositionTenPoints_staysNearHistoryWithOpenInterval() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(SCENARIO_A).forecastSteps(7).build();

        ForecastResponse response = service.forecast(ForecastBackendType.DECOMPOSABLE, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        List<ForecastPoint> points = response.getForecasts().getForecasts();
        assertThat(points).hasSize(7);
        assertOrderedAndNonNegative(points);
        assertThat(points).allSatisfy(p -> {
            assertThat(p.getForecast()).isBetween(10.0, 24.0);
            assertThat(p.getUpperBound() - p.getLowerBound()).isGreaterThan(0.5);
        });
        assertThat(response.getModelDiagnostics().getSeasonalityComponents()).isEmpty();
    }

    @Test
    void forecast_decompositionLongHistory_crossValidates() {
        ForecastRequest request = ForecastRequest.builder().dataPoints(weeklyWithSpike(60, -1)).build();

        ForecastResponse response = service.forecast(ForecastBackendType.DECOMPOSABLE, request, REQUEST_ID);

        DiagnosticsReport diagnostics = response.getModelDiagnostics();
        assertThat(diagnostics.getDiagnosticsError()).isNull();
        assertThat(diagnostics.getPerformance().isCrossValidation()).isTrue();
        assertThat(diagnostics.getPerformance().getCvPeriods()).isEqualTo(6);
        assertThat(diagnostics.getValidationMetrics().getSampleCount()).isEqualTo(12);
    }

    @Test
    void forecast_decompositionShortHistory_scoresInSample() {
        ForecastRequest request = ForecastRequest.builder()
            .dataPoints(weeklyWithSpike(20, -1))
            .includeTrendAnalysis(false)
            .build();

        ForecastResponse response = service.forecast(ForecastBackendType.DECOMPOSABLE, request, REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getModelDiagnostics().getPerformance().getInSampleOnly()).isTrue();
        assertThat(response.getTrendAnalysis()).isNull();
    }

    @Test
    void forecast_decompositionClampsNegativeDemand() {
        List<Double> values = new java.util.ArrayList<>(weeklyWithSpike(20, -1));
        values.set(3, -4.0);

        ForecastResponse response = service.forecast(ForecastBackendType.DECOMPOSABLE,
            ForecastRequest.builder().dataPoints(values).build(), REQUEST_ID);

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.getDataQuality().getClampedValues()).isEqualTo(1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void forecast_unexpectedBackendCrash_returnsInternalErrorEnvelope() {
        ForecastBackend<Object, Object> broken = mock(ForecastBackend.class);
        when(broken.type()).thenReturn(ForecastBackendType.AUTOREGRESSIVE);
        when(broken.prepare(any())).thenThrow(new IllegalStateException("disk on fire"));
        when(broken.failureRecommendations()).thenReturn(List.of("Check data format and quality"));

        ForecastResponse response = serviceWith(broken).forecast(ForecastBackendType.AUTOREGRESSIVE,
            ForecastRequest.builder().dataPoints(SCENARIO_A).build(), REQUEST_ID);

        assertThat(response.isSuccess()).isFalse();
        assertThat(response.getErrorCode()).isEqualTo(ResultAssembler.UNEXPECTED_ERROR_CODE);
        assertThat(response.getErrorType()).isEqualTo("IllegalStateException");
        assertThat(response.getError()).isEqualTo("disk on fire");
    }

    @Test
    void backends_listsEveryRegisteredBackendInDeclarationOrder() {
        List<BackendInfoResponse> backends = service.backends();

        assertThat(backends).extracting(BackendInfoResponse::getBackend)
            .containsExactly("arima", "decomposition", "gradient-boosting");
        assertThat(backends).extracting(BackendInfoResponse::getMinDataPoints).containsExactly(10, 10, 15);
        assertThat(backends).extracting(BackendInfoResponse::getDefaultForecastSteps).containsExactly(30, 30, 1);
    }

    @Test
    void featureImportances_fromMeanRegressorAreUniform() {
        ForecastResponse response = service.forecast(ForecastBackendType.GRADIENT_BOOSTED,
            ForecastRequest.builder().dataPoints(Collections.nCopies(15, 5.0)).build(), REQUEST_ID);

        List<FeatureImportance> top = response.getFeatureAnalysis().getTopFeatures();
        assertThat(top).extracting(FeatureImportance::importance).containsOnly(top.get(0).importance());
    }
}
