package com.inventoryforecast.backend;

import com.inventoryforecast.model.FitOutcome;
import com.inventoryforecast.model.ForecastBackendType;
import com.inventoryforecast.model.ForecastJob;
import com.inventoryforecast.model.StepResult;

import java.util.List;

/**
 * A modeling backend, driven by {@code ForecastService} through prepare, fit, forecast and diagnose.
 *
 * @param <I> prepared input
 * @param <M> fitted model handle
 */
public interface ForecastBackend<I, M> {

    ForecastBackendType type();

    /**
     * @throws com.inventoryforecast.exception.InsufficientDataException when the series is too short
     * @throws com.inventoryforecast.exception.PreparationException when the input cannot be cleaned
     */
    I prepare(ForecastJob job);

    /** Never throws for library failures; they come back as a failed outcome. */
    FitOutcome<M> fit(I input, ForecastJob job);

    List<StepResult> forecast(M model, I input, ForecastJob job);

    /** Diagnostic failures are recorded in the report, never thrown. */
    BackendReport diagnose(M model, I input, ForecastJob job);

    List<String> failureRecommendations();

    int minimumPoints();

    int defaultHorizon();
}
