package com.inventoryforecast.model;

import com.inventoryforecast.exception.ForecastStepException;

/**
 * Outcome of one forecast step. A failed step still carries its degraded zero point.
 */
public record StepResult(int step, ForecastPoint point, ForecastStepException error) {

    public static StepResult ok(ForecastPoint point) {
        return new StepResult(point.getStep(), point, null);
    }

    public static StepResult failed(ForecastPoint degraded, ForecastStepException error) {
        return new StepResult(degraded.getStep(), degraded, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
