package com.inventoryforecast.exception;

import lombok.Getter;

@Getter
public class ForecastStepException extends ForecastException {
    private final int step;

    public ForecastStepException(int step, String message) {
        super("FORECAST_STEP_ERROR", message);
        this.step = step;
    }
    public ForecastStepException(int step, String message, Throwable cause) {
        super("FORECAST_STEP_ERROR", message, cause);
        this.step = step;
    }
}
