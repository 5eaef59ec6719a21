package com.inventoryforecast.exception;

public class ModelFitException extends ForecastException {
    public ModelFitException(String message) {
        super("FIT_ERROR", message);
    }
    public ModelFitException(String message, Throwable cause) {
        super("FIT_ERROR", message, cause);
    }
}
