package com.inventoryforecast.exception;

public class PreparationException extends ForecastException {
    public PreparationException(String message) {
        super("PREPARATION_ERROR", message);
    }
    public PreparationException(String message, Throwable cause) {
        super("PREPARATION_ERROR", message, cause);
    }
}
