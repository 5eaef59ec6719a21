package com.inventoryforecast.exception;

public class UnsupportedBackendException extends ForecastException {
    public UnsupportedBackendException(String backend) {
        super("UNSUPPORTED_BACKEND", "Backend '" + backend + "' is not supported. "
            + "Use one of: arima, decomposition, gradient-boosting.");
    }
}
