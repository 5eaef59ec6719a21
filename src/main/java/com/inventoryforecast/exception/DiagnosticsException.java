package com.inventoryforecast.exception;

public class DiagnosticsException extends ForecastException {
    public DiagnosticsException(String message) {
        super("DIAGNOSTICS_ERROR", message);
    }
    public DiagnosticsException(String message, Throwable cause) {
        super("DIAGNOSTICS_ERROR", message, cause);
    }
}
