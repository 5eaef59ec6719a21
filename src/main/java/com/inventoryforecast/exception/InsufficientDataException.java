package com.inventoryforecast.exception;

public class InsufficientDataException extends ForecastException {
    public InsufficientDataException(int minimum) {
        super("INSUFFICIENT_DATA", "Insufficient data points (minimum " + minimum + " required)");
    }
}
