package com.inventoryforecast.exception;

import lombok.Getter;

@Getter
public abstract class ForecastException extends RuntimeException {
    private final String errorCode;
    protected ForecastException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
