package com.inventoryforecast.model;

import com.inventoryforecast.exception.UnsupportedBackendException;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;

@Getter
@RequiredArgsConstructor
public enum ForecastBackendType {
    AUTOREGRESSIVE("arima", "ARIMA"),
    DECOMPOSABLE("decomposition", "Decomposition"),
    GRADIENT_BOOSTED("gradient-boosting", "GradientBoosting");

    private final String path;
    private final String modelType;

    public static ForecastBackendType fromPath(String path) {
        return Arrays.stream(values())
            .filter(t -> t.path.equalsIgnoreCase(path))
            .findFirst()
            .orElseThrow(() -> new UnsupportedBackendException(path));
    }
}
