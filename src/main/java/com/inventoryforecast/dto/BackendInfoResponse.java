package com.inventoryforecast.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class BackendInfoResponse {
    String backend;
    String modelType;
    int    minDataPoints;
    int    defaultForecastSteps;
}
