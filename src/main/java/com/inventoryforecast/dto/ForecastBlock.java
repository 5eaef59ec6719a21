package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryforecast.model.ForecastPoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastBlock {
    List<ForecastPoint> forecasts;
    int                 forecastHorizon;
    String              modelType;
    double              confidenceLevel;
    Integer             failedSteps;
    List<String>        componentsIncluded;
}
