package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccuracyMetrics {
    int    sampleCount;
    Double mae;
    Double rmse;
    Double mape;
    Double r2;
}
