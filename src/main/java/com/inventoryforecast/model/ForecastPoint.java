package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ForecastPoint {
    int       step;
    LocalDate date;
    double    forecast;
    double    lowerBound;
    double    upperBound;
    double    confidenceLevel;
    Double    trend;
    Double    seasonal;
    Double    yearly;
    Double    weekly;
    String    error;

    public static ForecastPoint degraded(int step, LocalDate date, double confidenceLevel, String error) {
        return ForecastPoint.builder()
            .step(step)
            .date(date)
            .confidenceLevel(confidenceLevel)
            .error(error)
            .build();
    }

    @JsonIgnore
    public boolean isDegraded() {
        return error != null;
    }
}
