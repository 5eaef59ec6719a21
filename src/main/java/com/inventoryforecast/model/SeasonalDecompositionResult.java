package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SeasonalDecompositionResult {
    boolean      success;
    Integer      period;
    String       modelType;
    List<Double> trend;
    List<Double> seasonal;
    List<Double> residual;
    Double       seasonalStrength;
    String       error;

    public static SeasonalDecompositionResult failed(String error) {
        return SeasonalDecompositionResult.builder().success(false).error(error).build();
    }
}
