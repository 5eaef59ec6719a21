package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class StationarityResult {
    @JsonProperty("is_stationary")
    boolean             stationary;
    Double              adfStatistic;
    @JsonProperty("p_value")
    Double              pValue;
    Map<String, Double> criticalValues;
    Integer             usedLag;
    Integer             observations;
    String              interpretation;
    String              error;

    public static StationarityResult failed(String error) {
        return StationarityResult.builder()
            .stationary(false)
            .interpretation("Stationarity could not be determined")
            .error(error)
            .build();
    }
}
