package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryforecast.model.SeasonalDecompositionResult;
import com.inventoryforecast.model.StationarityResult;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DataQuality {
    int                         dataPoints;
    DateRange                   dateRange;
    Integer                     filledValues;
    Integer                     clampedValues;
    Boolean                     syntheticDates;
    Integer                     featuresEngineered;
    StationarityResult          stationarity;
    SeasonalDecompositionResult seasonalAnalysis;

    @Value
    @Builder
    public static class DateRange {
        LocalDate start;
        LocalDate end;
    }
}
