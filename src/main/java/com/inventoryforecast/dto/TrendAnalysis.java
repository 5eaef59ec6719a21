package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryforecast.model.TrendChangepoint;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TrendAnalysis {
    boolean                success;
    List<TrendChangepoint> changepoints;
    int                    totalChangepoints;
    String                 trendAnalysis;
}
