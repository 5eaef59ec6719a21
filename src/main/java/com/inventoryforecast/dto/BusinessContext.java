package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BusinessContext {
    boolean      businessCalendarApplied;
    Boolean      holidaysIncluded;
    List<String> featuresIncluded;
    List<String> seasonalityPatterns;
}
