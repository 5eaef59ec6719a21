package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrossValidationSummary {
    boolean crossValidation;
    Double  mape;
    Double  mae;
    Double  rmse;
    Double  coverage;
    Integer cvPeriods;
    Boolean inSampleOnly;
}
