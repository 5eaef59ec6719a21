package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HyperparameterSearchSummary {
    String       method;
    Double       bestScore;
    Integer      folds;
    Integer      candidatesEvaluated;
    List<String> failures;
}
