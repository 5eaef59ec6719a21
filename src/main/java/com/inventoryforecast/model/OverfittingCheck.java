package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OverfittingCheck(double trainValMaeRatio,
                               @JsonProperty("is_overfitting") boolean isOverfitting) {
}
