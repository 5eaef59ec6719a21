package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Decomposition prediction for one date. Component values are in demand units.
 */
@Value
@Builder
public class DecompositionPoint {
    LocalDate date;
    double    yhat;
    double    lower;
    double    upper;
    double    trend;
    double    seasonal;
    Double    yearly;
    Double    weekly;
    double    holidays;
}
