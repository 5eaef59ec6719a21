package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Value;

/**
 * Raw per-step model output before clamping. Missing bounds are filled in by the generator.
 */
@Value
@Builder
public class StepEstimate {
    double point;
    Double lower;
    Double upper;
    Double confidenceLevel;
    Double trend;
    Double seasonal;
    Double yearly;
    Double weekly;
}
