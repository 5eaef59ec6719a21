package com.inventoryforecast.client;

import com.inventoryforecast.model.DecompositionConfig;

import java.time.LocalDate;
import java.util.List;

public interface DecompositionLibrary {

    /**
     * Fits a trend plus seasonality plus holiday decomposition to a dated series.
     *
     * @throws com.inventoryforecast.exception.ModelFitException when estimation fails
     */
    FittedDecomposition fit(List<LocalDate> dates, double[] values, DecompositionConfig config);
}
