package com.inventoryforecast.client;

import com.inventoryforecast.model.ArimaConfig;

public interface ArimaLibrary {

    /**
     * Fits an ARIMA model of the given order.
     *
     * @throws com.inventoryforecast.exception.ModelFitException when estimation fails
     */
    FittedArima fit(double[] values, ArimaConfig config);
}
