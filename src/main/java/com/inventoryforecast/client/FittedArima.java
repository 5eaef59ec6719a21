package com.inventoryforecast.client;

import com.inventoryforecast.model.ArimaConfig;

public interface FittedArima {

    ArimaConfig config();

    double aic();

    double logLikelihood();

    double[] fittedValues();

    double[] residuals();

    /** Point forecasts with prediction intervals at significance {@code alpha}. */
    Prediction forecast(int steps, double alpha);

    String summary();

    record Prediction(double[] pointEstimates, double[] lower, double[] upper) {}
}
