package com.inventoryforecast.client;

import java.util.Map;

public interface FittedRegressor {

    double predict(double[] row);

    default double[] predict(double[][] rows) {
        double[] predictions = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            predictions[i] = predict(rows[i]);
        }
        return predictions;
    }

    /** Importance per feature, normalised to sum to one. Features the model never used map to zero. */
    Map<String, Double> featureImportances();
}
