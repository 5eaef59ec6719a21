package com.inventoryforecast.client;

import com.inventoryforecast.model.TreeHyperparameters;

import java.util.List;

public interface GradientBoostingLibrary {

    /**
     * Trains a gradient-boosted regression tree ensemble.
     *
     * @throws com.inventoryforecast.exception.ModelFitException when training fails
     */
    FittedRegressor fit(List<String> featureNames, double[][] rows, double[] targets,
                        TreeHyperparameters hyperparameters);
}
