package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class TreeHyperparameters {

    public static final long DEFAULT_SEED = 42L;

    @Builder.Default
    double learningRate = 0.1;

    @Builder.Default
    int maxDepth = 6;

    @Builder.Default
    @JsonProperty("n_estimators")
    int estimators = 100;

    @Builder.Default
    double minChildWeight = 1.0;

    @Builder.Default
    double subsample = 0.8;

    @Builder.Default
    double colsampleBytree = 0.8;

    @Builder.Default
    long seed = DEFAULT_SEED;

    public static TreeHyperparameters defaults() {
        return TreeHyperparameters.builder().build();
    }

    public static List<TreeHyperparameters> presets() {
        return List.of(
            TreeHyperparameters.builder().learningRate(0.05).maxDepth(4).estimators(150).build(),
            TreeHyperparameters.builder().learningRate(0.1).maxDepth(6).estimators(100).build(),
            TreeHyperparameters.builder().learningRate(0.15).maxDepth(8).estimators(80).build());
    }
}
