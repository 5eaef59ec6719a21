package com.inventoryforecast.search;

import com.inventoryforecast.client.FittedRegressor;
import com.inventoryforecast.client.GradientBoostingLibrary;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.HyperparameterSearchSummary;
import com.inventoryforecast.model.TreeHyperparameters;
import com.inventoryforecast.util.Numbers;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Scores the tree presets with forward-chaining cross-validation on mean absolute error.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TreeHyperparameterSearch {

    public static final String METHOD = "time_series_cv";
    public static final String DEFAULTS_METHOD = "defaults";

    private final GradientBoostingLibrary gradientBoostingLibrary;
    private final ForecastProperties properties;

    public record Result(TreeHyperparameters hyperparameters, HyperparameterSearchSummary summary) {}

    public Result search(List<String> featureNames, double[][] rows, double[] targets) {
        int folds = properties.getTree().getCvFolds();
        List<TreeHyperparameters> presets = TreeHyperparameters.presets();
        List<String> failures = new ArrayList<>();
        TreeHyperparameters best = null;
        double bestScore = Double.POSITIVE_INFINITY;

        for (TreeHyperparameters preset : presets) {
            try {
                double score = crossValidate(featureNames, rows, targets, preset, folds);
                log.debug("Preset scored | lr={} | depth={} | trees={} | mae={}",
                          preset.getLearningRate(), preset.getMaxDepth(), preset.getEstimators(), score);
                if (score < bestScore) {
                    bestScore = score;
                    best = preset;
                }
            } catch (ModelFitException e) {
                log.warn("Preset skipped | lr={} | depth={} | reason={}",
                         preset.getLearningRate(), preset.getMaxDepth(), e.getMessage());
                failures.add("learning_rate=" + preset.getLearningRate() + ", max_depth=" + preset.getMaxDepth()
                    + ": " + e.getMessage());
            }
        }

        HyperparameterSearchSummary.HyperparameterSearchSummaryBuilder summary = HyperparameterSearchSummary.builder()
            .folds(folds)
            .candidatesEvaluated(presets.size())
            .failures(failures.isEmpty() ? null : failures);
        if (best == null) {
            log.warn("All presets failed, using defaults | presets={}", presets.size());
            return new Result(TreeHyperparameters.defaults(), summary.method(DEFAULTS_METHOD).build());
        }
        return new Result(best, summary.method(METHOD).bestScore(Numbers.round(bestScore)).build());
    }

    double crossValidate(List<String> featureNames, double[][] rows, double[] targets,
                         TreeHyperparameters hp, int folds) {
        List<int[]> splits = splits(rows.length, folds);
        if (splits.isEmpty()) {
            throw new ModelFitException("Not enough rows for " + folds + "-fold time series cross-validation");
        }
        double total = 0.0;
        for (int[] split : splits) {
            int trainEnd = split[0];
            int testEnd = split[1];
            FittedRegressor model = gradientBoostingLibrary.fit(featureNames,
                Arrays.copyOfRange(rows, 0, trainEnd), Arrays.copyOfRange(targets, 0, trainEnd), hp);
            double[] predicted = model.predict(Arrays.copyOfRange(rows, trainEnd, testEnd));
            double error = 0.0;
            for (int i = 0; i < predicted.length; i++) {
                error += Math.abs(targets[trainEnd + i] - predicted[i]);
            }
            total += error / predicted.length;
        }
        return total / splits.size();
    }

    /** {trainEnd, testEnd} pairs; each test block has n / (folds + 1) rows and follows its training rows. */
    static List<int[]> splits(int n, int folds) {
        int testSize = n / (folds + 1);
        List<int[]> splits = new ArrayList<>();
        if (testSize == 0) {
            return splits;
        }
        for (int start = n - folds * testSize; start < n; start += testSize) {
            splits.add(new int[]{start, start + testSize});
        }
        return splits;
    }
}
