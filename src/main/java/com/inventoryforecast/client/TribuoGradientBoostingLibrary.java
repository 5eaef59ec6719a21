package com.inventoryforecast.client;

import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.TreeHyperparameters;
import com.oracle.labs.mlrg.olcut.util.Pair;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.tribuo.Model;
import org.tribuo.MutableDataset;
import org.tribuo.common.xgboost.XGBoostTrainer;
import org.tribuo.impl.ArrayExample;
import org.tribuo.provenance.SimpleDataSourceProvenance;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.xgboost.XGBoostRegressionTrainer;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class TribuoGradientBoostingLibrary implements GradientBoostingLibrary {

    private static final String TARGET = "demand";

    private final ForecastProperties properties;

    @Override
    public FittedRegressor fit(List<String> featureNames, double[][] rows, double[] targets,
                               TreeHyperparameters hp) {
        if (rows.length == 0 || rows.length != targets.length) {
            throw new ModelFitException("Training data needs one target per row, got "
                + rows.length + " rows and " + targets.length + " targets");
        }
        String[] names = featureNames.toArray(new String[0]);
        try {
            RegressionFactory factory = new RegressionFactory();
            MutableDataset<Regressor> dataset = new MutableDataset<>(
                new SimpleDataSourceProvenance("demand-history", factory), factory);
            for (int i = 0; i < rows.length; i++) {
                dataset.add(new ArrayExample<>(new Regressor(TARGET, targets[i]), names, rows[i]));
            }

            XGBoostRegressionTrainer trainer = new XGBoostRegressionTrainer(
                XGBoostTrainer.BoosterType.GBTREE,
                XGBoostTrainer.TreeMethod.HIST,
                XGBoostRegressionTrainer.RegressionType.LINEAR,
                hp.getEstimators(),
                hp.getLearningRate(),
                0.0,
                hp.getMaxDepth(),
                hp.getMinChildWeight(),
                hp.getSubsample(),
                hp.getColsampleBytree(),
                1.0,
                0.0,
                properties.getTree().getThreads(),
                XGBoostTrainer.LoggingVerbosity.SILENT,
                hp.getSeed());

            Model<Regressor> model = trainer.train(dataset);
            log.debug("XGBoost trained | rows={} | features={} | trees={}", rows.length, names.length, hp.getEstimators());
            return new TribuoRegressor(model, names, importances(model, featureNames));
        } catch (RuntimeException | LinkageError e) {
            throw new ModelFitException("Gradient boosting training failed: " + e.getMessage(), e);
        }
    }

    private static Map<String, Double> importances(Model<Regressor> model, List<String> featureNames) {
        Map<String, Double> raw = new LinkedHashMap<>();
        featureNames.forEach(name -> raw.put(name, 0.0));
        for (List<Pair<String, Double>> scores : model.getTopFeatures(-1).values()) {
            for (Pair<String, Double> score : scores) {
                raw.merge(score.getA(), Math.max(0.0, score.getB()), Double::sum);
            }
        }
        double total = raw.values().stream().mapToDouble(Double::doubleValue).sum();
        Map<String, Double> normalised = new LinkedHashMap<>();
        raw.forEach((name, value) -> normalised.put(name, total > 0 ? value / total : 0.0));
        return normalised;
    }

    private record TribuoRegressor(Model<Regressor> model, String[] names,
                                   Map<String, Double> importances) implements FittedRegressor {

        @Override
        public double predict(double[] row) {
            ArrayExample<Regressor> example = new ArrayExample<>(RegressionFactory.UNKNOWN_REGRESSOR, names, row);
            return model.predict(example).getOutput().getValues()[0];
        }

        @Override
        public Map<String, Double> featureImportances() {
            return importances;
        }
    }
}
