package com.inventoryforecast.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A demand series plus named feature columns, one value per row, in derivation order.
 */
public final class FeatureFrame {

    private final DemandSeries series;
    private final Map<String, double[]> columns;
    private final List<String> featureNames;

    public FeatureFrame(DemandSeries series, Map<String, double[]> columns) {
        Map<String, double[]> copy = new LinkedHashMap<>();
        columns.forEach((name, values) -> {
            if (values.length != series.size()) {
                throw new IllegalArgumentException("Feature '" + name + "' has " + values.length
                    + " rows, expected " + series.size());
            }
            for (double v : values) {
                if (!Double.isFinite(v)) {
                    throw new IllegalArgumentException("Feature '" + name + "' contains a non-finite value");
                }
            }
            copy.put(name, values.clone());
        });
        this.series = series;
        this.columns = Collections.unmodifiableMap(copy);
        this.featureNames = List.copyOf(copy.keySet());
    }

    public DemandSeries series() {
        return series;
    }

    public List<String> featureNames() {
        return featureNames;
    }

    public boolean hasFeature(String name) {
        return columns.containsKey(name);
    }

    public double[] column(String name) {
        double[] values = columns.get(name);
        if (values == null) {
            throw new IllegalArgumentException("Unknown feature '" + name + "'");
        }
        return values.clone();
    }

    public int width() {
        return featureNames.size();
    }

    public int size() {
        return series.size();
    }

    public double[] row(int index) {
        double[] row = new double[featureNames.size()];
        int i = 0;
        for (double[] column : columns.values()) {
            row[i++] = column[index];
        }
        return row;
    }

    public double[][] rows(int from, int to) {
        List<double[]> rows = new ArrayList<>(to - from);
        for (int r = from; r < to; r++) {
            rows.add(row(r));
        }
        return rows.toArray(new double[0][]);
    }

    public double[] targets(int from, int to) {
        double[] targets = new double[to - from];
        for (int r = from; r < to; r++) {
            targets[r - from] = series.valueAt(r);
        }
        return targets;
    }
}
