package com.inventoryforecast.stats;

import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.SeasonalDecompositionResult;
import com.inventoryforecast.util.Numbers;
import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Classical additive decomposition: centred moving-average trend, per-phase seasonal means, residual.
 */
@Component
public class SeasonalDecomposer {

    public SeasonalDecompositionResult decompose(double[] values, int period) {
        int n = values.length;
        if (period < 2) {
            throw new DiagnosticsException("Seasonal period must be at least 2, got " + period);
        }
        if (n < 2 * period) {
            throw new DiagnosticsException("Seasonal decomposition needs two complete cycles ("
                + (2 * period) + " observations), got " + n);
        }

        double[] trend = movingAverage(values, period);
        extrapolate(trend, period - 1);

        double[] detrended = new double[n];
        for (int i = 0; i < n; i++) {
            detrended[i] = values[i] - trend[i];
        }

        double[] phaseMeans = new double[period];
        for (int phase = 0; phase < period; phase++) {
            double sum = 0.0;
            int count = 0;
            for (int i = phase; i < n; i += period) {
                sum += detrended[i];
                count++;
            }
            phaseMeans[phase] = sum / count;
        }
        double centre = Numbers.mean(phaseMeans);

        double[] seasonal = new double[n];
        double[] residual = new double[n];
        for (int i = 0; i < n; i++) {
            seasonal[i] = phaseMeans[i % period] - centre;
            residual[i] = detrended[i] - seasonal[i];
        }

        return SeasonalDecompositionResult.builder()
            .success(true)
            .period(period)
            .modelType("additive")
            .trend(rounded(trend))
            .seasonal(rounded(seasonal))
            .residual(rounded(residual))
            .seasonalStrength(Numbers.round(seasonalStrength(seasonal, residual)))
            .build();
    }

    public double seasonalStrength(double[] seasonal, double[] residual) {
        double seasonalVar = Numbers.variance(seasonal);
        double residualVar = Numbers.variance(residual);
        if (residualVar == 0.0) {
            return 1.0;
        }
        return Math.min(seasonalVar / (seasonalVar + residualVar), 1.0);
    }

    private double[] movingAverage(double[] values, int period) {
        double[] weights;
        if (period % 2 == 0) {
            weights = new double[period + 1];
            Arrays.fill(weights, 1.0 / period);
            weights[0] = 0.5 / period;
            weights[period] = 0.5 / period;
        } else {
            weights = new double[period];
            Arrays.fill(weights, 1.0 / period);
        }
        int half = weights.length / 2;
        double[] trend = new double[values.length];
        Arrays.fill(trend, Double.NaN);
        for (int i = half; i < values.length - half; i++) {
            double sum = 0.0;
            for (int k = 0; k < weights.length; k++) {
                sum += weights[k] * values[i - half + k];
            }
            trend[i] = sum;
        }
        return trend;
    }

    // Fills the undefined ends of the trend with least-squares lines through the nearest points.
    private void extrapolate(double[] trend, int points) {
        int front = 0;
        while (Double.isNaN(trend[front])) {
            front++;
        }
        int back = trend.length - 1;
        while (Double.isNaN(trend[back])) {
            back--;
        }

        Line head = fit(trend, front, Math.min(front + points, back), front);
        for (int i = 0; i < front; i++) {
            trend[i] = head.at(i);
        }
        Line tail = fit(trend, Math.max(back - points, front), back, back);
        for (int i = back + 1; i < trend.length; i++) {
            trend[i] = tail.at(i);
        }
    }

    private Line fit(double[] trend, int from, int to, int anchor) {
        if (to - from < 2) {
            return new Line(0.0, trend[anchor]);
        }
        SimpleRegression regression = new SimpleRegression();
        for (int i = from; i < to; i++) {
            regression.addData(i, trend[i]);
        }
        return new Line(regression.getSlope(), regression.getIntercept());
    }

    private static List<Double> rounded(double[] values) {
        return Arrays.stream(values).mapToObj(Numbers::round).toList();
    }

    private record Line(double slope, double intercept) {
        double at(int x) {
            return slope * x + intercept;
        }
    }
}
