package com.inventoryforecast.stats;

import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.model.StationarityResult;
import com.inventoryforecast.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Augmented Dickey-Fuller test with a constant term and AIC lag selection.
 */
@Slf4j
@Component
public class StationarityAnalyzer {

    private static final double SIGNIFICANCE = 0.05;

    // MacKinnon (1994) response surface for one series with a constant.
    private static final double TAU_MAX = 2.74;
    private static final double TAU_MIN = -18.83;
    private static final double TAU_STAR = -1.61;
    private static final double[] SMALL_P = {2.1659, 1.4412, 0.038269};
    private static final double[] LARGE_P = {1.7339, 0.93202, -0.12745, -0.010368};

    // MacKinnon (2010) critical value coefficients in powers of 1/T.
    private static final double[][] CRITICAL = {
        {-3.43035, -6.5393, -16.786, -79.433},
        {-2.86154, -2.8903, -4.234, -40.040},
        {-2.56677, -1.5384, -2.809, 0.0}
    };
    private static final String[] CRITICAL_LABELS = {"1%", "5%", "10%"};

    private final NormalDistribution normal = new NormalDistribution();

    public StationarityResult analyze(double[] series) {
        int n = series.length;
        int maxLag = Math.min(n / 2 - 2, (int) Math.floor(12.0 * Math.pow(n / 100.0, 0.25)));
        if (maxLag < 0) {
            throw new DiagnosticsException("Series of length " + n + " is too short for the ADF test");
        }

        int bestLag = selectLag(series, maxLag);
        Regression result = regress(series, bestLag, bestLag);
        double statistic = result.tStatistic();
        if (!Double.isFinite(statistic)) {
            throw new DiagnosticsException("ADF statistic is not finite; the series may be constant");
        }
        double pValue = pValue(statistic);
        boolean stationary = pValue <= SIGNIFICANCE;

        Map<String, Double> critical = new LinkedHashMap<>();
        for (int i = 0; i < CRITICAL.length; i++) {
            double inv = 1.0 / result.observations();
            double[] c = CRITICAL[i];
            critical.put(CRITICAL_LABELS[i], Numbers.round(c[0] + c[1] * inv + c[2] * inv * inv + c[3] * inv * inv * inv));
        }

        return StationarityResult.builder()
            .stationary(stationary)
            .adfStatistic(Numbers.round(statistic))
            .pValue(Numbers.round(pValue))
            .criticalValues(critical)
            .usedLag(bestLag)
            .observations(result.observations())
            .interpretation(stationary ? "Series is stationary" : "Series is non-stationary")
            .build();
    }

    public double pValue(double statistic) {
        if (statistic > TAU_MAX) {
            return 1.0;
        }
        if (statistic < TAU_MIN) {
            return 0.0;
        }
        double[] coefficients = statistic <= TAU_STAR ? SMALL_P : LARGE_P;
        double z = 0.0;
        double power = 1.0;
        for (double c : coefficients) {
            z += c * power;
            power *= statistic;
        }
        return normal.cumulativeProbability(z);
    }

    // All candidate lags share the sample trimmed for maxLag so their AICs are comparable.
    private int selectLag(double[] series, int maxLag) {
        int best = -1;
        double bestAic = Double.POSITIVE_INFINITY;
        for (int lag = 0; lag <= maxLag; lag++) {
            try {
                double aic = regress(series, maxLag, lag).aic();
                if (aic < bestAic) {
                    bestAic = aic;
                    best = lag;
                }
            } catch (DiagnosticsException e) {
                log.debug("ADF lag skipped | lag={} | reason={}", lag, e.getMessage());
            }
        }
        if (best < 0) {
            throw new DiagnosticsException("ADF regression could not be estimated for any lag");
        }
        return best;
    }

    private Regression regress(double[] y, int trim, int lags) {
        int n = y.length;
        int observations = (n - 1) - trim;
        if (observations < lags + 3) {
            throw new DiagnosticsException("Not enough observations for ADF regression with " + lags + " lags");
        }
        double[] target = new double[observations];
        double[][] regressors = new double[observations][lags + 1];
        for (int r = 0; r < observations; r++) {
            int t = r + trim;
            target[r] = y[t + 1] - y[t];
            regressors[r][0] = y[t];
            for (int k = 1; k <= lags; k++) {
                regressors[r][k] = y[t - k + 1] - y[t - k];
            }
        }

        try {
            OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
            ols.newSampleData(target, regressors);
            double[] beta = ols.estimateRegressionParameters();
            double[] se = ols.estimateRegressionParametersStandardErrors();
            double ssr = ols.calculateResidualSumOfSquares();
            double llf = -observations / 2.0 * (Math.log(2 * Math.PI) + Math.log(ssr / observations) + 1);
            double aic = -2 * llf + 2 * (lags + 2);
            return new Regression(beta[1] / se[1], aic, observations);
        } catch (SingularMatrixException e) {
            throw new DiagnosticsException("ADF regression matrix is singular; the series may be constant", e);
        } catch (MathIllegalArgumentException e) {
            throw new DiagnosticsException("ADF regression could not be estimated: " + e.getMessage(), e);
        }
    }

    private record Regression(double tStatistic, double aic, int observations) {}
}
