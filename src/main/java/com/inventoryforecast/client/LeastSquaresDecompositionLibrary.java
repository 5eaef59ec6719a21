package com.inventoryforecast.client;

import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.CustomSeasonality;
import com.inventoryforecast.model.DecompositionConfig;
import com.inventoryforecast.model.DecompositionPoint;
import com.inventoryforecast.model.HolidayWindow;
import com.inventoryforecast.model.SeasonalityComponent;
import com.inventoryforecast.model.SeasonalityMode;
import com.inventoryforecast.model.TrendChangepoint;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Piecewise-linear trend with candidate changepoints, Fourier seasonalities and holiday indicators,
 * estimated by penalised least squares. Penalties follow Gaussian priors: noise variance over prior
 * scale squared, so small prior scales shrink a component harder.
 * <p>
 * Built-in seasonalities are fitted only once the history spans two full cycles, custom ones once it
 * spans a single cycle. Shorter histories cannot separate a cycle from the trend.
 */
@Slf4j
@Component
public class LeastSquaresDecompositionLibrary implements DecompositionLibrary {

    private static final double STABILITY = 1e-8;
    private static final double NOISE_FLOOR = 0.0025;
    private static final int REFINEMENT_PASSES = 3;
    private static final double SIGMA_FLOOR_FRACTION = 0.1;

    @Override
    public FittedDecomposition fit(List<LocalDate> dates, double[] values, DecompositionConfig config) {
        if (dates.size() != values.length) {
            throw new ModelFitException("Decomposition needs one date per value");
        }
        if (values.length < 2 || !dates.get(dates.size() - 1).isAfter(dates.get(0))) {
            throw new ModelFitException("Decomposition needs at least two distinct dates");
        }
        try {
            return estimate(dates, values, config);
        } catch (ModelFitException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ModelFitException("Decomposition fit failed: " + e.getMessage(), e);
        }
    }

    private Fitted estimate(List<LocalDate> dates, double[] values, DecompositionConfig config) {
        int n = values.length;
        Layout layout = Layout.of(dates, config);

        double scale = 0.0;
        for (double v : values) {
            scale = Math.max(scale, Math.abs(v));
        }
        if (scale == 0.0) {
            scale = 1.0;
        }
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            y[i] = values[i] / scale;
        }

        double[][] trendRows = new double[n][];
        double[][] effectRows = new double[n][];
        for (int i = 0; i < n; i++) {
            trendRows[i] = layout.trendRow(dates.get(i));
            effectRows[i] = layout.effectRow(dates.get(i));
        }

        double noise = Math.max(NOISE_FLOOR, linearResidualVariance(trendRows, y));
        double[] trendPenalty = layout.trendPenalty(noise, config);
        double[] effectPenalty = layout.effectPenalty(noise, config);

        double[] trendBeta;
        double[] effectBeta;
        double[][] finalRows = new double[n][];
        SeasonalityMode mode = config.getSeasonalityMode();
        if (mode == SeasonalityMode.ADDITIVE || layout.effectWidth() == 0) {
            double[][] joint = new double[n][];
            for (int i = 0; i < n; i++) {
                joint[i] = concat(trendRows[i], effectRows[i]);
            }
            double[] beta = ridge(joint, y, concat(trendPenalty, effectPenalty));
            finalRows = joint;
            trendBeta = slice(beta, 0, trendPenalty.length);
            effectBeta = slice(beta, trendPenalty.length, beta.length);
        } else {
            trendBeta = ridge(trendRows, y, trendPenalty);
            effectBeta = new double[layout.effectWidth()];
            for (int pass = 0; pass < REFINEMENT_PASSES; pass++) {
                double[][] scaledEffects = new double[n][];
                double[] gap = new double[n];
                for (int i = 0; i < n; i++) {
                    double level = dot(trendRows[i], trendBeta);
                    scaledEffects[i] = times(effectRows[i], level);
                    gap[i] = y[i] - level;
                }
                effectBeta = ridge(scaledEffects, gap, effectPenalty);

                double[][] scaledTrend = new double[n][];
                for (int i = 0; i < n; i++) {
                    scaledTrend[i] = times(trendRows[i], 1.0 + dot(effectRows[i], effectBeta));
                }
                trendBeta = ridge(scaledTrend, y, trendPenalty);
            }
            for (int i = 0; i < n; i++) {
                double level = dot(trendRows[i], trendBeta);
                finalRows[i] = concat(times(trendRows[i], 1.0 + dot(effectRows[i], effectBeta)),
                                      times(effectRows[i], level));
            }
        }

        Fitted fitted = new Fitted(layout, mode, scale, trendBeta, effectBeta, 0.0, config.getIntervalWidth());
        double sse = 0.0;
        for (int i = 0; i < n; i++) {
            double residual = values[i] - fitted.expected(dates.get(i));
            sse += residual * residual;
        }
        double parameters = effectiveParameters(finalRows, concat(trendPenalty, effectPenalty));
        double sigma = Math.max(Math.sqrt(sse / Math.max(1.0, n - parameters)),
                                SIGMA_FLOOR_FRACTION * sampleStd(values));
        log.debug("Decomposition fitted | points={} | changepoints={} | seasonalities={} | mode={} | sigma={}",
                  n, layout.changepoints.size(), layout.seasonalities.size(), mode, sigma);
        return new Fitted(layout, mode, scale, trendBeta, effectBeta, sigma, config.getIntervalWidth());
    }

    private static double linearResidualVariance(double[][] trendRows, double[] y) {
        double[][] linear = new double[y.length][];
        for (int i = 0; i < y.length; i++) {
            linear[i] = new double[]{trendRows[i][0], trendRows[i][1]};
        }
        double[] beta = ridge(linear, y, new double[]{STABILITY, STABILITY});
        double sum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double r = y[i] - dot(linear[i], beta);
            sum += r * r;
        }
        return sum / y.length;
    }

    // Trace of the ridge hat matrix: p - trace((X'X + L)^-1 L).
    private static double effectiveParameters(double[][] rows, double[] penalty) {
        RealMatrix design = MatrixUtils.createRealMatrix(rows);
        RealMatrix gram = design.transpose().multiply(design);
        for (int j = 0; j < penalty.length; j++) {
            gram.addToEntry(j, j, penalty[j]);
        }
        RealMatrix inverse = new LUDecomposition(gram).getSolver().getInverse();
        double shrunk = 0.0;
        for (int j = 0; j < penalty.length; j++) {
            shrunk += inverse.getEntry(j, j) * penalty[j];
        }
        return penalty.length - shrunk;
    }

    private static double sampleStd(double[] values) {
        if (values.length < 2) {
            return 0.0;
        }
        double mean = 0.0;
        for (double v : values) {
            mean += v;
        }
        mean /= values.length;
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / (values.length - 1));
    }

    private static double[] ridge(double[][] rows, double[] target, double[] penalty) {
        RealMatrix design = MatrixUtils.createRealMatrix(rows);
        RealMatrix gram = design.transpose().multiply(design);
        for (int j = 0; j < penalty.length; j++) {
            gram.addToEntry(j, j, penalty[j]);
        }
        ArrayRealVector rhs = new ArrayRealVector(design.transpose().operate(target));
        return new LUDecomposition(gram).getSolver().solve(rhs).toArray();
    }

    private static double dot(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }

    private static double[] times(double[] row, double factor) {
        double[] out = new double[row.length];
        for (int i = 0; i < row.length; i++) {
            out[i] = row[i] * factor;
        }
        return out;
    }

    private static double[] concat(double[] a, double[] b) {
        double[] out = new double[a.length + b.length];
        System.arraycopy(a, 0, out, 0, a.length);
        System.arraycopy(b, 0, out, a.length, b.length);
        return out;
    }

    private static double[] slice(double[] values, int from, int to) {
        double[] out = new double[to - from];
        System.arraycopy(values, from, out, 0, out.length);
        return out;
    }

    private record Seasonality(String name, double period, int order, double priorScale) {
        int width() {
            return 2 * order;
        }
    }

    private record HolidayColumn(String name, Set<LocalDate> dates) {}

    /** Column layout shared by fitting and prediction. */
    private static final class Layout {
        private final LocalDate start;
        private final double spanDays;
        private final List<Double> changepoints;
        private final List<LocalDate> changepointDates;
        private final List<Seasonality> seasonalities;
        private final List<HolidayColumn> holidays;

        private Layout(LocalDate start, double spanDays, List<Double> changepoints, List<LocalDate> changepointDates,
                       List<Seasonality> seasonalities, List<HolidayColumn> holidays) {
            this.start = start;
            this.spanDays = spanDays;
            this.changepoints = changepoints;
            this.changepointDates = changepointDates;
            this.seasonalities = seasonalities;
            this.holidays = holidays;
        }

        static Layout of(List<LocalDate> dates, DecompositionConfig config) {
            LocalDate start = dates.get(0);
            double span = dates.get(dates.size() - 1).toEpochDay() - start.toEpochDay();

            // Candidates spread evenly over the first part of the history, first row excluded.
            int history = (int) Math.floor(dates.size() * config.getChangepointRange());
            int count = Math.max(0, Math.min(config.getMaxChangepoints(), history - 1));
            List<Double> changepoints = new ArrayList<>();
            List<LocalDate> changepointDates = new ArrayList<>();
            for (int k = 1; k <= count; k++) {
                int index = (int) Math.rint((double) k * (history - 1) / count);
                LocalDate date = dates.get(index);
                changepointDates.add(date);
                changepoints.add((date.toEpochDay() - start.toEpochDay()) / span);
            }

            List<Seasonality> seasonalities = new ArrayList<>();
            if (config.isYearlySeasonality() && span >= 2 * 365.25) {
                seasonalities.add(new Seasonality("yearly", 365.25, 10, config.getSeasonalityPriorScale()));
            }
            if (config.isWeeklySeasonality() && span >= 2 * 7) {
                seasonalities.add(new Seasonality("weekly", 7, 3, config.getSeasonalityPriorScale()));
            }
            if (config.isDailySeasonality() && span >= 2) {
                seasonalities.add(new Seasonality("daily", 1, 4, config.getSeasonalityPriorScale()));
            }
            for (CustomSeasonality custom : config.getCustomSeasonalities()) {
                if (span >= custom.period()) {
                    seasonalities.add(new Seasonality(custom.name(), custom.period(), custom.fourierOrder(),
                                                      custom.priorScale()));
                }
            }

            Map<String, Set<LocalDate>> byColumn = new LinkedHashMap<>();
            for (HolidayWindow holiday : config.getHolidays()) {
                for (int offset = -holiday.lowerWindow(); offset <= holiday.upperWindow(); offset++) {
                    String key = holiday.name() + (offset < 0 ? "_" : "_+") + offset;
                    byColumn.computeIfAbsent(key, k -> new HashSet<>()).add(holiday.date().plusDays(offset));
                }
            }
            List<HolidayColumn> holidays = byColumn.entrySet().stream()
                .map(e -> new HolidayColumn(e.getKey(), e.getValue()))
                .toList();

            return new Layout(start, span, changepoints, changepointDates, seasonalities, holidays);
        }

        double time(LocalDate date) {
            return (date.toEpochDay() - start.toEpochDay()) / spanDays;
        }

        double[] trendRow(LocalDate date) {
            double t = time(date);
            double[] row = new double[2 + changepoints.size()];
            row[0] = 1.0;
            row[1] = t;
            for (int j = 0; j < changepoints.size(); j++) {
                row[2 + j] = Math.max(0.0, t - changepoints.get(j));
            }
            return row;
        }

        int effectWidth() {
            int width = holidays.size();
            for (Seasonality s : seasonalities) {
                width += s.width();
            }
            return width;
        }

        double[] effectRow(LocalDate date) {
            double[] row = new double[effectWidth()];
            double day = date.toEpochDay();
            int c = 0;
            for (Seasonality s : seasonalities) {
                for (int k = 1; k <= s.order(); k++) {
                    double angle = 2.0 * Math.PI * k * day / s.period();
                    row[c++] = Math.sin(angle);
                    row[c++] = Math.cos(angle);
                }
            }
            for (HolidayColumn h : holidays) {
                row[c++] = h.dates().contains(date) ? 1.0 : 0.0;
            }
            return row;
        }

        double[] trendPenalty(double noise, DecompositionConfig config) {
            double[] penalty = new double[2 + changepoints.size()];
            penalty[0] = STABILITY;
            penalty[1] = STABILITY;
            double tau = config.getChangepointPriorScale();
            for (int j = 2; j < penalty.length; j++) {
                penalty[j] = noise / (tau * tau);
            }
            return penalty;
        }

        double[] effectPenalty(double noise, DecompositionConfig config) {
            double[] penalty = new double[effectWidth()];
            int c = 0;
            for (Seasonality s : seasonalities) {
                for (int k = 0; k < s.width(); k++) {
                    penalty[c++] = noise / (s.priorScale() * s.priorScale());
                }
            }
            double holidayScale = config.getHolidaysPriorScale();
            for (int k = 0; k < holidays.size(); k++) {
                penalty[c++] = noise / (holidayScale * holidayScale);
            }
            return penalty;
        }
    }

    private static final class Fitted implements FittedDecomposition {
        private final Layout layout;
        private final SeasonalityMode mode;
        private final double scale;
        private final double[] trendBeta;
        private final double[] effectBeta;
        private final double sigma;
        private final double z;
        private final double meanAbsDelta;

        Fitted(Layout layout, SeasonalityMode mode, double scale, double[] trendBeta, double[] effectBeta,
               double sigma, double intervalWidth) {
            this.layout = layout;
            this.mode = mode;
            this.scale = scale;
            this.trendBeta = trendBeta;
            this.effectBeta = effectBeta;
            this.sigma = sigma;
            this.z = new NormalDistribution().inverseCumulativeProbability((1.0 + intervalWidth) / 2.0);
            double sum = 0.0;
            for (int j = 2; j < trendBeta.length; j++) {
                sum += Math.abs(trendBeta[j]);
            }
            this.meanAbsDelta = trendBeta.length > 2 ? sum / (trendBeta.length - 2) : 0.0;
        }

        double expected(LocalDate date) {
            return point(date).getYhat();
        }

        @Override
        public List<DecompositionPoint> predict(List<LocalDate> dates) {
            return dates.stream().map(this::point).toList();
        }

        private DecompositionPoint point(LocalDate date) {
            double trend = dot(layout.trendRow(date), trendBeta);
            double[] effects = layout.effectRow(date);

            Map<String, Double> components = new LinkedHashMap<>();
            int c = 0;
            double seasonal = 0.0;
            for (Seasonality s : layout.seasonalities) {
                double value = 0.0;
                for (int k = 0; k < s.width(); k++, c++) {
                    value += effects[c] * effectBeta[c];
                }
                components.put(s.name(), value);
                seasonal += value;
            }
            double holiday = 0.0;
            for (int k = 0; k < layout.holidays.size(); k++, c++) {
                holiday += effects[c] * effectBeta[c];
            }

            boolean multiplicative = mode == SeasonalityMode.MULTIPLICATIVE;
            double unit = multiplicative ? trend * scale : scale;
            double yhat = multiplicative
                ? trend * (1.0 + seasonal + holiday) * scale
                : (trend + seasonal + holiday) * scale;

            double t = layout.time(date);
            double trendSd = 0.0;
            if (t > 1.0 && !layout.changepoints.isEmpty()) {
                double rate = layout.changepoints.size();
                double ahead = t - 1.0;
                trendSd = scale * Math.sqrt(2.0 * meanAbsDelta * meanAbsDelta * rate * ahead * ahead * ahead / 3.0);
                if (multiplicative) {
                    trendSd *= Math.abs(1.0 + seasonal + holiday);
                }
            }
            double halfWidth = z * Math.sqrt(sigma * sigma + trendSd * trendSd);

            Double yearly = components.get("yearly");
            Double weekly = components.get("weekly");
            return DecompositionPoint.builder()
                .date(date)
                .yhat(yhat)
                .lower(yhat - halfWidth)
                .upper(yhat + halfWidth)
                .trend(trend * scale)
                .seasonal(seasonal * unit)
                .yearly(yearly == null ? null : yearly * unit)
                .weekly(weekly == null ? null : weekly * unit)
                .holidays(holiday * unit)
                .build();
        }

        @Override
        public List<TrendChangepoint> changepoints() {
            List<TrendChangepoint> out = new ArrayList<>();
            for (int j = 0; j < layout.changepointDates.size(); j++) {
                double perDay = trendBeta[2 + j] * scale / layout.spanDays;
                out.add(TrendChangepoint.of(layout.changepointDates.get(j), perDay));
            }
            return out;
        }

        @Override
        public List<SeasonalityComponent> seasonalities() {
            return layout.seasonalities.stream()
                .map(s -> new SeasonalityComponent(s.name(), s.period(), s.order(), mode))
                .toList();
        }
    }
}
