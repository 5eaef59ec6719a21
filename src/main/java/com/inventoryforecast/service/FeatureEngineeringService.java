package com.inventoryforecast.service;

import com.inventoryforecast.model.DemandSeries;
import com.inventoryforecast.model.FeatureFrame;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.IsoFields;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Derives the tree-model feature set from a prepared series. Deterministic and stateless.
 */
@Slf4j
@Service
public class FeatureEngineeringService {

    static final int[] LAGS = {1, 3, 7, 14, 30};
    static final int[] WINDOWS = {3, 7, 14, 30};
    static final int MOMENTUM_MIN_POINTS = 30;
    static final int RSI_WINDOW = 14;
    static final String EXTERNAL_PREFIX = "ext_";

    public FeatureFrame derive(DemandSeries series, Map<String, List<Double>> externalFeatures) {
        int n = series.size();
        double[] y = series.values();
        Map<String, double[]> columns = new LinkedHashMap<>();

        // Calendar-driven features come first so future rows can reuse the same derivation.
        for (int i = 0; i < n; i++) {
            Map<String, Double> calendar = calendarFeatures(series.dateAt(i), i);
            for (Map.Entry<String, Double> e : calendar.entrySet()) {
                columns.computeIfAbsent(e.getKey(), k -> new double[n])[i] = e.getValue();
            }
        }

        for (int lag : LAGS) {
            if (n > lag) {
                double[] column = nanColumn(n);
                for (int i = lag; i < n; i++) {
                    column[i] = y[i - lag];
                }
                columns.put("lag_" + lag, column);
            }
        }

        for (int window : WINDOWS) {
            if (n > window) {
                double[] mean = new double[n];
                double[] std = new double[n];
                double[] min = new double[n];
                double[] max = new double[n];
                for (int i = 0; i < n; i++) {
                    double[] slice = Arrays.copyOfRange(y, Math.max(0, i - window + 1), i + 1);
                    mean[i] = Arrays.stream(slice).average().orElse(Double.NaN);
                    std[i] = sampleStd(slice);
                    min[i] = Arrays.stream(slice).min().orElse(Double.NaN);
                    max[i] = Arrays.stream(slice).max().orElse(Double.NaN);
                }
                columns.put("rolling_mean_" + window, mean);
                columns.put("rolling_std_" + window, std);
                columns.put("rolling_min_" + window, min);
                columns.put("rolling_max_" + window, max);
            }
        }

        columns.put("pct_change_1", pctChange(y, 1));
        columns.put("pct_change_7", pctChange(y, 7));

        if (externalFeatures != null) {
            externalFeatures.forEach((name, values) -> {
                if (values == null || values.size() != n) {
                    log.warn("External feature skipped | name={} | length={} | expected={}",
                             name, values == null ? 0 : values.size(), n);
                    return;
                }
                double[] column = new double[n];
                for (int i = 0; i < n; i++) {
                    Double v = values.get(i);
                    column[i] = v == null ? Double.NaN : v;
                }
                columns.put(EXTERNAL_PREFIX + name, column);
            });
        }

        if (n > MOMENTUM_MIN_POINTS) {
            double[] ema12 = ewmMean(y, 12);
            double[] ema26 = ewmMean(y, 26);
            double[] macd = new double[n];
            for (int i = 0; i < n; i++) {
                macd[i] = ema12[i] - ema26[i];
            }
            columns.put("macd", macd);
            columns.put("rsi", rsi(y));
        }

        columns.values().forEach(FeatureEngineeringService::fillGaps);
        log.debug("Features derived | rows={} | features={}", n, columns.size());
        return new FeatureFrame(series, columns);
    }

    /**
     * Feature vector for a date after the observed history. Calendar, seasonal and trend features
     * are derived from the date and row index; history-dependent features carry the last observed row.
     */
    public double[] futureRow(FeatureFrame frame, LocalDate date, int index) {
        Map<String, Double> derived = calendarFeatures(date, index);
        double[] last = frame.row(frame.size() - 1);
        List<String> names = frame.featureNames();
        double[] row = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            Double value = derived.get(names.get(i));
            row[i] = value != null ? value : last[i];
        }
        return row;
    }

    Map<String, Double> calendarFeatures(LocalDate date, int index) {
        int month = date.getMonthValue();
        int day = date.getDayOfMonth();
        int dayOfWeek = date.getDayOfWeek().getValue() - 1;

        Map<String, Double> f = new LinkedHashMap<>();
        f.put("year", (double) date.getYear());
        f.put("month", (double) month);
        f.put("day", (double) day);
        f.put("dayofweek", (double) dayOfWeek);
        f.put("quarter", (double) ((month - 1) / 3 + 1));
        f.put("week_of_year", (double) date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
        f.put("is_weekend", flag(dayOfWeek >= 5));
        f.put("is_month_start", flag(day <= 5));
        f.put("is_month_end", flag(day >= 25));
        f.put("is_quarter_end", flag(month % 3 == 0 && day >= 25));
        f.put("is_year_end", flag(month == 12 && day >= 20));
        f.put("is_payday_week", flag(day >= 22 || day <= 5));

        f.put("trend", (double) index);
        f.put("trend_squared", (double) index * index);

        f.put("sin_weekly", Math.sin(2 * Math.PI * dayOfWeek / 7));
        f.put("cos_weekly", Math.cos(2 * Math.PI * dayOfWeek / 7));
        f.put("sin_monthly", Math.sin(2 * Math.PI * day / 30.5));
        f.put("cos_monthly", Math.cos(2 * Math.PI * day / 30.5));
        f.put("sin_yearly", Math.sin(2 * Math.PI * index / 365.25));
        f.put("cos_yearly", Math.cos(2 * Math.PI * index / 365.25));

        f.put("is_holiday_season", flag(isHolidaySeason(month, day)));
        f.put("ramadan_proximity", flag(Math.sin(2 * Math.PI * index / 354) > 0.8));
        return f;
    }

    private static boolean isHolidaySeason(int month, int day) {
        return (month == 4 && day >= 8 && day <= 15)
            || (month == 6 && day >= 15 && day <= 20)
            || (month == 8 && day >= 15 && day <= 20)
            || (month == 12 && day >= 20);
    }

    private static double flag(boolean condition) {
        return condition ? 1.0 : 0.0;
    }

    private static double[] nanColumn(int n) {
        double[] column = new double[n];
        Arrays.fill(column, Double.NaN);
        return column;
    }

    private static double sampleStd(double[] window) {
        if (window.length < 2) {
            return Double.NaN;
        }
        double mean = Arrays.stream(window).average().orElse(0.0);
        double sum = 0.0;
        for (double v : window) {
            sum += (v - mean) * (v - mean);
        }
        return Math.sqrt(sum / (window.length - 1));
    }

    // Zero where the prior value is missing or zero.
    static double[] pctChange(double[] y, int period) {
        double[] out = new double[y.length];
        for (int i = period; i < y.length; i++) {
            double prior = y[i - period];
            out[i] = prior == 0.0 ? 0.0 : (y[i] - prior) / prior;
        }
        return out;
    }

    // Adjusted exponential weighting, alpha = 2 / (span + 1).
    static double[] ewmMean(double[] y, int span) {
        double decay = 1.0 - 2.0 / (span + 1.0);
        double[] out = new double[y.length];
        double numerator = 0.0;
        double denominator = 0.0;
        for (int i = 0; i < y.length; i++) {
            numerator = y[i] + decay * numerator;
            denominator = 1.0 + decay * denominator;
            out[i] = numerator / denominator;
        }
        return out;
    }

    static double[] rsi(double[] y) {
        int n = y.length;
        double[] gain = new double[n];
        double[] loss = new double[n];
        for (int i = 1; i < n; i++) {
            double delta = y[i] - y[i - 1];
            gain[i] = Math.max(delta, 0.0);
            loss[i] = Math.max(-delta, 0.0);
        }
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            if (i < RSI_WINDOW - 1) {
                out[i] = 50.0;
                continue;
            }
            double avgGain = 0.0;
            double avgLoss = 0.0;
            for (int k = i - RSI_WINDOW + 1; k <= i; k++) {
                avgGain += gain[k];
                avgLoss += loss[k];
            }
            avgGain /= RSI_WINDOW;
            avgLoss /= RSI_WINDOW;
            if (avgLoss == 0.0) {
                out[i] = avgGain == 0.0 ? 50.0 : 100.0;
            } else {
                out[i] = 100.0 - 100.0 / (1.0 + avgGain / avgLoss);
            }
        }
        return out;
    }

    private static void fillGaps(double[] column) {
        int firstDefined = -1;
        for (int i = 0; i < column.length; i++) {
            if (Double.isFinite(column[i])) {
                if (firstDefined < 0) {
                    firstDefined = i;
                }
            } else if (firstDefined >= 0) {
                column[i] = column[i - 1];
            }
        }
        double backfill = firstDefined >= 0 ? column[firstDefined] : 0.0;
        for (int i = 0; i < (firstDefined >= 0 ? firstDefined : column.length); i++) {
            column[i] = backfill;
        }
    }
}
