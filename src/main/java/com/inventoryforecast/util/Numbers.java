package com.inventoryforecast.util;

public final class Numbers {

    private Numbers() {
    }

    public static Double round(double value) {
        if (!Double.isFinite(value)) {
            return null;
        }
        return Math.round(value * 10000.0) / 10000.0;
    }

    public static double clampNonNegative(double value) {
        return Math.max(0.0, value);
    }

    public static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population variance (ddof 0). */
    public static double variance(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.length;
    }

    public static double std(double[] values) {
        return Math.sqrt(variance(values));
    }
}
