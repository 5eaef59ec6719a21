package com.inventoryforecast.model;

import java.util.List;

public record ArimaConfig(int p, int d, int q, SeasonalOrder seasonal) {

    public ArimaConfig {
        if (p < 0 || d < 0 || q < 0) {
            throw new IllegalArgumentException("ARIMA orders must be non-negative");
        }
    }

    public static ArimaConfig of(int p, int d, int q) {
        return new ArimaConfig(p, d, q, null);
    }

    public boolean isSeasonal() {
        return seasonal != null;
    }

    public List<Integer> order() {
        return List.of(p, d, q);
    }

    public List<Integer> seasonalOrder() {
        return seasonal == null ? null : seasonal.asList();
    }

    /** Estimated coefficients, including the mean term for undifferenced models. */
    public int parameterCount() {
        int count = p + q;
        int seasonalDiff = 0;
        if (seasonal != null) {
            count += seasonal.p() + seasonal.q();
            seasonalDiff = seasonal.d();
        }
        return d + seasonalDiff == 0 ? count + 1 : count;
    }

    @Override
    public String toString() {
        String base = "ARIMA(" + p + "," + d + "," + q + ")";
        return seasonal == null ? base : base + seasonal;
    }

    public record SeasonalOrder(int p, int d, int q, int period) {

        public List<Integer> asList() {
            return List.of(p, d, q, period);
        }

        @Override
        public String toString() {
            return "(" + p + "," + d + "," + q + ")[" + period + "]";
        }
    }
}
