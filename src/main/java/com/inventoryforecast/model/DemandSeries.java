package com.inventoryforecast.model;

import lombok.Getter;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * Cleaned, time-indexed demand history. Dates strictly increase and values are finite.
 */
public final class DemandSeries {

    private final List<LocalDate> dates;
    private final double[] values;
    @Getter
    private final int filledCount;
    @Getter
    private final int clampedCount;
    @Getter
    private final boolean syntheticDates;

    public DemandSeries(List<LocalDate> dates, double[] values,
                        int filledCount, int clampedCount, boolean syntheticDates) {
        if (dates.size() != values.length) {
            throw new IllegalArgumentException("dates and values must have the same length");
        }
        this.dates = List.copyOf(dates);
        this.values = values.clone();
        this.filledCount = filledCount;
        this.clampedCount = clampedCount;
        this.syntheticDates = syntheticDates;
    }

    public int size() {
        return values.length;
    }

    public double[] values() {
        return values.clone();
    }

    public double valueAt(int index) {
        return values[index];
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public LocalDate dateAt(int index) {
        return dates.get(index);
    }

    public LocalDate startDate() {
        return dates.get(0);
    }

    public LocalDate endDate() {
        return dates.get(dates.size() - 1);
    }

    public DemandSeries head(int length) {
        return new DemandSeries(dates.subList(0, length), Arrays.copyOf(values, length),
            0, 0, syntheticDates);
    }

    public double[] tail(int from) {
        return Arrays.copyOfRange(values, from, values.length);
    }
}
