package com.inventoryforecast.model;

import java.time.LocalDate;
import java.time.ZoneOffset;

/** Candidate trend changepoint; {@code rateChange} is the fitted slope change per day. */
public record TrendChangepoint(LocalDate date, long timestamp, double rateChange) {

    public static TrendChangepoint of(LocalDate date, double rateChange) {
        return new TrendChangepoint(date, date.atStartOfDay().toEpochSecond(ZoneOffset.UTC), rateChange);
    }
}
