package com.inventoryforecast.search;

/**
 * What the caller asked for: a seasonal model and, if so, its period in days.
 */
public record OrderSearchContext(boolean seasonal, int period) {
}
