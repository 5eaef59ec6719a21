package com.inventoryforecast.search;

/**
 * One link in the ARIMA order selection chain. Implementations never throw for an unusable
 * series; they return a failed {@link SelectionAttempt} so the next strategy can run.
 */
public interface OrderSelectionStrategy {

    String method();

    SelectionAttempt select(double[] values, OrderSearchContext context);
}
