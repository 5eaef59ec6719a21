package com.inventoryforecast.search;

import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.ArimaConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Last resort: ARIMA(1,1,1), flagged as a fallback.
 */
@Component
@RequiredArgsConstructor
public class FixedOrderSelection implements OrderSelectionStrategy {

    public static final String METHOD = "fixed_fallback";
    public static final ArimaConfig FALLBACK_ORDER = ArimaConfig.of(1, 1, 1);

    private final ArimaLibrary arimaLibrary;

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public SelectionAttempt select(double[] values, OrderSearchContext context) {
        try {
            return SelectionAttempt.selected(METHOD, arimaLibrary.fit(values, FALLBACK_ORDER), true, 1);
        } catch (ModelFitException e) {
            return SelectionAttempt.failed(METHOD, 1, e.getMessage());
        }
    }
}
