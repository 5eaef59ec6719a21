package com.inventoryforecast.search;

import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.client.FittedArima;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.ArimaConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Exhaustive search over small (p,d,q) orders, keeping the lowest AIC. Ties keep the first candidate.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GridSearchOrderSelection implements OrderSelectionStrategy {

    public static final String METHOD = "grid_search";

    static final int[] P_VALUES = {0, 1, 2};
    static final int[] D_VALUES = {0, 1};
    static final int[] Q_VALUES = {0, 1, 2};

    private final ArimaLibrary arimaLibrary;

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public SelectionAttempt select(double[] values, OrderSearchContext context) {
        FittedArima best = null;
        int evaluated = 0;
        for (ArimaConfig candidate : candidates(context)) {
            evaluated++;
            try {
                FittedArima fitted = arimaLibrary.fit(values, candidate);
                double aic = fitted.aic();
                if (!Double.isFinite(aic)) {
                    log.debug("Grid candidate skipped | order={} | reason=non-finite AIC", candidate);
                    continue;
                }
                if (best == null || aic < best.aic()) {
                    best = fitted;
                }
            } catch (ModelFitException e) {
                log.debug("Grid candidate skipped | order={} | reason={}", candidate, e.getMessage());
            }
        }
        if (best == null) {
            return SelectionAttempt.failed(METHOD, evaluated, "No grid candidate could be fitted");
        }
        log.debug("Grid search selected | order={} | aic={} | candidates={}", best.config(), best.aic(), evaluated);
        return SelectionAttempt.selected(METHOD, best, false, evaluated);
    }

    List<ArimaConfig> candidates(OrderSearchContext context) {
        List<ArimaConfig.SeasonalOrder> seasonalOrders = new ArrayList<>();
        seasonalOrders.add(null);
        if (context.seasonal()) {
            seasonalOrders.add(new ArimaConfig.SeasonalOrder(0, 1, 0, context.period()));
            seasonalOrders.add(new ArimaConfig.SeasonalOrder(1, 1, 1, context.period()));
        }
        List<ArimaConfig> candidates = new ArrayList<>();
        for (int p : P_VALUES) {
            for (int d : D_VALUES) {
                for (int q : Q_VALUES) {
                    for (ArimaConfig.SeasonalOrder seasonal : seasonalOrders) {
                        candidates.add(new ArimaConfig(p, d, q, seasonal));
                    }
                }
            }
        }
        return candidates;
    }
}
