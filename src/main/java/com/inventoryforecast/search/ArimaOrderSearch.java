package com.inventoryforecast.search;

import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.ModelFitException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the order selection strategies in order and returns the first that produces a model.
 */
@Slf4j
@Service
public class ArimaOrderSearch {

    private final List<OrderSelectionStrategy> strategies;

    @Autowired
    public ArimaOrderSearch(StepwiseOrderSelection stepwise, GridSearchOrderSelection grid,
                            FixedOrderSelection fixed, ForecastProperties properties) {
        this(properties.getArima().isAutoSelection() ? List.of(stepwise, grid, fixed) : List.of(grid, fixed));
    }

    ArimaOrderSearch(List<OrderSelectionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public OrderSelection search(double[] values, OrderSearchContext context) {
        List<String> failures = new ArrayList<>();
        int evaluated = 0;
        for (OrderSelectionStrategy strategy : strategies) {
            SelectionAttempt attempt = strategy.select(values, context);
            evaluated += attempt.candidatesEvaluated();
            if (attempt.isSuccess()) {
                log.info("ARIMA order selected | order={} | method={} | fallback={} | candidates={}",
                         attempt.model().config(), attempt.method(), attempt.fallback(), evaluated);
                return new OrderSelection(attempt.model(), attempt.method(), attempt.fallback(),
                                          evaluated, List.copyOf(failures));
            }
            log.warn("ARIMA order strategy failed | method={} | reason={}", attempt.method(), attempt.error());
            failures.add(attempt.method() + ": " + attempt.error());
        }
        throw new ModelFitException("No ARIMA order could be fitted (" + String.join("; ", failures) + ")");
    }

    List<OrderSelectionStrategy> strategies() {
        return strategies;
    }
}
