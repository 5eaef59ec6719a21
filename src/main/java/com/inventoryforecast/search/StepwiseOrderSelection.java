package com.inventoryforecast.search;

import com.inventoryforecast.client.ArimaLibrary;
import com.inventoryforecast.client.FittedArima;
import com.inventoryforecast.config.ForecastProperties;
import com.inventoryforecast.exception.DiagnosticsException;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.ArimaConfig;
import com.inventoryforecast.stats.StationarityAnalyzer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Hill-climbing order selection. The differencing order comes from repeated ADF tests, then
 * (p,q) moves from (0,0) to the neighbour with the lowest AIC for as long as AIC improves.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StepwiseOrderSelection implements OrderSelectionStrategy {

    public static final String METHOD = "auto_arima";

    private final ArimaLibrary arimaLibrary;
    private final StationarityAnalyzer stationarityAnalyzer;
    private final ForecastProperties properties;

    @Override
    public String method() {
        return METHOD;
    }

    @Override
    public SelectionAttempt select(double[] values, OrderSearchContext context) {
        if (context.seasonal()) {
            return SelectionAttempt.failed(METHOD, 0, "Stepwise selection does not search seasonal orders");
        }
        ForecastProperties.Arima limits = properties.getArima();
        int d = differencingOrder(values, limits.getMaxD());

        Set<List<Integer>> visited = new HashSet<>();
        int evaluated = 0;
        FittedArima best;
        visited.add(List.of(0, 0));
        evaluated++;
        try {
            best = arimaLibrary.fit(values, ArimaConfig.of(0, d, 0));
        } catch (ModelFitException e) {
            return SelectionAttempt.failed(METHOD, evaluated, "Starting order (0," + d + ",0) failed: " + e.getMessage());
        }
        if (!Double.isFinite(best.aic())) {
            return SelectionAttempt.failed(METHOD, evaluated, "Starting order (0," + d + ",0) has a non-finite AIC");
        }

        boolean improved = true;
        while (improved) {
            improved = false;
            ArimaConfig current = best.config();
            int[][] moves = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};
            FittedArima roundBest = best;
            for (int[] move : moves) {
                int p = current.p() + move[0];
                int q = current.q() + move[1];
                if (p < 0 || q < 0 || p > limits.getMaxP() || q > limits.getMaxQ() || !visited.add(List.of(p, q))) {
                    continue;
                }
                evaluated++;
                try {
                    FittedArima candidate = arimaLibrary.fit(values, ArimaConfig.of(p, d, q));
                    if (Double.isFinite(candidate.aic()) && candidate.aic() < roundBest.aic()) {
                        roundBest = candidate;
                    }
                } catch (ModelFitException e) {
                    log.debug("Stepwise candidate skipped | order=({},{},{}) | reason={}", p, d, q, e.getMessage());
                }
            }
            if (roundBest != best) {
                best = roundBest;
                improved = true;
            }
        }
        log.debug("Stepwise selected | order={} | aic={} | candidates={}", best.config(), best.aic(), evaluated);
        return SelectionAttempt.selected(METHOD, best, false, evaluated);
    }

    int differencingOrder(double[] values, int maxD) {
        double[] series = values;
        int d = 0;
        while (d < maxD) {
            try {
                if (stationarityAnalyzer.analyze(series).isStationary()) {
                    break;
                }
            } catch (DiagnosticsException e) {
                log.debug("ADF unavailable while choosing d | d={} | reason={}", d, e.getMessage());
                break;
            }
            series = difference(series);
            d++;
        }
        return d;
    }

    private static double[] difference(double[] values) {
        double[] diff = new double[values.length - 1];
        for (int i = 1; i < values.length; i++) {
            diff[i - 1] = values[i] - values[i - 1];
        }
        return diff;
    }
}
