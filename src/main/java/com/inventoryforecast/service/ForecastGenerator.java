package com.inventoryforecast.service;

import com.inventoryforecast.exception.ForecastStepException;
import com.inventoryforecast.model.ForecastPoint;
import com.inventoryforecast.model.StepEstimate;
import com.inventoryforecast.model.StepResult;
import com.inventoryforecast.util.Numbers;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntFunction;

/**
 * Turns per-step model estimates into clamped, ordered forecast points. A step that cannot be
 * estimated becomes a degraded zero point and the remaining steps still run.
 */
@Slf4j
@Component
public class ForecastGenerator {

    static final double FALLBACK_LOWER = 0.8;
    static final double FALLBACK_UPPER = 1.2;

    @FunctionalInterface
    public interface StepEstimator {
        StepEstimate estimate(int step);
    }

    public List<StepResult> generate(int horizon, double confidenceLevel,
                                     IntFunction<LocalDate> dateOf, StepEstimator estimator) {
        List<StepResult> results = new ArrayList<>(horizon);
        for (int step = 1; step <= horizon; step++) {
            LocalDate date = safeDate(dateOf, step);
            try {
                results.add(StepResult.ok(toPoint(step, date, confidenceLevel, estimator.estimate(step))));
            } catch (ForecastStepException e) {
                results.add(failed(step, date, confidenceLevel, e));
            } catch (RuntimeException e) {
                results.add(failed(step, date, confidenceLevel,
                    new ForecastStepException(step, e.getMessage(), e)));
            }
        }
        long failures = results.stream().filter(r -> !r.isSuccess()).count();
        if (failures > 0) {
            log.warn("Forecast steps degraded | failed={} | horizon={}", failures, horizon);
        }
        return results;
    }

    public static List<ForecastPoint> render(List<StepResult> results) {
        return results.stream().map(StepResult::point).toList();
    }

    private ForecastPoint toPoint(int step, LocalDate date, double confidenceLevel, StepEstimate estimate) {
        if (estimate == null) {
            throw new ForecastStepException(step, "No estimate produced for step " + step);
        }
        double point = estimate.getPoint();
        if (!Double.isFinite(point)) {
            throw new ForecastStepException(step, "Non-finite forecast value at step " + step);
        }
        double lower = finiteOr(estimate.getLower(), point * FALLBACK_LOWER);
        double upper = finiteOr(estimate.getUpper(), point * FALLBACK_UPPER);

        double forecast = Numbers.clampNonNegative(point);
        lower = Math.min(Numbers.clampNonNegative(lower), forecast);
        upper = Math.max(Numbers.clampNonNegative(upper), forecast);

        return ForecastPoint.builder()
            .step(step)
            .date(date)
            .forecast(forecast)
            .lowerBound(lower)
            .upperBound(upper)
            .confidenceLevel(estimate.getConfidenceLevel() != null ? estimate.getConfidenceLevel() : confidenceLevel)
            .trend(estimate.getTrend())
            .seasonal(estimate.getSeasonal())
            .yearly(estimate.getYearly())
            .weekly(estimate.getWeekly())
            .build();
    }

    private static StepResult failed(int step, LocalDate date, double confidenceLevel, ForecastStepException e) {
        log.debug("Forecast step failed | step={} | reason={}", step, e.getMessage());
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return StepResult.failed(ForecastPoint.degraded(step, date, confidenceLevel, message), e);
    }

    private static LocalDate safeDate(IntFunction<LocalDate> dateOf, int step) {
        try {
            return dateOf.apply(step);
        } catch (RuntimeException e) {
            log.debug("Forecast date unavailable | step={} | reason={}", step, e.getMessage());
            return null;
        }
    }

    private static double finiteOr(Double value, double fallback) {
        return value != null && Double.isFinite(value) ? value : fallback;
    }
}
