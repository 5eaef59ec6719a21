package com.inventoryforecast.service;

import com.inventoryforecast.exception.InsufficientDataException;
import com.inventoryforecast.exception.PreparationException;
import com.inventoryforecast.model.DemandSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.stream.IntStream;

@Slf4j
@Service
@RequiredArgsConstructor
public class DataPreparationService {

    private final Clock clock;

    /**
     * Backend-specific cleaning rules.
     *
     * @param minimumPoints  shortest series the backend accepts
     * @param clampNegative  clamp negative demand to zero instead of rejecting it
     * @param sortByDate     order rows by date instead of requiring them in order
     */
    public record Policy(int minimumPoints, boolean clampNegative, boolean sortByDate) {}

    public DemandSeries prepare(List<Double> values, List<LocalDate> dates, Policy policy) {
        if (values == null || values.size() < policy.minimumPoints()) {
            throw new InsufficientDataException(policy.minimumPoints());
        }
        int n = values.size();
        boolean synthetic = dates == null || dates.isEmpty();
        if (!synthetic && dates.size() != n) {
            throw new PreparationException("dates has " + dates.size() + " entries but data_points has " + n);
        }
        if (!synthetic && dates.stream().anyMatch(d -> d == null)) {
            throw new PreparationException("dates must not contain null entries");
        }

        List<LocalDate> index = synthetic ? syntheticDates(n) : dates;
        List<Double> raw = values;
        if (!synthetic && policy.sortByDate()) {
            List<LocalDate> given = dates;
            List<Integer> order = IntStream.range(0, n).boxed()
                .sorted(Comparator.comparing(given::get))
                .toList();
            index = order.stream().map(given::get).toList();
            raw = order.stream().map(values::get).toList();
        }
        requireIncreasing(index);

        double[] cleaned = new double[n];
        boolean[] missing = new boolean[n];
        int present = 0;
        for (int i = 0; i < n; i++) {
            Double v = raw.get(i);
            missing[i] = v == null || !Double.isFinite(v);
            if (!missing[i]) {
                cleaned[i] = v;
                present++;
            }
        }
        if (present == 0) {
            throw new PreparationException("data_points contains no finite values");
        }
        int filled = fill(cleaned, missing);

        int clamped = 0;
        for (int i = 0; i < n; i++) {
            if (cleaned[i] < 0) {
                if (!policy.clampNegative()) {
                    throw new PreparationException("data_points must be non-negative, found "
                        + cleaned[i] + " at position " + i);
                }
                cleaned[i] = 0.0;
                clamped++;
            }
        }

        log.debug("Series prepared | points={} | filled={} | clamped={} | syntheticDates={}",
                  n, filled, clamped, synthetic);
        return new DemandSeries(index, cleaned, filled, clamped, synthetic);
    }

    private List<LocalDate> syntheticDates(int n) {
        LocalDate end = LocalDate.now(clock);
        return IntStream.range(0, n)
            .mapToObj(i -> end.minusDays(n - 1L - i))
            .toList();
    }

    private static void requireIncreasing(List<LocalDate> dates) {
        for (int i = 1; i < dates.size(); i++) {
            int cmp = dates.get(i).compareTo(dates.get(i - 1));
            if (cmp == 0) {
                throw new PreparationException("Duplicate date " + dates.get(i));
            }
            if (cmp < 0) {
                throw new PreparationException("dates must be strictly increasing, "
                    + dates.get(i) + " follows " + dates.get(i - 1));
            }
        }
    }

    // Forward fill, then backward fill for any leading gap.
    private static int fill(double[] values, boolean[] missing) {
        int filled = 0;
        int firstPresent = -1;
        for (int i = 0; i < values.length; i++) {
            if (!missing[i]) {
                if (firstPresent < 0) {
                    firstPresent = i;
                }
            } else if (firstPresent >= 0) {
                values[i] = values[i - 1];
                filled++;
            }
        }
        for (int i = 0; i < firstPresent; i++) {
            values[i] = values[firstPresent];
            filled++;
        }
        return filled;
    }
}
