package com.inventoryforecast.model;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Stream;

public final class RegionalHolidayCalendar {

    public static final String HOLIDAY_NAME = "regional_holiday";

    private static final List<String> DATES = List.of(
        // 2024
        "2024-01-01", "2024-02-08", "2024-02-09", "2024-02-10", "2024-03-11", "2024-03-29",
        "2024-04-10", "2024-04-11", "2024-05-01", "2024-05-09", "2024-05-23", "2024-06-01",
        "2024-06-17", "2024-08-17", "2024-09-16", "2024-11-25", "2024-12-25",
        // 2025
        "2025-01-01", "2025-01-29", "2025-01-30", "2025-02-14", "2025-03-14", "2025-03-31",
        "2025-04-01", "2025-04-18", "2025-05-01", "2025-05-12", "2025-05-29", "2025-06-01",
        "2025-06-07", "2025-08-17", "2025-09-05", "2025-11-14", "2025-12-25");

    private RegionalHolidayCalendar() {
    }

    public static List<HolidayWindow> holidays() {
        return DATES.stream()
            .map(LocalDate::parse)
            .map(date -> new HolidayWindow(HOLIDAY_NAME, date, 0, 1))
            .toList();
    }

    public static Stream<LocalDate> dates() {
        return DATES.stream().map(LocalDate::parse);
    }
}
