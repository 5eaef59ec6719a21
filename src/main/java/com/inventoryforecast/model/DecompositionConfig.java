package com.inventoryforecast.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class DecompositionConfig {

    @Builder.Default
    boolean yearlySeasonality = true;

    @Builder.Default
    boolean weeklySeasonality = true;

    @Builder.Default
    boolean dailySeasonality = false;

    @Builder.Default
    SeasonalityMode seasonalityMode = SeasonalityMode.MULTIPLICATIVE;

    @Builder.Default
    double seasonalityPriorScale = 10.0;

    @Builder.Default
    double holidaysPriorScale = 10.0;

    @Builder.Default
    double changepointPriorScale = 0.05;

    @Builder.Default
    double changepointRange = 0.8;

    @Builder.Default
    int maxChangepoints = 25;

    @Builder.Default
    double intervalWidth = 0.80;

    @Builder.Default
    String growth = "linear";

    @Singular
    List<CustomSeasonality> customSeasonalities;

    @Singular
    List<HolidayWindow> holidays;

    public static DecompositionConfig defaults() {
        return DecompositionConfig.builder()
            .customSeasonality(new CustomSeasonality("ramadan_effect", 355, 3, 5.0))
            .customSeasonality(new CustomSeasonality("monthly_payday", 30.5, 5, 8.0))
            .holidays(RegionalHolidayCalendar.holidays())
            .build();
    }
}
