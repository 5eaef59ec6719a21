package com.inventoryforecast.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SeasonalityMode {
    ADDITIVE,
    MULTIPLICATIVE;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SeasonalityMode fromLabel(String label) {
        return valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
