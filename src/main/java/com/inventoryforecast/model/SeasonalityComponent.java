package com.inventoryforecast.model;

public record SeasonalityComponent(String name, double period, int fourierOrder, SeasonalityMode mode) {
}
