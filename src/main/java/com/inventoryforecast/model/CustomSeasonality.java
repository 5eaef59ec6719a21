package com.inventoryforecast.model;

public record CustomSeasonality(String name, double period, int fourierOrder, double priorScale) {
}
