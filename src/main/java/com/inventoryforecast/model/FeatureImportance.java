package com.inventoryforecast.model;

public record FeatureImportance(String feature, double importance) {
}
