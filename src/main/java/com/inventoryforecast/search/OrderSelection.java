package com.inventoryforecast.search;

import com.inventoryforecast.client.FittedArima;

import java.util.List;

/**
 * The winning model of an order search plus the reasons earlier strategies failed.
 */
public record OrderSelection(FittedArima model, String method, boolean fallback,
                             int candidatesEvaluated, List<String> failures) {
}
