package com.inventoryforecast.search;

import com.inventoryforecast.client.FittedArima;

/**
 * Result of one order selection strategy: a fitted model, or the reason the strategy gave up.
 */
public record SelectionAttempt(String method, FittedArima model, boolean fallback,
                               int candidatesEvaluated, String error) {

    public static SelectionAttempt selected(String method, FittedArima model, boolean fallback,
                                            int candidatesEvaluated) {
        return new SelectionAttempt(method, model, fallback, candidatesEvaluated, null);
    }

    public static SelectionAttempt failed(String method, int candidatesEvaluated, String error) {
        return new SelectionAttempt(method, null, false, candidatesEvaluated, error);
    }

    public boolean isSuccess() {
        return model != null;
    }
}
