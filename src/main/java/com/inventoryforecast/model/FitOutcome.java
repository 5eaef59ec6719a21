package com.inventoryforecast.model;

import com.inventoryforecast.exception.ModelFitException;

public record FitOutcome<M>(M model, String error, boolean fallbackUsed) {

    public static <M> FitOutcome<M> success(M model) {
        return new FitOutcome<>(model, null, false);
    }

    public static <M> FitOutcome<M> failure(ModelFitException cause) {
        return new FitOutcome<>(null, cause.getMessage(), true);
    }

    public boolean isSuccess() {
        return model != null;
    }
}
