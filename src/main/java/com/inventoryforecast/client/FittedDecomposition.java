package com.inventoryforecast.client;

import com.inventoryforecast.model.DecompositionPoint;
import com.inventoryforecast.model.SeasonalityComponent;
import com.inventoryforecast.model.TrendChangepoint;

import java.time.LocalDate;
import java.util.List;

public interface FittedDecomposition {

    List<DecompositionPoint> predict(List<LocalDate> dates);

    List<TrendChangepoint> changepoints();

    List<SeasonalityComponent> seasonalities();
}
