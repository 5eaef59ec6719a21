package com.inventoryforecast.backend;

import com.inventoryforecast.dto.BusinessContext;
import com.inventoryforecast.dto.DataQuality;
import com.inventoryforecast.dto.DiagnosticsReport;
import com.inventoryforecast.dto.FeatureAnalysis;
import com.inventoryforecast.dto.TrendAnalysis;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything a backend contributes to a success envelope besides the forecast points.
 */
@Value
@Builder
public class BackendReport {
    DataQuality       dataQuality;
    DiagnosticsReport diagnostics;
    TrendAnalysis     trendAnalysis;
    FeatureAnalysis   featureAnalysis;
    BusinessContext   businessContext;
    List<String>      recommendations;
    List<String>      forecastComponents;
}
