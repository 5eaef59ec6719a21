package com.inventoryforecast.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.inventoryforecast.model.FeatureImportance;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FeatureAnalysis {
    boolean                                success;
    int                                    totalFeatures;
    Map<String, List<FeatureImportance>>   featureCategories;
    List<FeatureImportance>                topFeatures;
}
