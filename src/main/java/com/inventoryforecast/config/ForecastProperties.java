package com.inventoryforecast.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "forecast")
public class ForecastProperties {

    private double defaultConfidenceLevel = 0.95;
    private double validationFraction = 0.2;
    private Arima arima = new Arima();
    private Decomposition decomposition = new Decomposition();
    private Tree tree = new Tree();

    @Data
    public static class Arima {
        private int minDataPoints = 10;
        private int defaultSteps = 30;
        private int defaultSeasonalPeriod = 7;
        private boolean autoSelection = true;
        private int maxP = 3;
        private int maxQ = 3;
        private int maxD = 2;
    }

    @Data
    public static class Decomposition {
        private int minDataPoints = 10;
        private int defaultSteps = 30;
        private int crossValidationThreshold = 30;
        private int cvInitialDays = 15;
        private int cvPeriodDays = 7;
        private int cvHorizonDays = 7;
    }

    @Data
    public static class Tree {
        private int minDataPoints = 15;
        private int defaultSteps = 1;
        private int optimizationThreshold = 30;
        private int cvFolds = 3;
        private int threads = 1;
        private double intervalFraction = 0.15;
    }
}
