package com.inventoryforecast.client;

import com.github.signaflo.timeseries.TimePeriod;
import com.github.signaflo.timeseries.TimeSeries;
import com.github.signaflo.timeseries.TimeUnit;
import com.github.signaflo.timeseries.forecast.Forecast;
import com.github.signaflo.timeseries.model.arima.Arima;
import com.github.signaflo.timeseries.model.arima.ArimaOrder;
import com.inventoryforecast.exception.ModelFitException;
import com.inventoryforecast.model.ArimaConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

@Slf4j
@Component
public class SignafloArimaLibrary implements ArimaLibrary {

    private static final OffsetDateTime ORIGIN = OffsetDateTime.of(2000, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Override
    public FittedArima fit(double[] values, ArimaConfig config) {
        try {
            TimeSeries observations = TimeSeries.from(TimePeriod.oneDay(), ORIGIN, values);
            Arima model;
            if (config.isSeasonal()) {
                ArimaConfig.SeasonalOrder s = config.seasonal();
                ArimaOrder order = ArimaOrder.order(config.p(), config.d(), config.q(), s.p(), s.d(), s.q());
                model = Arima.model(observations, order, new TimePeriod(TimeUnit.DAY, s.period()));
            } else {
                model = Arima.model(observations, ArimaOrder.order(config.p(), config.d(), config.q()));
            }
            log.debug("ARIMA fitted | order={} | aic={}", config, model.aic());
            return new SignafloFittedArima(config, model);
        } catch (RuntimeException e) {
            throw new ModelFitException(config + " estimation failed: " + e.getMessage(), e);
        }
    }

    private record SignafloFittedArima(ArimaConfig config, Arima model) implements FittedArima {

        @Override
        public double aic() {
            return model.aic();
        }

        @Override
        public double logLikelihood() {
            return model.logLikelihood();
        }

        @Override
        public double[] fittedValues() {
            return model.fittedSeries().asArray();
        }

        @Override
        public double[] residuals() {
            return model.predictionErrors().asArray();
        }

        @Override
        public Prediction forecast(int steps, double alpha) {
            Forecast forecast = model.forecast(steps, alpha);
            return new Prediction(
                forecast.pointEstimates().asArray(),
                forecast.lowerPredictionInterval().asArray(),
                forecast.upperPredictionInterval().asArray());
        }

        @Override
        public String summary() {
            return config + " coefficients=" + model.coefficients();
        }
    }
}
