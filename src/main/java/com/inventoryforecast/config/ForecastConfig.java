package com.inventoryforecast.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ForecastConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
