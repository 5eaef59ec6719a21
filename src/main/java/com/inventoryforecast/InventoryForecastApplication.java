package com.inventoryforecast;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class InventoryForecastApplication {

    public static void main(String[] args) {
        SpringApplication.run(InventoryForecastApplication.class, args);
    }
}
