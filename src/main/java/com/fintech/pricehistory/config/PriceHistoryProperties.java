package com.fintech.pricehistory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized configuration for the price history service.
 * Maps to 'history.*' properties in application.yml.
 * Validation thresholds are constants, not configuration.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "history")
public class PriceHistoryProperties {

    private Sync sync = new Sync();
    private Simulation simulation = new Simulation();

    @Data
    public static class Sync {
        private int initialPeriodYears = 10;
        private int incrementalPeriodYears = 1;
        private long rateLimitDelayMs = 0L;
        private List<String> instruments = new ArrayList<>();
        private boolean jobEnabled = false;
        private String cron = "0 30 22 * * MON-FRI";
    }

    @Data
    public static class Simulation {
        private boolean enabled = false;
        private double anomalyProbability = 0.02;
        private Map<String, Double> initialPrices = new LinkedHashMap<>();
    }
}
