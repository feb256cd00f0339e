package com.fintech.pricehistory.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    /**
     * Source of "today" for recent-window reads and aggregate timestamps.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
