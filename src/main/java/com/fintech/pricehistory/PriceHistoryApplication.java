package com.fintech.pricehistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Price History Service
 *
 * Stores daily OHLCV candles per instrument, serves an anomaly-filtered view of them,
 * keeps monthly close averages, and can rebuild a complete series by repairing
 * corrupted candles from their neighbours.
 *
 * @since 1.0.0
 */
@SpringBootApplication
@EnableScheduling
public class PriceHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(PriceHistoryApplication.class, args);
    }
}
