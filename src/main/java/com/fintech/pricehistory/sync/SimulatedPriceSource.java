package com.fintech.pricehistory.sync;

import com.fintech.pricehistory.config.PriceHistoryProperties;
import com.fintech.pricehistory.util.DateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Simulated upstream for demos and end-to-end runs.
 *
 * Generates one bar per weekday with a random walk on the close, and with the
 * configured probability replaces a bar with a corrupted one: a zero close,
 * an 11x spike, or a High far above the close. Off unless
 * {@code history.simulation.enabled=true}.
 */
@Component
@ConditionalOnProperty(name = "history.simulation.enabled", havingValue = "true")
public class SimulatedPriceSource implements PriceSource {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPriceSource.class);

    static final double DEFAULT_INITIAL_PRICE = 100.0;
    // Max daily move as a fraction of price
    private static final double DAILY_VOLATILITY = 0.02;
    private static final double SPIKE_MULTIPLIER = 11.0;
    private static final double EXTREME_HIGH_MULTIPLIER = 500.0;

    private final PriceHistoryProperties properties;
    private final Random random;

    @Autowired
    public SimulatedPriceSource(PriceHistoryProperties properties) {
        this(properties, new Random());
    }

    SimulatedPriceSource(PriceHistoryProperties properties, Random random) {
        this.properties = properties;
        this.random = random;
        log.info("Simulated price source enabled: anomalyProbability={}",
            properties.getSimulation().getAnomalyProbability());
    }

    @Override
    public List<RawPriceBar> fetchDailyBars(String instrument, LocalDate from, LocalDate to) {
        double price = properties.getSimulation().getInitialPrices()
            .getOrDefault(instrument, DEFAULT_INITIAL_PRICE);
        double anomalyProbability = properties.getSimulation().getAnomalyProbability();

        List<RawPriceBar> bars = new ArrayList<>();
        int anomalies = 0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            if (day.getDayOfWeek() == DayOfWeek.SATURDAY || day.getDayOfWeek() == DayOfWeek.SUNDAY) {
                continue;
            }
            double open = price;
            double close = Math.max(0.01, open * (1 + (random.nextDouble() * 2 - 1) * DAILY_VOLATILITY));
            double high = Math.max(open, close) * (1 + random.nextDouble() * DAILY_VOLATILITY / 2);
            double low = Math.min(open, close) * (1 - random.nextDouble() * DAILY_VOLATILITY / 2);
            long volume = 100_000L + random.nextInt(900_000);
            long timestamp = DateCodec.toEpochSecond(day);

            if (random.nextDouble() < anomalyProbability) {
                bars.add(corrupt(timestamp, open, high, low, close, volume));
                anomalies++;
            } else {
                bars.add(new RawPriceBar(timestamp, open, high, low, close, volume));
            }
            price = close;
        }

        log.debug("Simulated bars: instrument={}, from={}, to={}, bars={}, anomalies={}",
            instrument, from, to, bars.size(), anomalies);
        return bars;
    }

    private RawPriceBar corrupt(long timestamp, double open, double high, double low, double close, long volume) {
        double spike = close * SPIKE_MULTIPLIER;
        return switch (random.nextInt(3)) {
            case 0 -> new RawPriceBar(timestamp, open, high, low, 0.0, volume);
            case 1 -> new RawPriceBar(timestamp, spike, spike, spike, spike, volume);
            default -> new RawPriceBar(timestamp, open, close * EXTREME_HIGH_MULTIPLIER, low, close, volume);
        };
    }
}
