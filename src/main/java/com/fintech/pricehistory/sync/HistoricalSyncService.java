package com.fintech.pricehistory.sync;

import com.fintech.pricehistory.config.PriceHistoryProperties;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.InstrumentIds;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import com.fintech.pricehistory.service.PriceHistoryStore;
import com.fintech.pricehistory.util.DateCodec;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Pulls daily bars from the upstream {@link PriceSource} and hands them to the store.
 *
 * An instrument without monthly aggregates gets a long initial backfill window,
 * otherwise a short incremental one. Upstream calls go through the "price-source"
 * circuit breaker; an open breaker fails the current instrument only.
 */
@Service
public class HistoricalSyncService {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSyncService.class);

    public static final String CIRCUIT_BREAKER_NAME = "price-source";

    private final PriceHistoryStore store;
    private final ObjectProvider<PriceSource> priceSource;
    private final PriceHistoryProperties properties;
    private final CircuitBreaker circuitBreaker;
    private final Clock clock;

    public HistoricalSyncService(
            PriceHistoryStore store,
            ObjectProvider<PriceSource> priceSource,
            PriceHistoryProperties properties,
            CircuitBreakerRegistry circuitBreakerRegistry,
            Clock clock) {
        this.store = store;
        this.priceSource = priceSource;
        this.properties = properties;
        this.circuitBreaker = circuitBreakerRegistry.circuitBreaker(CIRCUIT_BREAKER_NAME);
        this.clock = clock;

        circuitBreaker.getEventPublisher()
            .onStateTransition(event ->
                log.warn("Price source circuit breaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState())
            );
    }

    /**
     * Syncs one instrument.
     *
     * @throws SyncException if the source or the store fails
     */
    public SyncOutcome syncInstrument(String instrument) {
        String id = InstrumentIds.normalize(instrument);
        PriceSource source = priceSource.getIfAvailable();
        if (source == null) {
            throw new SyncException(id, "No price source configured", null);
        }

        boolean initial;
        try {
            initial = !store.hasMonthlyData(id);
        } catch (PriceHistoryStore.StoreException e) {
            throw new SyncException(id, "Could not determine sync window", e);
        }

        LocalDate to = LocalDate.now(clock);
        int years = initial
            ? properties.getSync().getInitialPeriodYears()
            : properties.getSync().getIncrementalPeriodYears();
        LocalDate from = to.minusYears(years);

        List<RawPriceBar> bars;
        try {
            bars = circuitBreaker.executeSupplier(() -> source.fetchDailyBars(id, from, to));
        } catch (RuntimeException e) {
            throw new SyncException(id, "Price source request failed", e);
        }

        if (bars == null || bars.isEmpty()) {
            log.warn("Price source returned no bars: instrument={}, from={}, to={}", id, from, to);
            return new SyncOutcome(id, from, to, initial, 0, 0, 0);
        }

        List<DailyCandle> candles = toCandles(id, bars);
        List<MonthlyAggregate> aggregates;
        try {
            aggregates = store.sync(id, candles);
        } catch (PriceHistoryStore.StoreException e) {
            throw new SyncException(id, "Store sync failed", e);
        }

        log.info("Historical sync complete: instrument={}, window={}..{}, initial={}, bars={}, accepted={}, months={}",
            id, from, to, initial, bars.size(), candles.size(), aggregates.size());
        return new SyncOutcome(id, from, to, initial, bars.size(), candles.size(), aggregates.size());
    }

    /**
     * Syncs each instrument in turn. A failure is logged and the next instrument proceeds.
     *
     * @return Outcomes of the instruments that synced
     */
    public List<SyncOutcome> syncAll(List<String> instruments) {
        List<SyncOutcome> outcomes = new ArrayList<>();
        long delayMs = properties.getSync().getRateLimitDelayMs();

        for (int i = 0; i < instruments.size(); i++) {
            String instrument = instruments.get(i);
            try {
                outcomes.add(syncInstrument(instrument));
            } catch (SyncException | IllegalArgumentException e) {
                log.error("Historical sync failed: instrument={}", instrument, e);
            }

            if (delayMs > 0 && i < instruments.size() - 1) {
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.warn("Historical sync interrupted after {} of {} instruments", i + 1, instruments.size());
                    break;
                }
            }
        }
        return outcomes;
    }

    private List<DailyCandle> toCandles(String instrument, List<RawPriceBar> bars) {
        List<DailyCandle> candles = new ArrayList<>(bars.size());
        for (RawPriceBar bar : bars) {
            try {
                candles.add(new DailyCandle(
                    DateCodec.fromEpochSecond(bar.timestamp()),
                    bar.open(),
                    bar.high(),
                    bar.low(),
                    bar.close(),
                    bar.volume(),
                    null
                ));
            } catch (RuntimeException e) {
                log.warn("Skipping malformed bar: instrument={}, timestamp={}, error={}",
                    instrument, bar.timestamp(), e.getMessage());
            }
        }
        return candles;
    }

    /**
     * Result of one instrument sync.
     *
     * @param initial true when the long backfill window was used
     * @param fetched Bars returned by the source
     * @param accepted Bars converted to candles and stored
     * @param months Monthly aggregates written
     */
    public record SyncOutcome(
        String instrument,
        LocalDate from,
        LocalDate to,
        boolean initial,
        int fetched,
        int accepted,
        int months
    ) {
    }

    /**
     * Sync failure for one instrument (upstream or store).
     */
    public static class SyncException extends RuntimeException {

        private final String instrument;

        public SyncException(String instrument, String message, Throwable cause) {
            super(message + ": instrument=" + instrument, cause);
            this.instrument = instrument;
        }

        public String getInstrument() {
            return instrument;
        }
    }
}
