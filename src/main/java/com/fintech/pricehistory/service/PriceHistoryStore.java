package com.fintech.pricehistory.service;

import com.fintech.pricehistory.cache.FilteredPriceCache;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.InstrumentIds;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import com.fintech.pricehistory.filter.AnomalyFilter;
import com.fintech.pricehistory.storage.PriceHistoryRepository;
import com.fintech.pricehistory.validation.ContextWindow;
import com.fintech.pricehistory.validation.PriceRepairService;
import com.fintech.pricehistory.validation.RepairResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Entry point for reading and writing daily price history.
 *
 * Reads serve the filtered series from {@link FilteredPriceCache}, loading and filtering
 * the raw rows on a miss. A cached series stays authoritative until the next successful
 * sync or an explicit invalidation; out-of-band writes to storage are not observed.
 *
 * Persistence failures surface as {@link StoreException} and never touch the cache, so
 * readers keep seeing the last successfully committed state.
 *
 * Instrument identifiers are trimmed and upper-cased before use.
 */
@Service
public class PriceHistoryStore {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryStore.class);

    private final PriceHistoryRepository repository;
    private final FilteredPriceCache cache;
    private final AnomalyFilter anomalyFilter;
    private final MonthlyAggregator monthlyAggregator;
    private final PriceRepairService repairService;
    private final Clock clock;

    private final Counter cacheHits;
    private final Counter cacheMisses;

    public PriceHistoryStore(
            PriceHistoryRepository repository,
            FilteredPriceCache cache,
            AnomalyFilter anomalyFilter,
            MonthlyAggregator monthlyAggregator,
            PriceRepairService repairService,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.repository = repository;
        this.cache = cache;
        this.anomalyFilter = anomalyFilter;
        this.monthlyAggregator = monthlyAggregator;
        this.repairService = repairService;
        this.clock = clock;

        this.cacheHits = meterRegistry.counter("history.cache.hits");
        this.cacheMisses = meterRegistry.counter("history.cache.misses");
        meterRegistry.gauge("history.cache.instruments", cache, FilteredPriceCache::size);
    }

    /**
     * Filtered daily candles, newest first.
     *
     * @param limit Maximum number of candles, 0 for all
     */
    public List<DailyCandle> getDaily(String instrument, int limit) {
        String id = InstrumentIds.normalize(instrument);
        List<DailyCandle> series = loadFiltered(id);
        if (limit > 0 && limit < series.size()) {
            return List.copyOf(series.subList(0, limit));
        }
        return series;
    }

    /**
     * Filtered daily candles dated within [today - days, today], newest first.
     * Returns an empty list when {@code days} is not positive.
     */
    public List<DailyCandle> getRecent(String instrument, int days) {
        String id = InstrumentIds.normalize(instrument);
        if (days <= 0) {
            return List.of();
        }
        LocalDate today = LocalDate.now(clock);
        LocalDate from = today.minusDays(days);
        return loadFiltered(id).stream()
            .filter(c -> !c.date().isBefore(from) && !c.date().isAfter(today))
            .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Stored monthly aggregates, newest month first. Not cached.
     *
     * @param limit Maximum number of months, 0 for all
     */
    public List<MonthlyAggregate> getMonthly(String instrument, int limit) {
        String id = InstrumentIds.normalize(instrument);
        try {
            return repository.findMonthly(id, Math.max(limit, 0));
        } catch (RuntimeException e) {
            throw new StoreException("get-monthly", id, e);
        }
    }

    /**
     * Complete series for the most recent {@code limit} stored days with every anomaly
     * repaired instead of dropped. The context is the filtered history that precedes
     * the window.
     *
     * @param limit Number of most recent raw candles to repair, 0 for all
     */
    public RepairResult getRepairedDaily(String instrument, int limit) {
        String id = InstrumentIds.normalize(instrument);
        List<DailyCandle> raw = readRaw(id, "get-repaired-daily");
        int start = limit > 0 ? Math.max(0, raw.size() - limit) : 0;
        List<DailyCandle> context = ContextWindow.newestFirst(anomalyFilter.filter(raw.subList(0, start)));
        return repairService.validateAndInterpolate(raw.subList(start, raw.size()), context);
    }

    /**
     * Upserts a batch of raw candles and replaces the monthly aggregates of every month
     * the batch touches, computed from its filtered subset. Both writes commit together.
     * On success the instrument's cache entry is invalidated; on failure it is left alone.
     *
     * Candles sharing a date are collapsed, the last one wins.
     *
     * @return Aggregates written
     * @throws StoreException when persistence fails
     */
    public List<MonthlyAggregate> sync(String instrument, List<DailyCandle> candles) {
        String id = InstrumentIds.normalize(instrument);
        if (candles == null || candles.isEmpty()) {
            log.debug("Nothing to sync: instrument={}", id);
            return List.of();
        }

        List<DailyCandle> batch = dedupeByDate(candles);
        List<DailyCandle> filtered = anomalyFilter.filter(batch);
        List<MonthlyAggregate> aggregates = monthlyAggregator.aggregate(id, filtered);

        try {
            repository.upsertHistory(id, batch, aggregates);
        } catch (RuntimeException e) {
            throw new StoreException("sync", id, e);
        }

        cache.invalidate(id);
        log.info("Synced price history: instrument={}, daily={}, filtered={}, monthly={}",
            id, batch.size(), filtered.size(), aggregates.size());
        return aggregates;
    }

    public boolean hasMonthlyData(String instrument) {
        String id = InstrumentIds.normalize(instrument);
        try {
            return repository.hasMonthly(id);
        } catch (RuntimeException e) {
            throw new StoreException("has-monthly-data", id, e);
        }
    }

    public void invalidateCache(String instrument) {
        cache.invalidate(InstrumentIds.normalize(instrument));
    }

    public void invalidateAllCaches() {
        cache.invalidateAll();
        log.info("Invalidated all cached price series");
    }

    /**
     * Removes all raw and monthly rows of the instrument, then evicts its cache entry.
     * Deleting an unknown instrument is a no-op.
     */
    public PriceHistoryRepository.DeletedRows deletePricesForSecurity(String instrument) {
        String id = InstrumentIds.normalize(instrument);
        PriceHistoryRepository.DeletedRows deleted;
        try {
            deleted = repository.deleteAll(id);
        } catch (RuntimeException e) {
            throw new StoreException("delete", id, e);
        }
        cache.invalidate(id);
        return deleted;
    }

    private List<DailyCandle> loadFiltered(String id) {
        Optional<List<DailyCandle>> cached = cache.get(id);
        if (cached.isPresent()) {
            cacheHits.increment();
            return cached.get();
        }
        cacheMisses.increment();

        FilteredPriceCache.Ticket ticket = cache.ticket(id);
        List<DailyCandle> newestFirst = new ArrayList<>(anomalyFilter.filter(readRaw(id, "get-daily")));
        newestFirst.sort(Comparator.comparing(DailyCandle::date).reversed());
        List<DailyCandle> series = List.copyOf(newestFirst);

        if (cache.putIfUnchanged(ticket, series)) {
            log.debug("Cached filtered series: instrument={}, candles={}", id, series.size());
        }
        return series;
    }

    private List<DailyCandle> readRaw(String id, String operation) {
        try {
            return repository.findAllDaily(id);
        } catch (RuntimeException e) {
            throw new StoreException(operation, id, e);
        }
    }

    private static List<DailyCandle> dedupeByDate(List<DailyCandle> candles) {
        Map<LocalDate, DailyCandle> byDate = new LinkedHashMap<>();
        for (DailyCandle candle : candles) {
            byDate.put(candle.date(), candle);
        }
        List<DailyCandle> batch = new ArrayList<>(byDate.values());
        batch.sort(Comparator.comparing(DailyCandle::date));
        return batch;
    }

    /**
     * Store layer exception carrying the failed operation and instrument, so callers can retry.
     */
    public static class StoreException extends RuntimeException {

        private final String operation;
        private final String instrument;

        public StoreException(String operation, String instrument, Throwable cause) {
            super(String.format("Price history %s failed for instrument %s", operation, instrument), cause);
            this.operation = operation;
            this.instrument = instrument;
        }

        public String getOperation() {
            return operation;
        }

        public String getInstrument() {
            return instrument;
        }
    }
}
