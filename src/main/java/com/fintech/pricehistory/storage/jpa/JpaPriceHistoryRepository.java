package com.fintech.pricehistory.storage.jpa;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.DailyPriceKey;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import com.fintech.pricehistory.storage.PriceHistoryRepository;
import com.fintech.pricehistory.storage.PriceStorageException;
import com.fintech.pricehistory.util.DateCodec;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Relational implementation of {@link PriceHistoryRepository} on Spring Data JPA.
 *
 * Upserts rely on the composite string ids: saving an entity whose id already exists
 * merges it, so re-syncing a date overwrites the stored row instead of duplicating it.
 * Writes are flushed inside the transaction so constraint violations surface here and
 * are wrapped with the operation and instrument.
 */
@Repository
public class JpaPriceHistoryRepository implements PriceHistoryRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaPriceHistoryRepository.class);

    private final DailyPriceJpaRepository dailyRepository;
    private final MonthlyPriceJpaRepository monthlyRepository;
    private final Timer syncTimer;
    private final Timer readTimer;

    public JpaPriceHistoryRepository(
            DailyPriceJpaRepository dailyRepository,
            MonthlyPriceJpaRepository monthlyRepository,
            MeterRegistry meterRegistry) {
        this.dailyRepository = dailyRepository;
        this.monthlyRepository = monthlyRepository;
        this.syncTimer = meterRegistry.timer("history.store.sync.latency");
        this.readTimer = meterRegistry.timer("history.store.read.latency");

        log.info("JPA price history repository initialized");
    }

    @Override
    @Transactional
    public void upsertHistory(String instrument, List<DailyCandle> candles, List<MonthlyAggregate> aggregates) {
        syncTimer.record(() -> {
            try {
                dailyRepository.saveAll(candles.stream()
                    .map(candle -> toEntity(instrument, candle))
                    .collect(Collectors.toList()));
                monthlyRepository.saveAll(aggregates.stream()
                    .map(this::toEntity)
                    .collect(Collectors.toList()));
                dailyRepository.flush();
                monthlyRepository.flush();

                if (log.isDebugEnabled()) {
                    log.debug("Upserted history: instrument={}, daily={}, monthly={}",
                        instrument, candles.size(), aggregates.size());
                }
            } catch (RuntimeException e) {
                log.error("Failed to upsert history: instrument={}, daily={}, monthly={}",
                    instrument, candles.size(), aggregates.size(), e);
                throw new PriceStorageException("upsert", instrument, e);
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<DailyCandle> findAllDaily(String instrument) {
        return readTimer.record(() -> {
            try {
                return dailyRepository.findByIsinOrderByTradeDateAsc(instrument).stream()
                    .map(this::fromEntity)
                    .collect(Collectors.toList());
            } catch (RuntimeException e) {
                log.error("Failed to read daily prices: instrument={}", instrument, e);
                throw new PriceStorageException("read-daily", instrument, e);
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<MonthlyAggregate> findMonthly(String instrument, int limit) {
        return readTimer.record(() -> {
            try {
                Pageable page = limit > 0 ? PageRequest.of(0, limit) : Pageable.unpaged();
                return monthlyRepository.findByIsinOrderByYearMonthDesc(instrument, page).stream()
                    .map(this::fromEntity)
                    .collect(Collectors.toList());
            } catch (RuntimeException e) {
                log.error("Failed to read monthly prices: instrument={}", instrument, e);
                throw new PriceStorageException("read-monthly", instrument, e);
            }
        });
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasMonthly(String instrument) {
        try {
            return monthlyRepository.existsByIsin(instrument);
        } catch (RuntimeException e) {
            log.error("Failed to check monthly prices: instrument={}", instrument, e);
            throw new PriceStorageException("has-monthly", instrument, e);
        }
    }

    @Override
    @Transactional
    public DeletedRows deleteAll(String instrument) {
        try {
            long daily = dailyRepository.deleteByIsin(instrument);
            long monthly = monthlyRepository.deleteByIsin(instrument);
            log.info("Deleted price history: instrument={}, daily={}, monthly={}", instrument, daily, monthly);
            return new DeletedRows(daily, monthly);
        } catch (RuntimeException e) {
            log.error("Failed to delete price history: instrument={}", instrument, e);
            throw new PriceStorageException("delete", instrument, e);
        }
    }

    private DailyPriceEntity toEntity(String instrument, DailyCandle candle) {
        return DailyPriceEntity.builder()
            .id(new DailyPriceKey(instrument, candle.date()).toStringKey())
            .isin(instrument)
            .tradeDate(DateCodec.toEpochSecond(candle.date()))
            .open(candle.open())
            .high(candle.high())
            .low(candle.low())
            .close(candle.close())
            .volume(candle.volume())
            .adjustedClose(candle.adjustedClose())
            .updatedAt(System.currentTimeMillis())
            .build();
    }

    private DailyCandle fromEntity(DailyPriceEntity entity) {
        return new DailyCandle(
            DateCodec.fromEpochSecond(entity.getTradeDate()),
            entity.getOpen(),
            entity.getHigh(),
            entity.getLow(),
            entity.getClose(),
            entity.getVolume(),
            entity.getAdjustedClose()
        );
    }

    private MonthlyPriceEntity toEntity(MonthlyAggregate aggregate) {
        String yearMonth = aggregate.yearMonth().toString();
        return MonthlyPriceEntity.builder()
            .id(MonthlyPriceEntity.generateId(aggregate.instrument(), yearMonth))
            .isin(aggregate.instrument())
            .yearMonth(yearMonth)
            .avgClose(aggregate.avgClose())
            .avgAdjClose(aggregate.avgAdjustedClose())
            .source(aggregate.source())
            .createdAt(aggregate.createdAt().toEpochMilli())
            .build();
    }

    private MonthlyAggregate fromEntity(MonthlyPriceEntity entity) {
        return new MonthlyAggregate(
            entity.getIsin(),
            YearMonth.parse(entity.getYearMonth()),
            entity.getAvgClose(),
            entity.getAvgAdjClose(),
            entity.getSource(),
            Instant.ofEpochMilli(entity.getCreatedAt())
        );
    }
}
