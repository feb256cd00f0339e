package com.fintech.pricehistory.storage;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.MonthlyAggregate;

import java.util.List;

/**
 * Persistence boundary for raw daily candles and their monthly aggregates.
 * Implementations must apply each write method as a single atomic unit and
 * report failures as {@link PriceStorageException}.
 */
public interface PriceHistoryRepository {

    /**
     * Upserts every candle keyed by (instrument, date) and replaces the aggregate row
     * of every month in {@code aggregates}, in one transaction.
     *
     * @param instrument Normalized instrument identifier
     * @param candles Raw candles; a date already stored is overwritten
     * @param aggregates Monthly aggregates to store; other months are left alone
     */
    void upsertHistory(String instrument, List<DailyCandle> candles, List<MonthlyAggregate> aggregates);

    /**
     * @return All raw candles of the instrument, oldest first; empty if none
     */
    List<DailyCandle> findAllDaily(String instrument);

    /**
     * @param limit Maximum number of months, 0 for all
     * @return Monthly aggregates, newest month first
     */
    List<MonthlyAggregate> findMonthly(String instrument, int limit);

    boolean hasMonthly(String instrument);

    /**
     * Removes every raw and monthly row of the instrument in one transaction.
     */
    DeletedRows deleteAll(String instrument);

    record DeletedRows(long daily, long monthly) {
    }
}
