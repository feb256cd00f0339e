package com.fintech.pricehistory.service;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups filtered daily candles by calendar month and averages their closes.
 */
@Component
public class MonthlyAggregator {

    private final Clock clock;

    public MonthlyAggregator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @param instrument Normalized instrument identifier
     * @param filtered Candles that passed the exclusion filter
     * @return One aggregate per touched month, oldest month first
     */
    public List<MonthlyAggregate> aggregate(String instrument, List<DailyCandle> filtered) {
        Map<YearMonth, double[]> sums = new TreeMap<>();
        for (DailyCandle candle : filtered) {
            // [sumClose, sumAdjustedClose, count]
            double[] bucket = sums.computeIfAbsent(YearMonth.from(candle.date()), k -> new double[3]);
            bucket[0] += candle.close();
            bucket[1] += candle.adjustedCloseOrClose();
            bucket[2]++;
        }

        Instant createdAt = Instant.now(clock);
        List<MonthlyAggregate> aggregates = new ArrayList<>(sums.size());
        sums.forEach((month, bucket) -> aggregates.add(new MonthlyAggregate(
            instrument,
            month,
            bucket[0] / bucket[2],
            bucket[1] / bucket[2],
            MonthlyAggregate.SOURCE_CALCULATED,
            createdAt
        )));
        return aggregates;
    }
}
