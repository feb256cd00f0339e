package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

import static com.fintech.pricehistory.validation.PriceThresholds.CONTEXT_WINDOW_DAYS;

/**
 * The single construction rule for the average-price context used by both the
 * validator and the filter: the most recent prior closes, newest first, and an
 * average only once a full window of {@value PriceThresholds#CONTEXT_WINDOW_DAYS}
 * entries exists.
 */
public final class ContextWindow {

    private ContextWindow() {
    }

    /**
     * Builds a newest-first window from a chronological sequence of accepted candles.
     *
     * @param chronological candles ordered oldest first
     * @return up to {@value PriceThresholds#CONTEXT_WINDOW_DAYS} candles, newest first
     */
    public static List<DailyCandle> newestFirst(List<DailyCandle> chronological) {
        int size = Math.min(chronological.size(), CONTEXT_WINDOW_DAYS);
        List<DailyCandle> window = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            window.add(chronological.get(chronological.size() - 1 - i));
        }
        return window;
    }

    /**
     * Builds a newest-first window from accepted candles, topped up with older history
     * while fewer than {@value PriceThresholds#CONTEXT_WINDOW_DAYS} are accepted.
     *
     * @param chronological accepted candles ordered oldest first
     * @param olderNewestFirst history preceding every accepted candle, newest first
     * @return up to {@value PriceThresholds#CONTEXT_WINDOW_DAYS} candles, newest first
     */
    public static List<DailyCandle> newestFirst(List<DailyCandle> chronological, List<DailyCandle> olderNewestFirst) {
        List<DailyCandle> window = newestFirst(chronological);
        for (int i = 0; window.size() < CONTEXT_WINDOW_DAYS && i < olderNewestFirst.size(); i++) {
            window.add(olderNewestFirst.get(i));
        }
        return window;
    }

    /**
     * Mean close of the first {@value PriceThresholds#CONTEXT_WINDOW_DAYS} entries
     * of a newest-first context.
     *
     * @return empty when the context holds fewer entries than a full window
     */
    public static OptionalDouble averageClose(List<DailyCandle> newestFirst) {
        if (newestFirst == null || newestFirst.size() < CONTEXT_WINDOW_DAYS) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (int i = 0; i < CONTEXT_WINDOW_DAYS; i++) {
            sum += newestFirst.get(i).close();
        }
        return OptionalDouble.of(sum / CONTEXT_WINDOW_DAYS);
    }
}
