package com.fintech.pricehistory.sync;

import java.time.LocalDate;
import java.util.List;

/**
 * Upstream supplier of daily bars (broker or market data API).
 * Implementations may fail with any runtime exception; callers treat the call as remote.
 */
public interface PriceSource {

    /**
     * @param instrument Normalized instrument identifier
     * @param from First day, inclusive
     * @param to Last day, inclusive
     * @return Bars in any order; empty when the source has nothing for the range
     */
    List<RawPriceBar> fetchDailyBars(String instrument, LocalDate from, LocalDate to);
}
