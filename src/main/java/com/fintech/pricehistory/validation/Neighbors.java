package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;

import java.util.Objects;
import java.util.Optional;

/**
 * The nearest trusted candles on either side of a flagged one.
 */
public record Neighbors(Optional<DailyCandle> before, Optional<DailyCandle> after) {

    public Neighbors {
        Objects.requireNonNull(before, "Before cannot be null");
        Objects.requireNonNull(after, "After cannot be null");
    }

    public static Neighbors none() {
        return new Neighbors(Optional.empty(), Optional.empty());
    }

    public static Neighbors of(DailyCandle before, DailyCandle after) {
        return new Neighbors(Optional.ofNullable(before), Optional.ofNullable(after));
    }
}
