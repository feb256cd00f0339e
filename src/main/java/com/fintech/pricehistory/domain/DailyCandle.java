package com.fintech.pricehistory.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * One day of OHLCV data for an instrument, exactly as received from upstream.
 * Unlike a validated candle, OHLC consistency is NOT enforced here: corrupted
 * candles must be representable so the validator and filter can judge them.
 * The instrument identifier is carried by the store key, not by the candle.
 *
 * @param date Trading day (no time-of-day)
 * @param open Opening price
 * @param high Highest price of the day
 * @param low Lowest price of the day
 * @param close Closing price, the anchor for every validity rule
 * @param volume Traded volume, null when the source did not report it
 * @param adjustedClose Split/dividend adjusted close, null when not supplied
 */
public record DailyCandle(
    LocalDate date,
    double open,
    double high,
    double low,
    double close,
    Long volume,
    Double adjustedClose
) {

    /**
     * Rejects values that cannot come from a well-formed source record.
     * Zero and negative prices are allowed; they are data-quality decisions.
     */
    public DailyCandle {
        Objects.requireNonNull(date, "Date cannot be null");
        requireFinite("open", open);
        requireFinite("high", high);
        requireFinite("low", low);
        requireFinite("close", close);
        if (adjustedClose != null) {
            requireFinite("adjustedClose", adjustedClose);
        }
    }

    /** Creates a candle without volume or adjusted close. */
    public static DailyCandle of(LocalDate date, double open, double high, double low, double close) {
        return new DailyCandle(date, open, high, low, close, null, null);
    }

    /** Returns the adjusted close, falling back to close when none was supplied. */
    public double adjustedCloseOrClose() {
        return adjustedClose != null ? adjustedClose : close;
    }

    private static void requireFinite(String field, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(field + " must be a finite number, got " + value);
        }
    }
}
