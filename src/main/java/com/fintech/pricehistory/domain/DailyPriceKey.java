package com.fintech.pricehistory.domain;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Composite key for one stored daily candle: (instrument, date).
 */
public record DailyPriceKey(
    String instrument,
    LocalDate date
) {

    private static final char SEPARATOR = '_';

    public DailyPriceKey {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(date, "Date cannot be null");
    }

    /**
     * Creates a string form suitable as a primary key.
     * Format: "INSTRUMENT_YYYY-MM-DD"
     */
    public String toStringKey() {
        return instrument + SEPARATOR + date;
    }
}
