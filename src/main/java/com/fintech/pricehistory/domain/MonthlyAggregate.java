package com.fintech.pricehistory.domain;

import java.time.Instant;
import java.time.YearMonth;
import java.util.Objects;

/**
 * Monthly mean of filtered daily closes for one instrument.
 *
 * @param instrument Normalized instrument identifier
 * @param yearMonth Calendar bucket
 * @param avgClose Arithmetic mean of Close
 * @param avgAdjustedClose Arithmetic mean of adjusted Close (Close where absent)
 * @param source Provenance tag, {@value #SOURCE_CALCULATED} for aggregates computed on sync
 * @param createdAt When the aggregate was computed
 */
public record MonthlyAggregate(
    String instrument,
    YearMonth yearMonth,
    double avgClose,
    double avgAdjustedClose,
    String source,
    Instant createdAt
) {

    public static final String SOURCE_CALCULATED = "calculated";

    public MonthlyAggregate {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(yearMonth, "Year-month cannot be null");
        Objects.requireNonNull(source, "Source cannot be null");
        Objects.requireNonNull(createdAt, "Created-at cannot be null");
    }
}
