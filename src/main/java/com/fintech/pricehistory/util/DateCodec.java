package com.fintech.pricehistory.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Conversions between trading days and their storage/wire forms.
 * Storage keeps a day as the epoch second of its UTC midnight; the wire uses
 * ISO {@code YYYY-MM-DD}.
 *
 * Stateless; all methods are pure functions.
 */
public final class DateCodec {

    private DateCodec() {
    }

    /** Epoch second of the day's UTC midnight. */
    public static long toEpochSecond(LocalDate date) {
        return date.atStartOfDay(ZoneOffset.UTC).toEpochSecond();
    }

    /**
     * Truncates an epoch-second timestamp to its UTC calendar day.
     * Intraday timestamps (e.g. a 16:00 close print) map to the same day.
     */
    public static LocalDate fromEpochSecond(long epochSecond) {
        return LocalDate.ofInstant(Instant.ofEpochSecond(epochSecond), ZoneOffset.UTC);
    }

    public static String formatIsoDate(LocalDate date) {
        return date.toString();
    }
}
