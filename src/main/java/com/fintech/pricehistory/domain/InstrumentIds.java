package com.fintech.pricehistory.domain;

import java.util.Locale;

/**
 * Instrument identifiers (ISINs) are opaque keys compared case-insensitively.
 */
public final class InstrumentIds {

    private InstrumentIds() {
    }

    /**
     * Trims and upper-cases an identifier.
     *
     * @throws IllegalArgumentException if the identifier is null or blank
     */
    public static String normalize(String instrument) {
        if (instrument == null || instrument.isBlank()) {
            throw new IllegalArgumentException("Instrument identifier cannot be null or blank");
        }
        return instrument.trim().toUpperCase(Locale.ROOT);
    }
}
