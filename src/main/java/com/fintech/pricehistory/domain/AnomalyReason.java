package com.fintech.pricehistory.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Diagnostic code attached to a validity verdict. Only the first failing rule
 * is reported, except that rules invalidating Close replace a field-level reason.
 */
public enum AnomalyReason {

    NONE("none"),
    CLOSE_ZERO_OR_NEGATIVE("close_zero_or_negative"),
    HIGH_BELOW_LOW("high_below_low"),
    HIGH_BELOW_OPEN("high_below_open"),
    HIGH_BELOW_CLOSE("high_below_close"),
    LOW_ABOVE_OPEN("low_above_open"),
    LOW_ABOVE_CLOSE("low_above_close"),
    HIGH_EXTREME_RELATIVE_TO_CLOSE("high_extreme_relative_to_close"),
    LOW_EXTREME_RELATIVE_TO_CLOSE("low_extreme_relative_to_close"),
    SPIKE_DETECTED("spike_detected"),
    CRASH_DETECTED("crash_detected"),
    PRICE_TOO_HIGH("price_too_high"),
    PRICE_TOO_LOW("price_too_low");

    private final String code;

    AnomalyReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }
}
