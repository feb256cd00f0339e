package com.fintech.pricehistory.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/** How a flagged candle was reconstructed. */
public enum RepairMethod {

    /** Close interpolated by calendar-day fraction between two valid neighbours. */
    LINEAR("linear"),
    /** Prices copied from the previous valid candle. */
    FORWARD_FILL("forward_fill"),
    /** Prices copied from the next valid candle. */
    BACKWARD_FILL("backward_fill"),
    /** Close was valid; only the invalid fields were replaced. */
    SELECTIVE("selective"),
    /** No neighbour available; the candle is returned unchanged. */
    NO_INTERPOLATION("no_interpolation");

    private final String tag;

    RepairMethod(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String tag() {
        return tag;
    }
}
