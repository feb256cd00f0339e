package com.fintech.pricehistory.domain;

import java.util.Objects;

/**
 * Per-field validity of a single candle. Derived predicates are computed,
 * never stored, so they cannot disagree with the four flags.
 */
public record OhlcVerdict(
    boolean openValid,
    boolean highValid,
    boolean lowValid,
    boolean closeValid,
    AnomalyReason reason
) {

    public OhlcVerdict {
        Objects.requireNonNull(reason, "Reason cannot be null");
    }

    /** All four fields invalid; used whenever Close cannot be trusted. */
    public static OhlcVerdict allInvalid(AnomalyReason reason) {
        return new OhlcVerdict(false, false, false, false, reason);
    }

    public boolean allValid() {
        return openValid && highValid && lowValid && closeValid;
    }

    /** Close anchors the candle: once it is invalid, every field is rebuilt. */
    public boolean needsFullRepair() {
        return !closeValid;
    }

    public boolean needsRepair() {
        return !allValid();
    }
}
