package com.fintech.pricehistory.domain;

import java.time.LocalDate;

/**
 * Provenance record for one repaired candle.
 */
public record RepairLogEntry(
    LocalDate date,
    double originalClose,
    double repairedClose,
    double originalHigh,
    double repairedHigh,
    double originalLow,
    double repairedLow,
    RepairMethod method,
    AnomalyReason reason
) {

    public static RepairLogEntry of(DailyCandle original, DailyCandle repaired, RepairMethod method, AnomalyReason reason) {
        return new RepairLogEntry(
            original.date(),
            original.close(),
            repaired.close(),
            original.high(),
            repaired.high(),
            original.low(),
            repaired.low(),
            method,
            reason
        );
    }
}
