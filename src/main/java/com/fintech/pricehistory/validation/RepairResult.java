package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.RepairLogEntry;

import java.util.List;

/**
 * A gap-free repaired series (oldest first) and one log entry per candle that was flagged.
 */
public record RepairResult(List<DailyCandle> candles, List<RepairLogEntry> repairs) {

    public RepairResult {
        candles = List.copyOf(candles);
        repairs = List.copyOf(repairs);
    }

    public static RepairResult empty() {
        return new RepairResult(List.of(), List.of());
    }
}
