package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.RepairMethod;

/** Output of a single repair. */
public record RepairedCandle(DailyCandle candle, RepairMethod method) {
}
