package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.AnomalyReason;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.OptionalDouble;

import static com.fintech.pricehistory.validation.PriceThresholds.*;

/**
 * Component-level OHLC validation.
 *
 * Rules, in evaluation order:
 * <ol>
 *   <li>Close &le; 0: everything invalid, no further rules.</li>
 *   <li>OHLC consistency: High/Low checked against each other, Open and Close.</li>
 *   <li>High/Low extreme relative to Close (100x / 0.01x).</li>
 *   <li>Day-over-day change against the previous close (+1000% / -90%).</li>
 *   <li>Close against the 30-day context average (10x / 0.1x), only while Close is still valid.</li>
 * </ol>
 * Field-level rules keep the first reason found. Rules that invalidate Close
 * (4 and 5) replace it, since they force a full repair whatever else failed.
 *
 * Thread-safe and stateless.
 */
@Component
public class OhlcValidator {

    /**
     * Validates one candle.
     *
     * @param candle Candle under test
     * @param previous Previous day's candle, null if unknown
     * @param context Prior candles, newest first; may be empty
     * @return Per-field verdict
     */
    public OhlcVerdict validate(DailyCandle candle, @Nullable DailyCandle previous, List<DailyCandle> context) {
        if (candle.close() <= 0) {
            return OhlcVerdict.allInvalid(AnomalyReason.CLOSE_ZERO_OR_NEGATIVE);
        }

        Verdict verdict = new Verdict();
        checkConsistency(candle, verdict);
        checkExtremes(candle, verdict);
        checkDayOverDay(candle, previous, verdict);
        if (verdict.closeValid) {
            checkContextAverage(candle, context, verdict);
        }
        return verdict.toRecord();
    }

    private void checkConsistency(DailyCandle c, Verdict verdict) {
        if (c.high() < c.low()) {
            verdict.invalidateHigh(AnomalyReason.HIGH_BELOW_LOW);
            verdict.invalidateLow(AnomalyReason.HIGH_BELOW_LOW);
        }
        if (c.high() < c.open()) {
            verdict.invalidateHigh(AnomalyReason.HIGH_BELOW_OPEN);
        }
        if (c.high() < c.close()) {
            verdict.invalidateHigh(AnomalyReason.HIGH_BELOW_CLOSE);
        }
        if (c.low() > c.open()) {
            verdict.invalidateLow(AnomalyReason.LOW_ABOVE_OPEN);
        }
        if (c.low() > c.close()) {
            verdict.invalidateLow(AnomalyReason.LOW_ABOVE_CLOSE);
        }
    }

    private void checkExtremes(DailyCandle c, Verdict verdict) {
        if (c.high() > c.close() * HIGH_CLOSE_MAX_RATIO) {
            verdict.invalidateHigh(AnomalyReason.HIGH_EXTREME_RELATIVE_TO_CLOSE);
        }
        // A zero Low is exempt from the ratio check
        if (c.low() > 0 && c.low() < c.close() * LOW_CLOSE_MIN_RATIO) {
            verdict.invalidateLow(AnomalyReason.LOW_EXTREME_RELATIVE_TO_CLOSE);
        }
    }

    private void checkDayOverDay(DailyCandle c, @Nullable DailyCandle previous, Verdict verdict) {
        if (previous == null || previous.close() <= 0) {
            return;
        }
        double changePercent = (c.close() - previous.close()) / previous.close() * 100.0;
        if (changePercent > MAX_DAILY_CHANGE_PERCENT) {
            verdict.invalidateAll(AnomalyReason.SPIKE_DETECTED);
        } else if (changePercent < MIN_DAILY_CHANGE_PERCENT) {
            verdict.invalidateAll(AnomalyReason.CRASH_DETECTED);
        }
    }

    private void checkContextAverage(DailyCandle c, List<DailyCandle> context, Verdict verdict) {
        OptionalDouble average = ContextWindow.averageClose(context);
        if (average.isEmpty()) {
            return;
        }
        double avg = average.getAsDouble();
        if (c.close() > avg * MAX_AVERAGE_MULTIPLIER) {
            verdict.invalidateAll(AnomalyReason.PRICE_TOO_HIGH);
        } else if (c.close() < avg * MIN_AVERAGE_MULTIPLIER) {
            verdict.invalidateAll(AnomalyReason.PRICE_TOO_LOW);
        }
    }

    /** Mutable accumulator, frozen into an {@link OhlcVerdict} once all rules ran. */
    private static final class Verdict {
        private boolean openValid = true;
        private boolean highValid = true;
        private boolean lowValid = true;
        private boolean closeValid = true;
        private AnomalyReason reason = AnomalyReason.NONE;

        void invalidateHigh(AnomalyReason cause) {
            highValid = false;
            keepFirst(cause);
        }

        void invalidateLow(AnomalyReason cause) {
            lowValid = false;
            keepFirst(cause);
        }

        void invalidateAll(AnomalyReason cause) {
            openValid = false;
            highValid = false;
            lowValid = false;
            closeValid = false;
            reason = cause;
        }

        private void keepFirst(AnomalyReason cause) {
            if (reason == AnomalyReason.NONE) {
                reason = cause;
            }
        }

        OhlcVerdict toRecord() {
            return new OhlcVerdict(openValid, highValid, lowValid, closeValid, reason);
        }
    }
}
