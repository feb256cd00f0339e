package com.fintech.pricehistory.filter;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import com.fintech.pricehistory.validation.ContextWindow;
import com.fintech.pricehistory.validation.OhlcValidator;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Read path exclusion filter: any candle the validator would flag is dropped, never repaired.
 *
 * The previous close and the 30-day context are both taken from the accepted output
 * built so far, so a dropped anomaly never becomes the baseline for its successors.
 * Rules and thresholds are the validator's own.
 */
@Component
public class AnomalyFilter {

    private static final Logger log = LoggerFactory.getLogger(AnomalyFilter.class);

    private final OhlcValidator validator;
    private final Counter droppedCounter;

    public AnomalyFilter(OhlcValidator validator, MeterRegistry meterRegistry) {
        this.validator = validator;
        this.droppedCounter = meterRegistry.counter("history.filter.dropped");
    }

    /**
     * @param candles Candles ordered oldest first
     * @return Accepted candles, oldest first, values untouched
     */
    public List<DailyCandle> filter(List<DailyCandle> candles) {
        if (candles == null || candles.isEmpty()) {
            return List.of();
        }

        List<DailyCandle> accepted = new ArrayList<>(candles.size());
        for (int i = 0; i < candles.size(); i++) {
            DailyCandle candle = candles.get(i);
            DailyCandle previous = accepted.isEmpty() ? null : accepted.get(accepted.size() - 1);
            OhlcVerdict verdict = validator.validate(candle, previous, ContextWindow.newestFirst(accepted));

            if (verdict.allValid()) {
                accepted.add(candle);
            } else {
                droppedCounter.increment();
                log.debug("Dropped anomalous candle: date={}, close={}, index={}, reason={}",
                    candle.date(), candle.close(), i, verdict.reason().code());
            }
        }
        return accepted;
    }
}
