package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import com.fintech.pricehistory.domain.RepairLogEntry;
import com.fintech.pricehistory.domain.RepairMethod;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static com.fintech.pricehistory.validation.PriceThresholds.SYSTEMIC_INVALID_RATIO;

/**
 * Maintenance path producing a complete series: every flagged candle is repaired
 * rather than dropped, and each repair is logged for provenance.
 *
 * Candles are processed oldest first. Each valid or repaired candle becomes the
 * day-over-day predecessor of the next one and enters the 30-day context, so a repaired
 * spike does not poison the following days. The context is built the way
 * {@link com.fintech.pricehistory.filter.AnomalyFilter} builds it, topped up from the
 * caller's older history, so both paths flag the same candles. A candle left as is for
 * lack of neighbours is never used as a neighbour.
 */
@Service
public class PriceRepairService {

    private static final Logger log = LoggerFactory.getLogger(PriceRepairService.class);

    private final OhlcValidator validator;
    private final OhlcInterpolator interpolator;
    private final Counter repairedCounter;

    public PriceRepairService(OhlcValidator validator, OhlcInterpolator interpolator, MeterRegistry meterRegistry) {
        this.validator = validator;
        this.interpolator = interpolator;
        this.repairedCounter = meterRegistry.counter("history.repair.repaired");
    }

    /**
     * Validates every candle and repairs the flagged ones.
     *
     * @param candles Candles to process, any order
     * @param context Prior candles, newest first; may be empty
     * @return Repaired series, oldest first, plus the repair log
     */
    public RepairResult validateAndInterpolate(List<DailyCandle> candles, List<DailyCandle> context) {
        if (candles == null || candles.isEmpty()) {
            return RepairResult.empty();
        }
        List<DailyCandle> batch = new ArrayList<>(candles);
        batch.sort(Comparator.comparing(DailyCandle::date));
        List<DailyCandle> safeContext = context != null ? context : List.of();

        NeighborResolver resolver = new NeighborResolver(batch, safeContext, validator);
        List<DailyCandle> result = new ArrayList<>(batch.size());
        // Output minus candles that could not be repaired
        List<DailyCandle> trusted = new ArrayList<>(batch.size());
        List<RepairLogEntry> repairs = new ArrayList<>();

        for (int i = 0; i < batch.size(); i++) {
            DailyCandle candle = batch.get(i);
            DailyCandle previous = resolver.previous(i, trusted).orElse(null);
            List<DailyCandle> window = ContextWindow.newestFirst(trusted, safeContext);
            OhlcVerdict verdict = validator.validate(candle, previous, window);

            if (verdict.allValid()) {
                result.add(candle);
                trusted.add(candle);
                continue;
            }

            RepairedCandle repaired = interpolator.repair(candle, verdict, resolver.neighbors(i, trusted));
            repairs.add(RepairLogEntry.of(candle, repaired.candle(), repaired.method(), verdict.reason()));
            result.add(repaired.candle());
            if (repaired.method() != RepairMethod.NO_INTERPOLATION) {
                trusted.add(repaired.candle());
            }

            if (log.isDebugEnabled()) {
                log.debug("Repaired candle: date={}, originalClose={}, repairedClose={}, method={}, reason={}",
                    candle.date(), candle.close(), repaired.candle().close(),
                    repaired.method().tag(), verdict.reason().code());
            }
        }

        repairedCounter.increment(repairs.size());

        double invalidRatio = (double) repairs.size() / batch.size();
        if (invalidRatio > SYSTEMIC_INVALID_RATIO) {
            log.warn("More than 50% of candles flagged invalid, possible data quality issue: invalid={}, total={}, ratio={}",
                repairs.size(), batch.size(), String.format("%.2f", invalidRatio));
        }

        return new RepairResult(result, repairs);
    }
}
