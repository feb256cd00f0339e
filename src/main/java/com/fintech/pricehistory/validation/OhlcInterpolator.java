package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import com.fintech.pricehistory.domain.RepairMethod;
import org.springframework.stereotype.Component;

import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.function.ToDoubleFunction;
import java.util.stream.Stream;

/**
 * Rebuilds the invalid fields of a candle from its trusted neighbours.
 *
 * <ul>
 *   <li>Close valid: selective repair of High, Low and Open only.</li>
 *   <li>Close invalid, both neighbours: linear interpolation of Close by calendar-day
 *       fraction, other fields from the mean neighbour ratio-to-Close.</li>
 *   <li>Close invalid, one neighbour: forward or backward fill of all four prices.</li>
 *   <li>No neighbour: candle returned unchanged.</li>
 * </ul>
 * Date and volume always come from the original candle. A fully repaired candle
 * loses its adjusted close, which no longer matches the rebuilt Close.
 *
 * Thread-safe and stateless.
 */
@Component
public class OhlcInterpolator {

    static final double DEFAULT_HIGH_RATIO = 1.02;
    static final double DEFAULT_LOW_RATIO = 0.98;

    public RepairedCandle repair(DailyCandle candle, OhlcVerdict verdict, Neighbors neighbors) {
        if (verdict.needsFullRepair()) {
            return repairFull(candle, neighbors);
        }
        return new RepairedCandle(repairSelective(candle, verdict, neighbors), RepairMethod.SELECTIVE);
    }

    private DailyCandle repairSelective(DailyCandle candle, OhlcVerdict verdict, Neighbors neighbors) {
        double open = candle.open();
        double high = candle.high();
        double low = candle.low();
        double close = candle.close();

        if (!verdict.highValid()) {
            high = close * typicalRatio(neighbors, c -> c.high() / c.close(), DEFAULT_HIGH_RATIO);
        }
        if (!verdict.lowValid()) {
            low = close * typicalRatio(neighbors, c -> c.low() / c.close(), DEFAULT_LOW_RATIO);
        }
        if (!verdict.openValid()) {
            open = neighbors.before().map(DailyCandle::close)
                .or(() -> neighbors.after().map(DailyCandle::open))
                .orElse(close);
        }
        return consistent(candle, open, high, low, close, candle.adjustedClose());
    }

    private RepairedCandle repairFull(DailyCandle candle, Neighbors neighbors) {
        Optional<DailyCandle> before = neighbors.before();
        Optional<DailyCandle> after = neighbors.after();

        if (before.isPresent() && after.isPresent()) {
            DailyCandle b = before.get();
            DailyCandle a = after.get();
            long totalDays = ChronoUnit.DAYS.between(b.date(), a.date());
            if (totalDays > 0 && b.close() > 0 && a.close() > 0) {
                long elapsedDays = ChronoUnit.DAYS.between(b.date(), candle.date());
                double close = b.close() + (a.close() - b.close()) * ((double) elapsedDays / totalDays);
                double openRatio = (b.open() / b.close() + a.open() / a.close()) / 2.0;
                double highRatio = (b.high() / b.close() + a.high() / a.close()) / 2.0;
                double lowRatio = (b.low() / b.close() + a.low() / a.close()) / 2.0;
                DailyCandle repaired = consistent(candle,
                    close * openRatio, close * highRatio, close * lowRatio, close, null);
                return new RepairedCandle(repaired, RepairMethod.LINEAR);
            }
        }
        if (before.isPresent()) {
            return new RepairedCandle(copyPrices(candle, before.get()), RepairMethod.FORWARD_FILL);
        }
        if (after.isPresent()) {
            return new RepairedCandle(copyPrices(candle, after.get()), RepairMethod.BACKWARD_FILL);
        }
        return new RepairedCandle(candle, RepairMethod.NO_INTERPOLATION);
    }

    private static DailyCandle copyPrices(DailyCandle target, DailyCandle source) {
        return new DailyCandle(target.date(), source.open(), source.high(), source.low(), source.close(),
            target.volume(), null);
    }

    /** Mean of the neighbours' field-to-Close ratio, or the fallback when none has a positive Close. */
    private static double typicalRatio(Neighbors neighbors, ToDoubleFunction<DailyCandle> ratio, double fallback) {
        return Stream.of(neighbors.before(), neighbors.after())
            .flatMap(Optional::stream)
            .filter(c -> c.close() > 0)
            .mapToDouble(ratio)
            .average()
            .orElse(fallback);
    }

    /**
     * Clamps High/Low around Open and Close: High = max(H, O, C), Low = min(L, O, C),
     * and High is raised to Low if they still cross.
     */
    static DailyCandle consistent(DailyCandle original, double open, double high, double low, double close,
                                  Double adjustedClose) {
        double h = Math.max(high, Math.max(open, close));
        double l = Math.min(low, Math.min(open, close));
        if (h < l) {
            h = l;
        }
        return new DailyCandle(original.date(), open, h, l, close, original.volume(), adjustedClose);
    }
}
