package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.AnomalyReason;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import com.fintech.pricehistory.domain.RepairMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("OhlcInterpolator Tests")
class OhlcInterpolatorTest {

    private static final LocalDate T = LocalDate.of(2024, 1, 1);

    private final OhlcInterpolator interpolator = new OhlcInterpolator();

    private final DailyCandle before = DailyCandle.of(T, 46.5, 47.5, 46.0, 47.0);
    private final DailyCandle after = DailyCandle.of(T.plusDays(2), 46.9, 47.2, 46.2, 46.7);
    private final DailyCandle broken = new DailyCandle(T.plusDays(1), 0, 0, 0, 0, 1234L, 5.0);
    private final OhlcVerdict fullRepair = OhlcVerdict.allInvalid(AnomalyReason.CLOSE_ZERO_OR_NEGATIVE);

    @Test
    @DisplayName("Both neighbours: Close interpolated linearly by calendar day")
    void testLinear() {
        RepairedCandle result = interpolator.repair(broken, fullRepair, Neighbors.of(before, after));

        DailyCandle repaired = result.candle();
        assertThat(result.method()).isEqualTo(RepairMethod.LINEAR);
        assertThat(repaired.close()).isCloseTo(46.85, within(1e-9));
        assertThat(repaired.date()).isEqualTo(broken.date());
        assertThat(repaired.volume()).isEqualTo(1234L);
        assertThat(repaired.adjustedClose()).isNull();
    }

    @Test
    @DisplayName("Linear repair derives O/H/L from the neighbours' mean ratios and stays consistent")
    void testLinearRatios() {
        DailyCandle repaired = interpolator.repair(broken, fullRepair, Neighbors.of(before, after)).candle();

        double highRatio = (47.5 / 47.0 + 47.2 / 46.7) / 2.0;
        double lowRatio = (46.0 / 47.0 + 46.2 / 46.7) / 2.0;
        assertThat(repaired.high()).isCloseTo(46.85 * highRatio, within(1e-9));
        assertThat(repaired.low()).isCloseTo(46.85 * lowRatio, within(1e-9));
        assertThat(repaired.high()).isGreaterThanOrEqualTo(Math.max(repaired.open(), repaired.close()));
        assertThat(repaired.low()).isLessThanOrEqualTo(Math.min(repaired.open(), repaired.close()));
    }

    @Test
    @DisplayName("Linear weight follows calendar days, not trading days")
    void testLinearCalendarFraction() {
        DailyCandle farAfter = DailyCandle.of(T.plusDays(4), 46.9, 47.2, 46.2, 46.7);

        DailyCandle repaired = interpolator.repair(broken, fullRepair, Neighbors.of(before, farAfter)).candle();

        assertThat(repaired.close()).isCloseTo(47.0 + (46.7 - 47.0) * 0.25, within(1e-9));
    }

    @Test
    @DisplayName("Only before: forward fill copies its prices verbatim")
    void testForwardFill() {
        RepairedCandle result = interpolator.repair(broken, fullRepair, Neighbors.of(before, null));

        assertThat(result.method()).isEqualTo(RepairMethod.FORWARD_FILL);
        assertThat(result.candle()).isEqualTo(
            new DailyCandle(broken.date(), 46.5, 47.5, 46.0, 47.0, 1234L, null));
    }

    @Test
    @DisplayName("Only after: backward fill copies its prices verbatim")
    void testBackwardFill() {
        RepairedCandle result = interpolator.repair(broken, fullRepair, Neighbors.of(null, after));

        assertThat(result.method()).isEqualTo(RepairMethod.BACKWARD_FILL);
        assertThat(result.candle()).isEqualTo(
            new DailyCandle(broken.date(), 46.9, 47.2, 46.2, 46.7, 1234L, null));
    }

    @Test
    @DisplayName("No neighbours: candle returned unchanged")
    void testNoInterpolation() {
        RepairedCandle result = interpolator.repair(broken, fullRepair, Neighbors.none());

        assertThat(result.method()).isEqualTo(RepairMethod.NO_INTERPOLATION);
        assertThat(result.candle()).isSameAs(broken);
    }

    @Test
    @DisplayName("Invalid High with valid Close: only High rebuilt from neighbour ratios")
    void testSelectiveHigh() {
        DailyCandle candle = new DailyCandle(T.plusDays(1), 10.0, 9.5, 9.8, 10.0, 500L, 9.9);
        OhlcVerdict verdict = new OhlcVerdict(true, false, true, true, AnomalyReason.HIGH_BELOW_CLOSE);
        DailyCandle b = DailyCandle.of(T, 10.0, 10.4, 9.9, 10.0);
        DailyCandle a = DailyCandle.of(T.plusDays(2), 20.0, 20.4, 19.9, 20.0);

        RepairedCandle result = interpolator.repair(candle, verdict, Neighbors.of(b, a));

        assertThat(result.method()).isEqualTo(RepairMethod.SELECTIVE);
        assertThat(result.candle().high()).isCloseTo(10.3, within(1e-9));
        assertThat(result.candle().low()).isEqualTo(9.8);
        assertThat(result.candle().open()).isEqualTo(10.0);
        assertThat(result.candle().close()).isEqualTo(10.0);
        assertThat(result.candle().adjustedClose()).isEqualTo(9.9);
        assertThat(result.candle().volume()).isEqualTo(500L);
    }

    @Test
    @DisplayName("Selective repair without neighbours uses default ratios")
    void testSelectiveDefaults() {
        DailyCandle candle = DailyCandle.of(T, 100.0, 90.0, 110.0, 100.0);
        OhlcVerdict verdict = new OhlcVerdict(true, false, false, true, AnomalyReason.HIGH_BELOW_LOW);

        DailyCandle repaired = interpolator.repair(candle, verdict, Neighbors.none()).candle();

        assertThat(repaired.high()).isCloseTo(102.0, within(1e-9));
        assertThat(repaired.low()).isCloseTo(98.0, within(1e-9));
    }

    @Test
    @DisplayName("Invalid Open takes the previous close, then the next open, then Close")
    void testSelectiveOpen() {
        DailyCandle candle = DailyCandle.of(T.plusDays(1), 55.0, 10.5, 9.5, 10.0);
        OhlcVerdict verdict = new OhlcVerdict(false, true, true, true, AnomalyReason.HIGH_BELOW_OPEN);
        DailyCandle b = DailyCandle.of(T, 9.8, 10.1, 9.7, 9.9);
        DailyCandle a = DailyCandle.of(T.plusDays(2), 10.2, 10.4, 10.0, 10.3);

        assertThat(interpolator.repair(candle, verdict, Neighbors.of(b, a)).candle().open()).isEqualTo(9.9);
        assertThat(interpolator.repair(candle, verdict, Neighbors.of(null, a)).candle().open()).isEqualTo(10.2);
        assertThat(interpolator.repair(candle, verdict, Neighbors.none()).candle().open()).isEqualTo(10.0);
    }

    @Test
    @DisplayName("Consistency clamp widens High and Low around Open and Close")
    void testConsistencyClamp() {
        DailyCandle original = DailyCandle.of(T, 0, 0, 0, 0);

        DailyCandle clamped = OhlcInterpolator.consistent(original, 10.0, 5.0, 20.0, 12.0, null);

        assertThat(clamped.high()).isEqualTo(12.0);
        assertThat(clamped.low()).isEqualTo(10.0);
    }
}
