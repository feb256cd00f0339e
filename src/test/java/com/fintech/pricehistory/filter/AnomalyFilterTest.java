package com.fintech.pricehistory.filter;

import com.fintech.pricehistory.domain.AnomalyReason;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.OhlcVerdict;
import com.fintech.pricehistory.validation.ContextWindow;
import com.fintech.pricehistory.validation.OhlcValidator;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AnomalyFilter Tests")
class AnomalyFilterTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private SimpleMeterRegistry meterRegistry;
    private OhlcValidator validator;
    private AnomalyFilter filter;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        validator = new OhlcValidator();
        filter = new AnomalyFilter(validator, meterRegistry);
    }

    private static DailyCandle candle(LocalDate date, double close) {
        return new DailyCandle(date, close, close + 0.5, close - 0.5, close, 10_000L, null);
    }

    /** 30 days near 50, one day at 550, then 4 more days near 50. */
    private static List<DailyCandle> thirtyFiveDays() {
        List<DailyCandle> candles = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            candles.add(candle(START.plusDays(i), 50.0 + (i % 3) * 0.1));
        }
        candles.add(candle(START.plusDays(30), 550.0));
        for (int i = 31; i < 35; i++) {
            candles.add(candle(START.plusDays(i), 50.0 - (i % 2) * 0.1));
        }
        return candles;
    }

    @Test
    @DisplayName("Drops the 11x day from a 35-day series")
    void testEndToEndScenario() {
        List<DailyCandle> input = thirtyFiveDays();

        List<DailyCandle> output = filter.filter(input);

        assertThat(output).hasSize(34);
        assertThat(output).extracting(DailyCandle::close).doesNotContain(550.0);
        assertThat(output).doesNotContain(input.get(30));
        assertThat(meterRegistry.counter("history.filter.dropped").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Retained candles are returned untouched and in order")
    void testRetainedUnchanged() {
        List<DailyCandle> input = thirtyFiveDays();

        List<DailyCandle> output = filter.filter(input);

        List<DailyCandle> expected = new ArrayList<>(input);
        expected.remove(30);
        assertThat(output).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("Validator reaches the same decision on the same fixture")
    void testParityWithValidator() {
        List<DailyCandle> input = thirtyFiveDays();
        List<DailyCandle> prior = input.subList(0, 30);

        OhlcVerdict verdict = validator.validate(input.get(30), prior.get(29), ContextWindow.newestFirst(prior));

        assertThat(verdict.reason()).isEqualTo(AnomalyReason.PRICE_TOO_HIGH);
        assertThat(verdict.allValid()).isFalse();
    }

    @Test
    @DisplayName("Non-positive close is always dropped")
    void testNonPositiveDropped() {
        List<DailyCandle> output = filter.filter(List.of(
            candle(START, 10.0),
            DailyCandle.of(START.plusDays(1), 10.0, 10.5, 9.5, 0.0),
            candle(START.plusDays(2), 10.1)
        ));

        assertThat(output).extracting(DailyCandle::date).containsExactly(START, START.plusDays(2));
    }

    @Test
    @DisplayName("A dropped spike is not the baseline for the next day")
    void testDroppedCandleNotBaseline() {
        List<DailyCandle> output = filter.filter(List.of(
            candle(START, 10.0),
            candle(START.plusDays(1), 200.0),
            candle(START.plusDays(2), 10.0)
        ));

        assertThat(output).extracting(DailyCandle::close).containsExactly(10.0, 10.0);
    }

    @Test
    @DisplayName("Field-level anomalies are dropped, not repaired")
    void testFieldLevelDropped() {
        DailyCandle extremeHigh = DailyCandle.of(START.plusDays(1), 10.0, 10.0 * 500, 9.5, 10.0);

        List<DailyCandle> output = filter.filter(List.of(candle(START, 10.0), extremeHigh));

        assertThat(output).containsExactly(candle(START, 10.0));
    }

    @Test
    @DisplayName("Empty input yields empty output")
    void testEmpty() {
        assertThat(filter.filter(List.of())).isEmpty();
        assertThat(filter.filter(null)).isEmpty();
    }
}
