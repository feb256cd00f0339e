package com.fintech.pricehistory.cucumber;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import com.fintech.pricehistory.domain.RepairLogEntry;
import com.fintech.pricehistory.service.PriceHistoryStore;
import com.fintech.pricehistory.validation.RepairResult;
import io.cucumber.java.After;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import io.cucumber.spring.CucumberContextConfiguration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Step definitions for the price history scenarios: sync a series through the store,
 * then read it back filtered, aggregated or repaired.
 */
@CucumberContextConfiguration
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@ActiveProfiles("test")
public class PriceHistorySteps {

    @Autowired
    private PriceHistoryStore store;

    private String instrument;
    private final List<DailyCandle> candles = new ArrayList<>();
    private List<DailyCandle> daily;
    private RepairResult repaired;

    @After
    public void tearDown() {
        if (instrument != null) {
            store.deletePricesForSecurity(instrument);
        }
    }

    // ================ Given Steps ================

    @Given("the price history service is running")
    public void thePriceHistoryServiceIsRunning() {
        assertThat(store).isNotNull();
    }

    @Given("{int} consecutive daily candles for {string} starting {string} closing near {double}")
    public void consecutiveDailyCandles(int days, String instrument, String start, double base) {
        this.instrument = instrument;
        LocalDate first = LocalDate.parse(start);
        for (int i = 0; i < days; i++) {
            candles.add(candle(first.plusDays(i), base + (i % 3) * 0.1));
        }
    }

    @And("the candle on day {int} closes at {double}")
    public void theCandleOnDayClosesAt(int day, double close) {
        DailyCandle original = candles.get(day - 1);
        candles.set(day - 1, new DailyCandle(original.date(), close, close + 0.5, Math.max(0, close - 0.5), close,
            original.volume(), null));
    }

    // ================ When Steps ================

    @When("the history is synced")
    public void theHistoryIsSynced() {
        store.sync(instrument, candles);
    }

    @When("I request the daily series")
    public void iRequestTheDailySeries() {
        daily = store.getDaily(instrument, 0);
    }

    @When("I request the repaired series")
    public void iRequestTheRepairedSeries() {
        repaired = store.getRepairedDaily(instrument, 0);
    }

    // ================ Then Steps ================

    @Then("the daily series contains {int} candles")
    public void theDailySeriesContains(int count) {
        assertThat(daily).hasSize(count);
    }

    @And("no returned candle closes above {double}")
    public void noReturnedCandleClosesAbove(double limit) {
        assertThat(daily).allSatisfy(c -> assertThat(c.close()).isLessThanOrEqualTo(limit));
    }

    @And("the candle dated {string} is absent")
    public void theCandleDatedIsAbsent(String date) {
        assertThat(daily).extracting(DailyCandle::date).doesNotContain(LocalDate.parse(date));
    }

    @And("every monthly average is below {double}")
    public void everyMonthlyAverageIsBelow(double limit) {
        List<MonthlyAggregate> months = store.getMonthly(instrument, 0);
        assertThat(months).isNotEmpty()
            .allSatisfy(m -> assertThat(m.avgClose()).isLessThan(limit));
    }

    @Then("the repaired series contains {int} candles")
    public void theRepairedSeriesContains(int count) {
        assertThat(repaired.candles()).hasSize(count);
    }

    @And("the repair log has one {string} entry for {string} with close {double}")
    public void theRepairLogHasOneEntry(String method, String date, double close) {
        assertThat(repaired.repairs()).hasSize(1);
        RepairLogEntry entry = repaired.repairs().get(0);
        assertThat(entry.method().tag()).isEqualTo(method);
        assertThat(entry.date()).isEqualTo(LocalDate.parse(date));
        assertThat(entry.repairedClose()).isCloseTo(close, within(1e-9));
    }

    private static DailyCandle candle(LocalDate date, double close) {
        return new DailyCandle(date, close, close + 0.5, close - 0.5, close, 10_000L, null);
    }
}
