package com.fintech.pricehistory.storage.jpa;

import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.domain.MonthlyAggregate;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Integration tests against a real PostgreSQL.
 * Skipped when no Docker daemon is available.
 */
@DataJpaTest
@Testcontainers(disabledWithoutDocker = true)
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ActiveProfiles("test")
@DisplayName("PostgreSQL Price History Repository Tests")
class PostgresPriceHistoryRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("pricehistory")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.datasource.driver-class-name", () -> "org.postgresql.Driver");
    }

    @Autowired
    private DailyPriceJpaRepository dailyJpaRepository;

    @Autowired
    private MonthlyPriceJpaRepository monthlyJpaRepository;

    private JpaPriceHistoryRepository repository;

    @BeforeEach
    void setUp() {
        dailyJpaRepository.deleteAll();
        monthlyJpaRepository.deleteAll();
        repository = new JpaPriceHistoryRepository(dailyJpaRepository, monthlyJpaRepository, new SimpleMeterRegistry());
    }

    @Test
    @DisplayName("Should upsert a year of candles and read them back in order")
    void testBulkUpsert() {
        // Given
        LocalDate start = LocalDate.of(2023, 1, 1);
        List<DailyCandle> candles = start.datesUntil(start.plusYears(1))
            .map(day -> new DailyCandle(day, 100.0, 101.0, 99.0, 100.5, 5_000L, null))
            .toList();

        // When
        repository.upsertHistory("US0378331005", candles, List.of());
        repository.upsertHistory("US0378331005", candles, List.of());

        // Then
        List<DailyCandle> stored = repository.findAllDaily("US0378331005");
        assertThat(stored).hasSize(365);
        assertThat(stored.get(0).date()).isEqualTo(start);
        assertThat(stored.get(364).date()).isEqualTo(LocalDate.of(2023, 12, 31));
    }

    @Test
    @DisplayName("Should page monthly aggregates newest first")
    void testMonthlyPaging() {
        // Given
        Instant created = Instant.parse("2024-01-01T00:00:00Z");
        List<MonthlyAggregate> months = YearMonth.of(2023, 1).atDay(1).datesUntil(LocalDate.of(2024, 1, 1))
            .filter(day -> day.getDayOfMonth() == 1)
            .map(day -> new MonthlyAggregate("US0378331005", YearMonth.from(day), day.getMonthValue(),
                day.getMonthValue(), MonthlyAggregate.SOURCE_CALCULATED, created))
            .toList();
        repository.upsertHistory("US0378331005", List.of(), months);

        // When
        List<MonthlyAggregate> latest = repository.findMonthly("US0378331005", 3);

        // Then
        assertThat(latest).extracting(MonthlyAggregate::yearMonth)
            .containsExactly(YearMonth.of(2023, 12), YearMonth.of(2023, 11), YearMonth.of(2023, 10));
        assertThat(latest.get(0).avgClose()).isCloseTo(12.0, within(1e-9));
    }
}
