package com.fintech.pricehistory.api;

import com.fintech.pricehistory.domain.InstrumentIds;
import com.fintech.pricehistory.service.PriceHistoryStore;
import com.fintech.pricehistory.storage.PriceHistoryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.function.Supplier;

/**
 * REST API over the price history store.
 *
 * Daily, recent and monthly reads return filtered data: anomalous candles are simply
 * absent. The repaired endpoint returns a complete series instead, with a log entry
 * for every synthetic value.
 */
@RestController
@RequestMapping("/api/v1/prices")
@Validated
@Tag(name = "Price History", description = "Daily and monthly price history API")
public class PriceHistoryController {

    private static final Logger log = LoggerFactory.getLogger(PriceHistoryController.class);

    private static final String INSTRUMENT_PATTERN = "^\\s*[A-Za-z0-9._-]{1,40}\\s*$";
    private static final String INSTRUMENT_MESSAGE = "Instrument must be 1-40 letters, digits, '.', '_' or '-'";
    private static final int MAX_DAYS = 36_600;

    private final PriceHistoryStore store;
    private final MeterRegistry meterRegistry;

    public PriceHistoryController(PriceHistoryStore store, MeterRegistry meterRegistry) {
        this.store = store;
        this.meterRegistry = meterRegistry;
    }

    @Operation(
        summary = "Get filtered daily prices",
        description = "Daily candles with anomalies removed, newest first. `limit=0` returns the whole history."
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved daily prices",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = DailyPriceResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "instrument": "US0378331005",
                          "count": 2,
                          "prices": [
                            {"date": "2024-03-15", "open": 171.2, "high": 172.6, "low": 170.3, "close": 172.0, "volume": 51200000},
                            {"date": "2024-03-14", "open": 170.1, "high": 171.9, "low": 169.8, "close": 171.1, "volume": 48700000}
                          ]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid instrument or limit",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "500",
            description = "Storage failure",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/{instrument}/daily")
    public ResponseEntity<DailyPriceResponse> getDaily(
            @Parameter(description = "Instrument identifier (ISIN)", example = "US0378331005")
            @PathVariable
            @Pattern(regexp = INSTRUMENT_PATTERN, message = INSTRUMENT_MESSAGE)
            String instrument,

            @Parameter(description = "Maximum number of candles, 0 for all", example = "30")
            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Limit must not be negative")
            int limit) {

        String id = InstrumentIds.normalize(instrument);
        return timed("daily", () -> ResponseEntity.ok(DailyPriceResponse.of(id, store.getDaily(id, limit))));
    }

    @Operation(
        summary = "Get filtered prices for the last N days",
        description = "Daily candles dated within [today - days, today], newest first."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved recent prices",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = DailyPriceResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid instrument or day count",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{instrument}/recent")
    public ResponseEntity<DailyPriceResponse> getRecent(
            @PathVariable
            @Pattern(regexp = INSTRUMENT_PATTERN, message = INSTRUMENT_MESSAGE)
            String instrument,

            @Parameter(description = "Number of calendar days back from today", example = "30")
            @RequestParam(defaultValue = "30")
            @Min(value = 1, message = "Days must be at least 1")
            @Max(value = MAX_DAYS, message = "Days must not exceed 36600")
            int days) {

        String id = InstrumentIds.normalize(instrument);
        return timed("recent", () -> ResponseEntity.ok(DailyPriceResponse.of(id, store.getRecent(id, days))));
    }

    @Operation(
        summary = "Get monthly close averages",
        description = "Monthly aggregates of filtered closes, newest month first. `limit=0` returns every month."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully retrieved monthly averages",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = MonthlyPriceResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid instrument or limit",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{instrument}/monthly")
    public ResponseEntity<MonthlyPriceResponse> getMonthly(
            @PathVariable
            @Pattern(regexp = INSTRUMENT_PATTERN, message = INSTRUMENT_MESSAGE)
            String instrument,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Limit must not be negative")
            int limit) {

        String id = InstrumentIds.normalize(instrument);
        return timed("monthly", () -> ResponseEntity.ok(MonthlyPriceResponse.of(id, store.getMonthly(id, limit))));
    }

    @Operation(
        summary = "Get a repaired daily series",
        description = """
            The most recent `limit` stored candles with every anomaly repaired instead of dropped,
            oldest first, plus one repair log entry per flagged candle. `limit=0` repairs the whole history.
            """
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Successfully repaired the series",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = RepairResponse.class))),
        @ApiResponse(responseCode = "400", description = "Invalid instrument or limit",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @GetMapping("/{instrument}/repaired")
    public ResponseEntity<RepairResponse> getRepaired(
            @PathVariable
            @Pattern(regexp = INSTRUMENT_PATTERN, message = INSTRUMENT_MESSAGE)
            String instrument,

            @RequestParam(defaultValue = "0")
            @Min(value = 0, message = "Limit must not be negative")
            int limit) {

        String id = InstrumentIds.normalize(instrument);
        return timed("repaired", () -> ResponseEntity.ok(RepairResponse.of(id, store.getRepairedDaily(id, limit))));
    }

    @Operation(
        summary = "Delete all history for an instrument",
        description = "Removes raw and monthly rows and evicts the cached series. Deleting an unknown instrument succeeds."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "204", description = "History deleted"),
        @ApiResponse(responseCode = "400", description = "Invalid instrument",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class)))
    })
    @DeleteMapping("/{instrument}")
    public ResponseEntity<Void> delete(
            @PathVariable
            @Pattern(regexp = INSTRUMENT_PATTERN, message = INSTRUMENT_MESSAGE)
            String instrument) {

        String id = InstrumentIds.normalize(instrument);
        return timed("delete", () -> {
            PriceHistoryRepository.DeletedRows deleted = store.deletePricesForSecurity(id);
            log.info("History deleted via API: instrument={}, daily={}, monthly={}", id, deleted.daily(), deleted.monthly());
            return ResponseEntity.<Void>noContent().build();
        });
    }

    private <T> T timed(String endpoint, Supplier<T> call) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            return call.get();
        } finally {
            sample.stop(meterRegistry.timer("api.prices.request.time", "endpoint", endpoint));
        }
    }
}
