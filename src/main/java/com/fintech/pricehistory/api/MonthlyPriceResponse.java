package com.fintech.pricehistory.api;

import com.fintech.pricehistory.domain.MonthlyAggregate;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

@Schema(description = "Monthly close averages for one instrument, newest month first")
public record MonthlyPriceResponse(
    String instrument,
    int count,
    List<Month> months
) {

    public static MonthlyPriceResponse of(String instrument, List<MonthlyAggregate> aggregates) {
        List<Month> months = aggregates.stream()
            .map(a -> new Month(a.yearMonth().toString(), a.avgClose(), a.avgAdjustedClose(), a.source(), a.createdAt()))
            .collect(Collectors.toList());
        return new MonthlyPriceResponse(instrument, months.size(), months);
    }

    public record Month(
        @Schema(description = "Calendar month", example = "2024-03")
        String yearMonth,
        @Schema(description = "Mean filtered close", example = "171.42")
        double avgClose,
        @Schema(description = "Mean filtered adjusted close", example = "171.42")
        double avgAdjustedClose,
        @Schema(description = "Provenance", example = "calculated")
        String source,
        Instant createdAt
    ) {}
}
