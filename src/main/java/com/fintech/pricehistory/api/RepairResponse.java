package com.fintech.pricehistory.api;

import com.fintech.pricehistory.domain.RepairLogEntry;
import com.fintech.pricehistory.util.DateCodec;
import com.fintech.pricehistory.validation.RepairResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.stream.Collectors;

@Schema(description = "Gap-free daily series, oldest first, with the provenance of every synthetic value")
public record RepairResponse(
    String instrument,
    int count,
    @Schema(description = "Number of candles that were flagged", example = "1")
    int repairedCount,
    List<DailyPriceResponse.Bar> prices,
    List<Repair> repairs
) {

    public static RepairResponse of(String instrument, RepairResult result) {
        List<Repair> repairs = result.repairs().stream()
            .map(Repair::fromEntry)
            .collect(Collectors.toList());
        return new RepairResponse(
            instrument,
            result.candles().size(),
            repairs.size(),
            DailyPriceResponse.Bar.fromCandles(result.candles()),
            repairs
        );
    }

    public record Repair(
        String date,
        double originalClose,
        double repairedClose,
        double originalHigh,
        double repairedHigh,
        double originalLow,
        double repairedLow,
        @Schema(example = "linear", allowableValues = {"linear", "forward_fill", "backward_fill", "selective", "no_interpolation"})
        String method,
        @Schema(example = "spike_detected")
        String reason
    ) {

        static Repair fromEntry(RepairLogEntry entry) {
            return new Repair(
                DateCodec.formatIsoDate(entry.date()),
                entry.originalClose(),
                entry.repairedClose(),
                entry.originalHigh(),
                entry.repairedHigh(),
                entry.originalLow(),
                entry.repairedLow(),
                entry.method().tag(),
                entry.reason().code()
            );
        }
    }
}
