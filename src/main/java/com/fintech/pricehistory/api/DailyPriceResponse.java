package com.fintech.pricehistory.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.pricehistory.domain.DailyCandle;
import com.fintech.pricehistory.util.DateCodec;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.stream.Collectors;

@Schema(description = "Daily price series for one instrument")
public record DailyPriceResponse(

    @Schema(description = "Normalized instrument identifier", example = "US0378331005")
    String instrument,

    @Schema(description = "Number of candles returned", example = "2")
    int count,

    @Schema(description = "Candles in the order the endpoint documents")
    List<Bar> prices
) {

    public static DailyPriceResponse of(String instrument, List<DailyCandle> candles) {
        return new DailyPriceResponse(instrument, candles.size(), Bar.fromCandles(candles));
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @Schema(description = "One trading day")
    public record Bar(
        @Schema(description = "Trading day", example = "2024-03-15")
        String date,
        double open,
        double high,
        double low,
        double close,
        Long volume,
        Double adjustedClose
    ) {

        static Bar fromCandle(DailyCandle candle) {
            return new Bar(
                DateCodec.formatIsoDate(candle.date()),
                candle.open(),
                candle.high(),
                candle.low(),
                candle.close(),
                candle.volume(),
                candle.adjustedClose()
            );
        }

        static List<Bar> fromCandles(List<DailyCandle> candles) {
            return candles.stream().map(Bar::fromCandle).collect(Collectors.toList());
        }
    }
}
