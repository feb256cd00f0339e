package com.fintech.pricehistory.sync;

/**
 * One daily bar as delivered by an upstream price source, before any interpretation.
 *
 * @param timestamp Unix epoch seconds anywhere within the trading day (UTC)
 * @param volume Traded volume, null when not reported
 */
public record RawPriceBar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    Long volume
) {
}
