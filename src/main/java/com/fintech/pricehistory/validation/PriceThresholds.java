package com.fintech.pricehistory.validation;

/**
 * Thresholds shared by the validator and the read-time filter.
 * No absolute price bounds exist: every check is relative to the candle
 * itself, the previous day or the recent average.
 */
public final class PriceThresholds {

    /** High must not exceed Close x 100. */
    public static final double HIGH_CLOSE_MAX_RATIO = 100.0;

    /** A positive Low must not fall below Close x 0.01. */
    public static final double LOW_CLOSE_MIN_RATIO = 0.01;

    /** Day-over-day increase above this percentage is a spike. */
    public static final double MAX_DAILY_CHANGE_PERCENT = 1000.0;

    /** Day-over-day decrease below this percentage is a crash. */
    public static final double MIN_DAILY_CHANGE_PERCENT = -90.0;

    /** Close above average x 10 is too high. */
    public static final double MAX_AVERAGE_MULTIPLIER = 10.0;

    /** Close below average x 0.1 is too low. */
    public static final double MIN_AVERAGE_MULTIPLIER = 0.1;

    /** Number of prior closes averaged; fewer than this disables the average check. */
    public static final int CONTEXT_WINDOW_DAYS = 30;

    /** Fraction of flagged candles in one batch that signals a systemic problem. */
    public static final double SYSTEMIC_INVALID_RATIO = 0.5;

    private PriceThresholds() {
    }
}
