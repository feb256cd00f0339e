package com.fintech.pricehistory.validation;

import com.fintech.pricehistory.domain.DailyCandle;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Finds trusted neighbours for one repair batch through a prioritized chain of sources:
 * <ol>
 *   <li>trusted output so far, valid or repaired (before side only),</li>
 *   <li>candles of the batch that were valid on their own,</li>
 *   <li>the external context window.</li>
 * </ol>
 * The first source that yields a candle wins. The day-over-day predecessor uses
 * the first two links of the same chain.
 *
 * One instance per batch; not thread-safe.
 */
class NeighborResolver {

    private final List<DailyCandle> batch;
    private final List<DailyCandle> context;
    private final OhlcValidator validator;
    private final Boolean[] standaloneValid;

    /**
     * @param batch Candles being repaired, oldest first
     * @param context Prior candles, newest first
     */
    NeighborResolver(List<DailyCandle> batch, List<DailyCandle> context, OhlcValidator validator) {
        this.batch = batch;
        this.context = context;
        this.validator = validator;
        this.standaloneValid = new Boolean[batch.size()];
    }

    /** Predecessor for the day-over-day check of {@code batch[index]}. */
    Optional<DailyCandle> previous(int index, List<DailyCandle> trusted) {
        LocalDate date = batch.get(index).date();
        return firstPresent(
            () -> latestBefore(trusted, date),
            () -> validInBatchBefore(index)
        );
    }

    Neighbors neighbors(int index, List<DailyCandle> trusted) {
        LocalDate date = batch.get(index).date();
        Optional<DailyCandle> before = firstPresent(
            () -> latestBefore(trusted, date),
            () -> validInBatchBefore(index),
            () -> contextBefore(date)
        );
        Optional<DailyCandle> after = firstPresent(
            () -> validInBatchAfter(index),
            () -> contextAfter(date)
        );
        return new Neighbors(before, after);
    }

    /** Whether {@code batch[index]} passes validation with no predecessor. Memoized. */
    boolean isStandaloneValid(int index) {
        if (standaloneValid[index] == null) {
            standaloneValid[index] = validator.validate(batch.get(index), null, context).allValid();
        }
        return standaloneValid[index];
    }

    @SafeVarargs
    private static Optional<DailyCandle> firstPresent(Supplier<Optional<DailyCandle>>... sources) {
        return Stream.of(sources)
            .map(Supplier::get)
            .flatMap(Optional::stream)
            .findFirst();
    }

    private static Optional<DailyCandle> latestBefore(List<DailyCandle> trusted, LocalDate date) {
        for (int j = trusted.size() - 1; j >= 0; j--) {
            if (trusted.get(j).date().isBefore(date)) {
                return Optional.of(trusted.get(j));
            }
        }
        return Optional.empty();
    }

    private Optional<DailyCandle> validInBatchBefore(int index) {
        for (int j = index - 1; j >= 0; j--) {
            if (isStandaloneValid(j)) {
                return Optional.of(batch.get(j));
            }
        }
        return Optional.empty();
    }

    private Optional<DailyCandle> validInBatchAfter(int index) {
        for (int j = index + 1; j < batch.size(); j++) {
            if (isStandaloneValid(j)) {
                return Optional.of(batch.get(j));
            }
        }
        return Optional.empty();
    }

    private Optional<DailyCandle> contextBefore(LocalDate date) {
        return context.stream()
            .filter(c -> c.close() > 0 && c.date().isBefore(date))
            .max(Comparator.comparing(DailyCandle::date));
    }

    private Optional<DailyCandle> contextAfter(LocalDate date) {
        return context.stream()
            .filter(c -> c.close() > 0 && c.date().isAfter(date))
            .min(Comparator.comparing(DailyCandle::date));
    }
}
