package com.fintech.pricehistory.cache;

import com.fintech.pricehistory.domain.DailyCandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory cache of filtered daily series, one entry per instrument, newest first.
 *
 * Entries live until invalidated; there is no expiry. A single read/write lock guards
 * the map and is held only for the lookup, insert or removal itself, never while a
 * series is being loaded or filtered.
 *
 * A loader takes a {@link Ticket} before reading from storage and stores its result
 * with {@link #putIfUnchanged}. Any invalidation of the key (or of the whole cache) in
 * between makes the ticket stale and the put is refused, so a slow reader can never
 * overwrite the result of a newer sync with pre-sync data.
 */
@Component
public class FilteredPriceCache {

    private static final Logger log = LoggerFactory.getLogger(FilteredPriceCache.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, List<DailyCandle>> entries = new HashMap<>();
    private final Map<String, Long> generations = new HashMap<>();
    private long epoch;

    /** Snapshot of a key's invalidation state, taken before a load. */
    public record Ticket(String instrument, long epoch, long generation) {
    }

    public Optional<List<DailyCandle>> get(String instrument) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(entries.get(instrument));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Ticket ticket(String instrument) {
        lock.readLock().lock();
        try {
            return new Ticket(instrument, epoch, generations.getOrDefault(instrument, 0L));
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Stores a series unless the key was invalidated after the ticket was taken.
     *
     * @return true when the series was stored
     */
    public boolean putIfUnchanged(Ticket ticket, List<DailyCandle> newestFirst) {
        List<DailyCandle> copy = List.copyOf(newestFirst);
        lock.writeLock().lock();
        try {
            if (ticket.epoch() != epoch
                || ticket.generation() != generations.getOrDefault(ticket.instrument(), 0L)) {
                log.debug("Discarded stale cache fill: instrument={}", ticket.instrument());
                return false;
            }
            entries.put(ticket.instrument(), copy);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidate(String instrument) {
        lock.writeLock().lock();
        try {
            entries.remove(instrument);
            generations.merge(instrument, 1L, Long::sum);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void invalidateAll() {
        lock.writeLock().lock();
        try {
            entries.clear();
            generations.clear();
            epoch++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
