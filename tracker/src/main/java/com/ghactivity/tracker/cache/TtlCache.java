package com.ghactivity.tracker.cache;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * In-memory key/value cache with a fixed time-to-live per entry and an upper bound
 * on the number of entries.
 *
 * <p>Expiry is lazy: every {@link #get} and {@link #set} first sweeps out entries whose
 * expiry time has passed. There is no background thread. When the cache is full and a
 * new key arrives, the entry closest to expiry is evicted.</p>
 *
 * <p>Thread-safe: all operations synchronize on the cache instance, so one instance can
 * be shared across request threads.</p>
 *
 * @param <T> the cached value type
 */
public class TtlCache<T> {

    private final Map<String, CacheEntry<T>> entries = new LinkedHashMap<>();
    private final long ttlSeconds;
    private final int maxSize;
    private final Clock clock;

    public TtlCache(long ttlSeconds, int maxSize) {
        this(ttlSeconds, maxSize, Clock.systemUTC());
    }

    public TtlCache(long ttlSeconds, int maxSize, Clock clock) {
        if (ttlSeconds <= 0) {
            throw new IllegalArgumentException("ttlSeconds must be positive, got " + ttlSeconds);
        }
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive, got " + maxSize);
        }
        this.ttlSeconds = ttlSeconds;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * Returns the cached value for {@code key}, or empty if it is missing or expired.
     */
    public synchronized Optional<T> get(String key) {
        Instant now = clock.instant();
        evictExpired(now);
        CacheEntry<T> entry = entries.get(key);
        if (entry == null || !entry.isLiveAt(now)) {
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    /**
     * Stores {@code value} under {@code key} with a fresh expiry. Replacing an existing
     * key never triggers eviction.
     */
    public synchronized void set(String key, T value) {
        Instant now = clock.instant();
        evictExpired(now);
        if (entries.size() >= maxSize && !entries.containsKey(key)) {
            evictSoonestExpiring();
        }
        entries.put(key, new CacheEntry<>(value, now.plusSeconds(ttlSeconds)));
    }

    public synchronized void clear() {
        entries.clear();
    }

    /**
     * Number of live entries.
     */
    public synchronized int size() {
        evictExpired(clock.instant());
        return entries.size();
    }

    private void evictExpired(Instant now) {
        entries.values().removeIf(entry -> !entry.isLiveAt(now));
    }

    // Linear scan; ties go to the first entry in insertion order.
    private void evictSoonestExpiring() {
        String soonestKey = null;
        Instant soonest = null;
        for (Map.Entry<String, CacheEntry<T>> e : entries.entrySet()) {
            Instant expiresAt = e.getValue().expiresAt();
            if (soonest == null || expiresAt.isBefore(soonest)) {
                soonest = expiresAt;
                soonestKey = e.getKey();
            }
        }
        if (soonestKey != null) {
            entries.remove(soonestKey);
        }
    }

    private record CacheEntry<T>(T value, Instant expiresAt) {

        boolean isLiveAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
