package com.kge.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Keyed cache whose entries expire a fixed time after they were fetched. A failing loader leaves the previous
 * entry untouched.
 */
public class TtlCache<K, V> {

    private final Map<K, CacheEntry<V>> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Clock clock;

    public TtlCache(Duration ttl, Clock clock) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        this.ttl = ttl;
        this.clock = clock;
    }

    public V getOrFetch(K key, Supplier<? extends V> loader) {
        return entries.compute(key, (k, current) -> {
            Instant now = clock.instant();
            if (current != null && current.isFresh(now, ttl)) {
                return current;
            }
            return new CacheEntry<>(loader.get(), now);
        }).value();
    }

    Optional<CacheEntry<V>> peek(K key) {
        return Optional.ofNullable(entries.get(key));
    }

    public record CacheEntry<V>(V value, Instant fetchedAt) {

        boolean isFresh(Instant now, Duration maxAge) {
            return Duration.between(fetchedAt, now).compareTo(maxAge) < 0;
        }
    }
}
