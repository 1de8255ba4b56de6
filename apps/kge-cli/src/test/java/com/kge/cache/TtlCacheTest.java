package com.kge.cache;

import com.kge.testutil.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TtlCacheTest {

    MutableClock clock;
    TtlCache<String, String> cache;
    AtomicInteger fetches;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new TtlCache<>(Duration.ofSeconds(10), clock);
        fetches = new AtomicInteger();
    }

    private String load() {
        return "v" + fetches.incrementAndGet();
    }

    @Test
    void readsWithinTtlFetchOnce() {
        assertEquals("v1", cache.getOrFetch("default", this::load));
        clock.advance(Duration.ofSeconds(9));
        assertEquals("v1", cache.getOrFetch("default", this::load));
        assertEquals(1, fetches.get());
    }

    @Test
    void readAfterTtlFetchesAgainAndReturnsNewValue() {
        cache.getOrFetch("default", this::load);
        clock.advance(Duration.ofSeconds(10));
        assertEquals("v2", cache.getOrFetch("default", this::load));
        assertEquals(2, fetches.get());
        assertEquals(clock.instant(), cache.peek("default").orElseThrow().fetchedAt());
    }

    @Test
    void keysAreCachedIndependently() {
        assertEquals("v1", cache.getOrFetch("a", this::load));
        assertEquals("v2", cache.getOrFetch("b", this::load));
        assertEquals("v1", cache.getOrFetch("a", this::load));
    }

    @Test
    void failedFetchKeepsPreviousEntry() {
        cache.getOrFetch("default", this::load);
        clock.advance(Duration.ofSeconds(30));

        assertThrows(IllegalStateException.class, () -> cache.getOrFetch("default", () -> {
            throw new IllegalStateException("boom");
        }));

        var entry = cache.peek("default").orElseThrow();
        assertEquals("v1", entry.value());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), entry.fetchedAt());
    }

    @Test
    void failedFetchOnEmptyCacheStoresNothing() {
        assertThrows(IllegalStateException.class, () -> cache.getOrFetch("default", () -> {
            throw new IllegalStateException("boom");
        }));
        assertTrue(cache.peek("default").isEmpty());
    }

    @Test
    void entryExactlyTtlOldIsRefetched() {
        cache.getOrFetch("default", this::load);
        clock.advance(Duration.ofSeconds(10));
        assertEquals("v2", cache.getOrFetch("default", this::load));
    }
}
