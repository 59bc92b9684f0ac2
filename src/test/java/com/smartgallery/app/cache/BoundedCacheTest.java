package com.smartgallery.app.cache;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BoundedCacheTest {

    private final AtomicLong now = new AtomicLong(1_000);

    private BoundedCache<String, Integer> cache(int maxSize, Duration ttl) {
        return new BoundedCache<>(maxSize, ttl, now::get);
    }

    @Test
    void evictsOldestInsertionNotLeastRecentlyRead() {
        BoundedCache<String, Integer> c = cache(3, Duration.ofMinutes(5));
        c.set("a", 1);
        now.addAndGet(10);
        c.set("b", 2);
        now.addAndGet(10);
        c.set("c", 3);
        assertEquals(1, c.get("a"));

        c.set("d", 4);

        assertNull(c.get("a"), "a was inserted first even though it was read last");
        assertEquals(2, c.get("b"));
        assertEquals(3, c.size());
    }

    @Test
    void sameInstantEvictsEarliestInserted() {
        BoundedCache<String, Integer> c = cache(2, Duration.ofMinutes(5));
        c.set("a", 1);
        c.set("b", 2);
        c.set("c", 3);

        assertNull(c.get("a"));
        assertEquals(2, c.get("b"));
        assertEquals(3, c.get("c"));
    }

    @Test
    void overwritingAtCapacityDoesNotEvict() {
        BoundedCache<String, Integer> c = cache(2, Duration.ofMinutes(5));
        c.set("a", 1);
        c.set("b", 2);
        c.set("a", 10);

        assertEquals(10, c.get("a"));
        assertEquals(2, c.get("b"));
    }

    @Test
    void neverExceedsMaxSize() {
        BoundedCache<Integer, Integer> c = new BoundedCache<>(50, Duration.ofMinutes(5), now::get);
        for (int i = 0; i < 500; i++) {
            c.set(i, i);
            now.incrementAndGet();
            assertTrue(c.size() <= 50);
        }
        assertEquals(50, c.size());
        assertEquals(499, c.get(499));
        assertNull(c.get(449));
    }

    @Test
    void expiredEntriesAreMissesAndDropped() {
        BoundedCache<String, Integer> c = cache(5, Duration.ofSeconds(300));
        c.set("k", 1);

        now.addAndGet(Duration.ofSeconds(300).toNanos());
        assertEquals(1, c.get("k"), "exactly at the ttl is still live");

        now.addAndGet(1);
        assertNull(c.get("k"));
        assertEquals(0, c.size());

        CacheStats stats = c.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(50.0, stats.hitRate());
    }

    @Test
    void loaderResultIsStored() {
        BoundedCache<String, Integer> c = cache(5, Duration.ofMinutes(5));
        AtomicInteger loads = new AtomicInteger();

        assertEquals(7, c.get("x", () -> { loads.incrementAndGet(); return 7; }));
        assertEquals(7, c.get("x", () -> { loads.incrementAndGet(); return 8; }));
        assertEquals(1, loads.get());
        assertNull(c.get("y", () -> null));
        assertEquals(1, c.size());
    }

    @Test
    void clearResetsEntriesAndCounters() {
        BoundedCache<String, Integer> c = cache(5, Duration.ofMinutes(5));
        c.set("a", 1);
        c.get("a");
        c.get("b");

        c.clear();

        CacheStats stats = c.stats();
        assertEquals(0, stats.size());
        assertEquals(5, stats.maxSize());
        assertEquals(0, stats.hits());
        assertEquals(0, stats.misses());
        assertEquals(0.0, stats.hitRate());
    }

    @Test
    void removeKeepsCounters() {
        BoundedCache<String, Integer> c = cache(5, Duration.ofMinutes(5));
        c.set("a", 1);
        c.get("a");

        assertEquals(1, c.remove("a"));
        assertNull(c.remove("a"));
        assertEquals(1, c.stats().hits());
    }

    @Test
    void rejectsBadArguments() {
        assertThrows(IllegalArgumentException.class, () -> cache(0, Duration.ofMinutes(1)));
        assertThrows(NullPointerException.class, () -> cache(1, Duration.ofMinutes(1)).set("a", null));
    }

    @Test
    void concurrentWritersStayBounded() throws Exception {
        BoundedCache<Integer, Integer> c = new BoundedCache<>(20, Duration.ofMinutes(5));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            for (int t = 0; t < 4; t++) {
                int base = t * 1000;
                pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 500; i++) {
                        c.set(base + i, i);
                        c.get(base + i / 2);
                    }
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20, c.size());
    }
}
