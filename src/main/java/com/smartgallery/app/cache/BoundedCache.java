package com.smartgallery.app.cache;

import java.time.Duration;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Size- and age-bounded key/value cache.
 * <ul>
 *   <li>At most {@code maxSize} live entries; inserting a new key at capacity evicts the entry with
 *       the oldest insertion time (not the least recently read).</li>
 *   <li>An entry older than {@code ttl} counts as a miss and is dropped on that lookup.</li>
 *   <li>Every operation runs under one lock.</li>
 * </ul>
 */
public final class BoundedCache<K, V> {

    private static final class Entry<V> {
        final V value;
        final long storedAt;
        final long seq;

        Entry(V value, long storedAt, long seq) {
            this.value = value;
            this.storedAt = storedAt;
            this.seq = seq;
        }
    }

    private final int maxSize;
    private final long ttlNanos;
    private final LongSupplier clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<K, Entry<V>> data = new HashMap<>();

    private long seq;
    private long hits;
    private long misses;

    public BoundedCache(int maxSize, Duration ttl) {
        this(maxSize, ttl, System::nanoTime);
    }

    /** @param clock monotonic nanosecond source */
    public BoundedCache(int maxSize, Duration ttl, LongSupplier clock) {
        if (maxSize < 1) throw new IllegalArgumentException("maxSize must be >= 1");
        this.maxSize = maxSize;
        this.ttlNanos = Objects.requireNonNull(ttl, "ttl").toNanos();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public V get(K key) {
        lock.lock();
        try {
            Entry<V> e = data.get(key);
            if (e == null) {
                misses++;
                return null;
            }
            if (clock.getAsLong() - e.storedAt > ttlNanos) {
                data.remove(key);
                misses++;
                return null;
            }
            hits++;
            return e.value;
        } finally {
            lock.unlock();
        }
    }

    public void set(K key, V value) {
        Objects.requireNonNull(value, "value");
        lock.lock();
        try {
            if (!data.containsKey(key) && data.size() >= maxSize) {
                evictOldest();
            }
            data.put(key, new Entry<>(value, clock.getAsLong(), seq++));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cached value, or the loader's result stored under the key. The loader runs outside the
     * lock, so two callers may both load on a cold key.
     */
    public V get(K key, Supplier<V> loader) {
        V cached = get(key);
        if (cached != null) return cached;
        V loaded = loader.get();
        if (loaded != null) set(key, loaded);
        return loaded;
    }

    public V remove(K key) {
        lock.lock();
        try {
            Entry<V> e = data.remove(key);
            return e == null ? null : e.value;
        } finally {
            lock.unlock();
        }
    }

    /** Drops all entries and resets the hit/miss counters. */
    public void clear() {
        lock.lock();
        try {
            data.clear();
            hits = 0;
            misses = 0;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return data.size();
        } finally {
            lock.unlock();
        }
    }

    public CacheStats stats() {
        lock.lock();
        try {
            return new CacheStats(data.size(), maxSize, hits, misses);
        } finally {
            lock.unlock();
        }
    }

    private void evictOldest() {
        K oldestKey = null;
        Entry<V> oldest = null;
        for (Iterator<Map.Entry<K, Entry<V>>> it = data.entrySet().iterator(); it.hasNext(); ) {
            Map.Entry<K, Entry<V>> me = it.next();
            Entry<V> e = me.getValue();
            if (oldest == null || e.storedAt < oldest.storedAt
                    || (e.storedAt == oldest.storedAt && e.seq < oldest.seq)) {
                oldest = e;
                oldestKey = me.getKey();
            }
        }
        if (oldest != null) {
            data.remove(oldestKey);
        }
    }
}
