package com.smartgallery.app.cache;

/** Snapshot of a {@link BoundedCache}'s occupancy and hit accounting. */
public record CacheStats(int size, int maxSize, long hits, long misses) {

    /** Hits over lookups, as a percentage; 0 before the first lookup. */
    public double hitRate() {
        long total = hits + misses;
        return total == 0 ? 0.0 : (hits * 100.0) / total;
    }
}
