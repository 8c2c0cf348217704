package de.mirkosertic.mcp.coursesync.repository;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe counters of the repository content cache.
 */
public class ContentCacheStats {

    private final AtomicLong totalRequests = new AtomicLong(0);
    private final AtomicLong cacheHits = new AtomicLong(0);
    private final AtomicLong cacheMisses = new AtomicLong(0);
    private final AtomicLong evictions = new AtomicLong(0);
    private final AtomicLong bytesServed = new AtomicLong(0);

    public void recordHit(final int bytes) {
        totalRequests.incrementAndGet();
        cacheHits.incrementAndGet();
        bytesServed.addAndGet(bytes);
    }

    public void recordMiss() {
        totalRequests.incrementAndGet();
        cacheMisses.incrementAndGet();
    }

    public void recordEviction() {
        evictions.incrementAndGet();
    }

    public long getTotalRequests() {
        return totalRequests.get();
    }

    public long getCacheHits() {
        return cacheHits.get();
    }

    public long getCacheMisses() {
        return cacheMisses.get();
    }

    public long getEvictions() {
        return evictions.get();
    }

    /**
     * Bytes answered from the cache instead of the network.
     */
    public long getBytesServed() {
        return bytesServed.get();
    }

    /**
     * Hit rate as a percentage (0.0 to 100.0).
     */
    public double getHitRate() {
        final long total = totalRequests.get();
        if (total == 0) {
            return 0.0;
        }
        return (cacheHits.get() * 100.0) / total;
    }
}
