package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;
import de.mirkosertic.mcp.coursesync.repository.ContentCacheStats;
import de.mirkosertic.mcp.coursesync.sync.SyncStatistics;

/**
 * Response DTO for the getSyncStatistics tool.
 */
public record SyncStatisticsResponse(
        boolean success,
        SyncStatistics statistics,
        Double averageRunTimeMs,
        CacheInfo contentCache,
        Long indexDocumentCount,
        String error
) implements ToolResponse {

    public record CacheInfo(long requests, long hits, long misses, long evictions, long bytesServed, double hitRate) {
    }

    public static SyncStatisticsResponse success(final SyncStatistics statistics, final ContentCacheStats cacheStats,
                                                 final long indexDocumentCount) {
        return new SyncStatisticsResponse(true, statistics, statistics.averageRunTimeMs(),
                new CacheInfo(cacheStats.getTotalRequests(), cacheStats.getCacheHits(), cacheStats.getCacheMisses(),
                        cacheStats.getEvictions(), cacheStats.getBytesServed(), cacheStats.getHitRate()),
                indexDocumentCount, null);
    }

    public static SyncStatisticsResponse error(final String errorMessage) {
        return new SyncStatisticsResponse(false, null, null, null, null, errorMessage);
    }
}
