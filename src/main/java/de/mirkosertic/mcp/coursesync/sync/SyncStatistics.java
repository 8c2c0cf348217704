package de.mirkosertic.mcp.coursesync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Map;

/**
 * Process-wide statistics of synchronization runs since startup.
 */
public record SyncStatistics(
        long runsStarted,
        long runsSucceeded,
        long runsUpToDate,
        long runsFailed,
        /** Entities created, updated, hidden, shown, moved or removed by successful runs. */
        long entitiesChanged,
        long assetsUploaded,
        long totalRunTimeMs,
        long startTimeMs,
        Map<String, CourseStatistics> perCourseStats,
        /** Courses with a run in progress. */
        List<ActiveSync> activeSyncs
) {

    public double averageRunTimeMs() {
        final long finished = runsSucceeded + runsUpToDate + runsFailed;
        if (finished == 0) return 0;
        return (double) totalRunTimeMs / finished;
    }

    public record CourseStatistics(
            String courseId,
            long runs,
            long failures,
            @Nullable SyncStatus lastStatus,
            long lastRunTimeMs,
            long lastDurationMs
    ) {
    }

    public record ActiveSync(String courseId, String triggeringUser, long runningForMs) {
    }
}
