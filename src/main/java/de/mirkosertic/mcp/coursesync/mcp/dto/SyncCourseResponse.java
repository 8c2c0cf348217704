package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;
import de.mirkosertic.mcp.coursesync.sync.SyncCounters;
import de.mirkosertic.mcp.coursesync.sync.SyncOutcome;

/**
 * Response DTO for the syncCourse tool.
 */
public record SyncCourseResponse(
        boolean success,
        String courseId,
        String status,
        String snapshotIdentity,
        String summary,
        SyncCounters counters,
        Integer operationCount,
        Boolean started,
        String error
) implements ToolResponse {

    public static SyncCourseResponse completed(final String courseId, final SyncOutcome outcome) {
        return new SyncCourseResponse(true, courseId, outcome.status().code(), outcome.snapshotIdentity(),
                outcome.summary(), outcome.counters(), outcome.operations().size(), null, null);
    }

    public static SyncCourseResponse started(final String courseId) {
        return new SyncCourseResponse(true, courseId, null, null, "Sync started in the background.", null, null,
                true, null);
    }

    public static SyncCourseResponse error(final String errorMessage) {
        return new SyncCourseResponse(false, null, null, null, null, null, null, null, errorMessage);
    }
}
