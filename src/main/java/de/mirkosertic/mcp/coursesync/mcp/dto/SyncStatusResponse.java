package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;
import de.mirkosertic.mcp.coursesync.sync.CourseRegistration;
import de.mirkosertic.mcp.coursesync.sync.SyncState;

import java.time.Instant;

/**
 * Response DTO for the getSyncStatus tool.
 */
public record SyncStatusResponse(
        boolean success,
        String courseId,
        String repoUrl,
        String branch,
        Boolean autoSync,
        String lastSnapshotIdentity,
        String lastSyncTime,
        String lastStatus,
        Boolean running,
        String error
) implements ToolResponse {

    public static SyncStatusResponse success(final CourseRegistration course, final SyncState state,
                                             final boolean running) {
        return new SyncStatusResponse(
                true,
                course.courseId(),
                course.repoUrl(),
                course.branch(),
                course.autoSync(),
                state.lastSnapshotIdentity(),
                state.lastSyncTimeMs() > 0 ? Instant.ofEpochMilli(state.lastSyncTimeMs()).toString() : null,
                state.lastStatus() != null ? state.lastStatus().code() : null,
                running,
                null
        );
    }

    public static SyncStatusResponse error(final String errorMessage) {
        return new SyncStatusResponse(false, null, null, null, null, null, null, null, null, errorMessage);
    }
}
