package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;
import de.mirkosertic.mcp.coursesync.sync.BatchResult;
import de.mirkosertic.mcp.coursesync.sync.SyncStatus;

import java.util.List;

/**
 * Response DTO for the syncAllCourses tool. Individual course failures do not fail the batch.
 */
public record SyncAllCoursesResponse(
        boolean success,
        long synchronizedCount,
        long upToDateCount,
        long failedCount,
        List<CourseResult> courses,
        String error
) implements ToolResponse {

    public record CourseResult(String courseId, String status, String summary) {
    }

    public static SyncAllCoursesResponse success(final BatchResult batch) {
        final List<CourseResult> courses = batch.results().stream()
                .map(result -> new CourseResult(result.courseId(), result.outcome().status().code(),
                        result.outcome().summary()))
                .toList();
        return new SyncAllCoursesResponse(true, batch.count(SyncStatus.SUCCESS), batch.count(SyncStatus.UP_TO_DATE),
                batch.count(SyncStatus.FAILED), courses, null);
    }

    public static SyncAllCoursesResponse error(final String errorMessage) {
        return new SyncAllCoursesResponse(false, 0, 0, 0, null, errorMessage);
    }
}
