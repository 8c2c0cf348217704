package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for the listCourses tool.
 */
public record ListCoursesResponse(
        boolean success,
        int totalCourses,
        List<CourseInfo> courses,
        String error
) implements ToolResponse {

    public record CourseInfo(
            String courseId,
            String repoUrl,
            String branch,
            String tokenEnv,
            boolean autoSync,
            String lastStatus,
            String lastSnapshotIdentity
    ) {
    }

    public static ListCoursesResponse success(final List<CourseInfo> courses) {
        return new ListCoursesResponse(true, courses.size(), courses, null);
    }

    public static ListCoursesResponse error(final String errorMessage) {
        return new ListCoursesResponse(false, 0, null, errorMessage);
    }
}
