package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

/**
 * Response DTO for the addCourse tool.
 */
public record AddCourseResponse(
        boolean success,
        String message,
        String courseId,
        Boolean created,
        Boolean syncStarted,
        Integer totalCourses,
        String error
) implements ToolResponse {

    public static AddCourseResponse success(final String message, final String courseId, final boolean created,
                                            final boolean syncStarted, final int totalCourses) {
        return new AddCourseResponse(true, message, courseId, created, syncStarted, totalCourses, null);
    }

    public static AddCourseResponse error(final String errorMessage) {
        return new AddCourseResponse(false, null, null, null, null, null, errorMessage);
    }
}
