package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;

import java.util.Map;

/**
 * Request DTO for tools that address a single course.
 */
public record CourseIdRequest(
        @Description("Id of the registered course")
        String courseId
) {
    public static CourseIdRequest fromMap(final Map<String, Object> args) {
        return new CourseIdRequest((String) args.get("courseId"));
    }
}
