package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the syncCourse tool.
 */
public record SyncCourseRequest(
        @Description("Id of the registered course")
        String courseId,

        @Description("If true, start the sync in the background and return immediately. Default is false.")
        @Nullable Boolean async
) {
    public static SyncCourseRequest fromMap(final Map<String, Object> args) {
        return new SyncCourseRequest(
                (String) args.get("courseId"),
                (Boolean) args.get("async")
        );
    }

    public boolean effectiveAsync() {
        return async != null && async;
    }
}
