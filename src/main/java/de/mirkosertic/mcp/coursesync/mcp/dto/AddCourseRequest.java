package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the addCourse tool.
 */
public record AddCourseRequest(
        @Description("Id of the course, letters, digits, '.', '_' and '-' only")
        String courseId,

        @Description("GitHub repository URL, e.g. https://github.com/owner/repo")
        String repoUrl,

        @Description("Branch to follow. Defaults to the configured default branch.")
        @Nullable String branch,

        @Description("Name of the environment variable holding the access token. Defaults to the configured one.")
        @Nullable String tokenEnv,

        @Description("If true, the scheduled batch synchronizes this course. Default is false.")
        @Nullable Boolean autoSync,

        @Description("If true, start a sync of the course right away. Default is false.")
        @Nullable Boolean syncNow
) {
    public static AddCourseRequest fromMap(final Map<String, Object> args) {
        return new AddCourseRequest(
                (String) args.get("courseId"),
                (String) args.get("repoUrl"),
                (String) args.get("branch"),
                (String) args.get("tokenEnv"),
                (Boolean) args.get("autoSync"),
                (Boolean) args.get("syncNow")
        );
    }

    public boolean effectiveAutoSync() {
        return autoSync != null && autoSync;
    }

    public boolean effectiveSyncNow() {
        return syncNow != null && syncNow;
    }
}
