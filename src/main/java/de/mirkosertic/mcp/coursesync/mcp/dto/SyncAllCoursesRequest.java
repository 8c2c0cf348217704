package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the syncAllCourses tool.
 */
public record SyncAllCoursesRequest(
        @Description("If true, only courses with auto-sync enabled are synchronized. Default is false.")
        @Nullable Boolean autoSyncOnly
) {
    public static SyncAllCoursesRequest fromMap(final Map<String, Object> args) {
        return new SyncAllCoursesRequest((Boolean) args.get("autoSyncOnly"));
    }

    public boolean effectiveAutoSyncOnly() {
        return autoSyncOnly != null && autoSyncOnly;
    }
}
