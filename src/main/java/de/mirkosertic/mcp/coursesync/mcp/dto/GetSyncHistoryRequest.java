package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the getSyncHistory tool.
 */
public record GetSyncHistoryRequest(
        @Description("Id of the registered course")
        String courseId,

        @Description("Maximum number of runs to return, newest first. Default is 10.")
        @Nullable Integer limit,

        @Description("If true, include the operation log of every run. Default is false.")
        @Nullable Boolean includeOperations
) {
    public static final int DEFAULT_LIMIT = 10;
    public static final int MAX_LIMIT = 100;

    public static GetSyncHistoryRequest fromMap(final Map<String, Object> args) {
        final Object limit = args.get("limit");
        return new GetSyncHistoryRequest(
                (String) args.get("courseId"),
                limit instanceof Number number ? number.intValue() : null,
                (Boolean) args.get("includeOperations")
        );
    }

    public int effectiveLimit() {
        if (limit == null || limit < 1) {
            return DEFAULT_LIMIT;
        }
        return Math.min(limit, MAX_LIMIT);
    }

    public boolean effectiveIncludeOperations() {
        return includeOperations != null && includeOperations;
    }
}
