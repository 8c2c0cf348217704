package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.Description;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * Request DTO for the searchCourseContent tool.
 */
public record SearchContentRequest(
        @Description("Lucene query over the synced page, chapter and lesson page content")
        String query,

        @Description("Limit the search to one course")
        @Nullable String courseId,

        @Description("Page number, starting at 0. Default is 0.")
        @Nullable Integer page,

        @Description("Results per page, at most 100. Default is 10.")
        @Nullable Integer pageSize
) {
    public static final int DEFAULT_PAGE_SIZE = 10;
    public static final int MAX_PAGE_SIZE = 100;

    public static SearchContentRequest fromMap(final Map<String, Object> args) {
        final Object page = args.get("page");
        final Object pageSize = args.get("pageSize");
        return new SearchContentRequest(
                (String) args.get("query"),
                (String) args.get("courseId"),
                page instanceof Number number ? number.intValue() : null,
                pageSize instanceof Number number ? number.intValue() : null
        );
    }

    public int effectivePage() {
        return page != null && page > 0 ? page : 0;
    }

    public int effectivePageSize() {
        if (pageSize == null || pageSize < 1) {
            return DEFAULT_PAGE_SIZE;
        }
        return Math.min(pageSize, MAX_PAGE_SIZE);
    }
}
