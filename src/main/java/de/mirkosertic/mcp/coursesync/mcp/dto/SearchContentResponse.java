package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

import java.util.List;
import java.util.Map;

/**
 * Response DTO for the searchCourseContent tool.
 */
public record SearchContentResponse(
        boolean success,
        List<Map<String, Object>> results,
        Long totalHits,
        Integer page,
        Integer pageSize,
        Integer totalPages,
        Boolean hasNextPage,
        Boolean hasPreviousPage,
        Long searchTimeMs,
        String error
) implements ToolResponse {

    public static SearchContentResponse success(final CourseIndexService.SearchResult result, final long searchTimeMs) {
        return new SearchContentResponse(true, result.documents(), result.totalHits(), result.page(),
                result.pageSize(), result.totalPages(), result.hasNextPage(), result.hasPreviousPage(),
                searchTimeMs, null);
    }

    public static SearchContentResponse error(final String errorMessage) {
        return new SearchContentResponse(false, null, null, null, null, null, null, null, null, errorMessage);
    }
}
