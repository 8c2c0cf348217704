package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mapping.MappingRecord;
import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

import java.util.List;

/**
 * Response DTO for the listMappings tool.
 */
public record ListMappingsResponse(
        boolean success,
        String courseId,
        int totalMappings,
        List<MappingRecord> mappings,
        String error
) implements ToolResponse {

    public static ListMappingsResponse success(final String courseId, final List<MappingRecord> mappings) {
        return new ListMappingsResponse(true, courseId, mappings.size(), mappings, null);
    }

    public static ListMappingsResponse error(final String errorMessage) {
        return new ListMappingsResponse(false, null, 0, null, errorMessage);
    }
}
