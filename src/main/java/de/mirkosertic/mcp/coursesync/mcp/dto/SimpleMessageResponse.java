package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

/**
 * Response DTO for tools that only report a message, such as removeCourse.
 */
public record SimpleMessageResponse(
        boolean success,
        String message,
        String error
) implements ToolResponse {

    public static SimpleMessageResponse success(final String message) {
        return new SimpleMessageResponse(true, message, null);
    }

    public static SimpleMessageResponse error(final String errorMessage) {
        return new SimpleMessageResponse(false, null, errorMessage);
    }
}
