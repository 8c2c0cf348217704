package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;

/**
 * Response DTO for the testConnection tool.
 */
public record TestConnectionResponse(
        boolean success,
        String courseId,
        String repository,
        Boolean reachable,
        Integer rateLimitRemaining,
        Long rateLimitReset,
        String error
) implements ToolResponse {

    public static TestConnectionResponse success(final String courseId, final String repository,
                                                 final boolean reachable, final int rateLimitRemaining,
                                                 final long rateLimitReset) {
        return new TestConnectionResponse(true, courseId, repository, reachable, rateLimitRemaining, rateLimitReset,
                null);
    }

    public static TestConnectionResponse error(final String errorMessage) {
        return new TestConnectionResponse(false, null, null, null, null, null, errorMessage);
    }
}
