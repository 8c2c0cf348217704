package de.mirkosertic.mcp.coursesync.mcp;

/**
 * Common shape of all tool responses: a success flag and an error message when it is false.
 */
public interface ToolResponse {

    boolean success();

    String error();
}
