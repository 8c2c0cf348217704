package de.mirkosertic.mcp.coursesync.content;

public enum UpsertOutcome {
    CREATED,
    UPDATED
}
