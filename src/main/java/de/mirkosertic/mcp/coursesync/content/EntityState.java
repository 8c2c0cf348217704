package de.mirkosertic.mcp.coursesync.content;

public enum EntityState {
    VISIBLE,
    HIDDEN,
    MISSING
}
