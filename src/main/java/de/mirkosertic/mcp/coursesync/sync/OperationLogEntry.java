package de.mirkosertic.mcp.coursesync.sync;

/**
 * One step performed during a run, e.g. {@code page_create} or {@code chapter_hide}.
 *
 * @param timestamp epoch millis
 */
public record OperationLogEntry(String kind, String path, String detail, long timestamp) {
}
