package de.mirkosertic.mcp.coursesync.content;

/**
 * Stored state of a book chapter.
 */
public record ChapterState(String importKey, String chapterId, int position, boolean hidden) {
}
