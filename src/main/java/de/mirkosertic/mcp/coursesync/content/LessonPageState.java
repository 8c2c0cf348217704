package de.mirkosertic.mcp.coursesync.content;

public record LessonPageState(String importKey, String pageId, int position) {
}
