package de.mirkosertic.mcp.coursesync.content;

import java.util.Map;

/**
 * @param pageIds lesson page id per import key
 */
public record LessonCreation(String lessonId, Map<String, String> pageIds) {

    public LessonCreation {
        pageIds = Map.copyOf(pageIds);
    }
}
