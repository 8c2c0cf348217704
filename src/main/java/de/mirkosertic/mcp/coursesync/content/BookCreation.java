package de.mirkosertic.mcp.coursesync.content;

import java.util.Map;

/**
 * Result of creating a book together with all of its chapters.
 *
 * @param chapterIds chapter id per import key
 */
public record BookCreation(String bookId, Map<String, String> chapterIds) {

    public BookCreation {
        chapterIds = Map.copyOf(chapterIds);
    }
}
