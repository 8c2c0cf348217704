package de.mirkosertic.mcp.coursesync.content;

/**
 * One book chapter as read from the repository.
 *
 * @param importKey  stable key of the chapter, its repository path
 * @param position   1-based page number inside the book
 */
public record ChapterContent(String importKey, String title, String body, boolean subchapter, int position) {
}
