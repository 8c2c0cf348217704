package de.mirkosertic.mcp.coursesync.tree;

/**
 * Multi-page container found inside a section directory.
 */
public enum BookKind {
    /** Chapters rendered as a book. */
    BOOK,
    /** Pages rendered as a lesson, marked by a lesson metadata file. */
    LESSON
}
