package de.mirkosertic.mcp.coursesync.content;

/**
 * Where a lesson answer leads to.
 */
public enum LessonJump {
    NEXT_PAGE,
    THIS_PAGE,
    END_OF_LESSON
}
