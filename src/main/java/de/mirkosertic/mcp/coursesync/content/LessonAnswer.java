package de.mirkosertic.mcp.coursesync.content;

import org.jspecify.annotations.Nullable;

public record LessonAnswer(String text, @Nullable String feedback, boolean correct, int score, LessonJump jump) {

    public LessonAnswer withJump(final LessonJump newJump) {
        return new LessonAnswer(text, feedback, correct, score, newJump);
    }
}
