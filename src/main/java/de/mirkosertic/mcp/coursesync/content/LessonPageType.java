package de.mirkosertic.mcp.coursesync.content;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Lesson page kinds selectable through the {@code pagetype} front matter key.
 * Absent or unknown page types produce content pages.
 */
public enum LessonPageType {
    CONTENT("content"),
    TRUE_FALSE("truefalse"),
    MULTI_CHOICE("multichoice");

    private final String typeName;

    LessonPageType(final String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    public static LessonPageType fromName(final @Nullable String name) {
        if (name == null) {
            return CONTENT;
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final LessonPageType type : values()) {
            if (type.typeName.equals(normalized)) {
                return type;
            }
        }
        return CONTENT;
    }
}
