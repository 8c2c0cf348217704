package de.mirkosertic.mcp.coursesync.content;

import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * Activity types selectable through the {@code type} front matter key.
 */
public enum ActivityType {
    PAGE("page"),
    LABEL("label"),
    URL("url");

    private final String typeName;

    ActivityType(final String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Resolves a front matter type, {@code page} when absent.
     */
    public static ActivityType fromName(final @Nullable String name) throws UnsupportedActivityException {
        if (name == null || name.isBlank()) {
            return PAGE;
        }
        final String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (final ActivityType type : values()) {
            if (type.typeName.equals(normalized)) {
                return type;
            }
        }
        throw new UnsupportedActivityException(name, "Unsupported activity type: " + name);
    }
}
