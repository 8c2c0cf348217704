package de.mirkosertic.mcp.coursesync.frontmatter;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Metadata block parsed from the head of a content file, plus the remaining body.
 * <p>
 * Metadata values are {@link String}, {@link Boolean}, {@link Integer} (nested parser only)
 * or {@link List} whose items are either scalars or {@code Map<String, Object>}.
 */
public record FrontMatter(Map<String, Object> metadata, String body) {

    public FrontMatter {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static FrontMatter empty(final String body) {
        return new FrontMatter(Map.of(), body);
    }

    public boolean hasMetadata() {
        return !metadata.isEmpty();
    }

    public @Nullable String getString(final String key) {
        final Object value = metadata.get(key);
        return value != null ? value.toString() : null;
    }

    public String getString(final String key, final String defaultValue) {
        final String value = getString(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    public boolean getBoolean(final String key, final boolean defaultValue) {
        final Object value = metadata.get(key);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return "true".equalsIgnoreCase(s) || "1".equals(s);
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return defaultValue;
    }

    public List<Object> getList(final String key) {
        final Object value = metadata.get(key);
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(list);
        }
        return List.of();
    }
}
