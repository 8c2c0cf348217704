package de.mirkosertic.mcp.coursesync.frontmatter;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Values read from a standalone metadata file.
 *
 * @param values          the parsed top-level mapping, never null
 * @param fallbackWarning set when the structured parse failed and the flat parser produced the values
 */
public record MetadataParseResult(Map<String, Object> values, @Nullable String fallbackWarning) {

    public MetadataParseResult {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MetadataParseResult of(final Map<String, Object> values) {
        return new MetadataParseResult(values, null);
    }

    public static MetadataParseResult fallback(final Map<String, Object> values, final String warning) {
        return new MetadataParseResult(values, warning);
    }

    public boolean usedFallback() {
        return fallbackWarning != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
