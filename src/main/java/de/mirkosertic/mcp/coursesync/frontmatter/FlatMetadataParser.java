package de.mirkosertic.mcp.coursesync.frontmatter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Hand-rolled parser for the {@code key: value} subset of YAML.
 * Document markers, comments, blank lines and indented (nested) lines are skipped.
 */
public class FlatMetadataParser implements MetadataParser {

    @Override
    public MetadataParseResult parse(final String content) {
        return MetadataParseResult.of(parseValues(content));
    }

    Map<String, Object> parseValues(final String content) {
        final Map<String, Object> values = new LinkedHashMap<>();
        for (final String line : content.split("\n")) {
            if (line.isEmpty() || Character.isWhitespace(line.charAt(0))) {
                continue;
            }
            final String trimmed = line.trim();
            if (FrontMatterBlock.isSkippable(trimmed) || "---".equals(trimmed) || "...".equals(trimmed)) {
                continue;
            }
            final Matcher matcher = FrontMatterBlock.KEY_VALUE.matcher(trimmed);
            if (matcher.matches()) {
                values.put(matcher.group(1), ScalarValues.parse(matcher.group(2), true));
            }
        }
        return values;
    }

    @Override
    public String name() {
        return "flat";
    }
}
