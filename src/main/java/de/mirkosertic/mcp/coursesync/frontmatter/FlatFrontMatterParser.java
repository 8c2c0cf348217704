package de.mirkosertic.mcp.coursesync.frontmatter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Front-matter parser for flat {@code key: value} blocks, used for section pages and book chapters.
 * Values are strings or booleans.
 */
public class FlatFrontMatterParser implements FrontMatterParser {

    @Override
    public FrontMatter parse(final String text) {
        final FrontMatterBlock block = FrontMatterBlock.find(text);
        if (block == null) {
            return FrontMatter.empty(text);
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        for (final String line : block.lines()) {
            final String trimmed = line.trim();
            if (FrontMatterBlock.isSkippable(trimmed)) {
                continue;
            }
            final Matcher matcher = FrontMatterBlock.KEY_VALUE.matcher(trimmed);
            if (matcher.matches()) {
                metadata.put(matcher.group(1), ScalarValues.parse(matcher.group(2), false));
            }
        }
        return new FrontMatter(metadata, block.body());
    }
}
