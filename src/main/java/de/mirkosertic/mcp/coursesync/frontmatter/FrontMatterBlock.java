package de.mirkosertic.mcp.coursesync.frontmatter;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the delimited metadata block at the very start of a text.
 */
final class FrontMatterBlock {

    private static final Pattern BLOCK = Pattern.compile("\\A---\\s*\\n(.*?)\\n---\\s*\\n", Pattern.DOTALL);

    static final Pattern KEY_VALUE = Pattern.compile("^([a-zA-Z_]+)\\s*:\\s*(.*)$");

    private final List<String> lines;
    private final String body;

    private FrontMatterBlock(final List<String> lines, final String body) {
        this.lines = lines;
        this.body = body;
    }

    static @Nullable FrontMatterBlock find(final String text) {
        final Matcher matcher = BLOCK.matcher(text);
        if (!matcher.find()) {
            return null;
        }
        return new FrontMatterBlock(List.of(matcher.group(1).split("\n", -1)), text.substring(matcher.end()));
    }

    List<String> lines() {
        return lines;
    }

    String body() {
        return body;
    }

    static boolean isSkippable(final String trimmedLine) {
        return trimmedLine.isEmpty() || trimmedLine.charAt(0) == '#';
    }
}
