package de.mirkosertic.mcp.coursesync.frontmatter;

/**
 * Parses standalone metadata files such as {@code course.yaml}, {@code section.yaml},
 * {@code book.yaml} and {@code lesson.yaml} into a flat top-level mapping.
 */
public interface MetadataParser {

    /**
     * Never throws for malformed input; degraded results carry a fallback warning instead.
     */
    MetadataParseResult parse(String content);

    String name();
}
