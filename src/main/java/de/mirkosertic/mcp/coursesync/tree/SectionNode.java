package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;

import java.util.SortedMap;

/**
 * A section directory with its pages and books, each keyed and ordered by name.
 */
public record SectionNode(String name, String path, @Nullable String metadataPath,
                          SortedMap<String, String> pages, SortedMap<String, BookNode> books) {
}
