package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.SortedMap;

/**
 * Typed view of a repository listing as produced by {@link TreeClassifier}.
 */
public record StructuredTree(@Nullable String rootMetadataPath, SortedMap<String, SectionNode> sections,
                             List<String> assets) {
}
