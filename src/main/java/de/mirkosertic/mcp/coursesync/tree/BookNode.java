package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;

import java.util.SortedMap;

/**
 * A book or lesson directory inside a section.
 *
 * @param name         directory name
 * @param path         repository path of the directory
 * @param metadataPath book or lesson metadata file, matching {@code kind}
 * @param chapters     chapter file name to repository path, in ordinal file name order
 */
public record BookNode(String name, String path, @Nullable String metadataPath, BookKind kind,
                       SortedMap<String, String> chapters) {
}
