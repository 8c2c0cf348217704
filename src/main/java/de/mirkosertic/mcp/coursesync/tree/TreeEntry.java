package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;

/**
 * One path of a recursive repository listing. Paths are {@code /}-separated, case-sensitive
 * and relative to the repository root.
 *
 * @param blobSha git object id when the listing supplies one, used for content caching only
 */
public record TreeEntry(String path, EntryKind kind, long size, @Nullable String blobSha) {

    public static TreeEntry blob(final String path) {
        return new TreeEntry(path, EntryKind.BLOB, 0, null);
    }

    public static TreeEntry tree(final String path) {
        return new TreeEntry(path, EntryKind.TREE, 0, null);
    }

    public boolean isBlob() {
        return kind == EntryKind.BLOB;
    }

    public boolean isTree() {
        return kind == EntryKind.TREE;
    }
}
