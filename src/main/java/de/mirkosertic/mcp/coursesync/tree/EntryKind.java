package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;

/**
 * Kind of an entry in a repository tree listing.
 */
public enum EntryKind {
    BLOB,
    TREE;

    /**
     * Maps the git object type of a tree entry. Submodule entries ({@code commit}) have no kind.
     */
    public static @Nullable EntryKind fromGitType(final String type) {
        if ("blob".equals(type)) {
            return BLOB;
        }
        if ("tree".equals(type)) {
            return TREE;
        }
        return null;
    }
}
