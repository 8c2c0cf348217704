package de.mirkosertic.mcp.coursesync.repository;

import de.mirkosertic.mcp.coursesync.tree.TreeEntry;

import java.util.List;

/**
 * Read access to one branch of a remote repository.
 */
public interface RepositoryClient {

    /**
     * Opaque token of the current branch state, a commit SHA for git hosts.
     */
    String getSnapshotIdentity() throws TransportException;

    /**
     * Flat recursive listing of the branch.
     *
     * @throws EmptySnapshotException if the listing has no entries
     */
    List<TreeEntry> listTree() throws TransportException;

    byte[] getFileContents(String path) throws TransportException;
}
