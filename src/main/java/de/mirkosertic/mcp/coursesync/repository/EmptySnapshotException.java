package de.mirkosertic.mcp.coursesync.repository;

/**
 * The tree listing of a snapshot contained no entries, which points at a wrong repository or branch.
 */
public class EmptySnapshotException extends TransportException {

    public EmptySnapshotException(final String message) {
        super(message);
    }
}
