package de.mirkosertic.mcp.coursesync.sync;

/**
 * Base class of all failures that abort a synchronization run.
 */
public class SyncException extends Exception {

    public SyncException(final String message) {
        super(message);
    }

    public SyncException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
