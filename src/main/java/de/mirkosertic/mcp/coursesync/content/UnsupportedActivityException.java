package de.mirkosertic.mcp.coursesync.content;

import de.mirkosertic.mcp.coursesync.sync.SyncException;

/**
 * Front matter asks for an activity the content platform cannot build, or lacks a field the
 * requested type requires.
 */
public class UnsupportedActivityException extends SyncException {

    private final String requestedType;

    public UnsupportedActivityException(final String requestedType, final String message) {
        super(message);
        this.requestedType = requestedType;
    }

    public String getRequestedType() {
        return requestedType;
    }
}
