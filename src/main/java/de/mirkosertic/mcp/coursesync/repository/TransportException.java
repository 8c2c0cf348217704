package de.mirkosertic.mcp.coursesync.repository;

import de.mirkosertic.mcp.coursesync.sync.SyncException;

/**
 * Network, authentication or rate-limit failure while talking to the repository host.
 */
public class TransportException extends SyncException {

    private final int statusCode;

    public TransportException(final String message) {
        this(message, -1);
    }

    public TransportException(final String message, final int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /**
     * HTTP status of the failed request, -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
