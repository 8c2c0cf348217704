package de.mirkosertic.mcp.coursesync.sync;

/**
 * Terminal state of a synchronization run.
 */
public enum SyncStatus {
    UP_TO_DATE("uptodate"),
    SUCCESS("success"),
    FAILED("failed");

    private final String code;

    SyncStatus(final String code) {
        this.code = code;
    }

    /**
     * Persisted and reported form of the status.
     */
    public String code() {
        return code;
    }

    public static SyncStatus fromCode(final String code) {
        for (final SyncStatus status : values()) {
            if (status.code.equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown sync status: " + code);
    }
}
