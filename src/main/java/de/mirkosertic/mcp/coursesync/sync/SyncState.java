package de.mirkosertic.mcp.coursesync.sync;

import org.jspecify.annotations.Nullable;

/**
 * Last snapshot marker of a course.
 *
 * @param lastSnapshotIdentity snapshot of the last successful run
 * @param lastSyncTimeMs       epoch millis of the last successful run
 * @param lastStatus           status of the most recent run
 */
public record SyncState(
        @Nullable String lastSnapshotIdentity,
        long lastSyncTimeMs,
        @Nullable SyncStatus lastStatus
) {

    public static SyncState initial() {
        return new SyncState(null, 0L, null);
    }
}
