package de.mirkosertic.mcp.coursesync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Result of one synchronization run as surfaced to callers.
 *
 * @param snapshotIdentity snapshot the run observed, null if it failed before resolving one
 */
public record SyncOutcome(
        SyncStatus status,
        @Nullable String snapshotIdentity,
        String summary,
        @Nullable SyncCounters counters,
        List<OperationLogEntry> operations
) {

    public static final String FAILURE_SUMMARY = "Sync failed. Check the sync history for details.";

    public SyncOutcome {
        operations = List.copyOf(operations);
    }

    public static SyncOutcome upToDate(final String snapshotIdentity) {
        return new SyncOutcome(SyncStatus.UP_TO_DATE, snapshotIdentity,
                "Already up to date (commit " + shortId(snapshotIdentity) + ").", null, List.of());
    }

    public static SyncOutcome success(final String snapshotIdentity, final SyncCounters counters,
                                      final List<OperationLogEntry> operations) {
        return new SyncOutcome(SyncStatus.SUCCESS, snapshotIdentity, counters.summary(), counters, operations);
    }

    public static SyncOutcome failed(final @Nullable String snapshotIdentity, final List<OperationLogEntry> operations) {
        return new SyncOutcome(SyncStatus.FAILED, snapshotIdentity, FAILURE_SUMMARY, null, operations);
    }

    static String shortId(final String snapshotIdentity) {
        return snapshotIdentity.length() > 7 ? snapshotIdentity.substring(0, 7) : snapshotIdentity;
    }
}
