package de.mirkosertic.mcp.coursesync.sync;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Durable record of one run, written once per run whatever its outcome.
 *
 * @param triggeringUser who or what started the run, e.g. {@code mcp}, {@code scheduler}
 * @param timestamp      epoch millis of the end of the run
 */
public record SyncHistoryRecord(
        String scopeId,
        String triggeringUser,
        @Nullable String snapshotIdentity,
        SyncStatus status,
        String summary,
        List<OperationLogEntry> operations,
        long timestamp
) {

    public SyncHistoryRecord {
        operations = List.copyOf(operations);
    }
}
