package de.mirkosertic.mcp.coursesync.mcp.dto;

import de.mirkosertic.mcp.coursesync.mcp.ToolResponse;
import de.mirkosertic.mcp.coursesync.sync.OperationLogEntry;
import de.mirkosertic.mcp.coursesync.sync.SyncHistoryRecord;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for the getSyncHistory tool.
 */
public record SyncHistoryResponse(
        boolean success,
        String courseId,
        List<Run> runs,
        String error
) implements ToolResponse {

    public record Run(
            String time,
            String triggeringUser,
            String snapshotIdentity,
            String status,
            String summary,
            int operationCount,
            List<OperationLogEntry> operations
    ) {
    }

    public static SyncHistoryResponse success(final String courseId, final List<SyncHistoryRecord> records,
                                              final boolean includeOperations) {
        final List<Run> runs = records.stream()
                .map(record -> new Run(
                        Instant.ofEpochMilli(record.timestamp()).toString(),
                        record.triggeringUser(),
                        record.snapshotIdentity(),
                        record.status().code(),
                        record.summary(),
                        record.operations().size(),
                        includeOperations ? record.operations() : null))
                .toList();
        return new SyncHistoryResponse(true, courseId, runs, null);
    }

    public static SyncHistoryResponse error(final String errorMessage) {
        return new SyncHistoryResponse(false, null, null, errorMessage);
    }
}
