package de.mirkosertic.mcp.coursesync.sync;

import java.util.List;

/**
 * Outcomes of a batch run over several courses, in registration order.
 */
public record BatchResult(List<CourseResult> results) {

    public BatchResult {
        results = List.copyOf(results);
    }

    public long count(final SyncStatus status) {
        return results.stream().filter(result -> result.outcome().status() == status).count();
    }

    public record CourseResult(String courseId, SyncOutcome outcome) {
    }
}
