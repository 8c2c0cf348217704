package de.mirkosertic.mcp.coursesync.sync;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of the operations of a single run. Used for history only,
 * never to decide what a run does.
 */
public class OperationLog {

    private final List<OperationLogEntry> entries = new ArrayList<>();

    public void log(final String kind, final String path, final String detail) {
        entries.add(new OperationLogEntry(kind, path, detail, System.currentTimeMillis()));
    }

    public List<OperationLogEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public long count(final String kind) {
        return entries.stream().filter(entry -> entry.kind().equals(kind)).count();
    }

    public int size() {
        return entries.size();
    }
}
