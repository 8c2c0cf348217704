package de.mirkosertic.mcp.coursesync.sync;

import java.io.IOException;
import java.util.List;

public interface SyncHistoryStore {

    void append(SyncHistoryRecord record) throws IOException;

    /**
     * Most recent records of a scope, newest first.
     */
    List<SyncHistoryRecord> list(String scopeId, int limit) throws IOException;
}
