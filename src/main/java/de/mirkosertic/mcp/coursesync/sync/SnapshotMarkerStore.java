package de.mirkosertic.mcp.coursesync.sync;

import java.io.IOException;

/**
 * Persists the snapshot a course was last synchronized to.
 */
public interface SnapshotMarkerStore {

    SyncState loadSyncState(String courseId);

    void saveSyncState(String courseId, SyncState state) throws IOException;
}
