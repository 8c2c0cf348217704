package de.mirkosertic.mcp.coursesync.sync;

import de.mirkosertic.mcp.coursesync.repository.EmptySnapshotException;
import de.mirkosertic.mcp.coursesync.repository.RepositoryClient;
import de.mirkosertic.mcp.coursesync.repository.TransportException;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-memory repository branch. Directory entries are derived from the file paths.
 */
class FakeRepositoryClient implements RepositoryClient {

    private final Map<String, String> files = new LinkedHashMap<>();
    private String snapshot = "0000000";
    private int listTreeCalls;
    private TransportException failure;

    FakeRepositoryClient put(final String path, final String content) {
        files.put(path, content);
        return this;
    }

    FakeRepositoryClient remove(final String path) {
        files.remove(path);
        return this;
    }

    FakeRepositoryClient commit(final String newSnapshot) {
        this.snapshot = newSnapshot;
        return this;
    }

    void failWith(final TransportException e) {
        this.failure = e;
    }

    int getListTreeCalls() {
        return listTreeCalls;
    }

    @Override
    public String getSnapshotIdentity() throws TransportException {
        if (failure != null) {
            throw failure;
        }
        return snapshot;
    }

    @Override
    public List<TreeEntry> listTree() throws TransportException {
        listTreeCalls++;
        if (files.isEmpty()) {
            throw new EmptySnapshotException("No entries");
        }
        final Set<String> directories = new LinkedHashSet<>();
        final List<TreeEntry> entries = new ArrayList<>();
        for (final String path : files.keySet()) {
            int slash = path.indexOf('/');
            while (slash > 0) {
                directories.add(path.substring(0, slash));
                slash = path.indexOf('/', slash + 1);
            }
            entries.add(TreeEntry.blob(path));
        }
        for (final String directory : directories) {
            entries.add(TreeEntry.tree(directory));
        }
        return entries;
    }

    @Override
    public byte[] getFileContents(final String path) throws TransportException {
        final String content = files.get(path);
        if (content == null) {
            throw new TransportException("Not found: " + path, 404);
        }
        return content.getBytes(StandardCharsets.UTF_8);
    }
}
