package de.mirkosertic.mcp.coursesync.content;

import de.mirkosertic.mcp.coursesync.repository.TransportException;

/**
 * Reads the bytes of an asset from the repository on demand.
 */
@FunctionalInterface
public interface AssetFetcher {

    byte[] fetch(String repoPath) throws TransportException;
}
