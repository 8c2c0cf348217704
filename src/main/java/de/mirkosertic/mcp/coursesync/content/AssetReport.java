package de.mirkosertic.mcp.coursesync.content;

import java.util.List;

/**
 * Outcome of storing the repository assets of one run.
 */
public record AssetReport(List<String> uploadedPaths, List<String> skippedPaths) {

    public AssetReport {
        uploadedPaths = List.copyOf(uploadedPaths);
        skippedPaths = List.copyOf(skippedPaths);
    }

    public int uploaded() {
        return uploadedPaths.size();
    }

    public int skipped() {
        return skippedPaths.size();
    }
}
