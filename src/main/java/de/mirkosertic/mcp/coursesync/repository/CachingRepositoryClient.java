package de.mirkosertic.mcp.coursesync.repository;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Serves file contents from a cache keyed by git blob SHA. The SHAs come from the last
 * {@link #listTree()} call, so a file is only downloaded again when its blob changed.
 */
public class CachingRepositoryClient implements RepositoryClient {

    private final RepositoryClient delegate;
    private final Cache<String, byte[]> cache;
    private final ContentCacheStats stats;
    private final Map<String, String> blobShaByPath = new ConcurrentHashMap<>();

    public CachingRepositoryClient(final RepositoryClient delegate, final Cache<String, byte[]> cache,
                                   final ContentCacheStats stats) {
        this.delegate = delegate;
        this.cache = cache;
        this.stats = stats;
    }

    /**
     * Creates a cache bounded by the total size of the cached contents.
     */
    public static Cache<String, byte[]> createSharedCache(final long maxBytes, final ContentCacheStats stats) {
        return Caffeine.newBuilder()
                .maximumWeight(maxBytes)
                .weigher((String key, byte[] value) -> value.length)
                .evictionListener((String key, byte[] value, RemovalCause cause) -> {
                    if (cause.wasEvicted()) {
                        stats.recordEviction();
                    }
                })
                .build();
    }

    @Override
    public String getSnapshotIdentity() throws TransportException {
        return delegate.getSnapshotIdentity();
    }

    @Override
    public List<TreeEntry> listTree() throws TransportException {
        final List<TreeEntry> entries = delegate.listTree();
        blobShaByPath.clear();
        for (final TreeEntry entry : entries) {
            if (entry.isBlob() && entry.blobSha() != null) {
                blobShaByPath.put(entry.path(), entry.blobSha());
            }
        }
        return entries;
    }

    @Override
    public byte[] getFileContents(final String path) throws TransportException {
        final String blobSha = blobShaByPath.get(path);
        if (blobSha == null) {
            return delegate.getFileContents(path);
        }

        final byte[] cached = cache.getIfPresent(blobSha);
        if (cached != null) {
            stats.recordHit(cached.length);
            return cached.clone();
        }

        stats.recordMiss();
        final byte[] contents = delegate.getFileContents(path);
        cache.put(blobSha, contents.clone());
        return contents;
    }
}
