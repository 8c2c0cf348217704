package de.mirkosertic.mcp.coursesync.mapping;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Persisted table of {@code (scope, repoPath) -> entity} records.
 * <p>
 * Upserts are idempotent and partial: only non-null fields overwrite, {@code createdAt} is kept
 * and {@code modifiedAt} is refreshed. Records are never deleted by a synchronization run.
 */
public interface MappingStore {

    Optional<MappingRecord> lookup(String scopeId, String repoPath) throws IOException;

    default MappingRecord upsert(final String scopeId, final String repoPath, final @Nullable String entityId,
                                 final @Nullable String parentEntityId, final @Nullable String contentHash)
            throws IOException {
        return upsert(scopeId, repoPath, MappingUpdate.of(entityId, parentEntityId, contentHash));
    }

    MappingRecord upsert(String scopeId, String repoPath, MappingUpdate update) throws IOException;

    /**
     * All records of a scope ordered by repository path.
     */
    List<MappingRecord> list(String scopeId) throws IOException;
}
