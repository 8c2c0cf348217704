package de.mirkosertic.mcp.coursesync.mapping;

import org.jspecify.annotations.Nullable;

/**
 * Durable link between one repository path of a course and the entity built from it.
 *
 * @param scopeId        course the path belongs to
 * @param repoPath       repository path, unique per scope
 * @param entityId       entity built from the path, null for pure container records
 * @param parentEntityId parent entity, e.g. the section of an activity
 * @param contentHash    SHA-256 of the stored body, null for containers
 * @param itemId         item inside the entity, e.g. a chapter of a book or a page of a lesson
 * @param createdAt      epoch millis of the first upsert
 * @param modifiedAt     epoch millis of the last upsert
 */
public record MappingRecord(
        String scopeId,
        String repoPath,
        @Nullable String entityId,
        @Nullable String parentEntityId,
        @Nullable String contentHash,
        @Nullable String itemId,
        long createdAt,
        long modifiedAt
) {

    public boolean hasEntity() {
        return entityId != null && !entityId.isEmpty();
    }
}
