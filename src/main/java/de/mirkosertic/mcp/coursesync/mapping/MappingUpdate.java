package de.mirkosertic.mcp.coursesync.mapping;

import org.jspecify.annotations.Nullable;

/**
 * Partial update of a {@link MappingRecord}: null fields keep their stored value.
 */
public record MappingUpdate(
        @Nullable String entityId,
        @Nullable String parentEntityId,
        @Nullable String contentHash,
        @Nullable String itemId
) {

    public static MappingUpdate of(final @Nullable String entityId, final @Nullable String parentEntityId,
                                   final @Nullable String contentHash) {
        return new MappingUpdate(entityId, parentEntityId, contentHash, null);
    }

    public static MappingUpdate hashOnly(final String contentHash) {
        return new MappingUpdate(null, null, contentHash, null);
    }
}
