package de.mirkosertic.mcp.coursesync.content;

import java.io.IOException;

/**
 * An entity id no longer resolves to a stored entity.
 */
public class EntityNotFoundException extends IOException {

    public EntityNotFoundException(final String entityId) {
        super("Entity not found: " + entityId);
    }
}
