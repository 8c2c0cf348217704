package de.mirkosertic.mcp.coursesync.repository;

import de.mirkosertic.mcp.coursesync.sync.CourseRegistration;

/**
 * Creates the repository client a course registration points at.
 */
@FunctionalInterface
public interface RepositoryClientFactory {

    /**
     * @throws IllegalArgumentException if the registration names no supported repository
     */
    RepositoryClient create(CourseRegistration registration);
}
