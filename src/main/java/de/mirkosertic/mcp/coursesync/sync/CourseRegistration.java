package de.mirkosertic.mcp.coursesync.sync;

import org.jspecify.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * A course kept in sync with a repository branch.
 *
 * @param courseId  scope id of the course
 * @param tokenEnv  environment variable holding the access token, the configured default when null
 * @param branch    branch to follow, the configured default when null
 * @param autoSync  whether the scheduled batch includes this course
 */
public record CourseRegistration(
        String courseId,
        String repoUrl,
        @Nullable String branch,
        @Nullable String tokenEnv,
        boolean autoSync
) {

    private static final Pattern COURSE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    public CourseRegistration {
        if (courseId == null || !COURSE_ID.matcher(courseId).matches()) {
            throw new IllegalArgumentException("Course id must match " + COURSE_ID.pattern() + ": " + courseId);
        }
        if (repoUrl == null || repoUrl.isBlank()) {
            throw new IllegalArgumentException("Repository URL is required");
        }
    }
}
