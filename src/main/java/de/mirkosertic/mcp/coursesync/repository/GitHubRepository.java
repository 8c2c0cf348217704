package de.mirkosertic.mcp.coursesync.repository;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Owner and name of a GitHub repository.
 */
public record GitHubRepository(String owner, String name) {

    private static final Pattern REPO_URL = Pattern.compile("^https://github\\.com/([^/]+)/([^/]+)$");

    /**
     * Parses {@code https://github.com/owner/repo}, tolerating a trailing slash and a {@code .git} suffix.
     *
     * @throws IllegalArgumentException if the URL does not name a GitHub repository
     */
    public static GitHubRepository parse(final String url) {
        if (url == null) {
            throw new IllegalArgumentException("Repository URL is required");
        }
        String normalized = url.trim();
        while (normalized.endsWith("/")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        if (normalized.endsWith(".git")) {
            normalized = normalized.substring(0, normalized.length() - 4);
        }
        final Matcher matcher = REPO_URL.matcher(normalized);
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Not a GitHub repository URL: " + url);
        }
        return new GitHubRepository(matcher.group(1), matcher.group(2));
    }

    public String fullName() {
        return owner + "/" + name;
    }
}
