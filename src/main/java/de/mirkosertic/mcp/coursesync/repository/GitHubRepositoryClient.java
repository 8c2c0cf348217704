package de.mirkosertic.mcp.coursesync.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.tree.EntryKind;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * {@link RepositoryClient} for one branch of a GitHub repository, using the REST API v3.
 */
public class GitHubRepositoryClient implements RepositoryClient {

    private static final Logger logger = LoggerFactory.getLogger(GitHubRepositoryClient.class);

    private static final String ACCEPT = "application/vnd.github.v3+json";

    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final String apiBaseUrl;
    private final GitHubRepository repository;
    private final String branch;
    private final @Nullable String token;
    private final String userAgent;
    private final Duration timeout;

    private volatile int rateLimitRemaining = -1;
    private volatile long rateLimitReset = 0;

    public GitHubRepositoryClient(final HttpClient httpClient, final ObjectMapper mapper, final String apiBaseUrl,
                                  final GitHubRepository repository, final String branch,
                                  final @Nullable String token, final String userAgent, final Duration timeout) {
        this.httpClient = httpClient;
        this.mapper = mapper;
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.repository = repository;
        this.branch = branch;
        this.token = token;
        this.userAgent = userAgent;
        this.timeout = timeout;
    }

    /**
     * Checks that the repository is reachable with the configured credentials.
     */
    public boolean testConnection() throws TransportException {
        final JsonNode response = get(repoEndpoint(""));
        return response.hasNonNull("id");
    }

    @Override
    public String getSnapshotIdentity() throws TransportException {
        final JsonNode response = get(repoEndpoint("/commits/" + encode(branch)));
        final String sha = response.path("sha").asText("");
        if (sha.isEmpty()) {
            throw new TransportException("No commit SHA returned for branch " + branch);
        }
        return sha;
    }

    @Override
    public List<TreeEntry> listTree() throws TransportException {
        final JsonNode response = get(repoEndpoint("/git/trees/" + encode(branch) + "?recursive=1"));
        final JsonNode tree = response.path("tree");
        if (!tree.isArray() || tree.isEmpty()) {
            throw new EmptySnapshotException("Empty repository tree for " + repository.fullName() + "@" + branch);
        }
        // A partial listing would let the removal sweep hide everything cut from it
        if (response.path("truncated").asBoolean(false)) {
            throw new TransportException("Tree listing of " + repository.fullName() + "@" + branch
                    + " was truncated by GitHub");
        }

        final List<TreeEntry> entries = new ArrayList<>(tree.size());
        for (final JsonNode node : tree) {
            final EntryKind kind = EntryKind.fromGitType(node.path("type").asText());
            if (kind == null) {
                continue;
            }
            final String sha = node.path("sha").asText(null);
            entries.add(new TreeEntry(node.path("path").asText(), kind, node.path("size").asLong(0), sha));
        }
        return entries;
    }

    @Override
    public byte[] getFileContents(final String path) throws TransportException {
        final JsonNode response = get(repoEndpoint("/contents/" + encodePath(path) + "?ref=" + encode(branch)));
        final String content = response.path("content").asText("");
        final long size = response.path("size").asLong(0);

        if (content.isEmpty()) {
            if (size == 0) {
                return new byte[0];
            }
            // Files above 1 MB come without inline content
            final String sha = response.path("sha").asText("");
            if (sha.isEmpty()) {
                throw new TransportException("No content returned for " + path);
            }
            return getBlob(sha, path);
        }
        return decode(content, path);
    }

    private byte[] getBlob(final String sha, final String path) throws TransportException {
        final JsonNode response = get(repoEndpoint("/git/blobs/" + encode(sha)));
        return decode(response.path("content").asText(""), path);
    }

    private static byte[] decode(final String content, final String path) throws TransportException {
        try {
            return Base64.getMimeDecoder().decode(content);
        } catch (final IllegalArgumentException e) {
            throw new TransportException("Failed to decode " + path, e);
        }
    }

    public RateLimitStatus getRateLimitStatus() {
        return new RateLimitStatus(rateLimitRemaining, rateLimitReset);
    }

    private JsonNode get(final String endpoint) throws TransportException {
        final HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(apiBaseUrl + endpoint))
                .timeout(timeout)
                .header("Accept", ACCEPT)
                .header("User-Agent", userAgent)
                .GET();
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "token " + token);
        }

        final HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (final IOException e) {
            throw new TransportException("GitHub request failed: " + endpoint, e);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("GitHub request interrupted: " + endpoint, e);
        }

        trackRateLimit(response);

        final int status = response.statusCode();
        if (status == 403 && rateLimitRemaining == 0) {
            throw new TransportException("GitHub API rate limit exceeded, resets at epoch second " + rateLimitReset,
                    status);
        }
        if (status == 401) {
            throw new TransportException("GitHub authentication failed for " + repository.fullName(), status);
        }
        if (status == 404) {
            throw new TransportException("Not found on GitHub: " + endpoint, status);
        }
        if (status < 200 || status >= 300) {
            throw new TransportException("GitHub request failed (" + status + "): " + endpoint, status);
        }

        try {
            return mapper.readTree(response.body());
        } catch (final IOException e) {
            throw new TransportException("Invalid JSON from GitHub for " + endpoint, e);
        }
    }

    private void trackRateLimit(final HttpResponse<String> response) {
        final Optional<String> remaining = response.headers().firstValue("X-RateLimit-Remaining");
        final Optional<String> reset = response.headers().firstValue("X-RateLimit-Reset");
        try {
            if (remaining.isPresent()) {
                rateLimitRemaining = Integer.parseInt(remaining.get().trim());
            }
            if (reset.isPresent()) {
                rateLimitReset = Long.parseLong(reset.get().trim());
            }
        } catch (final NumberFormatException e) {
            logger.debug("Ignoring malformed rate limit headers", e);
        }
    }

    private String repoEndpoint(final String suffix) {
        return "/repos/" + encode(repository.owner()) + "/" + encode(repository.name()) + suffix;
    }

    private static String encodePath(final String path) {
        final String[] segments = path.split("/");
        final StringBuilder encoded = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            if (i > 0) {
                encoded.append('/');
            }
            encoded.append(encode(segments[i]));
        }
        return encoded.toString();
    }

    private static String encode(final String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * @param remaining requests left in the current window, -1 before the first response
     * @param reset     epoch second at which the window resets
     */
    public record RateLimitStatus(int remaining, long reset) {
    }
}
