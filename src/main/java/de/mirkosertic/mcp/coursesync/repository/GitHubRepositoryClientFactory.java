package de.mirkosertic.mcp.coursesync.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import de.mirkosertic.mcp.coursesync.config.ApplicationConfig;
import de.mirkosertic.mcp.coursesync.config.BuildInfo;
import de.mirkosertic.mcp.coursesync.sync.CourseRegistration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.function.Function;

/**
 * Builds cached GitHub clients. Tokens are read from the environment variable named by the
 * registration and never persisted.
 */
public class GitHubRepositoryClientFactory implements RepositoryClientFactory {

    private static final Logger logger = LoggerFactory.getLogger(GitHubRepositoryClientFactory.class);

    private final ApplicationConfig config;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;
    private final Cache<String, byte[]> contentCache;
    private final ContentCacheStats cacheStats;
    private final Function<String, String> environment;

    public GitHubRepositoryClientFactory(final ApplicationConfig config, final ObjectMapper mapper,
                                         final Function<String, String> environment) {
        this.config = config;
        this.mapper = mapper;
        this.environment = environment;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(config.getHttpTimeoutSeconds()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.cacheStats = new ContentCacheStats();
        this.contentCache = CachingRepositoryClient.createSharedCache(config.getContentCacheMaxBytes(), cacheStats);
    }

    @Override
    public RepositoryClient create(final CourseRegistration registration) {
        return new CachingRepositoryClient(createGitHubClient(registration), contentCache, cacheStats);
    }

    public GitHubRepositoryClient createGitHubClient(final CourseRegistration registration) {
        final GitHubRepository repository = GitHubRepository.parse(registration.repoUrl());
        final String tokenEnv = registration.tokenEnv() != null ? registration.tokenEnv() : config.getDefaultTokenEnv();
        final String token = environment.apply(tokenEnv);
        if (token == null || token.isEmpty()) {
            logger.debug("No token in {} for course {}, using anonymous access", tokenEnv, registration.courseId());
        }
        final String branch = registration.branch() != null ? registration.branch() : config.getDefaultBranch();
        return new GitHubRepositoryClient(httpClient, mapper, config.getGithubApiUrl(), repository, branch, token,
                BuildInfo.getUserAgent(), Duration.ofSeconds(config.getHttpTimeoutSeconds()));
    }

    public ContentCacheStats getCacheStats() {
        return cacheStats;
    }
}
