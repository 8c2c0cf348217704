package de.mirkosertic.mcp.coursesync.config;

import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration for the MCP Course Sync Server.
 * Loads configuration from YAML files and environment variables.
 * <p>
 * Configuration priority (highest to lowest):
 * 1. Environment variables
 * 2. System properties
 * 3. User config file (~/.mcpcoursesync/config.yaml)
 * 4. Application defaults (application.yaml in classpath)
 */
public class ApplicationConfig {

    private static final Logger logger = LoggerFactory.getLogger(ApplicationConfig.class);

    private static final String ENV_INDEX_PATH = "COURSESYNC_INDEX_PATH";
    private static final String ENV_GITHUB_API = "COURSESYNC_GITHUB_API";
    private static final String PROP_INDEX_PATH = "coursesync.index.path";
    private static final String PROP_PROFILE = "coursesync.profile";
    private static final String CONFIG_DIR = ".mcpcoursesync";
    private static final String USER_CONFIG_FILE = "config.yaml";
    private static final String DEFAULT_CONFIG_FILE = "application.yaml";

    // Index settings
    private String indexPath;
    private long nrtRefreshIntervalMs = 100;

    // GitHub settings
    private String githubApiUrl = "https://api.github.com";
    private String defaultBranch = "main";
    private String defaultTokenEnv = "GITHUB_TOKEN";
    private int httpTimeoutSeconds = 30;
    private long contentCacheMaxBytes = 64L * 1024 * 1024;

    // Repository layout
    private String rootMetadataFile = RepositoryLayout.DEFAULT_ROOT_METADATA_FILE;
    private String sectionsDirectory = RepositoryLayout.DEFAULT_SECTIONS_DIRECTORY;
    private String assetsDirectory = RepositoryLayout.DEFAULT_ASSETS_DIRECTORY;
    private String sectionMetadataFile = RepositoryLayout.DEFAULT_SECTION_METADATA_FILE;
    private String bookMetadataFile = RepositoryLayout.DEFAULT_BOOK_METADATA_FILE;
    private String lessonMetadataFile = RepositoryLayout.DEFAULT_LESSON_METADATA_FILE;

    // Asset settings
    private String assetStoragePath;
    private String assetBaseUrl = "/coursesync/assets";

    // Sync settings
    private int threadPoolSize = 2;
    private boolean autoSyncEnabled = true;
    private long autoSyncIntervalMinutes = 60;
    private boolean notificationsEnabled = true;

    // Profile settings
    private boolean deployedMode = false;

    private ApplicationConfig() {
    }

    /**
     * Load configuration from all sources with proper priority.
     */
    public static ApplicationConfig load() {
        final ApplicationConfig config = new ApplicationConfig();

        // Step 1: Load application defaults from classpath
        config.loadFromClasspath();

        // Step 2: Load user config file (may override some settings)
        config.loadFromUserConfig();

        // Step 3: Apply environment variables and system properties (highest priority)
        config.applyEnvironmentOverrides();

        // Step 4: Determine profile/mode
        config.determineProfile();

        logger.info("Configuration loaded: indexPath={}, githubApiUrl={}, autoSync={}, deployedMode={}",
                config.indexPath, config.githubApiUrl, config.autoSyncEnabled, config.deployedMode);

        return config;
    }

    private void loadFromClasspath() {
        try (final InputStream is = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE)) {
            if (is != null) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded defaults from classpath: {}", DEFAULT_CONFIG_FILE);
                }
            }
        } catch (final IOException e) {
            logger.warn("Failed to load default config from classpath", e);
        }
    }

    private void loadFromUserConfig() {
        final Path userConfigPath = getUserConfigPath();
        if (Files.exists(userConfigPath)) {
            try (final InputStream is = Files.newInputStream(userConfigPath)) {
                final Yaml yaml = new Yaml();
                final Map<String, Object> config = yaml.load(is);
                if (config != null) {
                    applyYamlConfig(config);
                    logger.debug("Loaded user config from: {}", userConfigPath);
                }
            } catch (final IOException e) {
                logger.warn("Failed to load user config from: {}", userConfigPath, e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private void applyYamlConfig(final Map<String, Object> config) {
        final Map<String, Object> root = (Map<String, Object>) config.get("coursesync");
        if (root == null) {
            return;
        }

        final Map<String, Object> indexConfig = (Map<String, Object>) root.get("index");
        if (indexConfig != null) {
            if (indexConfig.get("path") != null) {
                this.indexPath = resolveVariables(indexConfig.get("path").toString());
            }
            if (indexConfig.containsKey("nrt-refresh-interval-ms")) {
                this.nrtRefreshIntervalMs = ((Number) indexConfig.get("nrt-refresh-interval-ms")).longValue();
            }
        }

        final Map<String, Object> githubConfig = (Map<String, Object>) root.get("github");
        if (githubConfig != null) {
            applyGithubConfig(githubConfig);
        }

        final Map<String, Object> layoutConfig = (Map<String, Object>) root.get("layout");
        if (layoutConfig != null) {
            applyLayoutConfig(layoutConfig);
        }

        final Map<String, Object> assetsConfig = (Map<String, Object>) root.get("assets");
        if (assetsConfig != null) {
            if (assetsConfig.get("storage-path") != null) {
                this.assetStoragePath = resolveVariables(assetsConfig.get("storage-path").toString());
            }
            if (assetsConfig.get("base-url") != null) {
                this.assetBaseUrl = assetsConfig.get("base-url").toString();
            }
        }

        final Map<String, Object> syncConfig = (Map<String, Object>) root.get("sync");
        if (syncConfig != null) {
            if (syncConfig.containsKey("thread-pool-size")) {
                this.threadPoolSize = ((Number) syncConfig.get("thread-pool-size")).intValue();
            }
            if (syncConfig.containsKey("auto-sync-enabled")) {
                this.autoSyncEnabled = (Boolean) syncConfig.get("auto-sync-enabled");
            }
            if (syncConfig.containsKey("auto-sync-interval-minutes")) {
                this.autoSyncIntervalMinutes = ((Number) syncConfig.get("auto-sync-interval-minutes")).longValue();
            }
        }

        final Map<String, Object> notificationConfig = (Map<String, Object>) root.get("notifications");
        if (notificationConfig != null && notificationConfig.containsKey("enabled")) {
            this.notificationsEnabled = (Boolean) notificationConfig.get("enabled");
        }
    }

    private void applyGithubConfig(final Map<String, Object> githubConfig) {
        if (githubConfig.get("api-url") != null) {
            this.githubApiUrl = githubConfig.get("api-url").toString();
        }
        if (githubConfig.get("default-branch") != null) {
            this.defaultBranch = githubConfig.get("default-branch").toString();
        }
        if (githubConfig.get("token-env") != null) {
            this.defaultTokenEnv = githubConfig.get("token-env").toString();
        }
        if (githubConfig.containsKey("timeout-seconds")) {
            this.httpTimeoutSeconds = ((Number) githubConfig.get("timeout-seconds")).intValue();
        }
        if (githubConfig.containsKey("content-cache-max-bytes")) {
            this.contentCacheMaxBytes = ((Number) githubConfig.get("content-cache-max-bytes")).longValue();
        }
    }

    private void applyLayoutConfig(final Map<String, Object> layoutConfig) {
        if (layoutConfig.get("root-metadata-file") != null) {
            this.rootMetadataFile = layoutConfig.get("root-metadata-file").toString();
        }
        if (layoutConfig.get("sections-directory") != null) {
            this.sectionsDirectory = layoutConfig.get("sections-directory").toString();
        }
        if (layoutConfig.get("assets-directory") != null) {
            this.assetsDirectory = layoutConfig.get("assets-directory").toString();
        }
        if (layoutConfig.get("section-metadata-file") != null) {
            this.sectionMetadataFile = layoutConfig.get("section-metadata-file").toString();
        }
        if (layoutConfig.get("book-metadata-file") != null) {
            this.bookMetadataFile = layoutConfig.get("book-metadata-file").toString();
        }
        if (layoutConfig.get("lesson-metadata-file") != null) {
            this.lessonMetadataFile = layoutConfig.get("lesson-metadata-file").toString();
        }
    }

    private void applyEnvironmentOverrides() {
        final String envIndexPath = System.getenv(ENV_INDEX_PATH);
        if (envIndexPath != null && !envIndexPath.trim().isEmpty()) {
            this.indexPath = envIndexPath.trim();
            logger.info("Index path from environment: {}", this.indexPath);
        }

        // Defaults when nothing configured a path
        if (this.indexPath == null || this.indexPath.isEmpty()) {
            this.indexPath = getConfigDirectory().resolve("index").toString();
        }
        if (this.assetStoragePath == null || this.assetStoragePath.isEmpty()) {
            this.assetStoragePath = getConfigDirectory().resolve("assets").toString();
        }

        final String envApiUrl = System.getenv(ENV_GITHUB_API);
        if (envApiUrl != null && !envApiUrl.trim().isEmpty()) {
            this.githubApiUrl = envApiUrl.trim();
            logger.info("GitHub API URL from environment: {}", this.githubApiUrl);
        }

        final String propIndexPath = System.getProperty(PROP_INDEX_PATH);
        if (propIndexPath != null && !propIndexPath.isEmpty()) {
            this.indexPath = propIndexPath;
        }
    }

    private void determineProfile() {
        this.deployedMode = isDeployedProfileActive();
    }

    /**
     * Checks the profile system properties without loading any configuration, so that
     * logging can be configured before the first log statement.
     */
    public static boolean isDeployedProfileActive() {
        final String profile = System.getProperty(PROP_PROFILE, System.getProperty("profile", "default"));
        return "deployed".equalsIgnoreCase(profile);
    }

    /**
     * Resolve variables in strings like ${VAR:default}
     */
    private String resolveVariables(final String value) {
        if (value == null || !value.contains("${")) {
            return value;
        }

        String result = value;
        int start;
        while ((start = result.indexOf("${")) >= 0) {
            final int end = result.indexOf("}", start);
            if (end < 0) {
                break;
            }

            final String varExpr = result.substring(start + 2, end);
            final String[] parts = varExpr.split(":", 2);
            final String varName = parts[0];
            final String defaultValue = parts.length > 1 ? parts[1] : "";

            // Check environment first, then system properties
            String replacement = System.getenv(varName);
            if (replacement == null || replacement.isEmpty()) {
                replacement = System.getProperty(varName, defaultValue);
            }

            result = result.substring(0, start) + replacement + result.substring(end + 1);
        }

        return result;
    }

    public static Path getUserConfigPath() {
        return getConfigDirectory().resolve(USER_CONFIG_FILE);
    }

    public static Path getConfigDirectory() {
        return Paths.get(System.getProperty("user.home"), CONFIG_DIR);
    }

    /**
     * Builds the repository layout from the configured file and directory names.
     */
    public RepositoryLayout getRepositoryLayout() {
        return new RepositoryLayout(rootMetadataFile, sectionsDirectory, assetsDirectory,
                sectionMetadataFile, bookMetadataFile, lessonMetadataFile);
    }

    // Getters
    public String getIndexPath() {
        return indexPath;
    }

    public long getNrtRefreshIntervalMs() {
        return nrtRefreshIntervalMs;
    }

    public String getGithubApiUrl() {
        return githubApiUrl;
    }

    public String getDefaultBranch() {
        return defaultBranch;
    }

    public String getDefaultTokenEnv() {
        return defaultTokenEnv;
    }

    public int getHttpTimeoutSeconds() {
        return httpTimeoutSeconds;
    }

    public long getContentCacheMaxBytes() {
        return contentCacheMaxBytes;
    }

    public String getAssetStoragePath() {
        return assetStoragePath;
    }

    public String getAssetBaseUrl() {
        return assetBaseUrl;
    }

    public int getThreadPoolSize() {
        return threadPoolSize;
    }

    public boolean isAutoSyncEnabled() {
        return autoSyncEnabled;
    }

    public long getAutoSyncIntervalMinutes() {
        return autoSyncIntervalMinutes;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public boolean isDeployedMode() {
        return deployedMode;
    }
}
