package de.mirkosertic.mcp.coursesync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.config.ApplicationConfig;
import de.mirkosertic.mcp.coursesync.config.BuildInfo;
import de.mirkosertic.mcp.coursesync.config.LoggingConfigurator;
import de.mirkosertic.mcp.coursesync.content.AssetUrlRewriter;
import de.mirkosertic.mcp.coursesync.content.LuceneContentStore;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mapping.LuceneMappingStore;
import de.mirkosertic.mcp.coursesync.frontmatter.MetadataParsers;
import de.mirkosertic.mcp.coursesync.mcp.CourseSyncTools;
import de.mirkosertic.mcp.coursesync.repository.GitHubRepositoryClientFactory;
import de.mirkosertic.mcp.coursesync.sync.CourseConfigurationManager;
import de.mirkosertic.mcp.coursesync.sync.CourseSyncService;
import de.mirkosertic.mcp.coursesync.sync.LuceneSyncHistoryStore;
import de.mirkosertic.mcp.coursesync.sync.SyncExecutorService;
import de.mirkosertic.mcp.coursesync.sync.SyncStatisticsTracker;
import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Main entry point for the MCP course sync server.
 * Initializes all services and starts the MCP server using STDIO transport.
 */
public class CourseSyncApplication {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncApplication.class);

    private final ApplicationConfig config;
    private final CourseIndexService indexService;
    private final NotificationService notificationService;
    private final CourseConfigurationManager configManager;
    private final SyncExecutorService syncExecutor;
    private final CourseSyncService syncService;
    private final CourseSyncTools syncTools;
    private McpSyncServer mcpServer;

    public CourseSyncApplication(final ApplicationConfig config) {
        this.config = config;

        final ObjectMapper objectMapper = new ObjectMapper();
        final RepositoryLayout layout = config.getRepositoryLayout();

        this.indexService = new CourseIndexService(config);

        final LuceneMappingStore mappingStore = new LuceneMappingStore(indexService);

        final LuceneContentStore contentStore = new LuceneContentStore(
                indexService,
                mappingStore,
                new AssetUrlRewriter(layout.assetsDirectory(), config.getAssetBaseUrl()),
                layout.assetsDirectory(),
                Path.of(config.getAssetStoragePath()),
                objectMapper
        );

        this.notificationService = new NotificationService(config.isNotificationsEnabled());

        this.configManager = new CourseConfigurationManager(ApplicationConfig.getConfigDirectory());

        this.syncExecutor = new SyncExecutorService(config);

        final SyncStatisticsTracker statisticsTracker = new SyncStatisticsTracker(notificationService);

        final GitHubRepositoryClientFactory clientFactory =
                new GitHubRepositoryClientFactory(config, objectMapper, System::getenv);

        this.syncService = new CourseSyncService(
                configManager,
                clientFactory,
                contentStore,
                mappingStore,
                new LuceneSyncHistoryStore(indexService, objectMapper),
                layout,
                MetadataParsers.select(),
                syncExecutor,
                statisticsTracker
        );

        this.syncTools = new CourseSyncTools(
                syncService,
                configManager,
                mappingStore,
                indexService,
                statisticsTracker,
                clientFactory
        );
    }

    /**
     * Initialize all services.
     */
    public void init() throws IOException {
        logger.info("Initializing MCP course sync server...");

        indexService.init();
        configManager.init();

        if (config.isAutoSyncEnabled()) {
            syncService.startAutoSync(config.getAutoSyncIntervalMinutes());
        }

        logger.info("All services initialized successfully");
    }

    /**
     * Start the MCP server and block until the process is terminated.
     */
    public void start() {
        logger.info("Starting MCP server with STDIO transport...");

        final McpSchema.ServerCapabilities capabilities = McpSchema.ServerCapabilities.builder()
                .tools(true)
                .resources(false, false)
                .build();

        final JacksonMcpJsonMapper jsonMapper = new JacksonMcpJsonMapper(new ObjectMapper());
        final StdioServerTransportProvider transportProvider = new StdioServerTransportProvider(jsonMapper);

        mcpServer = McpServer.sync(transportProvider)
                .serverInfo("MCP Course Sync Server", BuildInfo.getVersion())
                .capabilities(capabilities)
                .tools(syncTools.getToolSpecifications())
                .resources(syncTools.getResourceSpecifications())
                .build();

        logger.info("MCP server started successfully");

        notificationService.notify("MCP Course Sync Server started", "MCP Course Sync Server is now running.");

        Runtime.getRuntime().addShutdownHook(new Thread(this::shutdown, "shutdown-hook"));

        // The client owns the STDIO pipes, so exit together with it
        ProcessHandle.current().parent().ifPresent(parent -> {
            parent.onExit().thenRun(() -> {
                logger.info("Parent process terminated, shutting down...");
                System.exit(0);
            });
            logger.info("Monitoring parent process PID: {}", parent.pid());
        });

        try {
            Thread.currentThread().join();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Main thread interrupted, shutting down...");
        }

        logger.info("Main thread finished, shutting down...");
    }

    /**
     * Shutdown all services gracefully.
     */
    public void shutdown() {
        logger.info("Shutting down MCP course sync server...");

        try {
            if (mcpServer != null) {
                mcpServer.close();
            }
        } catch (final Exception e) {
            logger.error("Error closing MCP server", e);
        }

        try {
            syncService.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down sync service", e);
        }

        try {
            syncExecutor.shutdown();
        } catch (final Exception e) {
            logger.error("Error shutting down sync executor", e);
        }

        try {
            indexService.close();
        } catch (final Exception e) {
            logger.error("Error closing index service", e);
        }

        logger.info("MCP course sync server shutdown complete");
    }

    public static void main(final String[] args) {
        try {
            // Configure logging first, stdout belongs to the MCP protocol in deployed mode
            final boolean deployedMode = ApplicationConfig.isDeployedProfileActive();
            LoggingConfigurator.configure(deployedMode);

            final ApplicationConfig config = ApplicationConfig.load();

            if (!deployedMode) {
                logger.info("Running in development mode (console logging enabled)");
                logger.info("Index path: {}", config.getIndexPath());
                logger.info("GitHub API: {}", config.getGithubApiUrl());
            }

            final CourseSyncApplication app = new CourseSyncApplication(config);
            app.init();
            app.start();

            logger.info("MCP course sync server finished.");

        } catch (final Exception e) {
            System.err.println("Failed to start MCP course sync server: " + e.getMessage());
            e.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
