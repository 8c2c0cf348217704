package de.mirkosertic.mcp.coursesync.mcp;

import com.google.common.io.Resources;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mapping.MappingStore;
import de.mirkosertic.mcp.coursesync.mcp.dto.AddCourseRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.AddCourseResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.CourseIdRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.GetSyncHistoryRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.ListCoursesResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.ListMappingsResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SearchContentRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.SearchContentResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SimpleMessageResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncAllCoursesRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncAllCoursesResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncCourseRequest;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncCourseResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncHistoryResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncStatisticsResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.SyncStatusResponse;
import de.mirkosertic.mcp.coursesync.mcp.dto.TestConnectionResponse;
import de.mirkosertic.mcp.coursesync.repository.GitHubRepositoryClient;
import de.mirkosertic.mcp.coursesync.repository.GitHubRepositoryClientFactory;
import de.mirkosertic.mcp.coursesync.repository.GitHubRepository;
import de.mirkosertic.mcp.coursesync.repository.TransportException;
import de.mirkosertic.mcp.coursesync.sync.BatchResult;
import de.mirkosertic.mcp.coursesync.sync.CourseConfigurationManager;
import de.mirkosertic.mcp.coursesync.sync.CourseRegistration;
import de.mirkosertic.mcp.coursesync.sync.CourseSyncService;
import de.mirkosertic.mcp.coursesync.sync.SyncOutcome;
import de.mirkosertic.mcp.coursesync.sync.SyncState;
import de.mirkosertic.mcp.coursesync.sync.SyncStatisticsTracker;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServerExchange;
import io.modelcontextprotocol.spec.McpSchema;
import org.apache.lucene.queryparser.classic.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MCP tools to register courses, synchronize them with their repositories and inspect the results.
 */
public class CourseSyncTools {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncTools.class);

    static final String USER_MCP = "mcp";

    private static final String GUIDE_RESOURCE_ID = "coursesync://guide/repository-layout";
    private static final String GUIDE_FILE = "repository-layout-guide.md";

    private static final String SYNC_DESCRIPTION = """
            Synchronize one registered course with its GitHub repository. \
            Unchanged commits return status 'uptodate' without touching the course. \
            Otherwise sections, pages, books, lessons and assets are created, updated or hidden to mirror the repository, \
            and the summary lists what changed. Set async=true to return immediately and check getSyncStatus later. \
            Failed runs only report a short message; use getSyncHistory with includeOperations=true for details.""";

    private final CourseSyncService syncService;
    private final CourseConfigurationManager configManager;
    private final MappingStore mappingStore;
    private final CourseIndexService indexService;
    private final SyncStatisticsTracker statisticsTracker;
    private final GitHubRepositoryClientFactory clientFactory;

    public CourseSyncTools(final CourseSyncService syncService,
                           final CourseConfigurationManager configManager,
                           final MappingStore mappingStore,
                           final CourseIndexService indexService,
                           final SyncStatisticsTracker statisticsTracker,
                           final GitHubRepositoryClientFactory clientFactory) {
        this.syncService = syncService;
        this.configManager = configManager;
        this.mappingStore = mappingStore;
        this.indexService = indexService;
        this.statisticsTracker = statisticsTracker;
        this.clientFactory = clientFactory;
    }

    public List<McpServerFeatures.SyncResourceSpecification> getResourceSpecifications() {
        return List.of(new McpServerFeatures.SyncResourceSpecification(
                McpSchema.Resource.builder()
                        .uri(GUIDE_RESOURCE_ID)
                        .mimeType("text/markdown")
                        .name("Course repository layout")
                        .description("How a repository has to be structured to be synchronized into a course")
                        .build(),
                this::guideResource
        ));
    }

    private McpSchema.ReadResourceResult guideResource(final McpSyncServerExchange exchange,
                                                      final McpSchema.ReadResourceRequest request) {
        String guide;
        try {
            final URL url = Resources.getResource(GUIDE_FILE);
            guide = Resources.toString(url, StandardCharsets.UTF_8);
        } catch (final IOException | IllegalArgumentException e) {
            logger.error("Error loading the repository layout guide", e);
            guide = "";
        }
        return new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(GUIDE_RESOURCE_ID, "text/markdown", guide)));
    }

    /**
     * Returns all MCP tool specifications for registration with the MCP server.
     */
    public List<McpServerFeatures.SyncToolSpecification> getToolSpecifications() {
        final List<McpServerFeatures.SyncToolSpecification> tools = new ArrayList<>();

        tools.add(tool("syncCourse", SYNC_DESCRIPTION,
                SchemaGenerator.generateSchema(SyncCourseRequest.class), this::syncCourse));

        tools.add(tool("syncAllCourses",
                "Synchronize all registered courses, or only those with auto-sync enabled. "
                        + "A failing course does not stop the others; each course reports its own status.",
                SchemaGenerator.generateSchema(SyncAllCoursesRequest.class), this::syncAllCourses));

        tools.add(tool("getSyncStatus",
                "Get the registration and the last synchronized commit, time and status of a course, "
                        + "and whether a sync is running right now.",
                SchemaGenerator.generateSchema(CourseIdRequest.class), this::getSyncStatus));

        tools.add(tool("getSyncHistory",
                "List the most recent sync runs of a course, newest first, optionally with their operation logs.",
                SchemaGenerator.generateSchema(GetSyncHistoryRequest.class), this::getSyncHistory));

        tools.add(tool("listCourses",
                "List all registered courses with their repository, branch and last sync status.",
                SchemaGenerator.emptySchema(), args -> listCourses()));

        tools.add(tool("addCourse",
                "Register a course for a GitHub repository, or replace the registration with the same id. "
                        + "Tokens are never stored; name the environment variable that holds one. "
                        + "Read the resource " + GUIDE_RESOURCE_ID + " for the expected repository layout.",
                SchemaGenerator.generateSchema(AddCourseRequest.class), this::addCourse));

        tools.add(tool("removeCourse",
                "Unregister a course. Synced content and path mappings are kept, "
                        + "so registering it again continues where it stopped.",
                SchemaGenerator.generateSchema(CourseIdRequest.class), this::removeCourse));

        tools.add(tool("listMappings",
                "List the mapping records of a course: which repository path produced which entity, "
                        + "with content hashes and timestamps.",
                SchemaGenerator.generateSchema(CourseIdRequest.class), this::listMappings));

        tools.add(tool("searchCourseContent",
                "Full-text search over synced pages, book chapters and lesson pages using Lucene query syntax, "
                        + "e.g. 'loops AND java' or '\"exact phrase\"'. Returns paginated results with snippets.",
                SchemaGenerator.generateSchema(SearchContentRequest.class), this::searchCourseContent));

        tools.add(tool("getSyncStatistics",
                "Get statistics about sync runs since startup, running syncs and the repository content cache.",
                SchemaGenerator.emptySchema(), args -> getSyncStatistics()));

        tools.add(tool("testConnection",
                "Check that the repository of a course is reachable with its configured token "
                        + "and report the remaining GitHub API rate limit.",
                SchemaGenerator.generateSchema(CourseIdRequest.class), this::testConnection));

        return tools;
    }

    private static McpServerFeatures.SyncToolSpecification tool(final String name, final String description,
                                                               final McpSchema.JsonSchema schema,
                                                               final ToolHandler handler) {
        return McpServerFeatures.SyncToolSpecification.builder()
                .tool(McpSchema.Tool.builder()
                        .name(name)
                        .description(description)
                        .inputSchema(schema)
                        .build())
                .callHandler((exchange, request) -> handler.handle(
                        request.arguments() != null ? request.arguments() : Map.of()))
                .build();
    }

    @FunctionalInterface
    private interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> args);
    }

    McpSchema.CallToolResult syncCourse(final Map<String, Object> args) {
        final SyncCourseRequest request = SyncCourseRequest.fromMap(args);
        logger.info("Sync course request: courseId={}, async={}", request.courseId(), request.async());

        if (isBlank(request.courseId())) {
            return ToolResultHelper.createResult(SyncCourseResponse.error("courseId is required"));
        }
        if (configManager.findCourse(request.courseId()).isEmpty()) {
            return ToolResultHelper.createResult(SyncCourseResponse.error("Unknown course: " + request.courseId()));
        }

        if (request.effectiveAsync()) {
            syncService.submitSync(request.courseId(), USER_MCP);
            return ToolResultHelper.createResult(SyncCourseResponse.started(request.courseId()));
        }

        final SyncOutcome outcome = syncService.syncCourse(request.courseId(), USER_MCP);
        logger.info("Sync of {} finished with status {}", request.courseId(), outcome.status());
        return ToolResultHelper.createResult(SyncCourseResponse.completed(request.courseId(), outcome));
    }

    McpSchema.CallToolResult syncAllCourses(final Map<String, Object> args) {
        final SyncAllCoursesRequest request = SyncAllCoursesRequest.fromMap(args);
        logger.info("Sync all courses request: autoSyncOnly={}", request.effectiveAutoSyncOnly());

        try {
            final BatchResult batch = syncService.syncAll(request.effectiveAutoSyncOnly(), USER_MCP);
            return ToolResultHelper.createResult(SyncAllCoursesResponse.success(batch));
        } catch (final RuntimeException e) {
            logger.error("Error running the sync batch", e);
            return ToolResultHelper.createResult(SyncAllCoursesResponse.error("Error running the sync batch: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSyncStatus(final Map<String, Object> args) {
        final CourseIdRequest request = CourseIdRequest.fromMap(args);
        final Optional<CourseRegistration> course = configManager.findCourse(request.courseId());
        if (course.isEmpty()) {
            return ToolResultHelper.createResult(SyncStatusResponse.error("Unknown course: " + request.courseId()));
        }
        final SyncState state = syncService.getSyncState(request.courseId());
        return ToolResultHelper.createResult(SyncStatusResponse.success(course.get(), state,
                syncService.isSyncRunning(request.courseId())));
    }

    McpSchema.CallToolResult getSyncHistory(final Map<String, Object> args) {
        final GetSyncHistoryRequest request = GetSyncHistoryRequest.fromMap(args);
        if (isBlank(request.courseId())) {
            return ToolResultHelper.createResult(SyncHistoryResponse.error("courseId is required"));
        }
        try {
            return ToolResultHelper.createResult(SyncHistoryResponse.success(request.courseId(),
                    syncService.getHistory(request.courseId(), request.effectiveLimit()),
                    request.effectiveIncludeOperations()));
        } catch (final IOException e) {
            logger.error("Error reading sync history", e);
            return ToolResultHelper.createResult(SyncHistoryResponse.error("Error reading sync history: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listCourses() {
        final List<ListCoursesResponse.CourseInfo> courses = new ArrayList<>();
        for (final CourseRegistration course : configManager.loadCourses()) {
            final SyncState state = configManager.loadSyncState(course.courseId());
            courses.add(new ListCoursesResponse.CourseInfo(course.courseId(), course.repoUrl(), course.branch(),
                    course.tokenEnv(), course.autoSync(),
                    state.lastStatus() != null ? state.lastStatus().code() : null,
                    state.lastSnapshotIdentity()));
        }
        logger.info("Listed {} courses", courses.size());
        return ToolResultHelper.createResult(ListCoursesResponse.success(courses));
    }

    McpSchema.CallToolResult addCourse(final Map<String, Object> args) {
        final AddCourseRequest request = AddCourseRequest.fromMap(args);
        logger.info("Add course request: courseId={}, repoUrl={}", request.courseId(), request.repoUrl());

        final CourseRegistration registration;
        try {
            registration = new CourseRegistration(request.courseId(), request.repoUrl(), request.branch(),
                    request.tokenEnv(), request.effectiveAutoSync());
            GitHubRepository.parse(registration.repoUrl());
        } catch (final IllegalArgumentException e) {
            return ToolResultHelper.createResult(AddCourseResponse.error(e.getMessage()));
        }

        try {
            final boolean created = configManager.addCourse(registration);
            if (request.effectiveSyncNow()) {
                syncService.submitSync(registration.courseId(), USER_MCP);
            }
            final int total = configManager.loadCourses().size();
            final String message = (created ? "Added" : "Updated") + " course " + registration.courseId()
                    + (request.effectiveSyncNow() ? ", sync started" : "");
            return ToolResultHelper.createResult(AddCourseResponse.success(message, registration.courseId(), created,
                    request.effectiveSyncNow(), total));
        } catch (final IOException e) {
            logger.error("Error saving course registration", e);
            return ToolResultHelper.createResult(AddCourseResponse.error("Error saving course registration: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult removeCourse(final Map<String, Object> args) {
        final CourseIdRequest request = CourseIdRequest.fromMap(args);
        logger.info("Remove course request: courseId={}", request.courseId());
        try {
            if (!configManager.removeCourse(request.courseId())) {
                return ToolResultHelper.createResult(SimpleMessageResponse.error("Unknown course: "
                        + request.courseId()));
            }
            return ToolResultHelper.createResult(SimpleMessageResponse.success("Removed course "
                    + request.courseId()));
        } catch (final IOException e) {
            logger.error("Error removing course", e);
            return ToolResultHelper.createResult(SimpleMessageResponse.error("Error removing course: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult listMappings(final Map<String, Object> args) {
        final CourseIdRequest request = CourseIdRequest.fromMap(args);
        if (isBlank(request.courseId())) {
            return ToolResultHelper.createResult(ListMappingsResponse.error("courseId is required"));
        }
        try {
            return ToolResultHelper.createResult(ListMappingsResponse.success(request.courseId(),
                    mappingStore.list(request.courseId())));
        } catch (final IOException e) {
            logger.error("Error listing mappings", e);
            return ToolResultHelper.createResult(ListMappingsResponse.error("Error listing mappings: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult searchCourseContent(final Map<String, Object> args) {
        final SearchContentRequest request = SearchContentRequest.fromMap(args);
        logger.info("Search request: query='{}', courseId={}, page={}, pageSize={}",
                request.query(), request.courseId(), request.effectivePage(), request.effectivePageSize());

        if (isBlank(request.query())) {
            return ToolResultHelper.createResult(SearchContentResponse.error("query is required"));
        }

        try {
            final long start = System.currentTimeMillis();
            final CourseIndexService.SearchResult result = indexService.search(request.query(), request.courseId(),
                    request.effectivePage(), request.effectivePageSize());
            final long durationMs = System.currentTimeMillis() - start;
            logger.info("Search completed in {}ms: {} total hits", durationMs, result.totalHits());
            return ToolResultHelper.createResult(SearchContentResponse.success(result, durationMs));
        } catch (final ParseException e) {
            logger.warn("Invalid query syntax: {}", e.getMessage());
            return ToolResultHelper.createResult(SearchContentResponse.error("Invalid query syntax: "
                    + e.getMessage()));
        } catch (final IOException e) {
            logger.error("Search error", e);
            return ToolResultHelper.createResult(SearchContentResponse.error("Search error: " + e.getMessage()));
        }
    }

    McpSchema.CallToolResult getSyncStatistics() {
        try {
            return ToolResultHelper.createResult(SyncStatisticsResponse.success(statisticsTracker.getStatistics(),
                    clientFactory.getCacheStats(), indexService.getDocumentCount()));
        } catch (final IOException e) {
            logger.error("Error getting sync statistics", e);
            return ToolResultHelper.createResult(SyncStatisticsResponse.error("Error getting sync statistics: "
                    + e.getMessage()));
        }
    }

    McpSchema.CallToolResult testConnection(final Map<String, Object> args) {
        final CourseIdRequest request = CourseIdRequest.fromMap(args);
        final Optional<CourseRegistration> course = configManager.findCourse(request.courseId());
        if (course.isEmpty()) {
            return ToolResultHelper.createResult(TestConnectionResponse.error("Unknown course: "
                    + request.courseId()));
        }
        try {
            final GitHubRepositoryClient client = clientFactory.createGitHubClient(course.get());
            final boolean reachable = client.testConnection();
            final GitHubRepositoryClient.RateLimitStatus rateLimit = client.getRateLimitStatus();
            return ToolResultHelper.createResult(TestConnectionResponse.success(request.courseId(),
                    GitHubRepository.parse(course.get().repoUrl()).fullName(), reachable, rateLimit.remaining(),
                    rateLimit.reset()));
        } catch (final TransportException | IllegalArgumentException e) {
            logger.warn("Connection test of {} failed: {}", request.courseId(), e.getMessage());
            return ToolResultHelper.createResult(TestConnectionResponse.error("Connection failed: " + e.getMessage()));
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
