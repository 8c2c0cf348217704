package de.mirkosertic.mcp.coursesync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.NotificationService;
import de.mirkosertic.mcp.coursesync.content.AssetUrlRewriter;
import de.mirkosertic.mcp.coursesync.content.LuceneContentStore;
import de.mirkosertic.mcp.coursesync.frontmatter.SnakeYamlMetadataParser;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mapping.LuceneMappingStore;
import de.mirkosertic.mcp.coursesync.repository.RepositoryClient;
import de.mirkosertic.mcp.coursesync.repository.TransportException;
import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CourseSyncService Tests")
class CourseSyncServiceTest {

    @TempDir
    Path tempDir;

    private CourseIndexService indexService;
    private CourseConfigurationManager courses;
    private SyncExecutorService executorService;
    private SyncStatisticsTracker statisticsTracker;
    private CourseSyncService service;

    private final Map<String, FakeRepositoryClient> repositories = new HashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        indexService = new CourseIndexService(new ByteBuffersDirectory(), 1000);
        indexService.init();
        final ObjectMapper objectMapper = new ObjectMapper();
        final LuceneMappingStore mappingStore = new LuceneMappingStore(indexService);
        final LuceneContentStore contentStore = new LuceneContentStore(indexService, mappingStore,
                new AssetUrlRewriter("assets", "/assets"), "assets", tempDir.resolve("assets"), objectMapper);

        courses = new CourseConfigurationManager(tempDir.resolve("config"));
        courses.init();
        executorService = new SyncExecutorService(2);
        statisticsTracker = new SyncStatisticsTracker(new NotificationService(false));
        service = new CourseSyncService(courses, this::clientFor, contentStore, mappingStore,
                new LuceneSyncHistoryStore(indexService, objectMapper), RepositoryLayout.defaults(),
                new SnakeYamlMetadataParser(), executorService, statisticsTracker);
    }

    @AfterEach
    void tearDown() throws IOException {
        service.shutdown();
        executorService.shutdown();
        indexService.close();
    }

    private RepositoryClient clientFor(final CourseRegistration registration) {
        final FakeRepositoryClient client = repositories.get(registration.repoUrl());
        if (client == null) {
            throw new IllegalArgumentException("Unsupported repository URL: " + registration.repoUrl());
        }
        return client;
    }

    private FakeRepositoryClient register(final String courseId, final boolean autoSync) throws IOException {
        final String url = "https://github.com/acme/" + courseId;
        courses.addCourse(new CourseRegistration(courseId, url, null, null, autoSync));
        final FakeRepositoryClient client = new FakeRepositoryClient()
                .put("sections/01-intro/01-welcome.md", "Welcome to " + courseId)
                .commit("commit-" + courseId);
        repositories.put(url, client);
        return client;
    }

    @Nested
    @DisplayName("Single course")
    class SingleCourseTests {

        @Test
        @DisplayName("Should synchronize a course and record marker, history and statistics")
        void shouldSynchronizeCourse() throws IOException {
            // Given
            register("java", false);

            // When
            final SyncOutcome outcome = service.syncCourse("java", "mcp");

            // Then
            assertThat(outcome.status()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(service.getSyncState("java").lastSnapshotIdentity()).isEqualTo("commit-java");
            assertThat(service.getHistory("java", 10)).singleElement().satisfies(record -> {
                assertThat(record.triggeringUser()).isEqualTo("mcp");
                assertThat(record.status()).isEqualTo(SyncStatus.SUCCESS);
                assertThat(record.summary()).isEqualTo(outcome.summary());
            });
            assertThat(statisticsTracker.getStatistics().runsSucceeded()).isEqualTo(1);
            assertThat(service.isSyncRunning("java")).isFalse();
        }

        @Test
        @DisplayName("Should report up to date on the second run of the same commit")
        void shouldReportUpToDate() throws IOException {
            register("java", false);
            service.syncCourse("java", "mcp");

            final SyncOutcome outcome = service.syncCourse("java", "mcp");

            assertThat(outcome.status()).isEqualTo(SyncStatus.UP_TO_DATE);
            assertThat(service.getHistory("java", 10)).hasSize(2);
        }

        @Test
        @DisplayName("Should reject unknown courses")
        void shouldRejectUnknownCourse() {
            assertThatThrownBy(() -> service.syncCourse("nope", "mcp"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("nope");
        }

        @Test
        @DisplayName("Should turn a transport failure into a redacted failed outcome")
        void shouldRedactFailures() throws IOException {
            // Given
            final FakeRepositoryClient client = register("java", false);
            service.syncCourse("java", "mcp");
            client.failWith(new TransportException("connection reset by api.github.com", 502));

            // When
            final SyncOutcome outcome = service.syncCourse("java", "scheduler");

            // Then
            assertThat(outcome.status()).isEqualTo(SyncStatus.FAILED);
            assertThat(outcome.summary()).isEqualTo(SyncOutcome.FAILURE_SUMMARY);
            assertThat(outcome.summary()).doesNotContain("github");

            final SyncHistoryRecord latest = service.getHistory("java", 1).get(0);
            assertThat(latest.status()).isEqualTo(SyncStatus.FAILED);
            assertThat(latest.summary()).isEqualTo(SyncOutcome.FAILURE_SUMMARY);
            assertThat(latest.operations()).last().satisfies(entry -> {
                assertThat(entry.kind()).isEqualTo("error");
                assertThat(entry.detail()).contains("TransportException", "connection reset");
            });

            final SyncState state = service.getSyncState("java");
            assertThat(state.lastSnapshotIdentity()).isEqualTo("commit-java");
            assertThat(state.lastStatus()).isEqualTo(SyncStatus.FAILED);
        }

        @Test
        @DisplayName("Should run a submitted sync in the background")
        void shouldSubmitSync() throws Exception {
            register("java", false);

            final SyncOutcome outcome = service.submitSync("java", "mcp").get(10, TimeUnit.SECONDS);

            assertThat(outcome.status()).isEqualTo(SyncStatus.SUCCESS);
        }

        @Test
        @DisplayName("Should serialize concurrent runs of the same course")
        void shouldSerializeRunsOfSameCourse() throws Exception {
            // Given a repository whose first snapshot lookup blocks until released
            final CountDownLatch entered = new CountDownLatch(1);
            final CountDownLatch release = new CountDownLatch(1);
            final AtomicInteger lookups = new AtomicInteger();
            final String url = "https://github.com/acme/java";
            courses.addCourse(new CourseRegistration("java", url, null, null, false));
            final FakeRepositoryClient client = new FakeRepositoryClient() {
                @Override
                public String getSnapshotIdentity() throws TransportException {
                    if (lookups.incrementAndGet() == 1) {
                        entered.countDown();
                        try {
                            release.await(10, TimeUnit.SECONDS);
                        } catch (final InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                    }
                    return super.getSnapshotIdentity();
                }
            };
            client.put("sections/01-intro/01-welcome.md", "Welcome").commit("commit-java");
            repositories.put(url, client);

            // When a second run is triggered while the first is still running
            final Future<SyncOutcome> first = service.submitSync("java", "mcp");
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
            final Future<SyncOutcome> second = service.submitSync("java", "scheduler");
            Thread.sleep(200);

            // Then the second run waits and finds the snapshot up to date
            assertThat(service.isSyncRunning("java")).isTrue();
            assertThat(second.isDone()).isFalse();
            release.countDown();
            assertThat(first.get(10, TimeUnit.SECONDS).status()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(second.get(10, TimeUnit.SECONDS).status()).isEqualTo(SyncStatus.UP_TO_DATE);
            assertThat(lookups.get()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Batch")
    class BatchTests {

        @Test
        @DisplayName("Should continue the batch past a failing course")
        void shouldContinuePastFailure() throws IOException {
            // Given
            register("java", true);
            courses.addCourse(new CourseRegistration("broken", "https://gitlab.example/acme/broken", null, null, true));
            register("python", true);

            // When
            final BatchResult result = service.syncAll(false, "mcp");

            // Then
            assertThat(result.results()).extracting(BatchResult.CourseResult::courseId)
                    .containsExactly("java", "broken", "python");
            assertThat(result.count(SyncStatus.SUCCESS)).isEqualTo(2);
            assertThat(result.count(SyncStatus.FAILED)).isEqualTo(1);
            assertThat(service.getHistory("broken", 10)).singleElement()
                    .extracting(SyncHistoryRecord::status).isEqualTo(SyncStatus.FAILED);
        }

        @Test
        @DisplayName("Should only include auto-sync courses when asked to")
        void shouldFilterAutoSyncCourses() throws IOException {
            register("java", true);
            register("python", false);

            final BatchResult result = service.syncAll(true, CourseSyncService.USER_SCHEDULER);

            assertThat(result.results()).extracting(BatchResult.CourseResult::courseId).containsExactly("java");
            assertThat(service.getHistory("python", 10)).isEmpty();
            assertThat(service.getHistory("java", 10)).extracting(SyncHistoryRecord::triggeringUser)
                    .containsExactly(CourseSyncService.USER_SCHEDULER);
        }
    }
}
