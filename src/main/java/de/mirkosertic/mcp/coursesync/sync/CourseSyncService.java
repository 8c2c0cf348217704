package de.mirkosertic.mcp.coursesync.sync;

import com.google.common.base.Throwables;
import de.mirkosertic.mcp.coursesync.content.ContentBuilder;
import de.mirkosertic.mcp.coursesync.frontmatter.MetadataParser;
import de.mirkosertic.mcp.coursesync.mapping.MappingStore;
import de.mirkosertic.mcp.coursesync.repository.RepositoryClient;
import de.mirkosertic.mcp.coursesync.repository.RepositoryClientFactory;
import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry point for synchronization runs, used by the MCP tools and the auto-sync schedule.
 * <p>
 * Runs of the same course are serialized with a per-course lock: a second trigger waits for the
 * running one and then usually finds the course up to date. Every run, whatever its outcome, leaves
 * one history record. Failures never escape: they turn into a {@link SyncStatus#FAILED} outcome with a
 * redacted summary, while the exception detail is kept in the operation log of the history record.
 */
public class CourseSyncService {

    private static final Logger logger = LoggerFactory.getLogger(CourseSyncService.class);

    public static final String USER_SCHEDULER = "scheduler";

    private final CourseConfigurationManager courses;
    private final RepositoryClientFactory clientFactory;
    private final ContentBuilder contentBuilder;
    private final MappingStore mappingStore;
    private final SyncHistoryStore historyStore;
    private final RepositoryLayout layout;
    private final MetadataParser metadataParser;
    private final SyncExecutorService executorService;
    private final SyncStatisticsTracker statisticsTracker;

    private final Map<String, ReentrantLock> courseLocks = new ConcurrentHashMap<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        final Thread t = new Thread(r, "course-auto-sync");
        t.setDaemon(true);
        return t;
    });
    private volatile ScheduledFuture<?> autoSyncFuture;

    public CourseSyncService(final CourseConfigurationManager courses, final RepositoryClientFactory clientFactory,
                             final ContentBuilder contentBuilder, final MappingStore mappingStore,
                             final SyncHistoryStore historyStore, final RepositoryLayout layout,
                             final MetadataParser metadataParser, final SyncExecutorService executorService,
                             final SyncStatisticsTracker statisticsTracker) {
        this.courses = courses;
        this.clientFactory = clientFactory;
        this.contentBuilder = contentBuilder;
        this.mappingStore = mappingStore;
        this.historyStore = historyStore;
        this.layout = layout;
        this.metadataParser = metadataParser;
        this.executorService = executorService;
        this.statisticsTracker = statisticsTracker;
    }

    /**
     * Synchronizes one registered course and waits for the result.
     *
     * @throws IllegalArgumentException if no course with this id is registered
     */
    public SyncOutcome syncCourse(final String courseId, final String triggeringUser) {
        final CourseRegistration registration = courses.findCourse(courseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown course: " + courseId));
        return syncCourse(registration, triggeringUser);
    }

    public SyncOutcome syncCourse(final CourseRegistration registration, final String triggeringUser) {
        final String courseId = registration.courseId();
        final ReentrantLock lock = courseLocks.computeIfAbsent(courseId, k -> new ReentrantLock());
        if (lock.isLocked()) {
            logger.info("A sync of {} is already running, waiting for it", courseId);
        }
        lock.lock();
        try {
            return runLocked(registration, triggeringUser);
        } finally {
            lock.unlock();
        }
    }

    private SyncOutcome runLocked(final CourseRegistration registration, final String triggeringUser) {
        final String courseId = registration.courseId();
        final long start = System.currentTimeMillis();
        statisticsTracker.recordStart(courseId, triggeringUser);
        logger.info("Sync of {} triggered by {}", courseId, triggeringUser);

        CourseReconciler reconciler = null;
        SyncOutcome outcome;
        try {
            final RepositoryClient client = clientFactory.create(registration);
            reconciler = new CourseReconciler(courseId, client, contentBuilder, mappingStore, layout, metadataParser,
                    courses);
            outcome = reconciler.reconcile();
        } catch (final SyncException | IOException | RuntimeException e) {
            logger.error("Sync of {} failed", courseId, e);
            final OperationLog failureLog = new OperationLog();
            failureLog.log("error", "", describe(e));
            final List<OperationLogEntry> operations = new ArrayList<>();
            if (reconciler != null) {
                operations.addAll(reconciler.getOperations());
            }
            operations.addAll(failureLog.entries());
            outcome = SyncOutcome.failed(null, operations);
            markFailed(courseId);
        }

        final long durationMs = System.currentTimeMillis() - start;
        appendHistory(new SyncHistoryRecord(courseId, triggeringUser, outcome.snapshotIdentity(), outcome.status(),
                outcome.summary(), outcome.operations(), System.currentTimeMillis()));
        statisticsTracker.recordOutcome(courseId, outcome, durationMs);
        return outcome;
    }

    static String describe(final Throwable e) {
        final StringBuilder detail = new StringBuilder(e.getClass().getSimpleName());
        if (e.getMessage() != null) {
            detail.append(": ").append(e.getMessage());
        }
        final Throwable root = Throwables.getRootCause(e);
        if (root != e) {
            detail.append(" (caused by ").append(root.getClass().getSimpleName());
            if (root.getMessage() != null) {
                detail.append(": ").append(root.getMessage());
            }
            detail.append(')');
        }
        return detail.toString();
    }

    private void markFailed(final String courseId) {
        try {
            final SyncState previous = courses.loadSyncState(courseId);
            courses.saveSyncState(courseId,
                    new SyncState(previous.lastSnapshotIdentity(), previous.lastSyncTimeMs(), SyncStatus.FAILED));
        } catch (final IOException e) {
            logger.error("Failed to record failed sync state of {}", courseId, e);
        }
    }

    private void appendHistory(final SyncHistoryRecord record) {
        try {
            historyStore.append(record);
        } catch (final IOException e) {
            logger.error("Failed to write sync history of {}", record.scopeId(), e);
        }
    }

    /**
     * Synchronizes every registered course, or only those with auto-sync enabled. Courses run in parallel
     * on the sync workers; a failing course never stops the others.
     */
    public BatchResult syncAll(final boolean autoSyncOnly, final String triggeringUser) {
        final List<CourseRegistration> selected = new ArrayList<>();
        for (final CourseRegistration registration : courses.loadCourses()) {
            if (!autoSyncOnly || registration.autoSync()) {
                selected.add(registration);
            }
        }
        logger.info("Starting sync batch over {} courses (auto-sync only: {})", selected.size(), autoSyncOnly);

        final List<Future<SyncOutcome>> futures = new ArrayList<>();
        for (final CourseRegistration registration : selected) {
            futures.add(executorService.submit(() -> syncCourse(registration, triggeringUser)));
        }

        final List<BatchResult.CourseResult> results = new ArrayList<>();
        for (int i = 0; i < selected.size(); i++) {
            final String courseId = selected.get(i).courseId();
            results.add(new BatchResult.CourseResult(courseId, await(courseId, futures.get(i))));
        }

        final BatchResult result = new BatchResult(results);
        statisticsTracker.sendBatchCompleteNotification((int) result.count(SyncStatus.SUCCESS),
                (int) result.count(SyncStatus.UP_TO_DATE), (int) result.count(SyncStatus.FAILED));
        return result;
    }

    private static SyncOutcome await(final String courseId, final Future<SyncOutcome> future) {
        try {
            return future.get();
        } catch (final ExecutionException e) {
            logger.error("Sync task of {} failed", courseId, e.getCause());
            final OperationLog failureLog = new OperationLog();
            failureLog.log("error", "", describe(e.getCause() != null ? e.getCause() : e));
            return SyncOutcome.failed(null, failureLog.entries());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for the sync of {}", courseId);
            final OperationLog failureLog = new OperationLog();
            failureLog.log("error", "", "interrupted");
            return SyncOutcome.failed(null, failureLog.entries());
        }
    }

    /**
     * Starts a sync in the background.
     */
    public Future<SyncOutcome> submitSync(final String courseId, final String triggeringUser) {
        final CourseRegistration registration = courses.findCourse(courseId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown course: " + courseId));
        return executorService.submit(() -> syncCourse(registration, triggeringUser));
    }

    public boolean isSyncRunning(final String courseId) {
        final ReentrantLock lock = courseLocks.get(courseId);
        return lock != null && lock.isLocked();
    }

    public SyncState getSyncState(final String courseId) {
        return courses.loadSyncState(courseId);
    }

    public List<SyncHistoryRecord> getHistory(final String courseId, final int limit) throws IOException {
        return historyStore.list(courseId, limit);
    }

    public Optional<CourseRegistration> findCourse(final String courseId) {
        return courses.findCourse(courseId);
    }

    /**
     * Schedules the batch over all auto-sync courses at a fixed interval.
     */
    public void startAutoSync(final long intervalMinutes) {
        autoSyncFuture = scheduler.scheduleAtFixedRate(this::runScheduledBatch, intervalMinutes, intervalMinutes,
                TimeUnit.MINUTES);
        logger.info("Auto-sync scheduled every {} minutes", intervalMinutes);
    }

    private void runScheduledBatch() {
        try {
            syncAll(true, USER_SCHEDULER);
        } catch (final Exception e) {
            // ScheduledExecutorService cancels the periodic task if it throws
            logger.error("Scheduled sync batch failed", e);
        }
    }

    public void shutdown() {
        final ScheduledFuture<?> future = autoSyncFuture;
        if (future != null) {
            future.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
