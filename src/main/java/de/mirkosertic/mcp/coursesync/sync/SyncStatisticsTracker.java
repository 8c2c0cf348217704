package de.mirkosertic.mcp.coursesync.sync;

import de.mirkosertic.mcp.coursesync.NotificationService;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks synchronization statistics and sends notifications about finished runs.
 * Thread-safe for use from multiple sync threads.
 */
public class SyncStatisticsTracker {

    private static final Logger logger = LoggerFactory.getLogger(SyncStatisticsTracker.class);

    private final NotificationService notificationService;

    private final AtomicLong runsStarted = new AtomicLong(0);
    private final AtomicLong runsSucceeded = new AtomicLong(0);
    private final AtomicLong runsUpToDate = new AtomicLong(0);
    private final AtomicLong runsFailed = new AtomicLong(0);
    private final AtomicLong entitiesChanged = new AtomicLong(0);
    private final AtomicLong assetsUploaded = new AtomicLong(0);
    private final AtomicLong totalRunTimeMs = new AtomicLong(0);
    private final long startTime = System.currentTimeMillis();

    private final Map<String, CourseStats> courseStats = new ConcurrentHashMap<>();

    // Course id -> (user, start timestamp in millis)
    private final ConcurrentHashMap<String, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    public SyncStatisticsTracker(final NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    public void recordStart(final String courseId, final String triggeringUser) {
        runsStarted.incrementAndGet();
        activeRuns.put(courseId, new ActiveRun(triggeringUser, System.currentTimeMillis()));
    }

    public void recordOutcome(final String courseId, final SyncOutcome outcome, final long durationMs) {
        activeRuns.remove(courseId);
        totalRunTimeMs.addAndGet(durationMs);

        final CourseStats stats = courseStats.computeIfAbsent(courseId, k -> new CourseStats());
        stats.runs.incrementAndGet();
        stats.lastStatus = outcome.status();
        stats.lastRunTimeMs = System.currentTimeMillis();
        stats.lastDurationMs = durationMs;

        switch (outcome.status()) {
            case UP_TO_DATE -> runsUpToDate.incrementAndGet();
            case SUCCESS -> {
                runsSucceeded.incrementAndGet();
                if (outcome.counters() != null) {
                    entitiesChanged.addAndGet(outcome.counters().totalChanges());
                    assetsUploaded.addAndGet(outcome.counters().getAssetsUploaded());
                }
                sendCompleteNotification(courseId, outcome, durationMs);
            }
            case FAILED -> {
                runsFailed.incrementAndGet();
                stats.failures.incrementAndGet();
                sendFailureNotification(courseId);
            }
        }
    }

    private void sendCompleteNotification(final String courseId, final SyncOutcome outcome, final long durationMs) {
        final String message = String.format("%s (%.1f seconds)", outcome.summary(), durationMs / 1000.0);
        notificationService.notify("Course " + courseId + " synchronized", message);
        logger.info("Sync of {} complete: {}", courseId, message);
    }

    private void sendFailureNotification(final String courseId) {
        notificationService.notify("Course " + courseId + " sync failed", SyncOutcome.FAILURE_SUMMARY);
    }

    public void sendBatchCompleteNotification(final int succeeded, final int upToDate, final int failed) {
        final String message = String.format("%d synchronized, %d up to date, %d failed", succeeded, upToDate, failed);
        notificationService.notify("Course Sync Batch Complete", message);
        logger.info("Sync batch complete: {}", message);
    }

    public SyncStatistics getStatistics() {
        final Map<String, SyncStatistics.CourseStatistics> perCourse = new ConcurrentHashMap<>();
        for (final Map.Entry<String, CourseStats> entry : courseStats.entrySet()) {
            final CourseStats stats = entry.getValue();
            perCourse.put(entry.getKey(), new SyncStatistics.CourseStatistics(
                    entry.getKey(),
                    stats.runs.get(),
                    stats.failures.get(),
                    stats.lastStatus,
                    stats.lastRunTimeMs,
                    stats.lastDurationMs
            ));
        }

        final long now = System.currentTimeMillis();
        final List<SyncStatistics.ActiveSync> active = new ArrayList<>();
        for (final Map.Entry<String, ActiveRun> entry : activeRuns.entrySet()) {
            active.add(new SyncStatistics.ActiveSync(entry.getKey(), entry.getValue().user(),
                    now - entry.getValue().startedAt()));
        }

        return new SyncStatistics(
                runsStarted.get(),
                runsSucceeded.get(),
                runsUpToDate.get(),
                runsFailed.get(),
                entitiesChanged.get(),
                assetsUploaded.get(),
                totalRunTimeMs.get(),
                startTime,
                perCourse,
                active
        );
    }

    private record ActiveRun(String user, long startedAt) {
    }

    private static class CourseStats {
        final AtomicLong runs = new AtomicLong(0);
        final AtomicLong failures = new AtomicLong(0);
        volatile @Nullable SyncStatus lastStatus;
        volatile long lastRunTimeMs;
        volatile long lastDurationMs;
    }
}
