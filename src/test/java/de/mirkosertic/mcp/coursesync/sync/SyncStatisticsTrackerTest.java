package de.mirkosertic.mcp.coursesync.sync;

import de.mirkosertic.mcp.coursesync.NotificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("SyncStatisticsTracker Tests")
class SyncStatisticsTrackerTest {

    @Mock
    private NotificationService notificationService;

    private SyncStatisticsTracker tracker;

    @BeforeEach
    void setUp() {
        tracker = new SyncStatisticsTracker(notificationService);
    }

    @Test
    @DisplayName("Should track an active run until its outcome arrives")
    void shouldTrackActiveRun() {
        // When
        tracker.recordStart("java", "mcp");

        // Then
        assertThat(tracker.getStatistics().activeSyncs())
                .extracting(SyncStatistics.ActiveSync::courseId, SyncStatistics.ActiveSync::triggeringUser)
                .containsExactly(tuple("java", "mcp"));

        tracker.recordOutcome("java", SyncOutcome.upToDate("abc"), 10L);
        assertThat(tracker.getStatistics().activeSyncs()).isEmpty();
    }

    @Test
    @DisplayName("Should count outcomes and changed entities")
    void shouldCountOutcomes() {
        // Given
        final SyncCounters counters = new SyncCounters();
        counters.activityCreated();
        counters.chapterUpdated();
        counters.assetsUploaded(3);

        // When
        tracker.recordStart("java", "mcp");
        tracker.recordOutcome("java", SyncOutcome.success("abc", counters, List.of()), 100L);
        tracker.recordStart("java", "scheduler");
        tracker.recordOutcome("java", SyncOutcome.failed(null, List.of()), 300L);

        // Then
        final SyncStatistics stats = tracker.getStatistics();
        assertThat(stats.runsStarted()).isEqualTo(2);
        assertThat(stats.runsSucceeded()).isEqualTo(1);
        assertThat(stats.runsFailed()).isEqualTo(1);
        assertThat(stats.entitiesChanged()).isEqualTo(2);
        assertThat(stats.assetsUploaded()).isEqualTo(3);
        assertThat(stats.averageRunTimeMs()).isEqualTo(200.0);
        assertThat(stats.perCourseStats().get("java").failures()).isEqualTo(1);
        assertThat(stats.perCourseStats().get("java").lastStatus()).isEqualTo(SyncStatus.FAILED);
    }

    @Test
    @DisplayName("Should notify about changes and failures but not about up to date runs")
    void shouldNotify() {
        tracker.recordOutcome("a", SyncOutcome.upToDate("abc"), 1L);
        verify(notificationService, never()).notify(anyString(), anyString());

        tracker.recordOutcome("b", SyncOutcome.failed(null, List.of()), 1L);
        verify(notificationService).notify("Course b sync failed", SyncOutcome.FAILURE_SUMMARY);

        final SyncCounters counters = new SyncCounters();
        counters.activityCreated();
        tracker.recordOutcome("c", SyncOutcome.success("abc", counters, List.of()), 1500L);
        verify(notificationService).notify(eq("Course c synchronized"), startsWith("1 activity/activities created."));
    }
}
