package de.mirkosertic.mcp.coursesync.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.content.AssetUrlRewriter;
import de.mirkosertic.mcp.coursesync.content.EntityState;
import de.mirkosertic.mcp.coursesync.content.LessonJump;
import de.mirkosertic.mcp.coursesync.content.LessonAnswer;
import de.mirkosertic.mcp.coursesync.content.LuceneContentStore;
import de.mirkosertic.mcp.coursesync.content.UnsupportedActivityException;
import de.mirkosertic.mcp.coursesync.frontmatter.SnakeYamlMetadataParser;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mapping.LuceneMappingStore;
import de.mirkosertic.mcp.coursesync.mapping.MappingRecord;
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
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@DisplayName("CourseReconciler Tests")
class CourseReconcilerTest {

    private static final String SCOPE = "java-101";

    @TempDir
    Path assetRoot;

    private CourseIndexService indexService;
    private LuceneMappingStore mappingStore;
    private LuceneContentStore contentStore;
    private FakeRepositoryClient repository;
    private InMemorySnapshotMarkerStore markerStore;

    @BeforeEach
    void setUp() throws IOException {
        indexService = new CourseIndexService(new ByteBuffersDirectory(), 1000);
        indexService.init();
        mappingStore = new LuceneMappingStore(indexService);
        contentStore = spy(new LuceneContentStore(indexService, mappingStore,
                new AssetUrlRewriter("assets", "/coursesync/assets"), "assets", assetRoot, new ObjectMapper()));
        repository = new FakeRepositoryClient();
        markerStore = new InMemorySnapshotMarkerStore();
    }

    @AfterEach
    void tearDown() throws IOException {
        indexService.close();
    }

    private CourseReconciler reconciler() {
        return new CourseReconciler(SCOPE, repository, contentStore, mappingStore, RepositoryLayout.defaults(),
                new SnakeYamlMetadataParser(), markerStore);
    }

    private SyncOutcome sync(final String snapshot) throws Exception {
        repository.commit(snapshot);
        return reconciler().reconcile();
    }

    private String entityOf(final String path) throws IOException {
        return mappingStore.lookup(SCOPE, path).map(MappingRecord::entityId).orElseThrow();
    }

    private static List<String> pathsOf(final SyncOutcome outcome, final String kind) {
        return outcome.operations().stream()
                .filter(entry -> entry.kind().equals(kind))
                .map(OperationLogEntry::path)
                .toList();
    }

    @Nested
    @DisplayName("Snapshot handling")
    class SnapshotTests {

        @Test
        @DisplayName("Should report up to date without reading the tree when the snapshot is unchanged")
        void shouldStopAtUnchangedSnapshot() throws Exception {
            // Given
            repository.put("sections/01-basics/01-intro.md", "Hello");
            sync("c1");

            // When
            final SyncOutcome outcome = sync("c1");

            // Then
            assertThat(outcome.status()).isEqualTo(SyncStatus.UP_TO_DATE);
            assertThat(outcome.summary()).isEqualTo("Already up to date (commit c1).");
            assertThat(repository.getListTreeCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should persist the snapshot marker after a successful run")
        void shouldPersistSnapshot() throws Exception {
            repository.put("sections/01-basics/01-intro.md", "Hello");

            sync("abcdef1234");

            final SyncState state = markerStore.loadSyncState(SCOPE);
            assertThat(state.lastSnapshotIdentity()).isEqualTo("abcdef1234");
            assertThat(state.lastStatus()).isEqualTo(SyncStatus.SUCCESS);
        }

        @Test
        @DisplayName("Should fail on an empty tree and keep the previous marker")
        void shouldFailOnEmptyTree() {
            assertThatThrownBy(() -> sync("c1")).isInstanceOf(SyncException.class);
            assertThat(markerStore.loadSyncState(SCOPE).lastSnapshotIdentity()).isNull();
        }

        @Test
        @DisplayName("Should refuse to run twice")
        void shouldRunOnlyOnce() throws Exception {
            repository.put("sections/01-basics/01-intro.md", "Hello").commit("c1");
            final CourseReconciler reconciler = reconciler();
            reconciler.reconcile();

            assertThatThrownBy(reconciler::reconcile).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Pages")
    class PageTests {

        @Test
        @DisplayName("Should create sections and pages in ordinal order")
        void shouldCreateInOrder() throws Exception {
            // Given
            repository.put("sections/01-basics/02-b.md", "B")
                    .put("sections/01-basics/10-c.md", "C")
                    .put("sections/01-basics/01-a.md", "A");

            // When
            final SyncOutcome outcome = sync("c1");

            // Then
            assertThat(outcome.status()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(pathsOf(outcome, "page_create")).containsExactly(
                    "sections/01-basics/01-a.md", "sections/01-basics/02-b.md", "sections/01-basics/10-c.md");
            assertThat(outcome.summary()).isEqualTo("1 section(s) created, 3 activity/activities created.");
        }

        @Test
        @DisplayName("Should change nothing when a new snapshot has identical content")
        void shouldBeIdempotent() throws Exception {
            // Given
            repository.put("sections/01-basics/01-a.md", "---\nname: Alpha\n---\nA")
                    .put("sections/01-basics/02-book/01-x.md", "X");
            sync("c1");

            // When
            final SyncOutcome outcome = sync("c2");

            // Then
            assertThat(outcome.counters().totalChanges()).isZero();
            assertThat(outcome.summary()).isEqualTo("1 section(s) updated.");
            verify(contentStore, never()).updateActivity(anyString(), anyString(), anyString());
            verify(contentStore, never()).upsertChapter(anyString(), any());
        }

        @Test
        @DisplayName("Should update a page whose body changed")
        void shouldUpdateChangedPage() throws Exception {
            repository.put("sections/01-basics/01-a.md", "A");
            sync("c1");
            repository.put("sections/01-basics/01-a.md", "---\nname: Renamed\n---\nA2");

            final SyncOutcome outcome = sync("c2");

            assertThat(outcome.counters().getActivitiesUpdated()).isEqualTo(1);
            verify(contentStore).updateActivity(entityOf("sections/01-basics/01-a.md"), "Renamed", "A2");
        }

        @Test
        @DisplayName("Should hide a removed page and show it again without update when it returns")
        void shouldHideAndShowAgain() throws Exception {
            // Given
            repository.put("sections/01-basics/01-a.md", "A").put("sections/01-basics/02-b.md", "B");
            sync("c1");
            final String pageB = entityOf("sections/01-basics/02-b.md");

            // When
            repository.remove("sections/01-basics/02-b.md");
            final SyncOutcome removed = sync("c2");
            repository.put("sections/01-basics/02-b.md", "B");
            final SyncOutcome restored = sync("c3");

            // Then
            assertThat(removed.counters().getActivitiesHidden()).isEqualTo(1);
            assertThat(pathsOf(removed, "page_hide")).containsExactly("sections/01-basics/02-b.md");
            assertThat(restored.counters().getActivitiesShown()).isEqualTo(1);
            assertThat(contentStore.entityState(pageB)).isEqualTo(EntityState.VISIBLE);
            verify(contentStore, never()).updateActivity(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("Should hide the sections that disappeared at the end")
        void shouldHideRemovedSection() throws Exception {
            repository.put("sections/01-a/page.md", "A").put("sections/02-b/page.md", "B");
            sync("c1");
            final String sectionB = entityOf("sections/02-b");

            repository.remove("sections/02-b/page.md");
            final SyncOutcome outcome = sync("c2");

            assertThat(outcome.counters().getSectionsHidden()).isEqualTo(1);
            assertThat(outcome.counters().getActivitiesHidden()).isEqualTo(1);
            assertThat(contentStore.entityState(sectionB)).isEqualTo(EntityState.HIDDEN);
        }

        @Test
        @DisplayName("Should move the pages of a section that moved up and hide the section it left")
        void shouldMoveSectionWhenLeadingSectionRemoved() throws Exception {
            // Given two synchronized sections
            repository.put("sections/01-a/01-p.md", "P").put("sections/02-b/01-q.md", "Q");
            sync("c1");
            final String sectionA = entityOf("sections/01-a");
            final String sectionB = entityOf("sections/02-b");
            final String pageP = entityOf("sections/01-a/01-p.md");
            final String pageQ = entityOf("sections/02-b/01-q.md");

            // When the leading section is removed
            repository.remove("sections/01-a/01-p.md");
            final SyncOutcome outcome = sync("c2");

            // Then section b takes the first position with its page and the old entity is hidden
            assertThat(entityOf("sections/02-b")).isEqualTo(sectionA);
            assertThat(contentStore.entityName(sectionA)).contains("B");
            verify(contentStore).moveToSection(pageQ, SCOPE, 1);
            assertThat(mappingStore.lookup(SCOPE, "sections/02-b/01-q.md").orElseThrow().parentEntityId())
                    .isEqualTo(sectionA);
            assertThat(contentStore.entityState(pageQ)).isEqualTo(EntityState.VISIBLE);
            assertThat(contentStore.entityState(pageP)).isEqualTo(EntityState.HIDDEN);
            assertThat(contentStore.entityState(sectionB)).isEqualTo(EntityState.HIDDEN);
            assertThat(outcome.counters().getSectionsHidden()).isEqualTo(1);
            assertThat(outcome.counters().getActivitiesHidden()).isEqualTo(1);
            assertThat(pathsOf(outcome, "section_move")).containsExactly("sections/02-b");
        }

        @Test
        @DisplayName("Should create a page again when its activity was deleted on the platform")
        void shouldRecreateMissingActivity() throws Exception {
            repository.put("sections/01-basics/01-a.md", "A");
            mappingStore.upsert(SCOPE, "sections/01-basics/01-a.md", "deleted-id", null, "old");

            final SyncOutcome outcome = sync("c1");

            assertThat(pathsOf(outcome, "page_recreate")).containsExactly("sections/01-basics/01-a.md");
            assertThat(entityOf("sections/01-basics/01-a.md")).isNotEqualTo("deleted-id");
        }

        @Test
        @DisplayName("Should abort on unsupported activity types and keep the operations logged so far")
        void shouldAbortOnUnsupportedType() {
            repository.put("sections/01-basics/01-a.md", "A")
                    .put("sections/01-basics/02-f.md", "---\ntype: forum\n---\nF")
                    .commit("c1");
            final CourseReconciler reconciler = reconciler();

            assertThatThrownBy(reconciler::reconcile).isInstanceOf(UnsupportedActivityException.class);
            assertThat(reconciler.getOperations()).extracting(OperationLogEntry::kind)
                    .containsExactly("section_create", "page_create");
            assertThat(markerStore.loadSyncState(SCOPE).lastSnapshotIdentity()).isNull();
        }

        @Test
        @DisplayName("Should log removal errors and finish the run")
        void shouldContinueAfterSweepError() throws Exception {
            repository.put("sections/01-basics/01-a.md", "A");
            mappingStore.upsert(SCOPE, "sections/01-basics/99-old.md", "ghost", null, "h");

            final SyncOutcome outcome = sync("c1");

            assertThat(outcome.status()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(pathsOf(outcome, "page_hide_error")).containsExactly("sections/01-basics/99-old.md");
        }
    }

    @Nested
    @DisplayName("Books")
    class BookTests {

        @Test
        @DisplayName("Should create a new book with one call and map every chapter")
        void shouldCreateBookAtomically() throws Exception {
            // Given
            repository.put("sections/01-s/01-book/book.yaml", "title: The Book\n")
                    .put("sections/01-s/01-book/01-x.md", "---\ntitle: Ex\n---\nX")
                    .put("sections/01-s/01-book/02-y.md", "Y");

            // When
            final SyncOutcome outcome = sync("c1");

            // Then
            verify(contentStore, times(1)).createBook(eq(SCOPE), eq(1), eq("The Book"), anyList(), anyMap());
            verify(contentStore, never()).upsertChapter(anyString(), any());
            assertThat(outcome.counters().getChaptersCreated()).isEqualTo(2);
            final String bookId = entityOf("sections/01-s/01-book");
            final MappingRecord chapter = mappingStore.lookup(SCOPE, "sections/01-s/01-book/02-y.md").orElseThrow();
            assertThat(chapter.entityId()).isEqualTo(bookId);
            assertThat(chapter.itemId()).isNotNull();
            assertThat(chapter.contentHash()).isEqualTo(ContentHasher.hash("Y"));
        }

        @Test
        @DisplayName("Should count swapped chapter files as reordered, not updated")
        void shouldReorderWithoutUpdate() throws Exception {
            // Given
            repository.put("sections/01-s/01-book/01-x.md", "X").put("sections/01-s/01-book/02-y.md", "Y");
            sync("c1");

            // When
            repository.remove("sections/01-s/01-book/01-x.md").remove("sections/01-s/01-book/02-y.md")
                    .put("sections/01-s/01-book/01-y.md", "Y").put("sections/01-s/01-book/02-x.md", "X");
            final SyncOutcome outcome = sync("c2");

            // Then
            assertThat(outcome.counters().getChaptersReordered()).isEqualTo(2);
            assertThat(outcome.counters().getChaptersUpdated()).isZero();
            assertThat(outcome.counters().getChaptersCreated()).isZero();
            assertThat(outcome.counters().getChaptersHidden()).isZero();
            assertThat(pathsOf(outcome, "chapter_rename")).hasSize(2);
        }

        @Test
        @DisplayName("Should update changed chapters, add new ones and hide removed ones")
        void shouldDiffChapters() throws Exception {
            // Given
            repository.put("sections/01-s/01-book/01-x.md", "X").put("sections/01-s/01-book/02-y.md", "Y");
            sync("c1");

            // When
            repository.put("sections/01-s/01-book/01-x.md", "X2")
                    .remove("sections/01-s/01-book/02-y.md")
                    .put("sections/01-s/01-book/03-z.md", "Z");
            final SyncOutcome outcome = sync("c2");

            // Then
            assertThat(outcome.counters().getChaptersUpdated()).isEqualTo(1);
            assertThat(outcome.counters().getChaptersCreated()).isEqualTo(1);
            assertThat(outcome.counters().getChaptersHidden()).isEqualTo(1);
            assertThat(pathsOf(outcome, "chapter_hide")).containsExactly("sections/01-s/01-book/02-y.md");
        }

        @Test
        @DisplayName("Should update book metadata only when the metadata file changed")
        void shouldUpdateBookMetadata() throws Exception {
            repository.put("sections/01-s/01-book/book.yaml", "title: One\n").put("sections/01-s/01-book/01-x.md", "X");
            sync("c1");
            sync("c2");
            verify(contentStore, never()).updateBookMetadata(anyString(), anyMap());

            repository.put("sections/01-s/01-book/book.yaml", "title: Two\n");
            sync("c3");

            assertThat(contentStore.entityName(entityOf("sections/01-s/01-book"))).contains("Two");
        }
    }

    @Nested
    @DisplayName("Lessons")
    class LessonTests {

        @Test
        @DisplayName("Should create a lesson and relink it after a page is removed")
        void shouldCreateAndRelinkLesson() throws Exception {
            // Given
            repository.put("sections/01-s/02-quiz/lesson.yaml", "title: Quiz\n")
                    .put("sections/01-s/02-quiz/01-intro.md", "Welcome")
                    .put("sections/01-s/02-quiz/02-q.md", "---\npagetype: truefalse\ncorrect: true\n---\nJava?");
            final SyncOutcome created = sync("c1");
            final String introPage = mappingStore.lookup(SCOPE, "sections/01-s/02-quiz/01-intro.md")
                    .map(MappingRecord::itemId).orElseThrow();

            // When
            repository.remove("sections/01-s/02-quiz/02-q.md");
            final SyncOutcome updated = sync("c2");

            // Then
            assertThat(created.counters().getLessonPagesCreated()).isEqualTo(2);
            verify(contentStore, times(1)).createLesson(eq(SCOPE), eq(1), eq("Quiz"), anyList(), anyMap());
            assertThat(updated.counters().getLessonPagesRemoved()).isEqualTo(1);
            assertThat(pathsOf(updated, "lesson_relink")).containsExactly("sections/01-s/02-quiz");
            assertThat(contentStore.lessonAnswers(introPage)).extracting(LessonAnswer::jump)
                    .containsExactly(LessonJump.END_OF_LESSON);
        }

        @Test
        @DisplayName("Should update a lesson page when its answers change")
        void shouldUpdateLessonPageOnAnswerChange() throws Exception {
            repository.put("sections/01-s/02-quiz/lesson.yaml", "title: Quiz\n")
                    .put("sections/01-s/02-quiz/01-q.md", "---\npagetype: truefalse\ncorrect: true\n---\nJava?");
            sync("c1");

            repository.put("sections/01-s/02-quiz/01-q.md", "---\npagetype: truefalse\ncorrect: false\n---\nJava?");
            final SyncOutcome outcome = sync("c2");

            assertThat(outcome.counters().getLessonPagesUpdated()).isEqualTo(1);
            assertThat(pathsOf(outcome, "lesson_relink")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Metadata and assets")
    class MetadataTests {

        @Test
        @DisplayName("Should record a fallback parse of invalid metadata")
        void shouldRecordYamlFallback() throws Exception {
            repository.put("sections/01-s/section.yaml", "title: [broken\n").put("sections/01-s/a.md", "A");

            final SyncOutcome outcome = sync("c1");

            assertThat(outcome.status()).isEqualTo(SyncStatus.SUCCESS);
            assertThat(pathsOf(outcome, "yaml_fallback")).containsExactly("sections/01-s/section.yaml");
        }

        @Test
        @DisplayName("Should apply course metadata and use the section title")
        void shouldApplyCourseMetadata() throws Exception {
            repository.put("course.yaml", "fullname: Java 101\n")
                    .put("sections/01-s/section.yaml", "title: Getting started\n")
                    .put("sections/01-s/a.md", "A");

            final SyncOutcome outcome = sync("c1");

            assertThat(pathsOf(outcome, "course_update")).containsExactly("course.yaml");
            assertThat(contentStore.entityName(entityOf("sections/01-s"))).contains("Getting started");
        }

        @Test
        @DisplayName("Should upload assets and rewrite links to them")
        void shouldUploadAssetsAndRewriteLinks() throws Exception {
            repository.put("assets/logo.png", "PNG")
                    .put("sections/01-s/01-intro.md", "<img src=\"../../assets/logo.png\">");

            final SyncOutcome outcome = sync("c1");

            assertThat(outcome.counters().getAssetsUploaded()).isEqualTo(1);
            verify(contentStore).createTypedActivity(eq(SCOPE), anyInt(), eq("Intro"),
                    contains("/coursesync/assets/java-101/logo.png"), any());
        }
    }
}
