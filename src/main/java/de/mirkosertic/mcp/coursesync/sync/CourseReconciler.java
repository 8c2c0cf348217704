package de.mirkosertic.mcp.coursesync.sync;

import de.mirkosertic.mcp.coursesync.content.AssetReport;
import de.mirkosertic.mcp.coursesync.content.BookCreation;
import de.mirkosertic.mcp.coursesync.content.ChapterContent;
import de.mirkosertic.mcp.coursesync.content.ChapterState;
import de.mirkosertic.mcp.coursesync.content.ContentBuilder;
import de.mirkosertic.mcp.coursesync.content.EntityState;
import de.mirkosertic.mcp.coursesync.content.LessonCreation;
import de.mirkosertic.mcp.coursesync.content.LessonPageContent;
import de.mirkosertic.mcp.coursesync.content.LessonPageState;
import de.mirkosertic.mcp.coursesync.content.UpsertOutcome;
import de.mirkosertic.mcp.coursesync.frontmatter.FlatFrontMatterParser;
import de.mirkosertic.mcp.coursesync.frontmatter.FrontMatter;
import de.mirkosertic.mcp.coursesync.frontmatter.FrontMatterParser;
import de.mirkosertic.mcp.coursesync.frontmatter.MetadataParseResult;
import de.mirkosertic.mcp.coursesync.frontmatter.MetadataParser;
import de.mirkosertic.mcp.coursesync.frontmatter.NestedFrontMatterParser;
import de.mirkosertic.mcp.coursesync.mapping.MappingRecord;
import de.mirkosertic.mcp.coursesync.mapping.MappingStore;
import de.mirkosertic.mcp.coursesync.mapping.MappingUpdate;
import de.mirkosertic.mcp.coursesync.repository.RepositoryClient;
import de.mirkosertic.mcp.coursesync.tree.BookKind;
import de.mirkosertic.mcp.coursesync.tree.BookNode;
import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import de.mirkosertic.mcp.coursesync.tree.SectionNode;
import de.mirkosertic.mcp.coursesync.tree.StructuredTree;
import de.mirkosertic.mcp.coursesync.tree.TreeClassifier;
import de.mirkosertic.mcp.coursesync.tree.TreeEntry;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Synchronizes one course with the current snapshot of its repository.
 * <p>
 * A run resolves the snapshot, classifies the tree, stores assets, applies the course metadata,
 * walks sections in order (pages, books and lessons inside each), hides entities whose files are gone
 * and finally persists the snapshot marker. Every step writes its mapping records as it goes, so a
 * failed run leaves a consistent state that the next run continues from.
 * <p>
 * Instances hold the counters and the operation log of a single run and must not be reused.
 */
public class CourseReconciler {

    private static final Logger logger = LoggerFactory.getLogger(CourseReconciler.class);

    private final String scopeId;
    private final RepositoryClient repository;
    private final ContentBuilder builder;
    private final MappingStore mappings;
    private final RepositoryLayout layout;
    private final MetadataParser metadataParser;
    private final SnapshotMarkerStore markerStore;

    private final FrontMatterParser pageParser = new FlatFrontMatterParser();
    private final FrontMatterParser lessonParser = new NestedFrontMatterParser();

    private final OperationLog operations = new OperationLog();
    private final SyncCounters counters = new SyncCounters();
    private final Set<String> touchedPaths = new HashSet<>();
    private final Set<String> touchedEntities = new HashSet<>();
    private final Set<String> displacedSections = new HashSet<>();
    private boolean rewriteAssetUrls;
    private boolean started;

    public CourseReconciler(final String scopeId, final RepositoryClient repository, final ContentBuilder builder,
                            final MappingStore mappings, final RepositoryLayout layout,
                            final MetadataParser metadataParser, final SnapshotMarkerStore markerStore) {
        this.scopeId = scopeId;
        this.repository = repository;
        this.builder = builder;
        this.mappings = mappings;
        this.layout = layout;
        this.metadataParser = metadataParser;
        this.markerStore = markerStore;
    }

    /**
     * Runs the synchronization.
     *
     * @return {@link SyncStatus#UP_TO_DATE} when the snapshot did not change, {@link SyncStatus#SUCCESS} otherwise
     * @throws SyncException on transport failures, an empty tree or an activity type that cannot be built
     * @throws IOException   when the content platform or the mapping store fails
     */
    public SyncOutcome reconcile() throws SyncException, IOException {
        if (started) {
            throw new IllegalStateException("A reconciler runs only once");
        }
        started = true;

        final SyncState previous = markerStore.loadSyncState(scopeId);
        final String snapshot = repository.getSnapshotIdentity();
        if (snapshot.equals(previous.lastSnapshotIdentity())) {
            logger.info("Course {} is already at commit {}", scopeId, SyncOutcome.shortId(snapshot));
            return SyncOutcome.upToDate(snapshot);
        }

        logger.info("Synchronizing course {} to commit {}", scopeId, SyncOutcome.shortId(snapshot));
        final List<TreeEntry> entries = repository.listTree();
        final StructuredTree tree = new TreeClassifier(layout).classify(entries);
        rewriteAssetUrls = !tree.assets().isEmpty();

        if (!tree.assets().isEmpty()) {
            processAssets(tree.assets());
        }
        if (tree.rootMetadataPath() != null) {
            processRootMetadata(tree.rootMetadataPath());
        }

        int position = 0;
        for (final SectionNode section : tree.sections().values()) {
            position++;
            processSection(section, position);
        }

        sweep();
        hideDisplacedSections();

        markerStore.saveSyncState(scopeId, new SyncState(snapshot, System.currentTimeMillis(), SyncStatus.SUCCESS));
        final SyncOutcome outcome = SyncOutcome.success(snapshot, counters, operations.entries());
        logger.info("Course {} synchronized: {}", scopeId, outcome.summary());
        return outcome;
    }

    /**
     * Operations recorded so far, also available after a failed run.
     */
    public List<OperationLogEntry> getOperations() {
        return operations.entries();
    }

    public SyncCounters getCounters() {
        return counters;
    }

    // ==================== Assets and course metadata ====================

    private void processAssets(final List<String> assets) throws SyncException, IOException {
        touchedPaths.addAll(assets);
        final AssetReport report = builder.processAssets(scopeId, assets, repository::getFileContents);
        counters.assetsUploaded(report.uploaded());
        for (final String path : report.uploadedPaths()) {
            operations.log("asset_upload", path, "uploaded");
        }
        for (final String path : report.skippedPaths()) {
            operations.log("asset_skip", path, "unchanged");
        }
        logger.debug("Assets of {}: {} uploaded, {} unchanged", scopeId, report.uploaded(), report.skipped());
    }

    private void processRootMetadata(final String path) throws SyncException, IOException {
        touchedPaths.add(path);
        final Map<String, Object> metadata = parseMetadata(path, fetchText(path));
        if (!metadata.isEmpty()) {
            builder.updateRootMetadata(scopeId, metadata);
            operations.log("course_update", path, "metadata keys " + metadata.keySet());
        }
    }

    // ==================== Sections and pages ====================

    private void processSection(final SectionNode section, final int position) throws SyncException, IOException {
        touchedPaths.add(section.path());

        final Map<String, Object> metadata = new LinkedHashMap<>();
        if (section.metadataPath() != null) {
            touchedPaths.add(section.metadataPath());
            metadata.putAll(parseMetadata(section.metadataPath(), fetchText(section.metadataPath())));
        }
        final Object title = metadata.get("title");
        if (title == null || title.toString().isBlank()) {
            metadata.put("title", ActivityNames.derive(section.name()));
        }

        final @Nullable String previousId = mappings.lookup(scopeId, section.path())
                .filter(MappingRecord::hasEntity)
                .map(MappingRecord::entityId)
                .orElse(null);
        final String sectionId = builder.ensureSection(scopeId, position, metadata);
        touchedEntities.add(sectionId);
        if (previousId != null && !previousId.equals(sectionId)) {
            relocateSection(section, position, previousId, sectionId);
        }
        mappings.upsert(scopeId, section.path(), sectionId, null, null);
        if (section.metadataPath() != null) {
            mappings.upsert(scopeId, section.metadataPath(), sectionId, null, null);
        }
        if (previousId != null) {
            counters.sectionUpdated();
            operations.log("section_update", section.path(), "section " + position);
        } else {
            counters.sectionCreated();
            operations.log("section_create", section.path(), "section " + position + " id=" + sectionId);
        }

        for (final Map.Entry<String, String> page : section.pages().entrySet()) {
            processPage(sectionId, position, page.getKey(), page.getValue());
        }
        for (final BookNode book : section.books().values()) {
            if (book.kind() == BookKind.LESSON) {
                processLesson(sectionId, position, book);
            } else {
                processBook(sectionId, position, book);
            }
        }
    }

    // The directory now sits at another position: its entities follow it into the section there
    private void relocateSection(final SectionNode section, final int position, final String previousId,
                                 final String sectionId) throws IOException {
        final String prefix = section.path() + "/";
        final Set<String> moved = new HashSet<>();
        for (final MappingRecord record : mappings.list(scopeId)) {
            if (!record.hasEntity()
                    || !record.repoPath().startsWith(prefix)
                    || !previousId.equals(record.parentEntityId())) {
                continue;
            }
            if (moved.add(record.entityId()) && builder.entityState(record.entityId()) != EntityState.MISSING) {
                builder.moveToSection(record.entityId(), scopeId, position);
            }
            mappings.upsert(scopeId, record.repoPath(), new MappingUpdate(null, sectionId, null, null));
        }
        displacedSections.add(previousId);
        operations.log("section_move", section.path(), "section " + position + " was id=" + previousId
                + ", moved " + moved.size() + " item(s)");
    }

    private void processPage(final String sectionId, final int sectionPosition, final String fileName,
                             final String path) throws SyncException, IOException {
        touchedPaths.add(path);

        final FrontMatter frontMatter = pageParser.parse(fetchText(path));
        final String body = rewrite(frontMatter.body());
        final String name = frontMatter.getString("name", ActivityNames.derive(fileName));
        final String hash = ContentHasher.hash(body);

        final Optional<MappingRecord> mapping = mappings.lookup(scopeId, path).filter(MappingRecord::hasEntity);
        if (mapping.isPresent()) {
            final String entityId = mapping.get().entityId();
            final EntityState state = builder.entityState(entityId);
            if (state != EntityState.MISSING) {
                touchedEntities.add(entityId);
                if (hash.equals(mapping.get().contentHash())) {
                    counters.skipped();
                    operations.log("page_skip", path, "unchanged");
                } else {
                    builder.updateActivity(entityId, name, body);
                    mappings.upsert(scopeId, path, entityId, sectionId, hash);
                    counters.activityUpdated();
                    operations.log("page_update", path, "updated id=" + entityId);
                }
                if (state == EntityState.HIDDEN && frontMatter.getBoolean("visible", true)) {
                    builder.setVisible(entityId, true);
                    counters.activityShown();
                    operations.log("page_show", path, "shown id=" + entityId);
                }
                return;
            }
            logger.warn("Activity {} of {} no longer exists, creating it again", entityId, path);
            operations.log("page_recreate", path, "missing id=" + entityId);
        }

        final String entityId = builder.createTypedActivity(scopeId, sectionPosition, name, body, frontMatter);
        touchedEntities.add(entityId);
        mappings.upsert(scopeId, path, entityId, sectionId, hash);
        counters.activityCreated();
        operations.log(frontMatter.getString("type", "page") + "_create", path, "created id=" + entityId);
    }

    // ==================== Books ====================

    private void processBook(final String sectionId, final int sectionPosition, final BookNode book)
            throws SyncException, IOException {
        touchedPaths.add(book.path());
        final ContainerMetadata metadata = containerMetadata(book);

        final List<ChapterContent> chapters = new ArrayList<>();
        final Map<String, String> hashes = new HashMap<>();
        int position = 0;
        for (final Map.Entry<String, String> file : book.chapters().entrySet()) {
            position++;
            final String path = file.getValue();
            touchedPaths.add(path);
            final FrontMatter frontMatter = pageParser.parse(fetchText(path));
            final String body = rewrite(frontMatter.body());
            chapters.add(new ChapterContent(path, frontMatter.getString("title", ActivityNames.derive(file.getKey())),
                    body, frontMatter.getBoolean("subchapter", false), position));
            hashes.put(path, ContentHasher.hash(body));
        }

        final Optional<String> bookId = existingContainer(book);
        if (bookId.isEmpty()) {
            createBook(sectionId, sectionPosition, book, metadata, chapters, hashes);
        } else {
            updateBook(sectionId, bookId.get(), book, metadata, chapters, hashes);
        }
    }

    private void createBook(final String sectionId, final int sectionPosition, final BookNode book,
                            final ContainerMetadata metadata, final List<ChapterContent> chapters,
                            final Map<String, String> hashes) throws IOException {
        final BookCreation creation = builder.createBook(scopeId, sectionPosition, metadata.title(book),
                chapters, metadata.values());
        final String bookId = creation.bookId();
        touchedEntities.add(bookId);

        for (final ChapterContent chapter : chapters) {
            mappings.upsert(scopeId, chapter.importKey(), new MappingUpdate(bookId, sectionId,
                    hashes.get(chapter.importKey()), creation.chapterIds().get(chapter.importKey())));
            counters.chapterCreated();
        }
        mappings.upsert(scopeId, book.path(), bookId, sectionId, null);
        if (book.metadataPath() != null) {
            mappings.upsert(scopeId, book.metadataPath(), bookId, sectionId, metadata.hash());
        }
        counters.activityCreated();
        operations.log("book_create", book.path(), "created id=" + bookId + " with " + chapters.size() + " chapters");
    }

    private void updateBook(final String sectionId, final String bookId, final BookNode book,
                            final ContainerMetadata metadata, final List<ChapterContent> chapters,
                            final Map<String, String> hashes) throws IOException {
        touchedEntities.add(bookId);
        showContainerIfHidden(bookId, book.path());

        if (metadataChanged(book, metadata)) {
            builder.updateBookMetadata(bookId, metadata.values());
            mappings.upsert(scopeId, book.metadataPath(), bookId, sectionId, metadata.hash());
            operations.log("book_update", book.metadataPath(), "metadata updated id=" + bookId);
        }

        final Map<String, ChapterState> stored = new LinkedHashMap<>();
        for (final ChapterState state : builder.listChapters(bookId)) {
            stored.put(state.importKey(), state);
        }
        final Set<String> currentKeys = new HashSet<>();
        for (final ChapterContent chapter : chapters) {
            currentKeys.add(chapter.importKey());
        }

        // Chapters whose file vanished, by their last known hash, to follow renamed files
        final Map<String, String> vanishedByHash = new HashMap<>();
        for (final ChapterState state : stored.values()) {
            if (!currentKeys.contains(state.importKey())) {
                final Optional<MappingRecord> mapping = mappings.lookup(scopeId, state.importKey());
                if (mapping.isPresent() && mapping.get().contentHash() != null) {
                    vanishedByHash.putIfAbsent(mapping.get().contentHash(), state.importKey());
                }
            }
        }

        for (final ChapterContent chapter : chapters) {
            final String key = chapter.importKey();
            final String hash = hashes.get(key);
            ChapterState state = stored.get(key);
            @Nullable String knownHash = mappings.lookup(scopeId, key).map(MappingRecord::contentHash).orElse(null);

            if (state == null) {
                final String previousKey = vanishedByHash.remove(hash);
                if (previousKey != null) {
                    builder.rekeyChapter(bookId, previousKey, key);
                    final ChapterState moved = stored.remove(previousKey);
                    state = new ChapterState(key, moved.chapterId(), moved.position(), moved.hidden());
                    stored.put(key, state);
                    knownHash = hash;
                    operations.log("chapter_rename", key, "renamed from " + previousKey);
                }
            }

            if (state == null) {
                final UpsertOutcome outcome = builder.upsertChapter(bookId, chapter);
                if (outcome == UpsertOutcome.CREATED) {
                    counters.chapterCreated();
                } else {
                    counters.chapterUpdated();
                }
                operations.log("chapter_create", key, "page " + chapter.position());
            } else if (!hash.equals(knownHash)) {
                builder.upsertChapter(bookId, chapter);
                counters.chapterUpdated();
                operations.log("chapter_update", key, "page " + chapter.position());
            } else if (state.position() != chapter.position()) {
                builder.upsertChapter(bookId, chapter);
                counters.chapterReordered();
                operations.log("chapter_reorder", key, "page " + state.position() + " -> " + chapter.position());
            } else if (state.hidden()) {
                builder.upsertChapter(bookId, chapter);
                counters.chapterShown();
                operations.log("chapter_show", key, "page " + chapter.position());
            } else {
                counters.skipped();
                operations.log("chapter_skip", key, "unchanged");
            }
        }

        for (final ChapterState state : stored.values()) {
            if (!currentKeys.contains(state.importKey()) && !state.hidden()) {
                builder.hideChapter(bookId, state.importKey());
                counters.chapterHidden();
                operations.log("chapter_hide", state.importKey(), "hidden id=" + state.chapterId());
            }
        }

        for (final ChapterState state : builder.listChapters(bookId)) {
            if (currentKeys.contains(state.importKey())) {
                mappings.upsert(scopeId, state.importKey(),
                        new MappingUpdate(bookId, sectionId, hashes.get(state.importKey()), state.chapterId()));
            }
        }
        mappings.upsert(scopeId, book.path(), bookId, sectionId, null);
    }

    // ==================== Lessons ====================

    private void processLesson(final String sectionId, final int sectionPosition, final BookNode lesson)
            throws SyncException, IOException {
        touchedPaths.add(lesson.path());
        final ContainerMetadata metadata = containerMetadata(lesson);

        final List<LessonPageContent> pages = new ArrayList<>();
        final Map<String, String> hashes = new HashMap<>();
        final int count = lesson.chapters().size();
        int position = 0;
        for (final Map.Entry<String, String> file : lesson.chapters().entrySet()) {
            position++;
            final String path = file.getValue();
            touchedPaths.add(path);
            // Answers live in the front matter, so the hash covers the whole file
            final String text = rewrite(fetchText(path));
            final FrontMatter frontMatter = lessonParser.parse(text);
            pages.add(LessonPageContent.fromFrontMatter(path, ActivityNames.derive(file.getKey()), frontMatter,
                    position, position == count));
            hashes.put(path, ContentHasher.hash(text));
        }

        final Optional<String> lessonId = existingContainer(lesson);
        if (lessonId.isEmpty()) {
            createLesson(sectionId, sectionPosition, lesson, metadata, pages, hashes);
        } else {
            updateLesson(sectionId, lessonId.get(), lesson, metadata, pages, hashes);
        }
    }

    private void createLesson(final String sectionId, final int sectionPosition, final BookNode lesson,
                              final ContainerMetadata metadata, final List<LessonPageContent> pages,
                              final Map<String, String> hashes) throws IOException {
        final LessonCreation creation = builder.createLesson(scopeId, sectionPosition, metadata.title(lesson),
                pages, metadata.values());
        final String lessonId = creation.lessonId();
        touchedEntities.add(lessonId);

        for (final LessonPageContent page : pages) {
            mappings.upsert(scopeId, page.importKey(), new MappingUpdate(lessonId, sectionId,
                    hashes.get(page.importKey()), creation.pageIds().get(page.importKey())));
            counters.lessonPageCreated();
        }
        mappings.upsert(scopeId, lesson.path(), lessonId, sectionId, null);
        if (lesson.metadataPath() != null) {
            mappings.upsert(scopeId, lesson.metadataPath(), lessonId, sectionId, metadata.hash());
        }
        counters.activityCreated();
        operations.log("lesson_create", lesson.path(), "created id=" + lessonId + " with " + pages.size() + " pages");
    }

    private void updateLesson(final String sectionId, final String lessonId, final BookNode lesson,
                              final ContainerMetadata metadata, final List<LessonPageContent> pages,
                              final Map<String, String> hashes) throws IOException {
        touchedEntities.add(lessonId);
        showContainerIfHidden(lessonId, lesson.path());

        if (metadataChanged(lesson, metadata)) {
            builder.updateLessonMetadata(lessonId, metadata.values());
            mappings.upsert(scopeId, lesson.metadataPath(), lessonId, sectionId, metadata.hash());
            operations.log("lesson_update", lesson.metadataPath(), "metadata updated id=" + lessonId);
        }

        final Map<String, LessonPageState> stored = new LinkedHashMap<>();
        for (final LessonPageState state : builder.listLessonPages(lessonId)) {
            stored.put(state.importKey(), state);
        }

        boolean relink = false;
        final List<String> ordered = new ArrayList<>();
        for (final LessonPageContent page : pages) {
            final String key = page.importKey();
            final String hash = hashes.get(key);
            final LessonPageState state = stored.remove(key);
            final String knownHash = mappings.lookup(scopeId, key).map(MappingRecord::contentHash).orElse(null);

            final String pageId;
            if (state == null) {
                pageId = builder.upsertLessonPage(lessonId, null, page);
                counters.lessonPageCreated();
                operations.log("lesson_page_create", key, "page " + page.position());
                relink = true;
            } else {
                pageId = state.pageId();
                if (!hash.equals(knownHash)) {
                    builder.upsertLessonPage(lessonId, pageId, page);
                    counters.lessonPageUpdated();
                    operations.log("lesson_page_update", key, "page " + page.position());
                } else {
                    counters.skipped();
                    operations.log("lesson_page_skip", key, "unchanged");
                }
                if (state.position() != page.position()) {
                    relink = true;
                }
            }
            ordered.add(pageId);
            mappings.upsert(scopeId, key, new MappingUpdate(lessonId, sectionId, hash, pageId));
        }

        // Pages left over have no file anymore
        for (final LessonPageState removed : stored.values()) {
            builder.removeLessonPage(lessonId, removed.pageId());
            counters.lessonPageRemoved();
            operations.log("lesson_page_remove", removed.importKey(), "removed id=" + removed.pageId());
            relink = true;
        }

        if (relink) {
            builder.relinkLessonPages(lessonId, ordered);
            operations.log("lesson_relink", lesson.path(), ordered.size() + " pages");
        }
        mappings.upsert(scopeId, lesson.path(), lessonId, sectionId, null);
    }

    // ==================== Containers ====================

    private Optional<String> existingContainer(final BookNode container) throws IOException {
        final Optional<MappingRecord> mapping = mappings.lookup(scopeId, container.path())
                .filter(MappingRecord::hasEntity);
        if (mapping.isEmpty()) {
            return Optional.empty();
        }
        if (builder.entityState(mapping.get().entityId()) == EntityState.MISSING) {
            logger.warn("{} of {} no longer exists, creating it again", mapping.get().entityId(), container.path());
            operations.log("container_recreate", container.path(), "missing id=" + mapping.get().entityId());
            return Optional.empty();
        }
        return Optional.of(mapping.get().entityId());
    }

    private void showContainerIfHidden(final String entityId, final String path) throws IOException {
        if (builder.entityState(entityId) == EntityState.HIDDEN) {
            builder.setVisible(entityId, true);
            counters.activityShown();
            operations.log("page_show", path, "shown id=" + entityId);
        }
    }

    private ContainerMetadata containerMetadata(final BookNode container) throws SyncException {
        if (container.metadataPath() == null) {
            return new ContainerMetadata(Map.of(), null);
        }
        touchedPaths.add(container.metadataPath());
        final String text = fetchText(container.metadataPath());
        return new ContainerMetadata(parseMetadata(container.metadataPath(), text), ContentHasher.hash(text));
    }

    private boolean metadataChanged(final BookNode container, final ContainerMetadata metadata) throws IOException {
        if (container.metadataPath() == null) {
            return false;
        }
        final String knownHash = mappings.lookup(scopeId, container.metadataPath())
                .map(MappingRecord::contentHash).orElse(null);
        return !metadata.hash().equals(knownHash);
    }

    /**
     * Metadata of a book or lesson directory.
     *
     * @param hash digest of the raw metadata file, null without one
     */
    private record ContainerMetadata(Map<String, Object> values, @Nullable String hash) {

        String title(final BookNode container) {
            final Object title = values.get("title");
            return title != null && !title.toString().isBlank() ? title.toString() : ActivityNames.derive(container.name());
        }
    }

    // ==================== Removal sweep ====================

    private void sweep() throws IOException {
        for (final MappingRecord record : mappings.list(scopeId)) {
            final String path = record.repoPath();
            if (!record.hasEntity()
                    || touchedPaths.contains(path)
                    || layout.isAssetPath(path)
                    || record.itemId() != null
                    || touchedEntities.contains(record.entityId())) {
                continue;
            }

            try {
                final EntityState state = builder.entityState(record.entityId());
                if (state == EntityState.VISIBLE) {
                    builder.setVisible(record.entityId(), false);
                    if (isSectionPath(path)) {
                        counters.sectionHidden();
                    } else {
                        counters.activityHidden();
                    }
                    operations.log("page_hide", path, "hidden id=" + record.entityId());
                } else if (state == EntityState.MISSING) {
                    operations.log("page_hide_error", path, "entity " + record.entityId() + " no longer exists");
                }
            } catch (final IOException e) {
                logger.warn("Failed to hide {} of course {}", path, scopeId, e);
                operations.log("page_hide_error", path, e.getMessage() != null ? e.getMessage() : e.toString());
            }
        }
    }

    private void hideDisplacedSections() throws IOException {
        for (final String sectionId : displacedSections) {
            if (touchedEntities.contains(sectionId)) {
                continue;
            }
            if (builder.entityState(sectionId) == EntityState.VISIBLE) {
                builder.setVisible(sectionId, false);
                counters.sectionHidden();
                operations.log("section_hide", "", "hidden id=" + sectionId);
            }
        }
    }

    private boolean isSectionPath(final String path) {
        final String[] segments = path.split("/");
        if (!segments[0].equals(layout.sectionsDirectory())) {
            return false;
        }
        return segments.length == 2 || (segments.length == 3 && segments[2].equals(layout.sectionMetadataFile()));
    }

    // ==================== Helpers ====================

    private String fetchText(final String path) throws SyncException {
        return new String(repository.getFileContents(path), StandardCharsets.UTF_8);
    }

    private String rewrite(final String body) {
        return rewriteAssetUrls ? builder.rewriteAssetUrls(scopeId, body) : body;
    }

    private Map<String, Object> parseMetadata(final String path, final String text) {
        final MetadataParseResult result = metadataParser.parse(text);
        if (result.usedFallback()) {
            logger.warn("Metadata of {} in course {} parsed with the flat fallback: {}", path, scopeId,
                    result.fallbackWarning());
            operations.log("yaml_fallback", path, result.fallbackWarning());
        }
        return result.values();
    }
}
