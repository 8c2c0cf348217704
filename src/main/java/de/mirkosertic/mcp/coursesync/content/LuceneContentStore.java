package de.mirkosertic.mcp.coursesync.content;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import de.mirkosertic.mcp.coursesync.frontmatter.FrontMatter;
import de.mirkosertic.mcp.coursesync.index.CourseIndexService;
import de.mirkosertic.mcp.coursesync.mapping.MappingRecord;
import de.mirkosertic.mcp.coursesync.mapping.MappingStore;
import de.mirkosertic.mcp.coursesync.mapping.MappingUpdate;
import de.mirkosertic.mcp.coursesync.repository.TransportException;
import de.mirkosertic.mcp.coursesync.sync.ContentHasher;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.TermQuery;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * The content platform bundled with the server: course entities live as documents in the course index,
 * asset files below the configured storage directory.
 */
public class LuceneContentStore implements ContentBuilder {

    private static final Logger logger = LoggerFactory.getLogger(LuceneContentStore.class);

    static final String TYPE_COURSE = "course";
    static final String TYPE_SECTION = "section";
    static final String TYPE_ACTIVITY = "activity";
    static final String TYPE_BOOK = "book";
    static final String TYPE_CHAPTER = "chapter";
    static final String TYPE_LESSON = "lesson";
    static final String TYPE_LESSON_PAGE = "lesson_page";

    private static final Map<String, Integer> BOOK_NUMBERING = Map.of(
            "none", 0, "numbers", 1, "bullets", 2, "indented", 3);

    private static final List<String> COURSE_FIELDS = List.of("fullname", "shortname", "summary", "format");

    private static final TypeReference<List<LessonAnswer>> ANSWER_LIST = new TypeReference<>() {
    };

    private final CourseIndexService indexService;
    private final MappingStore mappingStore;
    private final AssetUrlRewriter urlRewriter;
    private final String assetsDirectory;
    private final Path assetStorageRoot;
    private final ObjectMapper objectMapper;

    public LuceneContentStore(final CourseIndexService indexService, final MappingStore mappingStore,
                              final AssetUrlRewriter urlRewriter, final String assetsDirectory,
                              final Path assetStorageRoot, final ObjectMapper objectMapper) {
        this.indexService = indexService;
        this.mappingStore = mappingStore;
        this.urlRewriter = urlRewriter;
        this.assetsDirectory = assetsDirectory;
        this.assetStorageRoot = assetStorageRoot;
        this.objectMapper = objectMapper;
    }

    // ---- course and sections ----

    @Override
    public void updateRootMetadata(final String scopeId, final Map<String, Object> metadata) throws IOException {
        final String courseId = TYPE_COURSE + ":" + scopeId;
        StoredEntity course = find(courseId).orElse(StoredEntity.create(TYPE_COURSE, courseId, scopeId, null));
        for (final String field : COURSE_FIELDS) {
            final Object value = metadata.get(field);
            if (value != null && !value.toString().isEmpty()) {
                course = course.withAttribute(field, value);
            }
        }
        final String fullName = course.attribute("fullname");
        if (fullName != null) {
            course = course.withName(fullName);
        }
        save(course);
        logger.debug("Updated course metadata of {}", scopeId);
    }

    @Override
    public String ensureSection(final String scopeId, final int position, final Map<String, Object> metadata)
            throws IOException {
        final Object title = metadata.get("title");
        final Object summary = metadata.get("summary");

        final Optional<StoredEntity> existing = findSection(scopeId, position);
        StoredEntity section = existing.orElseGet(() ->
                StoredEntity.create(TYPE_SECTION, UUID.randomUUID().toString(), scopeId, null)
                        .withAttribute(StoredEntity.ATTR_POSITION, position));
        section = section
                .withName(title != null ? title.toString() : "Section " + position)
                .withContent(summary != null ? summary.toString() : section.content())
                .withVisible(true);
        save(section);

        if (existing.isEmpty()) {
            logger.info("Created section {} of {}: {}", position, scopeId, section.name());
        }
        return section.entityId();
    }

    private Optional<StoredEntity> findSection(final String scopeId, final int position) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(typeQuery(TYPE_SECTION), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(CourseIndexService.FIELD_SCOPE_ID, scopeId)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(StoredEntity.ATTR_PREFIX + StoredEntity.ATTR_POSITION,
                        Integer.toString(position))), BooleanClause.Occur.FILTER)
                .build();
        return indexService.findOne(query).map(StoredEntity::fromDocument);
    }

    private String sectionId(final String scopeId, final int position) throws IOException {
        final Optional<StoredEntity> section = findSection(scopeId, position);
        if (section.isPresent()) {
            return section.get().entityId();
        }
        return ensureSection(scopeId, position, Map.of());
    }

    // ---- activities ----

    @Override
    public String createTypedActivity(final String scopeId, final int sectionPosition, final String name,
                                      final String body, final FrontMatter frontMatter)
            throws IOException, UnsupportedActivityException {
        final ActivityType type = ActivityType.fromName(frontMatter.getString("type"));
        final String activityName = frontMatter.getString("name", name);

        StoredEntity activity = StoredEntity.create(TYPE_ACTIVITY, UUID.randomUUID().toString(), scopeId,
                        sectionId(scopeId, sectionPosition))
                .withName(activityName)
                .withContent(body)
                .withVisible(frontMatter.getBoolean("visible", true))
                .withAttribute("activity_type", type.typeName())
                .withAttribute("section_position", sectionPosition);

        if (type == ActivityType.URL) {
            final String url = frontMatter.getString("url");
            if (url == null || url.isBlank()) {
                throw new UnsupportedActivityException(type.typeName(),
                        "URL activity '" + activityName + "' requires a 'url' front matter key");
            }
            activity = activity.withAttribute("url", url.trim());
        }

        save(activity);
        logger.info("Created {} activity '{}' in section {} of {}", type.typeName(), activityName,
                sectionPosition, scopeId);
        return activity.entityId();
    }

    @Override
    public void updateActivity(final String entityId, final String name, final String body) throws IOException {
        final StoredEntity activity = require(entityId);
        save(activity.withName(name).withContent(body));
    }

    @Override
    public void moveToSection(final String entityId, final String scopeId, final int sectionPosition)
            throws IOException {
        final StoredEntity entity = require(entityId);
        final String targetId = sectionId(scopeId, sectionPosition);
        if (!targetId.equals(entity.parentId())) {
            save(entity.withParentId(targetId).withAttribute("section_position", sectionPosition));
            logger.info("Moved {} '{}' to section {} of {}", entity.docType(), entity.name(), sectionPosition,
                    scopeId);
        }
    }

    @Override
    public void setVisible(final String entityId, final boolean visible) throws IOException {
        final StoredEntity entity = require(entityId);
        if (entity.visible() != visible) {
            save(entity.withVisible(visible));
        }
    }

    @Override
    public EntityState entityState(final String entityId) throws IOException {
        return find(entityId)
                .map(entity -> entity.visible() ? EntityState.VISIBLE : EntityState.HIDDEN)
                .orElse(EntityState.MISSING);
    }

    // ---- books ----

    @Override
    public BookCreation createBook(final String scopeId, final int sectionPosition, final String name,
                                   final List<ChapterContent> chapters, final Map<String, Object> bookMetadata)
            throws IOException {
        final StoredEntity book = applyBookMetadata(
                StoredEntity.create(TYPE_BOOK, UUID.randomUUID().toString(), scopeId, sectionId(scopeId, sectionPosition))
                        .withName(name)
                        .withAttribute("section_position", sectionPosition)
                        .withAttribute("numbering", 0),
                bookMetadata);
        save(book);

        final Map<String, String> chapterIds = new LinkedHashMap<>();
        for (final ChapterContent chapter : chapters) {
            final StoredEntity stored = chapterEntity(
                    StoredEntity.create(TYPE_CHAPTER, UUID.randomUUID().toString(), scopeId, book.entityId()), chapter);
            save(stored);
            chapterIds.put(chapter.importKey(), stored.entityId());
        }

        logger.info("Created book '{}' with {} chapters in section {} of {}", book.name(), chapters.size(),
                sectionPosition, scopeId);
        return new BookCreation(book.entityId(), chapterIds);
    }

    @Override
    public void updateBookMetadata(final String bookId, final Map<String, Object> metadata) throws IOException {
        save(applyBookMetadata(require(bookId), metadata));
    }

    private static StoredEntity applyBookMetadata(final StoredEntity book, final Map<String, Object> metadata) {
        StoredEntity result = book;
        final Object title = metadata.get("title");
        if (title != null && !title.toString().isEmpty()) {
            result = result.withName(title.toString());
        }
        final Object intro = metadata.get("intro");
        if (intro != null) {
            result = result.withContent(intro.toString());
        }
        final Object numbering = metadata.get("numbering");
        if (numbering != null && BOOK_NUMBERING.containsKey(numbering.toString())) {
            result = result.withAttribute("numbering", BOOK_NUMBERING.get(numbering.toString()));
        }
        return result;
    }

    @Override
    public UpsertOutcome upsertChapter(final String bookId, final ChapterContent chapter) throws IOException {
        final Optional<StoredEntity> existing = findChild(TYPE_CHAPTER, bookId, chapter.importKey());
        if (existing.isPresent()) {
            save(chapterEntity(existing.get(), chapter));
            return UpsertOutcome.UPDATED;
        }
        final StoredEntity book = require(bookId);
        save(chapterEntity(StoredEntity.create(TYPE_CHAPTER, UUID.randomUUID().toString(), book.scopeId(), bookId),
                chapter));
        return UpsertOutcome.CREATED;
    }

    private static StoredEntity chapterEntity(final StoredEntity base, final ChapterContent chapter) {
        // The first chapter of a book can never be a subchapter
        final boolean subchapter = chapter.position() > 1 && chapter.subchapter();
        return base.withName(chapter.title())
                .withContent(chapter.body())
                .withVisible(true)
                .withAttribute(StoredEntity.ATTR_IMPORT_KEY, chapter.importKey())
                .withAttribute(StoredEntity.ATTR_POSITION, chapter.position())
                .withAttribute("subchapter", subchapter);
    }

    @Override
    public void rekeyChapter(final String bookId, final String oldImportKey, final String newImportKey)
            throws IOException {
        final Optional<StoredEntity> chapter = findChild(TYPE_CHAPTER, bookId, oldImportKey);
        if (chapter.isPresent()) {
            save(chapter.get().withAttribute(StoredEntity.ATTR_IMPORT_KEY, newImportKey));
        }
    }

    @Override
    public void hideChapter(final String bookId, final String importKey) throws IOException {
        final Optional<StoredEntity> chapter = findChild(TYPE_CHAPTER, bookId, importKey);
        if (chapter.isPresent() && chapter.get().visible()) {
            save(chapter.get().withVisible(false));
        }
    }

    @Override
    public List<ChapterState> listChapters(final String bookId) throws IOException {
        final List<ChapterState> chapters = new ArrayList<>();
        for (final StoredEntity chapter : children(TYPE_CHAPTER, bookId)) {
            chapters.add(new ChapterState(chapter.attribute(StoredEntity.ATTR_IMPORT_KEY), chapter.entityId(),
                    chapter.intAttribute(StoredEntity.ATTR_POSITION, 0), !chapter.visible()));
        }
        chapters.sort(Comparator.comparingInt(ChapterState::position));
        return chapters;
    }

    // ---- lessons ----

    @Override
    public LessonCreation createLesson(final String scopeId, final int sectionPosition, final String name,
                                       final List<LessonPageContent> pages, final Map<String, Object> lessonMetadata)
            throws IOException {
        final StoredEntity lesson = applyLessonMetadata(
                StoredEntity.create(TYPE_LESSON, UUID.randomUUID().toString(), scopeId, sectionId(scopeId, sectionPosition))
                        .withName(name)
                        .withAttribute("section_position", sectionPosition)
                        .withAttribute("practice", 0)
                        .withAttribute("retake", 1)
                        .withAttribute("feedback", 1)
                        .withAttribute("review", 0)
                        .withAttribute("maxattempts", 1)
                        .withAttribute("progressbar", 1),
                lessonMetadata);
        save(lesson);

        final Map<String, String> pageIds = new LinkedHashMap<>();
        final List<String> ordered = new ArrayList<>();
        for (final LessonPageContent page : pages) {
            final String pageId = upsertLessonPage(lesson.entityId(), null, page);
            pageIds.put(page.importKey(), pageId);
            ordered.add(pageId);
        }
        relinkLessonPages(lesson.entityId(), ordered);

        logger.info("Created lesson '{}' with {} pages in section {} of {}", lesson.name(), pages.size(),
                sectionPosition, scopeId);
        return new LessonCreation(lesson.entityId(), pageIds);
    }

    @Override
    public void updateLessonMetadata(final String lessonId, final Map<String, Object> metadata) throws IOException {
        save(applyLessonMetadata(require(lessonId), metadata));
    }

    private static StoredEntity applyLessonMetadata(final StoredEntity lesson, final Map<String, Object> metadata) {
        StoredEntity result = lesson;
        final Object title = metadata.get("title");
        if (title != null && !title.toString().isEmpty()) {
            result = result.withName(title.toString());
        }
        final Object intro = metadata.get("intro");
        if (intro != null) {
            result = result.withContent(intro.toString());
        }
        for (final String flag : List.of("practice", "retake", "feedback", "review", "progressbar")) {
            if (metadata.containsKey(flag)) {
                result = result.withAttribute(flag, isTrue(metadata.get(flag)) ? 1 : 0);
            }
        }
        final Object maxAttempts = metadata.get("maxattempts");
        if (maxAttempts instanceof Number number) {
            result = result.withAttribute("maxattempts", number.intValue());
        }
        return result;
    }

    private static boolean isTrue(final @Nullable Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.intValue() != 0;
        }
        return value != null && ("true".equalsIgnoreCase(value.toString()) || "1".equals(value.toString()));
    }

    @Override
    public String upsertLessonPage(final String lessonId, final @Nullable String pageId,
                                   final LessonPageContent page) throws IOException {
        StoredEntity base = null;
        if (pageId != null) {
            base = find(pageId).orElse(null);
        }
        if (base == null) {
            final StoredEntity lesson = require(lessonId);
            base = StoredEntity.create(TYPE_LESSON_PAGE, UUID.randomUUID().toString(), lesson.scopeId(), lessonId);
        }

        final StoredEntity stored = base.withName(page.title())
                .withContent(page.body())
                .withAttribute(StoredEntity.ATTR_IMPORT_KEY, page.importKey())
                .withAttribute(StoredEntity.ATTR_POSITION, page.position())
                .withAttribute("page_type", page.type().typeName())
                .withAttribute("answers", objectMapper.writeValueAsString(page.answers()));
        save(stored);
        return stored.entityId();
    }

    @Override
    public void removeLessonPage(final String lessonId, final String pageId) throws IOException {
        final Optional<StoredEntity> page = find(pageId);
        if (page.isPresent() && lessonId.equals(page.get().parentId())) {
            indexService.deleteDocuments(new Term(StoredEntity.FIELD_ENTITY_ID, pageId));
            logger.debug("Removed lesson page {} of lesson {}", pageId, lessonId);
        }
    }

    @Override
    public List<LessonPageState> listLessonPages(final String lessonId) throws IOException {
        final List<LessonPageState> pages = new ArrayList<>();
        for (final StoredEntity page : children(TYPE_LESSON_PAGE, lessonId)) {
            pages.add(new LessonPageState(page.attribute(StoredEntity.ATTR_IMPORT_KEY), page.entityId(),
                    page.intAttribute(StoredEntity.ATTR_POSITION, 0)));
        }
        pages.sort(Comparator.comparingInt(LessonPageState::position));
        return pages;
    }

    @Override
    public void relinkLessonPages(final String lessonId, final List<String> orderedPageIds) throws IOException {
        final int count = orderedPageIds.size();
        for (int i = 0; i < count; i++) {
            StoredEntity page = require(orderedPageIds.get(i))
                    .withAttribute(StoredEntity.ATTR_POSITION, i + 1)
                    .withAttribute("prev_page_id", i > 0 ? orderedPageIds.get(i - 1) : null)
                    .withAttribute("next_page_id", i < count - 1 ? orderedPageIds.get(i + 1) : null);

            if (LessonPageType.CONTENT.typeName().equals(page.attribute("page_type"))) {
                page = withContinueJump(page, i == count - 1 ? LessonJump.END_OF_LESSON : LessonJump.NEXT_PAGE);
            }
            save(page);
        }
    }

    private StoredEntity withContinueJump(final StoredEntity page, final LessonJump jump) throws IOException {
        final List<LessonAnswer> answers = answersOf(page);
        if (answers.isEmpty() || answers.get(0).jump() == jump) {
            return page;
        }
        final List<LessonAnswer> updated = new ArrayList<>(answers);
        updated.set(0, answers.get(0).withJump(jump));
        return page.withAttribute("answers", objectMapper.writeValueAsString(updated));
    }

    /**
     * Answers of a stored lesson page, in display order.
     */
    public List<LessonAnswer> lessonAnswers(final String pageId) throws IOException {
        return answersOf(require(pageId));
    }

    private List<LessonAnswer> answersOf(final StoredEntity page) throws IOException {
        final String json = page.attribute("answers");
        if (json == null || json.isEmpty()) {
            return List.of();
        }
        return objectMapper.readValue(json, ANSWER_LIST);
    }

    // ---- assets ----

    @Override
    public AssetReport processAssets(final String scopeId, final List<String> assetPaths, final AssetFetcher fetcher)
            throws IOException, TransportException {
        final List<String> uploaded = new ArrayList<>();
        final List<String> skipped = new ArrayList<>();

        for (final String assetPath : assetPaths) {
            final byte[] data = fetcher.fetch(assetPath);
            final String hash = ContentHasher.hash(data);

            final Optional<MappingRecord> mapping = mappingStore.lookup(scopeId, assetPath);
            if (mapping.isPresent() && hash.equals(mapping.get().contentHash())) {
                skipped.add(assetPath);
                continue;
            }

            final Path target = resolveAssetFile(scopeId, assetPath);
            Files.createDirectories(target.getParent());
            Files.write(target, data);
            mappingStore.upsert(scopeId, assetPath, MappingUpdate.hashOnly(hash));
            uploaded.add(assetPath);
            logger.debug("Stored asset {} ({} bytes) of {}", assetPath, data.length, scopeId);
        }

        return new AssetReport(uploaded, skipped);
    }

    /**
     * Location of a stored asset file, guarded against paths leaving the course asset directory.
     */
    public Path resolveAssetFile(final String scopeId, final String assetPath) throws IOException {
        final String prefix = assetsDirectory + "/";
        final String relative = assetPath.startsWith(prefix) ? assetPath.substring(prefix.length()) : assetPath;
        final Path scopeDirectory = assetStorageRoot.resolve(URLEncoder.encode(scopeId, StandardCharsets.UTF_8))
                .toAbsolutePath().normalize();
        final Path target = scopeDirectory.resolve(relative).normalize();
        if (!target.startsWith(scopeDirectory) || target.equals(scopeDirectory)) {
            throw new IOException("Asset path outside of the asset directory: " + assetPath);
        }
        return target;
    }

    @Override
    public String rewriteAssetUrls(final String scopeId, final String body) {
        return urlRewriter.rewrite(scopeId, body);
    }

    // ---- lookups ----

    /**
     * Stored name of an entity, if it exists.
     */
    public Optional<String> entityName(final String entityId) throws IOException {
        return find(entityId).map(StoredEntity::name);
    }

    Optional<StoredEntity> find(final String entityId) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(new TermQuery(new Term(StoredEntity.FIELD_ENTITY_ID, entityId)), BooleanClause.Occur.FILTER)
                .build();
        return indexService.findOne(query).map(StoredEntity::fromDocument);
    }

    private StoredEntity require(final String entityId) throws IOException {
        return find(entityId).orElseThrow(() -> new EntityNotFoundException(entityId));
    }

    private Optional<StoredEntity> findChild(final String docType, final String parentId, final String importKey)
            throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(typeQuery(docType), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(StoredEntity.FIELD_PARENT_ID, parentId)), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(StoredEntity.ATTR_PREFIX + StoredEntity.ATTR_IMPORT_KEY, importKey)),
                        BooleanClause.Occur.FILTER)
                .build();
        return indexService.findOne(query).map(StoredEntity::fromDocument);
    }

    private List<StoredEntity> children(final String docType, final String parentId) throws IOException {
        final Query query = new BooleanQuery.Builder()
                .add(typeQuery(docType), BooleanClause.Occur.FILTER)
                .add(new TermQuery(new Term(StoredEntity.FIELD_PARENT_ID, parentId)), BooleanClause.Occur.FILTER)
                .build();
        final List<StoredEntity> result = new ArrayList<>();
        for (final Document document : indexService.findAll(query)) {
            result.add(StoredEntity.fromDocument(document));
        }
        return result;
    }

    private static Query typeQuery(final String docType) {
        return new TermQuery(new Term(CourseIndexService.FIELD_DOC_TYPE, docType));
    }

    private void save(final StoredEntity entity) throws IOException {
        indexService.upsertDocument(new Term(StoredEntity.FIELD_ENTITY_ID, entity.entityId()), entity.toDocument());
    }
}
