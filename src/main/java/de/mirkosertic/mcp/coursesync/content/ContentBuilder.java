package de.mirkosertic.mcp.coursesync.content;

import de.mirkosertic.mcp.coursesync.frontmatter.FrontMatter;
import de.mirkosertic.mcp.coursesync.repository.TransportException;
import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Write side of the content platform a course is synchronized into.
 * <p>
 * Every call is locally atomic and yields the same state when repeated with the same arguments.
 * Entity ids are opaque strings chosen by the implementation.
 */
public interface ContentBuilder {

    /**
     * Applies course level metadata such as {@code fullname}, {@code shortname} or {@code summary}.
     */
    void updateRootMetadata(String scopeId, Map<String, Object> metadata) throws IOException;

    /**
     * Creates the section at {@code position} if absent, otherwise updates its title and summary.
     * The section is visible afterwards.
     *
     * @return the section id
     */
    String ensureSection(String scopeId, int position, Map<String, Object> metadata) throws IOException;

    /**
     * Creates an activity in the section at {@code sectionPosition}, typed by the front matter {@code type}.
     *
     * @throws UnsupportedActivityException for an unknown type or a missing required field
     */
    String createTypedActivity(String scopeId, int sectionPosition, String name, String body,
                               FrontMatter frontMatter) throws IOException, UnsupportedActivityException;

    void updateActivity(String entityId, String name, String body) throws IOException;

    /**
     * Creates a book with all of its chapters in one call. Chapters are given in position order.
     */
    BookCreation createBook(String scopeId, int sectionPosition, String name, List<ChapterContent> chapters,
                            Map<String, Object> bookMetadata) throws IOException;

    void updateBookMetadata(String bookId, Map<String, Object> metadata) throws IOException;

    /**
     * Updates the chapter with the same import key, or appends a new one. Either way the chapter is visible.
     */
    UpsertOutcome upsertChapter(String bookId, ChapterContent chapter) throws IOException;

    /**
     * Moves a chapter to another import key, used when its file was renamed without content change.
     */
    void rekeyChapter(String bookId, String oldImportKey, String newImportKey) throws IOException;

    void hideChapter(String bookId, String importKey) throws IOException;

    List<ChapterState> listChapters(String bookId) throws IOException;

    /**
     * Moves an activity, book or lesson into the section at {@code sectionPosition}.
     */
    void moveToSection(String entityId, String scopeId, int sectionPosition) throws IOException;

    void setVisible(String entityId, boolean visible) throws IOException;

    EntityState entityState(String entityId) throws IOException;

    /**
     * Stores changed assets. Unchanged assets, detected by content hash, are skipped.
     */
    AssetReport processAssets(String scopeId, List<String> assetPaths, AssetFetcher fetcher)
            throws IOException, TransportException;

    /**
     * Points relative asset references of a body at the stored assets of the course.
     */
    String rewriteAssetUrls(String scopeId, String body);

    LessonCreation createLesson(String scopeId, int sectionPosition, String name, List<LessonPageContent> pages,
                                Map<String, Object> lessonMetadata) throws IOException;

    void updateLessonMetadata(String lessonId, Map<String, Object> metadata) throws IOException;

    /**
     * Replaces the page with id {@code pageId}, or creates a new page when it is null.
     *
     * @return the page id
     */
    String upsertLessonPage(String lessonId, @Nullable String pageId, LessonPageContent page) throws IOException;

    void removeLessonPage(String lessonId, String pageId) throws IOException;

    List<LessonPageState> listLessonPages(String lessonId) throws IOException;

    /**
     * Renumbers the pages and rebuilds their previous/next links in the given order. The "Continue"
     * answer of a content page leads to the end of the lesson on the last page, to the next page otherwise.
     */
    void relinkLessonPages(String lessonId, List<String> orderedPageIds) throws IOException;
}
