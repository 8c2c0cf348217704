package de.mirkosertic.mcp.coursesync.tree;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Groups a flat repository listing into root metadata, sections, pages, books, chapters and assets.
 * <p>
 * Rules, first match wins:
 * <ol>
 *   <li>the root metadata file (blob)</li>
 *   <li>blobs below the assets directory</li>
 *   <li>{@code sections/A/B/C} blobs whose directory {@code sections/A/B} is listed as a tree:
 *       chapter {@code C} of book {@code B}, or the book/lesson metadata file</li>
 *   <li>{@code sections/A/B} blobs: page {@code B}, or the section metadata file</li>
 *   <li>{@code sections/A} and {@code sections/A/B} trees: empty containers</li>
 * </ol>
 * Unmatched paths and hidden files (leading dot) are ignored. Every map is ordered by ordinal
 * name comparison, so numeric prefixes such as {@code 01-intro} define positions.
 */
public class TreeClassifier {

    private static final Logger logger = LoggerFactory.getLogger(TreeClassifier.class);

    private final RepositoryLayout layout;

    public TreeClassifier(final RepositoryLayout layout) {
        this.layout = layout;
    }

    public StructuredTree classify(final Collection<TreeEntry> entries) {
        final Set<String> treePaths = new HashSet<>();
        for (final TreeEntry entry : entries) {
            if (entry.isTree()) {
                treePaths.add(entry.path());
            }
        }

        String rootMetadataPath = null;
        final List<String> assets = new ArrayList<>();
        final SortedMap<String, SectionBuilder> sections = new TreeMap<>();
        int ignored = 0;

        for (final TreeEntry entry : entries) {
            final String path = entry.path();

            if (entry.isBlob() && path.equals(layout.rootMetadataFile())) {
                rootMetadataPath = path;
                continue;
            }
            if (entry.isBlob() && layout.isAssetPath(path)) {
                assets.add(path);
                continue;
            }

            final String[] segments = path.split("/");
            if (segments.length < 2 || !segments[0].equals(layout.sectionsDirectory())) {
                ignored++;
                continue;
            }

            if (entry.isBlob() && segments.length == 4 && treePaths.contains(layout.bookPath(segments[1], segments[2]))) {
                classifyBookFile(sections, segments[1], segments[2], segments[3], path);
            } else if (entry.isBlob() && segments.length == 3) {
                classifySectionFile(sections, segments[1], segments[2], path);
            } else if (entry.isTree() && segments.length == 2) {
                section(sections, segments[1]);
            } else if (entry.isTree() && segments.length == 3) {
                section(sections, segments[1]).book(segments[2]);
            } else {
                ignored++;
            }
        }

        Collections.sort(assets);
        final SortedMap<String, SectionNode> frozen = new TreeMap<>();
        for (final SectionBuilder builder : sections.values()) {
            frozen.put(builder.name, builder.build());
        }

        logger.debug("Classified {} entries: {} sections, {} assets, {} ignored",
                entries.size(), frozen.size(), assets.size(), ignored);

        return new StructuredTree(rootMetadataPath, Collections.unmodifiableSortedMap(frozen),
                Collections.unmodifiableList(assets));
    }

    private void classifyBookFile(final SortedMap<String, SectionBuilder> sections, final String sectionDir,
                                  final String bookDir, final String fileName, final String path) {
        final BookBuilder book = section(sections, sectionDir).book(bookDir);
        if (fileName.equals(layout.lessonMetadataFile())) {
            book.lessonMetadataPath = path;
        } else if (fileName.equals(layout.bookMetadataFile())) {
            book.bookMetadataPath = path;
        } else if (!isHidden(fileName)) {
            book.chapters.put(fileName, path);
        }
    }

    private void classifySectionFile(final SortedMap<String, SectionBuilder> sections, final String sectionDir,
                                     final String fileName, final String path) {
        final SectionBuilder section = section(sections, sectionDir);
        if (fileName.equals(layout.sectionMetadataFile())) {
            section.metadataPath = path;
        } else if (!isHidden(fileName)) {
            section.pages.put(fileName, path);
        }
    }

    private SectionBuilder section(final SortedMap<String, SectionBuilder> sections, final String sectionDir) {
        return sections.computeIfAbsent(sectionDir, name -> new SectionBuilder(name, layout.sectionPath(name)));
    }

    private static boolean isHidden(final String fileName) {
        return fileName.startsWith(".");
    }

    private final class SectionBuilder {
        private final String name;
        private final String path;
        private @Nullable String metadataPath;
        private final SortedMap<String, String> pages = new TreeMap<>();
        private final SortedMap<String, BookBuilder> books = new TreeMap<>();

        private SectionBuilder(final String name, final String path) {
            this.name = name;
            this.path = path;
        }

        private BookBuilder book(final String bookDir) {
            return books.computeIfAbsent(bookDir, dir -> new BookBuilder(dir, layout.bookPath(name, dir)));
        }

        private SectionNode build() {
            final SortedMap<String, BookNode> builtBooks = new TreeMap<>();
            for (final BookBuilder book : books.values()) {
                builtBooks.put(book.name, book.build());
            }
            return new SectionNode(name, path, metadataPath,
                    Collections.unmodifiableSortedMap(new TreeMap<>(pages)),
                    Collections.unmodifiableSortedMap(builtBooks));
        }
    }

    private static final class BookBuilder {
        private final String name;
        private final String path;
        private @Nullable String bookMetadataPath;
        private @Nullable String lessonMetadataPath;
        private final SortedMap<String, String> chapters = new TreeMap<>();

        private BookBuilder(final String name, final String path) {
            this.name = name;
            this.path = path;
        }

        private BookNode build() {
            // A lesson metadata file turns the whole directory into a lesson
            final BookKind kind = lessonMetadataPath != null ? BookKind.LESSON : BookKind.BOOK;
            final String metadataPath = kind == BookKind.LESSON ? lessonMetadataPath : bookMetadataPath;
            return new BookNode(name, path, metadataPath, kind,
                    Collections.unmodifiableSortedMap(new TreeMap<>(chapters)));
        }
    }
}
