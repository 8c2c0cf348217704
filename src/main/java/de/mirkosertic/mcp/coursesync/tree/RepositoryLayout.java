package de.mirkosertic.mcp.coursesync.tree;

/**
 * File and directory names that give a repository its course structure.
 */
public record RepositoryLayout(
        String rootMetadataFile,
        String sectionsDirectory,
        String assetsDirectory,
        String sectionMetadataFile,
        String bookMetadataFile,
        String lessonMetadataFile
) {

    public static final String DEFAULT_ROOT_METADATA_FILE = "course.yaml";
    public static final String DEFAULT_SECTIONS_DIRECTORY = "sections";
    public static final String DEFAULT_ASSETS_DIRECTORY = "assets";
    public static final String DEFAULT_SECTION_METADATA_FILE = "section.yaml";
    public static final String DEFAULT_BOOK_METADATA_FILE = "book.yaml";
    public static final String DEFAULT_LESSON_METADATA_FILE = "lesson.yaml";

    public static RepositoryLayout defaults() {
        return new RepositoryLayout(DEFAULT_ROOT_METADATA_FILE, DEFAULT_SECTIONS_DIRECTORY,
                DEFAULT_ASSETS_DIRECTORY, DEFAULT_SECTION_METADATA_FILE, DEFAULT_BOOK_METADATA_FILE,
                DEFAULT_LESSON_METADATA_FILE);
    }

    public String sectionPath(final String sectionDir) {
        return sectionsDirectory + "/" + sectionDir;
    }

    public String bookPath(final String sectionDir, final String bookDir) {
        return sectionPath(sectionDir) + "/" + bookDir;
    }

    public boolean isAssetPath(final String path) {
        return path.startsWith(assetsDirectory + "/") && path.length() > assetsDirectory.length() + 1;
    }
}
