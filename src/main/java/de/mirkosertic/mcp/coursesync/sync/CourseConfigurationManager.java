package de.mirkosertic.mcp.coursesync.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Manages persistent storage of course registrations in {@code courses.yaml} and of the
 * per-course snapshot markers in {@code sync-state.yaml}, both below the configuration directory.
 * <p>
 * Access tokens are never written; a registration only names the environment variable holding one.
 */
public class CourseConfigurationManager implements SnapshotMarkerStore {

    private static final Logger logger = LoggerFactory.getLogger(CourseConfigurationManager.class);
    private static final String COURSES_FILE = "courses.yaml";
    private static final String SYNC_STATE_FILE = "sync-state.yaml";

    private final Path configDirectory;
    private final Yaml yaml;

    public CourseConfigurationManager(final Path configDirectory) {
        this.configDirectory = configDirectory;
        final DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setPrettyFlow(true);
        this.yaml = new Yaml(options);
    }

    /**
     * Initialize the configuration manager. Ensures the course file exists.
     */
    public void init() {
        final Path coursesPath = getCoursesPath();
        if (!Files.exists(coursesPath)) {
            try {
                saveCourses(new ArrayList<>());
                logger.info("Created course registration file: {}", coursesPath);
            } catch (final IOException e) {
                logger.warn("Failed to create course registration file: {}", coursesPath, e);
            }
        }
    }

    /**
     * Load all course registrations.
     *
     * @return registrations in file order, never null
     */
    @SuppressWarnings("unchecked")
    public synchronized List<CourseRegistration> loadCourses() {
        final Path coursesPath = getCoursesPath();
        if (!Files.exists(coursesPath)) {
            logger.debug("Course registration file does not exist: {}", coursesPath);
            return new ArrayList<>();
        }

        try (final Reader reader = Files.newBufferedReader(coursesPath)) {
            final Map<String, Object> config = yaml.load(reader);
            if (config == null) {
                return new ArrayList<>();
            }
            final Map<String, Object> root = (Map<String, Object>) config.get("coursesync");
            if (root == null || !(root.get("courses") instanceof List)) {
                return new ArrayList<>();
            }

            final List<CourseRegistration> courses = new ArrayList<>();
            for (final Object item : (List<Object>) root.get("courses")) {
                if (item instanceof Map) {
                    toRegistration((Map<String, Object>) item).ifPresent(courses::add);
                }
            }
            logger.debug("Loaded {} course registrations from {}", courses.size(), coursesPath);
            return courses;
        } catch (final IOException e) {
            logger.error("Failed to load course registration file: {}", coursesPath, e);
            return new ArrayList<>();
        } catch (final ClassCastException e) {
            logger.error("Invalid course registration structure in: {}", coursesPath, e);
            return new ArrayList<>();
        }
    }

    private Optional<CourseRegistration> toRegistration(final Map<String, Object> item) {
        try {
            final Object autoSync = item.get("auto-sync");
            return Optional.of(new CourseRegistration(
                    stringOrNull(item.get("id")),
                    stringOrNull(item.get("repo-url")),
                    stringOrNull(item.get("branch")),
                    stringOrNull(item.get("token-env")),
                    autoSync instanceof Boolean b && b));
        } catch (final IllegalArgumentException e) {
            logger.warn("Skipping invalid course registration {}: {}", item, e.getMessage());
            return Optional.empty();
        }
    }

    private static String stringOrNull(final Object value) {
        return value != null ? value.toString() : null;
    }

    public synchronized Optional<CourseRegistration> findCourse(final String courseId) {
        return loadCourses().stream().filter(course -> course.courseId().equals(courseId)).findFirst();
    }

    /**
     * Save all course registrations, replacing the file content.
     */
    public synchronized void saveCourses(final List<CourseRegistration> courses) throws IOException {
        ensureConfigDirectoryExists();

        final List<Map<String, Object>> items = new ArrayList<>();
        for (final CourseRegistration course : courses) {
            final Map<String, Object> item = new LinkedHashMap<>();
            item.put("id", course.courseId());
            item.put("repo-url", course.repoUrl());
            if (course.branch() != null) {
                item.put("branch", course.branch());
            }
            if (course.tokenEnv() != null) {
                item.put("token-env", course.tokenEnv());
            }
            item.put("auto-sync", course.autoSync());
            items.add(item);
        }
        final Map<String, Object> root = new LinkedHashMap<>();
        root.put("courses", items);
        final Map<String, Object> config = new LinkedHashMap<>();
        config.put("coursesync", root);

        try (final Writer writer = Files.newBufferedWriter(getCoursesPath(),
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(config, writer);
            logger.info("Saved {} course registrations to {}", courses.size(), getCoursesPath());
        }
    }

    /**
     * Add a course, or replace the registration with the same id.
     *
     * @return true if the course was not registered before
     */
    public synchronized boolean addCourse(final CourseRegistration registration) throws IOException {
        final List<CourseRegistration> courses = loadCourses();
        final boolean existed = courses.removeIf(course -> course.courseId().equals(registration.courseId()));
        courses.add(registration);
        saveCourses(courses);
        logger.info("{} course {} -> {}", existed ? "Updated" : "Added", registration.courseId(), registration.repoUrl());
        return !existed;
    }

    /**
     * Remove a course and its snapshot marker. Mappings and synced content are kept.
     *
     * @return true if the course was registered
     */
    public synchronized boolean removeCourse(final String courseId) throws IOException {
        final List<CourseRegistration> courses = loadCourses();
        if (!courses.removeIf(course -> course.courseId().equals(courseId))) {
            logger.debug("Course not found in config: {}", courseId);
            return false;
        }
        saveCourses(courses);

        final Map<String, Object> states = loadStateMap();
        if (states.remove(courseId) != null) {
            writeStateMap(states);
        }
        logger.info("Removed course from config: {}", courseId);
        return true;
    }

    // ==================== Sync State Persistence ====================

    @Override
    @SuppressWarnings("unchecked")
    public synchronized SyncState loadSyncState(final String courseId) {
        final Object entry = loadStateMap().get(courseId);
        if (!(entry instanceof Map)) {
            return SyncState.initial();
        }
        try {
            final Map<String, Object> state = (Map<String, Object>) entry;
            final Object status = state.get("lastStatus");
            return new SyncState(
                    stringOrNull(state.get("lastSnapshotIdentity")),
                    ((Number) state.getOrDefault("lastSyncTimeMs", 0L)).longValue(),
                    status != null ? SyncStatus.fromCode(status.toString()) : null);
        } catch (final ClassCastException | IllegalArgumentException e) {
            logger.error("Invalid sync state for course {} in {}", courseId, getSyncStatePath(), e);
            return SyncState.initial();
        }
    }

    @Override
    public synchronized void saveSyncState(final String courseId, final SyncState state) throws IOException {
        final Map<String, Object> states = loadStateMap();
        final Map<String, Object> entry = new LinkedHashMap<>();
        if (state.lastSnapshotIdentity() != null) {
            entry.put("lastSnapshotIdentity", state.lastSnapshotIdentity());
        }
        entry.put("lastSyncTimeMs", state.lastSyncTimeMs());
        if (state.lastStatus() != null) {
            entry.put("lastStatus", state.lastStatus().code());
        }
        states.put(courseId, entry);
        writeStateMap(states);
        logger.debug("Saved sync state of {}: {}", courseId, state);
    }

    private Map<String, Object> loadStateMap() {
        final Path statePath = getSyncStatePath();
        if (!Files.exists(statePath)) {
            return new LinkedHashMap<>();
        }
        try (final Reader reader = Files.newBufferedReader(statePath)) {
            final Map<String, Object> states = yaml.load(reader);
            return states != null ? new LinkedHashMap<>(states) : new LinkedHashMap<>();
        } catch (final IOException e) {
            logger.error("Failed to load sync state file: {}", statePath, e);
            return new LinkedHashMap<>();
        } catch (final ClassCastException e) {
            logger.error("Invalid sync state structure in: {}", statePath, e);
            return new LinkedHashMap<>();
        }
    }

    private void writeStateMap(final Map<String, Object> states) throws IOException {
        ensureConfigDirectoryExists();
        try (final Writer writer = Files.newBufferedWriter(getSyncStatePath(),
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING)) {
            yaml.dump(states, writer);
        }
    }

    public Path getCoursesPath() {
        return configDirectory.resolve(COURSES_FILE);
    }

    public Path getSyncStatePath() {
        return configDirectory.resolve(SYNC_STATE_FILE);
    }

    private void ensureConfigDirectoryExists() throws IOException {
        if (!Files.exists(configDirectory)) {
            Files.createDirectories(configDirectory);
            logger.debug("Created config directory: {}", configDirectory);
        }
    }
}
