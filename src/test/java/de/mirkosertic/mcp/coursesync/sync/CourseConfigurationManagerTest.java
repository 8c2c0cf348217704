package de.mirkosertic.mcp.coursesync.sync;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CourseConfigurationManager Tests")
class CourseConfigurationManagerTest {

    @TempDir
    Path tempDir;

    private Path configDir;
    private CourseConfigurationManager manager;

    @BeforeEach
    void setUp() {
        configDir = tempDir.resolve(".mcpcoursesync");
        manager = new CourseConfigurationManager(configDir);
    }

    @Nested
    @DisplayName("Course registrations")
    class RegistrationTests {

        @Test
        @DisplayName("Should create an empty course file on init")
        void shouldCreateCourseFileOnInit() {
            // When
            manager.init();

            // Then
            assertThat(manager.getCoursesPath()).exists();
            assertThat(manager.loadCourses()).isEmpty();
        }

        @Test
        @DisplayName("Should return no courses when the file does not exist")
        void shouldHandleMissingFile() {
            assertThat(manager.loadCourses()).isEmpty();
        }

        @Test
        @DisplayName("Should add, replace and remove courses")
        void shouldAddReplaceAndRemove() throws IOException {
            // Given
            final CourseRegistration java = new CourseRegistration("java-101", "https://github.com/acme/java",
                    null, "JAVA_TOKEN", true);

            // When
            final boolean added = manager.addCourse(java);
            final boolean addedAgain = manager.addCourse(new CourseRegistration("java-101",
                    "https://github.com/acme/java2", "main", null, false));

            // Then
            assertThat(added).isTrue();
            assertThat(addedAgain).isFalse();
            assertThat(manager.loadCourses()).singleElement().satisfies(course -> {
                assertThat(course.repoUrl()).isEqualTo("https://github.com/acme/java2");
                assertThat(course.branch()).isEqualTo("main");
                assertThat(course.tokenEnv()).isNull();
                assertThat(course.autoSync()).isFalse();
            });

            assertThat(manager.removeCourse("java-101")).isTrue();
            assertThat(manager.removeCourse("java-101")).isFalse();
            assertThat(manager.loadCourses()).isEmpty();
        }

        @Test
        @DisplayName("Should keep the file order and round-trip all fields")
        void shouldRoundTripFields() throws IOException {
            manager.saveCourses(List.of(
                    new CourseRegistration("b", "https://github.com/acme/b", "dev", "B_TOKEN", true),
                    new CourseRegistration("a", "https://github.com/acme/a", null, null, false)));

            final List<CourseRegistration> loaded = new CourseConfigurationManager(configDir).loadCourses();

            assertThat(loaded).extracting(CourseRegistration::courseId).containsExactly("b", "a");
            assertThat(loaded.get(0)).isEqualTo(
                    new CourseRegistration("b", "https://github.com/acme/b", "dev", "B_TOKEN", true));
        }

        @Test
        @DisplayName("Should never write a token value")
        void shouldOnlyStoreTokenVariableName() throws IOException {
            manager.addCourse(new CourseRegistration("c", "https://github.com/acme/c", null, "C_TOKEN", false));

            assertThat(Files.readString(manager.getCoursesPath()))
                    .contains("token-env: C_TOKEN")
                    .doesNotContain("token:");
        }

        @Test
        @DisplayName("Should skip invalid registrations")
        void shouldSkipInvalidEntries() throws IOException {
            // Given
            Files.createDirectories(configDir);
            Files.writeString(manager.getCoursesPath(), """
                    coursesync:
                      courses:
                        - id: "bad id"
                          repo-url: https://github.com/acme/x
                        - id: good
                          repo-url: https://github.com/acme/good
                          auto-sync: true
                        - id: no-url
                    """);

            // When
            final List<CourseRegistration> courses = manager.loadCourses();

            // Then
            assertThat(courses).extracting(CourseRegistration::courseId).containsExactly("good");
            assertThat(manager.findCourse("good")).get().extracting(CourseRegistration::autoSync).isEqualTo(true);
        }

        @Test
        @DisplayName("Should return no courses for malformed structure")
        void shouldHandleMalformedStructure() throws IOException {
            Files.createDirectories(configDir);
            Files.writeString(manager.getCoursesPath(), "coursesync: just a string\n");

            assertThat(manager.loadCourses()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Snapshot markers")
    class SyncStateTests {

        @Test
        @DisplayName("Should return the initial state for unknown courses")
        void shouldReturnInitialState() {
            assertThat(manager.loadSyncState("unknown")).isEqualTo(SyncState.initial());
        }

        @Test
        @DisplayName("Should persist the snapshot marker per course")
        void shouldPersistState() throws IOException {
            // Given
            manager.saveSyncState("a", new SyncState("abc123", 1700000000000L, SyncStatus.SUCCESS));
            manager.saveSyncState("b", new SyncState(null, 0L, SyncStatus.FAILED));

            // When
            final CourseConfigurationManager reloaded = new CourseConfigurationManager(configDir);

            // Then
            assertThat(reloaded.loadSyncState("a"))
                    .isEqualTo(new SyncState("abc123", 1700000000000L, SyncStatus.SUCCESS));
            assertThat(reloaded.loadSyncState("b").lastSnapshotIdentity()).isNull();
            assertThat(reloaded.loadSyncState("b").lastStatus()).isEqualTo(SyncStatus.FAILED);
        }

        @Test
        @DisplayName("Should drop the snapshot marker when a course is removed")
        void shouldRemoveStateWithCourse() throws IOException {
            manager.addCourse(new CourseRegistration("a", "https://github.com/acme/a", null, null, false));
            manager.saveSyncState("a", new SyncState("abc123", 1L, SyncStatus.SUCCESS));

            manager.removeCourse("a");

            assertThat(manager.loadSyncState("a")).isEqualTo(SyncState.initial());
        }
    }
}
