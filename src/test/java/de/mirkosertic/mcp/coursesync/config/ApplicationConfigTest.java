package de.mirkosertic.mcp.coursesync.config;

import de.mirkosertic.mcp.coursesync.tree.RepositoryLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ApplicationConfig Tests")
class ApplicationConfigTest {

    @AfterEach
    void clearProperties() {
        System.clearProperty("coursesync.index.path");
        System.clearProperty("coursesync.profile");
    }

    @Test
    @DisplayName("Should load the bundled defaults")
    void shouldLoadDefaults() {
        // When
        final ApplicationConfig config = ApplicationConfig.load();

        // Then
        assertThat(config.getRepositoryLayout()).isEqualTo(RepositoryLayout.defaults());
        assertThat(config.getDefaultTokenEnv()).isNotBlank();
        assertThat(config.getThreadPoolSize()).isPositive();
        assertThat(config.getIndexPath()).doesNotContain("${");
        assertThat(config.getAssetStoragePath()).doesNotContain("${");
        assertThat(config.isDeployedMode()).isFalse();
    }

    @Test
    @DisplayName("Should let the system property override the index path")
    void shouldOverrideIndexPath() {
        System.setProperty("coursesync.index.path", "/tmp/coursesync-test-index");

        assertThat(ApplicationConfig.load().getIndexPath()).isEqualTo("/tmp/coursesync-test-index");
    }

    @Test
    @DisplayName("Should detect the deployed profile")
    void shouldDetectDeployedProfile() {
        assertThat(ApplicationConfig.isDeployedProfileActive()).isFalse();

        System.setProperty("coursesync.profile", "deployed");

        assertThat(ApplicationConfig.isDeployedProfileActive()).isTrue();
        assertThat(ApplicationConfig.load().isDeployedMode()).isTrue();
    }

    @Test
    @DisplayName("Should keep the configuration below the user home")
    void shouldResolveConfigDirectory() {
        assertThat(ApplicationConfig.getConfigDirectory())
                .isEqualTo(Path.of(System.getProperty("user.home"), ".mcpcoursesync"));
        assertThat(ApplicationConfig.getUserConfigPath().getFileName().toString()).isEqualTo("config.yaml");
    }
}
