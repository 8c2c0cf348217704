package de.mirkosertic.mcp.coursesync.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should load version and timestamp")
    void shouldLoadVersionAndTimestamp() {
        // When
        final String version = BuildInfo.getVersion();
        final String timestamp = BuildInfo.getBuildTimestamp();

        // Then: filtered values, or the IDE fallbacks
        assertThat(version)
                .isNotEmpty()
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(timestamp)
                .isNotEmpty()
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }

    @Test
    @DisplayName("Should derive the user agent from the version")
    void shouldBuildUserAgent() {
        assertThat(BuildInfo.getUserAgent()).isEqualTo("MCPCourseSync/" + BuildInfo.getVersion());
    }
}
