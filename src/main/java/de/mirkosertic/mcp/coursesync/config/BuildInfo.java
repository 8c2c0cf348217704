package de.mirkosertic.mcp.coursesync.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Version and build time of the running server, taken from the Maven-filtered build-info.properties.
 * Outside a Maven build (IDE runs) the values are "dev" and "unknown".
 */
public final class BuildInfo {

    private static final Logger logger = LoggerFactory.getLogger(BuildInfo.class);

    private static final String RESOURCE = "build-info.properties";
    private static final String DEFAULT_VERSION = "dev";
    private static final String DEFAULT_TIMESTAMP = "unknown";

    private static final Properties properties = load();

    private BuildInfo() {
    }

    private static Properties load() {
        final Properties loaded = new Properties();
        try (final InputStream input = BuildInfo.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (input == null) {
                logger.debug("{} not on the class path, running with development build info", RESOURCE);
                return loaded;
            }
            loaded.load(input);
        } catch (final IOException e) {
            logger.warn("Could not read {}, running with development build info", RESOURCE, e);
        }
        return loaded;
    }

    // ${...} survives when the resource was copied without filtering
    private static String property(final String key, final String fallback) {
        final String value = properties.getProperty(key);
        if (value == null || value.isBlank() || value.contains("${")) {
            return fallback;
        }
        return value;
    }

    public static String getVersion() {
        return property("build.version", DEFAULT_VERSION);
    }

    public static String getBuildTimestamp() {
        return property("build.timestamp", DEFAULT_TIMESTAMP);
    }

    /**
     * User agent sent to the GitHub API.
     */
    public static String getUserAgent() {
        return "MCPCourseSync/" + getVersion();
    }
}
