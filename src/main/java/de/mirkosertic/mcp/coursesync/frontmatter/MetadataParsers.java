package de.mirkosertic.mcp.coursesync.frontmatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses the metadata parser strategy based on what is available on the class path.
 */
public final class MetadataParsers {

    private static final Logger logger = LoggerFactory.getLogger(MetadataParsers.class);

    static final String SNAKEYAML_CLASS = "org.yaml.snakeyaml.Yaml";

    private MetadataParsers() {
    }

    public static MetadataParser select() {
        return select(MetadataParsers.class.getClassLoader());
    }

    static MetadataParser select(final ClassLoader classLoader) {
        final MetadataParser parser = isAvailable(SNAKEYAML_CLASS, classLoader)
                ? new SnakeYamlMetadataParser()
                : new FlatMetadataParser();
        logger.info("Using {} metadata parser", parser.name());
        return parser;
    }

    static boolean isAvailable(final String className, final ClassLoader classLoader) {
        try {
            Class.forName(className, false, classLoader);
            return true;
        } catch (final ClassNotFoundException e) {
            return false;
        }
    }
}
