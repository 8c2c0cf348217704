package de.mirkosertic.mcp.coursesync.frontmatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full YAML parsing through SnakeYAML. Documents SnakeYAML rejects, or whose root is not
 * a mapping, are re-read with {@link FlatMetadataParser} and flagged with a fallback warning
 * so a sync never fails on metadata alone.
 */
public class SnakeYamlMetadataParser implements MetadataParser {

    private static final Logger logger = LoggerFactory.getLogger(SnakeYamlMetadataParser.class);

    private final FlatMetadataParser fallback = new FlatMetadataParser();

    @Override
    public MetadataParseResult parse(final String content) {
        final Object loaded;
        try {
            // Yaml instances are not thread-safe
            final Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            loaded = yaml.load(content);
        } catch (final YAMLException e) {
            logger.debug("YAML parse failed, using flat parser", e);
            return MetadataParseResult.fallback(fallback.parseValues(content),
                    "Structured metadata parse failed, used flat key/value parse instead: " + firstLine(e.getMessage()));
        }

        if (loaded == null) {
            return MetadataParseResult.of(Map.of());
        }
        if (!(loaded instanceof Map<?, ?> map)) {
            return MetadataParseResult.fallback(fallback.parseValues(content),
                    "Metadata document is not a mapping (" + loaded.getClass().getSimpleName()
                            + "), used flat key/value parse instead");
        }

        final Map<String, Object> values = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            if (entry.getKey() != null && entry.getValue() != null) {
                values.put(entry.getKey().toString(), entry.getValue());
            }
        }
        return MetadataParseResult.of(values);
    }

    private static String firstLine(final String message) {
        if (message == null) {
            return "unknown error";
        }
        final int newline = message.indexOf('\n');
        return newline >= 0 ? message.substring(0, newline) : message;
    }

    @Override
    public String name() {
        return "snakeyaml";
    }
}
