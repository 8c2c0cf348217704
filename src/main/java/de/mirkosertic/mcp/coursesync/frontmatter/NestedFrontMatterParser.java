package de.mirkosertic.mcp.coursesync.frontmatter;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Front-matter parser that additionally understands one level of lists, as used by
 * question pages:
 * <pre>
 * pagetype: multichoice
 * answers:
 *   - text: "A"
 *     correct: true
 *   - text: "B"
 *     correct: false
 * </pre>
 * A top-level key with an empty value opens a list. A {@code - key: value} line starts a
 * map item, further indented {@code key: value} lines extend it, and {@code - scalar} is a
 * plain list item. Anything outside this subset is kept as a string or ignored.
 */
public class NestedFrontMatterParser implements FrontMatterParser {

    private static final Pattern LIST_ITEM = Pattern.compile("^\\s+-\\s+(.+)$");
    private static final Pattern MAP_CONTINUATION = Pattern.compile("^\\s{4,}([a-zA-Z_]+)\\s*:\\s*(.*)$");

    private enum State {
        TOP,
        LIST
    }

    @Override
    public FrontMatter parse(final String text) {
        final FrontMatterBlock block = FrontMatterBlock.find(text);
        if (block == null) {
            return FrontMatter.empty(text);
        }

        final Map<String, Object> metadata = new LinkedHashMap<>();
        State state = State.TOP;
        List<Object> currentList = null;
        Object pendingItem = null;

        for (final String line : block.lines()) {
            final String trimmed = line.trim();
            if (FrontMatterBlock.isSkippable(trimmed)) {
                continue;
            }

            final Matcher listItem = LIST_ITEM.matcher(line);
            if (listItem.matches()) {
                if (state == State.LIST) {
                    flush(currentList, pendingItem);
                    pendingItem = parseItem(listItem.group(1).trim());
                }
                continue;
            }

            final Matcher continuation = MAP_CONTINUATION.matcher(line);
            if (state == State.LIST && continuation.matches()) {
                if (pendingItem instanceof Map<?, ?>) {
                    @SuppressWarnings("unchecked")
                    final Map<String, Object> item = (Map<String, Object>) pendingItem;
                    item.put(continuation.group(1), ScalarValues.parse(continuation.group(2), true));
                }
                continue;
            }

            final Matcher keyValue = FrontMatterBlock.KEY_VALUE.matcher(trimmed);
            if (keyValue.matches()) {
                if (state == State.LIST) {
                    flush(currentList, pendingItem);
                    pendingItem = null;
                }

                final String key = keyValue.group(1);
                final String value = keyValue.group(2).trim();
                if (value.isEmpty()) {
                    state = State.LIST;
                    currentList = new ArrayList<>();
                    metadata.put(key, currentList);
                } else {
                    state = State.TOP;
                    currentList = null;
                    metadata.put(key, ScalarValues.parse(value, true));
                }
            }
        }

        if (state == State.LIST) {
            flush(currentList, pendingItem);
        }

        return new FrontMatter(metadata, block.body());
    }

    private static Object parseItem(final String itemText) {
        final Matcher keyValue = FrontMatterBlock.KEY_VALUE.matcher(itemText);
        if (keyValue.matches()) {
            final Map<String, Object> item = new LinkedHashMap<>();
            item.put(keyValue.group(1), ScalarValues.parse(keyValue.group(2), true));
            return item;
        }
        return ScalarValues.parse(itemText, true);
    }

    private static void flush(final @Nullable List<Object> list, final @Nullable Object item) {
        if (list != null && item != null) {
            list.add(item);
        }
    }
}
