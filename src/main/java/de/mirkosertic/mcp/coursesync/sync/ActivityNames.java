package de.mirkosertic.mcp.coursesync.sync;

import java.util.regex.Pattern;

/**
 * Derives display names from repository file and directory names,
 * e.g. {@code 02-getting_started.html} becomes {@code Getting Started}.
 */
public final class ActivityNames {

    private static final Pattern NUMERIC_PREFIX = Pattern.compile("^\\d+-");

    private ActivityNames() {
    }

    public static String derive(final String fileName) {
        String name = fileName;
        final int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        name = NUMERIC_PREFIX.matcher(name).replaceFirst("");
        name = name.replace('-', ' ').replace('_', ' ');
        return titleCase(name).trim();
    }

    private static String titleCase(final String text) {
        final StringBuilder result = new StringBuilder(text.length());
        boolean startOfWord = true;
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                startOfWord = true;
                result.append(c);
            } else if (startOfWord) {
                result.append(Character.toUpperCase(c));
                startOfWord = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
