package de.mirkosertic.mcp.coursesync.frontmatter;

/**
 * Scalar conversion shared by the front-matter and flat metadata parsers.
 */
final class ScalarValues {

    private ScalarValues() {
    }

    /**
     * Converts a raw scalar. Matching surrounding quotes are stripped. With {@code parseIntegers}
     * set (nested front matter and metadata files) a quoted value is a literal string and all-digit
     * values become integers. Without it (flat front matter) the unquoted text is typed as well, so
     * {@code "true"} is a boolean. {@code true}/{@code false} become booleans, everything else stays a string.
     */
    static Object parse(final String raw, final boolean parseIntegers) {
        String value = raw.trim();
        if (isQuoted(value)) {
            value = value.substring(1, value.length() - 1);
            if (parseIntegers) {
                return value;
            }
        }
        if ("true".equals(value)) {
            return Boolean.TRUE;
        }
        if ("false".equals(value)) {
            return Boolean.FALSE;
        }
        if (parseIntegers && isAllDigits(value)) {
            try {
                return Integer.parseInt(value);
            } catch (final NumberFormatException e) {
                // Too large for an int, keep the literal
                return value;
            }
        }
        return value;
    }

    private static boolean isQuoted(final String value) {
        if (value.length() < 2) {
            return false;
        }
        final char first = value.charAt(0);
        final char last = value.charAt(value.length() - 1);
        return (first == '"' && last == '"') || (first == '\'' && last == '\'');
    }

    private static boolean isAllDigits(final String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
