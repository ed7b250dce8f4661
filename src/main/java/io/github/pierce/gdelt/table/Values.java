package io.github.pierce.gdelt.table;

/**
 * Null and blank semantics shared by every table transform.
 *
 * <p>A cell is <em>missing</em> when it is {@code null} or a {@code NaN} double, and
 * <em>blank</em> when it is missing or its text is empty after stripping.</p>
 */
public final class Values {

    private Values() {
    }

    public static boolean isMissing(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof Double d) {
            return d.isNaN();
        }
        if (value instanceof Float f) {
            return f.isNaN();
        }
        return false;
    }

    public static boolean isBlank(Object value) {
        return isMissing(value) || String.valueOf(value).strip().isEmpty();
    }

    /**
     * Text cast used by join predicates: missing values stay null, everything else is
     * rendered with leading and trailing spaces removed. Only {@code ' '} is removed, as SQL
     * {@code TRIM} does; tabs and line breaks are kept.
     */
    public static String trimmedText(Object value) {
        if (isMissing(value)) {
            return null;
        }
        String text = String.valueOf(value);
        int start = 0;
        int end = text.length();
        while (start < end && text.charAt(start) == ' ') {
            start++;
        }
        while (end > start && text.charAt(end - 1) == ' ') {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Text form used for uniqueness and grouping; missing values map to null.
     */
    public static String text(Object value) {
        if (isMissing(value)) {
            return null;
        }
        return String.valueOf(value);
    }
}
