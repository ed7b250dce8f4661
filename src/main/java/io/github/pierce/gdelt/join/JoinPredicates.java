package io.github.pierce.gdelt.join;

import io.github.pierce.gdelt.table.Values;

/**
 * The three fixed join conditions, one per join path.
 *
 * <p>All compare the trimmed text of both sides. A missing value on either side never
 * matches, including against another missing value.</p>
 */
public final class JoinPredicates {

    private JoinPredicates() {
    }

    /**
     * {@code gkg_V2DOCUMENTIDENTIFIER = MentionIdentifier}.
     */
    public static boolean documentMatchesMention(Object primaryDocument, Object mentionIdentifier) {
        return textEquals(primaryDocument, mentionIdentifier);
    }

    /**
     * {@code mentions.GlobalEventID = export.GlobalEventID}.
     */
    public static boolean mentionMatchesEvent(Object mentionEventId, Object exportEventId) {
        return textEquals(mentionEventId, exportEventId);
    }

    /**
     * {@code gkg_V2DOCUMENTIDENTIFIER = export.SOURCEURL}, used when mentions are absent.
     */
    public static boolean documentMatchesEventSource(Object primaryDocument, Object sourceUrl) {
        return textEquals(primaryDocument, sourceUrl);
    }

    /**
     * Hash key for the equality used by every predicate; null when the value can never match.
     */
    public static String matchKey(Object value) {
        return Values.trimmedText(value);
    }

    private static boolean textEquals(Object left, Object right) {
        String a = matchKey(left);
        String b = matchKey(right);
        return a != null && a.equals(b);
    }
}
