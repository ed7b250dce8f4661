package io.github.pierce.gdelt.theme;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Label-level comparison of two theme token lists for one record.
 */
public record ThemeDiff(SortedSet<String> common, SortedSet<String> onlyInA, SortedSet<String> onlyInB) {

    private static final ThemeDiff EMPTY = new ThemeDiff(new TreeSet<>(), new TreeSet<>(), new TreeSet<>());

    public ThemeDiff {
        common = Collections.unmodifiableSortedSet(new TreeSet<>(common));
        onlyInA = Collections.unmodifiableSortedSet(new TreeSet<>(onlyInA));
        onlyInB = Collections.unmodifiableSortedSet(new TreeSet<>(onlyInB));
    }

    public static ThemeDiff empty() {
        return EMPTY;
    }
}
