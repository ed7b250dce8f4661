package io.github.pierce.gdelt.keys;

import io.github.pierce.gdelt.source.SourceRole;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cardinality of one key column.
 *
 * @param role        table the column belongs to
 * @param position    0 for a single key, 1 or 2 for the elements of a paired key
 * @param column      column name
 * @param rowCount    number of rows, nulls included
 * @param uniqueCount number of distinct non-null values, compared as text
 */
public record MappingStat(SourceRole role, int position, String column, long rowCount, long uniqueCount) {

    public long duplicateCount() {
        return rowCount - uniqueCount;
    }

    /**
     * The flat metric names used by the statistics reports, for example
     * {@code key_column_GKGRECORDID_length} or {@code key_column_2_GlobalEventID_uniquevalues_length}.
     */
    public Map<String, Long> toMetrics() {
        String prefix = position == 0
                ? "key_column_" + column
                : "key_column_" + position + "_" + column;
        Map<String, Long> metrics = new LinkedHashMap<>();
        metrics.put(prefix + "_length", rowCount);
        metrics.put(prefix + "_uniquevalues_length", uniqueCount);
        metrics.put(prefix + "_length_difference", duplicateCount());
        return metrics;
    }
}
