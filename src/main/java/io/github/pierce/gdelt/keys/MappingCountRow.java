package io.github.pierce.gdelt.keys;

import java.util.List;

/**
 * One left-table row of a mapping checkup: its key and every right-table key value it matched.
 */
public record MappingCountRow(Object keyValue, List<Object> matchedValues) {

    public MappingCountRow {
        matchedValues = List.copyOf(matchedValues);
    }

    public int matchedCount() {
        return matchedValues.size();
    }
}
