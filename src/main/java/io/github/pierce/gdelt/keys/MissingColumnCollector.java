package io.github.pierce.gdelt.keys;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.table.Table;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects missing columns across several tables so they can be reported together
 * instead of failing on the first one.
 */
class MissingColumnCollector {

    private final Map<String, List<String>> missing = new LinkedHashMap<>();

    void require(String tableName, Table table, Collection<String> columns) {
        List<String> absent = table.missingColumns(columns);
        if (!absent.isEmpty()) {
            missing.computeIfAbsent(tableName, k -> new ArrayList<>()).addAll(absent);
        }
    }

    boolean hasMissing() {
        return !missing.isEmpty();
    }

    Map<String, List<String>> getMissing() {
        return missing;
    }

    void throwIfMissing() {
        if (hasMissing()) {
            throw new SchemaException(missing);
        }
    }
}
