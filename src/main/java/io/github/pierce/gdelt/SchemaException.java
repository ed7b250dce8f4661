package io.github.pierce.gdelt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when columns required by a processing step are absent from one or more tables.
 * All missing columns are reported at once.
 */
public class SchemaException extends GdeltProcessingException {

    private final Map<String, List<String>> missingByTable;

    public SchemaException(String tableName, List<String> missingColumns) {
        this(Map.of(tableName, missingColumns));
    }

    public SchemaException(Map<String, List<String>> missingByTable) {
        super(formatMessage(missingByTable));
        Map<String, List<String>> copy = new LinkedHashMap<>();
        missingByTable.forEach((table, columns) -> copy.put(table, List.copyOf(columns)));
        this.missingByTable = copy;
    }

    private static String formatMessage(Map<String, List<String>> missingByTable) {
        return "Missing required columns: " + missingByTable.entrySet().stream()
                .map(e -> e.getKey() + " " + e.getValue())
                .collect(Collectors.joining("; "));
    }

    /**
     * Returns the missing columns grouped by the logical name of the table they were looked up in.
     */
    public Map<String, List<String>> getMissingByTable() {
        return missingByTable;
    }

    /**
     * Returns every missing column, in lookup order.
     */
    public List<String> getMissingColumns() {
        List<String> all = new ArrayList<>();
        missingByTable.values().forEach(all::addAll);
        return all;
    }
}
