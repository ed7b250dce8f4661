package io.github.pierce.gdelt.theme;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.table.Table;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds per-record theme token maps and compares them label by label.
 */
public final class ThemeSetComparator {

    public static final String RECORD_ID_COLUMN = "GKGRECORDID";
    public static final String DOCUMENT_ID_COLUMN = "V2DOCUMENTIDENTIFIER";

    private ThemeSetComparator() {
    }

    public static Map<RecordKey, List<ThemeToken>> buildKeyedTokens(Table table, String themeColumn) {
        return buildKeyedTokens(table, RECORD_ID_COLUMN, DOCUMENT_ID_COLUMN, themeColumn);
    }

    /**
     * Parses {@code themeColumn} for every row, keyed by (record id, document identifier).
     * A key seen twice keeps the tokens of its last row.
     *
     * @throws SchemaException listing every required column the table lacks
     */
    public static Map<RecordKey, List<ThemeToken>> buildKeyedTokens(Table table, String recordIdColumn,
                                                                    String documentIdColumn, String themeColumn) {
        List<String> missing = table.missingColumns(List.of(recordIdColumn, documentIdColumn, themeColumn));
        if (!missing.isEmpty()) {
            throw new SchemaException("gkg", missing);
        }

        int recordIdx = table.indexOf(recordIdColumn);
        int documentIdx = table.indexOf(documentIdColumn);
        int themeIdx = table.indexOf(themeColumn);

        Map<RecordKey, List<ThemeToken>> result = new LinkedHashMap<>();
        for (int r = 0; r < table.rowCount(); r++) {
            RecordKey key = new RecordKey(table.get(r, recordIdx), table.get(r, documentIdx));
            result.put(key, ThemeCellParser.parse(table.get(r, themeIdx)));
        }
        return result;
    }

    /**
     * Compares two keyed token maps over the union of their keys. Magnitudes are ignored;
     * a key absent from one side compares against an empty label set.
     */
    public static Map<RecordKey, ThemeDiff> diff(Map<RecordKey, List<ThemeToken>> a,
                                                 Map<RecordKey, List<ThemeToken>> b) {
        Set<RecordKey> keys = new LinkedHashSet<>(a.keySet());
        keys.addAll(b.keySet());

        Map<RecordKey, ThemeDiff> out = new LinkedHashMap<>();
        for (RecordKey key : keys) {
            Set<String> labelsA = new TreeSet<>(ThemeCellParser.labels(a.getOrDefault(key, List.of())));
            Set<String> labelsB = new TreeSet<>(ThemeCellParser.labels(b.getOrDefault(key, List.of())));

            TreeSet<String> common = new TreeSet<>(labelsA);
            common.retainAll(labelsB);
            TreeSet<String> onlyInA = new TreeSet<>(labelsA);
            onlyInA.removeAll(labelsB);
            TreeSet<String> onlyInB = new TreeSet<>(labelsB);
            onlyInB.removeAll(labelsA);

            out.put(key, new ThemeDiff(common, onlyInA, onlyInB));
        }
        return out;
    }
}
