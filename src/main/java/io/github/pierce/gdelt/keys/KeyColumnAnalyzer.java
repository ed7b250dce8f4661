package io.github.pierce.gdelt.keys;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.source.SourceTables;
import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cardinality and one-to-many checks on the key columns named by a {@link KeyColumnSpec}.
 *
 * <p>The primary table is expected in its normalized (prefixed) form, so its key is
 * usually {@code gkg_GKGRECORDID} or {@code gkg_V2DOCUMENTIDENTIFIER}.</p>
 */
public class KeyColumnAnalyzer {

    public static final String GKG_VS_MENTIONS = "gkg_vs_mentions";
    public static final String GKG_VS_EXPORT = "gkg_vs_export";
    public static final String MENTIONS_VS_EXPORT = "mentions_vs_exports";

    public static final String MAPPED_MENTIONS_COLUMN = "mapped mentions values";
    public static final String MAPPED_EXPORT_COLUMN = "mapped export values";
    public static final String MAPPED_COUNT_COLUMN = "mapped count";

    private final KeyColumnSpec spec;
    private final Logger log;

    public KeyColumnAnalyzer(KeyColumnSpec spec) {
        this(spec, LoggerFactory.getLogger(KeyColumnAnalyzer.class));
    }

    public KeyColumnAnalyzer(KeyColumnSpec spec, Logger log) {
        this.spec = spec;
        this.log = log;
    }

    /**
     * Row, unique and duplicate counts for every configured key column of every table that is
     * present. All missing key columns are reported together.
     *
     * @throws io.github.pierce.gdelt.SchemaException if any configured key column is absent
     */
    public Map<SourceRole, List<MappingStat>> checkKeyColumns(SourceTables tables) {
        Map<SourceRole, List<MappingStat>> results = new EnumMap<>(SourceRole.class);
        if (spec.isEmpty()) {
            log.info("No key columns configured, skipping key column check");
            return results;
        }

        MissingColumnCollector missing = new MissingColumnCollector();
        for (Map.Entry<SourceRole, KeyColumn> entry : spec.asMap().entrySet()) {
            SourceRole role = entry.getKey();
            if (!tables.has(role)) {
                log.info("No {} table for this instant, skipping its key columns", role.fileKey());
                continue;
            }
            missing.require(role.fileKey(), tables.get(role), entry.getValue().columns());
        }
        missing.throwIfMissing();

        for (Map.Entry<SourceRole, KeyColumn> entry : spec.asMap().entrySet()) {
            SourceRole role = entry.getKey();
            if (!tables.has(role)) {
                continue;
            }
            Table table = tables.get(role);
            KeyColumn key = entry.getValue();
            List<MappingStat> stats = new ArrayList<>();
            if (key instanceof KeyColumn.PairedKey) {
                List<String> columns = key.columns();
                for (int i = 0; i < columns.size(); i++) {
                    stats.add(stat(role, i + 1, table, columns.get(i)));
                }
            } else {
                stats.add(stat(role, 0, table, key.towardsPrimary()));
            }
            stats.forEach(s -> log.info("{} key column {}: {} rows, {} unique, {} duplicates",
                    role.fileKey(), s.column(), s.rowCount(), s.uniqueCount(), s.duplicateCount()));
            results.put(role, List.copyOf(stats));
        }
        return results;
    }

    private static MappingStat stat(SourceRole role, int position, Table table, String column) {
        int idx = table.indexOf(column);
        Set<String> uniques = new HashSet<>();
        for (int r = 0; r < table.rowCount(); r++) {
            Object value = table.get(r, idx);
            if (!Values.isMissing(value)) {
                uniques.add(String.valueOf(value));
            }
        }
        return new MappingStat(role, position, column, table.rowCount(), uniques.size());
    }

    /**
     * One-to-many tables for each adjacent pair of present, configured tables. Each table has
     * one row per left-table row: the left key, the list of matched right key values and its size.
     *
     * <p>A paired mentions key joins towards GKG on its first column and towards Export on its
     * second. A single mentions key is used for both legs.</p>
     */
    public Map<String, Table> mappingCheckup(SourceTables tables) {
        Map<String, Table> result = new LinkedHashMap<>();
        if (spec.isEmpty()) {
            log.info("No key columns configured, skipping mapping checkup");
            return result;
        }

        if (pairPresent(tables, SourceRole.PRIMARY, SourceRole.SECONDARY)) {
            String left = spec.get(SourceRole.PRIMARY).orElseThrow().towardsPrimary();
            String right = spec.get(SourceRole.SECONDARY).orElseThrow().towardsPrimary();
            result.put(GKG_VS_MENTIONS, toTable(left, MAPPED_MENTIONS_COLUMN,
                    countMappings(tables.primary(), left, tables.secondary(), right)));
        }
        if (pairPresent(tables, SourceRole.PRIMARY, SourceRole.TERTIARY)) {
            String left = spec.get(SourceRole.PRIMARY).orElseThrow().towardsPrimary();
            String right = spec.get(SourceRole.TERTIARY).orElseThrow().towardsPrimary();
            result.put(GKG_VS_EXPORT, toTable(left, MAPPED_EXPORT_COLUMN,
                    countMappings(tables.primary(), left, tables.tertiary(), right)));
        }
        if (pairPresent(tables, SourceRole.SECONDARY, SourceRole.TERTIARY)) {
            String left = spec.get(SourceRole.SECONDARY).orElseThrow().towardsTertiary();
            String right = spec.get(SourceRole.TERTIARY).orElseThrow().towardsPrimary();
            result.put(MENTIONS_VS_EXPORT, toTable(left, MAPPED_EXPORT_COLUMN,
                    countMappings(tables.secondary(), left, tables.tertiary(), right)));
        }
        log.info("Mapping checkup produced {} table(s): {}", result.size(), result.keySet());
        return result;
    }

    private boolean pairPresent(SourceTables tables, SourceRole left, SourceRole right) {
        return tables.has(left) && tables.has(right) && spec.has(left) && spec.has(right);
    }

    /**
     * Groups {@code right} by {@code rightColumn} (null and blank keys excluded, duplicates kept)
     * and looks up every row of {@code left}.
     */
    public static List<MappingCountRow> countMappings(Table left, String leftColumn, Table right, String rightColumn) {
        MissingColumnCollector missing = new MissingColumnCollector();
        missing.require("left", left, List.of(leftColumn));
        missing.require("right", right, List.of(rightColumn));
        missing.throwIfMissing();

        int rightIdx = right.indexOf(rightColumn);
        ListMultimap<String, Object> grouped = ArrayListMultimap.create();
        for (int r = 0; r < right.rowCount(); r++) {
            Object value = right.get(r, rightIdx);
            if (!Values.isBlank(value)) {
                grouped.put(String.valueOf(value), value);
            }
        }

        int leftIdx = left.indexOf(leftColumn);
        List<MappingCountRow> rows = new ArrayList<>(left.rowCount());
        for (int r = 0; r < left.rowCount(); r++) {
            Object key = left.get(r, leftIdx);
            List<Object> matched = Values.isMissing(key) ? List.of() : grouped.get(String.valueOf(key));
            rows.add(new MappingCountRow(key, matched));
        }
        return rows;
    }

    public static Table toTable(String leftColumn, String mappedColumn, List<MappingCountRow> rows) {
        Table.Builder builder = Table.builder(leftColumn, mappedColumn, MAPPED_COUNT_COLUMN);
        for (MappingCountRow row : rows) {
            builder.addRow(row.keyValue(), row.matchedValues(), row.matchedCount());
        }
        return builder.build();
    }
}
