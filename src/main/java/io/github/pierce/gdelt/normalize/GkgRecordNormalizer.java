package io.github.pierce.gdelt.normalize;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import io.github.pierce.gdelt.theme.RecordKey;
import io.github.pierce.gdelt.theme.ThemeCellParser;
import io.github.pierce.gdelt.theme.ThemeDiff;
import io.github.pierce.gdelt.theme.ThemeSetComparator;
import io.github.pierce.gdelt.theme.ThemeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Normalizes a raw GKG table before it is joined.
 *
 * <ol>
 *   <li>extracts {@code ACTUAL_TONE} from the composite {@code V1.5TONE} column,</li>
 *   <li>parses both theme columns and attaches their labels, magnitudes and per-record
 *       comparison as {@code ", "}-joined string columns,</li>
 *   <li>drops the configured columns (absent ones are logged and skipped),</li>
 *   <li>prefixes every column with {@value #SOURCE_PREFIX}.</li>
 * </ol>
 */
public class GkgRecordNormalizer {

    public static final String SOURCE_PREFIX = "gkg_";
    public static final String TONE_COLUMN = "V1.5TONE";
    public static final String ACTUAL_TONE_COLUMN = "ACTUAL_TONE";
    public static final String V1_THEMES_COLUMN = "V1THEMES";
    public static final String V2_THEMES_COLUMN = "V2ENHANCEDTHEMES";

    public static final String V1_THEMES_LIST = "V1THEMES_list_str";
    public static final String V1_NUMBERS_LIST = "V1NUMBERS_list_str";
    public static final String V2_THEMES_LIST = "V2ENHANCEDTHEMES_list_str";
    public static final String V2_NUMBERS_LIST = "V2NUMBERS_list_str";
    public static final String THEMES_COMMON = "Theme_row_common_str";
    public static final String THEMES_ONLY_V1 = "Theme_row_only_in_V1_str";
    public static final String THEMES_ONLY_V2 = "Theme_row_only_in_V2_str";

    static final String LIST_SEPARATOR = ", ";

    private final List<String> columnsToDrop;
    private final Logger log;

    public GkgRecordNormalizer(Collection<String> columnsToDrop) {
        this(columnsToDrop, LoggerFactory.getLogger(GkgRecordNormalizer.class));
    }

    public GkgRecordNormalizer(Collection<String> columnsToDrop, Logger log) {
        this.columnsToDrop = columnsToDrop != null ? List.copyOf(columnsToDrop) : List.of();
        this.log = log;
    }

    public Table process(Table gkg) {
        List<String> missing = gkg.missingColumns(List.of(
                TONE_COLUMN, V1_THEMES_COLUMN, V2_THEMES_COLUMN,
                ThemeSetComparator.RECORD_ID_COLUMN, ThemeSetComparator.DOCUMENT_ID_COLUMN));
        if (!missing.isEmpty()) {
            throw new SchemaException("gkg", missing);
        }

        Table table = extractActualTone(gkg);
        table = processThemes(table);
        table = dropColumns(table);
        table = table.renameColumns(column -> SOURCE_PREFIX + column);

        log.info("Processed GKG data: {} rows, {} columns", table.rowCount(), table.columnCount());
        return table;
    }

    private Table extractActualTone(Table table) {
        int toneIdx = table.indexOf(TONE_COLUMN);
        List<Object> tones = new ArrayList<>(table.rowCount());
        for (int r = 0; r < table.rowCount(); r++) {
            Object tone = table.get(r, toneIdx);
            if (Values.isMissing(tone)) {
                tones.add(null);
            } else {
                tones.add(String.valueOf(tone).split(",", -1)[0].strip());
            }
        }
        return table.withColumn(ACTUAL_TONE_COLUMN, tones);
    }

    private Table processThemes(Table table) {
        Map<RecordKey, List<ThemeToken>> v1 = ThemeSetComparator.buildKeyedTokens(table, V1_THEMES_COLUMN);
        Map<RecordKey, List<ThemeToken>> v2 = ThemeSetComparator.buildKeyedTokens(table, V2_THEMES_COLUMN);
        Map<RecordKey, ThemeDiff> comparison = ThemeSetComparator.diff(v1, v2);

        int recordIdx = table.indexOf(ThemeSetComparator.RECORD_ID_COLUMN);
        int documentIdx = table.indexOf(ThemeSetComparator.DOCUMENT_ID_COLUMN);
        int v1Idx = table.indexOf(V1_THEMES_COLUMN);
        int v2Idx = table.indexOf(V2_THEMES_COLUMN);

        int rows = table.rowCount();
        List<String> v1Themes = new ArrayList<>(rows);
        List<String> v1Numbers = new ArrayList<>(rows);
        List<String> v2Themes = new ArrayList<>(rows);
        List<String> v2Numbers = new ArrayList<>(rows);
        List<String> common = new ArrayList<>(rows);
        List<String> onlyV1 = new ArrayList<>(rows);
        List<String> onlyV2 = new ArrayList<>(rows);

        for (int r = 0; r < rows; r++) {
            List<ThemeToken> v1Tokens = ThemeCellParser.parse(table.get(r, v1Idx));
            List<ThemeToken> v2Tokens = ThemeCellParser.parse(table.get(r, v2Idx));
            v1Themes.add(join(ThemeCellParser.labels(v1Tokens)));
            v1Numbers.add(join(ThemeCellParser.magnitudes(v1Tokens)));
            v2Themes.add(join(ThemeCellParser.labels(v2Tokens)));
            v2Numbers.add(join(ThemeCellParser.magnitudes(v2Tokens)));

            // duplicate keys resolve to the last row's tokens, so the diff may not match this row's own cells
            RecordKey key = new RecordKey(table.get(r, recordIdx), table.get(r, documentIdx));
            ThemeDiff diff = comparison.getOrDefault(key, ThemeDiff.empty());
            common.add(join(diff.common()));
            onlyV1.add(join(diff.onlyInA()));
            onlyV2.add(join(diff.onlyInB()));
        }

        return table
                .withColumn(V1_THEMES_LIST, v1Themes)
                .withColumn(V1_NUMBERS_LIST, v1Numbers)
                .withColumn(V2_THEMES_LIST, v2Themes)
                .withColumn(V2_NUMBERS_LIST, v2Numbers)
                .withColumn(THEMES_COMMON, common)
                .withColumn(THEMES_ONLY_V1, onlyV1)
                .withColumn(THEMES_ONLY_V2, onlyV2);
    }

    private Table dropColumns(Table table) {
        List<String> missing = table.missingColumns(columnsToDrop);
        if (!missing.isEmpty()) {
            log.warn("Columns not found (skipped): {}", missing);
        }
        return table.dropColumns(columnsToDrop);
    }

    static String join(Collection<?> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(LIST_SEPARATOR));
    }
}
