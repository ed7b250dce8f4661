package io.github.pierce.gdelt.join;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.table.Table;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Key columns of the three join paths and the optional-table columns pulled into the result.
 *
 * @param secondaryColumns mentions columns added to the joined table as {@code Mentions_<col>}
 * @param tertiaryColumns  export columns added to the joined table as {@code Export_<col>}
 */
public record JoinColumns(List<String> secondaryColumns, List<String> tertiaryColumns) {

    public static final String PRIMARY_DOCUMENT_KEY = "gkg_V2DOCUMENTIDENTIFIER";
    public static final String SECONDARY_DOCUMENT_KEY = "MentionIdentifier";
    public static final String EVENT_KEY = "GlobalEventID";
    public static final String TERTIARY_URL_KEY = "SOURCEURL";

    public static final String SECONDARY_PREFIX = "Mentions_";
    public static final String TERTIARY_PREFIX = "Export_";
    public static final String SHARED_EVENT_ALIAS = "ExportANDMentions_GlobalEventID";

    public static final List<String> DEFAULT_SECONDARY_COLUMNS = List.of("MentionDocTone");
    public static final List<String> DEFAULT_TERTIARY_COLUMNS = List.of(
            "Actor1Code",
            "Actor1Name",
            "Actor1Geo_Type",
            "Actor1Geo_Fullname",
            "Actor1Geo_CountryCode",
            "NumMentions",
            "GoldsteinScale",
            "AvgTone");

    /**
     * A null or empty list falls back to the default columns for that table. Repeated names
     * are kept once, at their first position.
     */
    public JoinColumns {
        secondaryColumns = secondaryColumns == null || secondaryColumns.isEmpty()
                ? DEFAULT_SECONDARY_COLUMNS : distinct(secondaryColumns);
        tertiaryColumns = tertiaryColumns == null || tertiaryColumns.isEmpty()
                ? DEFAULT_TERTIARY_COLUMNS : distinct(tertiaryColumns);
    }

    private static List<String> distinct(List<String> columns) {
        return List.copyOf(new LinkedHashSet<>(columns));
    }

    public static JoinColumns defaults() {
        return new JoinColumns(null, null);
    }

    public static String secondaryAlias(String column) {
        return SECONDARY_PREFIX + column;
    }

    public static String tertiaryAlias(String column) {
        return EVENT_KEY.equals(column) ? SHARED_EVENT_ALIAS : TERTIARY_PREFIX + column;
    }

    /**
     * Checks that each present table carries the key columns of its join path and the
     * selected columns.
     *
     * @throws SchemaException naming every missing column, grouped by table
     */
    public void requireColumns(Table gkg, Table mentions, Table export) {
        Map<String, List<String>> missing = new LinkedHashMap<>();
        addMissing(missing, "gkg", gkg, List.of(PRIMARY_DOCUMENT_KEY));
        if (mentions != null) {
            List<String> required = new ArrayList<>();
            required.add(SECONDARY_DOCUMENT_KEY);
            if (export != null) {
                required.add(EVENT_KEY);
            }
            required.addAll(secondaryColumns);
            addMissing(missing, "mentions", mentions, required);
        }
        if (export != null) {
            List<String> required = new ArrayList<>();
            required.add(mentions != null ? EVENT_KEY : TERTIARY_URL_KEY);
            required.addAll(tertiaryColumns);
            addMissing(missing, "export", export, required);
        }
        if (!missing.isEmpty()) {
            throw new SchemaException(missing);
        }
    }

    private static void addMissing(Map<String, List<String>> missing, String name, Table table, List<String> required) {
        List<String> absent = table.missingColumns(required.stream().distinct().toList());
        if (!absent.isEmpty()) {
            missing.put(name, absent);
        }
    }
}
