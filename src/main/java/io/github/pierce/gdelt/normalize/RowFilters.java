package io.github.pierce.gdelt.normalize;

import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Optional row filters applied around GKG normalization: a country/region allow-list and
 * a theme-label prefix allow-list. Each filter is a no-op when it has no values or the
 * column it reads is absent.
 */
public class RowFilters {

    public static final String GKG_LOCATIONS_COLUMN = "V2ENHANCEDLOCATIONS";
    public static final String EXPORT_COUNTRY_COLUMN = "Actor1Geo_CountryCode";
    public static final String PROCESSED_THEMES_COLUMN =
            GkgRecordNormalizer.SOURCE_PREFIX + GkgRecordNormalizer.V2_THEMES_LIST;

    private final List<String> countryCodes;
    private final List<String> themePrefixes;
    private final Pattern locationPattern;
    private final Logger log;

    public RowFilters(Collection<String> countryCodes, Collection<String> themePrefixes) {
        this(countryCodes, themePrefixes, LoggerFactory.getLogger(RowFilters.class));
    }

    public RowFilters(Collection<String> countryCodes, Collection<String> themePrefixes, Logger log) {
        this.countryCodes = countryCodes != null ? List.copyOf(countryCodes) : List.of();
        this.themePrefixes = themePrefixes != null
                ? themePrefixes.stream().map(String::strip).collect(Collectors.toUnmodifiableList())
                : List.of();
        this.locationPattern = this.countryCodes.isEmpty() ? null : Pattern.compile(
                "(?<=#)(" + this.countryCodes.stream().map(Pattern::quote).collect(Collectors.joining("|")) + ")(?=#)");
        this.log = log;
    }

    public static RowFilters none() {
        return new RowFilters(List.of(), List.of());
    }

    /**
     * Keeps raw GKG rows whose enhanced locations mention one of the codes between {@code #} delimiters.
     */
    public Table filterGkgByCountry(Table gkg) {
        if (locationPattern == null || !gkg.hasColumn(GKG_LOCATIONS_COLUMN)) {
            return gkg;
        }
        int idx = gkg.indexOf(GKG_LOCATIONS_COLUMN);
        Table filtered = gkg.filterRows(r -> {
            Object locations = gkg.get(r, idx);
            return !Values.isMissing(locations) && locationPattern.matcher(String.valueOf(locations)).find();
        });
        log.info("Country filter kept {} of {} GKG rows", filtered.rowCount(), gkg.rowCount());
        return filtered;
    }

    /**
     * Keeps export rows whose actor country code is one of the codes.
     */
    public Table filterExportByCountry(Table export) {
        if (export == null || countryCodes.isEmpty() || !export.hasColumn(EXPORT_COUNTRY_COLUMN)) {
            return export;
        }
        Set<String> codes = new HashSet<>(countryCodes);
        int idx = export.indexOf(EXPORT_COUNTRY_COLUMN);
        Table filtered = export.filterRows(r -> {
            Object code = export.get(r, idx);
            return !Values.isMissing(code) && codes.contains(String.valueOf(code));
        });
        log.info("Country filter kept {} of {} export rows", filtered.rowCount(), export.rowCount());
        return filtered;
    }

    /**
     * Keeps processed GKG rows where any enhanced theme label starts with one of the prefixes.
     */
    public Table filterByThemePrefix(Table processedGkg) {
        if (themePrefixes.isEmpty() || !processedGkg.hasColumn(PROCESSED_THEMES_COLUMN)) {
            return processedGkg;
        }
        int idx = processedGkg.indexOf(PROCESSED_THEMES_COLUMN);
        Table filtered = processedGkg.filterRows(r -> {
            Object cell = processedGkg.get(r, idx);
            String labels = Values.isMissing(cell) ? "" : String.valueOf(cell);
            for (String label : labels.split(",", -1)) {
                String trimmed = label.strip();
                for (String prefix : themePrefixes) {
                    if (trimmed.startsWith(prefix)) {
                        return true;
                    }
                }
            }
            return false;
        });
        log.info("Theme prefix filter kept {} of {} GKG rows", filtered.rowCount(), processedGkg.rowCount());
        return filtered;
    }

    public List<String> getCountryCodes() {
        return countryCodes;
    }

    public List<String> getThemePrefixes() {
        return themePrefixes;
    }
}
