package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;

import java.util.Locale;

/**
 * How much statistics work each instant does besides the join.
 */
public enum StatisticsLevel {
    /** Join only. */
    NONE("none"),
    /** Join plus the per-pair mapping checkup tables. */
    KEY_COLUMNS_STATS("key_columns_stats"),
    /** Join, mapping checkup tables, key column cardinality and mapping completeness. */
    ALL("all");

    private final String configName;

    StatisticsLevel(String configName) {
        this.configName = configName;
    }

    public String configName() {
        return configName;
    }

    public static StatisticsLevel fromName(String name) {
        if (name != null) {
            String normalized = name.strip().toLowerCase(Locale.ROOT);
            for (StatisticsLevel level : values()) {
                if (level.configName.equals(normalized)) {
                    return level;
                }
            }
        }
        throw new ValidationException("Invalid statistics parameter: " + name
                + ". Must be 'all', 'key_columns_stats', or 'none'");
    }
}
