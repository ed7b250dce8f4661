package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;

import java.util.Locale;

/**
 * Shape in which a batch result is handed back to callers that read it positionally.
 */
public enum ReturnMode {
    /** The full {@link BatchResult}. Also accepted as {@code always_dict}. */
    STRUCTURED("structured", "always_dict"),
    /** A {@link LegacyTuple} shaped by the statistics level. Also accepted as {@code match_processor}. */
    LEGACY_TUPLE("legacy_tuple", "match_processor");

    private final String configName;
    private final String alias;

    ReturnMode(String configName, String alias) {
        this.configName = configName;
        this.alias = alias;
    }

    public String configName() {
        return configName;
    }

    public static ReturnMode fromName(String name) {
        if (name != null) {
            String normalized = name.strip().toLowerCase(Locale.ROOT);
            for (ReturnMode mode : values()) {
                if (mode.configName.equals(normalized) || mode.alias.equals(normalized)) {
                    return mode;
                }
            }
        }
        throw new ValidationException("Invalid return mode: " + name + ". Must be 'structured' or 'legacy_tuple'");
    }
}
