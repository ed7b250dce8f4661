package io.github.pierce.gdelt.join;

import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.source.SourceRole;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Which optional tables take part in a join, and therefore which predicate chain applies.
 */
public enum JoinCase {
    PRIMARY_ONLY("primary_only", "gkg_only", EnumSet.of(SourceRole.PRIMARY)),
    PRIMARY_SECONDARY("primary_secondary", "gkg_mentions", EnumSet.of(SourceRole.PRIMARY, SourceRole.SECONDARY)),
    PRIMARY_TERTIARY("primary_tertiary", "gkg_export", EnumSet.of(SourceRole.PRIMARY, SourceRole.TERTIARY)),
    ALL_THREE("all_three", "all", EnumSet.allOf(SourceRole.class));

    private final String configName;
    private final String legacyName;
    private final Set<SourceRole> roles;

    JoinCase(String configName, String legacyName, Set<SourceRole> roles) {
        this.configName = configName;
        this.legacyName = legacyName;
        this.roles = Collections.unmodifiableSet(roles);
    }

    public String configName() {
        return configName;
    }

    /**
     * Tables that must be fetched for this case.
     */
    public Set<SourceRole> roles() {
        return roles;
    }

    public boolean includes(SourceRole role) {
        return roles.contains(role);
    }

    /**
     * Accepts {@code primary_only|primary_secondary|primary_tertiary|all_three} and the GDELT
     * spellings {@code gkg_only|gkg_mentions|gkg_export|all}.
     */
    public static JoinCase fromName(String name) {
        if (name != null) {
            String normalized = name.strip().toLowerCase(Locale.ROOT);
            for (JoinCase joinCase : values()) {
                if (joinCase.configName.equals(normalized) || joinCase.legacyName.equals(normalized)) {
                    return joinCase;
                }
            }
        }
        throw new ValidationException("Unknown joincase: " + name
                + ". Must be one of: primary_only, primary_secondary, primary_tertiary, all_three");
    }
}
