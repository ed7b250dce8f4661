package io.github.pierce.gdelt.source;

import io.github.pierce.gdelt.ValidationException;

import java.util.Locale;

/**
 * The three GDELT tables a processing instant can involve.
 */
public enum SourceRole {
    /** GKG: the always-present anchor table. */
    PRIMARY("primary", "gkg"),
    /** Mentions: mention-level enrichment. */
    SECONDARY("secondary", "mentions"),
    /** Export (events): event-level enrichment. */
    TERTIARY("tertiary", "export");

    private final String roleName;
    private final String fileKey;

    SourceRole(String roleName, String fileKey) {
        this.roleName = roleName;
        this.fileKey = fileKey;
    }

    public String roleName() {
        return roleName;
    }

    /**
     * Name of the GDELT file type backing this role ({@code gkg}, {@code mentions}, {@code export}).
     */
    public String fileKey() {
        return fileKey;
    }

    /**
     * Resolves either the role name or the GDELT file key, case-insensitively.
     */
    public static SourceRole fromName(String name) {
        if (name != null) {
            String normalized = name.strip().toLowerCase(Locale.ROOT);
            for (SourceRole role : values()) {
                if (role.roleName.equals(normalized) || role.fileKey.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new ValidationException("Unknown source role: " + name
                + ". Must be one of: primary/gkg, secondary/mentions, tertiary/export");
    }
}
