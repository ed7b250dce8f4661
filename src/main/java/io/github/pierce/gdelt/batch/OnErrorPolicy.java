package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;

import java.util.Locale;

public enum OnErrorPolicy {
    /** Abort the batch on the first failed instant. */
    RAISE,
    /** Record the failure and continue with the next instant. */
    SKIP;

    public static OnErrorPolicy fromName(String name) {
        if (name != null) {
            String normalized = name.strip().toLowerCase(Locale.ROOT);
            for (OnErrorPolicy policy : values()) {
                if (policy.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                    return policy;
                }
            }
        }
        throw new ValidationException("Invalid on_error value: " + name + ". Must be 'raise' or 'skip'");
    }
}
