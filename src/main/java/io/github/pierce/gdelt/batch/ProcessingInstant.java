package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.keys.KeyColumnSpec;

import java.util.Objects;

/**
 * What to do for one 15-minute file set: which tables to join, how much statistics work to
 * do and which key columns to analyze.
 */
public record ProcessingInstant(String timestamp, JoinCase joinCase, StatisticsLevel statisticsLevel,
                                KeyColumnSpec keyColumnSpec) {

    public ProcessingInstant {
        Objects.requireNonNull(joinCase, "joinCase");
        Objects.requireNonNull(statisticsLevel, "statisticsLevel");
        if (keyColumnSpec == null) {
            keyColumnSpec = KeyColumnSpec.empty(joinCase);
        } else if (keyColumnSpec.joinCase() != joinCase) {
            throw new ConfigurationException("Key column spec was built for join case "
                    + keyColumnSpec.joinCase().configName() + " but the instant uses " + joinCase.configName());
        }
    }

    /**
     * A copy for another timestamp; the receiver is left untouched.
     */
    public ProcessingInstant withTimestamp(String newTimestamp) {
        return new ProcessingInstant(newTimestamp, joinCase, statisticsLevel, keyColumnSpec);
    }
}
