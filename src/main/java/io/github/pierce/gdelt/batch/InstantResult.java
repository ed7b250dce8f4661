package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.keys.MappingStat;
import io.github.pierce.gdelt.quality.CompletenessStat;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.table.Table;

import java.util.List;
import java.util.Map;

/**
 * Output of one successfully processed instant. Statistics the level did not ask for are empty.
 */
public record InstantResult(String timestamp,
                            Table joined,
                            Map<SourceRole, List<MappingStat>> keyColumnStats,
                            Map<String, Table> mappingTables,
                            Map<String, CompletenessStat> completeness) {

    public InstantResult {
        keyColumnStats = keyColumnStats == null ? Map.of() : keyColumnStats;
        mappingTables = mappingTables == null ? Map.of() : mappingTables;
        completeness = completeness == null ? Map.of() : completeness;
    }

    public static InstantResult joinedOnly(String timestamp, Table joined) {
        return new InstantResult(timestamp, joined, null, null, null);
    }
}
