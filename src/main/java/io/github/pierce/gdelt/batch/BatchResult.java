package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.keys.MappingStat;
import io.github.pierce.gdelt.quality.CompletenessStat;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.table.Table;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated output of a batch run. Per-instant maps are keyed by timestamp in timestamp order
 * and only contain instants that succeeded.
 */
public final class BatchResult {

    private final List<String> requested;
    private final List<String> processed;
    private final Map<String, String> failed;
    private final List<String> cancelled;
    private final Table joined;
    private final Map<String, Map<SourceRole, List<MappingStat>>> keyColumnStatsByInstant;
    private final Map<String, Map<String, Table>> mappingTablesByInstant;
    private final Map<String, Map<String, CompletenessStat>> completenessByInstant;
    private final Map<String, Table> flattenedMappingTables;
    private final StatisticsLevel statisticsLevel;
    private final ReturnMode returnMode;
    private final boolean flattened;
    private final Duration elapsed;

    BatchResult(List<String> requested, List<String> processed, Map<String, String> failed, List<String> cancelled,
                Table joined, Map<String, Map<SourceRole, List<MappingStat>>> keyColumnStatsByInstant,
                Map<String, Map<String, Table>> mappingTablesByInstant,
                Map<String, Map<String, CompletenessStat>> completenessByInstant,
                Map<String, Table> flattenedMappingTables, StatisticsLevel statisticsLevel,
                ReturnMode returnMode, boolean flattened, Duration elapsed) {
        this.requested = List.copyOf(requested);
        this.processed = List.copyOf(processed);
        this.failed = Collections.unmodifiableMap(new LinkedHashMap<>(failed));
        this.cancelled = List.copyOf(cancelled);
        this.joined = joined;
        this.keyColumnStatsByInstant = Collections.unmodifiableMap(new LinkedHashMap<>(keyColumnStatsByInstant));
        this.mappingTablesByInstant = Collections.unmodifiableMap(new LinkedHashMap<>(mappingTablesByInstant));
        this.completenessByInstant = Collections.unmodifiableMap(new LinkedHashMap<>(completenessByInstant));
        this.flattenedMappingTables = Collections.unmodifiableMap(new LinkedHashMap<>(flattenedMappingTables));
        this.statisticsLevel = statisticsLevel;
        this.returnMode = returnMode;
        this.flattened = flattened;
        this.elapsed = elapsed;
    }

    public List<String> getRequested() {
        return requested;
    }

    public List<String> getProcessed() {
        return processed;
    }

    /**
     * Failed timestamps mapped to {@code "<ExceptionSimpleName>: <message>"}.
     */
    public Map<String, String> getFailed() {
        return failed;
    }

    /**
     * Timestamps never started because the run was cancelled or aborted.
     */
    public List<String> getCancelled() {
        return cancelled;
    }

    public Table getJoined() {
        return joined;
    }

    public Map<String, Map<SourceRole, List<MappingStat>>> getKeyColumnStatsByInstant() {
        return keyColumnStatsByInstant;
    }

    public Map<String, Map<String, Table>> getMappingTablesByInstant() {
        return mappingTablesByInstant;
    }

    public Map<String, Map<String, CompletenessStat>> getCompletenessByInstant() {
        return completenessByInstant;
    }

    /**
     * Mapping tables of all instants concatenated by name; empty unless flattening was requested.
     */
    public Map<String, Table> getFlattenedMappingTables() {
        return flattenedMappingTables;
    }

    public StatisticsLevel getStatisticsLevel() {
        return statisticsLevel;
    }

    public ReturnMode getReturnMode() {
        return returnMode;
    }

    public Duration getElapsed() {
        return elapsed;
    }

    public boolean isComplete() {
        return failed.isEmpty() && cancelled.isEmpty();
    }

    public LegacyTuple legacyTuple() {
        Object mappingTables = flattened ? flattenedMappingTables : mappingTablesByInstant;
        List<Object> elements = new ArrayList<>();
        switch (statisticsLevel) {
            case NONE -> elements.add(joined);
            case KEY_COLUMNS_STATS -> {
                elements.add(mappingTables);
                elements.add(joined);
            }
            case ALL -> {
                elements.add(keyColumnStatsByInstant);
                elements.add(mappingTables);
                elements.add(joined);
                elements.add(completenessByInstant);
            }
        }
        return new LegacyTuple(statisticsLevel, elements);
    }

    /**
     * This result or its {@link #legacyTuple()}, depending on the requested return mode.
     */
    public Object output() {
        return returnMode == ReturnMode.LEGACY_TUPLE ? legacyTuple() : this;
    }

    @Override
    public String toString() {
        return "BatchResult[requested=" + requested.size() + ", processed=" + processed.size()
                + ", failed=" + failed.size() + ", cancelled=" + cancelled.size()
                + ", joinedRows=" + joined.rowCount() + "]";
    }
}
