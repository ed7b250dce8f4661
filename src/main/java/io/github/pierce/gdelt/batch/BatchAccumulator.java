package io.github.pierce.gdelt.batch;

import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import io.github.pierce.gdelt.keys.MappingStat;
import io.github.pierce.gdelt.quality.CompletenessStat;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.table.Table;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds instant outcomes into a {@link BatchResult}. Single writer: outcomes must be added
 * in timestamp order from one thread.
 */
class BatchAccumulator {

    private final List<String> requested;
    private final StatisticsLevel level;
    private final ReturnMode returnMode;
    private final boolean flatten;

    private final List<String> processed = new ArrayList<>();
    private final Map<String, String> failed = new LinkedHashMap<>();
    private final List<String> cancelled = new ArrayList<>();
    private final List<Table> joinedTables = new ArrayList<>();
    private final Map<String, Map<SourceRole, List<MappingStat>>> keyStats = new LinkedHashMap<>();
    private final Map<String, Map<String, Table>> mappingTables = new LinkedHashMap<>();
    private final Map<String, Map<String, CompletenessStat>> completeness = new LinkedHashMap<>();

    BatchAccumulator(List<String> requested, StatisticsLevel level, ReturnMode returnMode, boolean flatten) {
        this.requested = requested;
        this.level = level;
        this.returnMode = returnMode;
        this.flatten = flatten;
    }

    void add(InstantOutcome outcome) {
        switch (outcome.getState()) {
            case SUCCEEDED -> addSuccess(outcome.getResult());
            case FAILED -> failed.put(outcome.getTimestamp(), outcome.formatError());
            case CANCELLED -> cancelled.add(outcome.getTimestamp());
            default -> throw new IllegalStateException("Outcome not final: " + outcome.getState());
        }
    }

    void addCancelled(String timestamp) {
        cancelled.add(timestamp);
    }

    private void addSuccess(InstantResult result) {
        String ts = result.timestamp();
        joinedTables.add(result.joined());
        if (level == StatisticsLevel.ALL) {
            keyStats.put(ts, result.keyColumnStats());
            completeness.put(ts, result.completeness());
        }
        if (level != StatisticsLevel.NONE) {
            mappingTables.put(ts, result.mappingTables());
        }
        processed.add(ts);
    }

    BatchResult build(Duration elapsed) {
        Table joined = joinedTables.isEmpty() ? Table.empty() : Table.concat(joinedTables);
        Map<String, Table> flat = flatten ? flattenMappingTables() : Map.of();
        return new BatchResult(requested, processed, failed, cancelled, joined, keyStats, mappingTables,
                completeness, flat, level, returnMode, flatten, elapsed);
    }

    private Map<String, Table> flattenMappingTables() {
        ListMultimap<String, Table> byName = MultimapBuilder.linkedHashKeys().arrayListValues().build();
        mappingTables.values().forEach(tables -> tables.forEach(byName::put));
        Map<String, Table> out = new LinkedHashMap<>();
        for (String name : byName.keySet()) {
            out.put(name, Table.concat(byName.get(name)));
        }
        return out;
    }
}
