package io.github.pierce.gdelt.quality;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.table.Table;
import io.github.pierce.gdelt.table.Values;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Counts unmapped (null or blank) values in joined columns. Only rows with a filled
 * identifier are counted.
 */
public class MappingCompletenessAnalyzer {

    private final Logger log;

    public MappingCompletenessAnalyzer() {
        this(LoggerFactory.getLogger(MappingCompletenessAnalyzer.class));
    }

    public MappingCompletenessAnalyzer(Logger log) {
        this.log = log;
    }

    public Map<String, CompletenessStat> analyzeUnmapped(Table joined, MappingQualityConfig config) {
        return analyzeUnmapped(joined, config.checkColumns(), config.identifierColumn());
    }

    /**
     * @throws SchemaException if the identifier column is absent
     */
    public Map<String, CompletenessStat> analyzeUnmapped(Table joined, List<String> columns, String identifierColumn) {
        if (!joined.hasColumn(identifierColumn)) {
            throw new SchemaException("joined", List.of(identifierColumn));
        }

        int idIdx = joined.indexOf(identifierColumn);
        List<Integer> filled = new ArrayList<>();
        for (int r = 0; r < joined.rowCount(); r++) {
            if (!Values.isBlank(joined.get(r, idIdx))) {
                filled.add(r);
            }
        }

        Map<String, CompletenessStat> results = new LinkedHashMap<>();
        for (String column : columns) {
            if (!joined.hasColumn(column)) {
                log.warn("Column '{}' not found in joined data", column);
                results.put(column, CompletenessStat.columnNotFound());
                continue;
            }
            int idx = joined.indexOf(column);
            long empty = filled.stream().filter(r -> Values.isBlank(joined.get(r, idx))).count();
            CompletenessStat stat = CompletenessStat.of(empty, filled.size());
            log.info("{}: {} empty of {} rows checked ({})", column, empty, filled.size(), stat.percentOfRows());
            results.put(column, stat);
        }
        return results;
    }
}
