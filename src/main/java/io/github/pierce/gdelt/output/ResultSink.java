package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.table.Table;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Persists the tables a batch run produces.
 */
public interface ResultSink {

    /**
     * @param rangeLabel identifies the run in file names, e.g. {@code 20251201143000_20251201150000}
     */
    Path saveJoined(Table joined, String rangeLabel, OutputFormat format) throws IOException;

    /**
     * Writes all mapping checkup tables into one workbook. Nothing is written for an empty map.
     */
    Optional<Path> saveMappingTables(Map<String, Table> tables, String rangeLabel) throws IOException;
}
