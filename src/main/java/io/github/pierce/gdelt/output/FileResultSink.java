package io.github.pierce.gdelt.output;

import io.github.pierce.gdelt.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

/**
 * Writes results under an output directory as {@code GDELT_Joint_<range>.<csv|xlsx>} and
 * {@code Key_columns_checkup_<range>.xlsx}.
 */
public class FileResultSink implements ResultSink {

    public static final String JOINED_PREFIX = "GDELT_Joint_";
    public static final String MAPPING_PREFIX = "Key_columns_checkup_";

    private final Path outputDir;
    private final CsvTableWriter csvWriter;
    private final ExcelTableWriter excelWriter;
    private final Logger log;

    public FileResultSink(Path outputDir) {
        this(outputDir, new CsvTableWriter(), new ExcelTableWriter(), LoggerFactory.getLogger(FileResultSink.class));
    }

    public FileResultSink(Path outputDir, CsvTableWriter csvWriter, ExcelTableWriter excelWriter, Logger log) {
        this.outputDir = outputDir;
        this.csvWriter = csvWriter;
        this.excelWriter = excelWriter;
        this.log = log;
    }

    @Override
    public Path saveJoined(Table joined, String rangeLabel, OutputFormat format) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(JOINED_PREFIX + rangeLabel + "." + format.extension());
        switch (format) {
            case CSV -> csvWriter.write(target, joined);
            case XLSX -> excelWriter.write(target, Map.of("Sheet1", joined));
        }
        log.info("Saved results to {}", target);
        return target;
    }

    @Override
    public Optional<Path> saveMappingTables(Map<String, Table> tables, String rangeLabel) throws IOException {
        if (tables == null || tables.isEmpty()) {
            log.warn("No key column stats to save - skipping export");
            return Optional.empty();
        }
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(MAPPING_PREFIX + rangeLabel + "." + OutputFormat.XLSX.extension());
        excelWriter.write(target, tables);
        log.info("Saved results to {}", target);
        return Optional.of(target);
    }

    /**
     * {@code start} alone, or {@code start_end} when the run covered a range.
     */
    public static String rangeLabel(String start, String end) {
        if (end == null || end.isBlank() || end.equals(start)) {
            return start;
        }
        return start + "_" + end;
    }

    public Path getOutputDir() {
        return outputDir;
    }
}
