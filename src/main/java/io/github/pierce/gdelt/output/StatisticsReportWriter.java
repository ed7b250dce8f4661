package io.github.pierce.gdelt.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.pierce.gdelt.batch.BatchResult;
import io.github.pierce.gdelt.keys.MappingStat;
import io.github.pierce.gdelt.quality.CompletenessStat;
import io.github.pierce.gdelt.source.SourceRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Writes the run summary and the per-timestamp key column and completeness statistics as JSON.
 */
public class StatisticsReportWriter {

    public static final String REPORT_PREFIX = "GDELT_Statistics_";

    private final ObjectMapper mapper;
    private final Logger log;

    public StatisticsReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT),
                LoggerFactory.getLogger(StatisticsReportWriter.class));
    }

    public StatisticsReportWriter(ObjectMapper mapper, Logger log) {
        this.mapper = mapper;
        this.log = log;
    }

    public Path write(Path outputDir, String rangeLabel, BatchResult result) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(REPORT_PREFIX + rangeLabel + ".json");
        mapper.writeValue(target.toFile(), toJson(result));
        log.info("Saved statistics report to {}", target);
        return target;
    }

    public ObjectNode toJson(BatchResult result) {
        ObjectNode root = mapper.createObjectNode();
        root.set("timestamps_requested", stringArray(result.getRequested()));
        root.set("timestamps_processed", stringArray(result.getProcessed()));
        ObjectNode failed = root.putObject("timestamps_failed");
        result.getFailed().forEach(failed::put);
        root.set("timestamps_cancelled", stringArray(result.getCancelled()));
        root.put("joined_rows", result.getJoined().rowCount());
        root.put("processing_time_seconds", result.getElapsed().toMillis() / 1000.0);

        ObjectNode keyStats = root.putObject("key_columns_stats_by_timestamp");
        for (Map.Entry<String, Map<SourceRole, List<MappingStat>>> instant : result.getKeyColumnStatsByInstant().entrySet()) {
            ObjectNode perInstant = keyStats.putObject(instant.getKey());
            instant.getValue().forEach((role, stats) -> {
                ObjectNode perRole = perInstant.putObject(role.fileKey());
                stats.forEach(stat -> stat.toMetrics().forEach(perRole::put));
            });
        }

        ObjectNode completeness = root.putObject("mapping_stats_by_timestamp");
        for (Map.Entry<String, Map<String, CompletenessStat>> instant : result.getCompletenessByInstant().entrySet()) {
            ObjectNode perInstant = completeness.putObject(instant.getKey());
            instant.getValue().forEach((column, stat) -> perInstant.set(column, mapper.valueToTree(stat.toReport())));
        }
        return root;
    }

    private ArrayNode stringArray(List<String> values) {
        ArrayNode array = mapper.createArrayNode();
        values.forEach(array::add);
        return array;
    }
}
