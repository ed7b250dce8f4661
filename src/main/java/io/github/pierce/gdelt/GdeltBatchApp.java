package io.github.pierce.gdelt;

import io.github.pierce.gdelt.batch.BatchAggregator;
import io.github.pierce.gdelt.batch.BatchRequest;
import io.github.pierce.gdelt.batch.BatchResult;
import io.github.pierce.gdelt.batch.InstantPipeline;
import io.github.pierce.gdelt.config.BatchRunConfig;
import io.github.pierce.gdelt.config.BatchRunConfigLoader;
import io.github.pierce.gdelt.join.ConditionalJoinEngine;
import io.github.pierce.gdelt.join.JoinColumns;
import io.github.pierce.gdelt.normalize.GkgRecordNormalizer;
import io.github.pierce.gdelt.output.FileResultSink;
import io.github.pierce.gdelt.output.StatisticsReportWriter;
import io.github.pierce.gdelt.source.HeaderDictionary;
import io.github.pierce.gdelt.source.LocalArchiveTableProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs a batch from a YAML configuration file and writes the joined table, the mapping
 * workbook and a JSON statistics report to the configured output directory.
 *
 * <p><b>Usage:</b></p>
 * <pre>
 * java -cp gdelt-join-engine.jar io.github.pierce.gdelt.GdeltBatchApp [config.yaml]
 * </pre>
 */
public class GdeltBatchApp {

    private static final Logger LOG = LoggerFactory.getLogger(GdeltBatchApp.class);

    private final BatchRunConfig config;

    public GdeltBatchApp(BatchRunConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        String configFile = args.length > 0 ? args[0] : BatchRunConfigLoader.DEFAULT_CONFIG_FILE;
        try {
            BatchRunConfig config = new BatchRunConfigLoader().load(configFile);
            BatchResult result = new GdeltBatchApp(config).run();
            LOG.info("Finished: {}", result);
            if (!result.getFailed().isEmpty()) {
                System.exit(2);
            }
        } catch (BatchAbortedException e) {
            LOG.error("Batch aborted: {}", e.getMessage(), e);
            System.exit(1);
        } catch (IOException | GdeltProcessingException e) {
            LOG.error("Batch could not run: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Wires the local archive reader, pipeline and aggregator, runs the batch and saves its output.
     */
    public BatchResult run() throws IOException {
        if (config.getDictionaryPath() == null) {
            throw new ConfigurationException("paths.dictionary is required to read GDELT files");
        }
        HeaderDictionary dictionary = HeaderDictionary.fromWorkbook(config.getDictionaryPath());
        LocalArchiveTableProvider provider = new LocalArchiveTableProvider(config.getInputDirectory(), dictionary);

        JoinColumns joinColumns = config.toJoinColumns();
        InstantPipeline pipeline = new InstantPipeline(
                provider,
                new GkgRecordNormalizer(config.getGkgColumnsToDrop()),
                config.toRowFilters(),
                new ConditionalJoinEngine(joinColumns));
        BatchAggregator aggregator = new BatchAggregator(pipeline, () -> new ConditionalJoinEngine(joinColumns));

        BatchRequest request = config.toRequest();
        List<String> timestamps = request.timestamps();
        String rangeLabel = FileResultSink.rangeLabel(timestamps.get(0), timestamps.get(timestamps.size() - 1));

        BatchResult result = aggregator.run(request);

        Path outputDir = config.getOutputDirectory();
        Files.createDirectories(outputDir);
        FileResultSink sink = new FileResultSink(outputDir);
        if (!result.getProcessed().isEmpty()) {
            sink.saveJoined(result.getJoined(), rangeLabel, config.getOutputFormat());
        }
        sink.saveMappingTables(result.getFlattenedMappingTables(), rangeLabel);
        new StatisticsReportWriter().write(outputDir, rangeLabel, result);
        return result;
    }
}
