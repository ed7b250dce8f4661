package io.github.pierce.gdelt.config;

import io.github.pierce.gdelt.batch.BatchRequest;
import io.github.pierce.gdelt.batch.OnErrorPolicy;
import io.github.pierce.gdelt.batch.ProcessingInstant;
import io.github.pierce.gdelt.batch.ReturnMode;
import io.github.pierce.gdelt.batch.StatisticsLevel;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.join.JoinColumns;
import io.github.pierce.gdelt.keys.KeyColumnSpec;
import io.github.pierce.gdelt.normalize.RowFilters;
import io.github.pierce.gdelt.output.OutputFormat;
import io.github.pierce.gdelt.quality.MappingQualityConfig;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Options for one batch run.
 *
 * <p>This class uses the builder pattern and is immutable once constructed. The key column
 * map is validated against the join case when {@link Builder#build()} is called.</p>
 */
public final class BatchRunConfig {

    // What to run
    private final JoinCase joinCase;
    private final StatisticsLevel statisticsLevel;
    private final KeyColumnSpec keyColumnSpec;
    private final MappingQualityConfig mappingQuality;
    private final String timestampStart;
    private final String timestampEnd;

    // How to run it
    private final OnErrorPolicy onError;
    private final ReturnMode returnMode;
    private final boolean flattenMappingTables;
    private final int parallelism;

    // Column and row selection
    private final List<String> countryCodes;
    private final List<String> themeTags;
    private final List<String> gkgColumnsToDrop;
    private final List<String> mentionsColumns;
    private final List<String> exportColumns;

    // Files
    private final Path dictionaryPath;
    private final Path inputDirectory;
    private final Path outputDirectory;
    private final OutputFormat outputFormat;

    private BatchRunConfig(Builder builder) {
        this.joinCase = builder.joinCase;
        this.statisticsLevel = builder.statisticsLevel;
        this.keyColumnSpec = builder.keyColumnSpec != null
                ? builder.keyColumnSpec
                : KeyColumnSpec.fromMap(builder.joinCase, builder.keyColumns);
        this.mappingQuality = builder.mappingQuality;
        this.timestampStart = builder.timestampStart;
        this.timestampEnd = builder.timestampEnd;
        this.onError = builder.onError;
        this.returnMode = builder.returnMode;
        this.flattenMappingTables = builder.flattenMappingTables;
        this.parallelism = builder.parallelism;
        this.countryCodes = List.copyOf(builder.countryCodes);
        this.themeTags = List.copyOf(builder.themeTags);
        this.gkgColumnsToDrop = List.copyOf(builder.gkgColumnsToDrop);
        this.mentionsColumns = List.copyOf(builder.mentionsColumns);
        this.exportColumns = List.copyOf(builder.exportColumns);
        this.dictionaryPath = builder.dictionaryPath;
        this.inputDirectory = builder.inputDirectory;
        this.outputDirectory = builder.outputDirectory;
        this.outputFormat = builder.outputFormat;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BatchRunConfig defaults() {
        return builder().build();
    }

    public ProcessingInstant toBaseInstant() {
        return new ProcessingInstant(timestampStart, joinCase, statisticsLevel, keyColumnSpec);
    }

    public BatchRequest toRequest() {
        return BatchRequest.builder(toBaseInstant())
                .mappingQuality(mappingQuality)
                .range(timestampStart, timestampEnd)
                .onError(onError)
                .returnMode(returnMode)
                .flattenMappingTables(flattenMappingTables)
                .parallelism(parallelism)
                .build();
    }

    public JoinColumns toJoinColumns() {
        return new JoinColumns(mentionsColumns, exportColumns);
    }

    public RowFilters toRowFilters() {
        return new RowFilters(countryCodes, themeTags);
    }

    // Getters

    public JoinCase getJoinCase() {
        return joinCase;
    }

    public StatisticsLevel getStatisticsLevel() {
        return statisticsLevel;
    }

    public KeyColumnSpec getKeyColumnSpec() {
        return keyColumnSpec;
    }

    public MappingQualityConfig getMappingQuality() {
        return mappingQuality;
    }

    public String getTimestampStart() {
        return timestampStart;
    }

    public String getTimestampEnd() {
        return timestampEnd;
    }

    public OnErrorPolicy getOnError() {
        return onError;
    }

    public ReturnMode getReturnMode() {
        return returnMode;
    }

    public boolean isFlattenMappingTables() {
        return flattenMappingTables;
    }

    public int getParallelism() {
        return parallelism;
    }

    public List<String> getCountryCodes() {
        return countryCodes;
    }

    public List<String> getThemeTags() {
        return themeTags;
    }

    public List<String> getGkgColumnsToDrop() {
        return gkgColumnsToDrop;
    }

    public List<String> getMentionsColumns() {
        return mentionsColumns;
    }

    public List<String> getExportColumns() {
        return exportColumns;
    }

    public Path getDictionaryPath() {
        return dictionaryPath;
    }

    public Path getInputDirectory() {
        return inputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    // Builder

    public static final class Builder {
        private JoinCase joinCase = JoinCase.PRIMARY_ONLY;
        private StatisticsLevel statisticsLevel = StatisticsLevel.NONE;
        private Map<String, ?> keyColumns = Map.of();
        private KeyColumnSpec keyColumnSpec;
        private MappingQualityConfig mappingQuality;
        private String timestampStart;
        private String timestampEnd;
        private OnErrorPolicy onError = OnErrorPolicy.RAISE;
        private ReturnMode returnMode = ReturnMode.STRUCTURED;
        private boolean flattenMappingTables = true;
        private int parallelism = 1;
        private List<String> countryCodes = List.of();
        private List<String> themeTags = List.of();
        private List<String> gkgColumnsToDrop = List.of();
        private List<String> mentionsColumns = List.of();
        private List<String> exportColumns = List.of();
        private Path dictionaryPath;
        private Path inputDirectory = Path.of("data");
        private Path outputDirectory = Path.of("Output");
        private OutputFormat outputFormat = OutputFormat.CSV;

        private Builder() {
        }

        public Builder joinCase(JoinCase joinCase) {
            this.joinCase = joinCase;
            return this;
        }

        public Builder statisticsLevel(StatisticsLevel level) {
            this.statisticsLevel = level;
            return this;
        }

        /**
         * Role name ({@code gkg}, {@code mentions}, {@code export}) to a column name or a list of
         * one or two names.
         */
        public Builder keyColumns(Map<String, ?> keyColumns) {
            this.keyColumns = keyColumns != null ? keyColumns : Map.of();
            return this;
        }

        /**
         * An already validated spec; takes precedence over {@link #keyColumns(Map)}.
         */
        public Builder keyColumnSpec(KeyColumnSpec spec) {
            this.keyColumnSpec = spec;
            return this;
        }

        public Builder mappingQuality(MappingQualityConfig config) {
            this.mappingQuality = config;
            return this;
        }

        public Builder timestampStart(String start) {
            this.timestampStart = start;
            return this;
        }

        public Builder timestampEnd(String end) {
            this.timestampEnd = end;
            return this;
        }

        public Builder onError(OnErrorPolicy policy) {
            this.onError = policy;
            return this;
        }

        public Builder returnMode(ReturnMode mode) {
            this.returnMode = mode;
            return this;
        }

        public Builder flattenMappingTables(boolean flatten) {
            this.flattenMappingTables = flatten;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder countryCodes(List<String> codes) {
            this.countryCodes = codes != null ? codes : List.of();
            return this;
        }

        public Builder themeTags(List<String> tags) {
            this.themeTags = tags != null ? tags : List.of();
            return this;
        }

        public Builder gkgColumnsToDrop(List<String> columns) {
            this.gkgColumnsToDrop = columns != null ? columns : List.of();
            return this;
        }

        public Builder mentionsColumns(List<String> columns) {
            this.mentionsColumns = columns != null ? columns : List.of();
            return this;
        }

        public Builder exportColumns(List<String> columns) {
            this.exportColumns = columns != null ? columns : List.of();
            return this;
        }

        public Builder dictionaryPath(Path path) {
            this.dictionaryPath = path;
            return this;
        }

        public Builder inputDirectory(Path path) {
            this.inputDirectory = path;
            return this;
        }

        public Builder outputDirectory(Path path) {
            this.outputDirectory = path;
            return this;
        }

        public Builder outputFormat(OutputFormat format) {
            this.outputFormat = format;
            return this;
        }

        /**
         * @throws io.github.pierce.gdelt.ConfigurationException if the key columns do not fit the join case
         */
        public BatchRunConfig build() {
            return new BatchRunConfig(this);
        }
    }
}
