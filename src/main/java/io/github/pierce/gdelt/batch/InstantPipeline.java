package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.join.JoinEngine;
import io.github.pierce.gdelt.keys.KeyColumnAnalyzer;
import io.github.pierce.gdelt.keys.MappingStat;
import io.github.pierce.gdelt.normalize.GkgRecordNormalizer;
import io.github.pierce.gdelt.normalize.RowFilters;
import io.github.pierce.gdelt.quality.CompletenessStat;
import io.github.pierce.gdelt.quality.MappingCompletenessAnalyzer;
import io.github.pierce.gdelt.quality.MappingQualityConfig;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.source.SourceTableProvider;
import io.github.pierce.gdelt.source.SourceTables;
import io.github.pierce.gdelt.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Processes a single instant: fetch, filter, normalize, join, then the statistics the
 * instant's level asks for.
 */
public class InstantPipeline {

    public static final String TIMESTAMP_COLUMN = "Time Stamp";

    /** Raw and intermediate GKG columns removed after normalization. */
    public static final List<String> POST_NORMALIZE_DROP = List.of(
            "gkg_V1THEMES",
            "gkg_V2ENHANCEDTHEMES",
            "gkg_V1.5TONE",
            "gkg_V1NUMBERS_list_str",
            "gkg_V2NUMBERS_list_str");

    private final SourceTableProvider provider;
    private final GkgRecordNormalizer normalizer;
    private final RowFilters filters;
    private final JoinEngine joinEngine;
    private final MappingCompletenessAnalyzer completenessAnalyzer;
    private final Logger log;

    public InstantPipeline(SourceTableProvider provider, GkgRecordNormalizer normalizer,
                           RowFilters filters, JoinEngine joinEngine) {
        this(provider, normalizer, filters, joinEngine, LoggerFactory.getLogger(InstantPipeline.class));
    }

    public InstantPipeline(SourceTableProvider provider, GkgRecordNormalizer normalizer,
                           RowFilters filters, JoinEngine joinEngine, Logger log) {
        this.provider = provider;
        this.normalizer = normalizer;
        this.filters = filters != null ? filters : RowFilters.none();
        this.joinEngine = joinEngine;
        this.completenessAnalyzer = new MappingCompletenessAnalyzer(log);
        this.log = log;
    }

    /**
     * Same pipeline with another join engine, for workers that must not share one.
     */
    public InstantPipeline withJoinEngine(JoinEngine engine) {
        return new InstantPipeline(provider, normalizer, filters, engine, log);
    }

    public InstantResult process(ProcessingInstant instant, MappingQualityConfig mappingQuality) throws IOException {
        String ts = instant.timestamp();
        StatisticsLevel level = instant.statisticsLevel();
        if (level == StatisticsLevel.ALL && mappingQuality == null) {
            throw new ValidationException("Mapping quality configuration is required when statistics='all'");
        }
        log.info("Processing fileset for timestamp: {}", ts);

        SourceTables fetched = provider.fetch(ts, instant.joinCase().roles());
        SourceTables tables = new SourceTables(
                fetched.primary(),
                instant.joinCase().includes(SourceRole.SECONDARY) ? fetched.secondary() : null,
                instant.joinCase().includes(SourceRole.TERTIARY) ? fetched.tertiary() : null);

        Table gkg = filters.filterGkgByCountry(tables.primary());
        gkg = normalizer.process(gkg).dropColumns(POST_NORMALIZE_DROP);
        gkg = filters.filterByThemePrefix(gkg);
        Table export = filters.filterExportByCountry(tables.tertiary());
        SourceTables prepared = new SourceTables(gkg, tables.secondary(), export);

        Table joined = joinEngine.join(gkg, prepared.secondary(), export).withLeadingColumn(TIMESTAMP_COLUMN, ts);

        if (level == StatisticsLevel.NONE) {
            log.info("Completed processing for {} (no statistics)", ts);
            return InstantResult.joinedOnly(ts, joined);
        }

        KeyColumnAnalyzer keyAnalyzer = new KeyColumnAnalyzer(instant.keyColumnSpec());
        Map<SourceRole, List<MappingStat>> keyStats = null;
        Map<String, CompletenessStat> completeness = null;
        if (level == StatisticsLevel.ALL) {
            keyStats = keyAnalyzer.checkKeyColumns(prepared);
            completeness = completenessAnalyzer.analyzeUnmapped(joined, mappingQuality);
        }
        Map<String, Table> mappingTables = new LinkedHashMap<>();
        keyAnalyzer.mappingCheckup(prepared)
                .forEach((name, table) -> mappingTables.put(name, table.withLeadingColumn(TIMESTAMP_COLUMN, ts)));

        log.info("Completed processing for {} ({})", ts,
                level == StatisticsLevel.ALL ? "all statistics" : "key columns stats only");
        return new InstantResult(ts, joined, keyStats, mappingTables, completeness);
    }
}
