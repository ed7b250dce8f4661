package io.github.pierce.gdelt.batch;

import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.join.ConditionalJoinEngine;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.join.JoinColumns;
import io.github.pierce.gdelt.keys.KeyColumnAnalyzer;
import io.github.pierce.gdelt.keys.KeyColumnSpec;
import io.github.pierce.gdelt.normalize.GkgRecordNormalizer;
import io.github.pierce.gdelt.normalize.RowFilters;
import io.github.pierce.gdelt.quality.MappingQualityConfig;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.source.SourceTableProvider;
import io.github.pierce.gdelt.source.SourceTables;
import io.github.pierce.gdelt.table.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InstantPipelineTest {

    private static final String TS = "20250101000000";
    private static final JoinColumns COLUMNS = new JoinColumns(List.of("MentionDocTone"), List.of("AvgTone"));

    private static InstantPipeline pipeline(SourceTableProvider provider, RowFilters filters) {
        return new InstantPipeline(provider, new GkgRecordNormalizer(List.of("V2ENHANCEDLOCATIONS")),
                filters, new ConditionalJoinEngine(COLUMNS));
    }

    @Nested
    @DisplayName("Joined output")
    class JoinedOutput {

        @Test
        @DisplayName("GKG only: normalized rows with a leading timestamp column")
        void gkgOnly() throws Exception {
            InstantResult result = pipeline(GdeltTestTables.everything(), RowFilters.none()).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_ONLY, StatisticsLevel.NONE, null), null);

            Table joined = result.joined();
            assertThat(joined.columns().get(0)).isEqualTo(InstantPipeline.TIMESTAMP_COLUMN);
            assertThat(joined.column(InstantPipeline.TIMESTAMP_COLUMN)).containsOnly(TS);
            assertThat(joined.rowCount()).isEqualTo(2);
            assertThat(joined.columns()).doesNotContainAnyElementsOf(InstantPipeline.POST_NORMALIZE_DROP)
                    .doesNotContain("gkg_V2ENHANCEDLOCATIONS")
                    .contains("gkg_ACTUAL_TONE", "gkg_V2ENHANCEDTHEMES_list_str")
                    .noneMatch(c -> c.startsWith("Mentions_") || c.startsWith("Export_"));
            assertThat(result.keyColumnStats()).isEmpty();
            assertThat(result.mappingTables()).isEmpty();
        }

        @Test
        @DisplayName("tables outside the join case are ignored even when delivered")
        void ignoresTablesOutsideJoinCase() throws Exception {
            InstantResult result = pipeline(GdeltTestTables.everything(), RowFilters.none()).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_SECONDARY, StatisticsLevel.NONE, null), null);

            assertThat(result.joined().columns()).contains("Mentions_MentionDocTone")
                    .doesNotContain("Export_AvgTone");
            assertThat(result.joined().rowCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("fetches only the roles of the join case")
        void fetchesJoinCaseRoles() throws Exception {
            SourceTableProvider provider = mock(SourceTableProvider.class);
            when(provider.fetch(eq(TS), any())).thenReturn(GdeltTestTables.everything().fetch(TS, null));

            pipeline(provider, RowFilters.none()).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_TERTIARY, StatisticsLevel.NONE, null), null);

            verify(provider).fetch(TS, EnumSet.of(SourceRole.PRIMARY, SourceRole.TERTIARY));
        }

        @Test
        @DisplayName("country and theme filters apply before the join")
        void filters() throws Exception {
            RowFilters filters = new RowFilters(List.of("FR"), List.of("EPU"));

            InstantResult result = pipeline(GdeltTestTables.everything(), filters).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_TERTIARY, StatisticsLevel.NONE, null), null);

            assertThat(result.joined().column("gkg_GKGRECORDID")).containsExactly(TS + "-1");
            assertThat(result.joined().column("Export_AvgTone")).containsExactly("-4.0");
        }
    }

    @Nested
    @DisplayName("Statistics levels")
    class StatisticsLevels {

        private final KeyColumnSpec spec = KeyColumnSpec.builder(JoinCase.PRIMARY_SECONDARY)
                .single(SourceRole.PRIMARY, "gkg_V2DOCUMENTIDENTIFIER")
                .single(SourceRole.SECONDARY, "MentionIdentifier")
                .build();

        @Test
        @DisplayName("key columns stats adds timestamped mapping tables only")
        void keyColumnsStats() throws Exception {
            InstantResult result = pipeline(GdeltTestTables.everything(), RowFilters.none()).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_SECONDARY, StatisticsLevel.KEY_COLUMNS_STATS, spec), null);

            Table mapping = result.mappingTables().get(KeyColumnAnalyzer.GKG_VS_MENTIONS);
            assertThat(mapping.columns()).startsWith(InstantPipeline.TIMESTAMP_COLUMN, "gkg_V2DOCUMENTIDENTIFIER");
            assertThat(mapping.column(KeyColumnAnalyzer.MAPPED_COUNT_COLUMN)).containsExactly(2, 0);
            assertThat(result.keyColumnStats()).isEmpty();
            assertThat(result.completeness()).isEmpty();
        }

        @Test
        @DisplayName("all adds key statistics and completeness")
        void all() throws Exception {
            MappingQualityConfig quality = new MappingQualityConfig(
                    List.of("Mentions_MentionDocTone"), "gkg_V2DOCUMENTIDENTIFIER");

            InstantResult result = pipeline(GdeltTestTables.everything(), RowFilters.none()).process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_SECONDARY, StatisticsLevel.ALL, spec), quality);

            assertThat(result.keyColumnStats()).containsOnlyKeys(SourceRole.PRIMARY, SourceRole.SECONDARY);
            assertThat(result.completeness().get("Mentions_MentionDocTone").emptyCount()).isEqualTo(1L);
            assertThat(result.completeness().get("Mentions_MentionDocTone").rowsChecked()).isEqualTo(3L);
        }

        @Test
        @DisplayName("all without a mapping quality config is rejected")
        void allRequiresQualityConfig() {
            InstantPipeline pipeline = pipeline(GdeltTestTables.everything(), RowFilters.none());

            assertThatThrownBy(() -> pipeline.process(
                    new ProcessingInstant(TS, JoinCase.PRIMARY_SECONDARY, StatisticsLevel.ALL, spec), null))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("a spec built for another join case is rejected")
        void specJoinCaseMismatch() {
            assertThatThrownBy(() -> new ProcessingInstant(TS, JoinCase.ALL_THREE, StatisticsLevel.ALL, spec))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    @DisplayName("schema problems surface as schema exceptions")
    void schemaProblems() {
        SourceTableProvider provider = (ts, roles) -> SourceTables.primaryOnly(
                Table.builder("GKGRECORDID").addRow("x").build());

        assertThatThrownBy(() -> pipeline(provider, RowFilters.none()).process(
                new ProcessingInstant(TS, JoinCase.PRIMARY_ONLY, StatisticsLevel.NONE, null), null))
                .isInstanceOf(SchemaException.class);
    }
}
