package io.github.pierce.gdelt.keys;

import io.github.pierce.gdelt.SchemaException;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.source.SourceRole;
import io.github.pierce.gdelt.source.SourceTables;
import io.github.pierce.gdelt.table.Table;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KeyColumnAnalyzerTest {

    private static final Table GKG = Table.builder("gkg_GKGRECORDID", "gkg_V2DOCUMENTIDENTIFIER")
            .addRow("r1", "http://a")
            .addRow("r2", "http://b")
            .addRow("r3", "http://a")
            .addRow("r4", null)
            .build();

    private static final Table MENTIONS = Table.builder("GlobalEventID", "MentionIdentifier")
            .addRow("100", "http://a")
            .addRow("101", "http://a")
            .addRow("102", "http://c")
            .addRow("103", " ")
            .build();

    private static final Table EXPORT = Table.builder("GlobalEventID", "SOURCEURL")
            .addRow("100", "http://a")
            .addRow("102", "http://c")
            .addRow("102", "http://c2")
            .build();

    private static KeyColumnSpec allThree() {
        return KeyColumnSpec.builder(JoinCase.ALL_THREE)
                .single(SourceRole.PRIMARY, "gkg_V2DOCUMENTIDENTIFIER")
                .paired(SourceRole.SECONDARY, "MentionIdentifier", "GlobalEventID")
                .single(SourceRole.TERTIARY, "GlobalEventID")
                .build();
    }

    @Nested
    @DisplayName("checkKeyColumns")
    class CheckKeyColumns {

        @Test
        @DisplayName("counts rows, unique values and duplicates per column")
        void countsPerColumn() {
            Map<SourceRole, List<MappingStat>> stats = new KeyColumnAnalyzer(allThree())
                    .checkKeyColumns(new SourceTables(GKG, MENTIONS, EXPORT));

            MappingStat gkg = stats.get(SourceRole.PRIMARY).get(0);
            assertThat(gkg.position()).isZero();
            assertThat(gkg.rowCount()).isEqualTo(4);
            assertThat(gkg.uniqueCount()).isEqualTo(2);
            assertThat(gkg.duplicateCount()).isEqualTo(2);

            assertThat(stats.get(SourceRole.SECONDARY)).extracting(MappingStat::position, MappingStat::column)
                    .containsExactly(tuple(1, "MentionIdentifier"), tuple(2, "GlobalEventID"));
            assertThat(stats.get(SourceRole.TERTIARY).get(0).uniqueCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("duplicate count is never negative")
        void duplicateCountInvariant() {
            Map<SourceRole, List<MappingStat>> stats = new KeyColumnAnalyzer(allThree())
                    .checkKeyColumns(new SourceTables(GKG, MENTIONS, EXPORT));

            stats.values().stream().flatMap(List::stream).forEach(s -> {
                assertThat(s.duplicateCount()).isEqualTo(s.rowCount() - s.uniqueCount());
                assertThat(s.duplicateCount()).isGreaterThanOrEqualTo(0);
            });
        }

        @Test
        @DisplayName("metric names follow the report layout")
        void metricNames() {
            MappingStat single = new MappingStat(SourceRole.PRIMARY, 0, "GKGRECORDID", 10, 7);
            MappingStat paired = new MappingStat(SourceRole.SECONDARY, 2, "GlobalEventID", 5, 5);

            assertThat(single.toMetrics()).containsExactly(
                    entry("key_column_GKGRECORDID_length", 10L),
                    entry("key_column_GKGRECORDID_uniquevalues_length", 7L),
                    entry("key_column_GKGRECORDID_length_difference", 3L));
            assertThat(paired.toMetrics()).containsKey("key_column_2_GlobalEventID_uniquevalues_length");
        }

        @Test
        @DisplayName("absent tables are skipped and missing columns are reported together")
        void missingColumns() {
            KeyColumnSpec spec = KeyColumnSpec.builder(JoinCase.ALL_THREE)
                    .single(SourceRole.PRIMARY, "gkg_NOPE")
                    .single(SourceRole.SECONDARY, "AlsoMissing")
                    .single(SourceRole.TERTIARY, "GlobalEventID")
                    .build();

            assertThatThrownBy(() -> new KeyColumnAnalyzer(spec).checkKeyColumns(new SourceTables(GKG, MENTIONS, null)))
                    .isInstanceOf(SchemaException.class)
                    .satisfies(e -> assertThat(((SchemaException) e).getMissingByTable())
                            .containsOnlyKeys("gkg", "mentions"));
        }

        @Test
        @DisplayName("an empty spec yields no statistics")
        void emptySpec() {
            assertThat(new KeyColumnAnalyzer(KeyColumnSpec.empty(JoinCase.ALL_THREE))
                    .checkKeyColumns(SourceTables.primaryOnly(GKG))).isEmpty();
        }
    }

    @Nested
    @DisplayName("mappingCheckup")
    class MappingCheckup {

        @Test
        @DisplayName("builds one table per adjacent pair")
        void onePerPair() {
            Map<String, Table> tables = new KeyColumnAnalyzer(allThree())
                    .mappingCheckup(new SourceTables(GKG, MENTIONS, EXPORT));

            assertThat(tables).containsOnlyKeys(
                    KeyColumnAnalyzer.GKG_VS_MENTIONS, KeyColumnAnalyzer.GKG_VS_EXPORT, KeyColumnAnalyzer.MENTIONS_VS_EXPORT);
        }

        @Test
        @DisplayName("has one row per left row with the matched values and their count")
        void matchedValues() {
            Table gkgVsMentions = new KeyColumnAnalyzer(allThree())
                    .mappingCheckup(new SourceTables(GKG, MENTIONS, EXPORT))
                    .get(KeyColumnAnalyzer.GKG_VS_MENTIONS);

            assertThat(gkgVsMentions.rowCount()).isEqualTo(GKG.rowCount());
            assertThat(gkgVsMentions.columns()).containsExactly(
                    "gkg_V2DOCUMENTIDENTIFIER", KeyColumnAnalyzer.MAPPED_MENTIONS_COLUMN, KeyColumnAnalyzer.MAPPED_COUNT_COLUMN);
            assertThat(gkgVsMentions.column(KeyColumnAnalyzer.MAPPED_COUNT_COLUMN)).containsExactly(2, 0, 2, 0);
            assertThat(gkgVsMentions.get(0, KeyColumnAnalyzer.MAPPED_MENTIONS_COLUMN))
                    .isEqualTo(List.of("http://a", "http://a"));
        }

        @Test
        @DisplayName("mentions versus export uses the second mentions key")
        void mentionsVersusExport() {
            Table table = new KeyColumnAnalyzer(allThree())
                    .mappingCheckup(new SourceTables(GKG, MENTIONS, EXPORT))
                    .get(KeyColumnAnalyzer.MENTIONS_VS_EXPORT);

            assertThat(table.columns().get(0)).isEqualTo("GlobalEventID");
            assertThat(table.column(KeyColumnAnalyzer.MAPPED_COUNT_COLUMN)).containsExactly(1, 0, 2, 0);
        }

        @Test
        @DisplayName("pairs with an absent table are skipped")
        void absentTableSkipped() {
            KeyColumnSpec spec = KeyColumnSpec.builder(JoinCase.PRIMARY_SECONDARY)
                    .single(SourceRole.PRIMARY, "gkg_V2DOCUMENTIDENTIFIER")
                    .single(SourceRole.SECONDARY, "MentionIdentifier")
                    .build();

            Map<String, Table> tables = new KeyColumnAnalyzer(spec)
                    .mappingCheckup(new SourceTables(GKG, MENTIONS, null));

            assertThat(tables).containsOnlyKeys(KeyColumnAnalyzer.GKG_VS_MENTIONS);
        }

        @Test
        @DisplayName("countMappings excludes blank right keys")
        void blankRightKeys() {
            Table left = Table.builder("k").addRow(" ").addRow("x").build();
            Table right = Table.builder("k").addRow(" ").addRow("x").addRow((Object) null).build();

            List<MappingCountRow> rows = KeyColumnAnalyzer.countMappings(left, "k", right, "k");

            assertThat(rows).extracting(MappingCountRow::matchedCount).containsExactly(0, 1);
        }

        @Test
        @DisplayName("countMappings reports missing columns on both sides")
        void countMappingsMissing() {
            Table table = Table.builder("a").build();

            assertThatThrownBy(() -> KeyColumnAnalyzer.countMappings(table, "x", table, "y"))
                    .isInstanceOf(SchemaException.class)
                    .satisfies(e -> assertThat(((SchemaException) e).getMissingColumns()).containsExactly("x", "y"));
        }
    }

    @Nested
    @DisplayName("single mentions key")
    class SingleMentionsKey {

        private final Table gkgWithEvents = Table.builder("gkg_EVENTID")
                .addRow("100")
                .addRow("102")
                .addRow("999")
                .build();

        private Map<String, Table> checkup() {
            KeyColumnSpec spec = KeyColumnSpec.builder(JoinCase.ALL_THREE)
                    .single(SourceRole.PRIMARY, "gkg_EVENTID")
                    .single(SourceRole.SECONDARY, "GlobalEventID")
                    .single(SourceRole.TERTIARY, "GlobalEventID")
                    .build();
            return new KeyColumnAnalyzer(spec).mappingCheckup(new SourceTables(gkgWithEvents, MENTIONS, EXPORT));
        }

        @Test
        @DisplayName("joins towards GKG on the single column")
        void towardsGkg() {
            Table table = checkup().get(KeyColumnAnalyzer.GKG_VS_MENTIONS);

            assertThat(table.columns().get(0)).isEqualTo("gkg_EVENTID");
            assertThat(table.column(KeyColumnAnalyzer.MAPPED_MENTIONS_COLUMN))
                    .containsExactly(List.of("100"), List.of("102"), List.of());
            assertThat(table.column(KeyColumnAnalyzer.MAPPED_COUNT_COLUMN)).containsExactly(1, 1, 0);
        }

        @Test
        @DisplayName("joins towards Export on the same column")
        void towardsExport() {
            Table table = checkup().get(KeyColumnAnalyzer.MENTIONS_VS_EXPORT);

            assertThat(table.columns().get(0)).isEqualTo("GlobalEventID");
            assertThat(table.column("GlobalEventID")).containsExactly("100", "101", "102", "103");
            assertThat(table.column(KeyColumnAnalyzer.MAPPED_COUNT_COLUMN)).containsExactly(1, 0, 2, 0);
        }
    }
}
