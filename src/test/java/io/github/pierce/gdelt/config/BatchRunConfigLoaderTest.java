package io.github.pierce.gdelt.config;

import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.batch.BatchRequest;
import io.github.pierce.gdelt.batch.OnErrorPolicy;
import io.github.pierce.gdelt.batch.ReturnMode;
import io.github.pierce.gdelt.batch.StatisticsLevel;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.keys.KeyColumn;
import io.github.pierce.gdelt.output.OutputFormat;
import io.github.pierce.gdelt.source.SourceRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class BatchRunConfigLoaderTest {

    private static final BatchRunConfigLoader NO_ENV = new BatchRunConfigLoader(name -> null);

    private static InputStream yaml(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Nested
    @DisplayName("YAML")
    class Yaml {

        @Test
        @DisplayName("reads every section of a full configuration")
        void fullConfiguration() throws IOException {
            BatchRunConfig config = NO_ENV.load("gdelt-batch-test.yaml");

            assertThat(config.getJoinCase()).isEqualTo(JoinCase.ALL_THREE);
            assertThat(config.getStatisticsLevel()).isEqualTo(StatisticsLevel.ALL);
            assertThat(config.getOnError()).isEqualTo(OnErrorPolicy.SKIP);
            assertThat(config.getReturnMode()).isEqualTo(ReturnMode.LEGACY_TUPLE);
            assertThat(config.getParallelism()).isEqualTo(4);
            assertThat(config.isFlattenMappingTables()).isFalse();
            assertThat(config.getTimestampStart()).isEqualTo("20251201143000");
            assertThat(config.getKeyColumnSpec().get(SourceRole.SECONDARY))
                    .contains(KeyColumn.paired("MentionIdentifier", "GlobalEventID"));
            assertThat(config.getMappingQuality().checkColumns()).containsExactly("gkg_ACTUAL_TONE", "Export_AvgTone");
            assertThat(config.getCountryCodes()).containsExactly("FR", "GM");
            assertThat(config.getThemeTags()).containsExactly("EPU", "TAX");
            assertThat(config.getGkgColumnsToDrop()).containsExactly("V2GCAM", "V2EXTRASXML");
            assertThat(config.toJoinColumns().tertiaryColumns()).containsExactly("AvgTone", "Actor1Geo_CountryCode");
            assertThat(config.getDictionaryPath()).isEqualTo(Path.of("headers/GDELT_headers.xlsx"));
            assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.XLSX);
        }

        @Test
        @DisplayName("converts to a batch request over the configured range")
        void toRequest() throws IOException {
            BatchRequest request = NO_ENV.load("gdelt-batch-test.yaml").toRequest();

            assertThat(request.timestamps()).containsExactly("20251201143000", "20251201144500", "20251201150000");
            assertThat(request.getParallelism()).isEqualTo(4);
            assertThat(request.getBaseInstant().keyColumnSpec().joinCase()).isEqualTo(JoinCase.ALL_THREE);
        }

        @Test
        @DisplayName("the bundled defaults load")
        void bundledDefaults() throws IOException {
            BatchRunConfig config = NO_ENV.loadDefault();

            assertThat(config.getJoinCase()).isEqualTo(JoinCase.PRIMARY_ONLY);
            assertThat(config.getStatisticsLevel()).isEqualTo(StatisticsLevel.NONE);
            assertThat(config.getKeyColumnSpec().isEmpty()).isTrue();
            assertThat(config.getGkgColumnsToDrop()).contains("V2GCAM");
        }

        @Test
        @DisplayName("a file on disk wins over the classpath")
        void fileOnDisk(@TempDir Path dir) throws IOException {
            Path file = dir.resolve("run.yaml");
            Files.writeString(file, "joinCase: gkg_export\n");

            assertThat(NO_ENV.load(file.toString()).getJoinCase()).isEqualTo(JoinCase.PRIMARY_TERTIARY);
        }

        @Test
        @DisplayName("an empty document gives the defaults")
        void emptyDocument() {
            BatchRunConfig config = NO_ENV.load(yaml(""));

            assertThat(config.getJoinCase()).isEqualTo(JoinCase.PRIMARY_ONLY);
            assertThat(config.getOutputDirectory()).isEqualTo(Path.of("Output"));
        }

        @Test
        @DisplayName("an unknown file is reported")
        void unknownFile() {
            assertThatThrownBy(() -> NO_ENV.load("does-not-exist.yaml"))
                    .isInstanceOf(IOException.class)
                    .hasMessageContaining("does-not-exist.yaml");
        }

        @Test
        @DisplayName("key columns that do not fit the join case are rejected at load time")
        void invalidKeyColumns() {
            assertThatThrownBy(() -> NO_ENV.load(yaml("joinCase: gkg_mentions\nkeyColumns:\n  export: SOURCEURL\n")))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("bad scalars are rejected")
        void badScalars() {
            assertThatThrownBy(() -> NO_ENV.load(yaml("statistics: Yes please\n")))
                    .isInstanceOf(ValidationException.class);
            assertThatThrownBy(() -> NO_ENV.load(yaml("parallelism: many\n")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> NO_ENV.load(yaml("- just\n- a list\n")))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> NO_ENV.load(yaml("gkgColumnsToDrop: V2GCAM\n")))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Environment overrides")
    class EnvironmentOverrides {

        @Test
        @DisplayName("replace scalar settings")
        void replaceScalars() throws IOException {
            Map<String, String> env = Map.of(
                    BatchRunConfigLoader.ENV_JOIN_CASE, "primary_tertiary",
                    BatchRunConfigLoader.ENV_STATISTICS, "key_columns_stats",
                    BatchRunConfigLoader.ENV_ON_ERROR, "raise",
                    BatchRunConfigLoader.ENV_TIMESTAMP_START, "20250101000000",
                    BatchRunConfigLoader.ENV_TIMESTAMP_END, " ",
                    BatchRunConfigLoader.ENV_PARALLELISM, "2",
                    BatchRunConfigLoader.ENV_KEY_COLUMNS, "{\"gkg\": \"gkg_V2DOCUMENTIDENTIFIER\", \"export\": \"SOURCEURL\"}");

            BatchRunConfig config = new BatchRunConfigLoader(env::get).load("gdelt-batch-test.yaml");

            assertThat(config.getJoinCase()).isEqualTo(JoinCase.PRIMARY_TERTIARY);
            assertThat(config.getStatisticsLevel()).isEqualTo(StatisticsLevel.KEY_COLUMNS_STATS);
            assertThat(config.getOnError()).isEqualTo(OnErrorPolicy.RAISE);
            assertThat(config.getTimestampStart()).isEqualTo("20250101000000");
            assertThat(config.getTimestampEnd()).isEqualTo("20251201150000");
            assertThat(config.getParallelism()).isEqualTo(2);
            assertThat(config.getKeyColumnSpec().get(SourceRole.TERTIARY)).contains(KeyColumn.single("SOURCEURL"));
            assertThat(config.getReturnMode()).isEqualTo(ReturnMode.LEGACY_TUPLE);
        }

        @Test
        @DisplayName("a changed join case without new key columns invalidates the YAML ones")
        void joinCaseOverrideChecksKeys() {
            Map<String, String> env = Map.of(BatchRunConfigLoader.ENV_JOIN_CASE, "gkg_only");

            assertThatThrownBy(() -> new BatchRunConfigLoader(env::get).load("gdelt-batch-test.yaml"))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
