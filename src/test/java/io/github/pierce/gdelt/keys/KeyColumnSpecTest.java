package io.github.pierce.gdelt.keys;

import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.ValidationException;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.source.SourceRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class KeyColumnSpecTest {

    @Nested
    @DisplayName("Validation against the join case")
    class Validation {

        @ParameterizedTest
        @EnumSource(JoinCase.class)
        @DisplayName("an empty spec is valid for every join case")
        void emptyIsAlwaysValid(JoinCase joinCase) {
            KeyColumnSpec spec = KeyColumnSpec.builder(joinCase).build();

            assertThat(spec.isEmpty()).isTrue();
            assertThat(spec.joinCase()).isEqualTo(joinCase);
        }

        @Test
        @DisplayName("a role outside the join case is rejected")
        void roleOutsideJoinCase() {
            KeyColumnSpec.Builder builder = KeyColumnSpec.builder(JoinCase.PRIMARY_SECONDARY)
                    .single(SourceRole.PRIMARY, "gkg_V2DOCUMENTIDENTIFIER")
                    .single(SourceRole.TERTIARY, "SOURCEURL");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("export");
        }

        @Test
        @DisplayName("paired keys are only accepted for mentions")
        void pairedOnlyForMentions() {
            KeyColumnSpec.Builder builder = KeyColumnSpec.builder(JoinCase.ALL_THREE)
                    .paired(SourceRole.PRIMARY, "gkg_GKGRECORDID", "gkg_V2DOCUMENTIDENTIFIER");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("single key column");
        }

        @Test
        @DisplayName("paired mentions keys need a three-way join")
        void pairedNeedsAllThree() {
            KeyColumnSpec.Builder builder = KeyColumnSpec.builder(JoinCase.PRIMARY_SECONDARY)
                    .paired(SourceRole.SECONDARY, "MentionIdentifier", "GlobalEventID");

            assertThatThrownBy(builder::build)
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("all_three");
        }

        @Test
        @DisplayName("a three-way spec with paired mentions keys is accepted")
        void allThreePaired() {
            KeyColumnSpec spec = KeyColumnSpec.builder(JoinCase.ALL_THREE)
                    .single(SourceRole.PRIMARY, "gkg_V2DOCUMENTIDENTIFIER")
                    .paired(SourceRole.SECONDARY, "MentionIdentifier", "GlobalEventID")
                    .single(SourceRole.TERTIARY, "GlobalEventID")
                    .build();

            KeyColumn mentions = spec.get(SourceRole.SECONDARY).orElseThrow();
            assertThat(mentions.towardsPrimary()).isEqualTo("MentionIdentifier");
            assertThat(mentions.towardsTertiary()).isEqualTo("GlobalEventID");
            assertThat(spec.roles()).containsExactly(SourceRole.PRIMARY, SourceRole.SECONDARY, SourceRole.TERTIARY);
        }
    }

    @Nested
    @DisplayName("Configuration shapes")
    class Shapes {

        @Test
        @DisplayName("map values may be a name or a list, keyed by file or role name")
        void fromMap() {
            KeyColumnSpec spec = KeyColumnSpec.fromMap(JoinCase.ALL_THREE, Map.of(
                    "gkg", "gkg_V2DOCUMENTIDENTIFIER",
                    "secondary", List.of("MentionIdentifier", "GlobalEventID"),
                    "export", List.of("GlobalEventID")));

            assertThat(spec.get(SourceRole.PRIMARY)).contains(KeyColumn.single("gkg_V2DOCUMENTIDENTIFIER"));
            assertThat(spec.get(SourceRole.SECONDARY)).contains(KeyColumn.paired("MentionIdentifier", "GlobalEventID"));
            assertThat(spec.get(SourceRole.TERTIARY)).contains(KeyColumn.single("GlobalEventID"));
        }

        @Test
        @DisplayName("unknown roles are rejected")
        void unknownRole() {
            assertThatThrownBy(() -> KeyColumnSpec.fromMap(JoinCase.ALL_THREE, Map.of("events", "GlobalEventID")))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("events");
        }

        @Test
        @DisplayName("JSON form")
        void fromJson() {
            KeyColumnSpec spec = KeyColumnSpec.fromJson(JoinCase.PRIMARY_TERTIARY,
                    "{\"gkg\": \"gkg_V2DOCUMENTIDENTIFIER\", \"export\": [\"SOURCEURL\"]}");

            assertThat(spec.get(SourceRole.TERTIARY).orElseThrow().columns()).containsExactly("SOURCEURL");
            assertThat(spec.has(SourceRole.SECONDARY)).isFalse();
        }

        @Test
        @DisplayName("malformed JSON is a configuration error")
        void malformedJson() {
            assertThatThrownBy(() -> KeyColumnSpec.fromJson(JoinCase.ALL_THREE, "{\"gkg\": "))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> KeyColumnSpec.fromJson(JoinCase.ALL_THREE, "[\"gkg\"]"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("object");
            assertThatThrownBy(() -> KeyColumnSpec.fromJson(JoinCase.ALL_THREE, "{\"gkg\": 5}"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("blank JSON means no key columns")
        void blankJson() {
            assertThat(KeyColumnSpec.fromJson(JoinCase.ALL_THREE, "  ").isEmpty()).isTrue();
        }

        @Test
        @DisplayName("key lists take one or two names")
        void listArity() {
            assertThatThrownBy(() -> KeyColumn.fromList(List.of()))
                    .isInstanceOf(ConfigurationException.class);
            assertThatThrownBy(() -> KeyColumn.fromList(List.of("a", "b", "c")))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("one or two");
            assertThatThrownBy(() -> KeyColumn.single(" "))
                    .isInstanceOf(ConfigurationException.class);
        }
    }
}
