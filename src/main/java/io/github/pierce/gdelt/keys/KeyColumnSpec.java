package io.github.pierce.gdelt.keys;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.source.SourceRole;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Key columns per source role, checked once against the join case they are used with.
 *
 * <p>Rules: every role must be part of the join case; the primary and tertiary tables take
 * a single key; the secondary table takes a paired key only in a three-way join. An empty
 * spec is always valid.</p>
 */
public final class KeyColumnSpec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JoinCase joinCase;
    private final Map<SourceRole, KeyColumn> keys;

    private KeyColumnSpec(JoinCase joinCase, Map<SourceRole, KeyColumn> keys) {
        this.joinCase = joinCase;
        this.keys = Collections.unmodifiableMap(new EnumMap<>(keys));
    }

    public static KeyColumnSpec empty(JoinCase joinCase) {
        return new KeyColumnSpec(joinCase, new EnumMap<>(SourceRole.class));
    }

    public static Builder builder(JoinCase joinCase) {
        return new Builder(joinCase);
    }

    /**
     * Builds a spec from a role-name keyed map whose values are a column name or a list of one
     * or two names, as found in YAML configuration.
     */
    public static KeyColumnSpec fromMap(JoinCase joinCase, Map<String, ?> raw) {
        Builder builder = builder(joinCase);
        if (raw != null) {
            raw.forEach((roleName, value) -> builder.key(SourceRole.fromName(roleName), toKey(roleName, value)));
        }
        return builder.build();
    }

    /**
     * Parses the JSON object form, e.g. {@code {"gkg": ["GKGRECORDID"], "mentions": ["MentionIdentifier", "GlobalEventID"]}}.
     */
    public static KeyColumnSpec fromJson(JoinCase joinCase, String json) {
        if (json == null || json.isBlank()) {
            return empty(joinCase);
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid key column JSON: " + e.getOriginalMessage());
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Key column JSON must be an object, got " + root.getNodeType());
        }
        Builder builder = builder(joinCase);
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            List<String> names = new ArrayList<>();
            if (value.isTextual()) {
                names.add(value.asText());
            } else if (value.isArray()) {
                for (JsonNode element : value) {
                    if (!element.isTextual()) {
                        throw new ConfigurationException("Key column names for '" + field.getKey() + "' must be strings");
                    }
                    names.add(element.asText());
                }
            } else {
                throw new ConfigurationException("Key columns for '" + field.getKey() + "' must be a string or a list");
            }
            builder.key(SourceRole.fromName(field.getKey()), KeyColumn.fromList(names));
        }
        return builder.build();
    }

    private static KeyColumn toKey(String roleName, Object value) {
        if (value instanceof KeyColumn key) {
            return key;
        }
        if (value instanceof String name) {
            return KeyColumn.single(name);
        }
        if (value instanceof List<?> list) {
            List<String> names = new ArrayList<>(list.size());
            for (Object element : list) {
                if (!(element instanceof String name)) {
                    throw new ConfigurationException("Key column names for '" + roleName + "' must be strings");
                }
                names.add(name);
            }
            return KeyColumn.fromList(names);
        }
        throw new ConfigurationException("Key columns for '" + roleName + "' must be a string or a list, got " + value);
    }

    public JoinCase joinCase() {
        return joinCase;
    }

    public Optional<KeyColumn> get(SourceRole role) {
        return Optional.ofNullable(keys.get(role));
    }

    public boolean has(SourceRole role) {
        return keys.containsKey(role);
    }

    public Set<SourceRole> roles() {
        return keys.keySet();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public Map<SourceRole, KeyColumn> asMap() {
        return keys;
    }

    @Override
    public String toString() {
        return "KeyColumnSpec[" + joinCase.configName() + ", " + keys + "]";
    }

    public static final class Builder {
        private final JoinCase joinCase;
        private final Map<SourceRole, KeyColumn> keys = new EnumMap<>(SourceRole.class);

        private Builder(JoinCase joinCase) {
            if (joinCase == null) {
                throw new ConfigurationException("Join case is required for a key column spec");
            }
            this.joinCase = joinCase;
        }

        public Builder key(SourceRole role, KeyColumn key) {
            keys.put(role, key);
            return this;
        }

        public Builder single(SourceRole role, String name) {
            return key(role, KeyColumn.single(name));
        }

        public Builder paired(SourceRole role, String first, String second) {
            return key(role, KeyColumn.paired(first, second));
        }

        public KeyColumnSpec build() {
            keys.forEach(this::validate);
            return new KeyColumnSpec(joinCase, keys);
        }

        private void validate(SourceRole role, KeyColumn key) {
            if (!joinCase.includes(role)) {
                throw new ConfigurationException("Key columns given for " + role.fileKey()
                        + " but join case " + joinCase.configName() + " does not use it");
            }
            if (key instanceof KeyColumn.PairedKey) {
                if (role != SourceRole.SECONDARY) {
                    throw new ConfigurationException(role.fileKey() + " takes a single key column, got " + key.columns());
                }
                if (joinCase != JoinCase.ALL_THREE) {
                    throw new ConfigurationException("Paired key columns for mentions are only valid for join case "
                            + JoinCase.ALL_THREE.configName() + ", got " + joinCase.configName());
                }
            }
        }
    }
}
