package io.github.pierce.gdelt.config;

import io.github.pierce.gdelt.ConfigurationException;
import io.github.pierce.gdelt.batch.OnErrorPolicy;
import io.github.pierce.gdelt.batch.ReturnMode;
import io.github.pierce.gdelt.batch.StatisticsLevel;
import io.github.pierce.gdelt.join.JoinCase;
import io.github.pierce.gdelt.keys.KeyColumnSpec;
import io.github.pierce.gdelt.output.OutputFormat;
import io.github.pierce.gdelt.quality.MappingQualityConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Loads a {@link BatchRunConfig} from YAML, then applies environment overrides.
 *
 * <p>The YAML file is looked up on the file system first and on the classpath second.
 * Recognised environment variables: {@code GDELT_JOIN_CASE}, {@code GDELT_STATISTICS},
 * {@code GDELT_ON_ERROR}, {@code GDELT_RETURN_MODE}, {@code GDELT_TIMESTAMP_START},
 * {@code GDELT_TIMESTAMP_END}, {@code GDELT_PARALLELISM} and {@code GDELT_KEY_COLUMNS}
 * (a JSON object shaped like the YAML {@code keyColumns} map).</p>
 */
public class BatchRunConfigLoader {

    public static final String DEFAULT_CONFIG_FILE = "gdelt-batch.yaml";

    public static final String ENV_JOIN_CASE = "GDELT_JOIN_CASE";
    public static final String ENV_STATISTICS = "GDELT_STATISTICS";
    public static final String ENV_ON_ERROR = "GDELT_ON_ERROR";
    public static final String ENV_RETURN_MODE = "GDELT_RETURN_MODE";
    public static final String ENV_TIMESTAMP_START = "GDELT_TIMESTAMP_START";
    public static final String ENV_TIMESTAMP_END = "GDELT_TIMESTAMP_END";
    public static final String ENV_PARALLELISM = "GDELT_PARALLELISM";
    public static final String ENV_KEY_COLUMNS = "GDELT_KEY_COLUMNS";

    private final UnaryOperator<String> environment;
    private final Logger log;

    public BatchRunConfigLoader() {
        this(System::getenv);
    }

    public BatchRunConfigLoader(UnaryOperator<String> environment) {
        this(environment, LoggerFactory.getLogger(BatchRunConfigLoader.class));
    }

    public BatchRunConfigLoader(UnaryOperator<String> environment, Logger log) {
        this.environment = environment;
        this.log = log;
    }

    public BatchRunConfig loadDefault() throws IOException {
        return load(DEFAULT_CONFIG_FILE);
    }

    public BatchRunConfig load(String fileName) throws IOException {
        Path path = Path.of(fileName);
        if (Files.isRegularFile(path)) {
            log.info("Loading batch configuration from {}", path.toAbsolutePath());
            try (InputStream in = Files.newInputStream(path)) {
                return load(in);
            }
        }
        try (InputStream in = BatchRunConfigLoader.class.getClassLoader().getResourceAsStream(fileName)) {
            if (in == null) {
                throw new IOException("Configuration file not found: " + fileName);
            }
            log.info("Loading batch configuration from classpath:{}", fileName);
            return load(in);
        }
    }

    public BatchRunConfig load(InputStream in) {
        Object document = new Yaml().load(in);
        Map<String, Object> yaml;
        if (document == null) {
            yaml = Map.of();
        } else if (document instanceof Map<?, ?> map) {
            yaml = asStringMap(map, "root");
        } else {
            throw new ConfigurationException("Batch configuration must be a YAML mapping");
        }
        return fromMap(yaml);
    }

    /**
     * Builds the configuration from an already parsed YAML mapping plus the environment.
     */
    public BatchRunConfig fromMap(Map<String, Object> yaml) {
        BatchRunConfig.Builder builder = BatchRunConfig.builder();

        String joinCaseName = override(ENV_JOIN_CASE, text(yaml.get("joinCase")));
        JoinCase joinCase = joinCaseName != null ? JoinCase.fromName(joinCaseName) : JoinCase.PRIMARY_ONLY;
        builder.joinCase(joinCase);

        String statistics = override(ENV_STATISTICS, text(yaml.get("statistics")));
        if (statistics != null) {
            builder.statisticsLevel(StatisticsLevel.fromName(statistics));
        }
        String onError = override(ENV_ON_ERROR, text(yaml.get("onError")));
        if (onError != null) {
            builder.onError(OnErrorPolicy.fromName(onError));
        }
        String returnMode = override(ENV_RETURN_MODE, text(yaml.get("returnMode")));
        if (returnMode != null) {
            builder.returnMode(ReturnMode.fromName(returnMode));
        }
        builder.timestampStart(override(ENV_TIMESTAMP_START, text(yaml.get("timestampStart"))));
        builder.timestampEnd(override(ENV_TIMESTAMP_END, text(yaml.get("timestampEnd"))));

        String parallelism = override(ENV_PARALLELISM, text(yaml.get("parallelism")));
        if (parallelism != null) {
            try {
                builder.parallelism(Integer.parseInt(parallelism.strip()));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid parallelism: " + parallelism);
            }
        }
        Object flatten = yaml.get("flattenMappingTables");
        if (flatten != null) {
            builder.flattenMappingTables(Boolean.parseBoolean(String.valueOf(flatten)));
        }

        String keyColumnsJson = environment.apply(ENV_KEY_COLUMNS);
        if (keyColumnsJson != null && !keyColumnsJson.isBlank()) {
            builder.keyColumnSpec(KeyColumnSpec.fromJson(joinCase, keyColumnsJson));
        } else if (yaml.get("keyColumns") instanceof Map<?, ?> keyColumns) {
            builder.keyColumns(asStringMap(keyColumns, "keyColumns"));
        }

        if (yaml.get("mappingQuality") instanceof Map<?, ?> quality) {
            Map<String, Object> q = asStringMap(quality, "mappingQuality");
            builder.mappingQuality(new MappingQualityConfig(
                    stringList(q.get("checkColumns"), "mappingQuality.checkColumns"),
                    text(q.get("identifierColumn"))));
        }

        if (yaml.get("filters") instanceof Map<?, ?> filters) {
            Map<String, Object> f = asStringMap(filters, "filters");
            builder.countryCodes(stringList(f.get("countryCodes"), "filters.countryCodes"));
            builder.themeTags(stringList(f.get("themeTags"), "filters.themeTags"));
        }
        builder.gkgColumnsToDrop(stringList(yaml.get("gkgColumnsToDrop"), "gkgColumnsToDrop"));
        builder.mentionsColumns(stringList(yaml.get("mentionsColumns"), "mentionsColumns"));
        builder.exportColumns(stringList(yaml.get("exportColumns"), "exportColumns"));

        if (yaml.get("paths") instanceof Map<?, ?> paths) {
            Map<String, Object> p = asStringMap(paths, "paths");
            String dictionary = text(p.get("dictionary"));
            if (dictionary != null) {
                builder.dictionaryPath(Path.of(dictionary));
            }
            String input = text(p.get("input"));
            if (input != null) {
                builder.inputDirectory(Path.of(input));
            }
            String output = text(p.get("output"));
            if (output != null) {
                builder.outputDirectory(Path.of(output));
            }
        }
        String outputFormat = text(yaml.get("outputFormat"));
        if (outputFormat != null) {
            builder.outputFormat(OutputFormat.fromName(outputFormat));
        }

        return builder.build();
    }

    private String override(String variable, String configured) {
        String value = environment.apply(variable);
        if (value != null && !value.isBlank()) {
            log.info("Using {} from environment", variable);
            return value.strip();
        }
        return configured;
    }

    /**
     * Scalars as text. Unquoted YAML timestamps arrive as numbers.
     */
    private static String text(Object value) {
        if (value == null) {
            return null;
        }
        String text = String.valueOf(value).strip();
        return text.isEmpty() ? null : text;
    }

    private static Map<String, Object> asStringMap(Map<?, ?> map, String where) {
        Map<String, Object> out = new LinkedHashMap<>();
        map.forEach((key, value) -> {
            if (!(key instanceof String name)) {
                throw new ConfigurationException("Keys under '" + where + "' must be strings, got " + key);
            }
            out.put(name, value);
        });
        return out;
    }

    private static List<String> stringList(Object value, String where) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ConfigurationException("'" + where + "' must be a list");
        }
        List<String> out = new ArrayList<>(list.size());
        for (Object element : list) {
            if (element != null) {
                out.add(String.valueOf(element));
            }
        }
        return out;
    }
}
