package io.schemanode.standalone.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Loads {@link CheckerConfig} from a YAML file with an optional environment variable overlay.
 *
 * <p>
 * Supports two invocation patterns:
 * <ul>
 * <li>Default: loads {@code schema-check.yaml} from the current directory</li>
 * <li>{@code --config /path/to/config.yaml}: loads from the specified path</li>
 * </ul>
 *
 * <p>
 * Expected layout (all sections optional except {@code schema.path}):
 *
 * <pre>
 * schema:
 *   path: ./schemas/person.yaml
 * data:
 *   dir: ./data
 * output:
 *   format: text
 *   fail-fast: false
 * logging:
 *   format: text
 *   level: INFO
 * </pre>
 *
 * <p>
 * Every key can be overridden by an environment variable ({@code SCHEMA_PATH},
 * {@code DATA_DIR}, {@code OUTPUT_FORMAT}, {@code FAIL_FAST}, {@code LOG_FORMAT},
 * {@code LOG_LEVEL}). Env vars take precedence over YAML values. An env var is considered "set"
 * if and only if it is defined AND its trimmed value is non-empty.
 */
public final class ConfigLoader {

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final String DEFAULT_CONFIG_FILE = "schema-check.yaml";
    private static final Set<String> FORMATS = Set.of("text", "json");
    private static final List<String> LEVEL_ORDER = List.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");
    private static final Set<String> LEVELS = Set.copyOf(LEVEL_ORDER);

    private ConfigLoader() {
        // utility class
    }

    /**
     * Loads a {@link CheckerConfig} from the given YAML file, applying environment variable
     * overrides from {@link System#getenv}.
     *
     * @param configPath path to the YAML configuration file
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, contains invalid YAML, or describes an
     *     invalid configuration
     */
    public static CheckerConfig load(Path configPath) {
        return load(configPath, System::getenv);
    }

    /**
     * Loads a {@link CheckerConfig} from the given YAML file, applying environment variable
     * overrides from the supplied lookup function. Returning {@code null} from the lookup means
     * the variable is not defined.
     *
     * @param configPath path to the YAML configuration file
     * @param envLookup  environment variable lookup function
     * @return the validated configuration
     * @throws ConfigLoadException if the file is missing, contains invalid YAML, or describes an
     *     invalid configuration
     */
    public static CheckerConfig load(Path configPath, Function<String, String> envLookup) {
        if (!Files.exists(configPath)) {
            throw new ConfigLoadException(
                    "Configuration file not found: " + configPath + ". Use --config <path> to specify a config file.");
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(configPath)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new ConfigLoadException("Failed to parse YAML configuration: " + configPath, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            // empty file: defaults and env overrides only
            root = YAML_MAPPER.createObjectNode();
        } else if (!root.isObject()) {
            throw new ConfigLoadException("Configuration must be a YAML mapping: " + configPath);
        }

        CheckerConfig config = mapToConfig(root, envLookup);
        validate(config);
        return config;
    }

    /**
     * Resolves the config file path from CLI arguments.
     *
     * @param args command-line arguments
     * @return the resolved config file path
     * @throws IllegalArgumentException if {@code --config} has no value
     */
    public static Path resolveConfigPath(String[] args) {
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i])) {
                if (i + 1 >= args.length) {
                    throw new IllegalArgumentException("--config requires a file path argument");
                }
                return Path.of(args[i + 1]);
            }
        }
        return Path.of(DEFAULT_CONFIG_FILE);
    }

    private static CheckerConfig mapToConfig(JsonNode root, Function<String, String> envLookup) {
        CheckerConfig.Builder builder = CheckerConfig.builder();

        // --- YAML mapping ---

        JsonNode schema = root.path("schema");
        if (schema.has("path")) builder.schemaPath(schema.get("path").asText());

        JsonNode data = root.path("data");
        if (data.has("dir")) builder.dataDir(data.get("dir").asText());

        JsonNode output = root.path("output");
        if (output.has("format")) builder.outputFormat(output.get("format").asText());
        if (output.has("fail-fast")) builder.failFast(output.get("fail-fast").asBoolean());

        JsonNode logging = root.path("logging");
        if (logging.has("format")) builder.loggingFormat(logging.get("format").asText());
        if (logging.has("level")) builder.loggingLevel(logging.get("level").asText());

        // --- Environment variable overlay ---

        envString(envLookup, "SCHEMA_PATH", builder::schemaPath);
        envString(envLookup, "DATA_DIR", builder::dataDir);
        envString(envLookup, "OUTPUT_FORMAT", builder::outputFormat);
        envBool(envLookup, "FAIL_FAST", builder::failFast);
        envString(envLookup, "LOG_FORMAT", builder::loggingFormat);
        envString(envLookup, "LOG_LEVEL", builder::loggingLevel);

        return builder.build();
    }

    private static void validate(CheckerConfig config) {
        if (config.schemaPath() == null || config.schemaPath().isBlank()) {
            throw new ConfigLoadException("schema.path is required (or set SCHEMA_PATH)");
        }
        if (config.dataDir() == null || config.dataDir().isBlank()) {
            throw new ConfigLoadException("data.dir must not be empty");
        }
        if (!isFormat(config.outputFormat())) {
            throw new ConfigLoadException(
                    "output.format must be 'text' or 'json', got '" + config.outputFormat() + "'");
        }
        if (!isFormat(config.loggingFormat())) {
            throw new ConfigLoadException(
                    "logging.format must be 'text' or 'json', got '" + config.loggingFormat() + "'");
        }
        if (config.loggingLevel() == null || !LEVELS.contains(config.loggingLevel().toUpperCase(Locale.ROOT))) {
            throw new ConfigLoadException(
                    "logging.level must be one of " + String.join(", ", LEVEL_ORDER) + ", got '"
                            + config.loggingLevel() + "'");
        }
    }

    private static boolean isFormat(String value) {
        return value != null && FORMATS.contains(value.toLowerCase(Locale.ROOT));
    }

    // --- Env var helpers ---

    /** Returns {@code true} if the env var is "set": defined AND non-blank after trimming. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.trim().isEmpty();
    }

    /** Applies a string env var override if set. */
    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    /** Applies a boolean env var override if set. */
    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }
}
