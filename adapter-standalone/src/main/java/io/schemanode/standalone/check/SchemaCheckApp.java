package io.schemanode.standalone.check;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.schemanode.core.error.SchemaDefinitionException;
import io.schemanode.core.node.SchemaNode;
import io.schemanode.core.result.ValidationError;
import io.schemanode.core.result.ValidationResult;
import io.schemanode.core.spec.SchemaParser;
import io.schemanode.standalone.config.CheckerConfig;
import io.schemanode.standalone.config.ConfigLoadException;
import io.schemanode.standalone.config.ConfigLoader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one schema check: validates every data file in a directory against a schema definition
 * and reports the outcome.
 *
 * <p>
 * Sequence:
 * <ol>
 * <li>Load configuration from YAML + env overlay</li>
 * <li>Configure Logback from {@code logging.format} and {@code logging.level}</li>
 * <li>Parse the schema definition</li>
 * <li>Scan the data directory for {@code *.json}, {@code *.yaml} and {@code *.yml} files, sorted
 * by name</li>
 * <li>Validate each file, stopping at the first invalid one when fail-fast is enabled</li>
 * <li>Write the report</li>
 * </ol>
 *
 * <p>
 * This class is separate from {@link io.schemanode.standalone.StandaloneMain} so it can be
 * tested without going through {@code main()}.
 */
public final class SchemaCheckApp {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCheckApp.class);

    /** Every data file conforms. */
    public static final int EXIT_VALID = 0;
    /** At least one data file does not conform. */
    public static final int EXIT_INVALID = 1;
    /** Configuration, schema definition or data directory could not be loaded. */
    public static final int EXIT_ERROR = 2;

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private SchemaCheckApp() {
        // utility class
    }

    /**
     * Runs a check with environment overrides from {@link System#getenv}.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/schema-check.yaml})
     * @param out  stream the report is written to
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out) {
        return run(args, out, System::getenv);
    }

    /**
     * Runs a check with the given environment lookup.
     *
     * @param args      command-line arguments
     * @param out       stream the report is written to
     * @param envLookup environment variable lookup function
     * @return the process exit code
     */
    public static int run(String[] args, PrintStream out, Function<String, String> envLookup) {
        CheckerConfig config;
        Path configPath;
        try {
            configPath = ConfigLoader.resolveConfigPath(args);
            config = ConfigLoader.load(configPath, envLookup);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Configuration failed: {}", e.getMessage());
            return EXIT_ERROR;
        }

        LogbackConfigurator.configure(config);
        LOG.info("Configuration loaded from {}", configPath);

        SchemaNode schema;
        try {
            schema = new SchemaParser().parse(Path.of(config.schemaPath()));
        } catch (SchemaDefinitionException e) {
            LOG.error("Schema definition failed: {}", e.getMessage());
            return EXIT_ERROR;
        }

        List<Path> dataFiles;
        try {
            dataFiles = scanDataFiles(Path.of(config.dataDir()));
        } catch (IOException e) {
            LOG.error("Failed to scan data directory {}: {}", config.dataDir(), e.getMessage());
            return EXIT_ERROR;
        }
        LOG.info("Checking {} data files against {}", dataFiles.size(), config.schemaPath());

        List<FileResult> results = new ArrayList<>();
        for (Path dataFile : dataFiles) {
            FileResult result = check(schema, dataFile);
            results.add(result);
            if (!result.valid() && config.failFast()) {
                LOG.info("Stopping after first invalid file: {}", result.file());
                break;
            }
        }

        CheckReport report = new CheckReport(config.schemaPath(), results);
        new ReportWriter(config.outputFormat()).write(report, out);
        LOG.info("Check finished: valid={}, invalid={}", report.validCount(), report.invalidCount());
        return report.allValid() ? EXIT_VALID : EXIT_INVALID;
    }

    /**
     * Lists the data files of a directory, sorted by file name. Subdirectories are not descended
     * into.
     *
     * @throws IOException if the directory does not exist or cannot be listed
     */
    static List<Path> scanDataFiles(Path dataDir) throws IOException {
        if (!Files.isDirectory(dataDir)) {
            throw new IOException("not a directory: " + dataDir);
        }
        try (Stream<Path> entries = Files.list(dataDir)) {
            return entries.filter(Files::isRegularFile)
                    .filter(SchemaCheckApp::isDataFile)
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    static FileResult check(SchemaNode schema, Path dataFile) {
        String name = dataFile.getFileName().toString();
        JsonNode data;
        try {
            data = read(dataFile);
        } catch (IOException e) {
            String detail = e instanceof JsonProcessingException
                    ? ((JsonProcessingException) e).getOriginalMessage()
                    : e.getMessage();
            LOG.warn("Unreadable data file {}: {}", name, detail);
            return new FileResult(name, List.of(new ValidationError(
                    ValidationResult.ROOT_PATH, "Failed to read data file: " + detail)));
        }

        ValidationResult result = schema.validate(data);
        LOG.debug("Checked {}: errors={}", name, result.errors().size());
        return new FileResult(name, result.errors());
    }

    private static JsonNode read(Path dataFile) throws IOException {
        ObjectMapper mapper = extension(dataFile).equals("json") ? JSON_MAPPER : YAML_MAPPER;
        return mapper.readTree(Files.readString(dataFile));
    }

    private static boolean isDataFile(Path path) {
        String extension = extension(path);
        return extension.equals("json") || extension.equals("yaml") || extension.equals("yml");
    }

    private static String extension(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
