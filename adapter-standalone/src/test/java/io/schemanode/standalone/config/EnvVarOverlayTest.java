package io.schemanode.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the environment variable overlay on {@link ConfigLoader}.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is considered "set" if and only if it is
 * defined AND its trimmed value is non-empty. Uses a map-backed lookup instead of the real OS
 * environment.
 */
@DisplayName("Environment variable overlay")
class EnvVarOverlayTest {

    private final Map<String, String> envVars = new HashMap<>();

    private Path minimalConfigPath;
    private Path fullConfigPath;

    private Function<String, String> envLookup() {
        return envVars::get;
    }

    @BeforeEach
    void setUp() throws Exception {
        minimalConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/minimal-config.yaml")
                .toURI());
        fullConfigPath = Path.of(EnvVarOverlayTest.class
                .getClassLoader()
                .getResource("config/full-config.yaml")
                .toURI());
        envVars.clear();
    }

    @Test
    void everyKey_overriddenByEnvVar() {
        envVars.put("SCHEMA_PATH", "/opt/schemas/override.yaml");
        envVars.put("DATA_DIR", "/opt/data");
        envVars.put("OUTPUT_FORMAT", "text");
        envVars.put("FAIL_FAST", "false");
        envVars.put("LOG_FORMAT", "text");
        envVars.put("LOG_LEVEL", "WARN");

        CheckerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config).isEqualTo(
                new CheckerConfig("/opt/schemas/override.yaml", "/opt/data", "text", false, "text", "WARN"));
    }

    @Test
    void envVar_overridesDefaultWhenYamlIsSilent() {
        envVars.put("FAIL_FAST", "true");
        envVars.put("OUTPUT_FORMAT", "json");

        CheckerConfig config = ConfigLoader.load(minimalConfigPath, envLookup());

        assertThat(config.failFast()).isTrue();
        assertThat(config.outputFormat()).isEqualTo("json");
        assertThat(config.schemaPath()).isEqualTo("./schemas/order.yaml");
    }

    @Test
    void values_areTrimmed() {
        envVars.put("DATA_DIR", "  /srv/data  ");

        assertThat(ConfigLoader.load(minimalConfigPath, envLookup()).dataDir()).isEqualTo("/srv/data");
    }

    @Test
    void blankValues_areTreatedAsUnset() {
        envVars.put("SCHEMA_PATH", "");
        envVars.put("LOG_LEVEL", "   ");

        CheckerConfig config = ConfigLoader.load(fullConfigPath, envLookup());

        assertThat(config.schemaPath()).isEqualTo("/etc/schema-check/person.yaml");
        assertThat(config.loggingLevel()).isEqualTo("DEBUG");
    }

    @Test
    void unrelatedEnvVars_areIgnored() {
        envVars.put("PATH", "/usr/bin");
        envVars.put("SCHEMA", "ignored");

        assertThat(ConfigLoader.load(fullConfigPath, envLookup()).schemaPath())
                .isEqualTo("/etc/schema-check/person.yaml");
    }
}
