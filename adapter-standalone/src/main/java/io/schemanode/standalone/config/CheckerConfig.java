package io.schemanode.standalone.config;

/**
 * Configuration of the standalone schema checker.
 *
 * <p>
 * All fields have defaults except {@code schemaPath}, which is required. Use {@link #builder()}
 * to construct instances.
 *
 * @param schemaPath    schema definition file (YAML or JSON)
 * @param dataDir       directory scanned for {@code *.json}, {@code *.yaml} and {@code *.yml}
 *                      data files
 * @param outputFormat  report format: text or json
 * @param failFast      stop after the first invalid data file
 * @param loggingFormat json or text
 * @param loggingLevel  root log level
 */
public record CheckerConfig(
        String schemaPath,
        String dataDir,
        String outputFormat,
        boolean failFast,
        String loggingFormat,
        String loggingLevel) {

    /** Creates a new builder with the documented defaults. */
    public static Builder builder() {
        return new Builder();
    }

    /** Builder for {@link CheckerConfig}. All fields have defaults except {@code schemaPath}. */
    public static final class Builder {
        private String schemaPath;
        private String dataDir = "./data";
        private String outputFormat = "text";
        private boolean failFast;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder schemaPath(String schemaPath) {
            this.schemaPath = schemaPath;
            return this;
        }

        public Builder dataDir(String dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder outputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder failFast(boolean failFast) {
            this.failFast = failFast;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        public CheckerConfig build() {
            return new CheckerConfig(schemaPath, dataDir, outputFormat, failFast, loggingFormat, loggingLevel);
        }
    }
}
