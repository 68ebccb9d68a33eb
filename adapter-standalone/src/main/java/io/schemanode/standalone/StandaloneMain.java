package io.schemanode.standalone;

import io.schemanode.standalone.check.SchemaCheckApp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the standalone schema checker.
 *
 * <p>
 * Delegates to {@link SchemaCheckApp#run(String[], java.io.PrintStream)} and exits with its
 * status code: 0 when all data files conform, 1 when some do not, 2 when the configuration or
 * schema definition cannot be loaded.
 */
public final class StandaloneMain {

    private static final Logger LOG = LoggerFactory.getLogger(StandaloneMain.class);

    private StandaloneMain() {
        // utility class
    }

    /**
     * Application entry point.
     *
     * @param args command-line arguments (e.g. {@code --config path/to/schema-check.yaml})
     */
    @SuppressWarnings("SystemExitOutsideMain")
    public static void main(String[] args) {
        int status;
        try {
            status = SchemaCheckApp.run(args, System.out);
        } catch (Exception e) {
            LOG.error("Check failed: {}", e.getMessage(), e);
            status = SchemaCheckApp.EXIT_ERROR;
        }
        System.exit(status);
    }
}
