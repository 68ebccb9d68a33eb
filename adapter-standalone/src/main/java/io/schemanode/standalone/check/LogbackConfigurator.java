package io.schemanode.standalone.check;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.JsonEncoder;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.encoder.Encoder;
import io.schemanode.standalone.config.CheckerConfig;
import java.util.Map;
import org.slf4j.LoggerFactory;

/**
 * Points Logback at stderr once the checker configuration is known.
 *
 * <p>
 * The report owns stdout, so every log event goes to a single {@code STDERR} console appender,
 * encoded by Logback's {@link JsonEncoder} for {@code logging.format: json} or by
 * {@link #TEXT_PATTERN} otherwise. Third-party loggers listed in {@link #QUIET_LOGGERS} are capped
 * regardless of the configured root level.
 */
public final class LogbackConfigurator {

    static final String APPENDER_NAME = "STDERR";

    /** Pattern for {@code logging.format: text}. */
    static final String TEXT_PATTERN = "%d{HH:mm:ss.SSS} %-5level %logger{36} - %msg%n";

    /** Definition structure checks log every keyword at DEBUG. */
    static final Map<String, Level> QUIET_LOGGERS = Map.of("com.networknt", Level.WARN);

    private LogbackConfigurator() {
        // utility class
    }

    /**
     * Replaces the root appender and level from {@code logging.format} and {@code logging.level}.
     *
     * @param config a configuration already checked by the config loader
     * @throws IllegalArgumentException if the level is not a Logback level name
     */
    public static void configure(CheckerConfig config) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        Logger root = context.getLogger(Logger.ROOT_LOGGER_NAME);

        root.setLevel(level(config.loggingLevel()));
        root.detachAndStopAllAppenders();
        root.addAppender(stderrAppender(context, config.loggingFormat()));

        QUIET_LOGGERS.forEach((name, cap) -> context.getLogger(name).setLevel(cap));
    }

    static Level level(String name) {
        Level level = Level.toLevel(name, null);
        if (level == null || level == Level.ALL || level == Level.OFF) {
            throw new IllegalArgumentException("Unsupported log level: " + name);
        }
        return level;
    }

    private static ConsoleAppender<ILoggingEvent> stderrAppender(LoggerContext context, String format) {
        ConsoleAppender<ILoggingEvent> appender = new ConsoleAppender<>();
        appender.setContext(context);
        appender.setName(APPENDER_NAME);
        appender.setTarget("System.err");
        appender.setEncoder(encoder(context, format));
        appender.start();
        return appender;
    }

    private static Encoder<ILoggingEvent> encoder(LoggerContext context, String format) {
        if ("json".equalsIgnoreCase(format)) {
            JsonEncoder json = new JsonEncoder();
            json.setContext(context);
            json.start();
            return json;
        }
        PatternLayoutEncoder text = new PatternLayoutEncoder();
        text.setContext(context);
        text.setPattern(TEXT_PATTERN);
        text.start();
        return text;
    }
}
