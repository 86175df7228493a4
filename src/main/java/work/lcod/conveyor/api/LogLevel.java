package work.lcod.conveyor.api;

import java.util.Locale;

/**
 * Log thresholds accepted by the command-line tools.
 */
public enum LogLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    FATAL,
    OFF;

    public static final String SIMPLE_LOGGER_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    public static LogLevel from(String value) {
        if (value == null || value.isBlank()) {
            return WARN;
        }
        try {
            return LogLevel.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported log level: " + value);
        }
    }

    /**
     * Sets the slf4j-simple default level. Only loggers created afterwards pick it up, so call this
     * before the engine classes are first touched.
     */
    public void applyToSimpleLogger() {
        // slf4j has no fatal level
        var level = this == FATAL ? ERROR : this;
        System.setProperty(SIMPLE_LOGGER_LEVEL_PROPERTY, level.name().toLowerCase(Locale.ROOT));
    }
}
