package org.pxukit.obs;

import java.util.Collections;
import java.util.Map;

/**
 * Minimal structured logger that writes one JSON object per line.
 */
public interface JsonLinesLogger extends AutoCloseable {
    void log(String level, String message, LoadCorrelation correlation, Map<String, ?> fields);

    default void log(String level, String message, LoadCorrelation correlation) {
        log(level, message, correlation, Collections.emptyMap());
    }

    default void debug(String message, LoadCorrelation correlation, Map<String, ?> fields) {
        log("DEBUG", message, correlation, fields);
    }

    default void info(String message, LoadCorrelation correlation, Map<String, ?> fields) {
        log("INFO", message, correlation, fields);
    }

    default void info(String message, LoadCorrelation correlation) {
        info(message, correlation, Collections.emptyMap());
    }

    default void warn(String message, LoadCorrelation correlation, Map<String, ?> fields) {
        log("WARN", message, correlation, fields);
    }

    default void error(String message, LoadCorrelation correlation, Map<String, ?> fields) {
        log("ERROR", message, correlation, fields);
    }

    default void error(String message, LoadCorrelation correlation) {
        error(message, correlation, Collections.emptyMap());
    }

    @Override
    void close();

    /**
     * Logger that drops every event.
     */
    static JsonLinesLogger noop() {
        return NoopLogger.INSTANCE;
    }

    final class NoopLogger implements JsonLinesLogger {
        private static final NoopLogger INSTANCE = new NoopLogger();

        private NoopLogger() {}

        @Override
        public void log(String level, String message, LoadCorrelation correlation, Map<String, ?> fields) {}

        @Override
        public void close() {}
    }
}
