package org.pxukit.provider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Recoverable failure recorded while loading provider content.
 *
 * @param path file or directory the problem is attributed to
 * @param cause underlying exception, may be {@code null}
 */
public record ContentProblem(Path path, Kind kind, String message, Exception cause) {
    public ContentProblem {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static ContentProblem of(final Path path, final Kind kind, final Exception cause) {
        Objects.requireNonNull(cause, "cause");
        final String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new ContentProblem(path, kind, message, cause);
    }

    /**
     * The problem as an exception that can be rethrown by callers that do not tolerate problems.
     */
    public RuntimeException asException() {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return new ContentLoadException(path, message, cause);
    }

    @Override
    public String toString() {
        return path + ": " + message;
    }

    public enum Kind {
        ENUMERATION,
        CLASSIFICATION,
        LOAD,
        DEFINITION
    }
}
