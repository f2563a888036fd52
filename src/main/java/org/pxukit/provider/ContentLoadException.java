package org.pxukit.provider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Failure to load the content of one file.
 */
public final class ContentLoadException extends RuntimeException {
    private final Path path;

    public ContentLoadException(final Path path, final String message) {
        this(path, message, null);
    }

    public ContentLoadException(final Path path, final String message, final Throwable cause) {
        super(message, cause);
        this.path = Objects.requireNonNull(path, "path");
    }

    public Path path() {
        return path;
    }
}
