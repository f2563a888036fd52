package org.pxukit.provider;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Raised when no classification rule accepts a path.
 */
public final class ClassificationException extends IllegalArgumentException {
    private final Path path;

    public ClassificationException(final Path path) {
        super("Unable to classify: '" + Objects.requireNonNull(path, "path") + "'");
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
