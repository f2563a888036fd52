package org.pxukit.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Deferred access to the text of one content file.
 */
@FunctionalInterface
public interface LazyText {
    String read() throws IOException;

    static LazyText ofFile(final Path path) {
        Objects.requireNonNull(path, "path");
        return () -> Files.readString(path, StandardCharsets.UTF_8);
    }

    static LazyText of(final String text) {
        Objects.requireNonNull(text, "text");
        return () -> text;
    }
}
