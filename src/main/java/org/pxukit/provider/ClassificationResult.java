package org.pxukit.provider;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import org.pxukit.unit.FileRole;

/**
 * Outcome of classifying one path.
 *
 * @param baseDirectory directory the path is relative to when the provider is relocated, may be
 *     {@code null} for unknown files of a provider without a base directory
 * @param loaderKind strategy to load the file with, {@code null} when the file is acknowledged but
 *     not loaded
 */
public record ClassificationResult(FileRole role, Path baseDirectory, LoaderKind loaderKind) {
    public ClassificationResult {
        Objects.requireNonNull(role, "role");
    }

    public Optional<LoaderKind> loader() {
        return Optional.ofNullable(loaderKind);
    }

    public Optional<Path> base() {
        return Optional.ofNullable(baseDirectory);
    }
}
