package org.pxukit.provider;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Directories searched for provider definitions.
 *
 * <p>Providers defined directly in one of the secure directories are trusted; additional
 * directories are searched after them.
 */
public record ProviderSearchPath(List<Path> secureDirectories, List<Path> additionalDirectories) {
    public static final List<Path> DEFAULT_SECURE_DIRECTORIES = List.of(
            Path.of("/usr/local/share/pxukit-providers-1"),
            Path.of("/usr/share/pxukit-providers-1"));

    public ProviderSearchPath {
        secureDirectories = normalize(secureDirectories, "secureDirectories");
        additionalDirectories = normalize(additionalDirectories, "additionalDirectories");
    }

    public static ProviderSearchPath defaults() {
        return new ProviderSearchPath(DEFAULT_SECURE_DIRECTORIES, List.of());
    }

    /**
     * Same secure directories, plus the entries of a path list such as {@code a:b:c}.
     */
    public ProviderSearchPath withPathList(final String pathList) {
        Objects.requireNonNull(pathList, "pathList");
        final List<Path> additional = new ArrayList<>(additionalDirectories);
        for (final String entry : pathList.split(File.pathSeparator)) {
            if (!entry.isBlank()) {
                additional.add(Path.of(entry.trim()));
            }
        }
        return new ProviderSearchPath(secureDirectories, additional);
    }

    /**
     * Secure directories first, then additional ones, without repetitions.
     */
    public List<Path> allDirectories() {
        final Set<Path> all = new LinkedHashSet<>(secureDirectories);
        all.addAll(additionalDirectories);
        return List.copyOf(all);
    }

    public boolean isSecure(final Path definitionFile) {
        final Path parent = Objects.requireNonNull(definitionFile, "definitionFile")
                .toAbsolutePath()
                .normalize()
                .getParent();
        return parent != null && secureDirectories.contains(parent);
    }

    private static List<Path> normalize(final List<Path> dirs, final String name) {
        final List<Path> normalized = new ArrayList<>();
        for (final Path dir : Objects.requireNonNull(dirs, name)) {
            normalized.add(Objects.requireNonNull(dir, name + " entry").toAbsolutePath().normalize());
        }
        return List.copyOf(normalized);
    }
}
