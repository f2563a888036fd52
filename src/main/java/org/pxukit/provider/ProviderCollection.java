package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import org.pxukit.obs.JsonLinesLogger;
import org.pxukit.obs.LoadCorrelation;

/**
 * Providers defined by the {@code .provider} files of a search path.
 *
 * <p>A definition that cannot be read or validated becomes a problem; the other definitions are
 * still loaded. Content of the providers is not loaded.
 */
public final class ProviderCollection {
    private final List<Provider> providers;
    private final List<ContentProblem> problems;

    private ProviderCollection(final List<Provider> providers, final List<ContentProblem> problems) {
        this.providers = List.copyOf(providers);
        this.problems = List.copyOf(problems);
    }

    public static ProviderCollection discover(final ProviderSearchPath searchPath) throws IOException {
        return discover(searchPath, JsonLinesLogger.noop());
    }

    /**
     * Loads every definition found directly in the directories of {@code searchPath}.
     *
     * @throws IOException when an existing directory cannot be listed
     */
    public static ProviderCollection discover(final ProviderSearchPath searchPath, final JsonLinesLogger logger)
            throws IOException {
        Objects.requireNonNull(searchPath, "searchPath");
        Objects.requireNonNull(logger, "logger");
        final List<Provider> providers = new ArrayList<>();
        final List<ContentProblem> problems = new ArrayList<>();
        for (final Path dir : searchPath.allDirectories()) {
            for (final Path definitionFile : definitionFiles(dir)) {
                final LoadCorrelation correlation =
                        LoadCorrelation.builder("discover", definitionFile.getFileName().toString())
                                .path(definitionFile.toString())
                                .build();
                try {
                    final ProviderDefinition definition = ProviderDefinitionLoader.load(definitionFile);
                    final Provider provider =
                            Provider.fromDefinition(definition, searchPath.isSecure(definitionFile), logger);
                    providers.add(provider);
                    logger.info("provider.discovered", correlation, Map.of(
                            "name", provider.name(),
                            "secure", provider.isSecure()));
                } catch (IOException | IllegalArgumentException e) {
                    problems.add(ContentProblem.of(definitionFile, ContentProblem.Kind.DEFINITION, e));
                    logger.warn("provider.definition.problem", correlation, Map.of(
                            "error", String.valueOf(e.getMessage())));
                }
            }
        }
        return new ProviderCollection(providers, problems);
    }

    public List<Provider> providers() {
        return providers;
    }

    public List<ContentProblem> problems() {
        return problems;
    }

    public Optional<Provider> find(final String name) {
        for (final Provider provider : providers) {
            if (provider.name().equals(name)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    private static List<Path> definitionFiles(final Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        final TreeSet<Path> files = new TreeSet<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir, "*" + ProviderDefinitionLoader.EXTENSION)) {
            for (final Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        }
        return List.copyOf(files);
    }
}
