package org.pxukit.provider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;
import org.yaml.snakeyaml.resolver.Resolver;

/**
 * Loads {@code .provider} definition files (YAML) and validates them.
 */
public final class ProviderDefinitionLoader {
    public static final String EXTENSION = ".provider";

    private ProviderDefinitionLoader() {}

    public static ProviderDefinition load(final Path definitionPath) throws IOException {
        Objects.requireNonNull(definitionPath, "definitionPath");
        final Path normalized = definitionPath.toAbsolutePath().normalize();
        if (!Files.exists(normalized)) {
            throw new IllegalArgumentException("provider definition does not exist: " + normalized);
        }
        if (!Files.isRegularFile(normalized)) {
            throw new IllegalArgumentException("provider definition must be a file: " + normalized);
        }

        final String content = Files.readString(normalized, StandardCharsets.UTF_8);
        final ProviderDefinition definition = parse(content);
        ProviderDefinitionValidator.validateOrThrow(definition);
        return definition;
    }

    /**
     * Parses a definition without validating it.
     */
    public static ProviderDefinition parse(final String content) {
        Objects.requireNonNull(content, "content");
        final Object root;
        try {
            root = newYaml().load(content);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("provider definition is not valid YAML: " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("provider definition is empty");
        }
        if (!(root instanceof Map<?, ?> rawMap)) {
            throw new IllegalArgumentException("provider definition root must be a mapping");
        }
        final Map<String, Object> normalized = new LinkedHashMap<>();
        for (final Map.Entry<?, ?> entry : rawMap.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return ProviderDefinition.fromMap(normalized);
    }

    // Plain scalars stay strings, so versions such as 1.10 keep their text.
    private static Yaml newYaml() {
        final LoaderOptions loaderOptions = new LoaderOptions();
        final DumperOptions dumperOptions = new DumperOptions();
        return new Yaml(
                new SafeConstructor(loaderOptions),
                new Representer(dumperOptions),
                dumperOptions,
                loaderOptions,
                new Resolver() {
                    @Override
                    protected void addImplicitResolvers() {}
                });
    }
}
