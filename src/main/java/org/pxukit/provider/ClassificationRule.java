package org.pxukit.provider;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Named predicate of the classifier chain; an empty result passes the path to the next rule.
 */
public record ClassificationRule(String name, Function<Path, Optional<ClassificationResult>> function) {
    public ClassificationRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(function, "function");
    }

    public Optional<ClassificationResult> apply(final Path path) {
        return Objects.requireNonNull(function.apply(path), "rule " + name + " returned null");
    }
}
