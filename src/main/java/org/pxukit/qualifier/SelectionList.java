package org.pxukit.qualifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.pxukit.rfc822.Origin;

/**
 * Legacy selection list (formerly "whitelist"): one regular expression per line, matched against
 * whole unit identifiers.
 *
 * <p>Blank lines and lines starting with {@code #} are ignored. With an implicit namespace,
 * patterns that are not already qualified with {@code ::} only match identifiers in that
 * namespace.
 */
public final class SelectionList {
    private final String name;
    private final Origin origin;
    private final String implicitNamespace;
    private final List<String> patternTexts;
    private final List<Pattern> patterns;

    private SelectionList(
            final String name,
            final Origin origin,
            final String implicitNamespace,
            final List<String> patternTexts,
            final List<Pattern> patterns) {
        this.name = name;
        this.origin = origin;
        this.implicitNamespace = implicitNamespace;
        this.patternTexts = List.copyOf(patternTexts);
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Parses a selection list.
     *
     * @throws IllegalArgumentException when a line is not a valid regular expression
     */
    public static SelectionList fromText(
            final String text, final String name, final Origin origin, final String implicitNamespace) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(origin, "origin");
        final String namespace = implicitNamespace == null || implicitNamespace.isBlank() ? null : implicitNamespace;
        final List<String> texts = new ArrayList<>();
        final List<Pattern> compiled = new ArrayList<>();
        for (final String line : patternLines(text)) {
            final String qualified = namespace == null || line.contains("::")
                    ? line
                    : Pattern.quote(namespace + "::") + "(?:" + line + ")";
            try {
                compiled.add(Pattern.compile("^(?:" + qualified + ")$"));
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException(
                        "invalid pattern '" + line + "' in " + origin + ": " + e.getDescription(), e);
            }
            texts.add(line);
        }
        return new SelectionList(name, origin, namespace, texts, compiled);
    }

    /**
     * Meaningful pattern lines of {@code text}, stripped, without comments and blank lines.
     */
    public static List<String> patternLines(final String text) {
        final List<String> lines = new ArrayList<>();
        for (final String raw : Objects.requireNonNull(text, "text").split("\n")) {
            final String line = raw.strip();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            lines.add(line);
        }
        return List.copyOf(lines);
    }

    public String name() {
        return name;
    }

    public Origin origin() {
        return origin;
    }

    public Optional<String> implicitNamespace() {
        return Optional.ofNullable(implicitNamespace);
    }

    public List<String> patternTexts() {
        return patternTexts;
    }

    public List<Pattern> patterns() {
        return patterns;
    }

    public boolean designates(final String unitId) {
        Objects.requireNonNull(unitId, "unitId");
        for (final Pattern pattern : patterns) {
            if (pattern.matcher(unitId).matches()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "SelectionList{name=" + name + ", origin=" + origin + ", patterns=" + patternTexts.size() + "}";
    }
}
