package org.pxukit.provider;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.pxukit.unit.FileRole;

/**
 * Assigns a role, a base directory and a load strategy to every file of a provider.
 *
 * <p>The rule chain is built once from the directories the provider declares. Rules are tried in
 * order and the first match wins, so rules for specific directories come before the rules that
 * apply anywhere under the base directory. The last rule accepts every path.
 */
public final class ContentClassifier {
    static final Set<String> LEGAL_NAMES = Set.of("COPYING", "COPYING.LESSER", "LICENSE");
    static final Set<String> DOC_NAMES = Set.of("README", "README.md", "README.rst", "README.txt");
    static final String EXECUTABLES_HINT = "EXECUTABLES";

    private static final List<String> JOB_SUFFIXES = List.of(".txt", ".in", ".pxu");
    private static final List<String> UNIT_SUFFIXES = List.of(".txt", ".txt.in", ".pxu");
    private static final Set<String> VCS_IGNORE_NAMES = Set.of(".gitignore", ".bzrignore");
    private static final Set<String> VCS_DIR_NAMES = Set.of(".git", ".bzr");

    private final ProviderLayout layout;
    private final List<ClassificationRule> rules;
    private Set<String> executables;

    public ContentClassifier(final ProviderLayout layout) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.rules = List.copyOf(buildRules());
    }

    /**
     * Classifies {@code path}.
     *
     * @throws ClassificationException when no rule accepts the path
     * @throws UncheckedIOException when an executable cannot be inspected
     */
    public ClassificationResult classify(final Path path) {
        final Path normalized = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        for (final ClassificationRule rule : rules) {
            final Optional<ClassificationResult> result = rule.apply(normalized);
            if (result.isPresent()) {
                return result.get();
            }
        }
        throw new ClassificationException(normalized);
    }

    public List<ClassificationRule> rules() {
        return rules;
    }

    public List<String> ruleNames() {
        final List<String> names = new ArrayList<>(rules.size());
        for (final ClassificationRule rule : rules) {
            names.add(rule.name());
        }
        return List.copyOf(names);
    }

    /**
     * Names listed in {@code src/EXECUTABLES}, the executables expected to be built from source.
     */
    public Set<String> executables() {
        if (executables == null) {
            executables = readExecutablesHint(layout);
        }
        return executables;
    }

    private List<ClassificationRule> buildRules() {
        final List<ClassificationRule> chain = new ArrayList<>();
        layout.jobsDir().ifPresent(dir -> chain.add(new ClassificationRule("jobs", path ->
                under(path, dir) && hasSuffix(path, JOB_SUFFIXES)
                        ? result(FileRole.UNIT_SOURCE, dir, LoaderKind.UNIT_SOURCE)
                        : Optional.empty())));
        layout.unitsDir().ifPresent(dir -> chain.add(new ClassificationRule("units", path ->
                under(path, dir) && hasSuffix(path, UNIT_SUFFIXES)
                        ? result(FileRole.UNIT_SOURCE, dir, LoaderKind.UNIT_SOURCE)
                        : Optional.empty())));
        layout.whitelistsDir().ifPresent(dir -> chain.add(new ClassificationRule("whitelists", path ->
                under(path, dir) && hasSuffix(path, List.of(".whitelist"))
                        ? result(FileRole.LEGACY_WHITELIST, dir, LoaderKind.SELECTION_LIST)
                        : Optional.empty())));
        layout.dataDir().ifPresent(dir -> chain.add(new ClassificationRule("data", path ->
                under(path, dir) ? result(FileRole.DATA, dir, LoaderKind.PASSIVE) : Optional.empty())));
        layout.binDir().ifPresent(dir -> chain.add(new ClassificationRule("bin", path ->
                under(path, dir) && isExecutable(path)
                        ? result(executableRole(path), dir, LoaderKind.PASSIVE)
                        : Optional.empty())));
        layout.buildBinDir().ifPresent(dir -> chain.add(new ClassificationRule("build-bin", path ->
                under(path, dir) && isExecutable(path) && executables().contains(fileName(path))
                        ? result(executableRole(path), dir, LoaderKind.PASSIVE)
                        : Optional.empty())));
        layout.buildMoDir().ifPresent(dir -> chain.add(new ClassificationRule("build-mo", path ->
                under(path, dir) && hasSuffix(path, List.of(".mo"))
                        ? result(FileRole.I18N, dir, LoaderKind.PASSIVE)
                        : Optional.empty())));
        layout.buildDir().ifPresent(dir -> chain.add(new ClassificationRule("build", path ->
                under(path, dir) ? result(FileRole.BUILD, dir, null) : Optional.empty())));

        final Path base = layout.baseDir().orElse(null);
        layout.poDir().ifPresent(dir -> chain.add(new ClassificationRule("po", path ->
                dir.equals(path.getParent()) && isTranslationSource(fileName(path))
                        ? result(FileRole.SRC, base, null)
                        : Optional.empty())));
        layout.srcDir().ifPresent(dir -> chain.add(new ClassificationRule("src", path ->
                under(path, dir) ? result(FileRole.SRC, base, null) : Optional.empty())));
        if (base != null) {
            chain.add(new ClassificationRule("legal", path ->
                    LEGAL_NAMES.contains(fileName(path)) ? result(FileRole.LEGAL, base, null) : Optional.empty()));
            chain.add(new ClassificationRule("docs", path ->
                    DOC_NAMES.contains(fileName(path)) ? result(FileRole.DOCS, base, null) : Optional.empty()));
            chain.add(new ClassificationRule("manage.py", path ->
                    path.equals(base.resolve("manage.py"))
                            ? result(FileRole.MANAGE_PY, base, null)
                            : Optional.empty()));
            chain.add(new ClassificationRule("vcs", path ->
                    isVersionControl(path, base) ? result(FileRole.VCS, base, null) : Optional.empty()));
        }
        chain.add(new ClassificationRule("unknown", path -> result(FileRole.UNKNOWN, base, null)));
        return chain;
    }

    private static Optional<ClassificationResult> result(final FileRole role, final Path base, final LoaderKind kind) {
        return Optional.of(new ClassificationResult(role, base, kind));
    }

    private static boolean under(final Path path, final Path dir) {
        return path.startsWith(dir) && !path.equals(dir);
    }

    private static String fileName(final Path path) {
        final Path name = path.getFileName();
        return name == null ? "" : name.toString();
    }

    private static boolean hasSuffix(final Path path, final List<String> suffixes) {
        final String name = fileName(path);
        for (final String suffix : suffixes) {
            if (name.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTranslationSource(final String name) {
        return name.endsWith(".po") || name.endsWith(".pot") || "POTFILES.in".equals(name);
    }

    private static boolean isExecutable(final Path path) {
        return Files.isRegularFile(path) && Files.isExecutable(path);
    }

    private static FileRole executableRole(final Path path) {
        final byte[] head;
        try (InputStream in = Files.newInputStream(path)) {
            head = in.readNBytes(2);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot inspect executable '" + path + "'", e);
        }
        return head.length == 2 && head[0] == '#' && head[1] == '!' ? FileRole.SCRIPT : FileRole.BINARY;
    }

    private static boolean isVersionControl(final Path path, final Path base) {
        if (VCS_IGNORE_NAMES.contains(fileName(path))) {
            return true;
        }
        final Path relative = path.startsWith(base) ? base.relativize(path) : path;
        for (final Path component : relative) {
            if (VCS_DIR_NAMES.contains(component.toString())) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> readExecutablesHint(final ProviderLayout layout) {
        final Optional<Path> hint = layout.srcDir().map(dir -> dir.resolve(EXECUTABLES_HINT));
        if (hint.isEmpty() || !Files.isRegularFile(hint.get())) {
            return Set.of();
        }
        final List<String> lines;
        try {
            lines = Files.readAllLines(hint.get(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read '" + hint.get() + "'", e);
        }
        final Set<String> names = new LinkedHashSet<>();
        for (final String line : lines) {
            if (!line.isBlank()) {
                names.add(line.strip());
            }
        }
        return Set.copyOf(names);
    }
}
