package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.pxukit.obs.JsonLinesLogger;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.rfc822.FileTextSource;
import org.pxukit.unit.JobUnit;
import org.pxukit.unit.Unit;
import org.pxukit.unit.UnitProvider;

/**
 * Named collection of content directories that units are loaded on behalf of.
 *
 * <p>The provider owns its classifier, enumerator and loader. Content is loaded explicitly with
 * {@link #load(LoadOptions)}; the accessors that need content load it with default options on first
 * use.
 */
public final class Provider implements UnitProvider {
    private final String name;
    private final String version;
    private final String description;
    private final boolean secure;
    private final String gettextDomain;
    private final ProviderLayout layout;
    private final MessageCatalog messageCatalog;
    private final ContentClassifier classifier;
    private final ContentEnumerator enumerator;
    private final ContentLoader contentLoader;

    private Provider(final Builder builder) {
        this.name = requireText(builder.name, "name");
        this.version = requireText(builder.version, "version");
        this.description = builder.description;
        this.secure = builder.secure;
        this.gettextDomain = builder.gettextDomain == null || builder.gettextDomain.isBlank()
                ? null
                : builder.gettextDomain.trim();
        this.layout = builder.layout;
        this.messageCatalog = builder.messageCatalog;
        this.classifier = new ContentClassifier(layout);
        this.enumerator = builder.enumerator != null
                ? builder.enumerator
                : new FileSystemContentEnumerator(layout.contentDirectories());
        this.contentLoader = new ContentLoader(this, enumerator, builder.logger);
    }

    public static Builder builder(final String name, final String version) {
        return new Builder(name, version);
    }

    /**
     * Provider described by {@code definition}, with its effective directories.
     */
    public static Provider fromDefinition(
            final ProviderDefinition definition, final boolean secure, final JsonLinesLogger logger) {
        Objects.requireNonNull(definition, "definition");
        return builder(definition.name(), definition.version())
                .description(definition.description())
                .secure(secure)
                .gettextDomain(definition.effectiveGettextDomain().orElse(null))
                .layout(definition.effectiveLayout())
                .logger(logger)
                .build();
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Part of the name before the colon. Partial identifiers of this provider's units live in it.
     */
    @Override
    public String namespace() {
        final int colon = name.indexOf(':');
        return colon < 0 ? name : name.substring(0, colon);
    }

    public String version() {
        return version;
    }

    public String description() {
        return description;
    }

    public String translatedDescription() {
        return translate(description);
    }

    /**
     * Whether the provider was loaded from a secure directory of the search path.
     */
    public boolean isSecure() {
        return secure;
    }

    public Optional<String> gettextDomain() {
        return Optional.ofNullable(gettextDomain);
    }

    public ProviderLayout layout() {
        return layout;
    }

    public ContentClassifier classifier() {
        return classifier;
    }

    public ContentEnumerator enumerator() {
        return enumerator;
    }

    @Override
    public String translate(final String msgid) {
        if (msgid == null || msgid.isEmpty() || gettextDomain == null) {
            return msgid;
        }
        return messageCatalog.lookup(msgid).orElse(msgid);
    }

    public ClassificationResult classify(final Path path) {
        return classifier.classify(path);
    }

    public void load(final LoadOptions options) throws IOException {
        contentLoader.load(options);
    }

    public void load() throws IOException {
        load(LoadOptions.defaults());
    }

    public boolean isLoaded() {
        return contentLoader.isLoaded();
    }

    public List<Unit> unitList() {
        return contentLoader.unitList();
    }

    public List<ContentProblem> problemList() {
        return contentLoader.problemList();
    }

    public Map<String, List<Unit>> idMap() {
        return contentLoader.idMap();
    }

    public Map<String, List<Unit>> pathMap() {
        return contentLoader.pathMap();
    }

    public List<SelectionList> selectionLists() {
        return contentLoader.selectionLists();
    }

    /**
     * Every job of this provider sorted by identifier, and every problem met while loading.
     */
    public LoadReport loadAllJobs() throws IOException {
        ensureLoaded();
        final List<JobUnit> jobs = new ArrayList<>();
        for (final Unit unit : unitList()) {
            if (unit instanceof JobUnit job) {
                jobs.add(job);
            }
        }
        jobs.sort(Comparator.comparing(job -> job.id().orElse("")));
        return new LoadReport(jobs, problemList());
    }

    /**
     * Every job of this provider sorted by identifier.
     *
     * @throws RuntimeException the first problem met while loading
     */
    public List<JobUnit> builtinJobs() throws IOException {
        final LoadReport report = loadAllJobs();
        if (report.hasProblems()) {
            throw report.problems().get(0).asException();
        }
        return report.jobs();
    }

    /**
     * Selection lists read from the whitelists directory, sorted by name.
     *
     * @throws RuntimeException the first problem met while loading a file of that directory
     */
    public List<SelectionList> builtinSelectionLists() throws IOException {
        ensureLoaded();
        final Optional<Path> dir = layout.whitelistsDir();
        if (dir.isEmpty()) {
            return List.of();
        }
        for (final ContentProblem problem : problemList()) {
            if (problem.path().startsWith(dir.get())) {
                throw problem.asException();
            }
        }
        final List<SelectionList> lists = new ArrayList<>();
        for (final SelectionList list : selectionLists()) {
            if (list.origin().source() instanceof FileTextSource source
                    && Path.of(source.filename()).startsWith(dir.get())) {
                lists.add(list);
            }
        }
        lists.sort(Comparator.comparing(SelectionList::name));
        return List.copyOf(lists);
    }

    /**
     * Executables offered by this provider, sorted by path.
     *
     * <p>Covers the executable files of the bin directory and the executables of {@code build/bin}.
     * When {@code src/EXECUTABLES} exists, only the names it lists are taken from {@code build/bin}.
     */
    public List<Path> allExecutables() throws IOException {
        final List<Path> executables = new ArrayList<>();
        if (layout.binDir().isPresent()) {
            executables.addAll(listExecutables(layout.binDir().get()));
        }
        if (layout.buildBinDir().isPresent()) {
            final Path buildBin = layout.buildBinDir().get();
            final boolean hinted = layout.srcDir()
                    .map(dir -> Files.isRegularFile(dir.resolve(ContentClassifier.EXECUTABLES_HINT)))
                    .orElse(false);
            if (hinted) {
                for (final String executable : classifier.executables()) {
                    executables.add(buildBin.resolve(executable));
                }
            } else {
                executables.addAll(listExecutables(buildBin));
            }
        }
        executables.sort(Comparator.naturalOrder());
        return List.copyOf(executables);
    }

    private void ensureLoaded() throws IOException {
        if (!contentLoader.isLoaded()) {
            load();
        }
    }

    private static List<Path> listExecutables(final Path dir) throws IOException {
        final List<Path> executables = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (final Path entry : entries) {
                if (Files.isRegularFile(entry) && Files.isExecutable(entry)) {
                    executables.add(entry);
                }
            }
        } catch (NoSuchFileException e) {
            return List.of();
        }
        return executables;
    }

    private static String requireText(final String value, final String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("provider " + field + " must not be blank");
        }
        return value.trim();
    }

    @Override
    public String toString() {
        return "<Provider name:'" + name + "'>";
    }

    public static final class Builder {
        private final String name;
        private final String version;
        private String description;
        private boolean secure;
        private String gettextDomain;
        private ProviderLayout layout = ProviderLayout.builder().build();
        private MessageCatalog messageCatalog = MessageCatalog.empty();
        private ContentEnumerator enumerator;
        private JsonLinesLogger logger = JsonLinesLogger.noop();

        private Builder(final String name, final String version) {
            this.name = name;
            this.version = version;
        }

        public Builder description(final String description) {
            this.description = description;
            return this;
        }

        public Builder secure(final boolean secure) {
            this.secure = secure;
            return this;
        }

        public Builder gettextDomain(final String gettextDomain) {
            this.gettextDomain = gettextDomain;
            return this;
        }

        public Builder layout(final ProviderLayout layout) {
            this.layout = Objects.requireNonNull(layout, "layout");
            return this;
        }

        public Builder messageCatalog(final MessageCatalog messageCatalog) {
            this.messageCatalog = Objects.requireNonNull(messageCatalog, "messageCatalog");
            return this;
        }

        /**
         * Replaces the file-system enumerator, e.g. to load content that is not on disk.
         */
        public Builder enumerator(final ContentEnumerator enumerator) {
            this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
            return this;
        }

        public Builder logger(final JsonLinesLogger logger) {
            this.logger = Objects.requireNonNull(logger, "logger");
            return this;
        }

        public Provider build() {
            return new Provider(this);
        }
    }
}
