package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.pxukit.obs.JsonLinesLogger;
import org.pxukit.obs.LoadCorrelation;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.unit.Unit;

/**
 * Loads all content of one provider and indexes the resulting units.
 *
 * <p>Each call to {@link #load(LoadOptions)} discards the previous state and starts over. A file
 * that fails to classify or load becomes a {@link ContentProblem} and the pass moves on to the next
 * file. Instances are not thread-safe; callers serialize loads and reads.
 */
public final class ContentLoader {
    private final Provider provider;
    private final ContentEnumerator enumerator;
    private final JsonLinesLogger logger;

    private final List<Unit> unitList = new ArrayList<>();
    private final List<SelectionList> selectionLists = new ArrayList<>();
    private final List<ContentProblem> problemList = new ArrayList<>();
    private final Map<String, List<Unit>> idMap = new LinkedHashMap<>();
    private final Map<String, List<Unit>> pathMap = new LinkedHashMap<>();
    private boolean loaded;
    private long passCount;

    public ContentLoader(final Provider provider, final ContentEnumerator enumerator, final JsonLinesLogger logger) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.enumerator = Objects.requireNonNull(enumerator, "enumerator");
        this.logger = Objects.requireNonNull(logger, "logger");
    }

    /**
     * Runs a full load pass.
     *
     * @throws IOException when enumeration fails for a reason other than a missing directory
     */
    public void load(final LoadOptions options) throws IOException {
        Objects.requireNonNull(options, "options");
        reset();
        passCount++;
        final LoadCorrelation correlation = LoadCorrelation.of(provider.name() + "#" + passCount, provider.name());
        logger.info("content.load.start", correlation, Map.of(
                "validate", options.validate(),
                "check", options.check()));

        final ContentEnumeration enumeration = enumerator.enumerate();
        for (final ContentFile file : enumeration.files()) {
            loadFile(file, options, correlation.forPath(file.path().toString()));
        }
        for (final ContentProblem problem : enumeration.problems()) {
            problemList.add(problem);
            logProblem(problem, correlation.forPath(problem.path().toString()));
        }
        loaded = true;

        logger.info("content.load.complete", correlation, Map.of(
                "files", enumeration.files().size(),
                "units", unitList.size(),
                "problems", problemList.size()));
    }

    /**
     * Forgets everything loaded so far.
     */
    public void reset() {
        unitList.clear();
        selectionLists.clear();
        problemList.clear();
        idMap.clear();
        pathMap.clear();
        loaded = false;
    }

    public boolean isLoaded() {
        return loaded;
    }

    public List<Unit> unitList() {
        return Collections.unmodifiableList(unitList);
    }

    public List<SelectionList> selectionLists() {
        return Collections.unmodifiableList(selectionLists);
    }

    public List<ContentProblem> problemList() {
        return Collections.unmodifiableList(problemList);
    }

    /**
     * Units by identifier. Units sharing an identifier are all kept, in load order.
     */
    public Map<String, List<Unit>> idMap() {
        return Collections.unmodifiableMap(idMap);
    }

    public Map<String, List<Unit>> pathMap() {
        return Collections.unmodifiableMap(pathMap);
    }

    private void loadFile(final ContentFile file, final LoadOptions options, final LoadCorrelation correlation) {
        final Path path = file.path();
        final ClassificationResult classification;
        try {
            classification = provider.classify(path);
        } catch (RuntimeException e) {
            recordProblem(ContentProblem.of(path, ContentProblem.Kind.CLASSIFICATION, e), correlation);
            return;
        }
        if (classification.loader().isEmpty()) {
            logger.debug("content.file.skipped", correlation, Map.of("role", classification.role().value()));
            return;
        }

        final LoadedContent content;
        try {
            content = classification.loader().get().newStrategy().load(file, classification, provider, options);
        } catch (ContentLoadException e) {
            recordProblem(ContentProblem.of(path, ContentProblem.Kind.LOAD, e), correlation);
            return;
        }

        final List<Unit> units = content.allUnits();
        unitList.addAll(units);
        selectionLists.addAll(content.selectionLists());
        for (final Unit unit : units) {
            unit.id().ifPresent(id -> {
                idMap.computeIfAbsent(id, ignored -> new ArrayList<>()).add(unit);
                logger.debug("content.unit.indexed", correlation.forUnit(id), Map.of(
                        "kind", unit.kind().unitName(),
                        "virtual", unit.isVirtual()));
            });
            unit.path().ifPresent(unitPath -> pathMap.computeIfAbsent(unitPath, ignored -> new ArrayList<>()).add(unit));
        }
        logger.debug("content.file.loaded", correlation, Map.of(
                "role", classification.role().value(),
                "units", units.size(),
                "selectionLists", content.selectionLists().size()));
    }

    private void recordProblem(final ContentProblem problem, final LoadCorrelation correlation) {
        problemList.add(problem);
        logProblem(problem, correlation);
    }

    private void logProblem(final ContentProblem problem, final LoadCorrelation correlation) {
        logger.warn("content.file.problem", correlation, Map.of(
                "kind", problem.kind().name(),
                "error", problem.message()));
    }
}
