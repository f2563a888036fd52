package org.pxukit.unit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.pxukit.rfc822.Origin;
import org.pxukit.rfc822.Record;

/**
 * Typed object built from one {@link Record}, or synthesized by a loader.
 *
 * <p>Record fields whose name starts with an underscore are translatable; the underscore is not
 * part of the field name seen through {@link #value(String)}. When the unit carries template
 * parameters, {@code {name}} placeholders in field values are replaced by the parameter values.
 *
 * <p>Units are immutable. {@link #check(CheckContext)} and {@link #validate(ValidationOptions)}
 * only inspect them.
 */
public abstract class Unit {
    public static final String UNIT_FIELD = "unit";

    private final UnitKind kind;
    private final Record record;
    private final UnitProvider provider;
    private final Map<String, String> parameters;
    private final boolean virtual;
    private final Map<String, String> fields;
    private final Map<String, String> rawFieldNames;
    private final Set<String> translatableFields;

    protected Unit(
            final UnitKind kind,
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.record = Objects.requireNonNull(record, "record");
        this.provider = provider;
        this.parameters = Map.copyOf(Objects.requireNonNull(parameters, "parameters"));
        this.virtual = virtual;

        final Map<String, String> normalized = new LinkedHashMap<>();
        final Map<String, String> rawNames = new LinkedHashMap<>();
        final Set<String> translatable = new LinkedHashSet<>();
        for (final Map.Entry<String, String> entry : record.data().entrySet()) {
            final String rawName = entry.getKey();
            final boolean marked = rawName.length() > 1 && rawName.charAt(0) == '_';
            final String name = marked ? rawName.substring(1) : rawName;
            if (normalized.containsKey(name)) {
                throw new IllegalArgumentException(
                        "field '" + name + "' is defined both as translatable and as plain text");
            }
            normalized.put(name, entry.getValue());
            rawNames.put(name, rawName);
            if (marked) {
                translatable.add(name);
            }
        }
        this.fields = Collections.unmodifiableMap(normalized);
        this.rawFieldNames = Collections.unmodifiableMap(rawNames);
        this.translatableFields = Collections.unmodifiableSet(translatable);
    }

    public final UnitKind kind() {
        return kind;
    }

    public final Record record() {
        return record;
    }

    public final Origin origin() {
        return record.origin();
    }

    public final Optional<UnitProvider> provider() {
        return Optional.ofNullable(provider);
    }

    public final Map<String, String> parameters() {
        return parameters;
    }

    /**
     * Whether the unit was synthesized by a loader instead of read from a source record.
     */
    public final boolean isVirtual() {
        return virtual;
    }

    public final Set<String> fieldNames() {
        return fields.keySet();
    }

    public final boolean isTranslatable(final String field) {
        return translatableFields.contains(field);
    }

    /**
     * Value of {@code field} with template parameters applied, or {@code null} when absent.
     */
    public final String value(final String field) {
        final String raw = fields.get(field);
        if (raw == null || parameters.isEmpty()) {
            return raw;
        }
        String resolved = raw;
        for (final Map.Entry<String, String> parameter : parameters.entrySet()) {
            resolved = resolved.replace("{" + parameter.getKey() + "}", parameter.getValue());
        }
        return resolved;
    }

    /**
     * Value of {@code field}, translated through the provider when the field is translatable.
     */
    public final String translatedValue(final String field) {
        final String value = value(field);
        if (value == null || provider == null || !isTranslatable(field)) {
            return value;
        }
        return provider.translate(value);
    }

    public final Origin fieldOrigin(final String field) {
        final String rawName = rawFieldNames.get(field);
        return rawName == null ? record.origin() : record.fieldOrigin(rawName);
    }

    /**
     * Identifier used to index this unit, when the kind has one.
     */
    public Optional<String> id() {
        return Optional.empty();
    }

    /**
     * Path of the file this unit describes, when the kind has one.
     */
    public Optional<String> path() {
        return Optional.empty();
    }

    /**
     * Runs the consistency checks of this kind and returns every issue found.
     *
     * @param context other units for cross-reference checks, or {@code null} to skip them
     */
    public final List<UnitIssue> check(final CheckContext context) {
        final Issues issues = new Issues(this);
        inspect(issues, context);
        return issues.list();
    }

    /**
     * Static validation.
     *
     * @throws ValidationException for the first issue rejected by {@code options}
     */
    public final void validate(final ValidationOptions options) {
        Objects.requireNonNull(options, "options");
        for (final UnitIssue issue : check(null)) {
            if (options.rejects(issue)) {
                final String hint = issue.message().equals(issue.problem().description()) ? null : issue.message();
                throw new ValidationException(issue.field(), issue.problem(), hint);
            }
        }
    }

    protected abstract void inspect(Issues issues, CheckContext context);

    protected static Double parseNonNegativeNumber(final String raw, final String field) {
        if (raw == null) {
            return null;
        }
        final double parsed;
        try {
            parsed = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " must be a number (actual: " + raw + ")", e);
        }
        if (parsed < 0 || Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new IllegalArgumentException(field + " must be a non-negative number (actual: " + raw + ")");
        }
        return parsed;
    }

    protected static List<String> splitWords(final String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        final List<String> words = new ArrayList<>();
        for (final String word : raw.trim().split("[\\s,]+")) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return List.copyOf(words);
    }

    @Override
    public String toString() {
        final String label = id().or(this::path).orElse(String.valueOf(origin()));
        return "<" + getClass().getSimpleName() + " " + label + (virtual ? " virtual" : "") + ">";
    }

    /**
     * Collects issues with the origin of the offending field.
     */
    protected static final class Issues {
        private final Unit unit;
        private final List<UnitIssue> list = new ArrayList<>();

        private Issues(final Unit unit) {
            this.unit = unit;
        }

        public void error(final String field, final Problem problem, final String message) {
            add(Severity.ERROR, field, problem, message);
        }

        public void warning(final String field, final Problem problem, final String message) {
            add(Severity.WARNING, field, problem, message);
        }

        public void advice(final String field, final Problem problem, final String message) {
            add(Severity.ADVICE, field, problem, message);
        }

        /**
         * Reports a missing-field error when {@code field} is absent or blank.
         */
        public boolean require(final String field) {
            final String value = unit.value(field);
            if (value == null || value.isBlank()) {
                error(field, Problem.MISSING, null);
                return false;
            }
            return true;
        }

        private void add(final Severity severity, final String field, final Problem problem, final String message) {
            list.add(new UnitIssue(severity, field, problem, message, unit.fieldOrigin(field)));
        }

        private List<UnitIssue> list() {
            return List.copyOf(list);
        }
    }
}
