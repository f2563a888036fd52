package org.pxukit.unit;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.rfc822.Record;

/**
 * Named selection of jobs to run together.
 *
 * <p>{@code include}, {@code exclude}, {@code mandatory_include} and {@code bootstrap_include}
 * hold one regular expression per line.
 */
public final class TestPlanUnit extends IdentifiedUnit {
    private static final String[] PATTERN_FIELDS = {
        "include", "exclude", "mandatory_include", "bootstrap_include"
    };

    private final Double estimatedDuration;

    public TestPlanUnit(
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        super(UnitKind.TEST_PLAN, record, provider, parameters, virtual);
        this.estimatedDuration = parseNonNegativeNumber(value("estimated_duration"), "estimated_duration");
    }

    public String name() {
        return value("name");
    }

    public String translatedName() {
        return translatedValue("name");
    }

    public String description() {
        return value("description");
    }

    public String include() {
        return value("include");
    }

    public String exclude() {
        return value("exclude");
    }

    public String mandatoryInclude() {
        return value("mandatory_include");
    }

    public String bootstrapInclude() {
        return value("bootstrap_include");
    }

    public Optional<Double> estimatedDuration() {
        return Optional.ofNullable(estimatedDuration);
    }

    /**
     * The {@code include} field as a selection list named after the partial identifier.
     */
    public SelectionList includeSelection() {
        final String include = include();
        return SelectionList.fromText(
                include == null ? "" : include,
                partialId(),
                fieldOrigin("include"),
                provider().map(UnitProvider::namespace).orElse(null));
    }

    @Override
    protected void inspect(final Issues issues, final CheckContext context) {
        super.inspect(issues, context);
        issues.require("name");
        for (final String field : PATTERN_FIELDS) {
            final String patterns = value(field);
            if (patterns == null) {
                continue;
            }
            for (final String line : SelectionList.patternLines(patterns)) {
                try {
                    Pattern.compile(line);
                } catch (PatternSyntaxException e) {
                    issues.error(field, Problem.BAD_SYNTAX, "invalid pattern '" + line + "': " + e.getDescription());
                }
            }
        }
    }
}
