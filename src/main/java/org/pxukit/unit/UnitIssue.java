package org.pxukit.unit;

import java.util.Locale;
import java.util.Objects;
import org.pxukit.rfc822.Origin;

/**
 * One problem reported by {@link Unit#check(CheckContext)}.
 */
public record UnitIssue(Severity severity, String field, Problem problem, String message, Origin origin) {
    public UnitIssue {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(problem, "problem");
        message = message == null || message.isBlank() ? problem.description() : message;
        Objects.requireNonNull(origin, "origin");
    }

    @Override
    public String toString() {
        return origin + ": " + severity.name().toLowerCase(Locale.ROOT)
                + ": field '" + field + "', " + message;
    }
}
