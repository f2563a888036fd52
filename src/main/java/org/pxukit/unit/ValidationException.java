package org.pxukit.unit;

import java.util.Objects;

/**
 * Field-scoped validation failure.
 */
public final class ValidationException extends IllegalArgumentException {
    private final String field;
    private final Problem problem;

    public ValidationException(final String field, final Problem problem) {
        this(field, problem, null);
    }

    public ValidationException(final String field, final Problem problem, final String hint) {
        super("field " + Objects.requireNonNull(field, "field") + ": "
                + Objects.requireNonNull(problem, "problem")
                + (hint == null || hint.isBlank() ? "" : " (" + hint + ")"));
        this.field = field;
        this.problem = problem;
    }

    public String field() {
        return field;
    }

    public Problem problem() {
        return problem;
    }
}
