package org.pxukit.unit;

/**
 * Kind of defect found in a unit field.
 */
public enum Problem {
    MISSING("missing definition of required field"),
    WRONG("incorrect value supplied"),
    USELESS("useless field in this context"),
    DEPRECATED("deprecated field used"),
    BAD_SYNTAX("syntax error"),
    UNKNOWN_REFERENCE("reference to unknown unit");

    private final String description;

    Problem(final String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    @Override
    public String toString() {
        return description;
    }
}
