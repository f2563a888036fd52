package org.pxukit.unit;

/**
 * Controls which issues make {@link Unit#validate(ValidationOptions)} fail.
 *
 * @param strict also reject units with warnings
 * @param deprecated also reject units that use deprecated fields
 */
public record ValidationOptions(boolean strict, boolean deprecated) {
    public static final ValidationOptions DEFAULT = new ValidationOptions(false, false);

    boolean rejects(final UnitIssue issue) {
        if (issue.severity() == Severity.ERROR) {
            return true;
        }
        if (issue.problem() == Problem.DEPRECATED) {
            return deprecated;
        }
        return strict && issue.severity() == Severity.WARNING;
    }
}
