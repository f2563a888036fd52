package org.pxukit.unit;

/**
 * Severity of a {@link UnitIssue}.
 */
public enum Severity {
    ERROR,
    WARNING,
    ADVICE
}
