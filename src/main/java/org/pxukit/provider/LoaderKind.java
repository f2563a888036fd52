package org.pxukit.provider;

/**
 * Load strategies the classifier can select.
 */
public enum LoaderKind {
    /** Unit definitions in the record format. */
    UNIT_SOURCE,
    /** Legacy selection list ("whitelist") files. */
    SELECTION_LIST,
    /** Files that are only recorded for provenance and never read. */
    PASSIVE;

    public ContentLoadStrategy<?> newStrategy() {
        return switch (this) {
            case UNIT_SOURCE -> new UnitSourceLoadStrategy();
            case SELECTION_LIST -> new SelectionListLoadStrategy();
            case PASSIVE -> new PassiveContentLoadStrategy();
        };
    }
}
