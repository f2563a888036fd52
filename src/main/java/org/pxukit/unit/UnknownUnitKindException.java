package org.pxukit.unit;

/**
 * Record declares a {@code unit} kind with no registered constructor.
 */
public final class UnknownUnitKindException extends IllegalArgumentException {
    private final String kindName;

    public UnknownUnitKindException(final String kindName) {
        super("Unknown unit type: '" + kindName + "'");
        this.kindName = kindName;
    }

    public String kindName() {
        return kindName;
    }
}
