package org.pxukit.rfc822;

/**
 * Placeholder for text of unknown provenance. All instances are equal.
 */
public final class UnknownTextSource implements TextSource {
    public static final UnknownTextSource INSTANCE = new UnknownTextSource();

    private static final String DISPLAY_NAME = "???";

    public UnknownTextSource() {}

    @Override
    public String displayName() {
        return DISPLAY_NAME;
    }

    @Override
    public int compareTo(final TextSource other) {
        if (!(other instanceof UnknownTextSource)) {
            throw TextSource.incomparable(this, other);
        }
        return 0;
    }

    @Override
    public boolean equals(final Object other) {
        return other instanceof UnknownTextSource;
    }

    @Override
    public int hashCode() {
        return UnknownTextSource.class.hashCode();
    }

    @Override
    public String toString() {
        return DISPLAY_NAME;
    }
}
