package org.pxukit.rfc822;

/**
 * Describes where a piece of text was read from.
 *
 * <p>Sources of the same kind are ordered; comparing sources of unrelated kinds throws
 * {@link ClassCastException}.
 */
public interface TextSource extends Comparable<TextSource> {
    /**
     * Name used when rendering origins and syntax errors.
     */
    String displayName();

    static ClassCastException incomparable(final TextSource self, final TextSource other) {
        return new ClassCastException("cannot compare "
                + self.getClass().getSimpleName()
                + " with "
                + (other == null ? "null" : other.getClass().getSimpleName()));
    }
}
