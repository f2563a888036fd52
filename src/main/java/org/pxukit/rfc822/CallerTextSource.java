package org.pxukit.rfc822;

import java.util.Comparator;
import java.util.Objects;

/**
 * Java source file of the code that created a piece of data programmatically.
 */
public final class CallerTextSource implements TextSource {
    private static final Comparator<CallerTextSource> ORDER = Comparator
            .comparing(CallerTextSource::fileName)
            .thenComparing(CallerTextSource::className);

    private final String className;
    private final String fileName;

    public CallerTextSource(final String className, final String fileName) {
        this.className = Objects.requireNonNull(className, "className");
        this.fileName = fileName == null ? className : fileName;
    }

    public String className() {
        return className;
    }

    public String fileName() {
        return fileName;
    }

    @Override
    public String displayName() {
        return fileName;
    }

    @Override
    public int compareTo(final TextSource other) {
        if (!(other instanceof CallerTextSource that)) {
            throw TextSource.incomparable(this, other);
        }
        return ORDER.compare(this, that);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof CallerTextSource)) {
            return false;
        }
        final CallerTextSource that = (CallerTextSource) other;
        return className.equals(that.className) && fileName.equals(that.fileName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(className, fileName);
    }

    @Override
    public String toString() {
        return fileName;
    }
}
