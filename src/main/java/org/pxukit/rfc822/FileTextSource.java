package org.pxukit.rfc822;

import java.util.Objects;

/**
 * Text read from a named file.
 */
public final class FileTextSource implements TextSource {
    private final String filename;

    public FileTextSource(final String filename) {
        this.filename = Objects.requireNonNull(filename, "filename");
    }

    public String filename() {
        return filename;
    }

    @Override
    public String displayName() {
        return filename;
    }

    @Override
    public int compareTo(final TextSource other) {
        if (!(other instanceof FileTextSource that)) {
            throw TextSource.incomparable(this, other);
        }
        return filename.compareTo(that.filename);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof FileTextSource)) {
            return false;
        }
        return filename.equals(((FileTextSource) other).filename);
    }

    @Override
    public int hashCode() {
        return filename.hashCode();
    }

    @Override
    public String toString() {
        return filename;
    }
}
