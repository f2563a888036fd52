package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * One file found by a {@link ContentEnumerator}. The text is read on first use and cached.
 */
public final class ContentFile {
    private final Path path;
    private final LazyText lazyText;
    private String text;

    public ContentFile(final Path path, final LazyText lazyText) {
        this.path = Objects.requireNonNull(path, "path");
        this.lazyText = Objects.requireNonNull(lazyText, "lazyText");
    }

    public static ContentFile onDisk(final Path path) {
        return new ContentFile(path, LazyText.ofFile(path));
    }

    public Path path() {
        return path;
    }

    public String text() throws IOException {
        if (text == null) {
            text = Objects.requireNonNull(lazyText.read(), "text of " + path);
        }
        return text;
    }

    public boolean wasRead() {
        return text != null;
    }

    @Override
    public String toString() {
        return "ContentFile{" + path + (wasRead() ? ", read" : "") + "}";
    }
}
