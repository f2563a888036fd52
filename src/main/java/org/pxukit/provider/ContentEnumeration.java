package org.pxukit.provider;

import java.util.List;
import java.util.Objects;

/**
 * Files found by an enumeration pass and the problems met while walking directories.
 */
public record ContentEnumeration(List<ContentFile> files, List<ContentProblem> problems) {
    public ContentEnumeration {
        files = List.copyOf(Objects.requireNonNull(files, "files"));
        problems = List.copyOf(Objects.requireNonNull(problems, "problems"));
    }

    public static ContentEnumeration of(final List<ContentFile> files) {
        return new ContentEnumeration(files, List.of());
    }
}
