package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Recursive directory walk over a fixed list of roots.
 *
 * <p>Roots that do not exist are skipped. Files reachable from more than one root are reported
 * once, and the result is sorted by path. Failures below a root become problems; a root that
 * exists but is not a walkable directory fails the whole enumeration.
 */
public final class FileSystemContentEnumerator implements ContentEnumerator {
    private final List<Path> roots;

    public FileSystemContentEnumerator(final List<Path> roots) {
        Objects.requireNonNull(roots, "roots");
        final List<Path> normalized = new ArrayList<>(roots.size());
        for (final Path root : roots) {
            normalized.add(Objects.requireNonNull(root, "root").toAbsolutePath().normalize());
        }
        this.roots = List.copyOf(normalized);
    }

    public List<Path> roots() {
        return roots;
    }

    @Override
    public ContentEnumeration enumerate() throws IOException {
        final TreeSet<Path> found = new TreeSet<>();
        final List<ContentProblem> problems = new ArrayList<>();
        for (final Path root : roots) {
            if (Files.notExists(root)) {
                continue;
            }
            if (!Files.isDirectory(root)) {
                throw new NotDirectoryException(root.toString());
            }
            Files.walkFileTree(root, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult visitFile(final Path file, final BasicFileAttributes attrs) {
                    if (!attrs.isDirectory()) {
                        found.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(final Path file, final IOException exc) throws IOException {
                    if (file.equals(root)) {
                        throw exc;
                    }
                    problems.add(ContentProblem.of(file, ContentProblem.Kind.ENUMERATION, exc));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(final Path dir, final IOException exc) throws IOException {
                    if (exc != null) {
                        if (dir.equals(root)) {
                            throw exc;
                        }
                        problems.add(ContentProblem.of(dir, ContentProblem.Kind.ENUMERATION, exc));
                    }
                    return FileVisitResult.CONTINUE;
                }
            });
        }
        final List<ContentFile> files = new ArrayList<>(found.size());
        for (final Path path : found) {
            files.add(ContentFile.onDisk(path));
        }
        return new ContentEnumeration(files, problems);
    }
}
