package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.unit.FileRole;
import org.pxukit.unit.FileUnit;
import org.pxukit.unit.Unit;

/**
 * Loads the content of one classified file in two phases.
 *
 * <p>{@link #inspect} interprets the file and is the only phase that may fail. The projections
 * {@link #discoverUnits}, {@link #discoverSelectionLists} and {@link #synthesize} are pure
 * functions of its result.
 *
 * @param <T> intermediate result of the inspection phase
 */
public abstract class ContentLoadStrategy<T> {

    /**
     * Runs every phase for {@code file}.
     *
     * @param provider owner of the content, may be {@code null}
     * @throws ContentLoadException when the file cannot be loaded
     */
    public final LoadedContent load(
            final ContentFile file,
            final ClassificationResult classification,
            final Provider provider,
            final LoadOptions options) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(classification, "classification");
        Objects.requireNonNull(options, "options");
        try {
            final T inspected = inspect(file, provider, options);
            return new LoadedContent(
                    file.path(),
                    discoverUnits(inspected, file, classification, provider),
                    synthesize(inspected, file, provider),
                    discoverSelectionLists(inspected, file, provider));
        } catch (ContentLoadException e) {
            throw e;
        } catch (IOException e) {
            throw new ContentLoadException(file.path(), "Cannot read '" + file.path() + "': " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ContentLoadException(file.path(), "Cannot load '" + file.path() + "': " + e.getMessage(), e);
        }
    }

    protected abstract T inspect(ContentFile file, Provider provider, LoadOptions options) throws IOException;

    protected abstract List<Unit> discoverUnits(
            T inspected, ContentFile file, ClassificationResult classification, Provider provider);

    protected List<SelectionList> discoverSelectionLists(
            final T inspected, final ContentFile file, final Provider provider) {
        return List.of();
    }

    protected List<Unit> synthesize(final T inspected, final ContentFile file, final Provider provider) {
        return List.of();
    }

    /**
     * Virtual unit recording that {@code path} belongs to the provider.
     */
    protected static FileUnit fileUnit(final Path path, final FileRole role, final Path base, final Provider provider) {
        return FileUnit.describing(path.toString(), role, base == null ? null : base.toString(), provider);
    }

    protected static String baseName(final Path path) {
        final String name = path.getFileName().toString();
        final int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
