package org.pxukit.provider;

import java.util.List;
import org.pxukit.unit.Unit;

/**
 * Records files that belong to the provider without reading them.
 */
public final class PassiveContentLoadStrategy extends ContentLoadStrategy<Void> {

    @Override
    protected Void inspect(final ContentFile file, final Provider provider, final LoadOptions options) {
        return null;
    }

    @Override
    protected List<Unit> discoverUnits(
            final Void inspected,
            final ContentFile file,
            final ClassificationResult classification,
            final Provider provider) {
        return List.of(fileUnit(file.path(), classification.role(), classification.baseDirectory(), provider));
    }
}
