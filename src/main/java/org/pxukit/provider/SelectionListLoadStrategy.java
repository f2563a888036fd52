package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.rfc822.FileTextSource;
import org.pxukit.rfc822.Origin;
import org.pxukit.rfc822.Record;
import org.pxukit.unit.FileRole;
import org.pxukit.unit.TestPlanUnit;
import org.pxukit.unit.Unit;
import org.pxukit.unit.UnitKind;

/**
 * Loads legacy {@code .whitelist} selection lists.
 *
 * <p>Besides the selection list itself, every file yields a virtual test plan whose
 * {@code include} field is the raw file text, so the list can be used wherever test plans are.
 */
public final class SelectionListLoadStrategy extends ContentLoadStrategy<SelectionListLoadStrategy.Inspection> {

    @Override
    protected Inspection inspect(final ContentFile file, final Provider provider, final LoadOptions options)
            throws IOException {
        final Path path = file.path();
        final String text = file.text();
        final Origin origin = Origin.wholeText(new FileTextSource(path.toString()), text);
        final String namespace = provider == null ? null : provider.namespace();
        try {
            return new Inspection(SelectionList.fromText(text, baseName(path), origin, namespace), text, origin);
        } catch (IllegalArgumentException e) {
            throw new ContentLoadException(path, "Cannot load whitelist '" + path + "': " + e.getMessage(), e);
        }
    }

    @Override
    protected List<Unit> discoverUnits(
            final Inspection inspected,
            final ContentFile file,
            final ClassificationResult classification,
            final Provider provider) {
        if (provider == null) {
            return List.of();
        }
        final Path base = provider.layout().whitelistsDir().orElse(null);
        return List.of(fileUnit(file.path(), FileRole.LEGACY_WHITELIST, base, provider));
    }

    @Override
    protected List<SelectionList> discoverSelectionLists(
            final Inspection inspected, final ContentFile file, final Provider provider) {
        return List.of(inspected.selectionList());
    }

    @Override
    protected List<Unit> synthesize(final Inspection inspected, final ContentFile file, final Provider provider) {
        if (provider == null) {
            return List.of();
        }
        final String name = baseName(file.path());
        final Map<String, String> data = new LinkedHashMap<>();
        data.put(Unit.UNIT_FIELD, UnitKind.TEST_PLAN.unitName());
        data.put("id", name);
        data.put("name", name);
        data.put("include", inspected.text());
        final Record record = new Record(data, inspected.origin(), Map.of("include", 0));
        return List.of(new TestPlanUnit(record, provider, Map.of(), true));
    }

    /**
     * Parsed selection list with the text and origin it was read from.
     */
    public record Inspection(SelectionList selectionList, String text, Origin origin) {}
}
