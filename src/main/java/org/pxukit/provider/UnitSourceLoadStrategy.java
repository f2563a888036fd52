package org.pxukit.provider;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.rfc822.FileTextSource;
import org.pxukit.rfc822.Record;
import org.pxukit.rfc822.RecordParser;
import org.pxukit.rfc822.RecordSyntaxException;
import org.pxukit.unit.Severity;
import org.pxukit.unit.TestPlanUnit;
import org.pxukit.unit.Unit;
import org.pxukit.unit.UnitIssue;
import org.pxukit.unit.UnitKind;
import org.pxukit.unit.UnitProvider;
import org.pxukit.unit.UnknownUnitKindException;
import org.pxukit.unit.ValidationException;

/**
 * Loads units from files in the record format.
 *
 * <p>Each record is dispatched on its {@code unit} field. The first record that cannot be turned
 * into a valid unit rejects the whole file.
 */
public final class UnitSourceLoadStrategy extends ContentLoadStrategy<List<Unit>> {

    @Override
    protected List<Unit> inspect(final ContentFile file, final Provider provider, final LoadOptions options)
            throws IOException {
        final Path path = file.path();
        final List<Record> records;
        try {
            records = RecordParser.parse(file.text(), new FileTextSource(path.toString()));
        } catch (RecordSyntaxException e) {
            throw new ContentLoadException(
                    path, "Cannot load job definitions from '" + path + "': " + e.getMessage(), e);
        }

        final List<Unit> units = new ArrayList<>(records.size());
        for (final Record record : records) {
            final UnitKind kind;
            try {
                kind = UnitKind.of(record);
            } catch (UnknownUnitKindException e) {
                throw new ContentLoadException(path, "Unknown unit type: '" + e.kindName() + "'", e);
            }
            final Unit unit;
            try {
                unit = kind.instantiate(record, provider);
            } catch (IllegalArgumentException e) {
                throw new ContentLoadException(
                        path, "Cannot define unit from record " + record.origin() + ": " + e.getMessage(), e);
            }
            if (options.check()) {
                for (final UnitIssue issue : unit.check(options.checkContext())) {
                    if (issue.severity() == Severity.ERROR) {
                        throw new ContentLoadException(path, "Problem in unit definition, " + issue);
                    }
                }
            }
            if (options.validate()) {
                try {
                    unit.validate(options.validation());
                } catch (ValidationException e) {
                    throw new ContentLoadException(
                            path, "Problem in unit definition, field " + e.field() + ": " + e.problem(), e);
                }
            }
            units.add(unit);
        }
        return List.copyOf(units);
    }

    @Override
    protected List<Unit> discoverUnits(
            final List<Unit> inspected,
            final ContentFile file,
            final ClassificationResult classification,
            final Provider provider) {
        final List<Unit> units = new ArrayList<>(inspected);
        units.add(fileUnit(file.path(), classification.role(), classification.baseDirectory(), provider));
        return units;
    }

    @Override
    protected List<SelectionList> discoverSelectionLists(
            final List<Unit> inspected, final ContentFile file, final Provider provider) {
        final List<SelectionList> lists = new ArrayList<>();
        for (final Unit unit : inspected) {
            if (unit instanceof TestPlanUnit testPlan) {
                final String include = testPlan.include();
                lists.add(SelectionList.fromText(
                        include == null ? "" : include,
                        testPlan.partialId(),
                        testPlan.origin(),
                        testPlan.provider().map(UnitProvider::namespace).orElse(null)));
            }
        }
        return lists;
    }
}
