package org.pxukit.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.rfc822.Origin;
import org.pxukit.rfc822.Record;

class TestPlanUnitTest {
    private static final TestProvider PROVIDER = new TestProvider();

    @Test
    void includeFieldBecomesSelectionList() {
        final TestPlanUnit plan = plan(Map.of("id", "smoke", "name", "Smoke", "include", "audio/.*\n# comment\nusb"));

        final SelectionList selection = plan.includeSelection();

        assertEquals("smoke", selection.name());
        assertEquals(List.of("audio/.*", "usb"), selection.patternTexts());
        assertTrue(selection.designates("2013.org.example::audio/playback"));
        assertFalse(selection.designates("2013.org.example::usb/insert"));
    }

    @Test
    void rejectsInvalidPatterns() {
        final TestPlanUnit plan = plan(Map.of("id", "smoke", "name", "Smoke", "exclude", "ok\n(broken"));

        final List<UnitIssue> issues = plan.check(null);

        assertEquals(1, issues.size());
        assertEquals("exclude", issues.get(0).field());
        assertEquals(Problem.BAD_SYNTAX, issues.get(0).problem());
        assertThrows(ValidationException.class, () -> plan.validate(ValidationOptions.DEFAULT));
    }

    @Test
    void requiresIdAndName() {
        final ValidationException missingName = assertThrows(
                ValidationException.class, () -> plan(Map.of("id", "smoke")).validate(ValidationOptions.DEFAULT));
        assertEquals("name", missingName.field());

        final ValidationException missingId = assertThrows(
                ValidationException.class, () -> plan(Map.of("name", "Smoke")).validate(ValidationOptions.DEFAULT));
        assertEquals("id", missingId.field());
    }

    @Test
    void fileUnitsDescribeTheirPath() {
        final FileUnit file = FileUnit.describing("/p/units/a.pxu", FileRole.UNIT_SOURCE, "/p/units", PROVIDER);

        assertTrue(file.isVirtual());
        assertEquals(Optional.of("/p/units/a.pxu"), file.path());
        assertEquals(Optional.of(FileRole.UNIT_SOURCE), file.role());
        assertEquals("/p/units/a.pxu", file.origin().toString());
        assertEquals(List.of(), file.check(null));
    }

    @Test
    void fileUnitWithUnknownRoleIsWrong() {
        final FileUnit file = new FileUnit(
                new Record(Map.of("unit", "file", "path", "/x", "role", "poster"), Origin.unknown()),
                PROVIDER,
                Map.of(),
                false);

        assertEquals(Optional.empty(), file.role());
        assertEquals(Problem.WRONG, file.check(null).get(0).problem());
    }

    private static TestPlanUnit plan(final Map<String, String> fields) {
        return new TestPlanUnit(new Record(fields, Origin.unknown()), PROVIDER, Map.of(), false);
    }
}
