package org.pxukit.unit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.pxukit.rfc822.Origin;
import org.pxukit.rfc822.Record;

class UnitKindTest {
    @Test
    void defaultsToJobWithoutUnitField() {
        final Record record = new Record(Map.of("id", "smoke"), Origin.unknown());

        assertEquals(UnitKind.JOB, UnitKind.of(record));
        assertInstanceOf(JobUnit.class, UnitKind.of(record).instantiate(record, null));
    }

    @Test
    void dispatchesOnDeclaredKind() {
        assertInstanceOf(CategoryUnit.class, instantiate("category"));
        assertInstanceOf(TestPlanUnit.class, instantiate("test plan"));
        assertInstanceOf(FileUnit.class, instantiate("file"));
        assertInstanceOf(JobUnit.class, instantiate("job"));
    }

    @Test
    void rejectsUnknownKind() {
        final UnknownUnitKindException error =
                assertThrows(UnknownUnitKindException.class, () -> UnitKind.fromName("exporter"));

        assertEquals("exporter", error.kindName());
        assertEquals("Unknown unit type: 'exporter'", error.getMessage());
    }

    @Test
    void instantiatedUnitsKeepRecordAndFlags() {
        final Record record = new Record(Map.of("unit", "category", "id", "audio", "_name", "Audio"), Origin.unknown());

        final Unit unit = UnitKind.CATEGORY.instantiate(record, null, Map.of(), true);

        assertEquals(UnitKind.CATEGORY, unit.kind());
        assertEquals(record, unit.record());
        assertTrue(unit.isVirtual());
        assertTrue(unit.isTranslatable("name"));
        assertFalse(unit.isTranslatable("id"));
        assertEquals("Audio", unit.value("name"));
    }

    private static Unit instantiate(final String kind) {
        final Record record = new Record(Map.of("unit", kind, "id", "x"), Origin.unknown());
        return UnitKind.of(record).instantiate(record, null);
    }
}
