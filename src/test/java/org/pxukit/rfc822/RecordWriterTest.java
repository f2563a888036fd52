package org.pxukit.rfc822;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class RecordWriterTest {
    @Test
    void writesSingleAndMultiLineValues() {
        final Map<String, String> data = new LinkedHashMap<>();
        data.put("id", "smoke");
        data.put("command", "echo one\n\n..\necho two");

        assertEquals(
                "id: smoke\ncommand:\n echo one\n .\n ...\n echo two\n\n",
                RecordWriter.toText(data));
    }

    @Test
    void writtenRecordsParseBackToTheSameFields() {
        final Map<String, String> first = new LinkedHashMap<>();
        first.put("id", "disk/read");
        first.put("description", "Reads the disk.\n\nThen reports.\n.\nDone");
        first.put("empty", "");
        final Map<String, String> second = Map.of("summary", "  indented\nsecond line");
        final List<Record> records = List.of(
                new Record(first, Origin.unknown()),
                new Record(second, Origin.unknown()));

        final List<Record> parsed = RecordParser.parse(RecordWriter.toText(records));

        assertEquals(2, parsed.size());
        assertEquals(first, parsed.get(0).data());
        assertEquals(second, parsed.get(1).data());
    }

    @Test
    void writesToAppendable() throws Exception {
        final StringWriter out = new StringWriter();
        RecordWriter.write(new Record(Map.of("key", "value"), Origin.unknown()), out);

        assertEquals("key: value\n\n", out.toString());
    }

    @Test
    void rejectsFieldNamesTheParserCannotRead() {
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of("a:b", "value")));
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of(" key", "value")));
    }

    @Test
    void rejectsValuesThatWouldNotParseBack() {
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of("key", "x\n .")));
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of("key", "x\n  ..\ny")));
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of("key", "a\n \nb")));
        assertThrows(IllegalArgumentException.class, () -> RecordWriter.toText(Map.of("key", "a\n\t")));
    }

    @Test
    void keepsIndentedTextNextToPeriods() {
        final Map<String, String> data = Map.of("key", "x\n .y\n ..z\n...");

        assertEquals(data, RecordParser.parse(RecordWriter.toText(data)).get(0).data());
    }
}
