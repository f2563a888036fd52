package org.pxukit.rfc822;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parser for the line-oriented {@code key: value} record grammar.
 *
 * <p>Blank lines separate records. A line starting with a single space continues the value of the
 * previous field; a continuation made only of periods is an escape where {@code .} stands for an
 * empty line and {@code N} periods stand for {@code N-1} periods. Parsing stops at the first
 * error and no records are returned for that input.
 */
public final class RecordParser {
    static final String UNEXPECTED_MULTI_LINE_VALUE = "Unexpected multi-line value";
    static final String UNEXPECTED_NON_EMPTY_LINE = "Unexpected non-empty line";

    private RecordParser() {}

    public static List<Record> parse(final String text) {
        return parse(text, null);
    }

    /**
     * Parses {@code text}; a {@code null} source is reported as {@link UnknownTextSource}.
     */
    public static List<Record> parse(final String text, final TextSource source) {
        Objects.requireNonNull(text, "text");
        final RecordBuilder builder = new RecordBuilder(source == null ? UnknownTextSource.INSTANCE : source);
        final String[] lines = text.split("\n", -1);
        for (int index = 0; index < lines.length; index++) {
            builder.accept(index + 1, stripCarriageReturn(lines[index]));
        }
        return builder.finish();
    }

    public static List<Record> parse(final Reader reader, final TextSource source) throws IOException {
        Objects.requireNonNull(reader, "reader");
        final StringWriter buffer = new StringWriter();
        reader.transferTo(buffer);
        return parse(buffer.toString(), source);
    }

    private static String stripCarriageReturn(final String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    static String unescapeContinuation(final String content) {
        final String stripped = content.strip();
        if (!stripped.isEmpty() && isPeriods(stripped)) {
            return stripped.substring(1);
        }
        return content;
    }

    static boolean isPeriods(final String value) {
        for (int i = 0; i < value.length(); i++) {
            if (value.charAt(i) != '.') {
                return false;
            }
        }
        return true;
    }

    private static final class RecordBuilder {
        private final TextSource source;
        private final List<Record> records = new ArrayList<>();
        private Map<String, String> data;
        private Map<String, Integer> fieldOffsets;
        private int lineStart;
        private int lineEnd;
        private String key;
        private List<String> valueLines;

        private RecordBuilder(final TextSource source) {
            this.source = source;
        }

        void accept(final int lineNumber, final String line) {
            if (line.isBlank()) {
                commitField();
                commitRecord();
                return;
            }
            if (line.charAt(0) == ' ') {
                if (key == null) {
                    throw new RecordSyntaxException(source, lineNumber, UNEXPECTED_MULTI_LINE_VALUE);
                }
                valueLines.add(unescapeContinuation(line.substring(1)));
                lineEnd = lineNumber;
                return;
            }

            final int colon = line.indexOf(':');
            final String fieldKey = colon < 0 ? "" : line.substring(0, colon).strip();
            if (fieldKey.isEmpty()) {
                throw new RecordSyntaxException(source, lineNumber, UNEXPECTED_NON_EMPTY_LINE);
            }
            if (data == null) {
                data = new LinkedHashMap<>();
                fieldOffsets = new LinkedHashMap<>();
                lineStart = lineNumber;
            }
            commitField();

            final String value = line.substring(colon + 1).strip();
            if (data.containsKey(fieldKey)) {
                throw new RecordSyntaxException(source, lineNumber, "Job has a duplicate key '" + fieldKey
                        + "' with old value '" + data.get(fieldKey)
                        + "' and new value '" + value + "'");
            }
            key = fieldKey;
            valueLines = new ArrayList<>();
            if (!value.isEmpty()) {
                valueLines.add(value);
            }
            fieldOffsets.put(fieldKey, lineNumber - lineStart);
            lineEnd = lineNumber;
        }

        List<Record> finish() {
            commitField();
            commitRecord();
            return List.copyOf(records);
        }

        private void commitField() {
            if (key == null) {
                return;
            }
            data.put(key, String.join("\n", valueLines));
            key = null;
            valueLines = null;
        }

        private void commitRecord() {
            if (data != null && !data.isEmpty()) {
                records.add(new Record(data, new Origin(source, lineStart, lineEnd), fieldOffsets));
            }
            data = null;
            fieldOffsets = null;
        }
    }
}
