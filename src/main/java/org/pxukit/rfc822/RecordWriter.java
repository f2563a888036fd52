package org.pxukit.rfc822;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Writes records back into the text grammar understood by {@link RecordParser}.
 */
public final class RecordWriter {
    private RecordWriter() {}

    public static String toText(final Map<String, String> data) {
        final StringBuilder sb = new StringBuilder();
        appendQuietly(data, sb);
        return sb.toString();
    }

    public static String toText(final Collection<Record> records) {
        Objects.requireNonNull(records, "records");
        final StringBuilder sb = new StringBuilder();
        for (final Record record : records) {
            appendQuietly(record.data(), sb);
        }
        return sb.toString();
    }

    public static void write(final Record record, final Appendable out) throws IOException {
        write(Objects.requireNonNull(record, "record").data(), out);
    }

    /**
     * Writes one record followed by a blank line.
     *
     * @throws IllegalArgumentException when a value has a line the grammar cannot represent: a
     *     non-empty line of only whitespace, or a line of periods with surrounding whitespace
     */
    public static void write(final Map<String, String> data, final Appendable out) throws IOException {
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(out, "out");
        for (final Map.Entry<String, String> entry : data.entrySet()) {
            final String key = requireKey(entry.getKey());
            final String value = Objects.requireNonNull(entry.getValue(), "value for " + key);
            if (value.indexOf('\n') < 0) {
                out.append(key).append(": ").append(value).append('\n');
                continue;
            }
            out.append(key).append(":\n");
            for (final String line : value.split("\n", -1)) {
                out.append(' ').append(escapeContinuation(key, line)).append('\n');
            }
        }
        out.append('\n');
    }

    static String escapeContinuation(final String key, final String line) {
        if (line.isEmpty()) {
            return ".";
        }
        if (line.isBlank()) {
            throw new IllegalArgumentException("value of '" + key + "' has a whitespace-only line");
        }
        if (RecordParser.isPeriods(line)) {
            return "." + line;
        }
        if (RecordParser.isPeriods(line.strip())) {
            throw new IllegalArgumentException(
                    "value of '" + key + "' has a period-only line with surrounding whitespace: '" + line + "'");
        }
        return line;
    }

    private static void appendQuietly(final Map<String, String> data, final StringBuilder sb) {
        try {
            write(data, sb);
        } catch (IOException e) {
            throw new UncheckedIOException("StringBuilder does not fail", e);
        }
    }

    private static String requireKey(final String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("field name must not be blank");
        }
        if (key.indexOf(':') >= 0 || key.indexOf('\n') >= 0 || !key.equals(key.strip())) {
            throw new IllegalArgumentException("field name cannot be written: '" + key + "'");
        }
        return key;
    }
}
