package org.pxukit.rfc822;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One group of fields parsed from the record grammar, with its origin.
 *
 * <p>Field offsets hold, for each field, the distance in lines between the start of the record
 * and the {@code key:} line of that field.
 */
public final class Record {
    private final Map<String, String> data;
    private final Origin origin;
    private final Map<String, Integer> fieldOffsets;

    public Record(final Map<String, String> data, final Origin origin) {
        this(data, origin, Map.of());
    }

    public Record(final Map<String, String> data, final Origin origin, final Map<String, Integer> fieldOffsets) {
        this.data = unmodifiableCopy(Objects.requireNonNull(data, "data"), "data");
        this.origin = Objects.requireNonNull(origin, "origin");
        this.fieldOffsets = unmodifiableCopy(Objects.requireNonNull(fieldOffsets, "fieldOffsets"), "fieldOffsets");
    }

    public Map<String, String> data() {
        return data;
    }

    public Origin origin() {
        return origin;
    }

    public Map<String, Integer> fieldOffsets() {
        return fieldOffsets;
    }

    public String value(final String field) {
        return data.get(field);
    }

    public boolean has(final String field) {
        return data.containsKey(field);
    }

    /**
     * Origin of the {@code key:} line of a field, or of the whole record when unknown.
     */
    public Origin fieldOrigin(final String field) {
        final Integer offset = fieldOffsets.get(field);
        return offset == null ? origin : origin.lineAt(offset);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Record)) {
            return false;
        }
        final Record that = (Record) other;
        return data.equals(that.data) && origin.equals(that.origin);
    }

    @Override
    public int hashCode() {
        return Objects.hash(data, origin);
    }

    @Override
    public String toString() {
        return "Record{origin=" + origin + ", fields=" + data.keySet() + "}";
    }

    private static <V> Map<String, V> unmodifiableCopy(final Map<String, V> source, final String name) {
        final Map<String, V> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, V> entry : source.entrySet()) {
            copy.put(
                    Objects.requireNonNull(entry.getKey(), name + " key"),
                    Objects.requireNonNull(entry.getValue(), name + " value for " + entry.getKey()));
        }
        return Collections.unmodifiableMap(copy);
    }
}
