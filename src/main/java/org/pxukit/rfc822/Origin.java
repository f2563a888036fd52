package org.pxukit.rfc822;

import java.util.Comparator;
import java.util.Objects;

/**
 * Source and inclusive line span of a piece of data.
 *
 * <p>A missing line span means the origin describes the whole source. Origins are ordered by
 * {@code (source, lineStart, lineEnd)}; an origin without a span sorts before any spanned origin
 * of the same source.
 */
public final class Origin implements Comparable<Origin> {
    private static final Comparator<Integer> LINE_ORDER = Comparator.nullsFirst(Comparator.naturalOrder());

    private final TextSource source;
    private final Integer lineStart;
    private final Integer lineEnd;

    public Origin(final TextSource source, final Integer lineStart, final Integer lineEnd) {
        this.source = Objects.requireNonNull(source, "source");
        if ((lineStart == null) != (lineEnd == null)) {
            throw new IllegalArgumentException("lineStart and lineEnd must both be set or both be absent");
        }
        if (lineStart != null && (lineStart < 1 || lineEnd < lineStart)) {
            throw new IllegalArgumentException(
                    "invalid line span " + lineStart + "-" + lineEnd + " for " + source.displayName());
        }
        this.lineStart = lineStart;
        this.lineEnd = lineEnd;
    }

    public static Origin of(final TextSource source) {
        return new Origin(source, null, null);
    }

    public static Origin unknown() {
        return new Origin(UnknownTextSource.INSTANCE, null, null);
    }

    /**
     * Origin covering every line of {@code text}.
     */
    public static Origin wholeText(final TextSource source, final String text) {
        Objects.requireNonNull(text, "text");
        int newlines = 0;
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) == '\n') {
                newlines++;
            }
        }
        return new Origin(source, 1, Math.max(1, newlines));
    }

    /**
     * Origin pointing at the Java code that called this method.
     */
    public static Origin callerOrigin() {
        return callerOrigin(0);
    }

    /**
     * Origin pointing at a frame further up the call stack.
     *
     * @param extraFrames frames to skip above the direct caller
     */
    public static Origin callerOrigin(final int extraFrames) {
        if (extraFrames < 0) {
            throw new IllegalArgumentException("extraFrames must be >= 0");
        }
        final StackWalker.StackFrame frame = StackWalker.getInstance()
                .walk(frames -> frames.skip(1L + extraFrames).findFirst())
                .orElseThrow(() -> new IllegalStateException("call stack is too shallow"));
        final int line = Math.max(1, frame.getLineNumber());
        return new Origin(new CallerTextSource(frame.getClassName(), frame.getFileName()), line, line);
    }

    public TextSource source() {
        return source;
    }

    public Integer lineStart() {
        return lineStart;
    }

    public Integer lineEnd() {
        return lineEnd;
    }

    public boolean hasSpan() {
        return lineStart != null;
    }

    /**
     * Origin of a single line located {@code offset} lines after the start of this one.
     */
    public Origin lineAt(final int offset) {
        if (lineStart == null) {
            return this;
        }
        final int line = lineStart + offset;
        return new Origin(source, line, line);
    }

    @Override
    public int compareTo(final Origin other) {
        Objects.requireNonNull(other, "other");
        final int bySource = source.compareTo(other.source);
        if (bySource != 0) {
            return bySource;
        }
        final int byStart = LINE_ORDER.compare(lineStart, other.lineStart);
        if (byStart != 0) {
            return byStart;
        }
        return LINE_ORDER.compare(lineEnd, other.lineEnd);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Origin)) {
            return false;
        }
        final Origin that = (Origin) other;
        return source.equals(that.source)
                && Objects.equals(lineStart, that.lineStart)
                && Objects.equals(lineEnd, that.lineEnd);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, lineStart, lineEnd);
    }

    @Override
    public String toString() {
        if (lineStart == null) {
            return source.displayName();
        }
        if (lineStart.equals(lineEnd)) {
            return source.displayName() + ":" + lineStart;
        }
        return source.displayName() + ":" + lineStart + "-" + lineEnd;
    }
}
