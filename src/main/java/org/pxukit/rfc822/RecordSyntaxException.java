package org.pxukit.rfc822;

import java.util.Objects;

/**
 * Malformed record text. Carries the source, the offending line number and a short description.
 */
public final class RecordSyntaxException extends IllegalArgumentException {
    private final TextSource source;
    private final int lineNumber;
    private final String detail;

    public RecordSyntaxException(final TextSource source, final int lineNumber, final String detail) {
        super(Objects.requireNonNull(source, "source").displayName() + ":" + lineNumber + ": "
                + Objects.requireNonNull(detail, "detail"));
        this.source = source;
        this.lineNumber = lineNumber;
        this.detail = detail;
    }

    public TextSource source() {
        return source;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String detail() {
        return detail;
    }
}
