package org.pxukit.provider;

import java.util.List;
import java.util.Objects;

/**
 * Aggregated provider definition validation errors.
 */
public final class ProviderDefinitionValidationException extends IllegalArgumentException {
    private final List<String> errors;

    public ProviderDefinitionValidationException(final List<String> errors) {
        super(formatMessage(errors));
        this.errors = List.copyOf(Objects.requireNonNull(errors, "errors"));
    }

    public List<String> errors() {
        return errors;
    }

    private static String formatMessage(final List<String> errors) {
        final List<String> normalized = List.copyOf(Objects.requireNonNull(errors, "errors"));
        final StringBuilder sb = new StringBuilder("provider definition is invalid");
        if (normalized.isEmpty()) {
            return sb.toString();
        }
        sb.append(" (").append(normalized.size()).append(" issue(s))");
        for (final String error : normalized) {
            sb.append('\n').append("- ").append(error);
        }
        return sb.toString();
    }
}
