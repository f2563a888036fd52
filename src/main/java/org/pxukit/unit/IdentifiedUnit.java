package org.pxukit.unit;

import java.util.Map;
import java.util.Optional;
import org.pxukit.rfc822.Record;

/**
 * Unit addressed by an identifier, qualified with the provider namespace.
 */
public abstract class IdentifiedUnit extends Unit {
    public static final String NAMESPACE_SEPARATOR = "::";

    protected IdentifiedUnit(
            final UnitKind kind,
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        super(kind, record, provider, parameters, virtual);
    }

    /**
     * Identifier as written in the record.
     */
    public String partialId() {
        return value("id");
    }

    @Override
    public Optional<String> id() {
        final String partialId = partialId();
        if (partialId == null || partialId.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(qualify(partialId));
    }

    /**
     * Prefixes {@code partialId} with the provider namespace unless it is already qualified.
     */
    protected final String qualify(final String partialId) {
        if (partialId.contains(NAMESPACE_SEPARATOR)) {
            return partialId;
        }
        return provider()
                .map(owner -> owner.namespace() + NAMESPACE_SEPARATOR + partialId)
                .orElse(partialId);
    }

    @Override
    protected void inspect(final Issues issues, final CheckContext context) {
        final String partialId = partialId();
        if (partialId == null || partialId.isBlank()) {
            issues.error("id", Problem.MISSING, null);
            return;
        }
        if (!partialId.equals(partialId.strip()) || partialId.chars().anyMatch(Character::isWhitespace)) {
            issues.error("id", Problem.WRONG, "identifier cannot contain whitespace");
        }
    }
}
