package org.pxukit.unit;

import java.util.Map;
import java.util.Objects;
import org.pxukit.rfc822.Record;

/**
 * Registry of unit kinds, keyed by the value of the {@code unit} field.
 */
public enum UnitKind {
    JOB("job"),
    CATEGORY("category"),
    TEST_PLAN("test plan"),
    FILE("file");

    /**
     * Kind assumed for records without a {@code unit} field.
     */
    public static final UnitKind DEFAULT = JOB;

    private final String unitName;

    UnitKind(final String unitName) {
        this.unitName = unitName;
    }

    public String unitName() {
        return unitName;
    }

    public static UnitKind fromName(final String unitName) {
        Objects.requireNonNull(unitName, "unitName");
        for (final UnitKind kind : values()) {
            if (kind.unitName.equals(unitName.trim())) {
                return kind;
            }
        }
        throw new UnknownUnitKindException(unitName);
    }

    /**
     * Kind declared by {@code record}, or {@link #DEFAULT} when it declares none.
     */
    public static UnitKind of(final Record record) {
        final String declared = Objects.requireNonNull(record, "record").value(Unit.UNIT_FIELD);
        return declared == null ? DEFAULT : fromName(declared);
    }

    /**
     * Builds the unit variant of this kind from one record.
     *
     * @throws IllegalArgumentException when a field value is malformed
     */
    public Unit instantiate(
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        return switch (this) {
            case JOB -> new JobUnit(record, provider, parameters, virtual);
            case CATEGORY -> new CategoryUnit(record, provider, parameters, virtual);
            case TEST_PLAN -> new TestPlanUnit(record, provider, parameters, virtual);
            case FILE -> new FileUnit(record, provider, parameters, virtual);
        };
    }

    public Unit instantiate(final Record record, final UnitProvider provider) {
        return instantiate(record, provider, Map.of(), false);
    }

    @Override
    public String toString() {
        return unitName;
    }
}
