package org.pxukit.unit;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Units visible to cross-reference checks.
 */
public final class CheckContext {
    private static final CheckContext EMPTY = new CheckContext(Map.of());

    private final Map<String, List<Unit>> unitsById;

    private CheckContext(final Map<String, List<Unit>> unitsById) {
        this.unitsById = unitsById;
    }

    public static CheckContext empty() {
        return EMPTY;
    }

    public static CheckContext of(final Collection<? extends Unit> units) {
        Objects.requireNonNull(units, "units");
        final Map<String, List<Unit>> index = new LinkedHashMap<>();
        for (final Unit unit : units) {
            unit.id().ifPresent(id -> index.computeIfAbsent(id, ignored -> new ArrayList<>()).add(unit));
        }
        final Map<String, List<Unit>> frozen = new LinkedHashMap<>();
        index.forEach((id, list) -> frozen.put(id, List.copyOf(list)));
        return new CheckContext(Map.copyOf(frozen));
    }

    public boolean hasUnit(final String id) {
        return unitsById.containsKey(id);
    }

    public boolean hasUnit(final String id, final UnitKind kind) {
        return units(id).stream().anyMatch(unit -> unit.kind() == kind);
    }

    public List<Unit> units(final String id) {
        return unitsById.getOrDefault(id, List.of());
    }
}
