package org.pxukit.provider;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.pxukit.qualifier.SelectionList;
import org.pxukit.unit.Unit;

/**
 * Everything one file contributed to a load pass.
 *
 * @param units units discovered in the file, including its file provenance unit
 * @param synthesizedUnits compatibility units that are not present in the file text
 */
public record LoadedContent(
        Path path, List<Unit> units, List<Unit> synthesizedUnits, List<SelectionList> selectionLists) {
    public LoadedContent {
        Objects.requireNonNull(path, "path");
        units = List.copyOf(Objects.requireNonNull(units, "units"));
        synthesizedUnits = List.copyOf(Objects.requireNonNull(synthesizedUnits, "synthesizedUnits"));
        selectionLists = List.copyOf(Objects.requireNonNull(selectionLists, "selectionLists"));
    }

    public List<Unit> allUnits() {
        final List<Unit> all = new ArrayList<>(units.size() + synthesizedUnits.size());
        all.addAll(units);
        all.addAll(synthesizedUnits);
        return List.copyOf(all);
    }
}
