package org.pxukit.unit;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.pxukit.rfc822.FileTextSource;
import org.pxukit.rfc822.Origin;
import org.pxukit.rfc822.Record;

/**
 * Provenance record for one file of a provider.
 */
public final class FileUnit extends Unit {
    public FileUnit(
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        super(UnitKind.FILE, record, provider, parameters, virtual);
    }

    /**
     * Virtual file unit whose origin is the whole file.
     *
     * @param base base directory the path is relative to after relocation, may be {@code null}
     */
    public static FileUnit describing(
            final String path, final FileRole role, final String base, final UnitProvider provider) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(role, "role");
        final Map<String, String> data = new LinkedHashMap<>();
        data.put(UNIT_FIELD, UnitKind.FILE.unitName());
        data.put("path", path);
        if (base != null) {
            data.put("base", base);
        }
        data.put("role", role.value());
        return new FileUnit(new Record(data, Origin.of(new FileTextSource(path))), provider, Map.of(), true);
    }

    @Override
    public Optional<String> path() {
        return Optional.ofNullable(value("path"));
    }

    public Optional<String> base() {
        return Optional.ofNullable(value("base"));
    }

    /**
     * Declared role, empty when the field is missing or names no known role.
     */
    public Optional<FileRole> role() {
        final String role = value("role");
        if (role == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(FileRole.fromText(role));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    @Override
    protected void inspect(final Issues issues, final CheckContext context) {
        issues.require("path");
        if (issues.require("role") && role().isEmpty()) {
            issues.error("role", Problem.WRONG, "unknown role '" + value("role") + "'");
        }
    }
}
