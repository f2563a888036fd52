package org.pxukit.provider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Contents of a {@code .provider} definition file.
 *
 * <p>Directory fields are optional. The effective value of a directory is the explicit one, or
 * else the conventional sub-directory of {@code location} when that exists.
 */
public record ProviderDefinition(
        String name,
        String version,
        String description,
        String gettextDomain,
        Path location,
        Path unitsDir,
        Path jobsDir,
        Path whitelistsDir,
        Path dataDir,
        Path binDir,
        Path localeDir) {
    static final Set<String> KEYS = Set.of(
            "name",
            "version",
            "description",
            "gettext_domain",
            "location",
            "units_dir",
            "jobs_dir",
            "whitelists_dir",
            "data_dir",
            "bin_dir",
            "locale_dir");

    /**
     * Builds a definition from the key/value pairs of a definition file. Unknown keys are rejected.
     */
    public static ProviderDefinition fromMap(final Map<String, ?> rawValues) {
        Objects.requireNonNull(rawValues, "rawValues");
        final Map<String, String> values = new LinkedHashMap<>();
        for (final Map.Entry<String, ?> entry : rawValues.entrySet()) {
            if (!KEYS.contains(entry.getKey())) {
                throw new IllegalArgumentException("unsupported provider definition key: " + entry.getKey());
            }
            final Object value = entry.getValue();
            if (value instanceof Map<?, ?> || value instanceof Iterable<?>) {
                throw new IllegalArgumentException(entry.getKey() + " must be a scalar value");
            }
            if (value != null && !String.valueOf(value).isBlank()) {
                values.put(entry.getKey(), String.valueOf(value).trim());
            }
        }
        return new ProviderDefinition(
                values.get("name"),
                values.get("version"),
                values.get("description"),
                values.get("gettext_domain"),
                path(values.get("location")),
                path(values.get("units_dir")),
                path(values.get("jobs_dir")),
                path(values.get("whitelists_dir")),
                path(values.get("data_dir")),
                path(values.get("bin_dir")),
                path(values.get("locale_dir")));
    }

    public Optional<String> effectiveGettextDomain() {
        return gettextDomain == null || gettextDomain.isBlank() ? Optional.empty() : Optional.of(gettextDomain);
    }

    public Optional<Path> effectiveUnitsDir() {
        return effective(unitsDir, "units");
    }

    public Optional<Path> effectiveJobsDir() {
        return effective(jobsDir, "jobs");
    }

    public Optional<Path> effectiveWhitelistsDir() {
        return effective(whitelistsDir, "whitelists");
    }

    public Optional<Path> effectiveDataDir() {
        return effective(dataDir, "data");
    }

    public Optional<Path> effectiveBinDir() {
        return effective(binDir, "bin");
    }

    /**
     * Explicit locale directory, else {@code location/locale}, else {@code location/build/mo}.
     */
    public Optional<Path> effectiveLocaleDir() {
        final Optional<Path> locale = effective(localeDir, "locale");
        if (locale.isPresent() || location == null) {
            return locale;
        }
        final Path built = location.resolve("build").resolve("mo");
        return Files.isDirectory(built) ? Optional.of(built) : Optional.empty();
    }

    public ProviderLayout effectiveLayout() {
        return ProviderLayout.builder()
                .baseDir(location)
                .unitsDir(effectiveUnitsDir().orElse(null))
                .jobsDir(effectiveJobsDir().orElse(null))
                .whitelistsDir(effectiveWhitelistsDir().orElse(null))
                .dataDir(effectiveDataDir().orElse(null))
                .binDir(effectiveBinDir().orElse(null))
                .localeDir(effectiveLocaleDir().orElse(null))
                .build();
    }

    private Optional<Path> effective(final Path explicit, final String conventional) {
        if (explicit != null) {
            return Optional.of(explicit);
        }
        if (location == null) {
            return Optional.empty();
        }
        final Path candidate = location.resolve(conventional);
        return Files.isDirectory(candidate) ? Optional.of(candidate) : Optional.empty();
    }

    private static Path path(final String value) {
        return value == null ? null : Path.of(value);
    }
}
