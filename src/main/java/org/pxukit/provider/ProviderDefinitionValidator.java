package org.pxukit.provider;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Static validator for {@link ProviderDefinition}.
 */
public final class ProviderDefinitionValidator {
    /** Year, reversed domain with at least one dot, then an identifier: {@code 2013.com.example:smoke}. */
    static final Pattern IQN_PATTERN =
            Pattern.compile("^[0-9]{4}\\.[a-z][a-z0-9-]*(\\.[a-z][a-z0-9-]*)+:[a-z][a-z0-9-]*$");
    static final Pattern VERSION_PATTERN = Pattern.compile("^[0-9]+(\\.[0-9]+)*$");
    static final Pattern GETTEXT_DOMAIN_PATTERN = Pattern.compile("^[a-z0-9_-]+$");

    private ProviderDefinitionValidator() {}

    public static void validateOrThrow(final ProviderDefinition definition) {
        final List<String> errors = validate(definition);
        if (!errors.isEmpty()) {
            throw new ProviderDefinitionValidationException(errors);
        }
    }

    public static List<String> validate(final ProviderDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        final List<String> errors = new ArrayList<>();

        if (definition.name() == null) {
            errors.add("name is required");
        } else if (!IQN_PATTERN.matcher(definition.name()).matches()) {
            errors.add("name must look like YYYY.example.org:name (actual: " + definition.name() + ")");
        }
        if (definition.version() == null) {
            errors.add("version is required");
        } else if (!VERSION_PATTERN.matcher(definition.version()).matches()) {
            errors.add("version must be a sequence of dot-separated numbers (actual: "
                    + definition.version() + ")");
        }
        if (definition.gettextDomain() != null
                && !GETTEXT_DOMAIN_PATTERN.matcher(definition.gettextDomain()).matches()) {
            errors.add("gettext_domain may contain only lowercase letters, digits, underscore and hyphen");
        }

        validateDirectory("location", definition.location(), errors);
        validateDirectory("units_dir", definition.unitsDir(), errors);
        validateDirectory("jobs_dir", definition.jobsDir(), errors);
        validateDirectory("whitelists_dir", definition.whitelistsDir(), errors);
        validateDirectory("data_dir", definition.dataDir(), errors);
        validateDirectory("bin_dir", definition.binDir(), errors);
        validateDirectory("locale_dir", definition.localeDir(), errors);
        return List.copyOf(errors);
    }

    private static void validateDirectory(final String key, final Path dir, final List<String> errors) {
        if (dir == null) {
            return;
        }
        if (!dir.isAbsolute()) {
            errors.add(key + " must be an absolute path (actual: " + dir + ")");
            return;
        }
        if (!Files.isDirectory(dir)) {
            errors.add(key + " must be an existing directory (actual: " + dir + ")");
        }
    }
}
