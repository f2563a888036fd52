package org.pxukit.unit;

import java.util.Locale;

/**
 * Role of a file inside a provider.
 */
public enum FileRole {
    UNIT_SOURCE("unit-source"),
    LEGACY_WHITELIST("legacy-whitelist"),
    SCRIPT("script"),
    BINARY("binary"),
    DATA("data"),
    I18N("i18n"),
    BUILD("build"),
    MANAGE_PY("manage.py"),
    LEGAL("legal"),
    DOCS("docs"),
    SRC("src"),
    VCS("vcs"),
    UNKNOWN("unknown");

    private final String value;

    FileRole(final String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static FileRole fromText(final String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            throw new IllegalArgumentException("file role must not be blank");
        }
        final String value = rawValue.trim().toLowerCase(Locale.ROOT);
        for (final FileRole role : values()) {
            if (role.value.equals(value)) {
                return role;
            }
        }
        throw new IllegalArgumentException("unsupported file role: " + rawValue);
    }
}
