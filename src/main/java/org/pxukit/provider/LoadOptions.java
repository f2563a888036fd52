package org.pxukit.provider;

import java.util.Objects;
import org.pxukit.unit.CheckContext;
import org.pxukit.unit.ValidationOptions;

/**
 * Options for one load pass.
 *
 * @param validate run static validation on every unit (default on)
 * @param validation what static validation rejects
 * @param check run consistency checks and reject files with error-severity issues (default off)
 * @param checkContext units visible to cross-reference checks, may be {@code null}
 */
public record LoadOptions(boolean validate, ValidationOptions validation, boolean check, CheckContext checkContext) {
    private static final LoadOptions DEFAULTS = new LoadOptions(true, ValidationOptions.DEFAULT, false, null);

    public LoadOptions {
        Objects.requireNonNull(validation, "validation");
    }

    public static LoadOptions defaults() {
        return DEFAULTS;
    }

    public LoadOptions withValidate(final boolean enabled) {
        return new LoadOptions(enabled, validation, check, checkContext);
    }

    public LoadOptions withValidation(final ValidationOptions options) {
        return new LoadOptions(validate, options, check, checkContext);
    }

    public LoadOptions withCheck(final boolean enabled, final CheckContext context) {
        return new LoadOptions(validate, validation, enabled, context);
    }
}
