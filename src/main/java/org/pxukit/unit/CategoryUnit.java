package org.pxukit.unit;

import java.util.Map;
import org.pxukit.rfc822.Record;

/**
 * Human-readable group that jobs refer to through their {@code category_id} field.
 */
public final class CategoryUnit extends IdentifiedUnit {
    public CategoryUnit(
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        super(UnitKind.CATEGORY, record, provider, parameters, virtual);
    }

    public String name() {
        return value("name");
    }

    public String translatedName() {
        return translatedValue("name");
    }

    @Override
    protected void inspect(final Issues issues, final CheckContext context) {
        super.inspect(issues, context);
        issues.require("name");
    }
}
