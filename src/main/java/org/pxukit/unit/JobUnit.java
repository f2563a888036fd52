package org.pxukit.unit;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.pxukit.rfc822.Record;

/**
 * Job definition: one test to run.
 *
 * <p>Legacy definitions carry their identifier in the {@code name} field instead of {@code id}.
 */
public final class JobUnit extends IdentifiedUnit {
    public static final Set<String> PLUGINS = Set.of(
            "shell",
            "manual",
            "user-interact",
            "user-verify",
            "user-interact-verify",
            "attachment",
            "resource",
            "local",
            "qml");

    private static final Set<String> COMMAND_REQUIRED = Set.of("shell", "attachment", "resource", "local");
    private static final Set<String> INTERACTIVE = Set.of(
            "manual", "user-interact", "user-verify", "user-interact-verify");

    private final Double estimatedDuration;

    public JobUnit(
            final Record record,
            final UnitProvider provider,
            final Map<String, String> parameters,
            final boolean virtual) {
        super(UnitKind.JOB, record, provider, parameters, virtual);
        this.estimatedDuration = parseNonNegativeNumber(value("estimated_duration"), "estimated_duration");
    }

    @Override
    public String partialId() {
        final String id = value("id");
        return id != null ? id : value("name");
    }

    public String summary() {
        return value("summary");
    }

    public String plugin() {
        return value("plugin");
    }

    public String command() {
        return value("command");
    }

    /**
     * The {@code description} field, or the newer {@code purpose} field when there is no description.
     */
    public String description() {
        final String description = value("description");
        return description != null ? description : value("purpose");
    }

    public String categoryId() {
        return value("category_id");
    }

    public List<String> depends() {
        return splitWords(value("depends"));
    }

    public String requires() {
        return value("requires");
    }

    public Set<String> flags() {
        return Set.copyOf(new LinkedHashSet<>(splitWords(value("flags"))));
    }

    public Optional<Double> estimatedDuration() {
        return Optional.ofNullable(estimatedDuration);
    }

    @Override
    protected void inspect(final Issues issues, final CheckContext context) {
        super.inspect(issues, context);
        if (value("id") == null && value("name") != null) {
            issues.advice("name", Problem.DEPRECATED, "use 'id' instead of 'name'");
        }

        final String plugin = plugin();
        if (issues.require("plugin")) {
            if (!PLUGINS.contains(plugin.trim())) {
                issues.error("plugin", Problem.WRONG, "unknown plugin '" + plugin + "'");
            } else if (COMMAND_REQUIRED.contains(plugin.trim()) && isBlank(command())) {
                issues.error("command", Problem.MISSING, "command is mandatory for " + plugin.trim() + " jobs");
            } else if ("manual".equals(plugin.trim()) && !isBlank(command())) {
                issues.warning("command", Problem.USELESS, "manual jobs do not run commands");
            }
            if (INTERACTIVE.contains(plugin.trim()) && isBlank(description())) {
                issues.warning("description", Problem.MISSING, "interactive jobs must explain what to do");
            }
        }
        if (isBlank(summary())) {
            issues.warning("summary", Problem.MISSING, null);
        }

        if (context == null) {
            return;
        }
        final String categoryId = categoryId();
        if (!isBlank(categoryId) && !context.hasUnit(qualify(categoryId.trim()), UnitKind.CATEGORY)) {
            issues.warning("category_id", Problem.UNKNOWN_REFERENCE, "unknown category '" + categoryId.trim() + "'");
        }
        for (final String dependency : depends()) {
            if (!context.hasUnit(qualify(dependency), UnitKind.JOB)) {
                issues.warning("depends", Problem.UNKNOWN_REFERENCE, "unknown job '" + dependency + "'");
            }
        }
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }
}
