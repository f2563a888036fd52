package org.pxukit.obs;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Correlation metadata emitted with every content-loading log event.
 */
public final class LoadCorrelation {
    private final String loadId;
    private final String provider;
    private final String path;
    private final String unitId;

    private LoadCorrelation(Builder builder) {
        this.loadId = requireText(builder.loadId, "loadId");
        this.provider = requireText(builder.provider, "provider");
        this.path = normalize(builder.path);
        this.unitId = normalize(builder.unitId);
    }

    public static LoadCorrelation of(String loadId, String provider) {
        return builder(loadId, provider).build();
    }

    public static Builder builder(String loadId, String provider) {
        return new Builder(loadId, provider);
    }

    public String loadId() {
        return loadId;
    }

    public String provider() {
        return provider;
    }

    public Optional<String> path() {
        return Optional.ofNullable(path);
    }

    public Optional<String> unitId() {
        return Optional.ofNullable(unitId);
    }

    /**
     * Same load and provider, scoped to one file.
     */
    public LoadCorrelation forPath(String path) {
        return builder(loadId, provider).path(path).build();
    }

    /**
     * Same load, provider and path, scoped to one unit.
     */
    public LoadCorrelation forUnit(String unitId) {
        return builder(loadId, provider).path(path).unitId(unitId).build();
    }

    public Map<String, Object> asFields() {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("loadId", loadId);
        fields.put("provider", provider);
        if (path != null) {
            fields.put("path", path);
        }
        if (unitId != null) {
            fields.put("unitId", unitId);
        }
        return fields;
    }

    private static String requireText(String value, String fieldName) {
        String normalized = normalize(value);
        if (normalized == null) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return normalized;
    }

    private static String normalize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    public static final class Builder {
        private final String loadId;
        private final String provider;
        private String path;
        private String unitId;

        private Builder(String loadId, String provider) {
            this.loadId = Objects.requireNonNull(loadId, "loadId");
            this.provider = Objects.requireNonNull(provider, "provider");
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder unitId(String unitId) {
            this.unitId = unitId;
            return this;
        }

        public LoadCorrelation build() {
            return new LoadCorrelation(this);
        }
    }
}
