package org.pxukit.provider;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Directories a provider declares. Every directory is optional.
 *
 * <p>When a base directory is declared, the source layout directories ({@code build},
 * {@code build/bin}, {@code build/mo}, {@code src} and {@code po}) are derived from it.
 */
public final class ProviderLayout {
    private final Path unitsDir;
    private final Path jobsDir;
    private final Path whitelistsDir;
    private final Path dataDir;
    private final Path binDir;
    private final Path localeDir;
    private final Path baseDir;

    private ProviderLayout(final Builder builder) {
        this.unitsDir = normalize(builder.unitsDir);
        this.jobsDir = normalize(builder.jobsDir);
        this.whitelistsDir = normalize(builder.whitelistsDir);
        this.dataDir = normalize(builder.dataDir);
        this.binDir = normalize(builder.binDir);
        this.localeDir = normalize(builder.localeDir);
        this.baseDir = normalize(builder.baseDir);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Conventional layout of a provider kept in one directory.
     */
    public static ProviderLayout underBase(final Path baseDir) {
        final Path base = normalize(Objects.requireNonNull(baseDir, "baseDir"));
        return builder()
                .baseDir(base)
                .unitsDir(base.resolve("units"))
                .jobsDir(base.resolve("jobs"))
                .whitelistsDir(base.resolve("whitelists"))
                .dataDir(base.resolve("data"))
                .binDir(base.resolve("bin"))
                .localeDir(base.resolve("build").resolve("mo"))
                .build();
    }

    public Optional<Path> unitsDir() {
        return Optional.ofNullable(unitsDir);
    }

    public Optional<Path> jobsDir() {
        return Optional.ofNullable(jobsDir);
    }

    public Optional<Path> whitelistsDir() {
        return Optional.ofNullable(whitelistsDir);
    }

    public Optional<Path> dataDir() {
        return Optional.ofNullable(dataDir);
    }

    public Optional<Path> binDir() {
        return Optional.ofNullable(binDir);
    }

    public Optional<Path> localeDir() {
        return Optional.ofNullable(localeDir);
    }

    public Optional<Path> baseDir() {
        return Optional.ofNullable(baseDir);
    }

    public Optional<Path> buildDir() {
        return derived("build");
    }

    public Optional<Path> buildBinDir() {
        return derived("build", "bin");
    }

    public Optional<Path> buildMoDir() {
        return derived("build", "mo");
    }

    public Optional<Path> srcDir() {
        return derived("src");
    }

    public Optional<Path> poDir() {
        return derived("po");
    }

    /**
     * Roots to enumerate content from.
     *
     * <p>A provider with a base directory is enumerated from the base directory plus the source and
     * build output directories; otherwise from each declared content directory.
     */
    public List<Path> contentDirectories() {
        final List<Path> dirs = new ArrayList<>();
        if (baseDir != null) {
            dirs.add(baseDir);
            srcDir().ifPresent(dirs::add);
            buildBinDir().ifPresent(dirs::add);
            buildMoDir().ifPresent(dirs::add);
            return List.copyOf(dirs);
        }
        for (final Path dir : new Path[] {unitsDir, jobsDir, dataDir, binDir, localeDir, whitelistsDir}) {
            if (dir != null) {
                dirs.add(dir);
            }
        }
        return List.copyOf(dirs);
    }

    private Optional<Path> derived(final String first, final String... more) {
        if (baseDir == null) {
            return Optional.empty();
        }
        Path dir = baseDir.resolve(first);
        for (final String part : more) {
            dir = dir.resolve(part);
        }
        return Optional.of(dir);
    }

    private static Path normalize(final Path path) {
        return path == null ? null : path.toAbsolutePath().normalize();
    }

    @Override
    public String toString() {
        return "ProviderLayout{base=" + baseDir + ", units=" + unitsDir + ", jobs=" + jobsDir
                + ", whitelists=" + whitelistsDir + ", data=" + dataDir + ", bin=" + binDir
                + ", locale=" + localeDir + "}";
    }

    public static final class Builder {
        private Path unitsDir;
        private Path jobsDir;
        private Path whitelistsDir;
        private Path dataDir;
        private Path binDir;
        private Path localeDir;
        private Path baseDir;

        private Builder() {}

        public Builder unitsDir(final Path unitsDir) {
            this.unitsDir = unitsDir;
            return this;
        }

        public Builder jobsDir(final Path jobsDir) {
            this.jobsDir = jobsDir;
            return this;
        }

        public Builder whitelistsDir(final Path whitelistsDir) {
            this.whitelistsDir = whitelistsDir;
            return this;
        }

        public Builder dataDir(final Path dataDir) {
            this.dataDir = dataDir;
            return this;
        }

        public Builder binDir(final Path binDir) {
            this.binDir = binDir;
            return this;
        }

        public Builder localeDir(final Path localeDir) {
            this.localeDir = localeDir;
            return this;
        }

        public Builder baseDir(final Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        public ProviderLayout build() {
            return new ProviderLayout(this);
        }
    }
}
