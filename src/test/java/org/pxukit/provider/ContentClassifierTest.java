package org.pxukit.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pxukit.unit.FileRole;

class ContentClassifierTest {
    @TempDir
    Path base;

    private ContentClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ContentClassifier(ProviderLayout.underBase(base));
    }

    @Test
    void buildsRulesFromDeclaredDirectories() {
        assertEquals(
                List.of("jobs", "units", "whitelists", "data", "bin", "build-bin", "build-mo", "build", "po", "src",
                        "legal", "docs", "manage.py", "vcs", "unknown"),
                classifier.ruleNames());

        final ContentClassifier unitsOnly = new ContentClassifier(
                ProviderLayout.builder().unitsDir(base.resolve("units")).build());
        assertEquals(List.of("units", "unknown"), unitsOnly.ruleNames());
    }

    @Test
    void classifiesUnitSources() {
        assertResult(base.resolve("units/a.pxu"), FileRole.UNIT_SOURCE, base.resolve("units"), LoaderKind.UNIT_SOURCE);
        assertResult(base.resolve("units/nested/b.txt.in"), FileRole.UNIT_SOURCE, base.resolve("units"),
                LoaderKind.UNIT_SOURCE);
        assertResult(base.resolve("jobs/old.txt"), FileRole.UNIT_SOURCE, base.resolve("jobs"), LoaderKind.UNIT_SOURCE);
        assertResult(base.resolve("jobs/old.in"), FileRole.UNIT_SOURCE, base.resolve("jobs"), LoaderKind.UNIT_SOURCE);
        assertResult(base.resolve("units/notes.md"), FileRole.UNKNOWN, base, null);
    }

    @Test
    void specificDirectoriesWinOverBaseDirectoryRules() {
        assertResult(base.resolve("units/README.txt"), FileRole.UNIT_SOURCE, base.resolve("units"),
                LoaderKind.UNIT_SOURCE);
        assertResult(base.resolve("data/COPYING"), FileRole.DATA, base.resolve("data"), LoaderKind.PASSIVE);
        assertResult(base.resolve("data/.gitignore"), FileRole.DATA, base.resolve("data"), LoaderKind.PASSIVE);
        assertResult(base.resolve("src/README"), FileRole.SRC, base, null);
    }

    @Test
    void classifiesSelectionListsAndData() {
        assertResult(base.resolve("whitelists/smoke.whitelist"), FileRole.LEGACY_WHITELIST,
                base.resolve("whitelists"), LoaderKind.SELECTION_LIST);
        assertResult(base.resolve("data/sample.csv"), FileRole.DATA, base.resolve("data"), LoaderKind.PASSIVE);
    }

    @Test
    void inspectsExecutablesForShebang() throws IOException {
        final Path script = executable(base.resolve("bin/probe"), "#!/bin/sh\necho ok\n");
        final Path binary = executable(base.resolve("bin/blob"), "\u007fELF");
        final Path plain = base.resolve("bin/notes");
        Files.writeString(plain, "not executable", StandardCharsets.UTF_8);

        assertResult(script, FileRole.SCRIPT, base.resolve("bin"), LoaderKind.PASSIVE);
        assertResult(binary, FileRole.BINARY, base.resolve("bin"), LoaderKind.PASSIVE);
        assertResult(plain, FileRole.UNKNOWN, base, null);
    }

    @Test
    void buildBinExecutablesNeedExecutablesHint() throws IOException {
        Files.createDirectories(base.resolve("src"));
        Files.writeString(base.resolve("src/EXECUTABLES"), "built\n\n", StandardCharsets.UTF_8);
        final Path built = executable(base.resolve("build/bin/built"), "#!/bin/sh\n");
        final Path stray = executable(base.resolve("build/bin/stray"), "#!/bin/sh\n");

        assertResult(built, FileRole.SCRIPT, base.resolve("build/bin"), LoaderKind.PASSIVE);
        assertResult(stray, FileRole.BUILD, base.resolve("build"), null);
    }

    @Test
    void classifiesBuildAndTranslationFiles() {
        assertResult(base.resolve("build/mo/fr/LC_MESSAGES/p.mo"), FileRole.I18N, base.resolve("build/mo"),
                LoaderKind.PASSIVE);
        assertResult(base.resolve("build/mo/fr/notes.txt"), FileRole.BUILD, base.resolve("build"), null);
        assertResult(base.resolve("build/obj/x.o"), FileRole.BUILD, base.resolve("build"), null);
        assertResult(base.resolve("po/fr.po"), FileRole.SRC, base, null);
        assertResult(base.resolve("po/POTFILES.in"), FileRole.SRC, base, null);
        assertResult(base.resolve("po/extra/fr.po"), FileRole.UNKNOWN, base, null);
        assertResult(base.resolve("src/main.c"), FileRole.SRC, base, null);
    }

    @Test
    void classifiesFilesAtTheBase() {
        assertResult(base.resolve("COPYING"), FileRole.LEGAL, base, null);
        assertResult(base.resolve("LICENSE"), FileRole.LEGAL, base, null);
        assertResult(base.resolve("README.md"), FileRole.DOCS, base, null);
        assertResult(base.resolve("manage.py"), FileRole.MANAGE_PY, base, null);
        assertResult(base.resolve("tools/manage.py"), FileRole.UNKNOWN, base, null);
        assertResult(base.resolve(".gitignore"), FileRole.VCS, base, null);
        assertResult(base.resolve(".git/objects/ab/cdef"), FileRole.VCS, base, null);
        assertResult(base.resolve("random.bin"), FileRole.UNKNOWN, base, null);
    }

    @Test
    void unknownFilesOfProviderWithoutBaseHaveNoBase() {
        final ContentClassifier unitsOnly = new ContentClassifier(
                ProviderLayout.builder().unitsDir(base.resolve("units")).build());

        final ClassificationResult result = unitsOnly.classify(base.resolve("elsewhere/file"));

        assertEquals(FileRole.UNKNOWN, result.role());
        assertNull(result.baseDirectory());
        assertEquals(Optional.empty(), result.loader());
    }

    private void assertResult(final Path path, final FileRole role, final Path baseDir, final LoaderKind loader) {
        final ClassificationResult result = classifier.classify(path);
        assertEquals(role, result.role(), "role of " + path);
        assertEquals(baseDir, result.baseDirectory(), "base of " + path);
        assertEquals(Optional.ofNullable(loader), result.loader(), "loader of " + path);
    }

    private static Path executable(final Path path, final String content) throws IOException {
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
        Files.setPosixFilePermissions(path, PosixFilePermissions.fromString("rwxr-xr-x"));
        assertTrue(Files.isExecutable(path));
        return path;
    }
}
