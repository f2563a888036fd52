package org.pxukit.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pxukit.obs.JsonLinesLogger;
import org.pxukit.unit.JobUnit;

class ProviderTest {
    @TempDir
    Path base;

    @Test
    void namespaceIsTheNameBeforeTheColon() {
        final Provider provider = Provider.builder("2013.org.example:smoke", "1.0").build();

        assertEquals("2013.org.example", provider.namespace());
        assertEquals("<Provider name:'2013.org.example:smoke'>", provider.toString());
        assertFalse(provider.isLoaded());
    }

    @Test
    void translatesOnlyWithGettextDomain() {
        final MessageCatalog catalog = MessageCatalog.of(Map.of("Smoke tests", "Tests de fumée"));
        final Provider translated = Provider.builder("2013.org.example:smoke", "1.0")
                .description("Smoke tests")
                .gettextDomain("smoke")
                .messageCatalog(catalog)
                .build();
        final Provider untranslated = Provider.builder("2013.org.example:smoke", "1.0")
                .description("Smoke tests")
                .messageCatalog(catalog)
                .build();

        assertEquals("Tests de fumée", translated.translatedDescription());
        assertEquals("unknown", translated.translate("unknown"));
        assertEquals("Smoke tests", untranslated.translatedDescription());
        assertEquals(Optional.empty(), untranslated.gettextDomain());
    }

    @Test
    void loadAllJobsSortsByIdentifierAndKeepsProblems() throws IOException {
        write("units/b.pxu", "id: zeta\nplugin: shell\ncommand: z\n\nid: alpha\nplugin: shell\ncommand: a\n");
        write("units/c.pxu", "unit: category\nid: cat\nname: Cat\n");
        write("units/d.pxu", "broken line\n");
        final Provider provider = provider();

        final LoadReport report = provider.loadAllJobs();

        final List<String> ids = new ArrayList<>();
        for (final JobUnit job : report.jobs()) {
            ids.add(job.partialId());
        }
        assertEquals(List.of("alpha", "zeta"), ids);
        assertTrue(report.hasProblems());
        assertTrue(provider.isLoaded());

        final ContentLoadException error = assertThrows(ContentLoadException.class, provider::builtinJobs);
        assertEquals(base.resolve("units/d.pxu"), error.path());
    }

    @Test
    void builtinSelectionListsFailOnBrokenListFiles() throws IOException {
        write("whitelists/b.whitelist", "usb\n");
        write("whitelists/a.whitelist", "audio\n");
        final Provider provider = provider();

        assertEquals(List.of("a", "b"), names(provider));

        write("whitelists/c.whitelist", "(unclosed\n");
        provider.load();
        final ContentLoadException error = assertThrows(ContentLoadException.class, provider::builtinSelectionLists);
        assertTrue(error.getMessage().startsWith("Cannot load whitelist '"), error.getMessage());
    }

    @Test
    void listsExecutablesOfBinAndBuildBin() throws IOException {
        executable("bin/probe");
        write("bin/readme.txt", "not executable");
        executable("build/bin/compiled");
        executable("build/bin/helper");
        final Provider provider = provider();

        assertEquals(
                List.of(base.resolve("bin/probe"), base.resolve("build/bin/compiled"), base.resolve("build/bin/helper")),
                provider.allExecutables());

        write("src/EXECUTABLES", "compiled\n");
        final Provider hinted = provider();
        assertEquals(List.of(base.resolve("bin/probe"), base.resolve("build/bin/compiled")), hinted.allExecutables());
    }

    @Test
    void noExecutablesWhenDirectoriesAreMissing() throws IOException {
        assertEquals(List.of(), provider().allExecutables());
    }

    @Test
    void buildsFromDefinition() throws IOException {
        Files.createDirectories(base.resolve("units"));
        Files.createDirectories(base.resolve("build/mo"));
        final ProviderDefinition definition = ProviderDefinition.fromMap(Map.of(
                "name", "2013.org.example:smoke",
                "version", "1.2",
                "description", "Smoke",
                "gettext_domain", "smoke",
                "location", base.toString()));

        final Provider provider = Provider.fromDefinition(definition, true, JsonLinesLogger.noop());

        assertTrue(provider.isSecure());
        assertEquals(Optional.of("smoke"), provider.gettextDomain());
        assertEquals(Optional.of(base.resolve("units")), provider.layout().unitsDir());
        assertEquals(Optional.empty(), provider.layout().jobsDir());
        assertEquals(Optional.of(base.resolve("build/mo")), provider.layout().localeDir());
        assertEquals(Optional.of(base), provider.layout().baseDir());
    }

    private Provider provider() {
        return Provider.builder("2013.org.example:smoke", "1.0").layout(ProviderLayout.underBase(base)).build();
    }

    private static List<String> names(final Provider provider) throws IOException {
        final List<String> names = new ArrayList<>();
        provider.builtinSelectionLists().forEach(list -> names.add(list.name()));
        return names;
    }

    private void write(final String relative, final String content) throws IOException {
        final Path path = base.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private void executable(final String relative) throws IOException {
        write(relative, "#!/bin/sh\n");
        Files.setPosixFilePermissions(base.resolve(relative), PosixFilePermissions.fromString("rwxr-xr-x"));
    }
}
