package org.pxukit.provider;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.bson.Document;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pxukit.obs.StructuredJsonLinesLogger;
import org.pxukit.rfc822.FileTextSource;
import org.pxukit.rfc822.Origin;
import org.pxukit.unit.FileRole;
import org.pxukit.unit.FileUnit;
import org.pxukit.unit.TestPlanUnit;
import org.pxukit.unit.Unit;
import org.pxukit.unit.ValidationOptions;

class ContentLoaderTest {
    private static final String NAME = "2013.org.example:smoke";
    private static final String NS = "2013.org.example::";

    private static final String GOOD_UNITS = String.join("\n",
            "id: audio/playback",
            "plugin: shell",
            "command: play sound.wav",
            "_summary: Play a sound",
            "",
            "id: audio/record",
            "plugin: shell",
            "command: record",
            "",
            "unit: category",
            "id: audio",
            "_name: Audio",
            "",
            "unit: test plan",
            "id: plan",
            "_name: Audio plan",
            "include:",
            " audio/.*",
            "");

    @TempDir
    Path base;

    @Test
    void oneBadFileNeverStopsTheRest() throws IOException {
        write("units/good.pxu", GOOD_UNITS);
        write("units/bad.pxu", "id: broken\nid: again\n");
        write("whitelists/smoke.whitelist", "audio/playback\n# comment\n");
        write("data/sound.wav", "RIFF");
        write("README.md", "docs");
        final Provider provider = provider();

        provider.load();

        assertTrue(provider.isLoaded());
        assertEquals(1, provider.problemList().size());
        final ContentProblem problem = provider.problemList().get(0);
        assertEquals(base.resolve("units/bad.pxu"), problem.path());
        assertEquals(ContentProblem.Kind.LOAD, problem.kind());
        assertTrue(problem.message().startsWith("Cannot load job definitions from '" + base.resolve("units/bad.pxu")
                + "': "), problem.message());
        assertTrue(problem.message().contains("Job has a duplicate key 'id'"));

        assertEquals(8, provider.unitList().size());
        assertEquals(
                List.of(NS + "audio", NS + "audio/playback", NS + "audio/record", NS + "plan", NS + "smoke"),
                provider.idMap().keySet().stream().sorted().toList());
        assertEquals(3, provider.pathMap().size());
        assertFalse(provider.pathMap().containsKey(base.resolve("units/bad.pxu").toString()));
        assertFalse(provider.pathMap().containsKey(base.resolve("README.md").toString()));
    }

    @Test
    void unitFilesYieldUnitsFileUnitAndSelectionLists() throws IOException {
        write("units/good.pxu", GOOD_UNITS);
        final Provider provider = provider();

        provider.load();

        final Path path = base.resolve("units/good.pxu");
        final List<Unit> fromFile = provider.pathMap().get(path.toString());
        assertEquals(1, fromFile.size());
        final FileUnit fileUnit = assertInstanceOf(FileUnit.class, fromFile.get(0));
        assertTrue(fileUnit.isVirtual());
        assertEquals(Optional.of(FileRole.UNIT_SOURCE), fileUnit.role());
        assertEquals(Optional.of(base.resolve("units").toString()), fileUnit.base());

        final Unit playback = provider.idMap().get(NS + "audio/playback").get(0);
        assertEquals(new Origin(new FileTextSource(path.toString()), 1, 4), playback.origin());
        assertFalse(playback.isVirtual());

        assertEquals(1, provider.selectionLists().size());
        assertEquals("plan", provider.selectionLists().get(0).name());
        assertTrue(provider.selectionLists().get(0).designates(NS + "audio/record"));
    }

    @Test
    void selectionListFilesSynthesizeVirtualTestPlans() throws IOException {
        final String text = "audio/playback\n# comment\nusb/.*\n";
        write("whitelists/smoke.whitelist", text);
        final Provider provider = provider();

        provider.load();

        assertEquals(List.of(), provider.problemList());
        final TestPlanUnit plan = assertInstanceOf(TestPlanUnit.class, provider.idMap().get(NS + "smoke").get(0));
        assertTrue(plan.isVirtual());
        assertEquals("smoke", plan.name());
        assertEquals(text, plan.include());
        final Path path = base.resolve("whitelists/smoke.whitelist");
        assertEquals(new Origin(new FileTextSource(path.toString()), 1, 3), plan.origin());

        final FileUnit fileUnit = assertInstanceOf(FileUnit.class, provider.pathMap().get(path.toString()).get(0));
        assertEquals(Optional.of(FileRole.LEGACY_WHITELIST), fileUnit.role());

        assertEquals(1, provider.builtinSelectionLists().size());
        assertEquals("smoke", provider.builtinSelectionLists().get(0).name());
    }

    @Test
    void reportsUnknownKindsAndInvalidUnits() throws IOException {
        write("units/a.pxu", "unit: exporter\nid: x\n");
        write("units/b.pxu", "id: no-plugin\n");
        write("units/c.pxu", "id: slow\nplugin: shell\ncommand: true\nestimated_duration: soon\n");
        final Provider provider = provider();

        provider.load();

        final List<String> messages = new ArrayList<>();
        for (final ContentProblem problem : provider.problemList()) {
            messages.add(problem.message());
        }
        assertEquals(3, messages.size());
        assertEquals("Unknown unit type: 'exporter'", messages.get(0));
        assertEquals("Problem in unit definition, field plugin: missing definition of required field", messages.get(1));
        assertTrue(messages.get(2).startsWith("Cannot define unit from record "), messages.get(2));
        assertTrue(messages.get(2).contains("c.pxu:1-4"), messages.get(2));
        assertTrue(provider.unitList().isEmpty());
    }

    @Test
    void validationCanBeDisabledOrTightened() throws IOException {
        write("units/a.pxu", "id: no-plugin\n\nid: plain\nplugin: shell\ncommand: true\n");
        final Provider provider = provider();

        provider.load(LoadOptions.defaults().withValidate(false));
        assertEquals(List.of(), provider.problemList());
        assertEquals(3, provider.unitList().size());

        write("units/a.pxu", "id: plain\nplugin: shell\ncommand: true\n");
        provider.load(LoadOptions.defaults().withValidation(new ValidationOptions(true, false)));
        assertEquals(1, provider.problemList().size());
        assertEquals("Problem in unit definition, field summary: missing definition of required field",
                provider.problemList().get(0).message());
    }

    @Test
    void checkModeRejectsFilesWithErrors() throws IOException {
        write("units/a.pxu", "id: bad id\nplugin: shell\ncommand: true\n");
        final Provider provider = provider();

        provider.load(LoadOptions.defaults().withValidate(false).withCheck(true, null));

        assertEquals(1, provider.problemList().size());
        assertTrue(provider.problemList().get(0).message().startsWith("Problem in unit definition, "));
        assertTrue(provider.problemList().get(0).message().contains("field 'id'"));
    }

    @Test
    void duplicateIdentifiersAreKept() throws IOException {
        write("units/a.pxu", "id: same\nplugin: shell\ncommand: one\n");
        write("units/b.pxu", "id: same\nplugin: shell\ncommand: two\n");
        final Provider provider = provider();

        provider.load();

        assertEquals(2, provider.idMap().get(NS + "same").size());
        assertEquals(List.of(), provider.problemList());
    }

    @Test
    void reloadingGivesTheSameUnits() throws IOException {
        write("units/good.pxu", GOOD_UNITS);
        write("whitelists/smoke.whitelist", "audio/.*\n");
        write("units/bad.pxu", "oops\n");
        final Provider provider = provider();

        provider.load();
        final List<Map<String, String>> first = recordData(provider.unitList());
        final int firstProblems = provider.problemList().size();
        provider.load();

        assertEquals(first, recordData(provider.unitList()));
        assertEquals(firstProblems, provider.problemList().size());
        assertEquals(1, provider.idMap().get(NS + "audio").size());
    }

    @Test
    void filesWithoutLoaderAreNeverRead() throws IOException {
        final ContentFile readme = new ContentFile(base.resolve("README.md"), () -> {
            throw new IOException("must not be read");
        });
        final ContentFile data = new ContentFile(base.resolve("data/blob.bin"), () -> {
            throw new IOException("must not be read");
        });
        final ContentFile units = new ContentFile(base.resolve("units/a.pxu"),
                LazyText.of("id: a\nplugin: shell\ncommand: true\n"));
        final Provider provider = Provider.builder(NAME, "1.0")
                .layout(ProviderLayout.underBase(base))
                .enumerator(() -> ContentEnumeration.of(List.of(readme, data, units)))
                .build();

        provider.load();

        assertEquals(List.of(), provider.problemList());
        assertFalse(readme.wasRead());
        assertFalse(data.wasRead());
        assertTrue(units.wasRead());
        assertEquals(3, provider.unitList().size());
    }

    @Test
    void logsEveryIndexedUnitWithItsIdentifier() throws IOException {
        final ContentFile units = new ContentFile(base.resolve("units/a.pxu"),
                LazyText.of("id: a\nplugin: shell\ncommand: true\n"));
        final StringWriter output = new StringWriter();
        final Provider provider = Provider.builder(NAME, "1.0")
                .layout(ProviderLayout.underBase(base))
                .enumerator(() -> ContentEnumeration.of(List.of(units)))
                .logger(new StructuredJsonLinesLogger(
                        output, Clock.fixed(Instant.EPOCH, ZoneOffset.UTC), true, "DEBUG"))
                .build();

        provider.load();

        final List<Document> indexed = new ArrayList<>();
        for (final String line : output.toString().trim().split("\\R")) {
            final Document event = Document.parse(line);
            if ("content.unit.indexed".equals(event.getString("message"))) {
                indexed.add(event);
            }
        }
        assertEquals(1, indexed.size());
        assertEquals(NS + "a", indexed.get(0).getString("unitId"));
        assertEquals(base.resolve("units/a.pxu").toString(), indexed.get(0).getString("path"));
        assertEquals("job", indexed.get(0).getString("kind"));
        assertEquals(NAME + "#1", indexed.get(0).getString("loadId"));
    }

    @Test
    void unreadableFilesBecomeProblems() throws IOException {
        final ContentFile units = new ContentFile(base.resolve("units/a.pxu"), () -> {
            throw new IOException("disk on fire");
        });
        final Provider provider = Provider.builder(NAME, "1.0")
                .layout(ProviderLayout.underBase(base))
                .enumerator(() -> new ContentEnumeration(
                        List.of(units),
                        List.of(new ContentProblem(base.resolve("units/locked"), ContentProblem.Kind.ENUMERATION,
                                "Permission denied", null))))
                .build();

        provider.load();

        assertEquals(2, provider.problemList().size());
        assertTrue(provider.problemList().get(0).message().contains("disk on fire"));
        assertEquals(ContentProblem.Kind.ENUMERATION, provider.problemList().get(1).kind());
    }

    @Test
    void missingDirectoriesAreSkipped() throws IOException {
        final Provider provider = provider();

        provider.load();

        assertTrue(provider.isLoaded());
        assertEquals(List.of(), provider.unitList());
        assertEquals(List.of(), provider.problemList());
    }

    private Provider provider() {
        return Provider.builder(NAME, "1.0").layout(ProviderLayout.underBase(base)).build();
    }

    private void write(final String relative, final String content) throws IOException {
        final Path path = base.resolve(relative);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private static List<Map<String, String>> recordData(final List<Unit> units) {
        final List<Map<String, String>> data = new ArrayList<>();
        for (final Unit unit : units) {
            data.add(unit.record().data());
        }
        return data;
    }
}
