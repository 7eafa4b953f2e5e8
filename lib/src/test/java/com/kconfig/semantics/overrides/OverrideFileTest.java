package com.kconfig.semantics.overrides;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.diagnostic.Severity;
import com.kconfig.semantics.diagnostic.SuggestedFix;
import com.kconfig.semantics.diagnostic.TextEdit;
import com.kconfig.semantics.loader.KconfigLoader;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OverrideFileTest {

    private Path tempDir;
    private Repository repository;

    @BeforeEach
    void loadRepository() throws Exception {
        tempDir = Files.createTempDirectory("kconfig-overrides");
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(
                kconfig,
                String.join(
                        "\n",
                        "config FLAG",
                        "\tbool \"Flag\"",
                        "config ADDR",
                        "\thex \"Address\"",
                        "config COUNT",
                        "\tint \"Count\"",
                        "config NAME",
                        "\tstring \"Name\"",
                        ""));
        repository = new KconfigLoader().load(kconfig).getRepository();
    }

    @Test
    void parsesAssignmentsAndReportsBrokenLines() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);

        OverrideFile.Snapshot snapshot = file.parse(String.join(
                "\n",
                "# comment",
                "CONFIG_FLAG=y",
                "",
                "this is junk",
                "CONFIG_FLAG",
                "CONFIG_NOPE=y",
                "CONFIG_ADDR=16",
                "CONFIG_FLAG=y garbage # note",
                "CONFIG_NAME=\"quoted \\\"text\\\"\"",
                "CONFIG_COUNT=0x20"));

        assertEquals(1, snapshot.version());
        assertEquals(
                List.of("CONFIG_FLAG=y", "CONFIG_NAME=\"quoted \\\"text\\\"\""),
                snapshot.overrides().stream().map(ConfigOverride::toLine).collect(Collectors.toList()));
        assertEquals("quoted \\\"text\\\"", snapshot.overrides().get(1).getValue());
        assertEquals(9, snapshot.overrides().get(1).getLine());

        List<Diagnostic> diagnostics = snapshot.diagnostics();
        assertEquals(
                List.of(
                        "Syntax error: All lines must either be comments or config entries with values.",
                        "Missing value for config FLAG",
                        "Unknown entry NOPE",
                        "Invalid value. Entry ADDR is hex.",
                        "Unexpected trailing characters",
                        "Invalid value. Entry COUNT is int."),
                diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList()));
        assertEquals(
                List.of(4, 5, 6, 7, 8, 10),
                diagnostics.stream().map(Diagnostic::getLine).collect(Collectors.toList()));
        assertTrue(diagnostics.stream().allMatch(d -> d.getSeverity() == Severity.ERROR));

        Diagnostic trailing = diagnostics.get(4);
        assertEquals(15, trailing.getRange().getStartColumn());
        assertEquals(22, trailing.getRange().getEndColumn());
    }

    @Test
    void offersBaseConversionForNumbers() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);

        List<Diagnostic> diagnostics = file.parse("CONFIG_ADDR=16\nCONFIG_COUNT=0x20\n").diagnostics();

        SuggestedFix toHex = diagnostics.get(0).getFixes().get(0);
        assertEquals("Convert to hex (0x10)", toHex.getTitle());
        assertTrue(toHex.isPreferred());
        TextEdit edit = toHex.getEdits().get(0);
        assertEquals(TextEdit.Kind.REPLACE, edit.getKind());
        assertEquals("0x10", edit.getText());
        assertEquals(13, edit.getRange().getStartColumn());
        assertEquals(15, edit.getRange().getEndColumn());

        assertEquals("Convert to int (32)", diagnostics.get(1).getFixes().get(0).getTitle());
    }

    @Test
    void numbersBeyondSixtyFourBitsAreInvalidWithoutConversion() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);

        OverrideFile.Snapshot snapshot = file.parse(String.join(
                "\n",
                "CONFIG_ADDR=99999999999999999999",
                "CONFIG_COUNT=99999999999999999999",
                "CONFIG_COUNT=0x1ffffffffffffffff",
                "CONFIG_ADDR=0xffffffffffffffff"));

        List<Diagnostic> diagnostics = snapshot.diagnostics();
        assertEquals(
                List.of(
                        "Invalid value. Entry ADDR is hex.",
                        "Invalid value. Entry COUNT is int.",
                        "Invalid value. Entry COUNT is int."),
                diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList()));
        assertTrue(diagnostics.stream().allMatch(d -> d.getFixes().isEmpty()));
        assertEquals(List.of("CONFIG_ADDR=0xffffffffffffffff"),
                snapshot.overrides().stream().map(ConfigOverride::toLine).collect(Collectors.toList()));
    }

    @Test
    void invalidBooleanHasNoConversion() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);

        List<Diagnostic> diagnostics = file.parse("CONFIG_FLAG=1\n").diagnostics();

        assertEquals("Invalid value. Entry FLAG is bool.", diagnostics.get(0).getMessage());
        assertTrue(diagnostics.get(0).getFixes().isEmpty());
    }

    @Test
    void everyParseIsANewVersion() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);
        OverrideFile.Snapshot first = file.parse("CONFIG_FLAG=y\n");

        OverrideFile.Snapshot second = file.parse("CONFIG_FLAG=n\n");

        assertEquals(1, first.version());
        assertEquals(2, second.version());
        assertEquals(2, file.getVersion());
        assertEquals("y", first.overrides().get(0).getValue());
        assertEquals("n", file.getOverrides().get(0).getValue());
    }

    @Test
    void unreadableLinesAreSkippedIndividually() {
        OverrideFile file = new OverrideFile(tempDir.resolve("prj.conf"), repository);
        List<Diagnostic> diagnostics = new ArrayList<>();

        assertNull(file.parseLine("   # indented comment", 1, diagnostics));
        assertNull(file.parseLine("CONFIG_NOPE=y", 2, diagnostics));
        assertEquals("CONFIG_COUNT=-5", file.parseLine("  CONFIG_COUNT = -5", 3, diagnostics).toLine());
        assertEquals(1, diagnostics.size());
    }

    @Test
    void buildContextOrdersFilesBeforeBaseOverrides() throws Exception {
        Path first = tempDir.resolve("prj.conf");
        Path second = tempDir.resolve("extra.conf");
        Files.writeString(first, "CONFIG_COUNT=1\n");
        Files.writeString(second, "CONFIG_COUNT=2\nCONFIG_FLAG=y\n");
        BuildContext build = new BuildContext(
                repository, List.of(new ConfigOverride(repository.get("COUNT"), "3")));

        OverrideFile prj = build.open(first);
        build.open(second);

        assertEquals(
                List.of("CONFIG_COUNT=1", "CONFIG_COUNT=2", "CONFIG_FLAG=y", "CONFIG_COUNT=3"),
                build.overrides().stream().map(ConfigOverride::toLine).collect(Collectors.toList()));
        assertEquals(prj, build.find(tempDir.resolve("./prj.conf")).orElseThrow());

        assertTrue(build.removeFile(prj));
        assertEquals(1, build.getFiles().size());
        assertEquals("2", build.overrides().get(0).getValue());
    }
}
