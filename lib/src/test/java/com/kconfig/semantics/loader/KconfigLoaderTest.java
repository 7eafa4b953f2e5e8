package com.kconfig.semantics.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.diagnostic.Severity;
import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.model.Entry;
import com.kconfig.semantics.model.MenuScope;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.Scope;
import com.kconfig.semantics.model.Symbol;
import com.kconfig.semantics.model.SymbolKind;
import com.kconfig.semantics.model.SymbolType;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class KconfigLoaderTest {

    private static Path write(Path file, String... lines) throws Exception {
        Files.createDirectories(file.getParent());
        Files.writeString(file, String.join("\n", lines) + "\n");
        return file;
    }

    private static List<String> messages(List<Diagnostic> diagnostics) {
        return diagnostics.stream().map(Diagnostic::getMessage).collect(Collectors.toList());
    }

    @Test
    void followsSourceDirectivesAndSubstitutesEnvironment() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "mainmenu \"Firmware for $(ARCH)\"",
                "config ROOT_OPTION",
                "\tbool \"Root option\"",
                "source \"$(SUBDIR)/Kconfig\"",
                "source \"drivers/*/Kconfig\"",
                "osource \"optional/Kconfig\"",
                "source \"missing/Kconfig\"");
        write(tempDir.resolve("arch/Kconfig"), "config ARCH_OPTION", "\tbool \"Arch\"", "rsource \"nested.kconfig\"");
        write(tempDir.resolve("arch/nested.kconfig"), "config NESTED_OPTION", "\tbool \"Nested\"");
        write(tempDir.resolve("drivers/uart/Kconfig"), "config UART", "\tbool \"UART\"");
        write(tempDir.resolve("drivers/spi/Kconfig"), "config SPI", "\tbool \"SPI\"");

        LoaderResult result = new KconfigLoader().load(kconfig, Map.of("ARCH", "arm", "SUBDIR", "arch"));
        Repository repository = result.getRepository();

        assertEquals("Firmware for arm", repository.getTitle());
        assertEquals(
                List.of("ROOT_OPTION", "ARCH_OPTION", "NESTED_OPTION", "SPI", "UART"),
                repository.getSymbols().stream().map(Symbol::getName).collect(Collectors.toList()));
        assertEquals(5, repository.getFiles().size());
        assertEquals(tempDir.resolve("arch/nested.kconfig").toAbsolutePath().normalize(),
                repository.get("NESTED_OPTION").getEntries().get(0).getFile());

        assertEquals(List.of("Unable to resolve missing/Kconfig"), messages(result.getDiagnostics()));
        Diagnostic unresolved = result.getDiagnostics().get(0);
        assertEquals(Severity.WARNING, unresolved.getSeverity());
        assertEquals(7, unresolved.getLine());
    }

    @Test
    void collectsEntryProperties() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "config HELPED",
                "\tint",
                "\tprompt \"Helped\" if ENABLE",
                "\tdefault 3 if ENABLE",
                "\tdefault 0x10",
                "\trange 1 32",
                "\tselect OTHER if ENABLE",
                "\timply SOFT",
                "\thelp",
                "\t  First line.",
                "",
                "\t    Indented line.",
                "config NEXT",
                "\tdef_bool y",
                "config LABEL",
                "\tdef_string \"text\" if NEXT");

        LoaderResult result = new KconfigLoader().load(kconfig);
        Repository repository = result.getRepository();
        Symbol helped = repository.get("HELPED");

        assertTrue(result.getDiagnostics().isEmpty(), () -> messages(result.getDiagnostics()).toString());
        assertEquals(SymbolType.INT, helped.getType());
        assertEquals("Helped", helped.getPrompt());
        assertEquals(2, helped.getDefaults().size());
        assertEquals("3", helped.getDefaults().get(0).value());
        assertEquals("ENABLE", helped.getDefaults().get(0).condition());
        assertNull(helped.getDefaults().get(1).condition());
        assertEquals("OTHER", helped.getSelects().get(0).target());
        assertEquals("SOFT", helped.getImplies().get(0).target());
        assertEquals("1", helped.getRanges().get(0).min());
        assertEquals("First line.\nIndented line.", helped.getHelp());

        Entry entry = helped.getEntries().get(0);
        assertEquals(1, entry.getStartLine());
        assertEquals(12, entry.getEndLine());

        assertEquals(SymbolType.BOOL, repository.get("NEXT").getType());
        assertFalse(repository.get("NEXT").hasPrompt());
        assertEquals(SymbolType.STRING, repository.get("LABEL").getType());
        assertEquals(ConfigValue.of("text"), repository.evaluate(repository.get("LABEL"), List.of()));
    }

    @Test
    void reportsStructuralProblems() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "default y",
                "config A",
                "\tbool \"A\"",
                "\tdepends on B",
                "\tdepends on B",
                "\tdepends on (C",
                "bogus token",
                "endmenu",
                "if A");

        LoaderResult result = new KconfigLoader().load(kconfig);
        List<Diagnostic> diagnostics = result.getDiagnostics();

        assertEquals(
                List.of(
                        "Token is only valid in an entry context",
                        "Duplicate dependency",
                        "Unmatched opening parenthesis",
                        "Invalid token",
                        "Unexpected endmenu",
                        "Unterminated if"),
                messages(diagnostics));
        assertEquals(
                List.of(1, 5, 6, 7, 8, 9),
                diagnostics.stream().map(Diagnostic::getLine).collect(Collectors.toList()));
        assertEquals(Severity.WARNING, diagnostics.get(0).getSeverity());
        assertEquals(Severity.ERROR, diagnostics.get(2).getSeverity());
        // both copies of the duplicate stay in effect
        assertEquals(List.of("B", "B", "(C"), result.getRepository().get("A").getDependencies());
    }

    @Test
    void dependsOnAfterCommentIsIgnoredButElsewhereIsUnexpected() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "comment \"Board settings\"",
                "\tdepends on A",
                "config A",
                "\tbool \"A\"",
                "if A",
                "depends on A",
                "endif");

        LoaderResult result = new KconfigLoader().load(kconfig);

        assertEquals(List.of("Unexpected depends on"), messages(result.getDiagnostics()));
        assertEquals(6, result.getDiagnostics().get(0).getLine());
    }

    @Test
    void menuDependenciesGateTheirEntries() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "config A",
                "\tbool \"A\"",
                "menu \"Peripherals\"",
                "\tdepends on A",
                "\tvisible if A",
                "config B",
                "\tbool \"B\"",
                "\tdefault y",
                "endmenu");

        Repository repository = new KconfigLoader().load(kconfig).getRepository();
        Entry entry = repository.get("B").getEntries().get(0);
        Scope scope = repository.getScopes().get(entry.getScopeId());

        assertEquals(Scope.Kind.MENU, scope.getKind());
        assertEquals("Peripherals", scope.getName());
        assertEquals(List.of("A"), ((MenuScope) scope).getDependencies());
        assertEquals(ConfigValue.FALSE, repository.evaluate(repository.get("B"), List.of()));
    }

    @Test
    void choiceDefaultsBecomeMemberDefaults() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "choice MODE",
                "\tprompt \"Mode\"",
                "\tdefault MODE_B",
                "config MODE_A",
                "\tbool \"A\"",
                "config MODE_B",
                "\tbool \"B\"",
                "endchoice",
                "choice",
                "config OTHER",
                "\tbool \"Other\"",
                "endchoice");

        Repository repository = new KconfigLoader().load(kconfig).getRepository();

        assertEquals(SymbolKind.CHOICE, repository.get("MODE").getKind());
        assertEquals(ConfigValue.TRUE, repository.evaluate(repository.get("MODE_B"), List.of()));
        assertEquals(ConfigValue.FALSE, repository.evaluate(repository.get("MODE_A"), List.of()));
        assertEquals(List.of("MODE", "MODE_A", "MODE_B", "OTHER"),
                repository.getSymbols().stream().map(Symbol::getName).collect(Collectors.toList()));

        Scope unnamed = repository.getScopes().get(repository.get("OTHER").getEntries().get(0).getScopeId());
        assertEquals(Scope.Kind.CHOICE, unnamed.getKind());
        assertEquals("<choice @ Kconfig:9>", unnamed.getName());
    }

    @Test
    void symbolsMayBeDeclaredInSeveralFiles() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(
                tempDir.resolve("Kconfig"),
                "config SHARED",
                "\tbool \"Shared\"",
                "source \"extra.kconfig\"");
        write(tempDir.resolve("extra.kconfig"), "config SHARED", "\tdefault y");

        Symbol shared = new KconfigLoader().load(kconfig).getRepository().get("SHARED");

        assertEquals(2, shared.getEntries().size());
        assertEquals(SymbolType.BOOL, shared.getType());
        assertTrue(shared.getEntries().get(1).getFile().endsWith("extra.kconfig"));
        assertEquals(1, shared.getLocation().getStartLine());
    }

    @Test
    void recursiveInclusionIsReported() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(tempDir.resolve("Kconfig"), "source \"loop.kconfig\"");
        write(tempDir.resolve("loop.kconfig"), "config LOOPED", "\tbool", "source \"Kconfig\"");

        LoaderResult result = new KconfigLoader().load(kconfig);

        assertEquals(1, result.getDiagnostics().size());
        Diagnostic diagnostic = result.getDiagnostics().get(0);
        assertTrue(diagnostic.getMessage().startsWith("Recursive inclusion of "), diagnostic.getMessage());
        assertTrue(diagnostic.getRange().getFile().endsWith("loop.kconfig"));
        assertNotNull(result.getRepository().get("LOOPED"));
    }

    @Test
    void missingRootFileFails() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");

        LoaderException ex =
                assertThrows(LoaderException.class, () -> new KconfigLoader().load(tempDir.resolve("Kconfig")));
        assertTrue(ex.getMessage().contains("Unable to read Kconfig file"), ex.getMessage());
        assertTrue(ex.getMessage().startsWith("[Version 0.1.0-beta (ANTLR 4.13.1)]"), ex.getMessage());
    }

    @Test
    void circularEnvironmentFails() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-loader");
        Path kconfig = write(tempDir.resolve("Kconfig"), "config A");

        assertThrows(
                LoaderException.class,
                () -> new KconfigLoader().load(kconfig, Map.of("A", "${B}", "B", "${A}")));
    }
}
