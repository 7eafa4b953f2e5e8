package com.kconfig.semantics.loader;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.kconfig.semantics.expr.ConfigValue;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParsedFileTest {

    private static final String ROOT_TEXT = String.join(
            "\n",
            "config FIRST",
            "\tbool \"First\"",
            "menu \"Drivers\"",
            "config IN_MENU",
            "\tbool \"In menu\"",
            "endmenu",
            "source \"child.kconfig\"",
            "");

    private static Repository load(Path tempDir) throws Exception {
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(kconfig, ROOT_TEXT);
        Files.writeString(tempDir.resolve("child.kconfig"), "config CHILD\n\tbool \"Child\"\n");
        return new KconfigLoader().load(kconfig).getRepository();
    }

    @Test
    void duplicateVersionsAreIgnored() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        ParsedFile root = repository.getRoot();

        assertTrue(root.update(ROOT_TEXT + "config ADDED\n", 1));
        assertFalse(root.update(ROOT_TEXT, 1));
        assertEquals(1, root.getVersion());
        assertNotNull(repository.get("ADDED"));
    }

    @Test
    void editsDropCompiledExpressions() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        repository.resolveExpression("FIRST || CHILD", List.of());
        assertTrue(repository.getExpressions().size() > 0);

        assertTrue(repository.getRoot().update(ROOT_TEXT + "config ADDED\n\tbool \"Added\"\n\tdepends on FIRST\n", 1));

        assertEquals(0, repository.getExpressions().size());
        assertEquals(ConfigValue.FALSE, repository.resolveExpression("ADDED", List.of()));
        ConfigOverride first = new ConfigOverride(repository.get("FIRST"), "y");
        ConfigOverride added = new ConfigOverride(repository.get("ADDED"), "y");
        assertEquals(ConfigValue.TRUE, repository.resolveExpression("ADDED", List.of(first, added)));
    }

    @Test
    void unchangedInclusionsAreReused() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        ParsedFile root = repository.getRoot();
        ParsedFile child = root.getIncludedFiles().get(0);

        assertTrue(root.update("config EXTRA\n\tbool\n" + ROOT_TEXT, 1));

        assertEquals(1, root.getIncludedFiles().size());
        assertSame(child, root.getIncludedFiles().get(0));
        assertNotNull(repository.get("CHILD"));
        assertNotNull(repository.get("EXTRA"));
    }

    @Test
    void droppedInclusionsRemoveTheirSymbols() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        ParsedFile root = repository.getRoot();

        assertTrue(root.update("config FIRST\n\tbool \"First\"\n", 1));

        assertTrue(root.getIncludedFiles().isEmpty());
        assertNull(repository.get("CHILD"));
        assertNull(repository.get("IN_MENU"));
        assertEquals(1, repository.get("FIRST").getEntries().size());
        assertEquals(List.of(root), repository.getFiles());
    }

    @Test
    void inclusionUnderANewScopeIsParsedAgain() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        ParsedFile root = repository.getRoot();
        ParsedFile child = root.getIncludedFiles().get(0);

        assertTrue(root.update("if FIRST\nsource \"child.kconfig\"\nendif\n", 1));

        ParsedFile reparsed = root.getIncludedFiles().get(0);
        assertNotSame(child, reparsed);
        assertEquals(1, repository.get("CHILD").getEntries().size());
        assertTrue(root.getDiagnostics().isEmpty());
    }

    @Test
    void scopeIdsSurviveEditsAboveTheScope() throws Exception {
        Repository repository = load(Files.createTempDirectory("kconfig-file"));
        ParsedFile root = repository.getRoot();
        int before = repository.get("IN_MENU").getEntries().get(0).getScopeId();

        assertTrue(root.update("config EXTRA\n\tbool\n\n" + ROOT_TEXT, 1));

        int after = repository.get("IN_MENU").getEntries().get(0).getScopeId();
        assertEquals(before, after);
        assertEquals(6, repository.getScopes().get(after).getLocation().getStartLine());
    }

    @Test
    void overlayTextIsPreferredOverDisk() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-file");
        Path kconfig = tempDir.resolve("Kconfig");
        Files.writeString(kconfig, "config ON_DISK\n");
        OverlaySourceProvider sources = new OverlaySourceProvider(SourceProvider.filesystem());
        sources.put(kconfig, "config IN_MEMORY\n");

        Repository repository = new KconfigLoader(sources).load(kconfig).getRepository();

        assertNotNull(repository.get("IN_MEMORY"));
        assertNull(repository.get("ON_DISK"));
    }
}
