package com.kconfig.semantics.evaluation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.kconfig.semantics.loader.KconfigLoader;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.SourceRange;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class DependencySolverTest {

    private static Repository repository;
    private static DependencySolver solver;

    @BeforeAll
    static void loadRepository() throws Exception {
        Path tempDir = Files.createTempDirectory("kconfig-solver");
        Path kconfig = tempDir.resolve("Kconfig");
        StringBuilder text = new StringBuilder();
        for (String name : List.of("A", "B", "C", "D")) {
            text.append("config ").append(name).append("\n\tbool \"").append(name).append("\"\n");
        }
        text.append("config HIDDEN\n\tbool\n");
        text.append("config SIZE\n\tint \"Size\"\n");
        Files.writeString(kconfig, text.toString());
        repository = new KconfigLoader().load(kconfig).getRepository();
        solver = new DependencySolver(repository);
    }

    private static ConfigOverride line(String name, String value, int line) {
        return new ConfigOverride(repository.get(name), value, SourceRange.line(Path.of("prj.conf"), line));
    }

    private static List<String> lines(List<ConfigOverride> overrides) {
        return overrides.stream().map(ConfigOverride::toLine).collect(Collectors.toList());
    }

    @Test
    void insertsEveryMissingSymbol() {
        DependencyFix fix = solver.solve("A && B", List.of(), List.of()).orElseThrow();

        assertEquals(List.of("CONFIG_A=y", "CONFIG_B=y"), lines(fix.insertions()));
        assertTrue(fix.changes().isEmpty());
        assertEquals(2, fix.size());
    }

    @Test
    void rewritesExistingLinesInPlace() {
        ConfigOverride existing = line("A", "n", 4);

        DependencyFix fix = solver.solve("A || B", List.of(existing), List.of(existing)).orElseThrow();

        assertEquals(List.of("CONFIG_A=y"), lines(fix.changes()));
        assertEquals(4, fix.changes().get(0).getLine());
        assertEquals(List.of("CONFIG_B=n"), lines(fix.insertions()));
    }

    @Test
    void negatedDependenciesAreSolvedToo() {
        DependencyFix fix = solver.solve("!A && SIZE > 0", List.of(), List.of(line("SIZE", "4", 1))).orElseThrow();

        assertEquals(List.of("CONFIG_A=n"), lines(fix.insertions()));
    }

    @Test
    void givesUpBeyondThreeSymbols() {
        assertTrue(solver.solve("A && B && C && D", List.of(), List.of()).isEmpty());
        assertTrue(solver.solve("A && B && C", List.of(), List.of()).isPresent());
    }

    @Test
    void ignoresSymbolsWithoutPrompt() {
        assertTrue(solver.solve("HIDDEN", List.of(), List.of()).isEmpty());
    }

    @Test
    void noFixWhenNothingWouldChange() {
        List<ConfigOverride> existing = List.of(line("A", "y", 1), line("B", "y", 2));

        assertTrue(solver.solve("A && B", existing, existing).isEmpty());
    }

    @Test
    void unsatisfiableOrInvalidDependenciesHaveNoFix() {
        assertTrue(solver.solve("A && !A", List.of(), List.of()).isEmpty());
        assertTrue(solver.solve("A &&", List.of(), List.of()).isEmpty());
    }
}
