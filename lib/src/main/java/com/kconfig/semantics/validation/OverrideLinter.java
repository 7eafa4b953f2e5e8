package com.kconfig.semantics.validation;

import com.kconfig.semantics.diagnostic.Diagnostic;
import com.kconfig.semantics.expr.ExpressionTypeException;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.overrides.BuildContext;
import com.kconfig.semantics.overrides.OverrideFile;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.Lock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the lint rules over every line of an override file. A pass is tied to the file version it
 * started from and gives up, publishing nothing, as soon as the file moves on.
 */
public final class OverrideLinter {
    private static final Logger LOGGER = Logger.getLogger(OverrideLinter.class.getName());

    private final List<LintRule> rules;

    public OverrideLinter(List<LintRule> rules) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    }

    /** The standard rule set, in the order the checks are applied to each line. */
    public static OverrideLinter defaultRules() {
        return new OverrideLinter(List.of(
                new MultipleAssignmentRule(),
                new NoPromptRule(),
                new RangeRule(),
                new RedundantDefaultRule(),
                new MissingDependencyRule(),
                new SelectedRule(),
                new EvaluatedValueRule()));
    }

    /** Lints the file's current version; never abandoned. */
    public List<Diagnostic> lint(OverrideFile file, BuildContext build) {
        OverrideFile.Snapshot snapshot = file.getSnapshot();
        return lint(file, build, snapshot).orElseGet(List::of);
    }

    /**
     * Lints {@code snapshot}, checking before every line that it is still the file's current
     * version.
     *
     * @return The lint diagnostics, or empty when the pass was abandoned.
     */
    public Optional<List<Diagnostic>> lint(OverrideFile file, BuildContext build, OverrideFile.Snapshot snapshot) {
        long start = System.nanoTime();
        // re-parses of the Kconfig tree wait until the pass is over
        Lock read = build.getRepository().readLock();
        read.lock();
        try {
            LintContext context = new LintContext(build, file, snapshot.overrides());
            List<Diagnostic> diagnostics = new ArrayList<>();
            // a cycle entered from another symbol is the same cycle
            Set<Set<String>> reportedCycles = new HashSet<>();
            for (ConfigOverride override : snapshot.overrides()) {
                if (file.getVersion() != snapshot.version() || Thread.currentThread().isInterrupted()) {
                    LOGGER.log(Level.FINE, "Abandoning lint of {0} version {1}", new Object[] {file, snapshot.version()});
                    return Optional.empty();
                }
                lintLine(context, override, diagnostics);
                for (List<String> cycle : context.getEvaluation().getCycles()) {
                    if (reportedCycles.add(new HashSet<>(cycle))) {
                        diagnostics.add(Diagnostic.warning(
                                "Circular dependency: " + String.join(" -> ", cycle), override.getLocation()));
                    }
                }
            }
            LOGGER.log(Level.FINE, "Linted {0} version {1} in {2} ms: {3} diagnostics", new Object[] {
                file, snapshot.version(), (System.nanoTime() - start) / 1_000_000, diagnostics.size()
            });
            return Optional.of(diagnostics);
        } finally {
            read.unlock();
        }
    }

    private void lintLine(LintContext context, ConfigOverride override, List<Diagnostic> diagnostics) {
        List<Diagnostic> line = new ArrayList<>();
        try {
            for (LintRule rule : rules) {
                if (rule.check(context, override, line) == LintRule.Verdict.RESOLVED) {
                    break;
                }
            }
        } catch (ExpressionTypeException ex) {
            line.add(Diagnostic.error(ex.getMessage(), override.getLocation()));
        }
        diagnostics.addAll(line);
    }
}
