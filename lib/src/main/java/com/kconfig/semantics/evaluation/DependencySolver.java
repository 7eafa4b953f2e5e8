package com.kconfig.semantics.evaluation;

import com.kconfig.semantics.expr.CompiledExpression;
import com.kconfig.semantics.expr.LexException;
import com.kconfig.semantics.expr.Token;
import com.kconfig.semantics.expr.TokenKind;
import com.kconfig.semantics.model.ConfigOverride;
import com.kconfig.semantics.model.Repository;
import com.kconfig.semantics.model.Symbol;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Searches for bool/tristate assignments that make a dependency expression hold. Only symbols the
 * user can set (those with a prompt) are considered, and the search gives up beyond
 * {@link #MAX_VARIABLES} of them.
 */
public final class DependencySolver {
    private static final Logger LOGGER = Logger.getLogger(DependencySolver.class.getName());

    public static final int MAX_VARIABLES = 3;

    private final Repository repository;

    public DependencySolver(Repository repository) {
        this.repository = Objects.requireNonNull(repository, "repository");
    }

    /**
     * @param dependency Expression that should become truthy.
     * @param existing Overrides of the file the fix will be applied to.
     * @param overrides Full override list of the build.
     * @return The first assignment, in enumeration order, that satisfies the dependency and
     *     changes at least one line; empty when there is none.
     */
    public Optional<DependencyFix> solve(String dependency, List<ConfigOverride> existing, List<ConfigOverride> overrides) {
        CompiledExpression compiled = repository.getExpressions().get(dependency);
        if (!compiled.isValid()) {
            return Optional.empty();
        }
        List<Symbol> variables = variables(dependency);
        if (variables.isEmpty() || variables.size() > MAX_VARIABLES) {
            LOGGER.log(Level.FINE, "Not solving {0}: {1} candidate symbols", new Object[] {dependency, variables.size()});
            return Optional.empty();
        }
        EvaluationContext base = new EvaluationContext(repository, overrides);
        int combinations = 1 << variables.size();
        for (int code = 0; code < combinations; code++) {
            List<ConfigOverride> assignment = new ArrayList<>();
            for (int i = 0; i < variables.size(); i++) {
                String value = (code & (1 << i)) != 0 ? "y" : "n";
                assignment.add(new ConfigOverride(variables.get(i), value));
            }
            EvaluationContext hypothetical = base.withLeadingOverrides(assignment);
            if (!hypothetical.solve(compiled.getExpression()).isTruthy()) {
                continue;
            }
            DependencyFix fix = diff(assignment, existing);
            if (fix.size() > 0) {
                return Optional.of(fix);
            }
        }
        return Optional.empty();
    }

    private List<Symbol> variables(String dependency) {
        List<Token> tokens;
        try {
            tokens = repository.getExpressions().tokenize(dependency);
        } catch (LexException ex) {
            LOGGER.log(Level.FINE, "Cannot tokenize " + dependency, ex);
            return List.of();
        }
        Set<Symbol> variables = new LinkedHashSet<>();
        for (Token token : tokens) {
            if (token.getKind() != TokenKind.VAR) {
                continue;
            }
            Symbol symbol = repository.get(token.getValue());
            if (symbol != null && symbol.isBooleanTyped() && symbol.hasPrompt()) {
                variables.add(symbol);
            }
        }
        return new ArrayList<>(variables);
    }

    private static DependencyFix diff(List<ConfigOverride> assignment, List<ConfigOverride> existing) {
        List<ConfigOverride> insertions = new ArrayList<>();
        List<ConfigOverride> changes = new ArrayList<>();
        for (ConfigOverride wanted : assignment) {
            ConfigOverride current = null;
            for (ConfigOverride candidate : existing) {
                if (candidate.getSymbol() == wanted.getSymbol()) {
                    current = candidate;
                    break;
                }
            }
            if (current == null) {
                insertions.add(wanted);
            } else if (!current.getValue().equals(wanted.getValue())) {
                changes.add(new ConfigOverride(current.getSymbol(), wanted.getValue(), current.getLocation()));
            }
        }
        return new DependencyFix(insertions, changes);
    }
}
